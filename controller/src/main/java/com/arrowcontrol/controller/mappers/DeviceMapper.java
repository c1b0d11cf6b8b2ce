package com.arrowcontrol.controller.mappers;

import com.arrowcontrol.controller.dto.DeviceDto;
import com.arrowcontrol.controller.model.RegisteredDevice;
import lombok.RequiredArgsConstructor;
import org.modelmapper.ModelMapper;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Flattens a registry record into its operator view: identity fields from the advertised info, state fields
 * from the record itself.
 */
@Component
@RequiredArgsConstructor
public class DeviceMapper {

    private final ModelMapper modelMapper;

    public DeviceDto toDto(RegisteredDevice device) {
        DeviceDto dto = modelMapper.map(device.getInfo(), DeviceDto.class);
        dto.setStatus(device.getStatus());
        dto.setPaired(device.isPaired());
        dto.setFirstSeen(device.getFirstSeen());
        dto.setLastSeen(device.getLastSeen());
        return dto;
    }

    public List<DeviceDto> toDtos(List<RegisteredDevice> devices) {
        return devices.stream().map(this::toDto).toList();
    }
}
