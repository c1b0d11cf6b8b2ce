package com.arrowcontrol.controller.controller;

import com.arrowcontrol.controller.exception.GlobalExceptionHandler;
import com.arrowcontrol.controller.service.CommandDispatchResult;
import com.arrowcontrol.controller.service.ControlServer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class CommandControllerTest {

    @Mock
    private ControlServer controlServer;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new CommandController(controlServer))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void sentCommandEchoesEffectiveParameters() throws Exception {
        when(controlServer.sendArrowCommand("t1", "left", null, null))
                .thenReturn(CommandDispatchResult.sent("Command arrow_left sent to t1"));

        mockMvc.perform(post("/api/v1/commands/arrow")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"deviceId\":\"t1\",\"direction\":\"left\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.commandType").value("arrow_left"))
                .andExpect(jsonPath("$.data.repeat").value(1))
                .andExpect(jsonPath("$.data.holdTime").value(0));
    }

    @Test
    void unpairedDeviceIsConflict() throws Exception {
        when(controlServer.sendArrowCommand("t1", "RIGHT", 3, 50))
                .thenReturn(CommandDispatchResult.rejected(CommandDispatchResult.Failure.DEVICE_NOT_PAIRED,
                        "Device not paired"));

        mockMvc.perform(post("/api/v1/commands/arrow")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"deviceId\":\"t1\",\"direction\":\"RIGHT\",\"repeat\":3,\"holdTime\":50}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("DEVICE_NOT_PAIRED"))
                .andExpect(jsonPath("$.error.message").value("Device not paired"));

        verify(controlServer).sendArrowCommand("t1", "RIGHT", 3, 50);
    }

    @Test
    void unknownDeviceIsNotFound() throws Exception {
        when(controlServer.sendArrowCommand(anyString(), anyString(), any(), any()))
                .thenReturn(CommandDispatchResult.rejected(CommandDispatchResult.Failure.DEVICE_NOT_FOUND,
                        "Device not found"));

        mockMvc.perform(post("/api/v1/commands/arrow")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"deviceId\":\"ghost\",\"direction\":\"left\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("DEVICE_NOT_FOUND"));
    }

    @Test
    void invalidRequestNeverReachesServer() throws Exception {
        mockMvc.perform(post("/api/v1/commands/arrow")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"deviceId\":\"t1\",\"direction\":\"up\",\"repeat\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));

        verifyNoInteractions(controlServer);
    }
}
