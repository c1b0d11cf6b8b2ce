package com.arrowcontrol.controller.messaging;

import com.arrowcontrol.controller.application.ports.ControllerEventPublisher;
import com.arrowcontrol.controller.domain.events.CommandResultEvent;
import com.arrowcontrol.controller.domain.events.ConnectionEvent;
import com.arrowcontrol.controller.domain.events.DeviceEvent;
import com.arrowcontrol.controller.domain.events.PeerDiscoveredEvent;
import com.arrowcontrol.controller.domain.events.PeerLostEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Delivers controller events as Spring application events.
 */
@Component
@RequiredArgsConstructor
public class SpringControllerEventPublisher implements ControllerEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;

    @Override
    public void publishDeviceEvent(DeviceEvent event) {
        applicationEventPublisher.publishEvent(event);
    }

    @Override
    public void publishConnectionEvent(ConnectionEvent event) {
        applicationEventPublisher.publishEvent(event);
    }

    @Override
    public void publishCommandResult(CommandResultEvent event) {
        applicationEventPublisher.publishEvent(event);
    }

    @Override
    public void publishPeerDiscovered(PeerDiscoveredEvent event) {
        applicationEventPublisher.publishEvent(event);
    }

    @Override
    public void publishPeerLost(PeerLostEvent event) {
        applicationEventPublisher.publishEvent(event);
    }
}
