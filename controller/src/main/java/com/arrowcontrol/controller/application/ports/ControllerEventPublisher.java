package com.arrowcontrol.controller.application.ports;

import com.arrowcontrol.controller.domain.events.CommandResultEvent;
import com.arrowcontrol.controller.domain.events.ConnectionEvent;
import com.arrowcontrol.controller.domain.events.DeviceEvent;
import com.arrowcontrol.controller.domain.events.PeerDiscoveredEvent;
import com.arrowcontrol.controller.domain.events.PeerLostEvent;

public interface ControllerEventPublisher {
    void publishDeviceEvent(DeviceEvent event);
    void publishConnectionEvent(ConnectionEvent event);
    void publishCommandResult(CommandResultEvent event);
    void publishPeerDiscovered(PeerDiscoveredEvent event);
    void publishPeerLost(PeerLostEvent event);
}
