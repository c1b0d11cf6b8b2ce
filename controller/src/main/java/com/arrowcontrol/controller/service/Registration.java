package com.arrowcontrol.controller.service;

import com.arrowcontrol.controller.model.RegisteredDevice;

/**
 * Result of {@link DeviceRegistry#registerDevice}. {@code previousId} is the id the record was migrated from
 * when a restarted peer came back with a new identity on a known address.
 */
public record Registration(RegisteredDevice device, boolean created, String previousId) {

    public boolean migrated() {
        return previousId != null;
    }
}
