package com.arrowcontrol.controller.model;

import com.arrowcontrol.protocol.model.DeviceInfo;

import java.time.Instant;

/**
 * A target heard on the discovery port that may not have opened a session yet.
 */
public record DiscoveredPeer(String ip, DeviceInfo deviceInfo, Instant firstSeen, Instant lastSeen) {

    public DiscoveredPeer seenAgain(DeviceInfo latestInfo, Instant now) {
        return new DiscoveredPeer(ip, latestInfo != null ? latestInfo : deviceInfo, firstSeen, now);
    }
}
