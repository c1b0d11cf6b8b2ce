package com.arrowcontrol.controller.service;

import com.arrowcontrol.controller.application.ports.ControllerEventPublisher;
import com.arrowcontrol.controller.config.DiscoveryProperties;
import com.arrowcontrol.controller.domain.events.PeerDiscoveredEvent;
import com.arrowcontrol.controller.domain.events.PeerLostEvent;
import com.arrowcontrol.controller.model.DiscoveredPeer;
import com.arrowcontrol.protocol.model.DeviceInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Short-lived set of peers heard on the discovery port, keyed by ip. Separate from the device registry:
 * a discovered peer is only a connection candidate.
 */
@Slf4j
@Component
public class DiscoveredPeerTracker {

    private final Map<String, DiscoveredPeer> peers = new LinkedHashMap<>();
    private final Clock clock;
    private final ControllerEventPublisher eventPublisher;
    private final Duration ttl;

    public DiscoveredPeerTracker(Clock clock, ControllerEventPublisher eventPublisher, DiscoveryProperties properties) {
        this.clock = clock;
        this.eventPublisher = eventPublisher;
        this.ttl = properties.peerTtl();
    }

    /**
     * @return {@code true} when the peer was not known before
     */
    public synchronized boolean record(String ip, DeviceInfo deviceInfo) {
        Instant now = clock.instant();
        DiscoveredPeer known = peers.get(ip);
        if (known != null) {
            peers.put(ip, known.seenAgain(deviceInfo, now));
            return false;
        }
        peers.put(ip, new DiscoveredPeer(ip, deviceInfo, now, now));
        eventPublisher.publishPeerDiscovered(new PeerDiscoveredEvent(ip, deviceInfo, now));
        return true;
    }

    /**
     * Forgets peers silent for longer than the TTL, publishing a lost event for each.
     */
    public synchronized int prune() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(ttl);
        int removed = 0;
        Iterator<DiscoveredPeer> iterator = peers.values().iterator();
        while (iterator.hasNext()) {
            DiscoveredPeer peer = iterator.next();
            if (peer.lastSeen().isBefore(cutoff)) {
                iterator.remove();
                eventPublisher.publishPeerLost(new PeerLostEvent(peer.ip(), peer.deviceInfo(), peer.lastSeen(), now));
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("🧹 Forgot {} discovered peers", removed);
        }
        return removed;
    }

    public synchronized List<DiscoveredPeer> getPeers() {
        prune();
        return new ArrayList<>(peers.values());
    }
}
