package com.arrowcontrol.target.discovery;

import com.arrowcontrol.protocol.payload.AnnouncePayload;

/**
 * Receives controller announces heard on the discovery port.
 */
@FunctionalInterface
public interface AnnounceHandler {

    /**
     * @param senderIp address the announce came from, preferred over the advertised ip
     */
    void onAnnounce(String senderIp, AnnouncePayload announce);
}
