package com.arrowcontrol.protocol.util;

import lombok.extern.slf4j.Slf4j;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.NetworkInterface;
import java.net.SocketAddress;
import java.net.SocketException;
import java.util.Collections;
import java.util.Optional;

@Slf4j
public final class NetworkAddresses {

    public static final String LOOPBACK = "127.0.0.1";

    private NetworkAddresses() {}

    /**
     * First non-loopback IPv4 address of an interface that is up, or {@value #LOOPBACK}.
     */
    public static String localIpv4() {
        return findLocalIpv4().orElse(LOOPBACK);
    }

    public static Optional<String> findLocalIpv4() {
        try {
            for (NetworkInterface networkInterface : Collections.list(NetworkInterface.getNetworkInterfaces())) {
                if (!networkInterface.isUp() || networkInterface.isLoopback()) {
                    continue;
                }
                for (InetAddress address : Collections.list(networkInterface.getInetAddresses())) {
                    if (address instanceof Inet4Address && !address.isLoopbackAddress()) {
                        return Optional.of(address.getHostAddress());
                    }
                }
            }
        } catch (SocketException e) {
            log.warn("⚠️ Could not enumerate network interfaces: {}", e.getMessage());
        }
        return Optional.empty();
    }

    /**
     * Host part of a socket address, without the leading slash or any IPv4-mapped IPv6 prefix.
     */
    public static String hostOf(SocketAddress socketAddress) {
        if (socketAddress instanceof InetSocketAddress inet) {
            InetAddress address = inet.getAddress();
            String host = address != null ? address.getHostAddress() : inet.getHostString();
            return host.startsWith("::ffff:") ? host.substring(7) : host;
        }
        return socketAddress == null ? null : socketAddress.toString();
    }
}
