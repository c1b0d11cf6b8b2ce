package com.arrowcontrol.protocol.util;

/**
 * Source of pairing and auth secrets.
 */
@FunctionalInterface
public interface TokenGenerator {

    String generate();
}
