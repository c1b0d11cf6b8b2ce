package com.arrowcontrol.controller.support;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Waits for a condition set by another thread (Netty event loops, timers).
 */
public final class Poll {

    private static final long STEP_MILLIS = 20;

    private Poll() {}

    public static void until(Duration timeout, String description, BooleanSupplier condition) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Timed out after " + timeout + " waiting for " + description);
            }
            try {
                Thread.sleep(STEP_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError("Interrupted waiting for " + description, e);
            }
        }
    }
}
