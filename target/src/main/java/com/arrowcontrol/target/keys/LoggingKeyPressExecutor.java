package com.arrowcontrol.target.keys;

import com.arrowcontrol.protocol.payload.CommandParameters;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Logs presses instead of emitting them. Used on headless hosts and for dry runs.
 */
@Slf4j
public class LoggingKeyPressExecutor implements KeyPressExecutor {

    private static final Set<String> KNOWN_KEYS = Set.of("left", "right");

    private final AtomicInteger presses = new AtomicInteger();

    @Override
    public boolean press(String keyName, CommandParameters parameters) {
        if (!KNOWN_KEYS.contains(keyName)) {
            log.warn("⌨️ Unknown key '{}'", keyName);
            return false;
        }
        for (int i = 0; i < parameters.repeat(); i++) {
            presses.incrementAndGet();
            log.info("⌨️ [simulated] {} arrow ({}/{}, hold {}ms)", keyName, i + 1, parameters.repeat(),
                    parameters.holdTime());
        }
        return true;
    }

    public int getPressCount() {
        return presses.get();
    }
}
