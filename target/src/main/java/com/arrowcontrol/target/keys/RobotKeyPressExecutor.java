package com.arrowcontrol.target.keys;

import com.arrowcontrol.protocol.payload.CommandParameters;
import lombok.extern.slf4j.Slf4j;

import java.awt.AWTError;
import java.awt.AWTException;
import java.awt.GraphicsEnvironment;
import java.awt.HeadlessException;
import java.awt.Robot;
import java.awt.event.KeyEvent;
import java.util.Map;

/**
 * Emits real key events through {@link Robot}. Needs a display.
 */
@Slf4j
public class RobotKeyPressExecutor implements KeyPressExecutor {

    private static final long DELAY_BETWEEN_PRESSES_MILLIS = 50;
    private static final Map<String, Integer> KEY_CODES = Map.of(
            "left", KeyEvent.VK_LEFT,
            "right", KeyEvent.VK_RIGHT);

    private final Robot robot;

    public RobotKeyPressExecutor() {
        if (GraphicsEnvironment.isHeadless()) {
            throw new IllegalStateException("Key simulation needs a display, but the JVM is headless");
        }
        try {
            this.robot = new Robot();
        } catch (AWTException | AWTError | HeadlessException e) {
            throw new IllegalStateException("Could not create key robot: " + e.getMessage(), e);
        }
        log.info("⌨️ Using java.awt.Robot for key simulation");
    }

    @Override
    public synchronized boolean press(String keyName, CommandParameters parameters) {
        Integer keyCode = KEY_CODES.get(keyName);
        if (keyCode == null) {
            log.warn("⌨️ Unknown key '{}'", keyName);
            return false;
        }
        try {
            for (int i = 0; i < parameters.repeat(); i++) {
                if (i > 0) {
                    Thread.sleep(DELAY_BETWEEN_PRESSES_MILLIS);
                }
                robot.keyPress(keyCode);
                if (parameters.holdTime() > 0) {
                    Thread.sleep(parameters.holdTime());
                }
                robot.keyRelease(keyCode);
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            robot.keyRelease(keyCode);
            log.warn("⌨️ Interrupted while pressing {}", keyName);
            return false;
        }
    }
}
