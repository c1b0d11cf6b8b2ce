package com.arrowcontrol.target.pairing;

import com.arrowcontrol.protocol.model.ConnectionStatus;
import com.arrowcontrol.protocol.util.Tokens;
import com.arrowcontrol.target.client.ControlClient;
import com.arrowcontrol.target.client.ControlClientListener;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.concurrent.Executor;

/**
 * Asks the local operator before echoing a pairing token back to the controller.
 *
 * <p>At most one question is open at a time. A newer token replaces the pending one instead of queueing a
 * second prompt, and reaching {@code PAIRED} or {@code DISCONNECTED} withdraws it, so a late answer never
 * pairs with a token the controller no longer holds.
 */
@Slf4j
public class ConsolePairingPrompt implements ControlClientListener {

    private final ControlClient client;
    private final BufferedReader input;
    private final Executor promptExecutor;

    private String pendingToken;
    private boolean prompting;

    public ConsolePairingPrompt(ControlClient client, InputStream input, Executor promptExecutor) {
        this.client = client;
        this.input = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
        this.promptExecutor = promptExecutor;
    }

    @Override
    public synchronized void onPairingRequired(String pairingToken) {
        pendingToken = pairingToken;
        if (prompting) {
            System.out.println();
            System.out.println("🔐 Controller issued a new pairing token (" + Tokens.mask(pairingToken)
                    + "); your answer applies to it");
            return;
        }
        prompting = true;
        promptExecutor.execute(this::prompt);
    }

    @Override
    public synchronized void onStatusChanged(ConnectionStatus previous, ConnectionStatus current) {
        if ((current == ConnectionStatus.PAIRED || current == ConnectionStatus.DISCONNECTED) && pendingToken != null) {
            log.info("🔐 Pairing prompt withdrawn ({})", current.wireName());
            pendingToken = null;
        }
    }

    void prompt() {
        String shown;
        synchronized (this) {
            shown = pendingToken;
        }
        System.out.println();
        System.out.println("🔐 Controller requests pairing (token " + Tokens.mask(shown) + ")");
        System.out.print("   Allow this controller to send key presses? [y/N] ");
        System.out.flush();

        String answer;
        try {
            answer = input.readLine();
        } catch (IOException e) {
            synchronized (this) {
                prompting = false;
            }
            throw new UncheckedIOException("Could not read pairing answer", e);
        }

        String token;
        synchronized (this) {
            prompting = false;
            token = pendingToken;
            pendingToken = null;
        }
        if (token == null) {
            log.info("⌛ Pairing answer ignored: the request was withdrawn");
            return;
        }
        if (answer == null || !answer.trim().toLowerCase(Locale.ROOT).startsWith("y")) {
            log.info("🚫 Pairing declined by operator");
            return;
        }
        client.sendPairingRequest().whenComplete((accepted, error) -> {
            if (error != null) {
                log.warn("🔐 Pairing failed: {}", error.getMessage());
            } else {
                log.info("🤝 Pairing complete");
            }
        });
    }
}
