package org.endlesssource.mediarelay.agent.pairing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Prompts on the agent's terminal.
 */
public final class ConsoleConfirmationPrompt implements ConfirmationPrompt {
    private static final Logger logger = LoggerFactory.getLogger(ConsoleConfirmationPrompt.class);
    private static final long POLL_MILLIS = 100;

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleConfirmationPrompt() {
        this(System.in, System.out);
    }

    public ConsoleConfirmationPrompt(InputStream in, PrintStream out) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    @Override
    public OperatorDecision confirm(PairingRequest request) throws InterruptedException {
        long seconds = Math.max(0, Duration.between(Instant.now(), request.deadline()).toSeconds());
        out.printf("%nPairing request from \"%s\" at %s%n", request.clientName(), request.remoteAddress());
        out.printf("Identity: %s%n", request.identity());
        out.printf("Code: %s%n", request.sas());
        out.printf("Accept if the client shows the same code (%ds left) [y]es/[n]o/[b]lock: ", seconds);
        out.flush();
        try {
            // ready() polling keeps the wait interruptible
            while (!in.ready()) {
                Thread.sleep(POLL_MILLIS);
            }
            return parse(in.readLine());
        } catch (IOException e) {
            logger.warn("Cannot read operator answer, rejecting: {}", e.getMessage());
            return OperatorDecision.REJECT;
        }
    }

    static OperatorDecision parse(String answer) {
        if (answer == null) {
            return OperatorDecision.REJECT;
        }
        return switch (answer.trim().toLowerCase(Locale.ROOT)) {
            case "y", "yes" -> OperatorDecision.ACCEPT;
            case "b", "block" -> OperatorDecision.BLOCK;
            default -> OperatorDecision.REJECT;
        };
    }
}
