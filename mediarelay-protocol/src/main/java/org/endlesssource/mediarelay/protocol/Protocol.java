package org.endlesssource.mediarelay.protocol;

/**
 * Constants shared by the agent and its clients.
 */
public final class Protocol {
    /** Version spoken on both the pairing and the relay port. */
    public static final int VERSION = 1;

    /** Longest accepted line, newline excluded. */
    public static final int MAX_LINE_BYTES = 64 * 1024;

    public static final int DEFAULT_RELAY_PORT = 40051;
    public static final int DEFAULT_PAIRING_PORT = 40052;

    public static final int NONCE_LENGTH = 32;
    public static final int DEFAULT_SAS_DIGITS = 6;
    public static final int MIN_SAS_DIGITS = 4;
    public static final int MAX_SAS_DIGITS = 8;

    private Protocol() {
    }
}
