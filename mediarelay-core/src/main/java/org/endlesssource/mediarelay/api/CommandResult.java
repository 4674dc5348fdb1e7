package org.endlesssource.mediarelay.api;

/**
 * Outcome of a {@link PlayerCommand}. {@code reason} is null when the command was accepted.
 */
public record CommandResult(boolean accepted, RejectionReason reason, String message) {

    private static final CommandResult OK = new CommandResult(true, null, "");

    public CommandResult {
        if (!accepted && reason == null) {
            throw new IllegalArgumentException("a rejected command needs a reason");
        }
        message = message == null ? "" : message;
    }

    public static CommandResult ok() {
        return OK;
    }

    public static CommandResult rejected(RejectionReason reason, String message) {
        return new CommandResult(false, reason, message);
    }
}
