package org.endlesssource.mediarelay.protocol.message;

public record Pong(String requestId) implements Message {
}
