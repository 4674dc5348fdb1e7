package org.endlesssource.mediarelay.protocol.message;

public record Ping(String requestId) implements Message {
}
