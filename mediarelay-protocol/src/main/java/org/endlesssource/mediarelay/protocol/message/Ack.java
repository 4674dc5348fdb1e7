package org.endlesssource.mediarelay.protocol.message;

public record Ack(String requestId) implements Message {
}
