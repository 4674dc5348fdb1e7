package org.endlesssource.mediarelay.protocol.message;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A single line on the pairing or relay port. The {@code type} property names the concrete message.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = PairHello.class, name = "pair_hello"),
        @JsonSubTypes.Type(value = PairChallenge.class, name = "pair_challenge"),
        @JsonSubTypes.Type(value = PairConfirm.class, name = "pair_confirm"),
        @JsonSubTypes.Type(value = PairResult.class, name = "pair_result"),
        @JsonSubTypes.Type(value = Challenge.class, name = "challenge"),
        @JsonSubTypes.Type(value = Authenticate.class, name = "authenticate"),
        @JsonSubTypes.Type(value = Authenticated.class, name = "authenticated"),
        @JsonSubTypes.Type(value = ErrorMessage.class, name = "error"),
        @JsonSubTypes.Type(value = Subscribe.class, name = "subscribe"),
        @JsonSubTypes.Type(value = Unsubscribe.class, name = "unsubscribe"),
        @JsonSubTypes.Type(value = Ack.class, name = "ack"),
        @JsonSubTypes.Type(value = Snapshot.class, name = "snapshot"),
        @JsonSubTypes.Type(value = EventMessage.class, name = "event"),
        @JsonSubTypes.Type(value = Command.class, name = "command"),
        @JsonSubTypes.Type(value = CommandResultMessage.class, name = "command_result"),
        @JsonSubTypes.Type(value = Ping.class, name = "ping"),
        @JsonSubTypes.Type(value = Pong.class, name = "pong")
})
public interface Message {
}
