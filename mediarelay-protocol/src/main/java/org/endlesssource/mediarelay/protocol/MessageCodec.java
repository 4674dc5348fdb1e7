package org.endlesssource.mediarelay.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.endlesssource.mediarelay.protocol.message.Message;

import java.io.IOException;

/**
 * Converts messages to and from their single-line JSON form.
 * <p>
 * Unknown properties are ignored and a message with an unknown {@code type} decodes to
 * {@code null}, so newer peers can add fields and message types without breaking older ones.
 */
public final class MessageCodec {
    private static final ObjectMapper MAPPER = newMapper();
    private static final ObjectReader READER = MAPPER.readerFor(Message.class);
    private static final ObjectWriter WRITER = MAPPER.writerFor(Message.class);

    private MessageCodec() {
    }

    /**
     * A mapper configured the way the wire format expects. Exposed for callers that persist
     * protocol types next to their own data.
     */
    public static ObjectMapper newMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(DeserializationFeature.FAIL_ON_INVALID_SUBTYPE, false);
        mapper.configure(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_USING_DEFAULT_VALUE, true);
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        mapper.configure(SerializationFeature.INDENT_OUTPUT, false);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        return mapper;
    }

    public static byte[] encode(Message message) {
        try {
            return WRITER.writeValueAsBytes(message);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode " + message.getClass().getSimpleName(), e);
        }
    }

    /**
     * @return the message, or {@code null} when its type is not known to this version
     * @throws ProtocolException when the bytes are not a well-formed message
     */
    public static Message decode(byte[] line) throws ProtocolException {
        try {
            return READER.readValue(line);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Malformed message: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ProtocolException("Unreadable message", e);
        }
    }
}
