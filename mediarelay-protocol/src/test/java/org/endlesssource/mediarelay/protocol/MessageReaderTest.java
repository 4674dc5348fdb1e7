package org.endlesssource.mediarelay.protocol;

import org.endlesssource.mediarelay.protocol.message.Ack;
import org.endlesssource.mediarelay.protocol.message.Ping;
import org.endlesssource.mediarelay.protocol.message.Pong;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class MessageReaderTest {

    private static MessageReader reader(String text) {
        return new MessageReader(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void read_skipsBlankLinesAndUnknownTypes() throws IOException {
        MessageReader reader = reader("\n{\"type\":\"hologram\"}\r\n{\"type\":\"ping\",\"requestId\":\"1\"}\r\n");
        assertEquals(new Ping("1"), reader.read());
        assertNull(reader.read());
    }

    @Test
    void read_acceptsLastLineWithoutNewline() throws IOException {
        MessageReader reader = reader("{\"type\":\"ack\",\"requestId\":\"a\"}");
        assertEquals(new Ack("a"), reader.read());
        assertNull(reader.read());
    }

    @Test
    void read_rejectsOverlongLine() {
        MessageReader reader = new MessageReader(new ByteArrayInputStream(
                ("{\"type\":\"ping\",\"requestId\":\"" + "x".repeat(200) + "\"}\n").getBytes(StandardCharsets.UTF_8)), 64);
        assertThrows(ProtocolException.class, reader::read);
    }

    @Test
    void require_failsOnWrongTypeOrEndOfStream() {
        assertThrows(ProtocolException.class, () -> reader("{\"type\":\"ping\"}\n").require(Pong.class));
        assertThrows(ProtocolException.class, () -> reader("").require());
    }

    @Test
    void writer_producesLinesTheReaderAccepts() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        MessageWriter writer = new MessageWriter(out);
        writer.write(new Ping("a"));
        writer.write(new Pong("a"));

        MessageReader reader = new MessageReader(new ByteArrayInputStream(out.toByteArray()));
        assertEquals(new Ping("a"), reader.read());
        assertEquals(new Pong("a"), reader.require(Pong.class));
        assertNull(reader.read());
    }
}
