package org.endlesssource.mediarelay.protocol;

import org.endlesssource.mediarelay.protocol.message.Message;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Reads newline delimited messages from a stream. Not thread safe; each connection has one reader.
 */
public final class MessageReader {
    private final InputStream in;
    private final int maxLineBytes;
    private final ByteArrayOutputStream line = new ByteArrayOutputStream(256);

    public MessageReader(InputStream in) {
        this(in, Protocol.MAX_LINE_BYTES);
    }

    public MessageReader(InputStream in, int maxLineBytes) {
        Objects.requireNonNull(in, "in must not be null");
        if (maxLineBytes <= 0) {
            throw new IllegalArgumentException("maxLineBytes must be positive");
        }
        this.in = in instanceof BufferedInputStream ? in : new BufferedInputStream(in);
        this.maxLineBytes = maxLineBytes;
    }

    /**
     * Block until the next known message arrives. Blank lines and messages of unknown type are skipped.
     *
     * @return the message, or {@code null} once the peer closed the stream
     * @throws ProtocolException on an overlong or malformed line
     */
    public Message read() throws IOException {
        while (true) {
            byte[] bytes = readLine();
            if (bytes == null) {
                return null;
            }
            if (bytes.length == 0) {
                continue;
            }
            Message message = MessageCodec.decode(bytes);
            if (message != null) {
                return message;
            }
        }
    }

    /**
     * Like {@link #read()} but treats end of stream as an error.
     */
    public Message require() throws IOException {
        Message message = read();
        if (message == null) {
            throw new ProtocolException("Connection closed by peer");
        }
        return message;
    }

    /**
     * Read the next message and check its type.
     */
    public <T extends Message> T require(Class<T> type) throws IOException {
        Message message = require();
        if (!type.isInstance(message)) {
            throw new ProtocolException("Expected " + type.getSimpleName() + " but got "
                    + message.getClass().getSimpleName());
        }
        return type.cast(message);
    }

    private byte[] readLine() throws IOException {
        line.reset();
        int b;
        while ((b = in.read()) != -1) {
            if (b == '\n') {
                return trimmed();
            }
            if (line.size() >= maxLineBytes) {
                throw new ProtocolException("Line exceeds " + maxLineBytes + " bytes");
            }
            line.write(b);
        }
        return line.size() == 0 ? null : trimmed();
    }

    private byte[] trimmed() {
        byte[] bytes = line.toByteArray();
        int end = bytes.length;
        while (end > 0 && (bytes[end - 1] == '\r' || bytes[end - 1] == ' ' || bytes[end - 1] == '\t')) {
            end--;
        }
        if (end == bytes.length) {
            return bytes;
        }
        byte[] copy = new byte[end];
        System.arraycopy(bytes, 0, copy, 0, end);
        return copy;
    }
}
