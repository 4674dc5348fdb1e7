package org.endlesssource.mediarelay.protocol;

import org.endlesssource.mediarelay.protocol.message.Message;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

/**
 * Writes one message per line. Safe to share between threads; each message is written and
 * flushed atomically.
 */
public final class MessageWriter {
    private final OutputStream out;

    public MessageWriter(OutputStream out) {
        Objects.requireNonNull(out, "out must not be null");
        this.out = out instanceof BufferedOutputStream ? out : new BufferedOutputStream(out);
    }

    public synchronized void write(Message message) throws IOException {
        byte[] bytes = MessageCodec.encode(message);
        if (bytes.length > Protocol.MAX_LINE_BYTES) {
            throw new ProtocolException("Encoded " + message.getClass().getSimpleName() + " exceeds "
                    + Protocol.MAX_LINE_BYTES + " bytes");
        }
        out.write(bytes);
        out.write('\n');
        out.flush();
    }
}
