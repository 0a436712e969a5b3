package org.arpha.dispatch.http;

import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Request body. Either an unread stream handed over by the transport or bytes
 * it already aggregated. The body can be read once.
 */
public final class Body {

    private static final byte[] NO_BYTES = new byte[0];

    private final InputStream stream;
    private final byte[] bytes;
    private final AtomicBoolean consumed = new AtomicBoolean();

    private Body(InputStream stream, byte[] bytes) {
        this.stream = stream;
        this.bytes = bytes;
    }

    public static Body empty() {
        return new Body(null, NO_BYTES);
    }

    public static Body of(byte[] bytes) {
        return new Body(null, bytes.clone());
    }

    public static Body of(InputStream stream) {
        return new Body(stream, null);
    }

    /**
     * Drains the body. Blocks until the underlying stream reaches end of input.
     *
     * @throws IOException if the stream fails
     * @throws IllegalStateException if the body was already read
     */
    public byte[] readAllBytes() throws IOException {
        if (!consumed.compareAndSet(false, true)) {
            throw new IllegalStateException("Body already consumed");
        }
        if (bytes != null) {
            return bytes;
        }
        try (InputStream in = stream) {
            return in.readAllBytes();
        }
    }

    public boolean isConsumed() {
        return consumed.get();
    }
}
