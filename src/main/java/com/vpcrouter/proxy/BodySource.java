package com.vpcrouter.proxy;

import com.vpcrouter.error.GatewayErrorCode;
import com.vpcrouter.error.GatewayException;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Request payload. A streaming body can be sent once; a buffered one can be replayed on
 * every retry.
 */
public abstract class BodySource {

    private static final BodySource EMPTY = new Buffered(new byte[0]);

    public static BodySource empty() {
        return EMPTY;
    }

    public static BodySource buffered(byte[] bytes) {
        return new Buffered(bytes);
    }

    /**
     * @param length declared length, or -1 when unknown
     */
    public static BodySource streaming(InputStream in, long length) {
        if (length == 0) {
            return EMPTY;
        }
        return new Streaming(in, length);
    }

    public abstract InputStream open() throws IOException;

    /** Length in bytes, or -1 when unknown. */
    public abstract long length();

    public abstract boolean isRepeatable();

    public boolean isEmpty() {
        return length() == 0;
    }

    /**
     * Replayable copy of this body, read fully up to {@code maxBytes}.
     *
     * @throws GatewayException with {@link GatewayErrorCode#PAYLOAD_TOO_LARGE} past the limit
     */
    public abstract BodySource buffer(long maxBytes) throws IOException;

    private static final class Buffered extends BodySource {

        private final byte[] bytes;

        private Buffered(byte[] bytes) {
            this.bytes = bytes;
        }

        @Override
        public InputStream open() {
            return new ByteArrayInputStream(bytes);
        }

        @Override
        public long length() {
            return bytes.length;
        }

        @Override
        public boolean isRepeatable() {
            return true;
        }

        @Override
        public BodySource buffer(long maxBytes) {
            if (bytes.length > maxBytes) {
                throw tooLarge(maxBytes);
            }
            return this;
        }
    }

    private static final class Streaming extends BodySource {

        private final InputStream in;
        private final long length;
        private boolean consumed;

        private Streaming(InputStream in, long length) {
            this.in = in;
            this.length = length;
        }

        @Override
        public synchronized InputStream open() {
            if (consumed) {
                throw new IllegalStateException("Streaming body already consumed");
            }
            consumed = true;
            return in;
        }

        @Override
        public long length() {
            return length;
        }

        @Override
        public boolean isRepeatable() {
            return false;
        }

        @Override
        public BodySource buffer(long maxBytes) throws IOException {
            if (length > maxBytes) {
                throw tooLarge(maxBytes);
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream(length > 0 ? (int) length : 1024);
            byte[] chunk = new byte[8192];
            long total = 0;
            try (InputStream source = open()) {
                int read;
                while ((read = source.read(chunk)) != -1) {
                    total += read;
                    if (total > maxBytes) {
                        throw tooLarge(maxBytes);
                    }
                    out.write(chunk, 0, read);
                }
            }
            return new Buffered(out.toByteArray());
        }
    }

    private static GatewayException tooLarge(long maxBytes) {
        return new GatewayException(GatewayErrorCode.PAYLOAD_TOO_LARGE,
                "Request body exceeds the " + maxBytes + " byte retry buffer");
    }
}
