package io.memoryrunr.embedding;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Binary encoding of embedding vectors for the {@code embedding} BLOB column.
 *
 * <p>Format version 1: one version byte ({@code 0x01}) followed by the components as
 * little-endian IEEE-754 32-bit floats. The dimension is implied by the length.</p>
 */
public final class VectorCodec {

    public static final byte VERSION = 1;

    private VectorCodec() {
    }

    public static byte[] encode(float[] vector) {
        if (vector == null || vector.length == 0) {
            return null;
        }
        ByteBuffer buf = ByteBuffer.allocate(1 + vector.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        buf.put(VERSION);
        for (float v : vector) {
            buf.putFloat(v);
        }
        return buf.array();
    }

    /**
     * Decodes a stored vector. Returns null for empty, truncated or unknown-version data so callers
     * can skip the record instead of failing.
     */
    public static float[] decode(byte[] data) {
        if (data == null || data.length < 1 + Float.BYTES || data[0] != VERSION) {
            return null;
        }
        if ((data.length - 1) % Float.BYTES != 0) {
            return null;
        }
        ByteBuffer buf = ByteBuffer.wrap(data, 1, data.length - 1).order(ByteOrder.LITTLE_ENDIAN);
        float[] vector = new float[(data.length - 1) / Float.BYTES];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = buf.getFloat();
        }
        return vector;
    }
}
