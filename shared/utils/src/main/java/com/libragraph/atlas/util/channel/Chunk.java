package com.libragraph.atlas.util.channel;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * One slice of raw input. Chunks carry no framing: a record of the encoded file
 * may start in one chunk and end in the next.
 *
 * The empty chunk is reserved as the end-of-input marker. {@link #of(byte[])}
 * returns {@link #END} for empty input, so a chunk that carries data is never empty.
 */
public final class Chunk {

    /** End-of-input marker. */
    public static final Chunk END = new Chunk(new byte[0]);

    private final byte[] data;

    private Chunk(byte[] data) {
        this.data = data;
    }

    /**
     * Wraps the given bytes without copying. The caller hands ownership over
     * and must not modify the array afterwards.
     */
    public static Chunk of(byte[] data) {
        if (data.length == 0) {
            return END;
        }
        return new Chunk(data);
    }

    /**
     * Copies {@code length} bytes starting at {@code offset}.
     */
    public static Chunk copyOf(byte[] data, int offset, int length) {
        if (length == 0) {
            return END;
        }
        return new Chunk(Arrays.copyOfRange(data, offset, offset + length));
    }

    /** UTF-8 encodes the given text. */
    public static Chunk of(String text) {
        return of(text.getBytes(StandardCharsets.UTF_8));
    }

    public boolean isEnd() {
        return data.length == 0;
    }

    public int size() {
        return data.length;
    }

    /**
     * Backing array. Not copied; treat as read-only.
     */
    public byte[] bytes() {
        return data;
    }

    public String asString() {
        return new String(data, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return isEnd() ? "Chunk[END]" : "Chunk[" + data.length + " bytes]";
    }
}
