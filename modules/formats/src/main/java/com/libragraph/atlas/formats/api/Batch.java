package com.libragraph.atlas.formats.api;

import java.util.List;

/**
 * Unit of decoded output: entities in file order plus the number of input bytes
 * they were decoded from.
 * <p>
 * {@link #end()} is the end-of-stream marker. It is put on the output channel
 * exactly once per run, by the worker, and is never built by a decoder.
 */
public final class Batch {

    private static final Batch END = new Batch(List.of(), 0, true);

    private final List<Entity> entities;
    private final long byteSize;
    private final boolean end;

    private Batch(List<Entity> entities, long byteSize, boolean end) {
        this.entities = entities;
        this.byteSize = byteSize;
        this.end = end;
    }

    /**
     * A data batch. May hold zero entities, e.g. when every record in the input was
     * filtered out.
     */
    public static Batch of(List<? extends Entity> entities, long byteSize) {
        if (byteSize < 0) {
            throw new IllegalArgumentException("Negative byte size: " + byteSize);
        }
        return new Batch(List.copyOf(entities), byteSize, false);
    }

    public static Batch end() {
        return END;
    }

    public boolean isEnd() {
        return end;
    }

    public List<Entity> entities() {
        return entities;
    }

    public int size() {
        return entities.size();
    }

    public boolean isEmpty() {
        return entities.isEmpty();
    }

    public long byteSize() {
        return byteSize;
    }

    @Override
    public String toString() {
        return end ? "Batch[END]" : "Batch[" + entities.size() + " entities, " + byteSize + " bytes]";
    }
}
