package com.libragraph.atlas.formats.api;

import com.libragraph.atlas.types.EntityKind;
import com.libragraph.atlas.util.channel.AsyncResult;
import com.libragraph.atlas.util.channel.BlockingChannel;
import com.libragraph.atlas.util.channel.Chunk;
import com.libragraph.atlas.util.channel.OneShot;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Handles a decoder is constructed with: the input chunk channel, the output
 * channel of batch results, the header one-shot and the requested entity kinds.
 * <p>
 * The context also records whether the input end marker has been consumed and
 * whether the header has been resolved, so {@link DecoderWorker} can finish the run
 * correctly whatever the decoder did. Only the worker thread uses a context.
 */
public final class DecoderContext {

    private final BlockingChannel<Chunk> input;
    private final BlockingChannel<AsyncResult<Batch>> output;
    private final OneShot<Header> header;
    private final Set<EntityKind> readTypes;

    private boolean inputDone;
    private boolean headerDone;

    public DecoderContext(BlockingChannel<Chunk> input,
                          BlockingChannel<AsyncResult<Batch>> output,
                          OneShot<Header> header,
                          Set<EntityKind> readTypes) {
        this.input = Objects.requireNonNull(input, "input");
        this.output = Objects.requireNonNull(output, "output");
        this.header = Objects.requireNonNull(header, "header");
        this.readTypes = readTypes.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(EntityKind.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(readTypes));
    }

    // -- decoder-facing operations --

    /**
     * Takes the next chunk, waiting if none is ready. Returns {@link Chunk#END}
     * once the input is exhausted, and again on every later call.
     */
    public Chunk nextChunk() throws InterruptedException {
        if (inputDone) {
            return Chunk.END;
        }
        Chunk chunk = input.take();
        if (chunk.isEnd()) {
            inputDone = true;
        }
        return chunk;
    }

    /**
     * Sends a decoded batch downstream as a successful result.
     */
    public void send(Batch batch) throws InterruptedException {
        if (batch.isEnd()) {
            throw new IllegalArgumentException("The end-of-stream batch is sent by the worker, not by decoders");
        }
        output.put(AsyncResult.completed(batch));
    }

    /**
     * Resolves the header. Only the first resolution of a run has any effect.
     *
     * @return true if this call resolved the header
     */
    public boolean resolveHeader(Header value) {
        Objects.requireNonNull(value, "header");
        if (headerDone) {
            return false;
        }
        headerDone = true;
        return header.complete(value);
    }

    public Set<EntityKind> readTypes() {
        return readTypes;
    }

    public boolean wants(EntityKind kind) {
        return readTypes.contains(kind);
    }

    public boolean isInputDone() {
        return inputDone;
    }

    public boolean isHeaderResolved() {
        return headerDone;
    }

    // -- worker-facing operations --

    void failHeader(Throwable cause) {
        if (!headerDone) {
            headerDone = true;
            header.fail(cause);
        }
    }

    void sendFailure(Throwable cause) throws InterruptedException {
        output.put(AsyncResult.failed(cause));
    }

    void sendEnd() throws InterruptedException {
        output.put(AsyncResult.completed(Batch.end()));
    }

    /**
     * Takes and discards chunks up to and including the end marker.
     *
     * @return number of data chunks discarded
     */
    int drainInput() throws InterruptedException {
        int discarded = 0;
        while (!inputDone) {
            Chunk chunk = input.take();
            if (chunk.isEnd()) {
                inputDone = true;
            } else {
                discarded++;
            }
        }
        return discarded;
    }
}
