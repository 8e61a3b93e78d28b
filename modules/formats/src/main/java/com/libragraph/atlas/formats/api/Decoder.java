package com.libragraph.atlas.formats.api;

/**
 * Format-specific decode loop. One implementation per supported encoding, created
 * by a {@link DecoderFactory} around a {@link DecoderContext}.
 * <p>
 * {@link #run()} pulls chunks with {@link DecoderContext#nextChunk()} until it sees
 * the end marker, sends each decoded batch with {@link DecoderContext#send(Batch)},
 * and resolves the header with {@link DecoderContext#resolveHeader(Header)} as soon
 * as it is known. Failures are simply thrown: {@link DecoderWorker} turns them into
 * results on both channels, sends the end-of-stream batch and drains the input.
 * A decoder never sends {@link Batch#end()} itself.
 */
@FunctionalInterface
public interface Decoder {

    void run() throws Exception;
}
