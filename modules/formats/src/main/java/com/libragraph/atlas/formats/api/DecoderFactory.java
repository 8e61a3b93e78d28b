package com.libragraph.atlas.formats.api;

/**
 * Creates a ready-to-run decoder bound to the channels of one run.
 * Registered per format in {@link com.libragraph.atlas.formats.registry.DecoderRegistry}.
 */
@FunctionalInterface
public interface DecoderFactory {

    Decoder create(DecoderContext context);
}
