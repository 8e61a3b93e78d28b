package com.libragraph.atlas.formats.api;

import com.libragraph.atlas.types.FormatId;

/**
 * Service-provider interface for format modules. Implementations are listed in
 * {@code META-INF/services/com.libragraph.atlas.formats.api.DecoderPlugin} and
 * registered by {@link com.libragraph.atlas.formats.registry.DecoderRegistry#loadPlugins(ClassLoader)}.
 */
public interface DecoderPlugin {

    /**
     * The format this plugin decodes.
     */
    FormatId formatId();

    DecoderFactory factory();
}
