package com.libragraph.atlas.formats.registry;

import com.libragraph.atlas.formats.api.Decoder;
import com.libragraph.atlas.formats.api.DecoderContext;
import com.libragraph.atlas.formats.api.DecoderFactory;
import com.libragraph.atlas.formats.api.DecoderPlugin;
import com.libragraph.atlas.formats.api.InputFile;
import com.libragraph.atlas.types.FormatId;
import org.jboss.logging.Logger;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Maps each {@link FormatId} to the factory of its decoder.
 * <p>
 * Entries are never replaced: registering a format a second time is rejected and
 * leaves the first factory in place. Registration and lookup are synchronized, so
 * plugins may be registered while files are being opened, although the usual
 * pattern is to register everything at startup.
 * <p>
 * {@link #instance()} is the process-wide registry, filled from every
 * {@link DecoderPlugin} on the class path the first time it is requested.
 * A registry created with {@code new} starts empty.
 */
public class DecoderRegistry {

    private static final Logger log = Logger.getLogger(DecoderRegistry.class);

    private static final Object INSTANCE_LOCK = new Object();
    private static volatile DecoderRegistry instance;

    private final Map<FormatId, DecoderFactory> factories = new EnumMap<>(FormatId.class);

    /**
     * Returns the process-wide registry. Plugins are loaded exactly once, before the
     * registry becomes visible to other threads.
     */
    public static DecoderRegistry instance() {
        DecoderRegistry registry = instance;
        if (registry == null) {
            synchronized (INSTANCE_LOCK) {
                registry = instance;
                if (registry == null) {
                    registry = new DecoderRegistry();
                    registry.loadPlugins(DecoderRegistry.class.getClassLoader());
                    instance = registry;
                }
            }
        }
        return registry;
    }

    /**
     * Registers a factory for a format.
     *
     * @return false if the format already has a factory; the existing one is kept
     */
    public synchronized boolean register(FormatId format, DecoderFactory factory) {
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(factory, "factory");

        DecoderFactory existing = factories.putIfAbsent(format, factory);
        if (existing != null) {
            log.warnf("Decoder for format %s already registered, ignoring %s",
                    format.label(), factory.getClass().getName());
            return false;
        }
        log.infof("Registered decoder for format %s", format.label());
        return true;
    }

    /**
     * Finds the factory for the declared format of a file.
     *
     * @throws UnsupportedFormatException if no decoder is registered for the format
     */
    public synchronized DecoderFactory resolve(InputFile file) {
        DecoderFactory factory = factories.get(file.format());
        if (factory == null) {
            throw new UnsupportedFormatException(file.filename(), file.format().label());
        }
        return factory;
    }

    /**
     * Resolves the factory for a file and builds a decoder bound to the given context.
     */
    public Decoder createDecoder(InputFile file, DecoderContext context) {
        return resolve(file).create(context);
    }

    public synchronized boolean isRegistered(FormatId format) {
        return factories.containsKey(format);
    }

    /** Registered formats, in declaration order. */
    public synchronized Set<FormatId> formats() {
        if (factories.isEmpty()) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(EnumSet.copyOf(factories.keySet()));
    }

    /**
     * Registers every {@link DecoderPlugin} visible to the class loader. Plugins for
     * formats that are already registered are skipped.
     *
     * @return number of formats newly registered
     */
    public int loadPlugins(ClassLoader classLoader) {
        int registered = 0;
        for (DecoderPlugin plugin : ServiceLoader.load(DecoderPlugin.class, classLoader)) {
            if (register(plugin.formatId(), plugin.factory())) {
                registered++;
            }
        }
        log.debugf("Loaded %d decoder plugin(s)", registered);
        return registered;
    }
}
