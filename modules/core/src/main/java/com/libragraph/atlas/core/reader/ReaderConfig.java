package com.libragraph.atlas.core.reader;

import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;

/**
 * Channel sizes and threading settings of a {@link Reader}.
 *
 * @param inputQueueCapacity  chunks buffered between producer and decoder
 * @param outputQueueCapacity batch results buffered between decoder and consumer
 * @param chunkSize           bytes per chunk when reading from a stream
 * @param threadNamePrefix    prefix of decoder and feeder thread names
 */
public record ReaderConfig(
        int inputQueueCapacity,
        int outputQueueCapacity,
        int chunkSize,
        String threadNamePrefix
) {
    static final String PREFIX = "atlas.reader.";

    public ReaderConfig {
        requirePositive(inputQueueCapacity, "input-queue-capacity");
        requirePositive(outputQueueCapacity, "output-queue-capacity");
        requirePositive(chunkSize, "chunk-size");
        if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
            throw new IllegalArgumentException(PREFIX + "thread-name-prefix must not be blank");
        }
    }

    /**
     * Reads {@code atlas.reader.*} from MicroProfile Config. Defaults ship in
     * {@code META-INF/microprofile-config.properties}; system properties and
     * environment variables override them.
     */
    public static ReaderConfig defaults() {
        Config config = ConfigProvider.getConfig();
        return new ReaderConfig(
                config.getOptionalValue(PREFIX + "input-queue-capacity", Integer.class).orElse(20),
                config.getOptionalValue(PREFIX + "output-queue-capacity", Integer.class).orElse(20),
                config.getOptionalValue(PREFIX + "chunk-size", Integer.class).orElse(1024 * 1024),
                config.getOptionalValue(PREFIX + "thread-name-prefix", String.class).orElse("atlas-decoder"));
    }

    public static ReaderConfig of(int inputQueueCapacity, int outputQueueCapacity, int chunkSize) {
        return new ReaderConfig(inputQueueCapacity, outputQueueCapacity, chunkSize, "atlas-decoder");
    }

    private static void requirePositive(int value, String key) {
        if (value <= 0) {
            throw new IllegalArgumentException(PREFIX + key + " must be positive, got " + value);
        }
    }
}
