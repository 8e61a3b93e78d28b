package com.libragraph.atlas.formats.api;

import java.util.Objects;

/**
 * File-level metadata, delivered once per run independently of the batch stream.
 *
 * @param bounds                 bounding box declared by the file, possibly undefined
 * @param multipleObjectVersions true if the stream may contain several versions of the
 *                               same object (history and change files)
 * @param generator              program that wrote the file, empty if unknown
 * @param denseNodes             true if nodes use the dense encoding (binary formats only)
 */
public record Header(
        Bounds bounds,
        boolean multipleObjectVersions,
        String generator,
        boolean denseNodes
) {
    private static final Header EMPTY = new Header(Bounds.undefined(), false, "", false);

    public Header {
        Objects.requireNonNull(bounds, "bounds");
        Objects.requireNonNull(generator, "generator");
    }

    /** Header used when a file declares nothing. */
    public static Header empty() {
        return EMPTY;
    }

    public Header withBounds(Bounds bounds) {
        return new Header(bounds, multipleObjectVersions, generator, denseNodes);
    }

    public Header withMultipleObjectVersions(boolean multipleObjectVersions) {
        return new Header(bounds, multipleObjectVersions, generator, denseNodes);
    }

    public Header withGenerator(String generator) {
        return new Header(bounds, multipleObjectVersions, generator, denseNodes);
    }

    public Header withDenseNodes(boolean denseNodes) {
        return new Header(bounds, multipleObjectVersions, generator, denseNodes);
    }
}
