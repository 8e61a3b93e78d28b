package com.libragraph.atlas.formats.api;

import java.time.Instant;

/**
 * Editing metadata attached to nodes, ways and relations.
 * Fields a file does not carry keep their {@link #EMPTY} values.
 */
public record Metadata(
        int version,
        boolean visible,
        long changeset,
        Instant timestamp,
        long uid,
        String user
) {
    public static final Metadata EMPTY = new Metadata(0, true, 0, null, 0, "");
}
