package com.libragraph.atlas.formats.api;

import com.libragraph.atlas.types.EntityKind;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An edit session. {@code closedAt} is null while the changeset is open.
 */
public record Changeset(
        long id,
        Instant createdAt,
        Instant closedAt,
        int numChanges,
        int numComments,
        long uid,
        String user,
        Bounds bounds,
        Map<String, String> tags
) implements Entity {

    public Changeset {
        tags = Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    }

    @Override
    public EntityKind kind() {
        return EntityKind.CHANGESET;
    }

    public boolean isOpen() {
        return closedAt == null;
    }
}
