package com.libragraph.atlas.formats.api;

import com.libragraph.atlas.types.EntityKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A point. Deleted nodes in history files have no location (NaN coordinates).
 */
public record Node(
        long id,
        Metadata metadata,
        Map<String, String> tags,
        double lon,
        double lat
) implements Entity {

    public Node {
        tags = Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    }

    @Override
    public EntityKind kind() {
        return EntityKind.NODE;
    }

    public boolean hasLocation() {
        return !Double.isNaN(lon) && !Double.isNaN(lat);
    }
}
