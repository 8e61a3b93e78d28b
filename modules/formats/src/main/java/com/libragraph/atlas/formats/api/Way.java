package com.libragraph.atlas.formats.api;

import com.libragraph.atlas.types.EntityKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record Way(
        long id,
        Metadata metadata,
        Map<String, String> tags,
        List<Long> nodeRefs
) implements Entity {

    public Way {
        tags = Collections.unmodifiableMap(new LinkedHashMap<>(tags));
        nodeRefs = List.copyOf(nodeRefs);
    }

    @Override
    public EntityKind kind() {
        return EntityKind.WAY;
    }
}
