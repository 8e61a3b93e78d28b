package com.libragraph.atlas.formats.api;

import com.libragraph.atlas.types.EntityKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record Relation(
        long id,
        Metadata metadata,
        Map<String, String> tags,
        List<Member> members
) implements Entity {

    public Relation {
        tags = Collections.unmodifiableMap(new LinkedHashMap<>(tags));
        members = List.copyOf(members);
    }

    @Override
    public EntityKind kind() {
        return EntityKind.RELATION;
    }

    /** Reference from a relation to another object, with its role (may be empty). */
    public record Member(EntityKind type, long ref, String role) {}
}
