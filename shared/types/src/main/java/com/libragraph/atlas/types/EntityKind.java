package com.libragraph.atlas.types;

import java.util.EnumSet;
import java.util.Set;

/**
 * Kinds of decoded entities. Readers use a set of kinds to ask a decoder for
 * only part of a file.
 */
public enum EntityKind {
    NODE('n', "node"),
    WAY('w', "way"),
    RELATION('r', "relation"),
    CHANGESET('c', "changeset");

    private final char code;
    private final String label;

    EntityKind(char code, String label) {
        this.code = code;
        this.label = label;
    }

    /** Single-letter code, as used by line-oriented encodings. */
    public char code() {
        return code;
    }

    public String label() {
        return label;
    }

    public static EntityKind fromCode(char code) {
        for (EntityKind k : values()) {
            if (k.code == code) return k;
        }
        throw new IllegalArgumentException("Unknown EntityKind code: " + code);
    }

    /** Every kind. */
    public static Set<EntityKind> all() {
        return EnumSet.allOf(EntityKind.class);
    }

    /** Nodes, ways and relations, without changesets. */
    public static Set<EntityKind> objects() {
        return EnumSet.of(NODE, WAY, RELATION);
    }

    /** The empty selection: only the header is wanted. */
    public static Set<EntityKind> nothing() {
        return EnumSet.noneOf(EntityKind.class);
    }
}
