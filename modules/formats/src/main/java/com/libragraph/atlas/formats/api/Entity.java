package com.libragraph.atlas.formats.api;

import com.libragraph.atlas.types.EntityKind;

import java.util.Map;

/**
 * A decoded object. Tags are unmodifiable and keep file order.
 */
public sealed interface Entity permits Node, Way, Relation, Changeset {

    long id();

    EntityKind kind();

    Map<String, String> tags();
}
