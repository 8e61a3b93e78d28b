/**
 * Pure Java value types shared across all Atlas modules.
 *
 * <p>{@link com.libragraph.atlas.types.FormatId} identifies a file encoding and
 * {@link com.libragraph.atlas.types.EntityKind} the kinds of decoded entities.
 * This module has no dependencies.
 */
package com.libragraph.atlas.types;
