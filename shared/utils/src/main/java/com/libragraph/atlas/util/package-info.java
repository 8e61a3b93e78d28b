/**
 * Shared utilities for all Atlas modules.
 *
 * <p>Contains the {@link com.libragraph.atlas.util.channel channel layer}: raw input
 * {@link com.libragraph.atlas.util.channel.Chunk chunks}, the blocking FIFO
 * {@link com.libragraph.atlas.util.channel.BlockingChannel} and the single-assignment
 * {@link com.libragraph.atlas.util.channel.OneShot}. Only JBoss Logging as a dependency.
 */
package com.libragraph.atlas.util;
