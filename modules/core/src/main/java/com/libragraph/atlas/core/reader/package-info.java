/**
 * Running a decoder: {@link com.libragraph.atlas.core.reader.Reader} wires the
 * channels, starts the decoder thread and hands out batches.
 */
package com.libragraph.atlas.core.reader;
