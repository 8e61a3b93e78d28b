package com.libragraph.atlas.formats.registry;

/**
 * No decoder is registered for the declared format of a file. Not retryable.
 */
public class UnsupportedFormatException extends RuntimeException {

    private final String filename;
    private final String formatName;

    public UnsupportedFormatException(String filename, String formatName) {
        super("Can not open file '" + filename + "' with type '" + formatName
                + "'. No support for reading this format in this program.");
        this.filename = filename;
        this.formatName = formatName;
    }

    public String filename() {
        return filename;
    }

    public String formatName() {
        return formatName;
    }
}
