package com.libragraph.atlas.formats.api;

/**
 * Malformed or truncated input detected while decoding. Terminal for the run.
 */
public class DecodeException extends RuntimeException {

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }

    public DecodeException(String message) {
        super(message);
    }
}
