package com.questrail.penman.codec;

/**
 * Indicates that a graph could not be written in pointer notation.
 */
public final class PointerSerializationException extends RuntimeException
{
    public PointerSerializationException(String message) {
        super(message);
    }

    public PointerSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
