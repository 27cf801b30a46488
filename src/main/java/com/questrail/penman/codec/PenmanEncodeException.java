package com.questrail.penman.codec;

/**
 * Indicates that a graph could not be laid out as a tree rooted at its top.
 */
public final class PenmanEncodeException extends RuntimeException
{
    public PenmanEncodeException(String message) {
        super(message);
    }
}
