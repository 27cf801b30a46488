package com.questrail.penman.codec;

/**
 * Indicates that Penman text could not be decoded into a graph.
 *
 * This typically reflects:
 * <ul>
 *   <li>Unbalanced parentheses or trailing text</li>
 *   <li>A node without a {@code /} concept</li>
 *   <li>An unterminated string literal</li>
 *   <li>The same variable declared by two nodes</li>
 * </ul>
 */
public final class PenmanDecodeException extends RuntimeException
{
    private final int offset;

    public PenmanDecodeException(String message, int offset) {
        super(message + " (at offset " + offset + ")");
        this.offset = offset;
    }

    /**
     * Character offset in the decoded text where the problem was detected.
     */
    public int offset() {
        return offset;
    }
}
