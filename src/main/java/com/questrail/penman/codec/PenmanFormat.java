package com.questrail.penman.codec;

/**
 * Layout options for {@link PenmanEncoder}.
 *
 * <ul>
 *   <li>{@code indent == SINGLE_LINE}: the whole graph on one line</li>
 *   <li>{@code indent == ADAPTIVE}: one edge per line, indented past the
 *       node's variable (edges of a node {@code (a / ...} at the top level
 *       start in column 3)</li>
 *   <li>{@code indent > 0}: one edge per line, indented by that many spaces
 *       per nesting level</li>
 * </ul>
 */
public record PenmanFormat(
        int indent,
        boolean includeMetadata
) {
    public static final int SINGLE_LINE = 0;
    public static final int ADAPTIVE = -1;

    public PenmanFormat {
        if (indent < ADAPTIVE) {
            throw new IllegalArgumentException("indent must be -1, 0 or positive (was " + indent + ")");
        }
    }

    public static PenmanFormat singleLine() {
        return new PenmanFormat(SINGLE_LINE, false);
    }

    public static PenmanFormat adaptive() {
        return new PenmanFormat(ADAPTIVE, false);
    }

    public static PenmanFormat indented(int spaces) {
        if (spaces <= 0) {
            throw new IllegalArgumentException("spaces must be positive (was " + spaces + ")");
        }
        return new PenmanFormat(spaces, false);
    }

    public PenmanFormat withMetadata() {
        return new PenmanFormat(indent, true);
    }

    public boolean isSingleLine() {
        return indent == SINGLE_LINE;
    }
}
