package com.questrail.penman.codec;

import java.util.Objects;

/**
 * Raised by {@link PointerNotationParser#toPointerNotation(String)} when the
 * input violates the grammar.
 */
public final class PointerNotationException extends RuntimeException
{
    private final PointerParseError kind;
    private final String state;
    private final int offset;

    public PointerNotationException(PointerParseError kind, String state, int offset, String detail) {
        super(kind + " in state " + state + " at offset " + offset + ": " + detail);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.state = Objects.requireNonNull(state, "state");
        this.offset = offset;
    }

    public PointerParseError kind() {
        return kind;
    }

    /**
     * Name of the parser state the failure was detected in.
     */
    public String state() {
        return state;
    }

    /**
     * Offset of the offending character, or the input length for failures
     * detected at end of input.
     */
    public int offset() {
        return offset;
    }
}
