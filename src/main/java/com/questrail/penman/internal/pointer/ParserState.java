package com.questrail.penman.internal.pointer;

import java.util.Locale;

/**
 * States of the pointer-notation state machine.
 *
 * <pre>
 *   FIND_FIRST_LEFT
 *     -> FIND_BEGIN_OF_NEW_NODE_NAME -> FIND_END_OF_NEW_NODE_NAME
 *     -> FIND_SLASH -> FIND_BEGIN_OF_CONCEPT -> FIND_END_OF_CONCEPT
 *     -> FIND_RIGHT_OR_BEGIN_OF_RELATION -> FIND_END_OF_RELATION
 *     -> FIND_LEFT_OR_BEGIN_OF_VALUE
 *     -> FIND_END_OF_NON_LITERAL_VALUE | FIND_END_OF_LITERAL_VALUE
 *     -> FIND_RIGHT_OR_BEGIN_OF_RELATION (loop)
 *     -> END
 * </pre>
 */
public enum ParserState
{
    FIND_FIRST_LEFT,
    FIND_BEGIN_OF_NEW_NODE_NAME,
    FIND_END_OF_NEW_NODE_NAME,
    FIND_SLASH,
    FIND_BEGIN_OF_CONCEPT,
    FIND_END_OF_CONCEPT,
    FIND_RIGHT_OR_BEGIN_OF_RELATION,
    FIND_END_OF_RELATION,
    FIND_LEFT_OR_BEGIN_OF_VALUE,
    FIND_END_OF_NON_LITERAL_VALUE,
    FIND_END_OF_LITERAL_VALUE,
    END;

    /**
     * Lower-case name used in error messages, e.g. {@code find_slash}.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
