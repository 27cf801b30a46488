package com.questrail.penman.codec;

/**
 * Distinguishable failure kinds of the strict pointer-notation parser.
 */
public enum PointerParseError
{
    UNEXPECTED_BEGIN_OF_NODE_NAME,
    UNEXPECTED_CHAR_OF_NODE_NAME,
    UNEXPECTED_NODE_NAME,
    DUPLICATE_NODE_NAME,
    EXPECTING_SLASH,
    UNEXPECTED_BEGIN_OF_CONCEPT,
    UNEXPECTED_CHAR_OF_CONCEPT,
    EXPECTING_RIGHT_OR_RELATION,
    UNEXPECTED_CHAR_OF_RELATION,
    EXPECTING_LEFT_OR_VALUE,
    UNEXPECTED_CHAR_OF_VALUE,
    EXPECTING_END,
    UNRESOLVED_NODE_NAMES,
    UNEXPECTED_END_STATUS,

    /** The text passed the state machine but is not a valid graph. */
    INVALID_GRAPH
}
