package com.questrail.penman.codec.impl;

/**
 * A lexical token of Penman text together with its start offset.
 */
record PenmanToken(Type type, String text, int offset)
{
    enum Type
    {
        LPAREN,
        RPAREN,
        SLASH,
        ROLE,
        STRING,
        SYMBOL
    }

    boolean is(Type expected) {
        return type == expected;
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + offset;
    }
}
