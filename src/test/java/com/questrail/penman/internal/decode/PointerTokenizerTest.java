package com.questrail.penman.internal.decode;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class PointerTokenizerTest
{
    @Test
    void parenthesesAreAlwaysTokens()
    {
        assertEquals(
                List.of("(", "<pointer:0>", "go-01", ":ARG0", "(", "<pointer:1>", "person", ")", ")"),
                PointerTokenizer.tokenize("(<pointer:0> go-01 :ARG0(<pointer:1> person))"));
    }

    @Test
    void literalIsOneTokenWithItsQuotes()
    {
        assertEquals(
                List.of("(", "<pointer:0>", "name", ":op1", "\"a (b) \\\"c\\\"\"", ")"),
                PointerTokenizer.tokenize("( <pointer:0> name :op1 \"a (b) \\\"c\\\"\" )"));
    }

    @Test
    void unterminatedLiteralIsRejected()
    {
        assertThrows(PointerSyntaxException.class, () -> PointerTokenizer.tokenize("( x \"abc )"));
    }

    @Test
    void blankTextHasNoTokens()
    {
        assertTrue(PointerTokenizer.tokenize(" \t\n").isEmpty());
    }
}
