package com.questrail.penman.codec.impl;

import com.questrail.penman.codec.PenmanEncodeException;
import com.questrail.penman.codec.PenmanFormat;
import com.questrail.penman.model.Graph;
import com.questrail.penman.model.Triple;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultPenmanEncoderTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link DefaultPenmanEncoder} and the layout it relies on.
 */
final class DefaultPenmanEncoderTest
{
    private final DefaultPenmanDecoder decoder = new DefaultPenmanDecoder();
    private final DefaultPenmanEncoder encoder = new DefaultPenmanEncoder();

    private String reencode(String text, PenmanFormat format)
    {
        return encoder.encode(decoder.decode(text), format);
    }

    @Test
    void recordedLayoutReproducesSingleLineText()
    {
        String[] inputs = {
                "(a / go-01 :ARG0 (p / person) :time (k / yesterday))",
                "(b / boy :ARG0-of (w / want-01))",
                "(w / want-01 :ARG0 (b / boy) :ARG1 (g / go-01 :ARG0 b))",
                "(n / name :op1 \"A \\\"nested\\\" quote\")",
                "(a / love-01 :ARG0 a :polarity -)",
        };
        for (String input : inputs) {
            assertEquals(input, reencode(input, PenmanFormat.singleLine()), input);
        }
    }

    @Test
    void adaptiveFormatAlignsEdgesPastTheVariable()
    {
        String expected = "(w / want-01\n"
                + "   :ARG0 (b / boy)\n"
                + "   :ARG1 (g / go-01\n"
                + "            :ARG0 b))";
        assertEquals(expected,
                reencode("(w / want-01 :ARG0 (b / boy) :ARG1 (g / go-01 :ARG0 b))", PenmanFormat.adaptive()));
    }

    @Test
    void fixedIndentGrowsPerLevel()
    {
        String expected = "(a / go-01\n"
                + "    :ARG0 (p / person\n"
                + "        :mod (t / tall)))";
        assertEquals(expected,
                reencode("(a / go-01 :ARG0 (p / person :mod (t / tall)))", PenmanFormat.indented(4)));
    }

    @Test
    void metadataIsWrittenOnlyWhenRequested()
    {
        Graph graph = decoder.decode("# ::id s1\n(a / go-01)");

        assertEquals("(a / go-01)", encoder.encode(graph, PenmanFormat.singleLine()));
        assertEquals("# ::id s1\n(a / go-01)", encoder.encode(graph, PenmanFormat.singleLine().withMetadata()));
    }

    @Test
    void emptyGraphEncodesAsEmptyParentheses()
    {
        assertEquals("()", encoder.encode(Graph.empty(), PenmanFormat.adaptive()));
    }

    @Test
    void depthFirstLayoutInvertsIncomingEdges()
    {
        Graph graph = new Graph(List.of(
                Triple.instance("b", "boy"),
                Triple.instance("w", "want-01"),
                new Triple("w", ":ARG0", "b")), "b");

        assertEquals("(b / boy :ARG0-of (w / want-01))", encoder.encode(graph, PenmanFormat.singleLine()));
    }

    @Test
    void depthFirstLayoutWritesReentrancyAsReference()
    {
        Graph graph = new Graph(List.of(
                Triple.instance("a", "see-01"),
                Triple.instance("p", "person"),
                new Triple("a", ":ARG0", "p"),
                new Triple("a", ":ARG1", "p")), "a");

        assertEquals("(a / see-01 :ARG0 (p / person) :ARG1 p)", encoder.encode(graph, PenmanFormat.singleLine()));
    }

    @Test
    void missingOrUndeclaredTopIsRejected()
    {
        List<Triple> triples = List.of(Triple.instance("a", "go-01"));
        assertThrows(PenmanEncodeException.class,
                () -> encoder.encode(new Graph(triples, null), PenmanFormat.singleLine()));
        assertThrows(PenmanEncodeException.class,
                () -> encoder.encode(new Graph(triples, "z"), PenmanFormat.singleLine()));
    }

    @Test
    void unreachableNodeIsRejected()
    {
        Graph graph = new Graph(List.of(
                Triple.instance("a", "go-01"),
                Triple.instance("b", "boy")), "a");

        PenmanEncodeException e = assertThrows(PenmanEncodeException.class,
                () -> encoder.encode(graph, PenmanFormat.singleLine()));
        assertTrue(e.getMessage().contains("b"));
    }
}
