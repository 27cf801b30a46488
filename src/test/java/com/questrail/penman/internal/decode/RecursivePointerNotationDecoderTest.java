package com.questrail.penman.internal.decode;

import com.questrail.penman.codec.BackoffReason;
import com.questrail.penman.codec.DecodeStatus;
import com.questrail.penman.codec.PenmanDecoder;
import com.questrail.penman.codec.PointerDecodeResult;
import com.questrail.penman.codec.impl.DefaultPenmanDecoder;
import com.questrail.penman.model.Graph;
import com.questrail.penman.model.Triple;
import com.questrail.penman.observability.BackoffEvent;
import com.questrail.penman.observability.CodecErrorEvent;
import com.questrail.penman.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RecursivePointerNotationDecoderTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link RecursivePointerNotationDecoder}.
 *
 * <p>Successful decodes are checked through the intermediate Penman text;
 * failures must surface as a backoff result and an event, never as an
 * exception.</p>
 */
final class RecursivePointerNotationDecoderTest
{
    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final RecursivePointerNotationDecoder decoder =
            new RecursivePointerNotationDecoder(new DefaultPenmanDecoder(), sink, () -> NOW);

    private String penmanText(String pointerText)
    {
        PointerDecodeResult result = decoder.decode(pointerText);
        assertEquals(DecodeStatus.OK, result.status(), () -> String.valueOf(result));
        return result.penmanText().orElseThrow();
    }

    private PointerDecodeResult.Backoff backoff(String pointerText)
    {
        return assertInstanceOf(PointerDecodeResult.Backoff.class, decoder.decode(pointerText));
    }

    @Test
    void namesVariablesAfterTheirConcepts()
    {
        assertEquals(
                "(g1 / go-01 :ARG0 (p1 / person) :time (y1 / yesterday))",
                penmanText("( <pointer:0> go-01 :ARG0 ( <pointer:1> person ) :time ( <pointer:2> yesterday ) )"));
    }

    @Test
    void countsPerLetterAndFallsBackToX()
    {
        assertEquals(
                "(g1 / give-01 :ARG0 (g2 / girl) :ARG1 (x1 / 1st))",
                penmanText("( <pointer:0> give-01 :ARG0 ( <pointer:1> girl ) :ARG1 ( <pointer:2> 1st ) )"));
    }

    @Test
    void backReferenceResolvesToDeclaredVariable()
    {
        PointerDecodeResult result = decoder.decode(
                "( <pointer:0> want-01 :ARG0 ( <pointer:1> boy ) :ARG1 ( <pointer:2> go-01 :ARG0 <pointer:1> ) )");

        assertEquals("(w1 / want-01 :ARG0 (b1 / boy) :ARG1 (g1 / go-01 :ARG0 b1))",
                result.penmanText().orElseThrow());
        Graph graph = result.graph();
        assertTrue(graph.contains(new Triple("g1", ":ARG0", "b1")));
        assertEquals("w1", graph.top().orElseThrow());
    }

    @Test
    void forwardReferenceResolvesToLaterDeclaration()
    {
        assertEquals(
                "(w1 / want-01 :ARG0 b1 :ARG1 (b1 / boy))",
                penmanText("( <pointer:0> want-01 :ARG0 <pointer:1> :ARG1 ( <pointer:1> boy ) )"));
    }

    @Test
    void undeclaredPointerPassesThroughAsAtom()
    {
        PointerDecodeResult result = decoder.decode("( <pointer:0> go-01 :ARG0 <pointer:7> )");

        assertEquals(DecodeStatus.OK, result.status());
        assertTrue(result.graph().contains(new Triple("g1", ":ARG0", "<pointer:7>")));
    }

    @Test
    void literalWithParenthesesAndEscapedQuotesIsOneValue()
    {
        PointerDecodeResult result = decoder.decode("( <pointer:0> name :op1 \"A (b) \\\"c\\\"\" )");

        assertEquals("(n1 / name :op1 \"A (b) \\\"c\\\"\")", result.penmanText().orElseThrow());
        assertTrue(result.graph().contains(new Triple("n1", ":op1", "\"A (b) \\\"c\\\"\"")));
    }

    @Test
    void unbalancedInputBacksOff()
    {
        String input = "( <pointer:0> go-01 :ARG0 ( <pointer:1> person )";
        PointerDecodeResult.Backoff result = backoff(input);

        assertEquals(BackoffReason.MALFORMED_INPUT, result.reason());
        assertEquals(DecodeStatus.BACKOFF, result.status());
        assertEquals(PointerDecodeResult.BACKOFF_GRAPH, result.graph());
        assertTrue(result.penmanText().isEmpty());

        List<BackoffEvent> events = sink.getBackoffs();
        assertEquals(1, events.size());
        assertEquals(BackoffReason.MALFORMED_INPUT, events.get(0).reason());
        assertEquals(input, events.get(0).input());
        assertEquals(NOW, events.get(0).timestamp());
    }

    @Test
    void backoffGraphIsSingleStringEntity()
    {
        Graph graph = PointerDecodeResult.BACKOFF_GRAPH;
        assertEquals(List.of(Triple.instance("x1", "string-entity")), graph.triples());
        assertEquals("x1", graph.top().orElseThrow());
    }

    @Test
    void structuralDefectsAreMalformedInput()
    {
        String[] inputs = {
                "( <pointer:0> )",
                "( <pointer:0> go-01 :ARG0 )",
                "( <pointer:0> go-01 :ARG0 :ARG1 x )",
                "( <pointer:0> go-01 person )",
                "( go-01 :ARG0 x )",
                "( <pointer:0> go-01 ) ( <pointer:1> run-01 )",
                "( <pointer:0> name :op1 \"unterminated )",
        };
        for (String input : inputs) {
            assertEquals(BackoffReason.MALFORMED_INPUT, backoff(input).reason(), input);
        }
    }

    @Test
    void duplicateDeclarationIsADecodeFailure()
    {
        assertEquals(BackoffReason.DECODE_FAILURE,
                backoff("( <pointer:0> go-01 :ARG0 ( <pointer:0> person ) )").reason());
    }

    @Test
    void textNotStartingWithANodeIsADecodeFailure()
    {
        assertEquals(BackoffReason.DECODE_FAILURE, backoff("hello world").reason());
        assertEquals(BackoffReason.DECODE_FAILURE, backoff(")(").reason());
    }

    @Test
    void blankInputIsAnEmptyGraph()
    {
        PointerDecodeResult.Backoff result = backoff("   ");

        assertEquals(BackoffReason.EMPTY_GRAPH, result.reason());
        assertNull(sink.getBackoffs().get(0).cause());
    }

    @Test
    void unexpectedDecoderErrorIsContained()
    {
        PenmanDecoder failing = text -> {
            throw new IllegalStateException("boom");
        };
        RecursivePointerNotationDecoder contained =
                new RecursivePointerNotationDecoder(failing, sink, () -> NOW);

        PointerDecodeResult result = contained.decode("( <pointer:0> go-01 )");

        assertEquals(DecodeStatus.BACKOFF, result.status());
        assertTrue(sink.hasEventOfType(CodecErrorEvent.class));
        assertTrue(sink.hasEventOfType(BackoffEvent.class));
    }

    private static String nested(int depth)
    {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < depth - 1; i++) {
            text.append("( <pointer:").append(i).append("> thing :mod ");
        }
        text.append("( <pointer:").append(depth - 1).append("> thing");
        text.append(" )".repeat(depth));
        return text.toString();
    }

    @Test
    void nestingAtTheLimitDecodes()
    {
        PointerDecodeResult result = decoder.decode(nested(DefaultPenmanDecoder.MAX_DEPTH));

        assertEquals(DecodeStatus.OK, result.status());
        assertTrue(result.graph().contains(new Triple("t1", ":mod", "t2")));
    }

    @Test
    void nestingPastTheLimitBacksOffInsteadOfOverflowing()
    {
        PointerDecodeResult.Backoff result = backoff(nested(100_000));

        assertEquals(BackoffReason.MALFORMED_INPUT, result.reason());
        assertEquals(PointerDecodeResult.BACKOFF_GRAPH, result.graph());
        assertEquals(1, sink.getBackoffs().size());
        assertFalse(sink.hasEventOfType(CodecErrorEvent.class));
    }

    @Test
    void generatedNamesSkipBareConstants()
    {
        PointerDecodeResult result =
                decoder.decode("( <pointer:0> go-01 :ARG0 ( <pointer:1> person ) :mod p1 )");

        assertEquals("(g1 / go-01 :ARG0 (p2 / person) :mod p1)", result.penmanText().orElseThrow());
        assertTrue(result.graph().contains(new Triple("g1", ":mod", "p1")));
        assertTrue(result.graph().contains(new Triple("g1", ":ARG0", "p2")));
        assertFalse(result.graph().contains(new Triple("g1", ":mod", "p2")));
    }

    @Test
    void quotedLiteralDoesNotReserveAName()
    {
        assertEquals(
                "(g1 / go-01 :ARG0 (p1 / person) :name \"p1\")",
                penmanText("( <pointer:0> go-01 :ARG0 ( <pointer:1> person ) :name \"p1\" )"));
    }
}
