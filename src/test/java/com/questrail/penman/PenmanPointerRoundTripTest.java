package com.questrail.penman;

import com.questrail.penman.codec.BackoffReason;
import com.questrail.penman.codec.DecodeStatus;
import com.questrail.penman.codec.PenmanFormat;
import com.questrail.penman.codec.PointerDecodeResult;
import com.questrail.penman.codec.PointerNotationException;
import com.questrail.penman.codec.PointerParseError;
import com.questrail.penman.codec.PointerParseResult;
import com.questrail.penman.config.PointerCodecConfig;
import com.questrail.penman.model.Graph;
import com.questrail.penman.model.Triple;
import com.questrail.penman.observability.BackoffEvent;
import com.questrail.penman.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PenmanPointerRoundTripTest
 * =============================================================================
 * End-to-end behavior of {@link PenmanPointerCodec}.
 *
 * <p>Graphs are compared up to variable renaming: same concepts, same number
 * of triples, and the same pointer text when serialized again.</p>
 */
final class PenmanPointerRoundTripTest
{
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final PenmanPointerCodec codec = PenmanPointerCodec.create(
            PointerCodecConfig.builder().withObservabilitySink(sink).build());

    private static final List<String> GRAPHS = List.of(
            "(a / go-01 :ARG0 (p / person) :time (k / yesterday))",
            "(w / want-01 :ARG0 (b / boy) :ARG1 (g / go-01 :ARG0 b))",
            "(w / want-01 :ARG0 b :ARG1 (b / boy))",
            "(b / boy :ARG0-of (w / want-01 :polarity -))",
            "(a / love-01 :ARG0 a)",
            "(n / name :op1 \"A \\\"nested\\\" quote\" :op2 \"B\")",
            "(h / have-rel-role-91 :ARG0 (i / i) :ARG2 (f / friend :quant 2))");

    private static Map<String, Long> concepts(Graph graph)
    {
        return graph.instances().stream()
                .collect(Collectors.groupingBy(Triple::target, TreeMap::new, Collectors.counting()));
    }

    @Test
    void pointerTextSurvivesDecodeAndSerialize()
    {
        for (String penman : GRAPHS) {
            String pointer = codec.toPointerNotation(penman);

            PointerDecodeResult decoded = codec.fromPointerNotation(pointer);
            assertEquals(DecodeStatus.OK, decoded.status(), penman);
            assertEquals(pointer, codec.serialize(decoded.graph()), penman);
        }
    }

    @Test
    void decodedGraphIsIsomorphicToTheOriginal()
    {
        for (String penman : GRAPHS) {
            Graph original = codec.decodePenman(penman);
            Graph decoded = codec.fromPointerNotation(codec.serialize(original)).graph();

            assertEquals(original.triples().size(), decoded.triples().size(), penman);
            assertEquals(concepts(original), concepts(decoded), penman);
            assertEquals(
                    original.conceptOf(original.top().orElseThrow()),
                    decoded.conceptOf(decoded.top().orElseThrow()),
                    penman);
        }
    }

    @Test
    void strictParseAndSerializerAgree()
    {
        for (String penman : GRAPHS) {
            PointerParseResult.Parsed parsed =
                    assertInstanceOf(PointerParseResult.Parsed.class, codec.parsePointer(penman));

            assertEquals(parsed.pointerText(), codec.serialize(parsed.graph()), penman);
            assertEquals(parsed.pointerText(), codec.serialize(penman), penman);
        }
    }

    @Test
    void goYesterdayScenario()
    {
        String pointer = codec.toPointerNotation("(a / go-01 :ARG0 (p / person) :time (k / yesterday))");
        assertEquals(
                "( <pointer:0> go-01 :ARG0 ( <pointer:1> person ) :time ( <pointer:2> yesterday ) )",
                pointer);

        Graph graph = codec.fromPointerNotation(pointer).graph();
        assertEquals(3, graph.instances().size());
        assertEquals(Map.of("go-01", 1L, "person", 1L, "yesterday", 1L), concepts(graph));
        assertEquals("go-01", graph.conceptOf(graph.top().orElseThrow()).orElseThrow());
    }

    @Test
    void escapedQuotesSurviveAFullCycle()
    {
        String literal = "\"A \\\"nested\\\" quote\"";
        String pointer = codec.toPointerNotation("(n / name :op1 " + literal + ")");

        Graph graph = codec.fromPointerNotation(pointer).graph();
        assertTrue(graph.contains(new Triple(graph.top().orElseThrow(), ":op1", literal)));
        assertEquals("( <pointer:0> name :op1 " + literal + " )", codec.serialize(graph));
    }

    @Test
    void selfLoopIsPreserved()
    {
        Graph graph = codec.fromPointerNotation(codec.toPointerNotation("(a / love-01 :ARG0 a)")).graph();
        String variable = graph.top().orElseThrow();
        assertTrue(graph.contains(new Triple(variable, ":ARG0", variable)));
    }

    @Test
    void distinctVariablesGetDistinctPointers()
    {
        PointerParseResult.Parsed parsed = assertInstanceOf(PointerParseResult.Parsed.class,
                codec.parsePointer("(w / want-01 :ARG0 (b / boy) :ARG1 (g / go-01 :ARG0 b))"));

        assertEquals(3, parsed.pointerByName().size());
        assertEquals(3, Set.copyOf(parsed.pointerByName().values()).size());
    }

    @Test
    void unbalancedModelOutputBacksOffWithoutThrowing()
    {
        PointerDecodeResult result = codec.fromPointerNotation("( <pointer:0> go-01 :ARG0 ( <pointer:1> person )");

        assertEquals(DecodeStatus.BACKOFF, result.status());
        assertEquals(PointerDecodeResult.BACKOFF_GRAPH, result.graph());
        assertEquals(BackoffReason.MALFORMED_INPUT, ((PointerDecodeResult.Backoff) result).reason());
        assertTrue(sink.hasEventOfType(BackoffEvent.class));
    }

    @Test
    void strictFailuresThrow()
    {
        assertEquals(PointerParseError.DUPLICATE_NODE_NAME, assertThrows(PointerNotationException.class,
                () -> codec.toPointerNotation("(a / go-01 :ARG0 (a / person))")).kind());
        assertEquals(PointerParseError.UNRESOLVED_NODE_NAMES, assertThrows(PointerNotationException.class,
                () -> codec.toPointerNotation("(a / go-01 :ARG0 b)")).kind());
    }

    @Test
    void toPenmanUsesConfiguredFormat()
    {
        assertEquals("(g1 / go-01\n    :ARG0 (p1 / person))",
                codec.toPenman("( <pointer:0> go-01 :ARG0 ( <pointer:1> person ) )"));

        PenmanPointerCodec singleLine = PenmanPointerCodec.create(PointerCodecConfig.builder()
                .withPenmanFormat(PenmanFormat.singleLine())
                .withObservabilitySink(sink)
                .build());
        assertEquals("(g1 / go-01 :ARG0 (p1 / person))",
                singleLine.toPenman("( <pointer:0> go-01 :ARG0 ( <pointer:1> person ) )"));
    }

    @Test
    void toPenmanOfMalformedInputIsTheBackoffGraph()
    {
        assertEquals("(x1 / string-entity)", codec.toPenman("((("));
    }
}
