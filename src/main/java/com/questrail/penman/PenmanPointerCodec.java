package com.questrail.penman;

import com.questrail.penman.codec.PenmanDecoder;
import com.questrail.penman.codec.PenmanEncoder;
import com.questrail.penman.codec.PointerDecodeResult;
import com.questrail.penman.codec.PointerNotationDecoder;
import com.questrail.penman.codec.PointerNotationParser;
import com.questrail.penman.codec.PointerNotationSerializer;
import com.questrail.penman.codec.PointerParseResult;
import com.questrail.penman.codec.impl.DefaultPenmanDecoder;
import com.questrail.penman.codec.impl.DefaultPenmanEncoder;
import com.questrail.penman.config.PointerCodecConfig;
import com.questrail.penman.internal.decode.RecursivePointerNotationDecoder;
import com.questrail.penman.internal.encode.DefaultPointerNotationSerializer;
import com.questrail.penman.internal.pointer.StateMachinePointerNotationParser;
import com.questrail.penman.model.Graph;

import java.util.Objects;

/**
 * PenmanPointerCodec
 * =============================================================================
 * Composition root for the Penman / pointer-notation codec.
 *
 * <pre>
 *   Penman text  --toPointerNotation / parsePointer-->  pointer text
 *   Graph        --serialize----------------------->  pointer text
 *   pointer text --fromPointerNotation-------------->  Graph (or backoff)
 *   pointer text --toPenman------------------------->  Penman text
 * </pre>
 *
 * <p>Every component is stateless and all per-call state is created inside
 * the call, so one instance may be shared between threads.</p>
 */
public final class PenmanPointerCodec
{
    private final PointerCodecConfig config;
    private final PenmanDecoder penmanDecoder;
    private final PenmanEncoder penmanEncoder;
    private final PointerNotationParser parser;
    private final PointerNotationDecoder decoder;
    private final PointerNotationSerializer serializer;

    private PenmanPointerCodec(PointerCodecConfig config)
    {
        this.config = config;
        this.penmanDecoder = new DefaultPenmanDecoder();
        this.penmanEncoder = new DefaultPenmanEncoder();
        this.parser = new StateMachinePointerNotationParser(
                penmanDecoder, config.observabilitySink(), config.clock());
        this.decoder = new RecursivePointerNotationDecoder(
                penmanDecoder, config.observabilitySink(), config.clock());
        this.serializer = new DefaultPointerNotationSerializer(
                penmanDecoder, penmanEncoder, config.reuseZPrefixVariables());
    }

    public static PenmanPointerCodec create(PointerCodecConfig config)
    {
        return new PenmanPointerCodec(Objects.requireNonNull(config, "config"));
    }

    public static PenmanPointerCodec withDefaults()
    {
        return create(PointerCodecConfig.defaults());
    }

    public PointerCodecConfig config()
    {
        return config;
    }

    /**
     * Strict conversion of Penman text with short node names.
     *
     * @throws com.questrail.penman.codec.PointerNotationException on any grammar violation
     */
    public String toPointerNotation(String penmanText)
    {
        return parser.toPointerNotation(penmanText);
    }

    /**
     * Strict conversion reporting failures as a {@link PointerParseResult.Failed}.
     */
    public PointerParseResult parsePointer(String penmanText)
    {
        return parser.parse(penmanText);
    }

    /**
     * Lenient decode of model output; never throws for malformed input.
     */
    public PointerDecodeResult fromPointerNotation(String pointerText)
    {
        return decoder.decode(pointerText);
    }

    public String serialize(Graph graph)
    {
        return serializer.serialize(graph);
    }

    public String serialize(String penmanText)
    {
        return serializer.serialize(penmanText);
    }

    /**
     * Pointer text to Penman text in the configured format. Malformed input
     * yields the Penman text of the backoff graph.
     */
    public String toPenman(String pointerText)
    {
        return encodePenman(fromPointerNotation(pointerText).graph());
    }

    public Graph decodePenman(String penmanText)
    {
        return penmanDecoder.decode(penmanText);
    }

    public String encodePenman(Graph graph)
    {
        return penmanEncoder.encode(graph, config.penmanFormat());
    }
}
