package com.questrail.penman.internal.encode;

import com.questrail.penman.codec.PenmanDecoder;
import com.questrail.penman.codec.PenmanEncodeException;
import com.questrail.penman.codec.PenmanEncoder;
import com.questrail.penman.codec.PenmanFormat;
import com.questrail.penman.codec.PointerNotationSerializer;
import com.questrail.penman.codec.PointerSerializationException;
import com.questrail.penman.codec.impl.DefaultPenmanDecoder;
import com.questrail.penman.codec.impl.DefaultPenmanEncoder;
import com.questrail.penman.internal.pointer.PointerTokens;
import com.questrail.penman.internal.rename.VariableRenamer;
import com.questrail.penman.model.Graph;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * DefaultPointerNotationSerializer
 * ============================================================================
 * Concrete implementation of {@link PointerNotationSerializer}.
 *
 * <h2>Pointer assignment</h2>
 * <ul>
 *   <li>If every declared variable has the shape {@code z<digits>} (and reuse
 *       is enabled), {@code zN} is written as {@code <pointer:N>}. Serializing
 *       an already-normalized graph twice gives the same numbering.</li>
 *   <li>Otherwise pointers are allocated from 0 in the order the instance
 *       triples appear in the graph.</li>
 * </ul>
 *
 * <p>The renamed graph is encoded on a single line by the Penman encoder and
 * then re-spaced by {@link LiteralSafeWhitespace}.</p>
 */
public final class DefaultPointerNotationSerializer implements PointerNotationSerializer
{
    private final PenmanDecoder penmanDecoder;
    private final PenmanEncoder penmanEncoder;
    private final boolean reuseZPrefixVariables;

    public DefaultPointerNotationSerializer(PenmanDecoder penmanDecoder,
                                            PenmanEncoder penmanEncoder,
                                            boolean reuseZPrefixVariables)
    {
        this.penmanDecoder = Objects.requireNonNull(penmanDecoder, "penmanDecoder");
        this.penmanEncoder = Objects.requireNonNull(penmanEncoder, "penmanEncoder");
        this.reuseZPrefixVariables = reuseZPrefixVariables;
    }

    public DefaultPointerNotationSerializer()
    {
        this(new DefaultPenmanDecoder(), new DefaultPenmanEncoder(), true);
    }

    @Override
    public String serialize(Graph graph)
    {
        Objects.requireNonNull(graph, "graph");

        final String top = graph.top()
                .orElseThrow(() -> new PointerSerializationException("Graph has no top"));
        final List<String> variables = graph.variables();
        if (!variables.contains(top)) {
            throw new PointerSerializationException("Top is not a declared variable: " + top);
        }

        final Graph renamed = VariableRenamer.rename(graph, pointerMapping(variables));

        final String penman;
        try {
            penman = penmanEncoder.encode(renamed, PenmanFormat.singleLine());
        }
        catch (PenmanEncodeException e) {
            throw new PointerSerializationException("Cannot lay out graph: " + e.getMessage(), e);
        }
        return LiteralSafeWhitespace.normalize(penman);
    }

    @Override
    public String serialize(String penmanText)
    {
        Objects.requireNonNull(penmanText, "penmanText");
        return serialize(penmanDecoder.decode(penmanText).withoutMetadata());
    }

    Map<String, String> pointerMapping(List<String> variables)
    {
        final Map<String, String> mapping = new LinkedHashMap<>();
        if (reuseZPrefixVariables && variables.stream().allMatch(PointerTokens::isZPrefixVariable)) {
            for (String variable : variables) {
                mapping.put(variable, PointerTokens.zPrefixToPointer(variable));
            }
            return mapping;
        }

        int next = 0;
        for (String variable : variables) {
            if (!mapping.containsKey(variable)) {
                mapping.put(variable, PointerTokens.pointer(next++));
            }
        }
        return mapping;
    }
}
