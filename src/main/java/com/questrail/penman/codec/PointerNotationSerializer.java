package com.questrail.penman.codec;

import com.questrail.penman.model.Graph;

/**
 * PointerNotationSerializer
 * -----------------------------------------------------------------------------
 * Converts a graph into pointer-linear text for consumption by a sequence
 * model.
 *
 * <p>The serializer does not decide what the model sees beyond the notation
 * itself: no lower-casing, no prefixes, no truncation.</p>
 */
public interface PointerNotationSerializer
{
    /**
     * @throws PointerSerializationException if the graph has no usable top or
     *         cannot be laid out
     */
    String serialize(Graph graph);

    /**
     * Decode {@code penmanText}, drop its metadata and serialize the result.
     *
     * @throws PenmanDecodeException if {@code penmanText} is not well-formed
     */
    String serialize(String penmanText);
}
