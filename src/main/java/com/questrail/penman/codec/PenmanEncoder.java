package com.questrail.penman.codec;

import com.questrail.penman.model.Graph;

/**
 * PenmanEncoder
 * -----------------------------------------------------------------------------
 * Mechanical inverse of {@link PenmanDecoder}.
 *
 * <p>The encoder rebuilds the node tree from the graph's epidata when every
 * triple carries some, and from a depth-first walk starting at the top
 * otherwise. It never mutates the graph it is given.</p>
 */
public interface PenmanEncoder
{
    /**
     * Encode {@code graph} as Penman text laid out according to {@code format}.
     *
     * @throws PenmanEncodeException if the graph cannot be laid out as a tree
     *         rooted at its top
     */
    String encode(Graph graph, PenmanFormat format);
}
