package com.questrail.penman.codec;

import com.questrail.penman.model.Graph;

/**
 * PenmanDecoder
 * -----------------------------------------------------------------------------
 * Text-level decoder for Penman graph notation.
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Lexing and validating the bracketed structure</li>
 *   <li>Interpreting nodes into {@code (source, role, target)} triples</li>
 *   <li>Recording Push/Pop epidata so the nesting can be reproduced</li>
 *   <li>Collecting {@code # ::key value} metadata lines</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for checking roles or
 * concepts against any schema.</p>
 */
public interface PenmanDecoder
{
    /**
     * Decode one graph from {@code text}.
     *
     * @param text Penman text; blank text decodes to {@link Graph#empty()}
     * @return the decoded graph
     * @throws PenmanDecodeException if the text is not well-formed
     */
    Graph decode(String text);
}
