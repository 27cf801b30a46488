/**
 * Penman Text Codec Implementation
 * =============================================================================
 *
 * <p>Lexer, recursive-descent decoder and encoder for Penman graph text.</p>
 *
 * <pre>
 *   text -> PenmanLexer -> tokens -> PenmanTree -> triples + epidata -> Graph
 *   Graph -> PenmanLayout -> PenmanTree -> DefaultPenmanEncoder -> text
 * </pre>
 *
 * <p>{@link com.questrail.penman.codec.impl.PenmanTree} is the only shared
 * structure between the two directions. It is not part of the public API.</p>
 */
package com.questrail.penman.codec.impl;
