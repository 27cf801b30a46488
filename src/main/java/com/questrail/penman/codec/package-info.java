/**
 * Penman / Pointer Codec Interfaces
 * =============================================================================
 *
 * <p>This package defines the <strong>codec boundary</strong> between three
 * representations of the same rooted graph:</p>
 *
 * <ul>
 *   <li>Penman text with short node names, {@code (a / go-01 :ARG0 (p / person))}</li>
 *   <li>the {@link com.questrail.penman.model.Graph} value</li>
 *   <li>pointer notation, {@code ( <pointer:0> go-01 :ARG0 ( <pointer:1> person ) )}</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   Penman text
 *        -> PointerNotationParser      (strict, fails hard)
 *            -> pointer text
 *                -> PointerNotationDecoder   (lenient, backs off)
 *                    -> Graph
 *                        -> PointerNotationSerializer
 *                            -> pointer text
 * </pre>
 *
 * <h2>Two Error Policies</h2>
 * <p>The strict parser reports every grammar violation, either by throwing
 * {@link com.questrail.penman.codec.PointerNotationException} or as a
 * {@link com.questrail.penman.codec.PointerParseResult.Failed}. The lenient
 * decoder never throws for bad input: it answers with the fixed backoff graph
 * and {@link com.questrail.penman.codec.DecodeStatus#BACKOFF}. The two
 * channels share no error type.</p>
 */
package com.questrail.penman.codec;
