package com.questrail.penman.codec;

/**
 * PointerNotationParser
 * -----------------------------------------------------------------------------
 * Strict front end converting Penman text written with short node names
 * ({@code a}, {@code p12}) into pointer notation, where every node name is
 * replaced by a {@code <pointer:N>} token.
 *
 * <p>This parser <strong>fails hard</strong>: a grammar violation stops the
 * conversion with no partial result. It is meant for trusted input, where a
 * failure should stop a batch rather than be papered over.</p>
 *
 * <p>Implementations hold no state between calls and may be shared.</p>
 */
public interface PointerNotationParser
{
    /**
     * Convert {@code text} into the canonical pointer-token string.
     *
     * @throws PointerNotationException naming the error kind, parser state and
     *         offending character when {@code text} violates the grammar
     */
    String toPointerNotation(String text);

    /**
     * Convert {@code text} and decode it into a graph whose variables are the
     * allocated pointer tokens.
     *
     * @return {@link PointerParseResult.Parsed} on success,
     *         {@link PointerParseResult.Failed} on any grammar violation
     */
    PointerParseResult parse(String text);
}
