package com.questrail.penman.internal.decode;

import com.questrail.penman.codec.BackoffReason;
import com.questrail.penman.codec.PenmanDecodeException;
import com.questrail.penman.codec.PenmanDecoder;
import com.questrail.penman.codec.PointerDecodeResult;
import com.questrail.penman.codec.PointerNotationDecoder;
import com.questrail.penman.codec.impl.DefaultPenmanDecoder;
import com.questrail.penman.internal.pointer.PointerTokens;
import com.questrail.penman.internal.time.SystemWallClock;
import com.questrail.penman.internal.time.WallClock;
import com.questrail.penman.model.Graph;
import com.questrail.penman.observability.BackoffEvent;
import com.questrail.penman.observability.CodecErrorEvent;
import com.questrail.penman.observability.CodecObservabilitySink;
import com.questrail.penman.observability.NullObservabilitySink;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * RecursivePointerNotationDecoder
 * ============================================================================
 * Recursive-descent implementation of {@link PointerNotationDecoder}.
 *
 * <h2>Pipeline</h2>
 * <pre>
 *   pointer text
 *     -> PointerTokenizer            (literal-aware tokens)
 *     -> declaration pre-scan        (pointer -> short variable, pre-order)
 *     -> recursive node walk         (Penman text, one node per call)
 *     -> PenmanDecoder               (graph)
 * </pre>
 *
 * <p>The extent of a nested node is found by counting parenthesis tokens
 * from its {@code (} to the matching {@code )}; the walk descends into a
 * value only when the value begins with {@code (}. Other values are either
 * {@code <pointer:N>} references, rewritten to the variable of node N, or
 * constants and literals copied unchanged.</p>
 *
 * <p>Text nested deeper than {@link DefaultPenmanDecoder#MAX_DEPTH} nodes is
 * rejected before the walk. Generated variables never reuse the spelling of
 * a bare constant found in the text.</p>
 *
 * <h2>Failure policy</h2>
 * <p>Nothing raised while walking or decoding escapes {@link #decode(String)}.
 * Every failure, and a decode that yields no anchored graph, produces a
 * {@link PointerDecodeResult.Backoff} and a {@link BackoffEvent}.</p>
 */
public final class RecursivePointerNotationDecoder implements PointerNotationDecoder
{
    private final PenmanDecoder penmanDecoder;
    private final CodecObservabilitySink observabilitySink;
    private final WallClock clock;

    public RecursivePointerNotationDecoder(PenmanDecoder penmanDecoder,
                                           CodecObservabilitySink observabilitySink,
                                           WallClock clock)
    {
        this.penmanDecoder = Objects.requireNonNull(penmanDecoder, "penmanDecoder");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public RecursivePointerNotationDecoder()
    {
        this(new DefaultPenmanDecoder(), NullObservabilitySink.INSTANCE, SystemWallClock.INSTANCE);
    }

    @Override
    public PointerDecodeResult decode(String pointerText)
    {
        Objects.requireNonNull(pointerText, "pointerText");

        final String penmanText;
        try {
            penmanText = toPenmanText(pointerText);
        }
        catch (PointerSyntaxException e) {
            return backoff(BackoffReason.MALFORMED_INPUT, e.getMessage(), pointerText, e);
        }
        catch (RuntimeException e) {
            observabilitySink.onError(new CodecErrorEvent(clock.now(), "Processing failure", e));
            return backoff(BackoffReason.MALFORMED_INPUT, "Processing failure: " + e, pointerText, e);
        }

        final Graph graph;
        try {
            graph = penmanDecoder.decode(penmanText);
        }
        catch (PenmanDecodeException e) {
            return backoff(BackoffReason.DECODE_FAILURE, e.getMessage(), pointerText, e);
        }
        catch (RuntimeException e) {
            observabilitySink.onError(new CodecErrorEvent(clock.now(), "Decoding failure", e));
            return backoff(BackoffReason.DECODE_FAILURE, "Decoding failure: " + e, pointerText, e);
        }

        if (graph.isEmpty() || graph.top().isEmpty()) {
            return backoff(BackoffReason.EMPTY_GRAPH, "Decoded graph is empty", pointerText, null);
        }
        return new PointerDecodeResult.Decoded(graph, penmanText);
    }

    /**
     * Rewrites pointer text into Penman text with generated variable names.
     * Text that does not start with {@code (} is returned unchanged.
     */
    static String toPenmanText(String pointerText)
    {
        final List<String> tokens = PointerTokenizer.tokenize(pointerText);
        if (tokens.isEmpty()) {
            return "";
        }
        if (!tokens.get(0).equals("(")) {
            return pointerText;
        }

        checkDepth(tokens);

        final int close = matchingClose(tokens, 0);
        if (close != tokens.size() - 1) {
            throw new PointerSyntaxException(
                    "Unexpected token after root node: " + tokens.get(close + 1));
        }

        final VariableNamer namer = new VariableNamer(bareAtoms(tokens));
        declareAll(tokens, namer);

        final StringBuilder out = new StringBuilder();
        appendNode(tokens, 0, close, namer, out);
        return out.toString();
    }

    private PointerDecodeResult backoff(BackoffReason reason, String detail, String input, Throwable cause)
    {
        observabilitySink.onBackoff(new BackoffEvent(clock.now(), reason, detail, input, cause));
        return new PointerDecodeResult.Backoff(reason, detail);
    }

    // ------------------------------------------------------------------------
    // Walk
    // ------------------------------------------------------------------------

    /**
     * Names every declared node in text order, so a reference may precede
     * the declaration it points at.
     */
    private static void declareAll(List<String> tokens, VariableNamer namer)
    {
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).equals("(")) {
                namer.declare(pointerAt(tokens, i + 1), conceptAt(tokens, i + 2));
            }
        }
    }

    private static void checkDepth(List<String> tokens)
    {
        int depth = 0;
        for (String token : tokens) {
            if (token.equals("(") && ++depth > DefaultPenmanDecoder.MAX_DEPTH) {
                throw new PointerSyntaxException(
                        "Nesting deeper than " + DefaultPenmanDecoder.MAX_DEPTH + " nodes");
            }
            if (token.equals(")")) {
                depth--;
            }
        }
    }

    /**
     * Collects the constants written as role values, e.g. {@code p1} in
     * {@code :mod p1}. Quoted literals and pointers are excluded.
     */
    private static Set<String> bareAtoms(List<String> tokens)
    {
        final Set<String> atoms = new HashSet<>();
        for (int i = 1; i < tokens.size(); i++) {
            final String value = tokens.get(i);
            if (isRole(tokens.get(i - 1))
                    && !value.equals("(") && !value.equals(")") && !isRole(value)
                    && !PointerTokens.isPointer(value) && value.charAt(0) != '"') {
                atoms.add(value);
            }
        }
        return atoms;
    }

    private static void appendNode(List<String> tokens, int open, int close,
                                   VariableNamer namer, StringBuilder out)
    {
        final String pointer = pointerAt(tokens, open + 1);
        final String concept = conceptAt(tokens, open + 2);
        final String variable = namer.declare(pointer, concept);

        out.append('(').append(variable).append(" / ").append(concept);

        int i = open + 3;
        while (i < close) {
            final String role = tokens.get(i);
            if (!isRole(role)) {
                throw new PointerSyntaxException("Expecting role or ')', got " + role);
            }
            if (i + 1 >= close) {
                throw new PointerSyntaxException("Role without value: " + role);
            }

            final String value = tokens.get(i + 1);
            out.append(' ').append(role).append(' ');

            if (value.equals("(")) {
                final int nestedClose = matchingClose(tokens, i + 1);
                appendNode(tokens, i + 1, nestedClose, namer, out);
                i = nestedClose + 1;
            }
            else if (isRole(value)) {
                throw new PointerSyntaxException("Role without value: " + role);
            }
            else if (PointerTokens.isPointer(value)) {
                out.append(namer.resolve(value).orElse(value));
                i += 2;
            }
            else {
                out.append(value);
                i += 2;
            }
        }
        out.append(')');
    }

    private static int matchingClose(List<String> tokens, int open)
    {
        int depth = 0;
        for (int i = open; i < tokens.size(); i++) {
            final String token = tokens.get(i);
            if (token.equals("(")) {
                depth++;
            }
            else if (token.equals(")")) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        throw new PointerSyntaxException("Unbalanced parentheses: no ')' matches '(' at token " + open);
    }

    private static String pointerAt(List<String> tokens, int index)
    {
        if (index >= tokens.size() || !PointerTokens.isPointer(tokens.get(index))) {
            throw new PointerSyntaxException("Expecting pointer after '(' at token " + (index - 1)
                    + (index < tokens.size() ? ", got " + tokens.get(index) : ""));
        }
        return tokens.get(index);
    }

    private static String conceptAt(List<String> tokens, int index)
    {
        if (index >= tokens.size()) {
            throw new PointerSyntaxException("Missing concept at end of input");
        }
        final String concept = tokens.get(index);
        if (concept.equals("(") || concept.equals(")") || isRole(concept)) {
            throw new PointerSyntaxException("Expecting concept at token " + index + ", got " + concept);
        }
        return concept;
    }

    private static boolean isRole(String token)
    {
        return token.charAt(0) == ':';
    }
}
