package com.questrail.penman.internal.pointer;

import com.questrail.penman.codec.PenmanDecodeException;
import com.questrail.penman.codec.PenmanDecoder;
import com.questrail.penman.codec.PointerNotationException;
import com.questrail.penman.codec.PointerNotationParser;
import com.questrail.penman.codec.PointerParseError;
import com.questrail.penman.codec.PointerParseResult;
import com.questrail.penman.codec.impl.DefaultPenmanDecoder;
import com.questrail.penman.internal.rename.VariableRenamer;
import com.questrail.penman.internal.time.SystemWallClock;
import com.questrail.penman.internal.time.WallClock;
import com.questrail.penman.model.Graph;
import com.questrail.penman.observability.CodecObservabilitySink;
import com.questrail.penman.observability.NullObservabilitySink;
import com.questrail.penman.observability.PointerParseFailureEvent;

import java.util.Map;
import java.util.Objects;

/**
 * StateMachinePointerNotationParser
 * ============================================================================
 * Character-level state machine implementing {@link PointerNotationParser}.
 *
 * <h2>Output</h2>
 * The input tree re-emitted as one space-separated token stream:
 * parentheses are their own tokens, the {@code /} before a concept is
 * dropped, and every node name is replaced by a {@code <pointer:N>} token
 * allocated in first-seen order.
 *
 * <pre>
 *   (a / go-01 :ARG0 (p / person))
 *     -> ( &lt;pointer:0&gt; go-01 :ARG0 ( &lt;pointer:1&gt; person ) )
 * </pre>
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>A node name is 1-3 lowercase letters optionally followed by digits;
 *       any other token in naming position is fatal.</li>
 *   <li>A bare value shaped like a node name is a reference. A reference to a
 *       name not declared yet stays unresolved until a later declaration of
 *       the same name; anything still unresolved at end of input is fatal.</li>
 *   <li>Quoted literals are copied verbatim; {@code \"} does not end them and
 *       whitespace inside them is not a token boundary.</li>
 *   <li>Input must end in {@link ParserState#END}, which is only reachable at
 *       parenthesis depth zero.</li>
 * </ul>
 *
 * <p>There is no backtracking and no partial result. All mutable state lives
 * in a {@link Run} created per call, so one instance may be shared by
 * concurrent callers.</p>
 */
public final class StateMachinePointerNotationParser implements PointerNotationParser
{
    private final PenmanDecoder penmanDecoder;
    private final CodecObservabilitySink observabilitySink;
    private final WallClock clock;

    public StateMachinePointerNotationParser(PenmanDecoder penmanDecoder,
                                             CodecObservabilitySink observabilitySink,
                                             WallClock clock)
    {
        this.penmanDecoder = Objects.requireNonNull(penmanDecoder, "penmanDecoder");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public StateMachinePointerNotationParser()
    {
        this(new DefaultPenmanDecoder(), NullObservabilitySink.INSTANCE, SystemWallClock.INSTANCE);
    }

    @Override
    public String toPointerNotation(String text)
    {
        Objects.requireNonNull(text, "text");
        return new Run(text).execute();
    }

    @Override
    public PointerParseResult parse(String text)
    {
        Objects.requireNonNull(text, "text");

        final Run run = new Run(text);
        final String pointerText;
        try {
            pointerText = run.execute();
        }
        catch (PointerNotationException e) {
            return failed(e.kind(), e.getMessage(), text);
        }

        final Graph graph;
        try {
            graph = penmanDecoder.decode(text);
        }
        catch (PenmanDecodeException e) {
            return failed(PointerParseError.INVALID_GRAPH, e.getMessage(), text);
        }

        final Map<String, String> pointerByName = run.allocator.pointerByName();
        return new PointerParseResult.Parsed(
                pointerText,
                VariableRenamer.rename(graph, pointerByName),
                pointerByName);
    }

    private PointerParseResult failed(PointerParseError kind, String detail, String text)
    {
        observabilitySink.onParseFailure(
                new PointerParseFailureEvent(clock.now(), kind, detail, text.length()));
        return new PointerParseResult.Failed(kind, detail);
    }

    // ------------------------------------------------------------------------
    // One conversion
    // ------------------------------------------------------------------------

    private static final class Run
    {
        private final char[] input;
        private final StringBuilder out;
        private final PointerAllocator allocator = new PointerAllocator();

        private ParserState state = ParserState.FIND_FIRST_LEFT;
        private int level;
        private int tokenStart;
        private boolean escaped;

        Run(String text) {
            this.input = text.toCharArray();
            this.out = new StringBuilder(text.length() + 16);
        }

        String execute()
        {
            for (int i = 0; i < input.length; i++) {
                step(input[i], i);
            }

            if (state != ParserState.END) {
                throw fail(PointerParseError.UNEXPECTED_END_STATUS, input.length,
                        "Unexpected end status: " + state.label());
            }
            if (!allocator.unresolved().isEmpty()) {
                throw fail(PointerParseError.UNRESOLVED_NODE_NAMES, input.length,
                        "Unresolved node names: " + allocator.unresolved());
            }
            return out.toString();
        }

        private void step(char c, int i)
        {
            switch (state) {

                case FIND_FIRST_LEFT -> {
                    // Anything before the first '(' is ignored.
                    if (c == '(') {
                        openNode();
                    }
                }

                case FIND_BEGIN_OF_NEW_NODE_NAME -> {
                    if (isLower(c)) {
                        tokenStart = i;
                        state = ParserState.FIND_END_OF_NEW_NODE_NAME;
                    }
                    else if (!Character.isWhitespace(c)) {
                        throw unexpected(PointerParseError.UNEXPECTED_BEGIN_OF_NODE_NAME, c, i,
                                "Unexpected begin of node name");
                    }
                }

                case FIND_END_OF_NEW_NODE_NAME -> {
                    if (isLower(c) || isDigit(c) || c == '-') {
                        return;
                    }
                    if (!Character.isWhitespace(c) && c != '/') {
                        throw unexpected(PointerParseError.UNEXPECTED_CHAR_OF_NODE_NAME, c, i,
                                "Unexpected char of node name");
                    }
                    final String name = token(i);
                    if (!PointerTokens.isNodeName(name)) {
                        throw fail(PointerParseError.UNEXPECTED_NODE_NAME, tokenStart,
                                "Unexpected node name: \"" + name + "\"");
                    }
                    final String pointer = allocator.declare(name);
                    if (pointer == null) {
                        throw fail(PointerParseError.DUPLICATE_NODE_NAME, tokenStart,
                                "Duplicate node name: " + name);
                    }
                    out.append(pointer).append(' ');
                    state = (c == '/') ? ParserState.FIND_BEGIN_OF_CONCEPT : ParserState.FIND_SLASH;
                }

                case FIND_SLASH -> {
                    if (c == '/') {
                        state = ParserState.FIND_BEGIN_OF_CONCEPT;
                    }
                    else if (!Character.isWhitespace(c)) {
                        throw unexpected(PointerParseError.EXPECTING_SLASH, c, i, "Expecting slash");
                    }
                }

                case FIND_BEGIN_OF_CONCEPT -> {
                    if (isLower(c)) {
                        tokenStart = i;
                        state = ParserState.FIND_END_OF_CONCEPT;
                    }
                    else if (!Character.isWhitespace(c)) {
                        throw unexpected(PointerParseError.UNEXPECTED_BEGIN_OF_CONCEPT, c, i,
                                "Unexpected begin of concept");
                    }
                }

                case FIND_END_OF_CONCEPT -> {
                    if (isLower(c) || isDigit(c) || c == '-') {
                        return;
                    }
                    if (!Character.isWhitespace(c) && c != ')') {
                        throw unexpected(PointerParseError.UNEXPECTED_CHAR_OF_CONCEPT, c, i,
                                "Unexpected char of concept");
                    }
                    out.append(input, tokenStart, i - tokenStart);
                    if (c == ')') {
                        closeNode();
                    } else {
                        state = ParserState.FIND_RIGHT_OR_BEGIN_OF_RELATION;
                    }
                }

                case FIND_RIGHT_OR_BEGIN_OF_RELATION -> {
                    if (c == ')') {
                        closeNode();
                    }
                    else if (c == ':') {
                        tokenStart = i;
                        state = ParserState.FIND_END_OF_RELATION;
                    }
                    else if (!Character.isWhitespace(c)) {
                        throw unexpected(PointerParseError.EXPECTING_RIGHT_OR_RELATION, c, i,
                                "Expecting right parenthesis or begin of relation");
                    }
                }

                case FIND_END_OF_RELATION -> {
                    if (isLower(c) || isUpper(c) || isDigit(c) || c == '-') {
                        return;
                    }
                    if (!Character.isWhitespace(c) && c != '(' && c != '"') {
                        throw unexpected(PointerParseError.UNEXPECTED_CHAR_OF_RELATION, c, i,
                                "Unexpected char of relation");
                    }
                    out.append(' ').append(input, tokenStart, i - tokenStart).append(' ');
                    if (c == '(') {
                        openNode();
                    }
                    else if (c == '"') {
                        openLiteral();
                    }
                    else {
                        state = ParserState.FIND_LEFT_OR_BEGIN_OF_VALUE;
                    }
                }

                case FIND_LEFT_OR_BEGIN_OF_VALUE -> {
                    if (c == '(') {
                        openNode();
                    }
                    else if (isLower(c) || isDigit(c) || c == '+' || c == '-') {
                        // A node name or a non-literal constant.
                        tokenStart = i;
                        state = ParserState.FIND_END_OF_NON_LITERAL_VALUE;
                    }
                    else if (c == '"') {
                        openLiteral();
                    }
                    else if (!Character.isWhitespace(c)) {
                        throw unexpected(PointerParseError.EXPECTING_LEFT_OR_VALUE, c, i,
                                "Expecting left parenthesis or begin of value");
                    }
                }

                case FIND_END_OF_NON_LITERAL_VALUE -> {
                    // '.' admits decimal constants.
                    if (isLower(c) || isDigit(c) || c == '-' || c == '.') {
                        return;
                    }
                    if (!Character.isWhitespace(c) && c != ')') {
                        throw unexpected(PointerParseError.UNEXPECTED_CHAR_OF_VALUE, c, i,
                                "Unexpected char of node name or constant");
                    }
                    final String value = token(i);
                    if (PointerTokens.isNodeName(value)) {
                        out.append(allocator.reference(value));
                    } else {
                        out.append(value);
                    }
                    if (c == ')') {
                        closeNode();
                    } else {
                        state = ParserState.FIND_RIGHT_OR_BEGIN_OF_RELATION;
                    }
                }

                case FIND_END_OF_LITERAL_VALUE -> {
                    out.append(c);
                    if (escaped) {
                        escaped = false;
                    }
                    else if (c == '\\') {
                        escaped = true;
                    }
                    else if (c == '"') {
                        state = ParserState.FIND_RIGHT_OR_BEGIN_OF_RELATION;
                    }
                }

                case END -> {
                    if (!Character.isWhitespace(c)) {
                        throw unexpected(PointerParseError.EXPECTING_END, c, i, "Expecting end");
                    }
                }
            }
        }

        private void openNode()
        {
            out.append("( ");
            level++;
            state = ParserState.FIND_BEGIN_OF_NEW_NODE_NAME;
        }

        private void closeNode()
        {
            level--;
            out.append(" )");
            state = (level == 0) ? ParserState.END : ParserState.FIND_RIGHT_OR_BEGIN_OF_RELATION;
        }

        private void openLiteral()
        {
            out.append('"');
            escaped = false;
            state = ParserState.FIND_END_OF_LITERAL_VALUE;
        }

        private String token(int end)
        {
            return new String(input, tokenStart, end - tokenStart);
        }

        private PointerNotationException unexpected(PointerParseError kind, char c, int offset, String what)
        {
            return fail(kind, offset, what + ", got \"" + c + "\"");
        }

        private PointerNotationException fail(PointerParseError kind, int offset, String detail)
        {
            return new PointerNotationException(kind, state.label(), offset, detail);
        }

        private static boolean isLower(char c)
        {
            return c >= 'a' && c <= 'z';
        }

        private static boolean isUpper(char c)
        {
            return c >= 'A' && c <= 'Z';
        }

        private static boolean isDigit(char c)
        {
            return c >= '0' && c <= '9';
        }
    }
}
