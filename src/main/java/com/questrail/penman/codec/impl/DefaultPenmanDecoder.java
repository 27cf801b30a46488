package com.questrail.penman.codec.impl;

import com.questrail.penman.codec.PenmanDecodeException;
import com.questrail.penman.codec.PenmanDecoder;
import com.questrail.penman.model.Epidatum;
import com.questrail.penman.model.Graph;
import com.questrail.penman.model.Pop;
import com.questrail.penman.model.Push;
import com.questrail.penman.model.Roles;
import com.questrail.penman.model.Triple;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * DefaultPenmanDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link PenmanDecoder}.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Metadata: leading {@code #} lines, {@code ::key value} pairs</li>
 *   <li>Lexing ({@link PenmanLexer})</li>
 *   <li>Recursive-descent parse into a {@link PenmanTree}</li>
 *   <li>Interpretation of the tree into triples and Push/Pop epidata</li>
 * </ol>
 *
 * <p>Interpretation is pre-order: a node's instance triple comes first, then
 * one triple per edge in text order, with the nested node's triples right
 * after the edge that opened it. Inverted roles pointing at a node variable
 * are stored de-inverted.</p>
 *
 * <p>Nodes nested deeper than {@link #MAX_DEPTH} are rejected with a
 * {@link PenmanDecodeException}.</p>
 */
public final class DefaultPenmanDecoder implements PenmanDecoder
{
    /** Deepest node nesting accepted by the parser. */
    public static final int MAX_DEPTH = 1000;

    @Override
    public Graph decode(String text)
    {
        Objects.requireNonNull(text, "text");

        final Map<String, String> metadata = new LinkedHashMap<>();
        final int bodyStart = readMetadata(text, metadata);

        final List<PenmanToken> tokens = PenmanLexer.tokenize(text, bodyStart);
        if (tokens.isEmpty()) {
            return new Graph(List.of(), null, Map.of(), metadata);
        }

        final TreeParser parser = new TreeParser(tokens, text.length());
        final PenmanTree.Node root = parser.node();
        parser.expectEnd();

        final List<Triple> triples = new ArrayList<>();
        final Map<Triple, List<Epidatum>> epidata = new LinkedHashMap<>();
        interpret(root, parser.variables, triples, epidata);

        return new Graph(triples, root.variable, epidata, metadata);
    }

    // ------------------------------------------------------------------------
    // Metadata
    // ------------------------------------------------------------------------

    /**
     * Consumes leading comment lines and returns the offset where the graph starts.
     */
    static int readMetadata(String text, Map<String, String> metadata)
    {
        int i = 0;
        while (true) {
            while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
                i++;
            }
            if (i >= text.length() || text.charAt(i) != '#') {
                return i;
            }
            int eol = text.indexOf('\n', i);
            if (eol < 0) {
                eol = text.length();
            }
            parseMetadataLine(text.substring(i + 1, eol), metadata);
            i = eol;
        }
    }

    private static void parseMetadataLine(String line, Map<String, String> metadata)
    {
        // "::key value" pairs; several may share one line.
        int start = nextKeyMarker(line, 0);
        while (start >= 0) {
            final int next = nextKeyMarker(line, start + 2);
            final String pair = line.substring(start + 2, next < 0 ? line.length() : next).strip();
            if (!pair.isEmpty()) {
                final int space = indexOfWhitespace(pair);
                if (space < 0) {
                    metadata.put(pair, "");
                } else {
                    metadata.put(pair.substring(0, space), pair.substring(space + 1).strip());
                }
            }
            start = next;
        }
    }

    private static int nextKeyMarker(String line, int from)
    {
        int i = line.indexOf("::", from);
        while (i > 0 && !Character.isWhitespace(line.charAt(i - 1))) {
            i = line.indexOf("::", i + 2);
        }
        return i;
    }

    private static int indexOfWhitespace(String s)
    {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    // ------------------------------------------------------------------------
    // Interpretation
    // ------------------------------------------------------------------------

    /**
     * Emits the triples of {@code node} and returns the last one emitted.
     */
    private static Triple interpret(PenmanTree.Node node,
                                    Set<String> variables,
                                    List<Triple> triples,
                                    Map<Triple, List<Epidatum>> epidata)
    {
        Triple last = Triple.instance(node.variable, node.concept);
        add(last, new ArrayList<>(), triples, epidata);

        for (PenmanTree.Edge edge : node.edges) {
            if (edge.isNested()) {
                final Triple triple = deinvert(node.variable, edge.role, edge.nested.variable);
                final List<Epidatum> directives = new ArrayList<>();
                directives.add(new Push(edge.nested.variable));
                add(triple, directives, triples, epidata);

                // The nested node is closed after its last triple.
                last = interpret(edge.nested, variables, triples, epidata);
                epidata.get(last).add(Pop.POP);
            }
            else {
                Triple triple = new Triple(node.variable, edge.role, edge.atom);
                if (Roles.isInverted(edge.role) && variables.contains(edge.atom)) {
                    triple = deinvert(node.variable, edge.role, edge.atom);
                }
                add(triple, new ArrayList<>(), triples, epidata);
                last = triple;
            }
        }
        return last;
    }

    private static Triple deinvert(String source, String role, String target)
    {
        if (Roles.isInverted(role)) {
            return new Triple(target, Roles.invert(role), source);
        }
        return new Triple(source, role, target);
    }

    private static void add(Triple triple,
                            List<Epidatum> directives,
                            List<Triple> triples,
                            Map<Triple, List<Epidatum>> epidata)
    {
        // A repeated triple keeps its first position; its directives accumulate there.
        final List<Epidatum> existing = epidata.get(triple);
        if (existing != null) {
            existing.addAll(directives);
            return;
        }
        triples.add(triple);
        epidata.put(triple, directives);
    }

    // ------------------------------------------------------------------------
    // Recursive-descent parse
    // ------------------------------------------------------------------------

    private static final class TreeParser
    {
        private final List<PenmanToken> tokens;
        private final int endOffset;
        private final Set<String> variables = new HashSet<>();
        private int position;
        private int depth;

        TreeParser(List<PenmanToken> tokens, int endOffset) {
            this.tokens = tokens;
            this.endOffset = endOffset;
        }

        PenmanTree.Node node()
        {
            final PenmanToken open = expect(PenmanToken.Type.LPAREN, "'('");
            if (++depth > MAX_DEPTH) {
                throw new PenmanDecodeException("Nesting deeper than " + MAX_DEPTH + " nodes", open.offset());
            }

            final PenmanToken variable = expect(PenmanToken.Type.SYMBOL, "node variable");
            if (!variables.add(variable.text())) {
                throw new PenmanDecodeException(
                        "Variable declared more than once: " + variable.text(), variable.offset());
            }

            expect(PenmanToken.Type.SLASH, "'/' after variable " + variable.text());

            final PenmanToken concept = next("concept of " + variable.text());
            if (!concept.is(PenmanToken.Type.SYMBOL) && !concept.is(PenmanToken.Type.STRING)) {
                throw unexpected(concept, "concept of " + variable.text());
            }

            final PenmanTree.Node node = new PenmanTree.Node(variable.text(), concept.text());

            while (true) {
                final PenmanToken token = next("')' or role");
                if (token.is(PenmanToken.Type.RPAREN)) {
                    depth--;
                    return node;
                }
                if (!token.is(PenmanToken.Type.ROLE)) {
                    throw unexpected(token, "')' or role");
                }
                node.edges.add(edge(token.text()));
            }
        }

        private PenmanTree.Edge edge(String role)
        {
            final PenmanToken target = peek("target of " + role);
            switch (target.type()) {
                case LPAREN:
                    return new PenmanTree.Edge(role, node());
                case SYMBOL:
                case STRING:
                    position++;
                    return new PenmanTree.Edge(role, target.text());
                default:
                    throw unexpected(target, "target of " + role);
            }
        }

        void expectEnd()
        {
            if (position < tokens.size()) {
                final PenmanToken token = tokens.get(position);
                throw new PenmanDecodeException("Unexpected text after graph: " + token.text(), token.offset());
            }
        }

        private PenmanToken expect(PenmanToken.Type type, String what)
        {
            final PenmanToken token = next(what);
            if (!token.is(type)) {
                throw unexpected(token, what);
            }
            return token;
        }

        private PenmanToken next(String what)
        {
            final PenmanToken token = peek(what);
            position++;
            return token;
        }

        private PenmanToken peek(String what)
        {
            if (position >= tokens.size()) {
                throw new PenmanDecodeException("Unexpected end of input, expecting " + what, endOffset);
            }
            return tokens.get(position);
        }

        private static PenmanDecodeException unexpected(PenmanToken token, String what)
        {
            return new PenmanDecodeException(
                    "Expecting " + what + ", got " + token.type() + " \"" + token.text() + "\"",
                    token.offset());
        }
    }
}
