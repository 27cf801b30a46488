package com.questrail.penman.codec.impl;

import com.questrail.penman.codec.PenmanEncodeException;
import com.questrail.penman.model.Epidatum;
import com.questrail.penman.model.Graph;
import com.questrail.penman.model.Pop;
import com.questrail.penman.model.Push;
import com.questrail.penman.model.Roles;
import com.questrail.penman.model.Triple;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * PenmanLayout
 * -----------------------------------------------------------------------------
 * Rebuilds a {@link PenmanTree} rooted at the graph's top.
 *
 * <p>Two strategies:</p>
 * <ul>
 *   <li><b>Recorded</b>: when every triple carries epidata, triples are placed
 *       in order on a stack of open nodes. {@link Push} opens the pushed
 *       variable's node under the edge just placed, {@link Pop} closes the
 *       current node. A triple whose target is the current node is written
 *       inverted.</li>
 *   <li><b>Depth-first</b>: otherwise the tree is grown from the top, taking
 *       a node's instance first and then every unplaced triple touching it in
 *       triple order; a node claims all of its triples before any child is
 *       grown. Variables that already have a node are written as
 *       re-entrant references.</li>
 * </ul>
 */
final class PenmanLayout
{
    private PenmanLayout() {}

    static PenmanTree.Node configure(Graph graph)
    {
        final String top = graph.top()
                .orElseThrow(() -> new PenmanEncodeException("Graph has no top"));

        final Map<String, String> concepts = concepts(graph);
        if (!concepts.containsKey(top)) {
            throw new PenmanEncodeException("Top is not a declared variable: " + top);
        }

        return graph.hasCompleteLayout()
                ? recorded(graph, top)
                : depthFirst(graph, top, concepts);
    }

    private static Map<String, String> concepts(Graph graph)
    {
        final Map<String, String> concepts = new LinkedHashMap<>();
        for (Triple t : graph.instances()) {
            if (concepts.putIfAbsent(t.source(), t.target()) != null) {
                throw new PenmanEncodeException("Variable declared more than once: " + t.source());
            }
        }
        return concepts;
    }

    // ------------------------------------------------------------------------
    // Recorded layout
    // ------------------------------------------------------------------------

    private static PenmanTree.Node recorded(Graph graph, String top)
    {
        final PenmanTree.Node root = new PenmanTree.Node(top);
        final Deque<PenmanTree.Node> open = new ArrayDeque<>();
        open.push(root);

        for (Triple triple : graph.triples()) {
            final PenmanTree.Node current = open.peek();
            if (current == null) {
                throw new PenmanEncodeException("Triple follows the closed top node: " + triple);
            }

            PenmanTree.Edge edge = null;
            if (triple.isInstance()) {
                if (!triple.source().equals(current.variable) || current.concept != null) {
                    throw new PenmanEncodeException("Cannot place " + triple + " under " + current.variable);
                }
                current.concept = triple.target();
            }
            else if (triple.source().equals(current.variable)) {
                edge = new PenmanTree.Edge(triple.role(), triple.target());
                current.edges.add(edge);
            }
            else if (triple.target().equals(current.variable)) {
                edge = new PenmanTree.Edge(Roles.invert(triple.role()), triple.source());
                current.edges.add(edge);
            }
            else {
                throw new PenmanEncodeException("Cannot place " + triple + " under " + current.variable);
            }

            for (Epidatum directive : graph.epidata(triple)) {
                if (directive instanceof Push push) {
                    if (edge == null || !edge.atom.equals(push.variable())) {
                        throw new PenmanEncodeException("Push of " + push.variable() + " does not match " + triple);
                    }
                    edge.nested = new PenmanTree.Node(push.variable());
                    open.push(edge.nested);
                }
                else if (directive instanceof Pop) {
                    open.poll();
                }
            }
        }

        requireConcepts(root);
        return root;
    }

    private static void requireConcepts(PenmanTree.Node node)
    {
        if (node.concept == null) {
            throw new PenmanEncodeException("Node has no concept: " + node.variable);
        }
        for (PenmanTree.Edge edge : node.edges) {
            if (edge.isNested()) {
                requireConcepts(edge.nested);
            }
        }
    }

    // ------------------------------------------------------------------------
    // Depth-first layout
    // ------------------------------------------------------------------------

    private static PenmanTree.Node depthFirst(Graph graph, String top, Map<String, String> concepts)
    {
        final List<Triple> triples = graph.triples();
        final boolean[] placed = new boolean[triples.size()];
        final Set<String> opened = new HashSet<>();

        for (int i = 0; i < triples.size(); i++) {
            placed[i] = triples.get(i).isInstance();
        }

        final PenmanTree.Node root = grow(top, triples, placed, opened, concepts);

        for (int i = 0; i < triples.size(); i++) {
            if (!placed[i]) {
                throw new PenmanEncodeException("Triple is not reachable from top: " + triples.get(i));
            }
        }
        for (String variable : concepts.keySet()) {
            if (!opened.contains(variable)) {
                throw new PenmanEncodeException("Variable is not reachable from top: " + variable);
            }
        }
        return root;
    }

    private static PenmanTree.Node grow(String variable,
                                        List<Triple> triples,
                                        boolean[] placed,
                                        Set<String> opened,
                                        Map<String, String> concepts)
    {
        final PenmanTree.Node node = new PenmanTree.Node(variable, concepts.get(variable));
        opened.add(variable);

        // Claim every triple touching this node before descending, so a
        // parent's later edge is not taken over by its child.
        final List<PenmanTree.Edge> claimed = new ArrayList<>();
        for (int i = 0; i < triples.size(); i++) {
            if (placed[i]) {
                continue;
            }
            final Triple t = triples.get(i);
            if (t.source().equals(variable)) {
                claimed.add(new PenmanTree.Edge(t.role(), t.target()));
            }
            else if (t.target().equals(variable) && concepts.containsKey(t.source())) {
                claimed.add(new PenmanTree.Edge(Roles.invert(t.role()), t.source()));
            }
            else {
                continue;
            }
            placed[i] = true;
        }

        for (PenmanTree.Edge edge : claimed) {
            final String other = edge.atom;
            if (concepts.containsKey(other) && !opened.contains(other)) {
                node.edges.add(new PenmanTree.Edge(edge.role, grow(other, triples, placed, opened, concepts)));
            } else {
                node.edges.add(edge);
            }
        }
        return node;
    }
}
