package com.questrail.penman.model;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Size measures used when filtering or bucketing graphs and their sentences.
 */
public final class GraphMetrics
{
    private GraphMetrics() {}

    /**
     * Counts the distinct nodes of a graph: the top plus every source and
     * target of a non-instance triple. Constants count as nodes.
     */
    public static int countNodes(Graph graph) {
        Objects.requireNonNull(graph, "graph");

        Set<String> nodes = new HashSet<>();
        graph.top().ifPresent(nodes::add);
        for (Triple t : graph.triples()) {
            if (t.isInstance()) {
                continue;
            }
            nodes.add(t.source());
            nodes.add(t.target());
        }
        return nodes.size();
    }

    /**
     * Counts the runs of letters or digits in {@code text}.
     */
    public static int countTokens(String text) {
        Objects.requireNonNull(text, "text");

        int count = 0;
        boolean inToken = false;
        for (int i = 0; i < text.length(); i++) {
            boolean alnum = Character.isLetterOrDigit(text.charAt(i));
            if (alnum && !inToken) {
                count++;
            }
            inToken = alnum;
        }
        return count;
    }
}
