package com.questrail.penman.internal.rename;

import com.questrail.penman.model.Epidatum;
import com.questrail.penman.model.Graph;
import com.questrail.penman.model.Push;
import com.questrail.penman.model.Triple;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * VariableRenamer
 * ============================================================================
 * Rewrites every reference to a variable consistently.
 *
 * <p>Given a predicate selecting the tokens to rename and a renaming function,
 * {@link #rename(Graph, Predicate, UnaryOperator)} produces a new graph in
 * which:</p>
 * <ul>
 *   <li>each triple's source and target are rewritten independently, so a
 *       self-loop {@code (x, :r, x)} is rewritten on both ends</li>
 *   <li>{@code top} is rewritten</li>
 *   <li>every {@link Push} directive's variable is rewritten; other epidata
 *       is carried over untouched</li>
 *   <li>metadata is carried over untouched</li>
 * </ul>
 *
 * <p>The input graph is never modified. The renaming function must be
 * deterministic; it is applied per occurrence.</p>
 */
public final class VariableRenamer
{
    private VariableRenamer() {}

    public static Graph rename(Graph graph,
                               Predicate<String> isVariable,
                               UnaryOperator<String> renameFn) {

        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(isVariable, "isVariable");
        Objects.requireNonNull(renameFn, "renameFn");

        final List<Triple> triples = new ArrayList<>(graph.triples().size());
        final Map<Triple, List<Epidatum>> epidata = new LinkedHashMap<>();

        for (Triple triple : graph.triples()) {
            String source = triple.source();
            String target = triple.target();
            if (isVariable.test(source)) {
                source = renameFn.apply(source);
            }
            if (isVariable.test(target)) {
                target = renameFn.apply(target);
            }
            final Triple renamed = new Triple(source, triple.role(), target);
            triples.add(renamed);

            if (graph.epidata().containsKey(triple)) {
                final List<Epidatum> directives = new ArrayList<>();
                for (Epidatum directive : graph.epidata(triple)) {
                    if (directive instanceof Push push && isVariable.test(push.variable())) {
                        directives.add(new Push(renameFn.apply(push.variable())));
                    } else {
                        directives.add(directive);
                    }
                }
                epidata.put(renamed, directives);
            }
        }

        String top = graph.top().orElse(null);
        if (top != null && isVariable.test(top)) {
            top = renameFn.apply(top);
        }

        return new Graph(triples, top, epidata, graph.metadata());
    }

    /**
     * Renames through a fixed mapping; tokens outside the mapping are kept.
     */
    public static Graph rename(Graph graph, Map<String, String> mapping) {
        Objects.requireNonNull(mapping, "mapping");
        return rename(graph, mapping::containsKey, mapping::get);
    }
}
