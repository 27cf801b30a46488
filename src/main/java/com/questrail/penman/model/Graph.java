package com.questrail.penman.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Graph
 * -----------------------------------------------------------------------------
 * Immutable value representing a rooted, labeled, directed meaning graph.
 *
 * <h2>Two cooperating structures</h2>
 * <ul>
 *   <li>A collection of unique {@link Triple}s. For identity the collection is
 *       a set: {@link #equals(Object)} ignores triple order.</li>
 *   <li>An ordered view of the same triples plus per-triple {@link Epidatum}
 *       lists. The order and the directives are what the encoder uses to
 *       reproduce the textual nesting the graph was read from.</li>
 * </ul>
 *
 * <p>{@code metadata} is carried through unchanged and never interpreted.</p>
 *
 * <h2>Invariants</h2>
 * <p>The constructor does not reject a graph that violates the model
 * invariants (undeclared variables, duplicate declarations, undeclared top).
 * Those are reported by {@link #invariantViolations()} and surfaced as
 * failures by the parsers and the serializer that consume the graph.</p>
 *
 * <p>Callers wanting a modified graph build a new value from an edited triple
 * list and carry {@code top}, epidata and metadata over explicitly.</p>
 */
public final class Graph
{
    private final List<Triple> triples;
    private final Set<Triple> tripleSet;
    private final String top;
    private final Map<Triple, List<Epidatum>> epidata;
    private final Map<String, String> metadata;

    public Graph(List<Triple> triples,
                 String top,
                 Map<Triple, List<Epidatum>> epidata,
                 Map<String, String> metadata) {

        Objects.requireNonNull(triples, "triples");

        // Duplicates collapse onto their first occurrence.
        LinkedHashSet<Triple> unique = new LinkedHashSet<>(triples);
        this.triples = List.copyOf(unique);
        this.tripleSet = Collections.unmodifiableSet(unique);
        this.top = top;

        Map<Triple, List<Epidatum>> layout = new LinkedHashMap<>();
        if (epidata != null) {
            for (Triple triple : this.triples) {
                List<Epidatum> directives = epidata.get(triple);
                if (directives != null) {
                    layout.put(triple, List.copyOf(directives));
                }
            }
        }
        this.epidata = Collections.unmodifiableMap(layout);

        this.metadata = (metadata == null)
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public Graph(List<Triple> triples, String top) {
        this(triples, top, Map.of(), Map.of());
    }

    /**
     * Returns the empty graph: no triples and no top.
     */
    public static Graph empty() {
        return new Graph(List.of(), null);
    }

    /**
     * Triples in serialization order.
     */
    public List<Triple> triples() {
        return triples;
    }

    public Optional<String> top() {
        return Optional.ofNullable(top);
    }

    public Map<Triple, List<Epidatum>> epidata() {
        return epidata;
    }

    /**
     * Layout directives of {@code triple}, empty if none were recorded.
     */
    public List<Epidatum> epidata(Triple triple) {
        return epidata.getOrDefault(triple, List.of());
    }

    /**
     * Returns true if every triple carries a recorded epidata entry.
     */
    public boolean hasCompleteLayout() {
        return !triples.isEmpty() && epidata.keySet().containsAll(triples);
    }

    public Map<String, String> metadata() {
        return metadata;
    }

    public boolean isEmpty() {
        return triples.isEmpty();
    }

    public boolean contains(Triple triple) {
        return tripleSet.contains(triple);
    }

    public List<Triple> instances() {
        List<Triple> out = new ArrayList<>();
        for (Triple t : triples) {
            if (t.isInstance()) {
                out.add(t);
            }
        }
        return out;
    }

    /**
     * Non-instance triples whose target is a declared variable.
     */
    public List<Triple> edges() {
        Set<String> variables = variableSet();
        List<Triple> out = new ArrayList<>();
        for (Triple t : triples) {
            if (!t.isInstance() && variables.contains(t.target())) {
                out.add(t);
            }
        }
        return out;
    }

    /**
     * Non-instance triples whose target is a constant or a literal.
     */
    public List<Triple> attributes() {
        Set<String> variables = variableSet();
        List<Triple> out = new ArrayList<>();
        for (Triple t : triples) {
            if (!t.isInstance() && !variables.contains(t.target())) {
                out.add(t);
            }
        }
        return out;
    }

    /**
     * Declared variables in the order their instance triples appear.
     */
    public List<String> variables() {
        return List.copyOf(variableSet());
    }

    /**
     * Returns the concept bound to {@code variable}, if it is declared.
     */
    public Optional<String> conceptOf(String variable) {
        for (Triple t : triples) {
            if (t.isInstance() && t.source().equals(variable)) {
                return Optional.of(t.target());
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the model invariants this graph violates, empty if none.
     */
    public List<String> invariantViolations() {
        List<String> violations = new ArrayList<>();
        Set<String> declared = new HashSet<>();

        for (Triple t : triples) {
            if (t.isInstance() && !declared.add(t.source())) {
                violations.add("variable declared more than once: " + t.source());
            }
        }
        Set<String> reported = new HashSet<>();
        for (Triple t : triples) {
            if (!declared.contains(t.source()) && reported.add(t.source())) {
                violations.add("source is not a declared variable: " + t.source());
            }
        }
        if (!triples.isEmpty()) {
            if (top == null) {
                violations.add("graph has triples but no top");
            }
            else if (!declared.contains(top)) {
                violations.add("top is not a declared variable: " + top);
            }
        }
        return violations;
    }

    /**
     * Same triples, top and epidata with an empty metadata map.
     */
    public Graph withoutMetadata() {
        return new Graph(triples, top, epidata, Map.of());
    }

    public Graph withMetadata(Map<String, String> metadata) {
        return new Graph(triples, top, epidata, metadata);
    }

    private Set<String> variableSet() {
        Set<String> variables = new LinkedHashSet<>();
        for (Triple t : triples) {
            if (t.isInstance()) {
                variables.add(t.source());
            }
        }
        return variables;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Graph that)) return false;
        return tripleSet.equals(that.tripleSet) && Objects.equals(top, that.top);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tripleSet, top);
    }

    @Override
    public String toString() {
        return "Graph[" +
                "top=" + top +
                ", triples=" + triples +
                (metadata.isEmpty() ? "" : ", metadata=" + metadata) +
                ']';
    }
}
