package com.questrail.penman.model;

import java.util.Objects;

/**
 * A single {@code (source, role, target)} assertion of a Penman graph.
 *
 * <p>{@code source} is always a node variable. {@code role} is either
 * {@link Roles#INSTANCE} (binding the variable to a concept) or a relation
 * label starting with {@code ':'}. {@code target} is a variable, a constant
 * atom, or a quoted string literal kept verbatim with its quotes.</p>
 */
public record Triple(
        String source,
        String role,
        String target
) {
    public Triple {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(target, "target");
    }

    public static Triple instance(String variable, String concept) {
        return new Triple(variable, Roles.INSTANCE, concept);
    }

    /**
     * Returns true if this triple binds its source to a concept.
     */
    public boolean isInstance() {
        return Roles.INSTANCE.equals(role);
    }

    @Override
    public String toString() {
        return "(" + source + ", " + role + ", " + target + ")";
    }
}
