package com.questrail.penman.internal.decode;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Variable naming state of a single decode.
 *
 * <p>Maps each pointer token to a short variable name made of the first
 * letter of its node's concept (lower-cased, {@code x} when the concept does
 * not start with a letter) and a running counter per letter:
 * {@code go-01 -> g1}, {@code girl -> g2}, {@code 1st -> x1}. A name in
 * the reserved set is skipped and the counter moves on.</p>
 */
final class VariableNamer
{
    private final Map<String, String> variableByPointer = new HashMap<>();
    private final Map<Character, Integer> counters = new HashMap<>();
    private final Set<String> reserved;

    VariableNamer(Set<String> reserved)
    {
        this.reserved = Objects.requireNonNull(reserved, "reserved");
    }

    /**
     * Names the node declared by {@code pointer}; a pointer declared again
     * keeps its first name.
     */
    String declare(String pointer, String concept)
    {
        return variableByPointer.computeIfAbsent(pointer, p -> nextName(concept));
    }

    Optional<String> resolve(String pointer)
    {
        return Optional.ofNullable(variableByPointer.get(pointer));
    }

    private String nextName(String concept)
    {
        final char first = concept.charAt(0);
        final char prefix = Character.isLetter(first) ? Character.toLowerCase(first) : 'x';
        String name;
        do {
            name = prefix + Integer.toString(counters.merge(prefix, 1, Integer::sum));
        } while (reserved.contains(name));
        return name;
    }
}
