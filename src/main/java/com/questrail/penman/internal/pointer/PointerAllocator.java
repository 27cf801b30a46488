package com.questrail.penman.internal.pointer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Pointer id allocation state of a single conversion.
 *
 * <p>One instance is created per call and discarded with it; ids start at
 * zero every time and carry no meaning across calls.</p>
 *
 * <h2>Declarations and references</h2>
 * <ul>
 *   <li>The first occurrence of a name allocates the next id, whether it is a
 *       declaration or a bare reference.</li>
 *   <li>A reference to a name not yet declared is remembered as unresolved.</li>
 *   <li>Declaring a name that is unresolved resolves it to the id allocated
 *       by the reference. Declaring a name that is already declared is a
 *       duplicate.</li>
 * </ul>
 */
final class PointerAllocator
{
    private final Map<String, String> pointerByName = new LinkedHashMap<>();
    private final Set<String> unresolved = new LinkedHashSet<>();
    private int nextId;

    /**
     * @return the pointer for {@code name}, or {@code null} if {@code name}
     *         was already declared
     */
    String declare(String name)
    {
        final String existing = pointerByName.get(name);
        if (existing == null) {
            return allocate(name);
        }
        return unresolved.remove(name) ? existing : null;
    }

    String reference(String name)
    {
        final String existing = pointerByName.get(name);
        if (existing != null) {
            return existing;
        }
        unresolved.add(name);
        return allocate(name);
    }

    Set<String> unresolved()
    {
        return Collections.unmodifiableSet(unresolved);
    }

    Map<String, String> pointerByName()
    {
        return Collections.unmodifiableMap(pointerByName);
    }

    private String allocate(String name)
    {
        final String pointer = PointerTokens.pointer(nextId++);
        pointerByName.put(name, pointer);
        return pointer;
    }
}
