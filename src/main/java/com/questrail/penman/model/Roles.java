package com.questrail.penman.model;

import java.util.Set;

/**
 * Role label conventions shared by the decoder, the encoder and the layout.
 *
 * <p>A role ending in {@code -of} is an inversion of the role without the
 * suffix: {@code (a :ARG0-of b)} asserts {@code (b :ARG0 a)}. A handful of
 * AMR roles end in {@code -of} without being inversions and are listed in
 * {@link #NON_INVERTING}.</p>
 */
public final class Roles
{
    /** Reserved role binding a variable to its concept. */
    public static final String INSTANCE = ":instance";

    /** Sigil every relation label starts with. */
    public static final char SIGIL = ':';

    private static final String INVERSE_SUFFIX = "-of";

    static final Set<String> NON_INVERTING = Set.of(
            ":consist-of",
            ":prep-on-behalf-of",
            ":prep-out-of"
    );

    private Roles() {}

    public static boolean isInverted(String role) {
        return role.endsWith(INVERSE_SUFFIX)
                && role.length() > INVERSE_SUFFIX.length() + 1
                && !NON_INVERTING.contains(role);
    }

    /**
     * Returns the role that expresses the same relation from the other end.
     */
    public static String invert(String role) {
        if (isInverted(role)) {
            return role.substring(0, role.length() - INVERSE_SUFFIX.length());
        }
        return role + INVERSE_SUFFIX;
    }
}
