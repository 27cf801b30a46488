package com.questrail.penman.internal.pointer;

import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shape rules for pointer tokens, node names and z-prefix variables.
 */
public final class PointerTokens
{
    public static final String PREFIX = "<pointer:";
    public static final String SUFFIX = ">";

    private static final Pattern POINTER = Pattern.compile("<pointer:(\\d+)>");
    private static final Pattern NODE_NAME = Pattern.compile("[a-z]{1,3}[0-9]*");

    private PointerTokens() {}

    public static String pointer(int id) {
        if (id < 0) {
            throw new IllegalArgumentException("pointer id must be non-negative (was " + id + ")");
        }
        return PREFIX + id + SUFFIX;
    }

    public static boolean isPointer(String token) {
        return POINTER.matcher(token).matches();
    }

    /**
     * Returns the id of a whole {@code <pointer:N>} token.
     */
    public static OptionalInt pointerId(String token) {
        final Matcher m = POINTER.matcher(token);
        if (!m.matches()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(m.group(1)));
        }
        catch (NumberFormatException e) {
            // More digits than an int holds.
            return OptionalInt.empty();
        }
    }

    /**
     * One to three lowercase letters, optionally followed by digits.
     */
    public static boolean isNodeName(CharSequence token) {
        return NODE_NAME.matcher(token).matches();
    }

    /**
     * {@code z} followed by at least one digit, e.g. {@code z3}.
     */
    public static boolean isZPrefixVariable(String variable) {
        if (variable.length() <= 1 || variable.charAt(0) != 'z') {
            return false;
        }
        for (int i = 1; i < variable.length(); i++) {
            final char c = variable.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    /**
     * {@code z3} becomes {@code <pointer:3>}; the digits are kept as written.
     */
    public static String zPrefixToPointer(String variable) {
        if (!isZPrefixVariable(variable)) {
            throw new IllegalArgumentException("not a z-prefix variable: " + variable);
        }
        return PREFIX + variable.substring(1) + SUFFIX;
    }
}
