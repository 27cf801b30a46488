package com.questrail.penman.internal.encode;

import java.util.Objects;

/**
 * LiteralSafeWhitespace
 * -----------------------------------------------------------------------------
 * Rewrites single-line Penman text into the token spacing of pointer
 * notation:
 *
 * <pre>
 *   (&lt;pointer:0&gt; / go-01 :ARG0 (&lt;pointer:1&gt; / person))
 *   ( &lt;pointer:0&gt; go-01 :ARG0 ( &lt;pointer:1&gt; person ) )
 * </pre>
 *
 * <p>Outside quoted literals: parentheses become stand-alone tokens, a
 * stand-alone {@code /} is dropped, and whitespace runs collapse to one
 * space. Inside a literal every character is copied as written; a
 * backslash escapes the character after it, so {@code \"} does not close
 * the literal.</p>
 */
final class LiteralSafeWhitespace
{
    private LiteralSafeWhitespace() {}

    static String normalize(String text)
    {
        Objects.requireNonNull(text, "text");

        final StringBuilder out = new StringBuilder(text.length() + 16);
        boolean inLiteral = false;
        boolean escaped = false;
        boolean pendingSpace = false;

        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);

            if (inLiteral) {
                out.append(c);
                if (escaped) {
                    escaped = false;
                }
                else if (c == '\\') {
                    escaped = true;
                }
                else if (c == '"') {
                    inLiteral = false;
                }
                continue;
            }

            if (Character.isWhitespace(c) || isSeparatorSlash(text, i)) {
                pendingSpace = true;
                continue;
            }

            switch (c) {
                case '(' -> {
                    separate(out, pendingSpace);
                    out.append('(');
                    pendingSpace = true;
                }
                case ')' -> {
                    separate(out, true);
                    out.append(')');
                    pendingSpace = true;
                }
                default -> {
                    separate(out, pendingSpace);
                    out.append(c);
                    pendingSpace = false;
                    inLiteral = (c == '"');
                }
            }
        }
        return out.toString();
    }

    private static void separate(StringBuilder out, boolean pendingSpace)
    {
        if (pendingSpace && out.length() > 0 && out.charAt(out.length() - 1) != ' ') {
            out.append(' ');
        }
    }

    // The concept separator is a '/' standing between whitespace.
    private static boolean isSeparatorSlash(String text, int i)
    {
        if (text.charAt(i) != '/') {
            return false;
        }
        final boolean spaceBefore = i == 0 || Character.isWhitespace(text.charAt(i - 1));
        final boolean spaceAfter = i + 1 == text.length() || Character.isWhitespace(text.charAt(i + 1));
        return spaceBefore && spaceAfter;
    }
}
