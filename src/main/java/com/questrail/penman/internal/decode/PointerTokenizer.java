package com.questrail.penman.internal.decode;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits pointer text on whitespace.
 *
 * <p>Parentheses are always tokens of their own. A double-quoted literal is
 * one token, quotes included, even when it contains whitespace, parentheses
 * or backslash-escaped quotes.</p>
 */
final class PointerTokenizer
{
    private PointerTokenizer() {}

    static List<String> tokenize(String text)
    {
        final List<String> tokens = new ArrayList<>();
        final StringBuilder current = new StringBuilder();

        int i = 0;
        while (i < text.length()) {
            final char c = text.charAt(i);

            if (Character.isWhitespace(c) || c == '(' || c == ')') {
                flush(current, tokens);
                if (c != '(' && c != ')') {
                    i++;
                    continue;
                }
                tokens.add(String.valueOf(c));
                i++;
            }
            else if (c == '"') {
                flush(current, tokens);
                final int end = endOfLiteral(text, i);
                tokens.add(text.substring(i, end));
                i = end;
            }
            else {
                current.append(c);
                i++;
            }
        }
        flush(current, tokens);
        return tokens;
    }

    private static int endOfLiteral(String text, int start)
    {
        boolean escaped = false;
        for (int i = start + 1; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (escaped) {
                escaped = false;
            }
            else if (c == '\\') {
                escaped = true;
            }
            else if (c == '"') {
                return i + 1;
            }
        }
        throw new PointerSyntaxException("Unterminated literal starting at offset " + start);
    }

    private static void flush(StringBuilder current, List<String> tokens)
    {
        if (current.length() > 0) {
            tokens.add(current.toString());
            current.setLength(0);
        }
    }
}
