package com.questrail.penman.codec.impl;

import com.questrail.penman.codec.PenmanDecodeException;

import java.util.ArrayList;
import java.util.List;

/**
 * PenmanLexer
 * -----------------------------------------------------------------------------
 * Splits Penman text into {@link PenmanToken}s.
 *
 * <ul>
 *   <li>{@code (}, {@code )} and {@code /} are single-character tokens</li>
 *   <li>A role is {@code :} followed by non-delimiter characters</li>
 *   <li>A string is a double-quoted literal; a backslash escapes the next
 *       character, so {@code \"} does not terminate it. The token text keeps
 *       the quotes and the escapes verbatim.</li>
 *   <li>{@code <pointer:N>} is read as one symbol even though it contains
 *       {@code :}</li>
 *   <li>Anything else up to the next delimiter is a symbol</li>
 * </ul>
 */
final class PenmanLexer
{
    static final String POINTER_PREFIX = "<pointer:";

    private PenmanLexer() {}

    static List<PenmanToken> tokenize(String text, int from)
    {
        List<PenmanToken> tokens = new ArrayList<>();
        final int length = text.length();
        int i = from;

        while (i < length) {
            final char c = text.charAt(i);

            if (Character.isWhitespace(c)) {
                i++;
            }
            else if (c == '(') {
                tokens.add(new PenmanToken(PenmanToken.Type.LPAREN, "(", i++));
            }
            else if (c == ')') {
                tokens.add(new PenmanToken(PenmanToken.Type.RPAREN, ")", i++));
            }
            else if (c == '/') {
                tokens.add(new PenmanToken(PenmanToken.Type.SLASH, "/", i++));
            }
            else if (c == '"') {
                final int end = endOfString(text, i);
                tokens.add(new PenmanToken(PenmanToken.Type.STRING, text.substring(i, end), i));
                i = end;
            }
            else if (c == ':') {
                final int end = endOfSymbol(text, i + 1);
                tokens.add(new PenmanToken(PenmanToken.Type.ROLE, text.substring(i, end), i));
                i = end;
            }
            else if (text.startsWith(POINTER_PREFIX, i)) {
                final int end = endOfPointer(text, i);
                tokens.add(new PenmanToken(PenmanToken.Type.SYMBOL, text.substring(i, end), i));
                i = end;
            }
            else {
                final int end = endOfSymbol(text, i);
                tokens.add(new PenmanToken(PenmanToken.Type.SYMBOL, text.substring(i, end), i));
                i = end;
            }
        }
        return tokens;
    }

    /**
     * Returns the index just past the closing quote of the string starting at {@code start}.
     */
    private static int endOfString(String text, int start)
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
        throw new PenmanDecodeException("Unterminated string literal", start);
    }

    private static int endOfPointer(String text, int start)
    {
        int i = start + POINTER_PREFIX.length();
        final int digitsStart = i;
        while (i < text.length() && Character.isDigit(text.charAt(i))) {
            i++;
        }
        if (i == digitsStart || i >= text.length() || text.charAt(i) != '>') {
            throw new PenmanDecodeException("Malformed pointer token", start);
        }
        return i + 1;
    }

    private static int endOfSymbol(String text, int start)
    {
        int i = start;
        while (i < text.length() && !isDelimiter(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static boolean isDelimiter(char c)
    {
        return Character.isWhitespace(c)
                || c == '(' || c == ')' || c == '/' || c == ':' || c == '"';
    }
}
