package com.questrail.penman.internal.decode;

/**
 * Pointer text that cannot be walked as a bracketed node tree.
 *
 * <p>Never escapes {@link RecursivePointerNotationDecoder}; it is converted
 * into a backoff result there.</p>
 */
final class PointerSyntaxException extends RuntimeException
{
    PointerSyntaxException(String message) {
        super(message);
    }
}
