package com.questrail.penman.model;

/**
 * Layout directive attached to a {@link Triple}.
 *
 * <p>Epidata never affects graph identity. It only records where, in the
 * text a graph was read from, a nested node was opened ({@link Push}) and
 * closed ({@link Pop}), so the encoder can reproduce the same nesting.</p>
 */
public sealed interface Epidatum permits Push, Pop {
}
