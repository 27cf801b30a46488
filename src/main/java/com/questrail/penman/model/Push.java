package com.questrail.penman.model;

import java.util.Objects;

/**
 * The triple carrying this directive descends into the node of {@code variable}.
 */
public record Push(String variable) implements Epidatum {
    public Push {
        Objects.requireNonNull(variable, "variable");
    }
}
