package com.questrail.penman.model;

/**
 * The triple carrying this directive is the last one of the current nested node.
 */
public record Pop() implements Epidatum {
    public static final Pop POP = new Pop();
}
