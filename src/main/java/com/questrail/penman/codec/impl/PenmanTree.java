package com.questrail.penman.codec.impl;

import java.util.ArrayList;
import java.util.List;

/**
 * Intermediate node tree shared by the decoder (text to tree to triples) and
 * the encoder (triples to tree to text).
 */
final class PenmanTree
{
    private PenmanTree() {}

    static final class Node
    {
        final String variable;
        String concept;
        final List<Edge> edges = new ArrayList<>();

        Node(String variable) {
            this.variable = variable;
        }

        Node(String variable, String concept) {
            this.variable = variable;
            this.concept = concept;
        }
    }

    /**
     * An edge to either an atom (variable reference, constant, literal) or a nested node.
     */
    static final class Edge
    {
        final String role;
        final String atom;
        Node nested;

        Edge(String role, String atom) {
            this.role = role;
            this.atom = atom;
        }

        Edge(String role, Node nested) {
            this.role = role;
            this.atom = nested.variable;
            this.nested = nested;
        }

        boolean isNested() {
            return nested != null;
        }
    }
}
