package com.questrail.penman.codec.impl;

import com.questrail.penman.codec.PenmanEncoder;
import com.questrail.penman.codec.PenmanFormat;
import com.questrail.penman.model.Graph;

import java.util.Map;
import java.util.Objects;

/**
 * DefaultPenmanEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link PenmanEncoder}.
 *
 * <p>This is the mechanical inverse of {@link DefaultPenmanDecoder}: the tree
 * comes from {@link PenmanLayout}, and this class only decides where line
 * breaks and indentation go.</p>
 *
 * <pre>
 *   singleLine : (a / go-01 :ARG0 (p / person))
 *   adaptive   : (a / go-01
 *                   :ARG0 (p / person))
 * </pre>
 */
public final class DefaultPenmanEncoder implements PenmanEncoder
{
    @Override
    public String encode(Graph graph, PenmanFormat format)
    {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(format, "format");

        final StringBuilder out = new StringBuilder();
        if (format.includeMetadata()) {
            for (Map.Entry<String, String> entry : graph.metadata().entrySet()) {
                out.append("# ::").append(entry.getKey());
                if (!entry.getValue().isEmpty()) {
                    out.append(' ').append(entry.getValue());
                }
                out.append('\n');
            }
        }

        if (graph.isEmpty()) {
            return out.append("()").toString();
        }

        final PenmanTree.Node root = PenmanLayout.configure(graph);
        appendNode(out, root, format, 0);
        return out.toString();
    }

    private static void appendNode(StringBuilder out, PenmanTree.Node node, PenmanFormat format, int column)
    {
        final String joiner;
        if (format.isSingleLine()) {
            joiner = " ";
        }
        else {
            column += (format.indent() == PenmanFormat.ADAPTIVE)
                    ? node.variable.length() + 2
                    : format.indent();
            joiner = "\n" + " ".repeat(column);
        }

        out.append('(').append(node.variable).append(" / ").append(node.concept);

        for (PenmanTree.Edge edge : node.edges) {
            out.append(joiner).append(edge.role).append(' ');
            if (edge.isNested()) {
                final int nestedColumn = (format.indent() == PenmanFormat.ADAPTIVE)
                        ? column + edge.role.length() + 1
                        : column;
                appendNode(out, edge.nested, format, nestedColumn);
            } else {
                out.append(edge.atom);
            }
        }
        out.append(')');
    }
}
