package com.shellast.ast;

import java.util.List;

/**
 * A location in the original shell source. Lines and columns are 1-based;
 * {@link #UNKNOWN} stands for "no source location".
 */
public record Pos(int line, int column) {

    /**
     * Position of nodes that were not produced from source text, such as a
     * {@link Word} with no parts.
     */
    public static final Pos UNKNOWN = new Pos(0, 0);

    public boolean isKnown() {
        return line > 0;
    }

    /**
     * Returns the position of the first node, or {@link #UNKNOWN} for an empty list.
     *
     * @throws MalformedTreeException if the first element is missing
     */
    public static Pos firstOf(List<? extends Node> nodes) {
        if (nodes == null || nodes.isEmpty()) {
            return UNKNOWN;
        }
        return Printer.required(nodes.get(0), "Node", "element").pos();
    }

    @Override
    public String toString() {
        return isKnown() ? line + ":" + column : "?";
    }
}
