package com.shellast.ast;

/**
 * Thrown when a tree is rendered while a required child is missing.
 * Building well-formed trees is the caller's job; rendering refuses to
 * guess at text for a hole in the tree.
 */
public class MalformedTreeException extends IllegalStateException {

    private final String nodeType;
    private final String field;

    public MalformedTreeException(String nodeType, String field) {
        super(nodeType + "." + field + " is required but missing");
        this.nodeType = nodeType;
        this.field = field;
    }

    public String getNodeType() {
        return nodeType;
    }

    public String getField() {
        return field;
    }
}
