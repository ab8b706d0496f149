package com.shellast.json;

import com.shellast.ast.Node;

/**
 * Writes shell trees as JSON, one object per node tagged with its
 * {@link Node#type()}, so that another process can store or diff them.
 */
public interface AstJsonSerializer {

    /**
     * Writes {@code node} and its subtree on a single line.
     *
     * @throws AstJsonException if the tree cannot be written
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Same tree as {@link #serialize(Node)}, indented for reading.
     */
    String serializePretty(Node node) throws AstJsonException;
}
