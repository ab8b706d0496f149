package com.shellast.json;

import com.shellast.ast.File;
import com.shellast.ast.Node;

/**
 * Interface for reading shell AST nodes back from JSON, typically trees
 * produced by an external parser.
 */
public interface AstJsonDeserializer {

    /**
     * Reads a whole script. Missing positions come back as {@link com.shellast.ast.Pos#UNKNOWN}
     * and missing lists as empty ones; missing required children are only
     * reported once the tree is rendered.
     *
     * @throws AstJsonException if the text is not JSON or names an unknown node type
     */
    File deserializeFile(String json) throws AstJsonException;

    /**
     * Reads a subtree, e.g. a single {@code Stmt} or {@code Word}.
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException;
}
