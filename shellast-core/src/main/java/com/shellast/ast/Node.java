package com.shellast.ast;

/**
 * Base interface for all shell AST nodes.
 *
 * <p>{@link #render()} produces shell source and is kept apart from
 * {@code toString()}, which stays the record's debug representation.</p>
 */
public sealed interface Node permits
    File,
    Stmt,
    Assign,
    Redirect,
    Word,
    Elif,
    PatternList,
    Command,
    WordPart {

    String type();

    Pos pos();

    String render();
}
