package com.shellast.ast;

import java.util.List;

/**
 * A shell program. {@code name} identifies the source (usually a file name)
 * for diagnostics and plays no part in rendering.
 */
public record File(
    String name,
    List<Stmt> stmts
) implements Node {

    public File {
        stmts = Printer.listOf(stmts);
    }

    public File(List<Stmt> stmts) {
        this("", stmts);
    }

    @Override
    public Pos pos() {
        return Pos.firstOf(stmts);
    }

    @Override
    public String render() {
        return Printer.stmtJoin(stmts, true);
    }

    @Override
    public String type() {
        return "File";
    }
}
