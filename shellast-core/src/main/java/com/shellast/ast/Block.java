package com.shellast.ast;

import java.util.List;

/**
 * A brace group, {@code { stmts; }}. Its position is the closing brace.
 */
public record Block(
    Pos lbrace,
    Pos rbrace,
    List<Stmt> stmts
) implements Command {

    public Block {
        if (lbrace == null) {
            lbrace = Pos.UNKNOWN;
        }
        if (rbrace == null) {
            rbrace = Pos.UNKNOWN;
        }
        stmts = Printer.listOf(stmts);
    }

    public Block(List<Stmt> stmts) {
        this(Pos.UNKNOWN, Pos.UNKNOWN, stmts);
    }

    @Override
    public Pos pos() {
        return rbrace;
    }

    @Override
    public String render() {
        return "{" + Printer.stmtList(stmts) + "}";
    }

    @Override
    public String type() {
        return "Block";
    }
}
