package com.shellast.ast;

import java.util.List;

public record Subshell(
    Pos lparen,
    Pos rparen,
    List<Stmt> stmts
) implements Command {

    public Subshell {
        if (lparen == null) {
            lparen = Pos.UNKNOWN;
        }
        if (rparen == null) {
            rparen = Pos.UNKNOWN;
        }
        stmts = Printer.listOf(stmts);
    }

    public Subshell(List<Stmt> stmts) {
        this(Pos.UNKNOWN, Pos.UNKNOWN, stmts);
    }

    @Override
    public Pos pos() {
        return lparen;
    }

    @Override
    public String render() {
        if (stmts.isEmpty()) {
            // "()" would read back as an empty arithmetic-style pair
            return "( )";
        }
        return "(" + Printer.stmtJoin(stmts) + ")";
    }

    @Override
    public String type() {
        return "Subshell";
    }
}
