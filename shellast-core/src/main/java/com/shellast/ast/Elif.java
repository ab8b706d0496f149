package com.shellast.ast;

import java.util.List;

public record Elif(
    Pos elifPos,
    List<Stmt> conds,
    List<Stmt> thenStmts
) implements Node {

    public Elif {
        if (elifPos == null) {
            elifPos = Pos.UNKNOWN;
        }
        conds = Printer.listOf(conds);
        thenStmts = Printer.listOf(thenStmts);
    }

    public Elif(List<Stmt> conds, List<Stmt> thenStmts) {
        this(Pos.UNKNOWN, conds, thenStmts);
    }

    @Override
    public Pos pos() {
        return elifPos;
    }

    @Override
    public String render() {
        return Token.ELIF.text() + Printer.stmtList(conds)
            + Token.THEN.text() + Printer.stmtList(thenStmts);
    }

    @Override
    public String type() {
        return "Elif";
    }
}
