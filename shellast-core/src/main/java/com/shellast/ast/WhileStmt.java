package com.shellast.ast;

import java.util.List;

public record WhileStmt(
    Pos whilePos,
    Pos donePos,
    List<Stmt> conds,
    List<Stmt> doStmts
) implements Command {

    public WhileStmt {
        if (whilePos == null) {
            whilePos = Pos.UNKNOWN;
        }
        if (donePos == null) {
            donePos = Pos.UNKNOWN;
        }
        conds = Printer.listOf(conds);
        doStmts = Printer.listOf(doStmts);
    }

    public WhileStmt(List<Stmt> conds, List<Stmt> doStmts) {
        this(Pos.UNKNOWN, Pos.UNKNOWN, conds, doStmts);
    }

    @Override
    public Pos pos() {
        return whilePos;
    }

    @Override
    public String render() {
        return Token.WHILE.text() + Printer.stmtList(conds)
            + Token.DO.text() + Printer.stmtList(doStmts)
            + Token.DONE.text();
    }

    @Override
    public String type() {
        return "WhileStmt";
    }
}
