package com.shellast.ast;

import java.util.List;

public record UntilStmt(
    Pos untilPos,
    Pos donePos,
    List<Stmt> conds,
    List<Stmt> doStmts
) implements Command {

    public UntilStmt {
        if (untilPos == null) {
            untilPos = Pos.UNKNOWN;
        }
        if (donePos == null) {
            donePos = Pos.UNKNOWN;
        }
        conds = Printer.listOf(conds);
        doStmts = Printer.listOf(doStmts);
    }

    public UntilStmt(List<Stmt> conds, List<Stmt> doStmts) {
        this(Pos.UNKNOWN, Pos.UNKNOWN, conds, doStmts);
    }

    @Override
    public Pos pos() {
        return untilPos;
    }

    @Override
    public String render() {
        return Token.UNTIL.text() + Printer.stmtList(conds)
            + Token.DO.text() + Printer.stmtList(doStmts)
            + Token.DONE.text();
    }

    @Override
    public String type() {
        return "UntilStmt";
    }
}
