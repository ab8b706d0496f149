package com.shellast.ast;

import java.util.List;

public record IfStmt(
    Pos ifPos,
    Pos fiPos,
    List<Stmt> conds,
    List<Stmt> thenStmts,
    List<Elif> elifs,
    List<Stmt> elseStmts  // empty when there is no else branch
) implements Command {

    public IfStmt {
        if (ifPos == null) {
            ifPos = Pos.UNKNOWN;
        }
        if (fiPos == null) {
            fiPos = Pos.UNKNOWN;
        }
        conds = Printer.listOf(conds);
        thenStmts = Printer.listOf(thenStmts);
        elifs = Printer.listOf(elifs);
        elseStmts = Printer.listOf(elseStmts);
    }

    public IfStmt(List<Stmt> conds, List<Stmt> thenStmts, List<Elif> elifs, List<Stmt> elseStmts) {
        this(Pos.UNKNOWN, Pos.UNKNOWN, conds, thenStmts, elifs, elseStmts);
    }

    @Override
    public Pos pos() {
        return ifPos;
    }

    @Override
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append(Token.IF.text()).append(Printer.stmtList(conds));
        sb.append(Token.THEN.text()).append(Printer.stmtList(thenStmts));
        for (Elif elif : elifs) {
            sb.append(Printer.required(elif, "IfStmt", "elifs").render());
        }
        if (!elseStmts.isEmpty()) {
            sb.append(Token.ELSE.text()).append(Printer.stmtList(elseStmts));
        }
        sb.append(Token.FI.text());
        return sb.toString();
    }

    @Override
    public String type() {
        return "IfStmt";
    }
}
