package com.shellast.ast;

import java.util.List;

/**
 * One arm of a {@link CaseStmt}: {@code pat1 | pat2) stmts}.
 */
public record PatternList(
    List<Word> patterns,
    List<Stmt> stmts
) implements Node {

    public PatternList {
        patterns = Printer.listOf(patterns);
        stmts = Printer.listOf(stmts);
    }

    @Override
    public Pos pos() {
        return Pos.firstOf(patterns);
    }

    @Override
    public String render() {
        return Printer.join(patterns, " " + Token.OR.text() + " ") + ") " + Printer.stmtJoin(stmts);
    }

    @Override
    public String type() {
        return "PatternList";
    }
}
