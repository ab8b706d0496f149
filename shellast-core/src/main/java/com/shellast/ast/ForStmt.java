package com.shellast.ast;

import java.util.List;

/**
 * {@code for name in words; do stmts; done}. With no words the
 * {@code in} clause is left out and the loop runs over the positional
 * parameters.
 */
public record ForStmt(
    Pos forPos,
    Pos donePos,
    Lit name,
    List<Word> wordList,
    List<Stmt> doStmts
) implements Command {

    public ForStmt {
        if (forPos == null) {
            forPos = Pos.UNKNOWN;
        }
        if (donePos == null) {
            donePos = Pos.UNKNOWN;
        }
        wordList = Printer.listOf(wordList);
        doStmts = Printer.listOf(doStmts);
    }

    public ForStmt(Lit name, List<Word> wordList, List<Stmt> doStmts) {
        this(Pos.UNKNOWN, Pos.UNKNOWN, name, wordList, doStmts);
    }

    @Override
    public Pos pos() {
        return forPos;
    }

    @Override
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append(Token.FOR.text()).append(' ')
            .append(Printer.required(name, "ForStmt", "name").render());
        if (!wordList.isEmpty()) {
            sb.append(' ').append(Token.IN.text()).append(' ')
                .append(Printer.join(wordList, " "));
        }
        sb.append(Printer.SEMICOLON_SPACE).append(Token.DO.text())
            .append(Printer.stmtList(doStmts))
            .append(Token.DONE.text());
        return sb.toString();
    }

    @Override
    public String type() {
        return "ForStmt";
    }
}
