package com.shellast.ast;

import java.util.List;

public record CaseStmt(
    Pos casePos,
    Pos esacPos,
    Word word,
    List<PatternList> list
) implements Command {

    public CaseStmt {
        if (casePos == null) {
            casePos = Pos.UNKNOWN;
        }
        if (esacPos == null) {
            esacPos = Pos.UNKNOWN;
        }
        list = Printer.listOf(list);
    }

    public CaseStmt(Word word, List<PatternList> list) {
        this(Pos.UNKNOWN, Pos.UNKNOWN, word, list);
    }

    @Override
    public Pos pos() {
        return casePos;
    }

    @Override
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append(Token.CASE.text()).append(' ')
            .append(Printer.required(word, "CaseStmt", "word").render())
            .append(' ').append(Token.IN.text());
        for (int i = 0; i < list.size(); i++) {
            sb.append(i == 0 ? " " : Token.DSEMICOLON.text() + " ");
            sb.append(Printer.required(list.get(i), "CaseStmt", "list").render());
        }
        sb.append(Printer.SEMICOLON_SPACE).append(Token.ESAC.text());
        return sb.toString();
    }

    @Override
    public String type() {
        return "CaseStmt";
    }
}
