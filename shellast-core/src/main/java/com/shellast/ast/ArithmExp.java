package com.shellast.ast;

import java.util.List;

public record ArithmExp(
    Pos exp,
    Pos rparen,
    List<Word> words
) implements WordPart {

    public ArithmExp {
        if (exp == null) {
            exp = Pos.UNKNOWN;
        }
        if (rparen == null) {
            rparen = Pos.UNKNOWN;
        }
        words = Printer.listOf(words);
    }

    public ArithmExp(List<Word> words) {
        this(Pos.UNKNOWN, Pos.UNKNOWN, words);
    }

    @Override
    public Pos pos() {
        return exp;
    }

    @Override
    public String render() {
        return "$((" + Printer.join(words, " ") + "))";
    }

    @Override
    public String type() {
        return "ArithmExp";
    }
}
