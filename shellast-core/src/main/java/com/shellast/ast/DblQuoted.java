package com.shellast.ast;

import java.util.List;

public record DblQuoted(
    Pos quote,
    List<WordPart> parts
) implements WordPart {

    public DblQuoted {
        if (quote == null) {
            quote = Pos.UNKNOWN;
        }
        parts = Printer.listOf(parts);
    }

    public DblQuoted(List<WordPart> parts) {
        this(Pos.UNKNOWN, parts);
    }

    @Override
    public Pos pos() {
        return quote;
    }

    @Override
    public String render() {
        return "\"" + Printer.join(parts, "") + "\"";
    }

    @Override
    public String type() {
        return "DblQuoted";
    }
}
