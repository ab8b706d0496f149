package com.shellast.ast;

public record Lit(
    Pos valuePos,
    String value
) implements WordPart {

    public Lit {
        if (valuePos == null) {
            valuePos = Pos.UNKNOWN;
        }
    }

    public Lit(String value) {
        this(Pos.UNKNOWN, value);
    }

    @Override
    public Pos pos() {
        return valuePos;
    }

    @Override
    public String render() {
        return Printer.required(value, "Lit", "value");
    }

    @Override
    public String type() {
        return "Lit";
    }
}
