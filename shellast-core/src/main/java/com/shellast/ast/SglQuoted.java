package com.shellast.ast;

/**
 * A single-quoted string. The value is emitted as is; it must not contain
 * a single quote.
 */
public record SglQuoted(
    Pos quote,
    String value
) implements WordPart {

    public SglQuoted {
        if (quote == null) {
            quote = Pos.UNKNOWN;
        }
    }

    public SglQuoted(String value) {
        this(Pos.UNKNOWN, value);
    }

    @Override
    public Pos pos() {
        return quote;
    }

    @Override
    public String render() {
        return "'" + Printer.required(value, "SglQuoted", "value") + "'";
    }

    @Override
    public String type() {
        return "SglQuoted";
    }
}
