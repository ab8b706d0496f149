package com.shellast.ast;

/**
 * A parameter expansion, either short ({@code $name}) or braced
 * ({@code ${text}}). In the braced form {@code text} is everything between
 * the braces, operators included.
 */
public record ParamExp(
    Pos exp,
    boolean shortForm,
    String text
) implements WordPart {

    public ParamExp {
        if (exp == null) {
            exp = Pos.UNKNOWN;
        }
    }

    public ParamExp(boolean shortForm, String text) {
        this(Pos.UNKNOWN, shortForm, text);
    }

    @Override
    public Pos pos() {
        return exp;
    }

    @Override
    public String render() {
        String t = Printer.required(text, "ParamExp", "text");
        if (shortForm) {
            return "$" + t;
        }
        return "${" + t + "}";
    }

    @Override
    public String type() {
        return "ParamExp";
    }
}
