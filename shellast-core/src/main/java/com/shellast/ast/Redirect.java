package com.shellast.ast;

/**
 * An I/O redirection such as {@code 2>err.log} or {@code <<EOF}.
 * {@code n} is the optional file descriptor and may be null.
 */
public record Redirect(
    Pos opPos,
    Token op,
    Lit n,
    Word word
) implements Node {

    public Redirect {
        if (opPos == null) {
            opPos = Pos.UNKNOWN;
        }
    }

    public Redirect(Pos opPos, Token op, Word word) {
        this(opPos, op, null, word);
    }

    @Override
    public Pos pos() {
        return opPos;
    }

    @Override
    public String render() {
        StringBuilder sb = new StringBuilder();
        if (n != null) {
            sb.append(n.render());
        }
        sb.append(Printer.required(op, "Redirect", "op").text());
        sb.append(Printer.required(word, "Redirect", "word").render());
        return sb.toString();
    }

    @Override
    public String type() {
        return "Redirect";
    }
}
