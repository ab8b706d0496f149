package com.shellast.ast;

/**
 * A function definition. {@code bashStyle} selects the
 * {@code function name() body} spelling over the POSIX {@code name() body}.
 */
public record FuncDecl(
    Pos position,
    boolean bashStyle,
    Lit name,
    Stmt body
) implements Command {

    public FuncDecl {
        if (position == null) {
            position = Pos.UNKNOWN;
        }
    }

    public FuncDecl(boolean bashStyle, Lit name, Stmt body) {
        this(Pos.UNKNOWN, bashStyle, name, body);
    }

    @Override
    public Pos pos() {
        return position;
    }

    @Override
    public String render() {
        String decl = Printer.required(name, "FuncDecl", "name").render() + "() "
            + Printer.required(body, "FuncDecl", "body").render();
        if (bashStyle) {
            return Token.FUNCTION.text() + " " + decl;
        }
        return decl;
    }

    @Override
    public String type() {
        return "FuncDecl";
    }
}
