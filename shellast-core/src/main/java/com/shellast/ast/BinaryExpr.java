package com.shellast.ast;

/**
 * Two statements joined by {@code &&}, {@code ||} or {@code |}. Chains are
 * left-associative: {@code a && b || c} nests {@code a && b} as {@code x}.
 */
public record BinaryExpr(
    Pos opPos,
    Token op,
    Stmt x,
    Stmt y
) implements Command {

    public BinaryExpr {
        if (opPos == null) {
            opPos = Pos.UNKNOWN;
        }
    }

    public BinaryExpr(Token op, Stmt x, Stmt y) {
        this(Pos.UNKNOWN, op, x, y);
    }

    @Override
    public Pos pos() {
        return Printer.required(x, "BinaryExpr", "x").pos();
    }

    @Override
    public String render() {
        return Printer.required(x, "BinaryExpr", "x").render()
            + " " + Printer.required(op, "BinaryExpr", "op").text() + " "
            + Printer.required(y, "BinaryExpr", "y").render();
    }

    @Override
    public String type() {
        return "BinaryExpr";
    }
}
