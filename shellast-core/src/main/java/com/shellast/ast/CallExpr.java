package com.shellast.ast;

import java.util.List;

/**
 * A simple command: a program name followed by its arguments.
 */
public record CallExpr(
    List<Word> args
) implements Command {

    public CallExpr {
        args = Printer.listOf(args);
    }

    public CallExpr(Word... args) {
        this(List.of(args));
    }

    @Override
    public Pos pos() {
        return Pos.firstOf(args);
    }

    @Override
    public String render() {
        return Printer.join(args, " ");
    }

    @Override
    public String type() {
        return "CallExpr";
    }
}
