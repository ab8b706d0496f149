package com.shellast.ast;

/**
 * The absent command of a statement such as {@code x=1} or {@code >out}.
 */
public record NoCommand() implements Command {

    public static final NoCommand INSTANCE = new NoCommand();

    @Override
    public Pos pos() {
        return Pos.UNKNOWN;
    }

    @Override
    public String render() {
        return "";
    }

    @Override
    public String type() {
        return "NoCommand";
    }
}
