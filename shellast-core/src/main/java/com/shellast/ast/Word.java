package com.shellast.ast;

import java.util.List;

/**
 * One shell word: adjacent literal, quoted and expanded parts with no
 * separator between them, such as {@code foo"$bar"'baz'}.
 */
public record Word(
    List<WordPart> parts
) implements Node {

    public Word {
        parts = Printer.listOf(parts);
    }

    public Word(WordPart... parts) {
        this(List.of(parts));
    }

    @Override
    public Pos pos() {
        return Pos.firstOf(parts);
    }

    @Override
    public String render() {
        return Printer.join(parts, "");
    }

    @Override
    public String type() {
        return "Word";
    }
}
