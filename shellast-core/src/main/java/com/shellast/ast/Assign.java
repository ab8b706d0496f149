package com.shellast.ast;

public record Assign(
    Lit name,
    Word value
) implements Node {

    @Override
    public Pos pos() {
        return Printer.required(name, "Assign", "name").pos();
    }

    @Override
    public String render() {
        return Printer.required(name, "Assign", "name").render()
            + "="
            + Printer.required(value, "Assign", "value").render();
    }

    @Override
    public String type() {
        return "Assign";
    }
}
