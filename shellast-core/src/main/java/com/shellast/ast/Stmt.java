package com.shellast.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A command together with its execution modifiers: negation, assignments,
 * redirections and backgrounding.
 *
 * <p>The position is the statement's own, which is not necessarily that of
 * its command.</p>
 */
public record Stmt(
    Pos position,
    Command cmd,
    boolean negated,
    List<Assign> assigns,
    List<Redirect> redirs,
    boolean background
) implements Node {

    public Stmt {
        if (position == null) {
            position = Pos.UNKNOWN;
        }
        if (cmd == null) {
            cmd = NoCommand.INSTANCE;
        }
        assigns = Printer.listOf(assigns);
        redirs = Printer.listOf(redirs);
    }

    public Stmt(Pos position, Command cmd) {
        this(position, cmd, false, List.of(), List.of(), false);
    }

    public Stmt(Command cmd) {
        this(cmd.pos(), cmd);
    }

    public Stmt withNegated(boolean negated) {
        return new Stmt(position, cmd, negated, assigns, redirs, background);
    }

    public Stmt withBackground(boolean background) {
        return new Stmt(position, cmd, negated, assigns, redirs, background);
    }

    public Stmt withAssigns(List<Assign> assigns) {
        return new Stmt(position, cmd, negated, assigns, redirs, background);
    }

    public Stmt withRedirs(List<Redirect> redirs) {
        return new Stmt(position, cmd, negated, assigns, redirs, background);
    }

    /**
     * Whether any redirect is a here-document, in which case the statement
     * must be followed by a line break rather than {@code ;}.
     */
    public boolean hasHeredoc() {
        for (Redirect r : redirs) {
            if (r != null && r.op() != null && r.op().isHeredoc()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Pos pos() {
        return position;
    }

    @Override
    public String render() {
        List<String> parts = new ArrayList<>();
        if (negated) {
            parts.add(Token.BANG.text());
        }
        if (!(cmd instanceof NoCommand)) {
            parts.add(cmd.render());
        }
        for (Assign a : assigns) {
            parts.add(Printer.required(a, "Stmt", "assigns").render());
        }
        for (Redirect r : redirs) {
            parts.add(Printer.required(r, "Stmt", "redirs").render());
        }
        if (background) {
            parts.add(Token.AND.text());
        }
        return String.join(" ", parts);
    }

    @Override
    public String type() {
        return "Stmt";
    }
}
