package com.shellast.ast;

import java.util.List;

/**
 * A command substitution, {@code $(stmts)} or the legacy backquote form.
 */
public record CmdSubst(
    Pos left,
    Pos right,
    boolean backquotes,
    List<Stmt> stmts
) implements WordPart {

    public CmdSubst {
        if (left == null) {
            left = Pos.UNKNOWN;
        }
        if (right == null) {
            right = Pos.UNKNOWN;
        }
        stmts = Printer.listOf(stmts);
    }

    public CmdSubst(boolean backquotes, List<Stmt> stmts) {
        this(Pos.UNKNOWN, Pos.UNKNOWN, backquotes, stmts);
    }

    @Override
    public Pos pos() {
        return left;
    }

    @Override
    public String render() {
        String body = Printer.stmtJoin(stmts);
        if (backquotes) {
            return "`" + body + "`";
        }
        return "$(" + body + ")";
    }

    @Override
    public String type() {
        return "CmdSubst";
    }
}
