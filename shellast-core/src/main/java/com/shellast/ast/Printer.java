package com.shellast.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Joining rules shared by the node render methods.
 */
final class Printer {

    static final String SEMICOLON_SPACE = "; ";

    private Printer() {
        // Utility class
    }

    /**
     * Joins statements with {@code "; "}, except that a statement carrying a
     * here-document is always followed by a newline so that its body stays
     * terminated when the text is parsed again.
     *
     * @param end whether to also emit the newline owed by a trailing heredoc
     */
    static String stmtJoin(List<Stmt> stmts, boolean end) {
        StringBuilder sb = new StringBuilder();
        boolean newline = false;
        for (int i = 0; i < stmts.size(); i++) {
            Stmt stmt = required(stmts.get(i), "Stmt", "element");
            if (newline) {
                sb.append('\n');
            } else if (i > 0) {
                sb.append(SEMICOLON_SPACE);
            }
            sb.append(stmt.render());
            newline = stmt.hasHeredoc();
        }
        if (newline && end) {
            sb.append('\n');
        }
        return sb.toString();
    }

    static String stmtJoin(List<Stmt> stmts) {
        return stmtJoin(stmts, true);
    }

    /**
     * Renders a statement list that sits between two keywords, e.g. the body
     * of {@code do ... done}. The result starts with a space and ends with
     * {@code "; "} or a newline; an empty list is just {@code "; "}.
     */
    static String stmtList(List<Stmt> stmts) {
        if (stmts.isEmpty()) {
            return SEMICOLON_SPACE;
        }
        String joined = stmtJoin(stmts);
        if (joined.endsWith("\n")) {
            return " " + joined;
        }
        return " " + joined + SEMICOLON_SPACE;
    }

    static String join(List<? extends Node> nodes, String sep) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0) {
                sb.append(sep);
            }
            sb.append(required(nodes.get(i), "Node", "element").render());
        }
        return sb.toString();
    }

    static <T> T required(T value, String nodeType, String field) {
        if (value == null) {
            throw new MalformedTreeException(nodeType, field);
        }
        return value;
    }

    /**
     * Unmodifiable copy of a child list; a missing list is an empty one.
     */
    static <T> List<T> listOf(List<T> list) {
        return list == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(list));
    }
}
