package com.shellast.ast;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.shellast.ast.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

public class StmtRenderTest {

    @Test
    void testSimpleCommandFile() {
        File f = new File("t.sh", List.of(stmt("echo", "hi")));
        assertEquals("echo hi", f.render());
    }

    @Test
    void testNegatedBackground() {
        Stmt s = stmt("echo", "hi").withNegated(true).withBackground(true);
        assertEquals("! echo hi &", s.render());
        assertEquals("! echo hi &", new File(List.of(s)).render());
    }

    @Test
    void testAssign() {
        Assign a = new Assign(lit("x"), new Word(lit("1")));
        assertEquals("x=1", a.render());
        assertEquals("x=", new Assign(lit("x"), new Word(List.of())).render());
    }

    @Test
    void testAssignmentOnlyStatement() {
        Stmt s = new Stmt(Pos.UNKNOWN, null, false,
            List.of(new Assign(lit("a"), word("1")), new Assign(lit("b"), word("2"))),
            List.of(), false);
        assertSame(NoCommand.INSTANCE, s.cmd());
        assertEquals("a=1 b=2", s.render());
    }

    @Test
    void testPartsOrder() {
        Stmt s = new Stmt(Pos.UNKNOWN, call("make"), true,
            List.of(new Assign(lit("CC"), word("gcc"))),
            List.of(new Redirect(Pos.UNKNOWN, Token.GTR, word("out.log"))),
            true);
        assertEquals("! make CC=gcc >out.log &", s.render());
    }

    @Test
    void testRedirects() {
        assertEquals(">f", new Redirect(Pos.UNKNOWN, Token.GTR, word("f")).render());
        assertEquals("2>&1", new Redirect(Pos.UNKNOWN, Token.DPLOUT, lit("2"), word("1")).render());
        assertEquals("<<-EOF", new Redirect(Pos.UNKNOWN, Token.DHEREDOC, word("EOF")).render());
        assertEquals("<<<word", new Redirect(Pos.UNKNOWN, Token.WHEREDOC, word("word")).render());
        assertEquals("0<>rw", new Redirect(Pos.UNKNOWN, Token.RDRINOUT, lit("0"), word("rw")).render());
    }

    @Test
    void testRedirectOnlyStatement() {
        Stmt s = stmt(NoCommand.INSTANCE).withRedirs(List.of(new Redirect(Pos.UNKNOWN, Token.GTR, word("empty"))));
        assertEquals(">empty", s.render());
    }

    @Test
    void testHasHeredoc() {
        assertTrue(heredoc("cat", "EOF").hasHeredoc());
        Stmt dash = stmt("cat").withRedirs(List.of(new Redirect(Pos.UNKNOWN, Token.DHEREDOC, word("END"))));
        assertTrue(dash.hasHeredoc());
        Stmt hereString = stmt("cat").withRedirs(List.of(new Redirect(Pos.UNKNOWN, Token.WHEREDOC, word("x"))));
        assertFalse(hereString.hasHeredoc());
        assertFalse(stmt("cat").hasHeredoc());
    }

    @Test
    void testListsAreImmutable() {
        Stmt s = stmt("a");
        assertThrows(UnsupportedOperationException.class, () -> s.redirs().add(null));
        File f = new File(List.of(s));
        assertThrows(UnsupportedOperationException.class, () -> f.stmts().clear());
    }

    @Test
    void testNullListsAreEmpty() {
        Stmt s = new Stmt(Pos.UNKNOWN, call("a"), false, null, null, false);
        assertTrue(s.assigns().isEmpty());
        assertTrue(s.redirs().isEmpty());
        assertEquals("a", s.render());
    }
}
