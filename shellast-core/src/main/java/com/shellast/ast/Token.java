package com.shellast.ast;

/**
 * Keywords and operators that appear literally in rendered shell source.
 */
public enum Token {
    // Reserved words
    IF("if"),
    THEN("then"),
    ELIF("elif"),
    ELSE("else"),
    FI("fi"),
    WHILE("while"),
    UNTIL("until"),
    FOR("for"),
    IN("in"),
    DO("do"),
    DONE("done"),
    CASE("case"),
    ESAC("esac"),
    FUNCTION("function"),

    // Control operators
    BANG("!"),
    AND("&"),
    LAND("&&"),
    OR("|"),
    LOR("||"),
    DSEMICOLON(";;"),

    // Redirect operators
    LSS("<"),
    GTR(">"),
    SHR(">>"),
    RDRINOUT("<>"),
    DPLIN("<&"),
    DPLOUT(">&"),
    CLBOUT(">|"),
    HEREDOC("<<"),
    DHEREDOC("<<-"),
    WHEREDOC("<<<");

    private final String text;

    Token(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }

    /**
     * True for the here-document operators whose body must be followed by a
     * real line break. Here-strings ({@code <<<}) carry their word inline.
     */
    public boolean isHeredoc() {
        return this == HEREDOC || this == DHEREDOC;
    }
}
