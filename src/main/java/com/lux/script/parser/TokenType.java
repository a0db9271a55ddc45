package com.lux.script.parser;

public enum TokenType {
    // Single-character tokens.
    LEFT_PAREN("("), RIGHT_PAREN(")"), LEFT_BRACE("{"), RIGHT_BRACE("}"),
    COMMA(","), DOT("."), MINUS("-"), PLUS("+"), SEMICOLON(";"), SLASH("/"), STAR("*"),

    // One or two character tokens.
    BANG("!"), BANG_EQUAL("!="),
    EQUAL("="), EQUAL_EQUAL("=="),
    GREATER(">"), GREATER_EQUAL(">="),
    LESS("<"), LESS_EQUAL("<="),

    // Literals.
    IDENTIFIER("identifier"), STRING("string"), NUMBER("number"),

    // Keywords.
    AND("and"), CLASS("class"), ELSE("else"), FALSE("false"), FUN("fun"), FOR("for"),
    IF("if"), NIL("nil"), OR("or"), PRINT("print"), RETURN("return"), SUPER("super"),
    THIS("this"), TRUE("true"), VAR("var"), WHILE("while"),

    // Lexical error sentinels; the parser decides how to report them.
    UNTERMINATED_STRING("unterminated-string"),
    UNKNOWN_CHAR("unknown-char"),

    EOF("EOF");

    private final String display;

    TokenType(String display) {
        this.display = display;
    }

    /** Human-readable spelling used in diagnostics. */
    @Override
    public String toString() {
        return display;
    }
}
