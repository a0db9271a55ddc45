package com.lux.script.parser;

public class Token {
    public final TokenType type;
    public final String lexeme;
    public final Object literal;
    public final Span span;

    public Token(TokenType type, String lexeme, Object literal, Span span) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.span = span;
    }

    @Override
    public String toString() {
        switch (type) {
            case IDENTIFIER:
            case NUMBER:
                return type + " '" + lexeme + "'";
            case STRING:
                return "string " + lexeme;
            case UNKNOWN_CHAR:
                return "'" + lexeme + "'";
            default:
                return type.toString();
        }
    }
}
