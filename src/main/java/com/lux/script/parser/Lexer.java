package com.lux.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns source text into tokens in a single left-to-right pass.
 *
 * Lexical problems (unterminated strings, unknown characters) become sentinel
 * tokens instead of exceptions. No EOF token is appended; the parser answers
 * EOF for any position past the end of the list.
 *
 * Token spans are UTF-8 byte offsets, so {@code bytePos} advances by the
 * encoded length of every consumed code point while {@code current} walks the
 * UTF-16 string.
 */
public class Lexer {
    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int startByte = 0;
    private int bytePos = 0;

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("and", TokenType.AND);
        map.put("class", TokenType.CLASS);
        map.put("else", TokenType.ELSE);
        map.put("false", TokenType.FALSE);
        map.put("for", TokenType.FOR);
        map.put("fun", TokenType.FUN);
        map.put("if", TokenType.IF);
        map.put("nil", TokenType.NIL);
        map.put("or", TokenType.OR);
        map.put("print", TokenType.PRINT);
        map.put("return", TokenType.RETURN);
        map.put("super", TokenType.SUPER);
        map.put("this", TokenType.THIS);
        map.put("true", TokenType.TRUE);
        map.put("var", TokenType.VAR);
        map.put("while", TokenType.WHILE);
        keywords = Collections.unmodifiableMap(map);
    }

    public Lexer(String source) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        this.source = source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            startByte = bytePos;
            scanToken();
        }
        return tokens;
    }

    private void scanToken() {
        int c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case ',': addToken(TokenType.COMMA); break;
            case '.': addToken(TokenType.DOT); break;
            case '-': addToken(TokenType.MINUS); break;
            case '+': addToken(TokenType.PLUS); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '*': addToken(TokenType.STAR); break;
            case '!': addToken(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG); break;
            case '=': addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL); break;
            case '<': addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS); break;
            case '>': addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER); break;
            case '/':
                if (match('/')) {
                    while (!isAtEnd() && peek() != '\n') advance();
                } else {
                    addToken(TokenType.SLASH);
                }
                break;
            case ' ': case '\r': case '\t': case '\n':
                break;
            case '"':
                string();
                break;
            default:
                if (isDigit(c)) number();
                else if (isAlpha(c)) identifier();
                else addToken(TokenType.UNKNOWN_CHAR, new String(Character.toChars(c)));
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
        addToken(type);
    }

    private void number() {
        while (isDigit(peek())) advance();
        // "1." stays NUMBER DOT; only "1.5" is a decimal literal.
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
        }
        double value = Double.parseDouble(source.substring(start, current));
        addToken(TokenType.NUMBER, value);
    }

    private void string() {
        while (!isAtEnd() && peek() != '"') advance();
        if (isAtEnd()) {
            addToken(TokenType.UNTERMINATED_STRING);
            return;
        }
        advance();
        String value = source.substring(start + 1, current - 1);
        addToken(TokenType.STRING, value);
    }

    private boolean isAtEnd() { return current >= source.length(); }

    private int advance() {
        int cp = source.codePointAt(current);
        current += Character.charCount(cp);
        bytePos += utf8Length(cp);
        return cp;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private int peek() { return isAtEnd() ? '\0' : source.codePointAt(current); }

    private int peekNext() {
        if (isAtEnd()) return '\0';
        int next = current + Character.charCount(source.codePointAt(current));
        return (next >= source.length()) ? '\0' : source.codePointAt(next);
    }

    private static boolean isDigit(int c) { return c >= '0' && c <= '9'; }
    private static boolean isAlpha(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }
    private static boolean isAlphaNumeric(int c) { return isAlpha(c) || isDigit(c); }

    static int utf8Length(int codePoint) {
        if (codePoint < 0x80) return 1;
        if (codePoint < 0x800) return 2;
        if (codePoint < 0x10000) return 3;
        return 4;
    }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, new Span(startByte, bytePos)));
    }
}
