import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.lux.script.parser.Lexer;
import com.lux.script.parser.Span;
import com.lux.script.parser.Token;
import com.lux.script.parser.TokenType;

public class LexerTest {

    private static List<TokenType> types(String source) {
        List<TokenType> out = new ArrayList<>();
        for (Token t : new Lexer(source).tokenize()) out.add(t.type);
        return out;
    }

    @Test
    void emptySource_hasNoTokens() {
        assertTrue(new Lexer("").tokenize().isEmpty());
        assertTrue(new Lexer("  \t\r\n // only a comment").tokenize().isEmpty());
    }

    @Test
    void punctuationAndOperators() {
        assertEquals(List.of(
                TokenType.LEFT_PAREN, TokenType.RIGHT_PAREN, TokenType.LEFT_BRACE, TokenType.RIGHT_BRACE,
                TokenType.COMMA, TokenType.DOT, TokenType.MINUS, TokenType.PLUS, TokenType.SEMICOLON,
                TokenType.STAR, TokenType.SLASH),
                types("(){},.-+;*/"));

        assertEquals(List.of(
                TokenType.BANG_EQUAL, TokenType.EQUAL_EQUAL, TokenType.LESS_EQUAL, TokenType.GREATER_EQUAL,
                TokenType.BANG, TokenType.EQUAL, TokenType.LESS, TokenType.GREATER),
                types("!= == <= >= ! = < >"));
    }

    @Test
    void lineCommentRunsToEndOfLine() {
        assertEquals(List.of(TokenType.VAR, TokenType.IDENTIFIER),
                types("// var ignored;\nvar x"));
    }

    @Test
    void keywordsIncludingReservedOnes() {
        assertEquals(List.of(
                TokenType.AND, TokenType.CLASS, TokenType.ELSE, TokenType.FALSE, TokenType.FUN,
                TokenType.FOR, TokenType.IF, TokenType.NIL, TokenType.OR, TokenType.PRINT,
                TokenType.RETURN, TokenType.SUPER, TokenType.THIS, TokenType.TRUE, TokenType.VAR,
                TokenType.WHILE),
                types("and class else false fun for if nil or print return super this true var while"));

        // prefixes and suffixes of keywords are identifiers
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.IDENTIFIER),
                types("orchid _var var2"));
    }

    @Test
    void numbers_trailingDotIsSeparateToken() {
        List<Token> tokens = new Lexer("1. 1.5 42").tokenize();
        assertEquals(4, tokens.size());

        assertEquals(TokenType.NUMBER, tokens.get(0).type);
        assertEquals(1.0, (Double) tokens.get(0).literal);
        assertEquals(TokenType.DOT, tokens.get(1).type);

        assertEquals(TokenType.NUMBER, tokens.get(2).type);
        assertEquals(1.5, (Double) tokens.get(2).literal);
        assertEquals("1.5", tokens.get(2).lexeme);

        assertEquals(42.0, (Double) tokens.get(3).literal);
    }

    @Test
    void strings_mayContainNewlines() {
        List<Token> tokens = new Lexer("\"a\nb\"").tokenize();
        assertEquals(1, tokens.size());
        assertEquals(TokenType.STRING, tokens.get(0).type);
        assertEquals("a\nb", tokens.get(0).literal);
        assertEquals("\"a\nb\"", tokens.get(0).lexeme);
    }

    @Test
    void unterminatedString_becomesSentinelToEndOfInput() {
        List<Token> tokens = new Lexer("print \"abc").tokenize();
        assertEquals(2, tokens.size());
        Token t = tokens.get(1);
        assertEquals(TokenType.UNTERMINATED_STRING, t.type);
        assertEquals("\"abc", t.lexeme);
        assertEquals(new Span(6, 10), t.span);
    }

    @Test
    void unknownCharacter_becomesSentinel() {
        List<Token> tokens = new Lexer("a @ b").tokenize();
        assertEquals(3, tokens.size());
        assertEquals(TokenType.UNKNOWN_CHAR, tokens.get(1).type);
        assertEquals("@", tokens.get(1).lexeme);
    }

    @Test
    void spansAreUtf8ByteOffsets() {
        // 'é' is two bytes in UTF-8
        List<Token> tokens = new Lexer("\"é\" x").tokenize();
        assertEquals(new Span(0, 4), tokens.get(0).span);
        assertEquals(new Span(5, 6), tokens.get(1).span);

        List<Token> plain = new Lexer("var ab = 1;").tokenize();
        assertEquals(new Span(0, 3), plain.get(0).span);
        assertEquals(new Span(4, 6), plain.get(1).span);
        assertEquals(new Span(10, 11), plain.get(4).span);
    }
}
