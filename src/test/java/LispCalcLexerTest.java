import com.lispcalc.parser.Lexer;
import com.lispcalc.parser.Token;
import com.lispcalc.parser.TokenType;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LispCalcLexerTest {

    private static List<Token> lex(String src) {
        return new Lexer(src).tokenize();
    }

    @Test
    void namedOperators() {
        List<Token> expected = Arrays.asList(
                Token.leftParen(),
                Token.identifier("add"),
                Token.number("2"),
                Token.leftParen(),
                Token.identifier("subtract"),
                Token.number("4"),
                Token.number("2"),
                Token.rightParen(),
                Token.rightParen(),
                Token.eof()
        );
        assertEquals(expected, lex("(add 2 (subtract 4 2))"));
    }

    @Test
    void symbolOperators_lexAsIdentifiers() {
        List<Token> expected = Arrays.asList(
                Token.leftParen(),
                Token.identifier("+"),
                Token.number("2"),
                Token.leftParen(),
                Token.identifier("-"),
                Token.number("4"),
                Token.number("2"),
                Token.rightParen(),
                Token.rightParen(),
                Token.eof()
        );
        assertEquals(expected, lex("(+ 2 (- 4 2))"));
    }

    @Test
    void emptyInput_isJustEof() {
        assertEquals(Arrays.asList(Token.eof()), lex(""));
        assertEquals(Arrays.asList(Token.eof()), lex("   \t\n "));
        assertEquals(Arrays.asList(Token.eof()), lex(null));
    }

    @Test
    void unknownCharacters_areDropped() {
        assertEquals(
                Arrays.asList(Token.leftParen(), Token.identifier("+"), Token.number("1"),
                        Token.number("2"), Token.rightParen(), Token.eof()),
                lex("(+ 1, 2; ! ?)"));
    }

    @Test
    void greedyRuns_splitAtClassBoundary() {
        // digits and identifier characters never share a token
        assertEquals(
                Arrays.asList(Token.number("12"), Token.identifier("ab"), Token.number("3"),
                        Token.identifier("*/x"), Token.eof()),
                lex("12ab3*/x"));
    }

    @Test
    void adjacentParens_areSeparateTokens() {
        List<Token> toks = lex("((read))");
        assertEquals(6, toks.size());
        assertEquals(TokenType.LEFT_PAREN, toks.get(0).type);
        assertEquals(TokenType.LEFT_PAREN, toks.get(1).type);
        assertEquals("read", toks.get(2).lexeme);
        assertEquals(TokenType.RIGHT_PAREN, toks.get(3).type);
        assertEquals(TokenType.RIGHT_PAREN, toks.get(4).type);
        assertEquals(TokenType.EOF, toks.get(5).type);
    }

    @Test
    void eofAppearsExactlyOnce_atTheEnd() {
        List<Token> toks = lex("(+ 1 2)");
        long eofs = toks.stream().filter(t -> t.type == TokenType.EOF).count();
        assertEquals(1, eofs);
        assertEquals(TokenType.EOF, toks.get(toks.size() - 1).type);
    }

    @Test
    void tracksLineNumbers() {
        List<Token> toks = lex("(+\n1\n\n2)");
        assertEquals(1, toks.get(1).line);
        assertEquals(2, toks.get(2).line);
        assertEquals(4, toks.get(3).line);
    }
}
