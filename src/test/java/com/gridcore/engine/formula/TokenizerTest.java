package com.gridcore.engine.formula;

import com.gridcore.engine.exceptions.FormulaParseException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TokenizerTest {

    private static List<TokenType> types(String input) {
        return new Tokenizer(input).tokenize().stream().map(Token::getType).collect(Collectors.toList());
    }

    @Test
    void testFunctionCallWithRange() {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.LPAREN, TokenType.CELL_REF, TokenType.COLON,
                        TokenType.CELL_REF, TokenType.RPAREN, TokenType.EOF),
                types("SUM(A1:B2)"));
    }

    @Test
    void testLiterals() {
        List<Token> tokens = new Tokenizer("1.5e3 \"say \"\"hi\"\"\" true #DIV/0!").tokenize();
        assertEquals(TokenType.NUMBER, tokens.get(0).getType());
        assertEquals("1.5e3", tokens.get(0).getText());
        assertEquals(TokenType.STRING, tokens.get(1).getType());
        assertEquals("say \"hi\"", tokens.get(1).getText());
        assertEquals(TokenType.BOOLEAN, tokens.get(2).getType());
        assertEquals("TRUE", tokens.get(2).getText());
        assertEquals(TokenType.ERROR, tokens.get(3).getType());
        assertEquals("#DIV/0!", tokens.get(3).getText());
    }

    @Test
    void testTwoCharacterOperators() {
        List<Token> tokens = new Tokenizer("A1<=B1<>C1>=D1").tokenize();
        assertEquals("<=", tokens.get(1).getText());
        assertEquals("<>", tokens.get(3).getText());
        assertEquals(">=", tokens.get(5).getText());
    }

    @Test
    void testAbsoluteReferences() {
        List<Token> tokens = new Tokenizer("$A$1+A$2+$B3").tokenize();
        assertEquals(TokenType.CELL_REF, tokens.get(0).getType());
        assertEquals("$A$1", tokens.get(0).getText());
        assertEquals("A$2", tokens.get(2).getText());
        assertEquals("$B3", tokens.get(4).getText());
    }

    @Test
    void testPositionsAreRecorded() {
        List<Token> tokens = new Tokenizer("  A1 + 2").tokenize();
        assertEquals(2, tokens.get(0).getPosition());
        assertEquals(5, tokens.get(1).getPosition());
        assertEquals(7, tokens.get(2).getPosition());
    }

    @Test
    void testErrors() {
        FormulaParseException unterminated = assertThrows(FormulaParseException.class,
                () -> new Tokenizer("\"abc").tokenize());
        assertEquals(0, unterminated.getPosition());

        FormulaParseException unexpected = assertThrows(FormulaParseException.class,
                () -> new Tokenizer("1 ? 2").tokenize());
        assertEquals(2, unexpected.getPosition());
        assertEquals("?", unexpected.getToken());

        assertThrows(FormulaParseException.class, () -> new Tokenizer("#BOGUS").tokenize());
        assertThrows(FormulaParseException.class, () -> new Tokenizer("A$$1").tokenize());
    }
}
