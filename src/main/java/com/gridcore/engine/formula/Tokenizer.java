package com.gridcore.engine.formula;

import com.gridcore.engine.exceptions.FormulaParseException;
import com.gridcore.engine.models.ErrorType;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits formula text into tokens. String literals use doubled quotes as escapes.
 * A word directly followed by "(" is always an identifier so that names like LOG10
 * are not mistaken for cell references.
 */
public class Tokenizer {

    private static final Pattern CELL_REF = Pattern.compile("^\\$?[A-Za-z]{1,3}\\$?[0-9]+$");

    private final String input;
    private int pos;

    public Tokenizer(String input) {
        this.input = input;
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= input.length()) {
                tokens.add(new Token(TokenType.EOF, "", pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() {
        int start = pos;
        char c = input.charAt(pos);

        if (Character.isDigit(c) || (c == '.' && pos + 1 < input.length() && Character.isDigit(input.charAt(pos + 1)))) {
            return readNumber();
        }
        if (c == '"') {
            return readString();
        }
        if (c == '#') {
            return readError();
        }
        if (Character.isLetter(c) || c == '$' || c == '_') {
            return readWord();
        }

        pos++;
        switch (c) {
            case '(':
                return new Token(TokenType.LPAREN, "(", start);
            case ')':
                return new Token(TokenType.RPAREN, ")", start);
            case ',':
                return new Token(TokenType.COMMA, ",", start);
            case ':':
                return new Token(TokenType.COLON, ":", start);
            case '+':
            case '-':
            case '*':
            case '/':
            case '^':
            case '&':
            case '%':
            case '=':
                return new Token(TokenType.OPERATOR, String.valueOf(c), start);
            case '<':
                if (pos < input.length() && (input.charAt(pos) == '=' || input.charAt(pos) == '>')) {
                    pos++;
                    return new Token(TokenType.OPERATOR, input.substring(start, pos), start);
                }
                return new Token(TokenType.OPERATOR, "<", start);
            case '>':
                if (pos < input.length() && input.charAt(pos) == '=') {
                    pos++;
                    return new Token(TokenType.OPERATOR, ">=", start);
                }
                return new Token(TokenType.OPERATOR, ">", start);
            default:
                throw new FormulaParseException("Unexpected character", start, String.valueOf(c));
        }
    }

    private Token readNumber() {
        int start = pos;
        while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
            pos++;
        }
        if (pos < input.length() && input.charAt(pos) == '.') {
            pos++;
            while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
                pos++;
            }
        }
        if (pos < input.length() && (input.charAt(pos) == 'e' || input.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < input.length() && (input.charAt(pos) == '+' || input.charAt(pos) == '-')) {
                pos++;
            }
            if (pos < input.length() && Character.isDigit(input.charAt(pos))) {
                while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
                    pos++;
                }
            } else {
                // not an exponent after all
                pos = mark;
            }
        }
        return new Token(TokenType.NUMBER, input.substring(start, pos), start);
    }

    private Token readString() {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '"') {
                if (pos + 1 < input.length() && input.charAt(pos + 1) == '"') {
                    sb.append('"');
                    pos += 2;
                    continue;
                }
                pos++;
                return new Token(TokenType.STRING, sb.toString(), start);
            }
            sb.append(c);
            pos++;
        }
        throw new FormulaParseException("Unterminated string literal", start, input.substring(start));
    }

    private Token readError() {
        int start = pos;
        for (ErrorType type : ErrorType.values()) {
            String code = type.getCode();
            if (input.regionMatches(true, pos, code, 0, code.length())) {
                pos += code.length();
                return new Token(TokenType.ERROR, code, start);
            }
        }
        throw new FormulaParseException("Unknown error literal", start, "#");
    }

    private Token readWord() {
        int start = pos;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '$' || c == '_' || c == '.') {
                pos++;
            } else {
                break;
            }
        }
        String word = input.substring(start, pos);

        if (peekNonWhitespace() == '(') {
            if (word.indexOf('$') >= 0) {
                throw new FormulaParseException("Invalid function name", start, word);
            }
            return new Token(TokenType.IDENTIFIER, word, start);
        }
        if (word.equalsIgnoreCase("TRUE") || word.equalsIgnoreCase("FALSE")) {
            return new Token(TokenType.BOOLEAN, word.toUpperCase(), start);
        }
        if (CELL_REF.matcher(word).matches()) {
            return new Token(TokenType.CELL_REF, word, start);
        }
        if (word.indexOf('$') >= 0) {
            throw new FormulaParseException("Invalid cell reference", start, word);
        }
        return new Token(TokenType.IDENTIFIER, word, start);
    }

    private char peekNonWhitespace() {
        int i = pos;
        while (i < input.length() && Character.isWhitespace(input.charAt(i))) {
            i++;
        }
        return i < input.length() ? input.charAt(i) : '\0';
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }
}
