package com.gridcore.engine.formula;

import com.gridcore.engine.exceptions.FormulaParseException;
import com.gridcore.engine.exceptions.InvalidAddressException;
import com.gridcore.engine.formula.ast.BinaryExpr;
import com.gridcore.engine.formula.ast.BinaryOperator;
import com.gridcore.engine.formula.ast.Expr;
import com.gridcore.engine.formula.ast.FunctionCallExpr;
import com.gridcore.engine.formula.ast.LiteralExpr;
import com.gridcore.engine.formula.ast.NameExpr;
import com.gridcore.engine.formula.ast.RangeExpr;
import com.gridcore.engine.formula.ast.ReferenceExpr;
import com.gridcore.engine.formula.ast.UnaryExpr;
import com.gridcore.engine.formula.ast.UnaryOperator;
import com.gridcore.engine.models.CellAddress;
import com.gridcore.engine.models.CellValue;
import com.gridcore.engine.models.ErrorType;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for spreadsheet formulas.
 *
 * Precedence, lowest first:
 * comparison (= <> < <= > >=), concatenation (&), additive (+ -),
 * multiplicative (* /), power (^), prefix sign (- +), postfix percent (%).
 * All binary levels are left-associative.
 *
 * Instances are single-use; call {@link #parseFormula(String)} for the common case.
 */
public class FormulaParser {

    private final List<Token> tokens;
    private int current;

    public FormulaParser(String source) {
        this.tokens = new Tokenizer(source).tokenize();
    }

    /**
     * Parses formula text, with or without a leading "=".
     * Error positions refer to the text as given, "=" included.
     */
    public static Expr parseFormula(String text) {
        if (text == null) {
            throw new FormulaParseException("Formula is empty", 0, "");
        }
        String source = text.startsWith("=") ? " " + text.substring(1) : text;
        return new FormulaParser(source).parse();
    }

    public Expr parse() {
        if (peek().getType() == TokenType.EOF) {
            throw new FormulaParseException("Formula is empty", peek().getPosition(), "");
        }
        Expr expr = comparison();
        Token trailing = peek();
        if (trailing.getType() != TokenType.EOF) {
            if (trailing.getType() == TokenType.RPAREN) {
                throw new FormulaParseException("Unbalanced parenthesis", trailing.getPosition(), trailing.getText());
            }
            throw new FormulaParseException("Unexpected token", trailing.getPosition(), trailing.getText());
        }
        return expr;
    }

    private Expr comparison() {
        Expr left = concatenation();
        while (peek().getType() == TokenType.OPERATOR) {
            BinaryOperator op = BinaryOperator.fromSymbol(peek().getText());
            if (op == null || !op.isComparison()) {
                break;
            }
            advance();
            left = new BinaryExpr(op, left, concatenation());
        }
        return left;
    }

    private Expr concatenation() {
        Expr left = additive();
        while (peek().is(TokenType.OPERATOR, "&")) {
            advance();
            left = new BinaryExpr(BinaryOperator.CONCAT, left, additive());
        }
        return left;
    }

    private Expr additive() {
        Expr left = multiplicative();
        while (peek().is(TokenType.OPERATOR, "+") || peek().is(TokenType.OPERATOR, "-")) {
            BinaryOperator op = advance().getText().equals("+") ? BinaryOperator.ADD : BinaryOperator.SUBTRACT;
            left = new BinaryExpr(op, left, multiplicative());
        }
        return left;
    }

    private Expr multiplicative() {
        Expr left = power();
        while (peek().is(TokenType.OPERATOR, "*") || peek().is(TokenType.OPERATOR, "/")) {
            BinaryOperator op = advance().getText().equals("*") ? BinaryOperator.MULTIPLY : BinaryOperator.DIVIDE;
            left = new BinaryExpr(op, left, power());
        }
        return left;
    }

    private Expr power() {
        Expr left = unary();
        while (peek().is(TokenType.OPERATOR, "^")) {
            advance();
            left = new BinaryExpr(BinaryOperator.POWER, left, unary());
        }
        return left;
    }

    private Expr unary() {
        if (peek().is(TokenType.OPERATOR, "-")) {
            advance();
            return new UnaryExpr(UnaryOperator.NEGATE, unary());
        }
        if (peek().is(TokenType.OPERATOR, "+")) {
            advance();
            return new UnaryExpr(UnaryOperator.PLUS, unary());
        }
        return postfix();
    }

    private Expr postfix() {
        Expr expr = primary();
        while (peek().is(TokenType.OPERATOR, "%")) {
            advance();
            expr = new UnaryExpr(UnaryOperator.PERCENT, expr);
        }
        return expr;
    }

    private Expr primary() {
        Token token = peek();
        switch (token.getType()) {
            case NUMBER:
                advance();
                return new LiteralExpr(CellValue.number(parseNumber(token)));
            case STRING:
                advance();
                return new LiteralExpr(CellValue.string(token.getText()));
            case BOOLEAN:
                advance();
                return new LiteralExpr(CellValue.bool(token.getText().equals("TRUE")));
            case ERROR:
                advance();
                return new LiteralExpr(CellValue.error(ErrorType.fromCode(token.getText())));
            case CELL_REF:
                return reference();
            case IDENTIFIER:
                advance();
                if (peek().getType() == TokenType.LPAREN) {
                    return functionCall(token);
                }
                return new NameExpr(token.getText());
            case LPAREN:
                advance();
                Expr inner = comparison();
                expect(TokenType.RPAREN, "Unbalanced parenthesis");
                return inner;
            case EOF:
                throw new FormulaParseException("Unexpected end of formula", token.getPosition(), "");
            default:
                throw new FormulaParseException("Unexpected token", token.getPosition(), token.getText());
        }
    }

    private Expr reference() {
        ReferenceExpr start = toReference(advance());
        if (peek().getType() != TokenType.COLON) {
            return start;
        }
        advance();
        Token endToken = peek();
        if (endToken.getType() != TokenType.CELL_REF) {
            throw new FormulaParseException("Expected cell reference after ':'", endToken.getPosition(), endToken.getText());
        }
        advance();
        return normalizeRange(start, toReference(endToken));
    }

    private Expr functionCall(Token name) {
        advance(); // (
        List<Expr> args = new ArrayList<>();
        if (peek().getType() != TokenType.RPAREN) {
            args.add(comparison());
            while (peek().getType() == TokenType.COMMA) {
                advance();
                args.add(comparison());
            }
        }
        expect(TokenType.RPAREN, "Unbalanced parenthesis");
        return new FunctionCallExpr(name.getText(), args);
    }

    private ReferenceExpr toReference(Token token) {
        String text = token.getText();
        boolean absoluteCol = text.startsWith("$");
        String rest = absoluteCol ? text.substring(1) : text;
        int split = 0;
        while (split < rest.length() && Character.isLetter(rest.charAt(split))) {
            split++;
        }
        String letters = rest.substring(0, split);
        String rowPart = rest.substring(split);
        boolean absoluteRow = rowPart.startsWith("$");
        if (absoluteRow) {
            rowPart = rowPart.substring(1);
        }
        try {
            CellAddress address = CellAddress.fromString(letters + rowPart);
            return new ReferenceExpr(address, absoluteCol, absoluteRow);
        } catch (InvalidAddressException e) {
            throw new FormulaParseException("Invalid cell reference", token.getPosition(), text);
        }
    }

    // Ranges are stored top-left to bottom-right, each axis keeping its own $ flag.
    private static RangeExpr normalizeRange(ReferenceExpr a, ReferenceExpr b) {
        CellAddress first = a.getAddress();
        CellAddress second = b.getAddress();
        boolean swapCols = first.getCol() > second.getCol();
        boolean swapRows = first.getRow() > second.getRow();
        if (!swapCols && !swapRows) {
            return new RangeExpr(a, b);
        }
        ReferenceExpr colLow = swapCols ? b : a;
        ReferenceExpr colHigh = swapCols ? a : b;
        ReferenceExpr rowLow = swapRows ? b : a;
        ReferenceExpr rowHigh = swapRows ? a : b;
        ReferenceExpr start = new ReferenceExpr(
                CellAddress.of(colLow.getAddress().getCol(), rowLow.getAddress().getRow()),
                colLow.isAbsoluteCol(), rowLow.isAbsoluteRow());
        ReferenceExpr end = new ReferenceExpr(
                CellAddress.of(colHigh.getAddress().getCol(), rowHigh.getAddress().getRow()),
                colHigh.isAbsoluteCol(), rowHigh.isAbsoluteRow());
        return new RangeExpr(start, end);
    }

    private static double parseNumber(Token token) {
        try {
            return Double.parseDouble(token.getText());
        } catch (NumberFormatException e) {
            throw new FormulaParseException("Invalid number", token.getPosition(), token.getText());
        }
    }

    private void expect(TokenType type, String message) {
        Token token = peek();
        if (token.getType() != type) {
            throw new FormulaParseException(message, token.getPosition(), token.getText());
        }
        advance();
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token advance() {
        Token token = tokens.get(current);
        if (token.getType() != TokenType.EOF) {
            current++;
        }
        return token;
    }
}
