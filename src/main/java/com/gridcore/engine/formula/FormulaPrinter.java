package com.gridcore.engine.formula;

import com.gridcore.engine.formula.ast.BinaryExpr;
import com.gridcore.engine.formula.ast.Expr;
import com.gridcore.engine.formula.ast.ExprVisitor;
import com.gridcore.engine.formula.ast.FunctionCallExpr;
import com.gridcore.engine.formula.ast.LiteralExpr;
import com.gridcore.engine.formula.ast.NameExpr;
import com.gridcore.engine.formula.ast.RangeExpr;
import com.gridcore.engine.formula.ast.ReferenceExpr;
import com.gridcore.engine.formula.ast.UnaryExpr;
import com.gridcore.engine.formula.ast.UnaryOperator;
import com.gridcore.engine.models.CellAddress;
import com.gridcore.engine.models.CellValue;

import java.util.stream.Collectors;

/**
 * Turns a syntax tree back into formula source (without the leading "=").
 * Only the parentheses needed to keep the same tree on re-parse are emitted.
 */
public final class FormulaPrinter implements ExprVisitor<String> {

    private static final int UNARY_PRECEDENCE = 6;
    private static final int POSTFIX_PRECEDENCE = 7;
    private static final int PRIMARY_PRECEDENCE = 8;

    private static final FormulaPrinter INSTANCE = new FormulaPrinter();

    private FormulaPrinter() {
    }

    public static String print(Expr expr) {
        return expr.accept(INSTANCE);
    }

    @Override
    public String visitLiteral(LiteralExpr expr) {
        CellValue value = expr.getValue();
        switch (value.getType()) {
            case STRING:
                return "\"" + value.asString().replace("\"", "\"\"") + "\"";
            case NUMBER:
                return CellValue.formatNumber(value.asNumber());
            default:
                return value.toDisplayString();
        }
    }

    @Override
    public String visitReference(ReferenceExpr expr) {
        CellAddress address = expr.getAddress();
        return (expr.isAbsoluteCol() ? "$" : "") + CellAddress.columnToLabel(address.getCol())
                + (expr.isAbsoluteRow() ? "$" : "") + (address.getRow() + 1);
    }

    @Override
    public String visitRange(RangeExpr expr) {
        return visitReference(expr.getStart()) + ":" + visitReference(expr.getEnd());
    }

    @Override
    public String visitUnary(UnaryExpr expr) {
        if (expr.getOperator() == UnaryOperator.PERCENT) {
            return wrap(expr.getOperand(), precedenceOf(expr.getOperand()) < POSTFIX_PRECEDENCE) + "%";
        }
        String sign = expr.getOperator() == UnaryOperator.NEGATE ? "-" : "+";
        return sign + wrap(expr.getOperand(), precedenceOf(expr.getOperand()) < UNARY_PRECEDENCE);
    }

    @Override
    public String visitBinary(BinaryExpr expr) {
        int precedence = expr.getOperator().getPrecedence();
        String left = wrap(expr.getLeft(), precedenceOf(expr.getLeft()) < precedence);
        String right = wrap(expr.getRight(), precedenceOf(expr.getRight()) <= precedence);
        return left + expr.getOperator().getSymbol() + right;
    }

    @Override
    public String visitFunctionCall(FunctionCallExpr expr) {
        return expr.getName() + "(" + expr.getArguments().stream()
                .map(FormulaPrinter::print)
                .collect(Collectors.joining(",")) + ")";
    }

    @Override
    public String visitName(NameExpr expr) {
        return expr.getName();
    }

    private String wrap(Expr expr, boolean parenthesize) {
        String text = expr.accept(this);
        return parenthesize ? "(" + text + ")" : text;
    }

    private static int precedenceOf(Expr expr) {
        if (expr instanceof BinaryExpr) {
            return ((BinaryExpr) expr).getOperator().getPrecedence();
        }
        if (expr instanceof UnaryExpr) {
            return ((UnaryExpr) expr).getOperator() == UnaryOperator.PERCENT ? POSTFIX_PRECEDENCE : UNARY_PRECEDENCE;
        }
        if (expr instanceof LiteralExpr && ((LiteralExpr) expr).getValue().isNumber()
                && ((LiteralExpr) expr).getValue().asNumber() < 0) {
            return UNARY_PRECEDENCE;
        }
        return PRIMARY_PRECEDENCE;
    }
}
