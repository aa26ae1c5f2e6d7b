package com.gridcore.engine.evaluator;

import com.gridcore.engine.formula.ast.BinaryExpr;
import com.gridcore.engine.formula.ast.BinaryOperator;
import com.gridcore.engine.formula.ast.Expr;
import com.gridcore.engine.formula.ast.ExprVisitor;
import com.gridcore.engine.formula.ast.FunctionCallExpr;
import com.gridcore.engine.formula.ast.LiteralExpr;
import com.gridcore.engine.formula.ast.NameExpr;
import com.gridcore.engine.formula.ast.RangeExpr;
import com.gridcore.engine.formula.ast.ReferenceExpr;
import com.gridcore.engine.formula.ast.UnaryExpr;
import com.gridcore.engine.models.CellValue;
import com.gridcore.engine.models.ErrorType;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates formula trees to cell values. Evaluation never throws:
 * every failure is expressed as an error value, and errors propagate
 * left to right through operators and function arguments.
 */
public class Evaluator {

    private static final CellValue VALUE_ERROR = CellValue.error(ErrorType.VALUE);

    private final FunctionRegistry functions;

    public Evaluator() {
        this(new FunctionRegistry());
    }

    public Evaluator(FunctionRegistry functions) {
        this.functions = functions;
    }

    public FunctionRegistry getFunctions() {
        return functions;
    }

    /**
     * Evaluates a formula for storage in a cell. An empty result is reported as 0.
     */
    public CellValue evaluate(Expr expr, CellResolver resolver) {
        CellValue result = expr.accept(new Visitor(resolver));
        return result.isEmpty() ? CellValue.number(0) : result;
    }

    private final class Visitor implements ExprVisitor<CellValue> {

        private final CellResolver resolver;

        private Visitor(CellResolver resolver) {
            this.resolver = resolver;
        }

        @Override
        public CellValue visitLiteral(LiteralExpr expr) {
            return expr.getValue();
        }

        @Override
        public CellValue visitReference(ReferenceExpr expr) {
            CellValue value = resolver.resolve(expr.getAddress());
            return value == null ? CellValue.EMPTY : value;
        }

        // A range only has meaning as a function argument.
        @Override
        public CellValue visitRange(RangeExpr expr) {
            return VALUE_ERROR;
        }

        @Override
        public CellValue visitUnary(UnaryExpr expr) {
            CellValue operand = expr.getOperand().accept(this);
            if (operand.isError()) {
                return operand;
            }
            switch (expr.getOperator()) {
                case PLUS:
                    return operand;
                case NEGATE: {
                    Double d = Coercion.toNumber(operand);
                    return d == null ? VALUE_ERROR : CellValue.number(-d);
                }
                case PERCENT: {
                    Double d = Coercion.toNumber(operand);
                    return d == null ? VALUE_ERROR : CellValue.number(d / 100);
                }
                default:
                    throw new IllegalStateException("Unknown unary operator " + expr.getOperator());
            }
        }

        @Override
        public CellValue visitBinary(BinaryExpr expr) {
            CellValue left = expr.getLeft().accept(this);
            CellValue right = expr.getRight().accept(this);
            if (left.isError()) {
                return left;
            }
            if (right.isError()) {
                return right;
            }
            BinaryOperator op = expr.getOperator();
            if (op == BinaryOperator.CONCAT) {
                return CellValue.string(left.toDisplayString() + right.toDisplayString());
            }
            if (op.isComparison()) {
                return CellValue.bool(compare(op, left, right));
            }
            Double a = Coercion.toNumber(left);
            Double b = Coercion.toNumber(right);
            if (a == null || b == null) {
                return VALUE_ERROR;
            }
            switch (op) {
                case ADD:
                    return Coercion.numberResult(a + b);
                case SUBTRACT:
                    return Coercion.numberResult(a - b);
                case MULTIPLY:
                    return Coercion.numberResult(a * b);
                case DIVIDE:
                    if (b == 0) {
                        return CellValue.error(ErrorType.DIV_ZERO);
                    }
                    return Coercion.numberResult(a / b);
                case POWER:
                    return Coercion.numberResult(Math.pow(a, b));
                default:
                    throw new IllegalStateException("Unknown binary operator " + op);
            }
        }

        @Override
        public CellValue visitFunctionCall(FunctionCallExpr expr) {
            if (expr.getName().equals("IF")) {
                return evaluateIf(expr.getArguments());
            }
            SpreadsheetFunction function = functions.lookup(expr.getName());
            if (function == null) {
                return CellValue.error(ErrorType.NAME);
            }
            List<FunctionArgument> args = new ArrayList<>(expr.getArguments().size());
            for (Expr arg : expr.getArguments()) {
                if (arg instanceof RangeExpr) {
                    args.add(FunctionArgument.range(resolveRange((RangeExpr) arg)));
                } else {
                    args.add(FunctionArgument.scalar(arg.accept(this)));
                }
            }
            return function.apply(args);
        }

        @Override
        public CellValue visitName(NameExpr expr) {
            return CellValue.error(ErrorType.NAME);
        }

        // Only the chosen branch is evaluated.
        private CellValue evaluateIf(List<Expr> args) {
            if (args.size() < 2 || args.size() > 3) {
                return VALUE_ERROR;
            }
            CellValue condition = args.get(0).accept(this);
            if (condition.isError()) {
                return condition;
            }
            Boolean test = Coercion.toBoolean(condition);
            if (test == null) {
                return VALUE_ERROR;
            }
            if (test) {
                return args.get(1).accept(this);
            }
            return args.size() == 3 ? args.get(2).accept(this) : CellValue.FALSE;
        }

        private List<CellValue> resolveRange(RangeExpr range) {
            return resolver.resolveRange(range.toCellRange());
        }
    }

    /**
     * Ordering used by comparison operators: booleans and empty compare as numbers,
     * numbers sort before text, text compares case-insensitively.
     */
    static boolean compare(BinaryOperator op, CellValue left, CellValue right) {
        int cmp = compareValues(left, right);
        switch (op) {
            case EQUAL:
                return cmp == 0;
            case NOT_EQUAL:
                return cmp != 0;
            case LESS_THAN:
                return cmp < 0;
            case LESS_THAN_OR_EQUAL:
                return cmp <= 0;
            case GREATER_THAN:
                return cmp > 0;
            case GREATER_THAN_OR_EQUAL:
                return cmp >= 0;
            default:
                throw new IllegalStateException("Not a comparison: " + op);
        }
    }

    private static int compareValues(CellValue left, CellValue right) {
        boolean leftText = left.isString() || (left.isEmpty() && right.isString());
        boolean rightText = right.isString() || (right.isEmpty() && left.isString());
        if (leftText && rightText) {
            return String.CASE_INSENSITIVE_ORDER.compare(left.toDisplayString(), right.toDisplayString());
        }
        if (leftText) {
            return 1;
        }
        if (rightText) {
            return -1;
        }
        // -0 and 0 are equal
        double l = Coercion.toNumber(left);
        double r = Coercion.toNumber(right);
        return l < r ? -1 : (l == r ? 0 : 1);
    }
}
