package com.gridcore.engine.formula.ast;

public interface ExprVisitor<R> {
    R visitLiteral(LiteralExpr expr);

    R visitReference(ReferenceExpr expr);

    R visitRange(RangeExpr expr);

    R visitUnary(UnaryExpr expr);

    R visitBinary(BinaryExpr expr);

    R visitFunctionCall(FunctionCallExpr expr);

    R visitName(NameExpr expr);
}
