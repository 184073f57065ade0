package com.example.sclanalyzer.service.expression;

import com.example.sclanalyzer.model.SclValue;

/**
 * Узлы AST выражения SCL.
 */
public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitLiteralExpr(Literal expr);
        R visitReferenceExpr(Reference expr);
        R visitUnaryExpr(Unary expr);
        R visitBinaryExpr(Binary expr);
        R visitLogicalExpr(Logical expr);
    }

    public static final class Literal implements ExprInterface {
        public final SclValue value;

        public Literal(SclValue value) {
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }
    }

    /**
     * Ссылка на переменную: голый идентификатор или тег в кавычках.
     */
    public static final class Reference implements ExprInterface {
        public final String name;
        public final boolean quoted;

        public Reference(String name, boolean quoted) {
            this.name = name;
            this.quoted = quoted;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitReferenceExpr(this);
        }
    }

    public static final class Unary implements ExprInterface {
        public final Token operator;
        public final ExprInterface right;

        public Unary(Token operator, ExprInterface right) {
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }
    }

    public static final class Binary implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Binary(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }
    }

    /**
     * AND / OR с коротким замыканием.
     */
    public static final class Logical implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Logical(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLogicalExpr(this);
        }
    }
}
