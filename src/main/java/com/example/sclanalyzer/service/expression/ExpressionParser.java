package com.example.sclanalyzer.service.expression;

import com.example.sclanalyzer.model.SclValue;
import com.example.sclanalyzer.service.expression.Expr.ExprInterface;

import java.util.List;

/**
 * Рекурсивный спуск по грамматике выражений SCL.
 * <pre>
 * expression     → or
 * or             → and ( OR and )*
 * and            → equality ( AND equality )*
 * equality       → relational ( ( "=" | "&lt;&gt;" | XOR ) relational )*
 * relational     → additive ( ( "&lt;" | "&gt;" | "&lt;=" | "&gt;=" ) additive )*
 * additive       → multiplicative ( ( "+" | "-" ) multiplicative )*
 * multiplicative → unary ( ( "*" | "/" | MOD ) unary )*
 * unary          → ( NOT | "-" | "+" ) unary | primary
 * primary        → NUMBER | TEXT | TRUE | FALSE | IDENTIFIER | TAG_REFERENCE | "(" expression ")"
 * </pre>
 * Глубина вложенности (скобки, унарные операторы) и число операторов ограничены:
 * дерево разбора обходится рекурсивно, поэтому слишком глубокое выражение
 * отклоняется с {@link ExpressionException} ещё при разборе.
 */
public class ExpressionParser {
    static final int MAX_NESTING = 256;
    static final int MAX_OPERATORS = 1024;

    private final List<Token> tokens;
    private int current = 0;
    private int nesting = 0;
    private int operators = 0;

    public ExpressionParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static ExprInterface parse(String source) {
        return new ExpressionParser(new ExpressionLexer(source).tokenize()).parse();
    }

    public ExprInterface parse() {
        if (check(TokenType.EOF)) {
            throw error(peek(), "Empty expression.");
        }
        ExprInterface expr = expression();
        if (!isAtEnd()) {
            throw error(peek(), "Unexpected token after expression.");
        }
        return expr;
    }

    private ExprInterface expression() {
        return or();
    }

    private ExprInterface or() {
        ExprInterface expr = and();
        while (match(TokenType.OR)) {
            Token operator = countOperator(previous());
            ExprInterface right = and();
            expr = new Expr.Logical(expr, operator, right);
        }
        return expr;
    }

    private ExprInterface and() {
        ExprInterface expr = equality();
        while (match(TokenType.AND)) {
            Token operator = countOperator(previous());
            ExprInterface right = equality();
            expr = new Expr.Logical(expr, operator, right);
        }
        return expr;
    }

    private ExprInterface equality() {
        ExprInterface expr = relational();
        while (match(TokenType.EQUAL, TokenType.NOT_EQUAL, TokenType.XOR)) {
            Token operator = countOperator(previous());
            ExprInterface right = relational();
            expr = new Expr.Binary(expr, operator, right);
        }
        return expr;
    }

    private ExprInterface relational() {
        ExprInterface expr = additive();
        while (match(TokenType.LESS, TokenType.LESS_EQUAL, TokenType.GREATER, TokenType.GREATER_EQUAL)) {
            Token operator = countOperator(previous());
            ExprInterface right = additive();
            expr = new Expr.Binary(expr, operator, right);
        }
        return expr;
    }

    private ExprInterface additive() {
        ExprInterface expr = multiplicative();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token operator = countOperator(previous());
            ExprInterface right = multiplicative();
            expr = new Expr.Binary(expr, operator, right);
        }
        return expr;
    }

    private ExprInterface multiplicative() {
        ExprInterface expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.MOD)) {
            Token operator = countOperator(previous());
            ExprInterface right = unary();
            expr = new Expr.Binary(expr, operator, right);
        }
        return expr;
    }

    private ExprInterface unary() {
        if (match(TokenType.NOT, TokenType.MINUS, TokenType.PLUS)) {
            Token operator = countOperator(previous());
            enterNesting(operator);
            ExprInterface right = unary();
            nesting--;
            return new Expr.Unary(operator, right);
        }
        return primary();
    }

    private ExprInterface primary() {
        if (match(TokenType.TRUE)) return new Expr.Literal(SclValue.bool(true));
        if (match(TokenType.FALSE)) return new Expr.Literal(SclValue.bool(false));
        if (match(TokenType.NUMBER)) return new Expr.Literal(SclValue.number((Double) previous().literal));
        if (match(TokenType.TEXT)) return new Expr.Literal(SclValue.text((String) previous().literal));
        if (match(TokenType.IDENTIFIER)) {
            if (check(TokenType.LEFT_PAREN)) {
                throw error(peek(), "Function calls are not supported: " + previous().lexeme);
            }
            return new Expr.Reference((String) previous().literal, false);
        }
        if (match(TokenType.TAG_REFERENCE)) return new Expr.Reference((String) previous().literal, true);
        if (match(TokenType.LEFT_PAREN)) {
            enterNesting(previous());
            ExprInterface expr = expression();
            consume(TokenType.RIGHT_PAREN, "Expect ')' after expression.");
            nesting--;
            return expr;
        }
        throw error(peek(), "Expect expression.");
    }

    private void enterNesting(Token token) {
        if (++nesting > MAX_NESTING) {
            throw error(token, "Expression nested deeper than " + MAX_NESTING + " levels.");
        }
    }

    private Token countOperator(Token operator) {
        if (++operators > MAX_OPERATORS) {
            throw error(operator, "Expression has more than " + MAX_OPERATORS + " operators.");
        }
        return operator;
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        return peek().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private ExpressionException error(Token token, String message) {
        String where = token.type == TokenType.EOF ? "at end" : "at '" + token.lexeme + "'";
        return new ExpressionException("[col " + (token.position + 1) + "] " + where + ": " + message);
    }
}
