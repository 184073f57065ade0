package com.example.sclanalyzer.service.expression;

/**
 * Ошибка лексического разбора, синтаксического разбора или вычисления выражения SCL.
 */
public class ExpressionException extends RuntimeException {

    public ExpressionException(String message) {
        super(message);
    }
}
