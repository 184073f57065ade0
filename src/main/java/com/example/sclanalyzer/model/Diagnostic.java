package com.example.sclanalyzer.model;

import lombok.Builder;
import lombok.Value;

/**
 * Нефатальная аномалия, обнаруженная во время анализа.
 */
@Value
@Builder
public class Diagnostic {

    public enum Severity { INFO, WARNING, ERROR }

    public enum Type {
        /**
         * Деление на ноль (результат ±∞)
         */
        DIVISION_BY_ZERO,

        /**
         * Результат NaN
         */
        NAN_RESULT,

        /**
         * Непредвиденная ошибка анализа
         */
        RUNTIME_ERROR
    }

    Severity severity;

    Type type;

    String message;

    /**
     * Переменная, присваивание которой вызвало аномалию (если применимо)
     */
    String variableName;
}
