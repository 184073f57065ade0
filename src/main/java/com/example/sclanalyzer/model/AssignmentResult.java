package com.example.sclanalyzer.model;

import lombok.Builder;
import lombok.Value;

/**
 * Результат одного выполненного присваивания {@code target := expression;}.
 */
@Value
@Builder
public class AssignmentResult {
    /**
     * Имя переменной слева от :=
     */
    String variableName;

    /**
     * Вычисленное значение; null означает "нет значения" (ошибка вычисления)
     */
    SclValue value;

    /**
     * Тип, выведенный из значения
     */
    TagDataType inferredType;

    /**
     * Исходное выражение справа от :=
     */
    String sourceExpression;

    public boolean hasValue() {
        return value != null;
    }
}
