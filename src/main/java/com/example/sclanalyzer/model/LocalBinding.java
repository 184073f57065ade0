package com.example.sclanalyzer.model;

import lombok.Builder;
import lombok.Value;

/**
 * Имя, доступное при вычислении выражений в рамках одного анализа.
 */
@Value
@Builder
public class LocalBinding {
    /**
     * Имя переменной (уникально в рамках анализа, последняя запись побеждает)
     */
    String name;

    /**
     * Текущее значение; null, если выражение присваивания не удалось вычислить
     */
    SclValue value;

    /**
     * Объявленный (для тегов) или выведенный (для присваиваний) тип
     */
    TagDataType declaredType;

    BindingOrigin origin;

    public boolean hasValue() {
        return value != null;
    }

    public boolean isComputed() {
        return origin == BindingOrigin.COMPUTED;
    }
}
