package com.example.sclanalyzer.model;

import java.util.Locale;

/**
 * Объявленный тип данных тега PLC (и выведенный тип результата присваивания).
 */
public enum TagDataType {
    BOOL,

    BYTE,
    WORD,
    DWORD,
    LWORD,

    SINT,
    INT,
    DINT,
    LINT,
    USINT,
    UINT,
    UDINT,
    ULINT,

    REAL,
    LREAL,

    STRING,
    WSTRING,
    CHAR,
    TIME,
    DATE,

    /**
     * Тип не распознан (или значение не удалось вычислить)
     */
    UNKNOWN;

    /**
     * Целочисленное семейство, включая битовые строки BYTE/WORD/DWORD/LWORD.
     */
    public boolean isIntegerFamily() {
        switch (this) {
            case BYTE:
            case WORD:
            case DWORD:
            case LWORD:
            case SINT:
            case INT:
            case DINT:
            case LINT:
            case USINT:
            case UINT:
            case UDINT:
            case ULINT:
                return true;
            default:
                return false;
        }
    }

    public boolean isRealFamily() {
        return this == REAL || this == LREAL;
    }

    /**
     * Разбирает имя типа из снимка тегов. Неизвестные имена дают {@link #UNKNOWN}.
     */
    public static TagDataType fromName(String name) {
        if (name == null || name.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
