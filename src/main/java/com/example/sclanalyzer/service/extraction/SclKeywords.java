package com.example.sclanalyzer.service.extraction;

import java.util.Locale;
import java.util.Set;

/**
 * Зарезервированные слова SCL: управляющие конструкции, объявления, типы данных,
 * операторы, стандартные функции и инструкции. Такие слова никогда не считаются тегами.
 */
public final class SclKeywords {

    private static final Set<String> KEYWORDS = Set.of(
            "IF", "THEN", "ELSIF", "ELSE", "END_IF",
            "CASE", "OF", "END_CASE",
            "FOR", "TO", "BY", "DO", "END_FOR",
            "WHILE", "END_WHILE",
            "REPEAT", "UNTIL", "END_REPEAT",
            "EXIT", "CONTINUE", "RETURN", "GOTO",
            "FUNCTION", "FUNCTION_BLOCK", "END_FUNCTION", "END_FUNCTION_BLOCK",
            "PROGRAM", "END_PROGRAM",
            "VAR", "VAR_INPUT", "VAR_OUTPUT", "VAR_IN_OUT", "VAR_TEMP", "VAR_STATIC", "END_VAR",
            "CONST", "END_CONST", "TYPE", "END_TYPE", "STRUCT", "END_STRUCT",
            "REGION", "END_REGION",
            "BOOL", "BYTE", "WORD", "DWORD", "LWORD",
            "SINT", "INT", "DINT", "LINT", "USINT", "UINT", "UDINT", "ULINT",
            "REAL", "LREAL", "TIME", "DATE", "TIME_OF_DAY", "TOD", "DATE_AND_TIME", "DT",
            "STRING", "WSTRING", "CHAR", "WCHAR", "ARRAY", "POINTER", "REF_TO",
            "AND", "OR", "XOR", "NOT", "TRUE", "FALSE", "NULL", "MOD",
            "ABS", "SQR", "SQRT", "LN", "LOG", "EXP", "SIN", "COS", "TAN",
            "ROUND", "TRUNC", "CEIL", "FLOOR", "MAX", "MIN", "LIMIT", "SEL", "MUX",
            "SHL", "SHR", "ROL", "ROR", "LEN", "LEFT", "RIGHT", "MID", "CONCAT",
            "TON", "TOF", "TP", "TONR", "CTU", "CTD", "CTUD", "R_TRIG", "F_TRIG"
    );

    private SclKeywords() {
    }

    public static boolean isKeyword(String word) {
        return word != null && KEYWORDS.contains(word.toUpperCase(Locale.ROOT));
    }
}
