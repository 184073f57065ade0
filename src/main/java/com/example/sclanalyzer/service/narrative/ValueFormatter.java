package com.example.sclanalyzer.service.narrative;

import com.example.sclanalyzer.model.SclValue;

import java.util.Locale;

/**
 * Форматирование значений для текста объяснения.
 */
public final class ValueFormatter {

    public static final String NO_VALUE = "?";

    private ValueFormatter() {
    }

    /**
     * {@code ?} для отсутствующего значения, TRUE/FALSE, целые без дробной части,
     * дробные с двумя знаками, специальные маркеры для NaN и ±∞.
     */
    public static String format(SclValue value) {
        if (value == null) {
            return NO_VALUE;
        }
        switch (value.getKind()) {
            case BOOL:
                return value.asBool() ? "TRUE" : "FALSE";
            case NUMBER:
                return formatNumber(value.asNumber());
            default:
                return value.asText();
        }
    }

    private static String formatNumber(double number) {
        if (Double.isNaN(number)) {
            return "NaN (erro)";
        }
        if (number == Double.POSITIVE_INFINITY) {
            return "∞ (div/0)";
        }
        if (number == Double.NEGATIVE_INFINITY) {
            return "-∞ (div/0)";
        }
        if (number == Math.rint(number) && Math.abs(number) < 1e15) {
            return Long.toString((long) number);
        }
        return String.format(Locale.ROOT, "%.2f", number);
    }

    /**
     * Убирает кавычки вокруг имён тегов для отображения.
     */
    public static String display(String text) {
        return text == null ? "" : text.replaceAll("\"([^\"]+)\"", "$1").trim();
    }
}
