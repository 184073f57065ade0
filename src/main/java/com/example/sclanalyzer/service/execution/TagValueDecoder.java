package com.example.sclanalyzer.service.execution;

import com.example.sclanalyzer.model.SclValue;
import com.example.sclanalyzer.model.TagDataType;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Декодирует текстовое значение тега из снимка по его объявленному типу.
 */
public final class TagValueDecoder {

    private static final Pattern INTEGER_PREFIX = Pattern.compile("^[+-]?\\d+");
    private static final Pattern REAL_PREFIX =
            Pattern.compile("^[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern NUMERIC =
            Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private TagValueDecoder() {
    }

    /**
     * <ul>
     *   <li>BOOL: истина только для "TRUE" или "1"</li>
     *   <li>целочисленные типы: ведущее целое, 0 при ошибке разбора</li>
     *   <li>REAL/LREAL: ведущее число с плавающей точкой, 0 при ошибке разбора</li>
     *   <li>прочие: TRUE/FALSE, затем число (пустая строка даёт 0), иначе текст</li>
     * </ul>
     */
    public static SclValue decode(String rawValue, TagDataType declaredType) {
        String raw = rawValue == null ? "" : rawValue.trim();
        TagDataType type = declaredType == null ? TagDataType.UNKNOWN : declaredType;

        if (type == TagDataType.BOOL) {
            return SclValue.bool("TRUE".equalsIgnoreCase(raw) || "1".equals(raw));
        }
        if (type.isIntegerFamily()) {
            return SclValue.number(parsePrefix(INTEGER_PREFIX, raw));
        }
        if (type.isRealFamily()) {
            return SclValue.number(parsePrefix(REAL_PREFIX, raw));
        }
        return decodeUntyped(raw, rawValue);
    }

    private static SclValue decodeUntyped(String trimmed, String rawValue) {
        String upper = trimmed.toUpperCase(Locale.ROOT);
        if ("TRUE".equals(upper)) {
            return SclValue.bool(true);
        }
        if ("FALSE".equals(upper)) {
            return SclValue.bool(false);
        }
        if (trimmed.isEmpty()) {
            return SclValue.number(0);
        }
        if (NUMERIC.matcher(trimmed).matches()) {
            return SclValue.number(Double.parseDouble(trimmed));
        }
        return SclValue.text(rawValue);
    }

    private static double parsePrefix(Pattern pattern, String raw) {
        Matcher matcher = pattern.matcher(raw);
        if (!matcher.find()) {
            return 0;
        }
        double parsed = Double.parseDouble(matcher.group());
        return Double.isFinite(parsed) ? parsed : 0;
    }
}
