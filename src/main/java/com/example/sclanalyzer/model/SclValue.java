package com.example.sclanalyzer.model;

import lombok.EqualsAndHashCode;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Динамически типизированное значение при вычислении выражений SCL: BOOL, число или текст.
 * Все числа хранятся как double, целочисленность определяется по значению.
 */
@EqualsAndHashCode
public final class SclValue {

    public enum Kind { BOOL, NUMBER, TEXT }

    private static final Pattern NUMERIC_TEXT =
            Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private static final SclValue TRUE = new SclValue(Kind.BOOL, Boolean.TRUE);
    private static final SclValue FALSE = new SclValue(Kind.BOOL, Boolean.FALSE);

    private final Kind kind;
    private final Object value;

    private SclValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static SclValue bool(boolean b) { return b ? TRUE : FALSE; }
    public static SclValue number(double d) { return new SclValue(Kind.NUMBER, d); }
    public static SclValue text(String s) { return new SclValue(Kind.TEXT, s == null ? "" : s); }

    public Kind getKind() { return kind; }

    public boolean isBool() { return kind == Kind.BOOL; }
    public boolean isNumber() { return kind == Kind.NUMBER; }
    public boolean isText() { return kind == Kind.TEXT; }

    public boolean asBool() {
        if (kind != Kind.BOOL) throw new IllegalStateException("Expected BOOL, got " + kind);
        return (Boolean) value;
    }

    public double asNumber() {
        if (kind != Kind.NUMBER) throw new IllegalStateException("Expected NUMBER, got " + kind);
        return (Double) value;
    }

    public String asText() {
        if (kind != Kind.TEXT) throw new IllegalStateException("Expected TEXT, got " + kind);
        return (String) value;
    }

    /**
     * Числовое приведение: BOOL → 1/0, пустой текст → 0, нечисловой текст → NaN.
     */
    public double toNumber() {
        switch (kind) {
            case BOOL:
                return asBool() ? 1 : 0;
            case NUMBER:
                return asNumber();
            default:
                String text = asText().trim();
                if (text.isEmpty()) {
                    return 0;
                }
                return NUMERIC_TEXT.matcher(text).matches() ? Double.parseDouble(text) : Double.NaN;
        }
    }

    /**
     * Истинность для логических операторов: ненулевое число, непустой текст.
     */
    public boolean isTruthy() {
        switch (kind) {
            case BOOL:
                return asBool();
            case NUMBER:
                double d = asNumber();
                return d != 0 && !Double.isNaN(d);
            default:
                return !asText().isEmpty();
        }
    }

    public boolean isNaN() {
        return kind == Kind.NUMBER && Double.isNaN(asNumber());
    }

    public boolean isInfinite() {
        return kind == Kind.NUMBER && Double.isInfinite(asNumber());
    }

    public boolean isIntegral() {
        if (kind != Kind.NUMBER) return false;
        double d = asNumber();
        return Double.isFinite(d) && d == Math.rint(d);
    }

    /**
     * Текстовое представление для конкатенации строк.
     */
    public String toText() {
        switch (kind) {
            case BOOL:
                return asBool() ? "true" : "false";
            case NUMBER:
                if (isIntegral() && Math.abs(asNumber()) < 1e15) {
                    return Long.toString((long) asNumber());
                }
                return Double.toString(asNumber());
            default:
                return asText();
        }
    }

    /**
     * Значение в виде примитива Java для сериализации (Boolean, Long, Double или String).
     */
    public Object toPlainObject() {
        if (kind == Kind.NUMBER && isIntegral() && Math.abs(asNumber()) < 1e15) {
            return (long) asNumber();
        }
        return value;
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase(Locale.ROOT) + ":" + toText();
    }
}
