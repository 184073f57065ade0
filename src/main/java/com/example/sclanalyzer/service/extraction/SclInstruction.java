package com.example.sclanalyzer.service.extraction;

import com.example.sclanalyzer.model.ConstructType;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Каталог стандартных таймеров и счётчиков IEC 61131-3 с их описаниями.
 */
@Getter
@RequiredArgsConstructor
public enum SclInstruction {
    TON(ConstructType.TIMER, "Timer TON: liga saída após tempo (delay on)"),
    TOF(ConstructType.TIMER, "Timer TOF: desliga saída após tempo (delay off)"),
    TP(ConstructType.TIMER, "Timer TP: gera pulso com duração definida"),
    TONR(ConstructType.TIMER, "Timer TONR: timer com retenção"),

    CTU(ConstructType.COUNTER, "Contador CTU: incrementa a cada pulso"),
    CTD(ConstructType.COUNTER, "Contador CTD: decrementa a cada pulso"),
    CTUD(ConstructType.COUNTER, "Contador CTUD: conta para cima e para baixo");

    static final Pattern TIMER_PATTERN =
            Pattern.compile("\\b(TON|TOF|TP|TONR)\\b", Pattern.CASE_INSENSITIVE);
    static final Pattern COUNTER_PATTERN =
            Pattern.compile("\\b(CTU|CTD|CTUD)\\b", Pattern.CASE_INSENSITIVE);

    private final ConstructType category;
    private final String description;

    /**
     * Первая по тексту инструкция заданной категории (TIMER или COUNTER).
     *
     * @param cleanCode код без комментариев и строковых литералов
     */
    public static Optional<SclInstruction> detect(String cleanCode, ConstructType category) {
        Pattern pattern;
        if (category == ConstructType.TIMER) {
            pattern = TIMER_PATTERN;
        } else if (category == ConstructType.COUNTER) {
            pattern = COUNTER_PATTERN;
        } else {
            return Optional.empty();
        }
        Matcher matcher = pattern.matcher(cleanCode);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(valueOf(matcher.group(1).toUpperCase(Locale.ROOT)));
    }
}
