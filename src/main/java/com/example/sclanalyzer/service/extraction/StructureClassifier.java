package com.example.sclanalyzer.service.extraction;

import com.example.sclanalyzer.model.ConstructType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Определяет доминирующую конструкцию фрагмента по ключевым словам с фиксированным приоритетом:
 * IF &gt; FOR &gt; WHILE &gt; REPEAT &gt; CASE &gt; TIMER &gt; COUNTER &gt; PLAIN.
 * <p>
 * Вложенные конструкции отдельно не классифицируются: решает первая сработавшая категория.
 */
@Slf4j
@Component
public class StructureClassifier {

    private static final Map<ConstructType, Pattern> MARKERS = new LinkedHashMap<>();

    static {
        MARKERS.put(ConstructType.IF, keyword("IF"));
        MARKERS.put(ConstructType.FOR, keyword("FOR"));
        MARKERS.put(ConstructType.WHILE, keyword("WHILE"));
        MARKERS.put(ConstructType.REPEAT, keyword("REPEAT"));
        MARKERS.put(ConstructType.CASE, keyword("CASE"));
        MARKERS.put(ConstructType.TIMER, SclInstruction.TIMER_PATTERN);
        MARKERS.put(ConstructType.COUNTER, SclInstruction.COUNTER_PATTERN);
    }

    /**
     * @param cleanCode код после {@link SclSourceCleaner#clean(String)}
     * @return ровно одна категория конструкции
     */
    public ConstructType classify(String cleanCode) {
        for (Map.Entry<ConstructType, Pattern> marker : MARKERS.entrySet()) {
            if (marker.getValue().matcher(cleanCode).find()) {
                log.debug("Classified snippet as {}", marker.getKey());
                return marker.getKey();
            }
        }
        log.debug("Classified snippet as {}", ConstructType.PLAIN);
        return ConstructType.PLAIN;
    }

    private static Pattern keyword(String word) {
        return Pattern.compile("\\b" + word + "\\b", Pattern.CASE_INSENSITIVE);
    }
}
