package com.example.sclanalyzer.model;

import lombok.Builder;
import lombok.Value;

/**
 * Статистика анализа фрагмента кода.
 */
@Value
@Builder
public class AnalysisStatistics {
    int totalLines;

    int codeLines;

    /**
     * Строки, начинающиеся с //, (* или {
     */
    int commentLines;

    int emptyLines;

    /**
     * Различные идентификаторы-кандидаты в теги (найденные и не найденные)
     */
    int tagsFound;

    int tagsInSnapshot;

    int tagsNotInSnapshot;

    int assignmentsExecuted;
}
