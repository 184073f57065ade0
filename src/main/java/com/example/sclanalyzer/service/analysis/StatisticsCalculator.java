package com.example.sclanalyzer.service.analysis;

import com.example.sclanalyzer.model.AnalysisStatistics;
import com.example.sclanalyzer.service.extraction.TagExtraction;
import org.springframework.stereotype.Component;

/**
 * Подсчитывает статистику строк и тегов фрагмента.
 */
@Component
public class StatisticsCalculator {

    /**
     * @param code        исходный код (с комментариями)
     * @param extraction  результат извлечения тегов
     * @param assignments количество выполненных присваиваний
     */
    public AnalysisStatistics calculate(String code, TagExtraction extraction, int assignments) {
        String[] lines = code.split("\n", -1);
        int codeLines = 0;
        int commentLines = 0;
        int emptyLines = 0;

        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                emptyLines++;
            } else if (trimmed.startsWith("//") || trimmed.startsWith("(*") || trimmed.startsWith("{")) {
                commentLines++;
            } else {
                codeLines++;
            }
        }

        int inSnapshot = extraction.getTags().size();
        int notInSnapshot = extraction.getUnresolvedIdentifiers().size();

        return AnalysisStatistics.builder()
                .totalLines(lines.length)
                .codeLines(codeLines)
                .commentLines(commentLines)
                .emptyLines(emptyLines)
                .tagsFound(inSnapshot + notInSnapshot)
                .tagsInSnapshot(inSnapshot)
                .tagsNotInSnapshot(notInSnapshot)
                .assignmentsExecuted(assignments)
                .build();
    }
}
