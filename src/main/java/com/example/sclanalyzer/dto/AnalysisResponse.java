package com.example.sclanalyzer.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Ответ с результатами анализа.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisResponse {
    /**
     * Статус выполнения
     */
    private AnalysisStatus status;

    /**
     * Доминирующая конструкция (IF, FOR, ..., PLAIN)
     */
    private String classifiedType;

    private String summary;

    /**
     * Текст объяснения
     */
    private String narrative;

    private List<TagReferenceDto> tagsReferenced;

    private List<String> unresolvedIdentifiers;

    private List<AssignmentDto> assignments;

    /**
     * Последнее выполненное присваивание
     */
    private AssignmentDto lastAssignment;

    private List<DiagnosticDto> diagnostics;

    private StatisticsDto statistics;

    public enum AnalysisStatus {
        COMPLETED,
        FAILED
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TagReferenceDto {
        private String name;
        private String declaredType;
        private String value;
        private boolean foundInSnapshot;
        private String address;
        private String quality;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AssignmentDto {
        private String variableName;
        /**
         * Boolean, Long, Double или String; null, если выражение не вычислено
         */
        private Object value;
        /**
         * Значение в формате объяснения ("TRUE", "2.50", "∞ (div/0)")
         */
        private String displayValue;
        private String inferredType;
        private String sourceExpression;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DiagnosticDto {
        private String severity;
        private String type;
        private String message;
        private String variableName;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StatisticsDto {
        private int totalLines;
        private int codeLines;
        private int commentLines;
        private int emptyLines;
        private int tagsFound;
        private int tagsInSnapshot;
        private int tagsNotInSnapshot;
        private int assignmentsExecuted;
    }
}
