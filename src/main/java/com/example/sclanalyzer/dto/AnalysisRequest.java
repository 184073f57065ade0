package com.example.sclanalyzer.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Запрос на анализ фрагмента SCL.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisRequest {
    /**
     * Исходный код SCL (может быть пустым)
     */
    @NotNull(message = "SCL code is required")
    private String code;

    /**
     * Снимок тегов PLC на момент анализа
     */
    @Valid
    private List<TagSnapshotDto> tags;
}
