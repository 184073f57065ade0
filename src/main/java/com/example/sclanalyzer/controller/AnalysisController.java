package com.example.sclanalyzer.controller;

import com.example.sclanalyzer.dto.AnalysisRequest;
import com.example.sclanalyzer.dto.AnalysisResponse;
import com.example.sclanalyzer.model.AnalysisResult;
import com.example.sclanalyzer.service.analysis.AnalysisResultMapper;
import com.example.sclanalyzer.service.analysis.SclAnalysisService;
import com.example.sclanalyzer.service.narrative.AnalysisReportGenerator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API контроллер для анализа логики SCL.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AnalysisController {

    private final SclAnalysisService analysisService;
    private final AnalysisResultMapper resultMapper;
    private final AnalysisReportGenerator reportGenerator;

    /**
     * Анализирует фрагмент кода на переданном снимке тегов.
     *
     * POST /api/v1/analyze
     */
    @PostMapping("/analyze")
    public ResponseEntity<AnalysisResponse> analyze(@RequestBody @Valid AnalysisRequest request) {
        log.info("Received analysis request: {} chars, {} tags",
                request.getCode().length(), request.getTags() != null ? request.getTags().size() : 0);

        AnalysisResult result = analysisService.analyze(request.getCode(), resultMapper.toSnapshot(request));
        return ResponseEntity.ok(resultMapper.toDto(result));
    }

    /**
     * Анализирует фрагмент и возвращает Markdown отчёт.
     *
     * POST /api/v1/analyze/report
     */
    @PostMapping("/analyze/report")
    public ResponseEntity<String> report(@RequestBody @Valid AnalysisRequest request) {
        log.info("Received report request: {} chars", request.getCode().length());

        AnalysisResult result = analysisService.analyze(request.getCode(), resultMapper.toSnapshot(request));
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType("text/markdown; charset=utf-8"))
                .body(reportGenerator.generate(result));
    }

    /**
     * Health check эндпоинт.
     *
     * GET /api/v1/health
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
