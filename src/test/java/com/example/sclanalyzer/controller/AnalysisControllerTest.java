package com.example.sclanalyzer.controller;

import com.example.sclanalyzer.dto.AnalysisRequest;
import com.example.sclanalyzer.dto.TagSnapshotDto;
import com.example.sclanalyzer.model.AnalysisResult;
import com.example.sclanalyzer.model.AnalysisStatistics;
import com.example.sclanalyzer.model.AssignmentResult;
import com.example.sclanalyzer.model.BindingOrigin;
import com.example.sclanalyzer.model.ConstructType;
import com.example.sclanalyzer.model.Diagnostic;
import com.example.sclanalyzer.model.LocalBinding;
import com.example.sclanalyzer.model.SclValue;
import com.example.sclanalyzer.model.TagDataType;
import com.example.sclanalyzer.model.TagReference;
import com.example.sclanalyzer.model.TagSnapshotIndex;
import com.example.sclanalyzer.service.analysis.AnalysisResultMapper;
import com.example.sclanalyzer.service.analysis.SclAnalysisService;
import com.example.sclanalyzer.service.narrative.AnalysisReportGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AnalysisController.class)
@Import(AnalysisResultMapper.class)
class AnalysisControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private SclAnalysisService analysisService;

    @MockBean
    private AnalysisReportGenerator reportGenerator;

    @Test
    void shouldAnalyzeSnippet() throws Exception {
        // Given
        when(analysisService.analyze(anyString(), any())).thenReturn(motorResult());

        AnalysisRequest request = AnalysisRequest.builder()
                .code("Motor := Start;")
                .tags(List.of(TagSnapshotDto.builder()
                        .tagName("Start")
                        .value("TRUE")
                        .dataType("BOOL")
                        .build()))
                .build();

        // When & Then
        mockMvc.perform(post("/api/v1/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.classifiedType").value("PLAIN"))
                .andExpect(jsonPath("$.narrative").value("Motor := Start → TRUE"))
                .andExpect(jsonPath("$.tagsReferenced[0].name").value("Start"))
                .andExpect(jsonPath("$.tagsReferenced[0].declaredType").value("BOOL"))
                .andExpect(jsonPath("$.unresolvedIdentifiers[0]").value("Motor"))
                .andExpect(jsonPath("$.lastAssignment.variableName").value("Motor"))
                .andExpect(jsonPath("$.lastAssignment.value").value(true))
                .andExpect(jsonPath("$.lastAssignment.displayValue").value("TRUE"))
                .andExpect(jsonPath("$.statistics.assignmentsExecuted").value(1));

        ArgumentCaptor<TagSnapshotIndex> snapshot = ArgumentCaptor.forClass(TagSnapshotIndex.class);
        verify(analysisService).analyze(eq("Motor := Start;"), snapshot.capture());
        assertEquals(TagDataType.BOOL, snapshot.getValue().find("start").orElseThrow().getDeclaredType());
    }

    @Test
    void shouldAcceptSnakeCaseTagFields() throws Exception {
        // Given
        when(analysisService.analyze(anyString(), any())).thenReturn(motorResult());

        String body = """
                {
                  "code": "Motor := Start;",
                  "tags": [{"tag_name": "Start", "value": "1", "data_type": "BOOL", "address": "%I0.0"}]
                }
                """;

        // When & Then
        mockMvc.perform(post("/api/v1/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk());

        ArgumentCaptor<TagSnapshotIndex> snapshot = ArgumentCaptor.forClass(TagSnapshotIndex.class);
        verify(analysisService).analyze(anyString(), snapshot.capture());
        assertEquals("%I0.0", snapshot.getValue().find("Start").orElseThrow().getAddress());
    }

    @Test
    void shouldReportFailedAnalysis() throws Exception {
        // Given
        AnalysisResult failed = AnalysisResult.builder()
                .success(false)
                .classifiedType(ConstructType.PLAIN)
                .summary("X := 1;")
                .narrative("Avisos:\n⚠ Erro inesperado na análise: boom")
                .diagnostic(Diagnostic.builder()
                        .severity(Diagnostic.Severity.ERROR)
                        .type(Diagnostic.Type.RUNTIME_ERROR)
                        .message("Erro inesperado na análise: boom")
                        .build())
                .build();
        when(analysisService.analyze(anyString(), any())).thenReturn(failed);

        // When & Then
        mockMvc.perform(post("/api/v1/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\": \"X := 1;\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("FAILED"))
                .andExpect(jsonPath("$.diagnostics[0].type").value("RUNTIME_ERROR"))
                .andExpect(jsonPath("$.diagnostics[0].severity").value("ERROR"));
    }

    @Test
    void shouldReturnBadRequestForMissingCode() throws Exception {
        // Given
        AnalysisRequest request = AnalysisRequest.builder()
                .tags(List.of())
                .build();

        // When & Then
        mockMvc.perform(post("/api/v1/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest());

        verify(analysisService, never()).analyze(any(), any());
    }

    @Test
    void shouldReturnBadRequestForTagWithoutName() throws Exception {
        // When & Then
        mockMvc.perform(post("/api/v1/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\": \"A := 1;\", \"tags\": [{\"value\": \"1\"}]}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldReturnMarkdownReport() throws Exception {
        // Given
        AnalysisResult result = motorResult();
        when(analysisService.analyze(anyString(), any())).thenReturn(result);
        when(reportGenerator.generate(result)).thenReturn("# Анализ логики SCL\n");

        // When & Then
        mockMvc.perform(post("/api/v1/analyze/report")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\": \"Motor := Start;\"}"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith("text/markdown"))
                .andExpect(content().string("# Анализ логики SCL\n"));
    }

    @Test
    void shouldReturnHealthStatus() throws Exception {
        // When & Then
        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(content().string("OK"));
    }

    private AnalysisResult motorResult() {
        SclValue on = SclValue.bool(true);
        return AnalysisResult.builder()
                .success(true)
                .classifiedType(ConstructType.PLAIN)
                .summary("Motor := Start;")
                .tagReferenced(TagReference.builder()
                        .name("Start")
                        .declaredType(TagDataType.BOOL)
                        .value("TRUE")
                        .foundInSnapshot(true)
                        .build())
                .unresolvedIdentifier("Motor")
                .assignment(AssignmentResult.builder()
                        .variableName("Motor")
                        .value(on)
                        .inferredType(TagDataType.BOOL)
                        .sourceExpression("Start")
                        .build())
                .computedBinding(LocalBinding.builder()
                        .name("Motor")
                        .value(on)
                        .declaredType(TagDataType.BOOL)
                        .origin(BindingOrigin.COMPUTED)
                        .build())
                .step("Motor := Start → TRUE")
                .narrative("Motor := Start → TRUE")
                .statistics(AnalysisStatistics.builder()
                        .totalLines(1)
                        .codeLines(1)
                        .tagsFound(2)
                        .tagsInSnapshot(1)
                        .tagsNotInSnapshot(1)
                        .assignmentsExecuted(1)
                        .build())
                .build();
    }
}
