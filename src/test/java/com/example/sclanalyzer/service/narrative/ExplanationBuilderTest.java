package com.example.sclanalyzer.service.narrative;

import com.example.sclanalyzer.model.BindingOrigin;
import com.example.sclanalyzer.model.Diagnostic;
import com.example.sclanalyzer.model.LocalBinding;
import com.example.sclanalyzer.model.SclValue;
import com.example.sclanalyzer.model.TagDataType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExplanationBuilderTest {

    private final ExplanationBuilder builder = new ExplanationBuilder();

    @Test
    void shouldAppendWarningsAndResultsAfterSteps() {
        // Given
        Diagnostic warning = Diagnostic.builder()
                .severity(Diagnostic.Severity.WARNING)
                .type(Diagnostic.Type.DIVISION_BY_ZERO)
                .message("X")
                .build();
        LocalBinding motor = LocalBinding.builder()
                .name("Motor")
                .value(SclValue.bool(true))
                .declaredType(TagDataType.BOOL)
                .origin(BindingOrigin.COMPUTED)
                .build();

        // When
        String explanation = builder.build(List.of("a", "b"), List.of(warning), List.of(motor));

        // Then
        assertEquals("a\nb\n\nAvisos:\n⚠ X\n\nResultados:\n  Motor = TRUE [BOOL]", explanation);
    }

    @Test
    void shouldReturnOnlyStepsWhenNothingElse() {
        assertEquals("IF A\nCondição: FALSA",
                builder.build(List.of("IF A", "Condição: FALSA"), List.of(), List.of()));
        assertEquals("", builder.build(List.of(), List.of(), List.of()));
    }

    @Test
    void shouldSummarizeByNonEmptyLines() {
        assertEquals("Código vazio", builder.summarize("  \n\n"));
        assertEquals("Motor := Start;", builder.summarize("\n   Motor := Start;  \n"));
        assertEquals("Lógica SCL com 3 linhas", builder.summarize("""
                A := 1;

                B := 2;
                C := 3;
                """));
    }
}
