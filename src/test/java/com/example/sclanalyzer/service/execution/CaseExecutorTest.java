package com.example.sclanalyzer.service.execution;

import com.example.sclanalyzer.model.ConstructType;
import com.example.sclanalyzer.model.SclValue;
import com.example.sclanalyzer.service.expression.ExpressionEvaluator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.sclanalyzer.service.execution.ExecutorTestSupport.context;
import static org.junit.jupiter.api.Assertions.*;

class CaseExecutorTest {

    private static final String CODE = """
            CASE Mode OF
                1: Speed := 10;
                2: Speed := 20;
            END_CASE;
            """;

    private CaseExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new CaseExecutor(new AssignmentScanner(new ExpressionEvaluator()));
    }

    @Test
    void shouldReportSelectorWithCurrentValue() {
        // Given
        ExecutionContext context = context("Mode", "2", "INT");

        // When
        executor.execute(ConstructType.CASE, CODE, context);

        // Then
        assertEquals(List.of("Seletor: Mode (valor atual: 2)", "Speed := 10 → 10", "Speed := 20 → 20"),
                context.getSteps());
        // ветви не выбираются, побеждает последнее присваивание
        assertEquals(SclValue.number(20), context.getEnvironment().resolve("Speed").orElseThrow().getValue());
    }

    @Test
    void shouldOmitCurrentValueForUnknownSelector() {
        // Given
        ExecutionContext context = context();

        // When
        executor.execute(ConstructType.CASE, CODE, context);

        // Then
        assertEquals("Seletor: Mode", context.getSteps().get(0));
    }

    @Test
    void shouldFallBackWithoutHeader() {
        // Given
        ExecutionContext context = context();

        // When
        executor.execute(ConstructType.CASE, "CASE OF END_CASE;", context);

        // Then
        assertEquals(List.of("Estrutura CASE"), context.getSteps());
    }
}
