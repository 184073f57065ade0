package com.example.sclanalyzer.service.narrative;

import com.example.sclanalyzer.model.Diagnostic;
import com.example.sclanalyzer.model.LocalBinding;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Собирает текст объяснения анализа.
 */
@Component
public class ExplanationBuilder {

    /**
     * Шаги по одному на строку, затем блок "Avisos" и блок "Resultados"
     * (только вычисленные переменные).
     */
    public String build(List<String> steps, List<Diagnostic> diagnostics, List<LocalBinding> computed) {
        StringBuilder explanation = new StringBuilder();

        for (String step : steps) {
            explanation.append(step).append("\n");
        }

        if (!diagnostics.isEmpty()) {
            explanation.append("\nAvisos:\n");
            for (Diagnostic diagnostic : diagnostics) {
                explanation.append("⚠ ").append(diagnostic.getMessage()).append("\n");
            }
        }

        if (!computed.isEmpty()) {
            explanation.append("\nResultados:\n");
            for (LocalBinding binding : computed) {
                explanation.append("  ").append(binding.getName())
                        .append(" = ").append(ValueFormatter.format(binding.getValue()))
                        .append(" [").append(binding.getDeclaredType()).append("]\n");
            }
        }

        return explanation.toString().trim();
    }

    /**
     * Краткое описание кода по непустым строкам без комментариев.
     */
    public String summarize(String cleanCode) {
        List<String> lines = Arrays.stream(cleanCode.split("\n"))
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .toList();

        if (lines.isEmpty()) {
            return "Código vazio";
        }
        if (lines.size() == 1) {
            return lines.get(0);
        }
        return "Lógica SCL com " + lines.size() + " linhas";
    }
}
