package com.example.sclanalyzer.service.narrative;

import com.example.sclanalyzer.config.OutputConfig;
import com.example.sclanalyzer.model.AnalysisResult;
import com.example.sclanalyzer.model.AnalysisStatistics;
import com.example.sclanalyzer.model.Diagnostic;
import com.example.sclanalyzer.model.LocalBinding;
import com.example.sclanalyzer.model.TagReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Сервис для генерации Markdown отчёта по результату анализа SCL.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisReportGenerator {

    private final OutputConfig outputConfig;

    /**
     * Генерирует отчёт и сохраняет его в каталог вывода.
     *
     * @param result результат анализа
     * @return путь к сохранённому файлу
     */
    public Path generateAndSave(AnalysisResult result) {
        Path outputDir = Path.of(outputConfig.getMarkdown().getPath());
        return save(result, outputDir.resolve(outputConfig.getMarkdown().getDefaultFilename()));
    }

    /**
     * Генерирует отчёт и сохраняет его в указанный файл.
     */
    public Path save(AnalysisResult result, Path outputFile) {
        String markdown = generate(result);

        try {
            Path parent = outputFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(outputFile, markdown);
            log.info("Analysis report saved to: {}", outputFile);
            return outputFile;

        } catch (IOException e) {
            log.error("Error saving analysis report", e);
            throw new RuntimeException("Failed to save analysis report: " + e.getMessage(), e);
        }
    }

    /**
     * Генерирует Markdown отчёт.
     *
     * @param result результат анализа
     * @return Markdown строка
     */
    public String generate(AnalysisResult result) {
        StringBuilder doc = new StringBuilder();

        doc.append("# Анализ логики SCL\n\n");

        doc.append("> - **Конструкция:** ").append(result.getClassifiedType()).append("\n");
        doc.append("> - **Описание:** ").append(escapeMarkdownTableCell(result.getSummary())).append("\n");
        doc.append("> - **Статус:** ").append(result.isSuccess() ? "успешно" : "с ошибкой").append("\n");
        result.getLastAssignment().ifPresent(last -> doc.append("> - **Итог:** `")
                .append(last.getVariableName()).append(" = ")
                .append(ValueFormatter.format(last.getValue())).append("`\n"));
        doc.append("\n");

        appendStatistics(doc, result.getStatistics());
        appendTags(doc, result);

        doc.append("## Трассировка\n\n");
        if (result.getNarrative() == null || result.getNarrative().isBlank()) {
            doc.append("_Нет шагов выполнения_\n\n");
        } else {
            doc.append("```text\n").append(result.getNarrative()).append("\n```\n\n");
        }

        if (!result.getDiagnostics().isEmpty()) {
            doc.append("## Предупреждения\n\n");
            doc.append("| Уровень | Тип | Сообщение |\n");
            doc.append("|---------|-----|-----------|\n");
            for (Diagnostic diagnostic : result.getDiagnostics()) {
                doc.append("| ").append(diagnostic.getSeverity()).append(" | ");
                doc.append(diagnostic.getType()).append(" | ");
                doc.append(escapeMarkdownTableCell(diagnostic.getMessage())).append(" |\n");
            }
            doc.append("\n");
        }

        if (!result.getComputedBindings().isEmpty()) {
            doc.append("## Результаты\n\n");
            doc.append("| Переменная | Значение | Тип |\n");
            doc.append("|------------|----------|-----|\n");
            for (LocalBinding binding : result.getComputedBindings()) {
                doc.append("| `").append(binding.getName()).append("` | ");
                doc.append(escapeMarkdownTableCell(ValueFormatter.format(binding.getValue()))).append(" | ");
                doc.append(binding.getDeclaredType()).append(" |\n");
            }
            doc.append("\n");
        }

        return doc.toString();
    }

    private void appendStatistics(StringBuilder doc, AnalysisStatistics statistics) {
        if (statistics == null) {
            return;
        }
        doc.append("## Статистика\n\n");
        doc.append("| Показатель | Значение |\n");
        doc.append("|------------|----------|\n");
        doc.append("| Всего строк | ").append(statistics.getTotalLines()).append(" |\n");
        doc.append("| Строк кода | ").append(statistics.getCodeLines()).append(" |\n");
        doc.append("| Комментариев | ").append(statistics.getCommentLines()).append(" |\n");
        doc.append("| Пустых строк | ").append(statistics.getEmptyLines()).append(" |\n");
        doc.append("| Идентификаторов | ").append(statistics.getTagsFound()).append(" |\n");
        doc.append("| Найдено в снимке | ").append(statistics.getTagsInSnapshot()).append(" |\n");
        doc.append("| Нет в снимке | ").append(statistics.getTagsNotInSnapshot()).append(" |\n");
        doc.append("| Присваиваний | ").append(statistics.getAssignmentsExecuted()).append(" |\n\n");
    }

    private void appendTags(StringBuilder doc, AnalysisResult result) {
        doc.append("## Теги\n\n");
        if (result.getTagsReferenced().isEmpty()) {
            doc.append("_Теги из снимка не используются_\n\n");
        } else {
            doc.append("| Тег | Тип | Значение | Адрес |\n");
            doc.append("|-----|-----|----------|-------|\n");
            for (TagReference tag : result.getTagsReferenced()) {
                doc.append("| `").append(tag.getName()).append("` | ");
                doc.append(tag.getDeclaredType()).append(" | ");
                doc.append(escapeMarkdownTableCell(tag.getValue())).append(" | ");
                doc.append(escapeMarkdownTableCell(tag.getAddress())).append(" |\n");
            }
            doc.append("\n");
        }

        if (!result.getUnresolvedIdentifiers().isEmpty()) {
            doc.append("**Нет в снимке:** ");
            doc.append(String.join(", ", result.getUnresolvedIdentifiers().stream()
                    .map(name -> "`" + name + "`")
                    .toList()));
            doc.append("\n\n");
        }
    }

    private String escapeMarkdownTableCell(String value) {
        if (value == null) {
            return "-";
        }
        return value.replace("|", "\\|")
                    .replace("`", "\\`")
                    .replace("\n", "<br>");
    }
}
