package com.example.sclanalyzer.cli;

import com.example.sclanalyzer.dto.TagSnapshotDto;
import com.example.sclanalyzer.model.AnalysisResult;
import com.example.sclanalyzer.model.TagSnapshotIndex;
import com.example.sclanalyzer.service.analysis.AnalysisResultMapper;
import com.example.sclanalyzer.service.analysis.SclAnalysisService;
import com.example.sclanalyzer.service.narrative.AnalysisReportGenerator;
import com.example.sclanalyzer.service.narrative.ValueFormatter;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * CLI интерфейс для запуска анализа из командной строки.
 *
 * Примеры использования:
 *
 * java -jar scl-logic-analyzer.jar --scl=./motor.scl --tags=./tags.json
 *
 * java -jar scl-logic-analyzer.jar --scl=./motor.scl --tags=./tags.json --output=./docs/MOTOR.md
 *
 * Файл тегов: массив {@code [{"tag_name": ..., "value": ..., "data_type": ...}]}
 * или объект {@code {"Sensor_1": {"value": ..., "data_type": ...}}}, где ключ задаёт имя для поиска.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommandLineRunner implements ApplicationRunner {

    private final SclAnalysisService analysisService;
    private final AnalysisResultMapper resultMapper;
    private final AnalysisReportGenerator reportGenerator;
    private final ObjectMapper objectMapper;

    @Override
    public void run(ApplicationArguments args) throws Exception {
        // Без параметра --scl запущен REST API режим
        if (!args.containsOption("scl")) {
            log.info("Starting in REST API mode. Use --scl=<file> for CLI mode.");
            return;
        }

        log.info("Starting in CLI mode");

        try {
            boolean success = runCli(args);
            System.exit(success ? 0 : 1);
        } catch (Exception e) {
            log.error("CLI execution failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    private boolean runCli(ApplicationArguments args) throws IOException {
        Path sclFile = Path.of(getRequiredOption(args, "scl"));
        String tagsFile = getOption(args, "tags", null);
        String output = getOption(args, "output", null);

        printBanner();

        System.out.println("SCL file: " + sclFile);
        System.out.println("Tags:     " + (tagsFile != null ? tagsFile : "none"));
        System.out.println();

        String code = Files.readString(sclFile);
        TagSnapshotIndex snapshot = tagsFile != null ? readSnapshot(Path.of(tagsFile)) : TagSnapshotIndex.empty();

        AnalysisResult result = analysisService.analyze(code, snapshot);

        System.out.println(result.getNarrative());

        Path reportPath = output != null
                ? reportGenerator.save(result, Path.of(output))
                : reportGenerator.generateAndSave(result);
        System.out.println();
        System.out.println("Report saved to: " + reportPath.toAbsolutePath());

        printSummary(result);
        return result.isSuccess();
    }

    /**
     * Читает снимок тегов из JSON: массив тегов или объект ключ → тег.
     */
    TagSnapshotIndex readSnapshot(Path file) throws IOException {
        JsonNode root = objectMapper.readTree(file.toFile());
        if (root.isArray()) {
            List<TagSnapshotDto> tags = objectMapper.convertValue(root, new TypeReference<List<TagSnapshotDto>>() {});
            return resultMapper.toSnapshot(tags);
        }
        Map<String, TagSnapshotDto> keyed =
                objectMapper.convertValue(root, new TypeReference<Map<String, TagSnapshotDto>>() {});
        return resultMapper.toSnapshot(keyed);
    }

    private void printBanner() {
        System.out.println();
        System.out.println("╔═══════════════════════════════════════════════════════════╗");
        System.out.println("║               SCL Logic Analyzer                          ║");
        System.out.println("║         Step-by-step explanation of PLC logic             ║");
        System.out.println("╚═══════════════════════════════════════════════════════════╝");
        System.out.println();
    }

    private void printSummary(AnalysisResult result) {
        System.out.println();
        System.out.println("═══════════════════════════════════════════════════════════");
        System.out.println("                      ANALYSIS SUMMARY                      ");
        System.out.println("═══════════════════════════════════════════════════════════");
        System.out.println();
        System.out.println("  Construct:            " + result.getClassifiedType());
        System.out.println("  Summary:              " + result.getSummary());
        System.out.println("  Tags referenced:      " + result.getTagsReferenced().size());
        System.out.println("  Not in snapshot:      " + result.getUnresolvedIdentifiers().size());
        System.out.println("  Assignments:          " + result.getAssignments().size());
        System.out.println("  Diagnostics:          " + result.getDiagnostics().size());
        System.out.println();

        result.getLastAssignment().ifPresent(last ->
                System.out.println("  Result: " + last.getVariableName() + " = "
                        + ValueFormatter.format(last.getValue()) + " [" + last.getInferredType() + "]"));

        System.out.println();
        System.out.println("═══════════════════════════════════════════════════════════");
        System.out.println(result.isSuccess()
                ? "                    ANALYSIS COMPLETED                      "
                : "                     ANALYSIS FAILED                        ");
        System.out.println("═══════════════════════════════════════════════════════════");
        System.out.println();
    }

    private String getRequiredOption(ApplicationArguments args, String name) {
        if (!args.containsOption(name)) {
            throw new IllegalArgumentException("Required option --" + name + " is missing");
        }
        return args.getOptionValues(name).get(0);
    }

    private String getOption(ApplicationArguments args, String name, String defaultValue) {
        if (args.containsOption(name)) {
            return args.getOptionValues(name).get(0);
        }
        return defaultValue;
    }
}
