package com.example.sclanalyzer.service.analysis;

import com.example.sclanalyzer.config.AnalyzerConfig;
import com.example.sclanalyzer.metrics.AnalysisMetrics;
import com.example.sclanalyzer.model.AnalysisResult;
import com.example.sclanalyzer.model.ConstructType;
import com.example.sclanalyzer.model.Diagnostic;
import com.example.sclanalyzer.model.LocalBinding;
import com.example.sclanalyzer.model.TagSnapshotIndex;
import com.example.sclanalyzer.service.execution.ConstructExecutor;
import com.example.sclanalyzer.service.execution.ExecutionContext;
import com.example.sclanalyzer.service.execution.LocalVariableEnvironment;
import com.example.sclanalyzer.service.extraction.SclSourceCleaner;
import com.example.sclanalyzer.service.extraction.StructureClassifier;
import com.example.sclanalyzer.service.extraction.TagExtraction;
import com.example.sclanalyzer.service.extraction.TagExtractor;
import com.example.sclanalyzer.service.narrative.ExplanationBuilder;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Основной сервис анализа фрагмента SCL.
 * <p>
 * Сервис не хранит состояния между вызовами: переменные, шаги и диагностики живут
 * в {@link ExecutionContext}, создаваемом на каждый вызов, поэтому параллельные
 * вызовы безопасны. Анализ никогда не бросает исключений.
 */
@Slf4j
@Service
public class SclAnalysisService {

    private final SclSourceCleaner sourceCleaner;
    private final StructureClassifier structureClassifier;
    private final TagExtractor tagExtractor;
    private final ExplanationBuilder explanationBuilder;
    private final StatisticsCalculator statisticsCalculator;
    private final AnalysisMetrics metrics;
    private final AnalyzerConfig analyzerConfig;
    private final Map<ConstructType, ConstructExecutor> executors = new EnumMap<>(ConstructType.class);

    public SclAnalysisService(SclSourceCleaner sourceCleaner,
                              StructureClassifier structureClassifier,
                              TagExtractor tagExtractor,
                              List<ConstructExecutor> constructExecutors,
                              ExplanationBuilder explanationBuilder,
                              StatisticsCalculator statisticsCalculator,
                              AnalysisMetrics metrics,
                              AnalyzerConfig analyzerConfig) {
        this.sourceCleaner = sourceCleaner;
        this.structureClassifier = structureClassifier;
        this.tagExtractor = tagExtractor;
        this.explanationBuilder = explanationBuilder;
        this.statisticsCalculator = statisticsCalculator;
        this.metrics = metrics;
        this.analyzerConfig = analyzerConfig;
        for (ConstructExecutor executor : constructExecutors) {
            for (ConstructType type : executor.supportedTypes()) {
                executors.put(type, executor);
            }
        }
        for (ConstructType type : ConstructType.values()) {
            if (!executors.containsKey(type)) {
                throw new IllegalStateException("No executor registered for construct " + type);
            }
        }
    }

    /**
     * Анализирует фрагмент кода на снимке тегов.
     *
     * @param code     исходный код SCL (null трактуется как пустой)
     * @param snapshot снимок тегов, только для чтения
     * @return результат анализа; при непредвиденной ошибке success = false и частичная трассировка
     */
    public AnalysisResult analyze(String code, TagSnapshotIndex snapshot) {
        String source = code == null ? "" : code;
        TagSnapshotIndex tags = snapshot == null ? TagSnapshotIndex.empty() : snapshot;

        Timer.Sample sample = metrics.startTimer();
        long startedAt = System.nanoTime();
        log.info("Analyzing SCL snippet: {} chars, {} tags in snapshot", source.length(), tags.size());

        ExecutionContext context = new ExecutionContext(LocalVariableEnvironment.seededFrom(tags));
        String cleanCode = "";
        ConstructType type = ConstructType.PLAIN;
        TagExtraction extraction = TagExtraction.builder().build();
        boolean success = true;

        try {
            cleanCode = sourceCleaner.clean(source);
            type = structureClassifier.classify(cleanCode);
            extraction = tagExtractor.extract(cleanCode, tags);
            executors.get(type).execute(type, cleanCode, context);
        } catch (RuntimeException e) {
            log.error("Unexpected error while analyzing SCL snippet", e);
            success = false;
            context.addDiagnostic(Diagnostic.builder()
                    .severity(Diagnostic.Severity.ERROR)
                    .type(Diagnostic.Type.RUNTIME_ERROR)
                    .message("Erro inesperado na análise: " + e.getMessage())
                    .build());
        }

        List<LocalBinding> computed = context.getEnvironment().computedBindings();
        AnalysisResult result = AnalysisResult.builder()
                .success(success)
                .classifiedType(type)
                .summary(explanationBuilder.summarize(cleanCode))
                .tagsReferenced(extraction.getTags())
                .unresolvedIdentifiers(extraction.getUnresolvedIdentifiers())
                .assignments(context.getAssignments())
                .computedBindings(computed)
                .steps(context.getSteps())
                .narrative(explanationBuilder.build(context.getSteps(), context.getDiagnostics(), computed))
                .diagnostics(context.getDiagnostics())
                .statistics(statisticsCalculator.calculate(source, extraction, context.getAssignments().size()))
                .build();

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startedAt);
        if (elapsed.compareTo(analyzerConfig.getMaxExecutionTime()) > 0) {
            log.warn("Analysis took {} ms, above configured maximum of {} ms",
                    elapsed.toMillis(), analyzerConfig.getMaxExecutionTime().toMillis());
        }

        metrics.recordDuration(sample);
        metrics.recordConstruct(type);
        metrics.recordDiagnostics(result.getDiagnostics().size());
        metrics.setTagsCount(result.getTagsReferenced().size());
        if (success) {
            metrics.recordCompleted();
        } else {
            metrics.recordFailed();
        }

        log.info("Analysis completed: type={}, assignments={}, diagnostics={}",
                type, result.getAssignments().size(), result.getDiagnostics().size());
        return result;
    }
}
