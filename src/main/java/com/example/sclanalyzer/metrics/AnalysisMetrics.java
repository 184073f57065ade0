package com.example.sclanalyzer.metrics;

import com.example.sclanalyzer.model.ConstructType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Метрики анализа логики SCL.
 */
@Component
public class AnalysisMetrics {

    private final MeterRegistry meterRegistry;
    private final Timer duration;
    private final Counter completedTotal;
    private final Counter failedTotal;
    private final Counter diagnosticsTotal;
    private final AtomicInteger lastTagsCount;

    public AnalysisMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.duration = Timer.builder("scl.analysis.duration")
            .description("Duration of SCL snippet analysis")
            .register(meterRegistry);

        this.completedTotal = Counter.builder("scl.analysis.completed.total")
            .description("Total number of completed analyses")
            .register(meterRegistry);

        this.failedTotal = Counter.builder("scl.analysis.failed.total")
            .description("Total number of analyses interrupted by an unexpected error")
            .register(meterRegistry);

        this.diagnosticsTotal = Counter.builder("scl.analysis.diagnostics.total")
            .description("Total number of diagnostics raised by analyses")
            .register(meterRegistry);

        this.lastTagsCount = new AtomicInteger(0);
        Gauge.builder("scl.analysis.tags.count", lastTagsCount, AtomicInteger::get)
            .description("Number of snapshot tags referenced by the last analysis")
            .register(meterRegistry);
    }

    /**
     * Создаёт Timer.Sample для измерения времени анализа.
     */
    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Записывает время выполнения анализа.
     */
    public void recordDuration(Timer.Sample sample) {
        sample.stop(duration);
    }

    /**
     * Учитывает классифицированную конструкцию.
     */
    public void recordConstruct(ConstructType type) {
        Counter.builder("scl.analysis.construct")
            .tag("type", type.name())
            .description("Analyses by dominant construct")
            .register(meterRegistry)
            .increment();
    }

    /**
     * Добавляет количество диагностик анализа.
     */
    public void recordDiagnostics(int count) {
        if (count > 0) {
            diagnosticsTotal.increment(count);
        }
    }

    /**
     * Обновляет количество тегов, использованных последним анализом.
     */
    public void setTagsCount(int count) {
        lastTagsCount.set(count);
    }

    /**
     * Отмечает успешное завершение анализа.
     */
    public void recordCompleted() {
        completedTotal.increment();
    }

    /**
     * Отмечает анализ, прерванный непредвиденной ошибкой.
     */
    public void recordFailed() {
        failedTotal.increment();
    }
}
