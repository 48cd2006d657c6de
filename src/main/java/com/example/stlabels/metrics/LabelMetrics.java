package com.example.stlabels.metrics;

import com.example.stlabels.model.ActionType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Метрики извлечения меток и журнала версий.
 */
@Component
public class LabelMetrics {

    private final MeterRegistry meterRegistry;
    private final Timer extractionDuration;
    private final Counter labelsExtracted;
    private final Counter linesSkipped;
    private final Counter ledgerConflicts;
    private final AtomicInteger lastLabelsCount;

    public LabelMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.extractionDuration = Timer.builder("labels.extraction.duration")
            .description("Duration of label extraction from ST source")
            .register(meterRegistry);

        this.labelsExtracted = Counter.builder("labels.extracted.total")
            .description("Total number of extracted labels")
            .register(meterRegistry);

        this.linesSkipped = Counter.builder("labels.lines.skipped.total")
            .description("Total number of declaration lines skipped by the extractor")
            .register(meterRegistry);

        this.ledgerConflicts = Counter.builder("ledger.conflicts.total")
            .description("Total number of rejected ledger appends")
            .register(meterRegistry);

        this.lastLabelsCount = new AtomicInteger(0);
        Gauge.builder("labels.last.count", lastLabelsCount, AtomicInteger::get)
            .description("Number of labels found in last extraction")
            .register(meterRegistry);
    }

    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Фиксирует результат одного прохода извлечения.
     */
    public void recordExtraction(Timer.Sample sample, int labels, int skipped) {
        sample.stop(extractionDuration);
        labelsExtracted.increment(labels);
        linesSkipped.increment(skipped);
        lastLabelsCount.set(labels);
    }

    /**
     * Отмечает добавление записи в журнал версий.
     */
    public void recordLedgerAppend(ActionType actionType) {
        Counter.builder("ledger.entries.appended.total")
            .tag("action", actionType.getCode())
            .description("Total number of appended version entries")
            .register(meterRegistry)
            .increment();
    }

    /**
     * Отмечает конфликт версий при добавлении записи.
     */
    public void recordLedgerConflict() {
        ledgerConflicts.increment();
    }
}
