package com.engram.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for repository analyses.
 */
@Service
public class AnalysisMetrics {

    private final MeterRegistry registry;

    public AnalysisMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPhaseDuration(String phase, long ms) {
        Timer.builder("engram.analysis.phase.duration")
                .tag("phase", phase)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordAnalysisDuration(long ms) {
        Timer.builder("engram.analysis.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param outcome "complete" when no field degraded, "degraded" otherwise, "rejected" for an invalid path
     */
    public void recordAnalysisResult(String outcome) {
        Counter.builder("engram.analyses.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Records a soft failure that left some fields of the result empty.
     *
     * @param phase the analysis phase that degraded
     */
    public void recordDegraded(String phase) {
        Counter.builder("engram.analysis.degraded")
                .description("Soft failures recorded as warnings")
                .tag("phase", phase)
                .register(registry)
                .increment();
    }

    public void recordFilesScanned(int files) {
        DistributionSummary.builder("engram.walk.files")
                .register(registry)
                .record(files);
    }
}
