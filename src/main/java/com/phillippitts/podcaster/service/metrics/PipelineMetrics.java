package com.phillippitts.podcaster.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the podcast generation pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Stage latency (fetch, script, synthesis, assembly, total)</li>
 *   <li>Pipeline outcomes per entry point (generate, regenerate)</li>
 *   <li>Synthesized segment results (success, failed, skipped)</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class PipelineMetrics {

    private static final String METRIC_PREFIX = "podcaster";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records latency of one pipeline stage.
     *
     * @param stage stage name
     * @param durationNanos duration in nanoseconds
     */
    public void recordStageLatency(String stage, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".pipeline.stage.latency")
                .description("Time spent in a pipeline stage")
                .tag("stage", stage)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Counts a finished pipeline run.
     *
     * @param pipeline "generate" or "regenerate"
     * @param outcome "success" or "failed"
     */
    public void incrementOutcome(String pipeline, String outcome) {
        Counter.builder(METRIC_PREFIX + ".pipeline.outcome")
                .description("Number of finished pipeline runs")
                .tag("pipeline", pipeline)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Counts dialogue segments by synthesis result.
     *
     * @param result "success", "failed" or "skipped"
     * @param count number of segments
     */
    public void recordSegments(String result, int count) {
        if (count <= 0) {
            return;
        }
        Counter.builder(METRIC_PREFIX + ".synthesis.segments")
                .description("Number of dialogue segments by synthesis result")
                .tag("result", result)
                .register(registry)
                .increment(count);
    }
}
