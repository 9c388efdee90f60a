package com.aura.backend.service;

import com.aura.backend.model.FailureReason;
import com.aura.backend.model.PredictionSource;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;

@Service
@RequiredArgsConstructor
public class PipelineMetricsService {

    private final MeterRegistry meterRegistry;

    public void recordRun(PredictionSource source, Duration elapsed) {
        Counter.builder("pipeline_runs_total")
                .tag("source", source.getTag())
                .register(meterRegistry)
                .increment();
        Timer.builder("pipeline_run_duration")
                .tag("source", source.getTag())
                .register(meterRegistry)
                .record(elapsed);
    }

    public void recordFallback(FailureReason reason) {
        Counter.builder("pipeline_fallbacks_total")
                .tag("reason", reason.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();
    }

    public void recordFailure(FailureReason reason) {
        Counter.builder("pipeline_failures_total")
                .tag("reason", reason.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();
    }

    public void recordBusyRejection() {
        meterRegistry.counter("pipeline_busy_rejections_total").increment();
    }
}
