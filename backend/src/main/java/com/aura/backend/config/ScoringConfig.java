package com.aura.backend.config;

import com.aura.backend.service.CsvTableCodec;
import com.aura.backend.service.scoring.ExchangeChannel;
import com.aura.backend.service.scoring.FileExchangeChannel;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

@Configuration
public class ScoringConfig {

    @Bean
    public Bulkhead scoringBulkhead() {
        BulkheadConfig config = BulkheadConfig.custom()
                .maxConcurrentCalls(1)
                .maxWaitDuration(Duration.ZERO)
                .build();
        return Bulkhead.of("scoring-process", config);
    }

    @Bean
    public CsvMapper csvMapper() {
        return new CsvMapper();
    }

    @Bean
    public ExchangeChannel exchangeChannel(PipelineProperties properties, CsvTableCodec codec) {
        PipelineProperties.Scorer scorer = properties.getScorer();
        return new FileExchangeChannel(
                Path.of(scorer.getWorkingDirectory()),
                scorer.getInputFile(),
                scorer.getOutputFile(),
                codec
        );
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
