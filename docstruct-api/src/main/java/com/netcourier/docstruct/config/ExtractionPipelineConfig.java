package com.netcourier.docstruct.config;

import com.netcourier.docstruct.service.chunking.ChunkPlanner;
import com.netcourier.docstruct.service.extraction.ExtractionClient;
import com.netcourier.docstruct.service.extraction.ModelClient;
import com.netcourier.docstruct.service.extraction.RetryingExtractionClient;
import com.netcourier.docstruct.service.sequencing.RecordSequencer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
@EnableConfigurationProperties(ExtractionProperties.class)
public class ExtractionPipelineConfig {

    @Bean
    public ChunkPlanner chunkPlanner(ExtractionProperties properties) {
        return new ChunkPlanner(properties.getTokenBudget(), properties.getChunkOverlap(), properties.getSlackWindowChars());
    }

    @Bean
    public ExtractionClient extractionClient(ModelClient modelClient,
                                             ExtractionProperties properties,
                                             @Value("${docstruct.llm.max-output-tokens:3000}") int maxOutputTokens) {
        return new RetryingExtractionClient(
                modelClient,
                properties.getMaxRetries(),
                seconds(properties.getBackoffBaseSeconds()),
                seconds(properties.getMaxBackoffSeconds()),
                seconds(properties.getTotalTimeoutSeconds()),
                maxOutputTokens,
                Clock.systemUTC()
        );
    }

    @Bean
    public RecordSequencer recordSequencer(ExtractionProperties properties) {
        return new RecordSequencer(properties.isPruneCrossRecordComments());
    }

    private static Duration seconds(double value) {
        return Duration.ofMillis(Math.max(0L, Math.round(value * 1000)));
    }
}
