package com.trendplatform.analysis.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.trendplatform.common.trend.TrendDetectionEngine;
import com.trendplatform.common.trend.TrendEngineSettings;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AnalysisEngineConfig {

    @Value("${trend.engine.prediction-horizon:5}")
    private int predictionHorizon;

    @Value("${trend.engine.min-data-points:2}")
    private int minDataPoints;

    @Bean
    public TrendEngineSettings trendEngineSettings() {
        return new TrendEngineSettings(predictionHorizon, minDataPoints);
    }

    @Bean
    public TrendDetectionEngine trendDetectionEngine(TrendEngineSettings settings) {
        return new TrendDetectionEngine(settings);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }
}
