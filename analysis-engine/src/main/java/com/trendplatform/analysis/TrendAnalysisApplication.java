package com.trendplatform.analysis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TrendAnalysisApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrendAnalysisApplication.class, args);
    }
}
