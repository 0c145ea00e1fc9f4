package com.complypilot.config;

import com.complypilot.catalog.QuestionCatalog;
import com.complypilot.catalog.RiskTemplateLibrary;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Reference data loaded once at startup and shared read-only by all requests.
 */
@Configuration
public class CoreConfig {

    @Bean
    public QuestionCatalog questionCatalog() {
        return QuestionCatalog.ukSme();
    }

    @Bean
    public RiskTemplateLibrary riskTemplateLibrary() {
        return RiskTemplateLibrary.ukSme();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
