package com.complypilot.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * ChatClient and worker pool used for policy document analysis.
 */
@Configuration
public class AiConfig {

    /**
     * ChatClient for compliance analysis (OpenAI model configured under spring.ai.openai).
     */
    @Bean("analysisChatClient")
    public ChatClient analysisChatClient(OpenAiChatModel openAiChatModel) {
        return ChatClient.builder(openAiChatModel).build();
    }

    /**
     * Bounds the OpenAI HTTP calls made through the auto-configured RestClient.Builder, so a
     * hung reply releases its analysis worker no later than the analysis timeout.
     */
    @Bean
    public RestClientCustomizer analysisHttpTimeouts(ComplyPilotProperties properties) {
        Duration timeout = properties.analysis().timeout();
        return builder -> {
            SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
            factory.setConnectTimeout(timeout);
            factory.setReadTimeout(timeout);
            builder.requestFactory(factory);
        };
    }

    /**
     * Pool running analyzer calls, sized by complypilot.analysis.worker-threads.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService analysisExecutor(ComplyPilotProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "analysis-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(properties.analysis().workerThreads(), threadFactory);
    }
}
