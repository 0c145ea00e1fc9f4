package com.complypilot.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties of the compliance service.
 */
@ConfigurationProperties(prefix = "complypilot")
public record ComplyPilotProperties(
        Identity identity,
        Session session,
        Analysis analysis
) {

    /**
     * Identity provider that exchanges a login session id for user data.
     *
     * @param baseUrl        base URL of the provider (e.g. https://auth.example.com/auth/v1/env/oauth)
     * @param connectTimeout connection timeout
     * @param readTimeout    read timeout
     */
    public record Identity(String baseUrl, Duration connectTimeout, Duration readTimeout) {}

    /**
     * @param ttl        lifetime of an issued session token
     * @param cookieName name of the cookie carrying the token
     */
    public record Session(Duration ttl, String cookieName) {}

    /**
     * Policy document analysis.
     *
     * @param maxExcerptChars characters of document text sent to the analyzer
     * @param timeout         upper bound on a single analyzer call
     * @param workerThreads   size of the pool running analyzer calls
     */
    public record Analysis(int maxExcerptChars, Duration timeout, int workerThreads) {}
}
