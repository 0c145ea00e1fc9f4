package com.complypilot.config;

import com.complypilot.controller.CurrentUserArgumentResolver;
import com.complypilot.service.SessionService;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

/**
 * Registers the authenticated-user resolver and opens the API to the mobile/web client.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final SessionService sessionService;
    private final ComplyPilotProperties properties;

    public WebConfig(SessionService sessionService, ComplyPilotProperties properties) {
        this.sessionService = sessionService;
        this.properties = properties;
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(new CurrentUserArgumentResolver(sessionService, properties));
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOriginPatterns("*")
                .allowedMethods("*")
                .allowedHeaders("*")
                .allowCredentials(true);
    }
}
