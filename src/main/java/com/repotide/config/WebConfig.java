package com.repotide.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Opens the feed, the receiver and the health check to cross-origin callers:
 * the dashboard polls from its own origin and GitHub posts from anywhere.
 */
@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    private final RepoTideProperties properties;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        String[] origins = properties.getCors().getAllowedOrigins().toArray(String[]::new);

        registry.addMapping("/api/**").allowedOrigins(origins).allowedMethods("GET");
        registry.addMapping("/webhook/**").allowedOrigins(origins).allowedMethods("POST");
        registry.addMapping("/health").allowedOrigins(origins).allowedMethods("GET");
    }
}
