package com.viralengine.orchestrator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

/**
 * Lets the dashboard front end call the job API from the browser.
 *
 * Allowed origins come from viral.cors.allowed-origins (comma-separated);
 * every other origin is refused on preflight.
 */
@Configuration
public class CorsConfig implements WebMvcConfigurer {

    private static final Logger log = LoggerFactory.getLogger(CorsConfig.class);

    private final String[] allowedOrigins;

    public CorsConfig(
            @Value("${viral.cors.allowed-origins:http://localhost:3000,http://localhost:3001}")
            String[] allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
        log.info("CORS enabled for origins {}", List.of(allowedOrigins));
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/jobs/**")
                .allowedOrigins(allowedOrigins)
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders("*")
                .allowCredentials(true)
                .maxAge(3600);
    }
}
