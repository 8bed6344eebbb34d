package com.shetka.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

/**
 * CORS for the WebApp frontend. WEBAPP_ORIGINS unset means any origin.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class WebConfig implements WebMvcConfigurer {

    private final AppProperties properties;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        List<String> origins = properties.getCors().originList();
        CorsRegistration registration = registry.addMapping("/api/**")
                .allowedMethods("*")
                .allowedHeaders("*")
                .allowCredentials(true);

        if (origins.isEmpty()) {
            // allowCredentials rules out a literal "*" origin
            registration.allowedOriginPatterns("*");
            log.info("CORS: allowing all origins");
        } else {
            registration.allowedOrigins(origins.toArray(String[]::new));
            log.info("CORS: allowed origins {}", origins);
        }
    }
}
