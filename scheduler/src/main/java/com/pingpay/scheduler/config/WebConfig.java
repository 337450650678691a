package com.pingpay.scheduler.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.Arrays;

/**
 * CORS for the dashboard and other browser callers.
 *
 * scheduler.cors.allowed-origins is a comma-separated list; "*" (default)
 * allows any origin. Credentials are only enabled for an explicit list,
 * since browsers reject a wildcard origin with credentials.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final String[] allowedOrigins;

    public WebConfig(@Value("${scheduler.cors.allowed-origins:*}") String allowedOrigins) {
        this.allowedOrigins = Arrays.stream(allowedOrigins.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toArray(String[]::new);
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        boolean wildcard = allowedOrigins.length == 0
                || Arrays.asList(allowedOrigins).contains("*");

        registry.addMapping("/**")
                .allowedOriginPatterns(wildcard ? new String[]{"*"} : allowedOrigins)
                .allowCredentials(!wildcard)
                .allowedMethods("GET", "POST", "PUT", "DELETE", "PATCH")
                .allowedHeaders("Content-Type", "Authorization")
                .exposedHeaders("Content-Length", "X-Request-Id")
                .maxAge(600);
    }
}
