package com.linlay.agentcoordinator.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.util.StringUtils;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.reactive.CorsWebFilter;
import org.springframework.web.cors.reactive.UrlBasedCorsConfigurationSource;

import java.util.List;

/**
 * The HTTP surface is read-only, so only the allowed origins are configurable.
 */
@Configuration
public class CorsConfig {

    static final String API_PATH_PATTERN = "/api/coordinator/**";

    @Bean
    public CorsWebFilter corsWebFilter(
            @Value("${coordinator.cors.allowed-origin-patterns:http://localhost:*}") List<String> allowedOriginPatterns,
            @Value("${coordinator.cors.max-age-seconds:3600}") long maxAgeSeconds
    ) {
        CorsConfiguration configuration = new CorsConfiguration();
        configuration.setAllowedOriginPatterns(allowedOriginPatterns.stream()
                .filter(StringUtils::hasText)
                .map(String::trim)
                .toList());
        configuration.setAllowedMethods(List.of(HttpMethod.GET.name(), HttpMethod.OPTIONS.name()));
        configuration.addAllowedHeader(CorsConfiguration.ALL);
        configuration.setMaxAge(maxAgeSeconds);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration(API_PATH_PATTERN, configuration);
        return new CorsWebFilter(source);
    }
}
