package com.demo.lending.config;

import java.util.Arrays;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * CORS for browser wallets. Only the lending API is exposed cross-origin and only the
 * headers it reads are allowed; with no origins configured the browser default applies.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Value("${app.cors.allowed-origins:}")
    private String corsOrigins;

    @Value("${app.cors.max-age:1800}")
    private long maxAge;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        String[] origins = parseOrigins(corsOrigins);
        if (origins.length == 0) {
            return;
        }
        // the caller header is an identity claim, not a credential; no cookies
        registry.addMapping("/api/**")
                .allowedOrigins(origins)
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders(HttpHeaders.CONTENT_TYPE, "X-Caller")
                .allowCredentials(false)
                .maxAge(maxAge);
    }

    static String[] parseOrigins(String raw) {
        if (!StringUtils.hasText(raw)) {
            return new String[0];
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> s.endsWith("/") ? s.substring(0, s.length() - 1) : s)
                .distinct()
                .toArray(String[]::new);
    }
}
