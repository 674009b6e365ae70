package com.eventfacts.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Connection settings for the upstream event-management system.
 *
 * Bound from app.upstream.*; the defaults in application.yml read them from
 * UPSTREAM_BASE_URL, UPSTREAM_USERNAME and UPSTREAM_PASSWORD.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.upstream")
public class UpstreamProperties {

    /** API root, e.g. https://example.church.tools/api */
    @NotBlank
    private String baseUrl;

    @NotBlank
    private String username;

    @NotBlank
    private String password;

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(10);

    @NotNull
    private Duration readTimeout = Duration.ofSeconds(30);
}
