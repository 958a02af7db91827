package com.scholary.docshare.preview.conversion;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Gotenberg conversion service.
 *
 * <p>Timeouts are in seconds. The read timeout is the only bound on how long the worker can wait
 * for a single conversion.
 */
@ConfigurationProperties(prefix = "gotenberg")
@Validated
public record GotenbergProperties(
    @NotBlank String baseUrl, @Positive int connectTimeout, @Positive int readTimeout) {}
