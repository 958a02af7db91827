package com.scholary.docshare.preview.config;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for preview job scheduling.
 *
 * <p>Controls the wake-up queue size, the retry policy, the worker count, and how long finished
 * jobs are kept.
 */
@ConfigurationProperties(prefix = "preview")
@Validated
public record PreviewProperties(
    @PositiveOrZero int queueBufferSize,
    @Positive int maxAttempts,
    @NotEmpty List<@NotNull Duration> retryDelays,
    @Positive int workerCount,
    @NotNull Duration jobRetention,
    @NotNull Duration presignTtl) {}
