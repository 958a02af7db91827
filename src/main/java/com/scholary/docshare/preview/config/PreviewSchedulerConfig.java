package com.scholary.docshare.preview.config;

import com.scholary.docshare.preview.scheduler.PreviewWakeUpQueue;
import com.scholary.docshare.preview.scheduler.RetryBackoff;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Infrastructure beans for the preview job scheduler.
 *
 * <p>The wake-up queue is a single bean shared by the service and the worker, sized by {@code
 * preview.queue-buffer-size}.
 */
@Configuration
@EnableConfigurationProperties(PreviewProperties.class)
public class PreviewSchedulerConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public PreviewWakeUpQueue previewWakeUpQueue(PreviewProperties properties) {
    return new PreviewWakeUpQueue(properties.queueBufferSize());
  }

  @Bean
  public RetryBackoff retryBackoff(PreviewProperties properties) {
    return new RetryBackoff(properties.retryDelays());
  }
}
