package com.scholary.docshare.preview.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic trigger for {@link PreviewQueueService#recoverStaleJobs()}.
 *
 * <p>The first run happens shortly after startup so jobs left pending or processing by a previous
 * process are picked up without waiting for new traffic.
 */
@Component
public class PreviewRecoveryScheduler {

  private static final Logger LOGGER = LoggerFactory.getLogger(PreviewRecoveryScheduler.class);

  private final PreviewQueueService previewQueueService;

  public PreviewRecoveryScheduler(PreviewQueueService previewQueueService) {
    this.previewQueueService = previewQueueService;
  }

  @Scheduled(
      initialDelayString = "${preview.recovery-initial-delay:PT10S}",
      fixedDelayString = "${preview.recovery-interval:PT2M}")
  public void recover() {
    try {
      previewQueueService.recoverStaleJobs();
    } catch (RuntimeException e) {
      LOGGER.error("Preview recovery sweep failed", e);
    }
  }
}
