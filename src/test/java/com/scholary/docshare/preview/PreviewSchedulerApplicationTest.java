package com.scholary.docshare.preview;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.docshare.preview.conversion.ConversionBackend;
import com.scholary.docshare.preview.conversion.OfficeDocumentConverter;
import com.scholary.docshare.preview.file.InMemoryFileCatalog;
import com.scholary.docshare.preview.file.SourceFile;
import com.scholary.docshare.preview.job.InMemoryPreviewJobStore;
import com.scholary.docshare.preview.job.PreviewJob;
import com.scholary.docshare.preview.job.PreviewJobStatus;
import com.scholary.docshare.preview.job.PreviewJobStore;
import com.scholary.docshare.preview.scheduler.PreviewQueueService;
import com.scholary.docshare.preview.scheduler.PreviewRecoveryScheduler;
import com.scholary.docshare.preview.scheduler.PreviewWorker;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(
    properties = {
      "spring.main.keep-alive=false",
      "preview.recovery-initial-delay=PT1H",
      "preview.queue-buffer-size=5"
    })
class PreviewSchedulerApplicationTest {

  @Autowired private PreviewQueueService previewQueueService;
  @Autowired private InMemoryFileCatalog fileCatalog;
  @Autowired private PreviewWorker previewWorker;
  @Autowired private PreviewJobStore previewJobStore;
  @Autowired private ConversionBackend conversionBackend;
  @Autowired private PreviewRecoveryScheduler previewRecoveryScheduler;

  @Test
  void context_shouldScanSchedulerComponents() {
    assertThat(previewJobStore).isInstanceOf(InMemoryPreviewJobStore.class);
    assertThat(conversionBackend).isInstanceOf(OfficeDocumentConverter.class);
    assertThat(previewRecoveryScheduler).isNotNull();
  }

  @Test
  void context_shouldStartWorkerAndCompleteNonOfficePreview() throws Exception {
    assertThat(previewWorker.isRunning()).isTrue();

    UUID fileId = UUID.randomUUID();
    UUID ownerId = UUID.randomUUID();
    fileCatalog.register(
        new SourceFile(
            fileId, ownerId, "scan.pdf", "application/pdf", ownerId + "/scan.pdf", false, null));

    PreviewJob job = previewQueueService.enqueue(fileId, ownerId);

    long deadline = System.currentTimeMillis() + 10_000;
    PreviewJob current = job;
    while (current.getStatus() != PreviewJobStatus.COMPLETED
        && System.currentTimeMillis() < deadline) {
      Thread.sleep(20);
      current = previewQueueService.getJobByFileId(fileId).orElseThrow();
    }

    assertThat(current.getId()).isEqualTo(job.getId());
    assertThat(current.getStatus()).isEqualTo(PreviewJobStatus.COMPLETED);
    assertThat(current.getAttempts()).isZero();
  }
}
