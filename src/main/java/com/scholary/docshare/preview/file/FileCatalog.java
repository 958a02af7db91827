package com.scholary.docshare.preview.file;

import java.util.Optional;
import java.util.UUID;

/**
 * Read access to the platform's file records, plus the one write the preview pipeline makes.
 */
public interface FileCatalog {

  Optional<SourceFile> findById(UUID fileId);

  /**
   * Record where the generated preview of a file was stored.
   *
   * @throws IllegalArgumentException if the file is unknown
   */
  void updatePreviewPath(UUID fileId, String previewPath);
}
