package com.scholary.docshare.preview.file;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Map-backed {@link FileCatalog}. Files are made known with {@link #register(SourceFile)}. */
@Component
public class InMemoryFileCatalog implements FileCatalog {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryFileCatalog.class);

  private final Map<UUID, SourceFile> files = new ConcurrentHashMap<>();

  public void register(SourceFile file) {
    files.put(file.id(), file);
    LOGGER.debug("Registered file: id={}, name={}", file.id(), file.name());
  }

  public void remove(UUID fileId) {
    files.remove(fileId);
  }

  @Override
  public Optional<SourceFile> findById(UUID fileId) {
    return Optional.ofNullable(files.get(fileId));
  }

  @Override
  public void updatePreviewPath(UUID fileId, String previewPath) {
    SourceFile updated =
        files.computeIfPresent(fileId, (id, file) -> file.withPreviewPath(previewPath));
    if (updated == null) {
      throw new IllegalArgumentException("File not found: " + fileId);
    }
  }
}
