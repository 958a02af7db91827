package com.scholary.docshare.preview.file;

import java.util.Objects;
import java.util.UUID;

/**
 * A stored file as seen by the preview pipeline.
 *
 * @param id file id
 * @param ownerId owning user; previews are written under the owner's prefix
 * @param name display name, used to detect office formats by extension
 * @param mimeType content type of the original object
 * @param storagePath object key of the original content
 * @param directory true for folders, which can never be previewed
 * @param previewPath object key of the generated preview, or null if none exists yet
 */
public record SourceFile(
    UUID id,
    UUID ownerId,
    String name,
    String mimeType,
    String storagePath,
    boolean directory,
    String previewPath) {

  public SourceFile {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(name, "name must not be null");
  }

  public SourceFile withPreviewPath(String path) {
    return new SourceFile(id, ownerId, name, mimeType, storagePath, directory, path);
  }
}
