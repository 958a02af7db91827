package com.scholary.docshare.preview.conversion;

import com.scholary.docshare.preview.file.SourceFile;

/**
 * Turns a stored file into a previewable artifact.
 *
 * <p>Calls may take tens of seconds and may fail. The scheduler treats any {@link
 * RuntimeException} thrown from {@link #convert(SourceFile)} as a failed attempt.
 */
public interface ConversionBackend {

  /**
   * Produce a preview for the file.
   *
   * @param file the file to preview
   * @return an opaque reference to the preview artifact
   * @throws ConversionException if the preview cannot be produced
   */
  String convert(SourceFile file);
}
