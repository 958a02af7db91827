package com.scholary.docshare.preview.conversion;

import com.scholary.docshare.preview.config.PreviewProperties;
import com.scholary.docshare.preview.file.FileCatalog;
import com.scholary.docshare.preview.file.SourceFile;
import com.scholary.docshare.preview.objectstore.ObjectStoreClient;
import com.scholary.docshare.preview.objectstore.ObjectStoreProperties;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * {@link ConversionBackend} that renders office documents to PDF through Gotenberg.
 *
 * <p>Files browsers can already display are not converted: their preview is a presigned link to
 * the original object. Office documents are downloaded, converted, uploaded under the owner's
 * {@code previews/} prefix, and recorded on the file.
 */
@Service
public class OfficeDocumentConverter implements ConversionBackend {

  private static final Logger LOGGER = LoggerFactory.getLogger(OfficeDocumentConverter.class);

  private static final Set<String> OFFICE_EXTENSIONS =
      Set.of(".docx", ".xlsx", ".pptx", ".odt", ".ods", ".odp");
  static final String PDF_CONTENT_TYPE = "application/pdf";
  static final String INLINE = "inline";

  private final GotenbergClient gotenbergClient;
  private final ObjectStoreClient objectStoreClient;
  private final FileCatalog fileCatalog;
  private final String bucket;
  private final Duration presignTtl;

  @Autowired
  public OfficeDocumentConverter(
      GotenbergClient gotenbergClient,
      ObjectStoreClient objectStoreClient,
      FileCatalog fileCatalog,
      ObjectStoreProperties objectStoreProperties,
      PreviewProperties previewProperties) {
    this(
        gotenbergClient,
        objectStoreClient,
        fileCatalog,
        objectStoreProperties.bucket(),
        previewProperties.presignTtl());
  }

  public OfficeDocumentConverter(
      GotenbergClient gotenbergClient,
      ObjectStoreClient objectStoreClient,
      FileCatalog fileCatalog,
      String bucket,
      Duration presignTtl) {
    this.gotenbergClient = gotenbergClient;
    this.objectStoreClient = objectStoreClient;
    this.fileCatalog = fileCatalog;
    this.bucket = bucket;
    this.presignTtl = presignTtl;
  }

  @Override
  public String convert(SourceFile file) {
    if (file.directory()) {
      throw new ConversionException("cannot preview a directory");
    }

    if (!isOfficeDocument(file.name())) {
      LOGGER.debug("No conversion needed: fileId={}, name={}", file.id(), file.name());
      return objectStoreClient
          .presignGet(bucket, file.storagePath(), presignTtl, file.mimeType(), INLINE)
          .toString();
    }

    byte[] source = download(file);
    byte[] pdf = gotenbergClient.convertToPdf(file.name(), source);

    String previewPath = String.format("%s/previews/%s.pdf", file.ownerId(), UUID.randomUUID());
    objectStoreClient.putObject(
        bucket, previewPath, new ByteArrayInputStream(pdf), pdf.length, PDF_CONTENT_TYPE);
    fileCatalog.updatePreviewPath(file.id(), previewPath);

    LOGGER.info(
        "Stored preview: fileId={}, previewPath={}, bytes={}", file.id(), previewPath, pdf.length);
    return objectStoreClient
        .presignGet(bucket, previewPath, presignTtl, PDF_CONTENT_TYPE, INLINE)
        .toString();
  }

  static boolean isOfficeDocument(String name) {
    int dot = name.lastIndexOf('.');
    if (dot < 0) {
      return false;
    }
    return OFFICE_EXTENSIONS.contains(name.substring(dot).toLowerCase(Locale.ROOT));
  }

  private byte[] download(SourceFile file) {
    try (InputStream in = objectStoreClient.getObjectStream(bucket, file.storagePath())) {
      return in.readAllBytes();
    } catch (IOException e) {
      throw new ConversionException("failed to read source object: " + file.storagePath(), e);
    }
  }
}
