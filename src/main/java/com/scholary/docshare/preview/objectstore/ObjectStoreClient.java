package com.scholary.docshare.preview.objectstore;

import java.io.InputStream;
import java.net.URL;
import java.time.Duration;

/**
 * Abstraction for object storage operations.
 *
 * <p>Covers what the preview pipeline needs from the platform's object store: reading an original
 * document, writing the generated preview, and handing out presigned links to either.
 */
public interface ObjectStoreClient {

  /**
   * Retrieve an object as a stream. The caller is responsible for closing the stream.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @return an input stream for reading the object
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  InputStream getObjectStream(String bucket, String key);

  /**
   * Store an object from a stream.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @param data the input stream containing object data
   * @param contentLength the size of the object in bytes
   * @param contentType the MIME type of the object
   * @throws ObjectStoreException if the upload fails
   */
  void putObject(
      String bucket, String key, InputStream data, long contentLength, String contentType);

  /**
   * Generate a presigned URL for temporary read access to an object.
   *
   * <p>The content type and disposition override the headers the store answers the download with,
   * so a browser renders the object instead of saving it. A null or empty value leaves the stored
   * header in place.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @param ttl time-to-live for the URL
   * @param contentType the Content-Type to serve the object with
   * @param contentDisposition the Content-Disposition to serve the object with
   * @return a presigned URL
   * @throws ObjectStoreException if URL generation fails
   */
  URL presignGet(
      String bucket, String key, Duration ttl, String contentType, String contentDisposition);
}
