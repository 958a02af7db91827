package com.scholary.docshare.preview.objectstore;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>During conversion this counts as a failed attempt like any other conversion error.
 */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
