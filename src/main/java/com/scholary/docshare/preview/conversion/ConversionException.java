package com.scholary.docshare.preview.conversion;

/**
 * Exception thrown when a preview cannot be produced.
 *
 * <p>This could be an unsupported file, an unreachable conversion service, or a conversion the
 * service rejected.
 */
public class ConversionException extends RuntimeException {

  public ConversionException(String message) {
    super(message);
  }

  public ConversionException(String message, Throwable cause) {
    super(message, cause);
  }
}
