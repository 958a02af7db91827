package com.scholary.docshare.preview.conversion;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the Gotenberg LibreOffice conversion route.
 *
 * <p>Sends one document as multipart/form-data and returns the PDF bytes. There is no retry here:
 * a failed call is one failed attempt, and the preview scheduler owns the retry policy.
 */
@Component
public class GotenbergClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(GotenbergClient.class);

  static final String CONVERT_PATH = "/forms/libreoffice/convert";
  private static final int MAX_ERROR_BODY_BYTES = 2048;

  private final HttpClient httpClient;
  private final GotenbergProperties properties;

  public GotenbergClient(GotenbergProperties properties) {
    this.properties = properties;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info("Initialized Gotenberg client: baseUrl={}", properties.baseUrl());
  }

  /**
   * Convert an office document to PDF.
   *
   * @param filename original file name; Gotenberg picks the import filter from its extension
   * @param content the document bytes
   * @return the PDF bytes
   * @throws ConversionException if the call fails or Gotenberg answers with a non-2xx status
   */
  public byte[] convertToPdf(String filename, byte[] content) {
    String boundary = UUID.randomUUID().toString();

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(trimTrailingSlash(properties.baseUrl()) + CONVERT_PATH))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "multipart/form-data; boundary=" + boundary)
            .POST(buildMultipartBody(filename, content, boundary))
            .build();

    LOGGER.debug(
        "Sending conversion request: uri={}, file={}, bytes={}",
        request.uri(),
        filename,
        content.length);

    HttpResponse<byte[]> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
    } catch (IOException e) {
      throw new ConversionException("gotenberg request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ConversionException("gotenberg request interrupted", e);
    }

    if (response.statusCode() < 200 || response.statusCode() >= 300) {
      byte[] body = response.body() == null ? new byte[0] : response.body();
      String detail =
          new String(
              Arrays.copyOf(body, Math.min(body.length, MAX_ERROR_BODY_BYTES)),
              StandardCharsets.UTF_8);
      throw new ConversionException("gotenberg conversion failed: " + detail);
    }

    LOGGER.info("Conversion successful: file={}, pdfBytes={}", filename, response.body().length);
    return response.body();
  }

  /**
   * Build the multipart body. Gotenberg reads the documents from the {@code files} field:
   *
   * <pre>
   * --boundary
   * Content-Disposition: form-data; name="files"; filename="report.docx"
   * Content-Type: application/octet-stream
   *
   * [binary data]
   * --boundary--
   * </pre>
   */
  private BodyPublisher buildMultipartBody(String filename, byte[] content, String boundary) {
    String head =
        "--"
            + boundary
            + "\r\n"
            + "Content-Disposition: form-data; name=\"files\"; filename=\""
            + filename.replace("\"", "")
            + "\"\r\n"
            + "Content-Type: application/octet-stream\r\n\r\n";
    String tail = "\r\n--" + boundary + "--\r\n";

    byte[] prefix = head.getBytes(StandardCharsets.UTF_8);
    byte[] suffix = tail.getBytes(StandardCharsets.UTF_8);

    byte[] body = new byte[prefix.length + content.length + suffix.length];
    System.arraycopy(prefix, 0, body, 0, prefix.length);
    System.arraycopy(content, 0, body, prefix.length, content.length);
    System.arraycopy(suffix, 0, body, prefix.length + content.length, suffix.length);

    return BodyPublishers.ofByteArray(body);
  }

  private static String trimTrailingSlash(String url) {
    String trimmed = url;
    while (trimmed.endsWith("/")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    return trimmed;
  }
}
