package com.scholary.storage.provider;

import java.time.Duration;
import java.util.Map;

/**
 * Parameters of a presigned URL.
 *
 * @param expiresIn validity of the signature
 * @param operation GET for reads, PUT for direct uploads
 * @param contentType content type the PUT must carry; ignored for GET
 * @param responseHeaders response header overrides for GET, such as Content-Disposition
 */
public record SignedUrlRequest(
    Duration expiresIn,
    SignedOperation operation,
    String contentType,
    Map<String, String> responseHeaders) {

  public static final String CONTENT_DISPOSITION = "Content-Disposition";
  public static final String CONTENT_TYPE = "Content-Type";

  public enum SignedOperation {
    GET,
    PUT
  }

  public SignedUrlRequest {
    responseHeaders = responseHeaders != null ? Map.copyOf(responseHeaders) : Map.of();
  }

  public static SignedUrlRequest get(Duration expiresIn) {
    return new SignedUrlRequest(expiresIn, SignedOperation.GET, null, Map.of());
  }

  public static SignedUrlRequest put(Duration expiresIn, String contentType) {
    return new SignedUrlRequest(expiresIn, SignedOperation.PUT, contentType, Map.of());
  }
}
