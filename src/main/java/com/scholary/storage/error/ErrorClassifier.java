package com.scholary.storage.error;

import java.util.Set;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;

/**
 * Maps AWS SDK exceptions onto {@link ErrorKind}.
 *
 * <p>S3-compatible providers (R2, Spaces, Vultr, Linode, MinIO) return the same error codes as AWS,
 * so one table covers all of them. Anything unrecognised keeps the fallback kind of the operation
 * that failed.
 */
public final class ErrorClassifier {

  private static final Set<String> AUTH_CODES =
      Set.of("InvalidAccessKeyId", "SignatureDoesNotMatch", "AccessDenied", "ExpiredToken");
  private static final Set<String> VALIDATION_CODES =
      Set.of("InvalidRequest", "EntityTooLarge", "InvalidArgument", "KeyTooLongError");
  private static final Set<String> CONNECTION_CODES =
      Set.of("ServiceUnavailable", "SlowDown", "InternalError", "RequestTimeout");

  private ErrorClassifier() {}

  public static ErrorKind kindOf(Throwable error, ErrorKind fallback) {
    if (error instanceof StorageException) {
      return ((StorageException) error).kind();
    }
    if (error instanceof ApiCallTimeoutException
        || error instanceof ApiCallAttemptTimeoutException) {
      return ErrorKind.TIMEOUT;
    }
    if (error instanceof NoSuchKeyException) {
      return ErrorKind.NOT_FOUND;
    }
    if (error instanceof NoSuchBucketException) {
      return ErrorKind.CONFIGURATION;
    }
    if (error instanceof AwsServiceException) {
      return kindOfServiceError((AwsServiceException) error, fallback);
    }
    if (error instanceof SdkClientException) {
      return ErrorKind.CONNECTION;
    }
    return fallback;
  }

  private static ErrorKind kindOfServiceError(AwsServiceException e, ErrorKind fallback) {
    String code = errorCode(e);
    if (code == null) {
      code = "";
    }
    if ("NoSuchBucket".equals(code)) {
      return ErrorKind.CONFIGURATION;
    }
    if ("NoSuchKey".equals(code)) {
      return ErrorKind.NOT_FOUND;
    }
    if (AUTH_CODES.contains(code)) {
      return ErrorKind.AUTHENTICATION;
    }
    if (VALIDATION_CODES.contains(code)) {
      return ErrorKind.VALIDATION;
    }
    if (CONNECTION_CODES.contains(code)) {
      return ErrorKind.CONNECTION;
    }
    int status = e.statusCode();
    if (status == 401 || status == 403) {
      return ErrorKind.AUTHENTICATION;
    }
    if (status == 404) {
      return ErrorKind.NOT_FOUND;
    }
    if (status == 400 || status == 413) {
      return ErrorKind.VALIDATION;
    }
    if (status == 429 || status >= 500) {
      return ErrorKind.CONNECTION;
    }
    return fallback;
  }

  /**
   * Wrap any failure in a {@link StorageException}. Existing storage exceptions pass through
   * unchanged.
   */
  public static StorageException classify(
      Throwable error, ErrorKind fallback, String provider, String key) {
    if (error instanceof StorageException) {
      return (StorageException) error;
    }
    ErrorKind kind = kindOf(error, fallback);
    String message =
        String.format(
            "%s: provider=%s, key=%s, reason=%s",
            describe(kind), provider, key, ErrorSanitizer.sanitize(reason(error)));
    return new StorageException(kind, message, provider, key, error);
  }

  /**
   * Human readable reason for a failed connection test, phrased for someone fixing a provider
   * configuration.
   */
  public static String connectionFailureReason(Throwable error, String bucket) {
    if (error instanceof NoSuchBucketException) {
      return String.format("Bucket '%s' does not exist", bucket);
    }
    if (error instanceof AwsServiceException) {
      AwsServiceException serviceException = (AwsServiceException) error;
      String code = errorCode(serviceException);
      if ("NoSuchBucket".equals(code) || serviceException.statusCode() == 404) {
        return String.format("Bucket '%s' does not exist", bucket);
      }
      if ("InvalidAccessKeyId".equals(code)) {
        return "Invalid access key ID";
      }
      if ("SignatureDoesNotMatch".equals(code)) {
        return "Invalid secret access key";
      }
      if ("AccessDenied".equals(code) || serviceException.statusCode() == 403) {
        return "Access denied - check your permissions";
      }
    }
    return ErrorSanitizer.sanitize(reason(error));
  }

  private static String errorCode(AwsServiceException e) {
    return e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : null;
  }

  private static String reason(Throwable error) {
    String message = error.getMessage();
    return message != null ? message : error.getClass().getSimpleName();
  }

  private static String describe(ErrorKind kind) {
    switch (kind) {
      case CONFIGURATION:
        return "Storage configuration error";
      case AUTHENTICATION:
        return "Storage authentication failed";
      case VALIDATION:
        return "Request rejected by storage provider";
      case NOT_FOUND:
        return "Object not found";
      case CONNECTION:
        return "Storage provider unreachable";
      case TIMEOUT:
        return "Storage call timed out";
      case UPLOAD:
        return "Upload failed";
      case DELETE:
        return "Delete failed";
      default:
        return "Storage operation failed";
    }
  }
}
