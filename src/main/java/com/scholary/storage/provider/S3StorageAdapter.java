package com.scholary.storage.provider;

import com.scholary.storage.error.ErrorClassifier;
import com.scholary.storage.error.ErrorKind;
import com.scholary.storage.error.StorageException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AnonymousCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.ObjectCannedACL;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PutObjectPresignRequest;

/**
 * S3 implementation of {@link StorageAdapter}.
 *
 * <p>This uses AWS SDK v2, which talks to every S3-compatible service (R2, Spaces, Vultr, Linode,
 * MinIO) once the endpoint and addressing style are set. Provider families subclass it to add their
 * public URL rules and upload options. Used as is for the custom-s3 provider.
 *
 * <p>Retries: the SDK's own retry policy is switched off. Retries belong to the storage service so
 * that every provider call follows the same classified policy. Each call carries the configured API
 * timeout.
 */
public class S3StorageAdapter implements StorageAdapter {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3StorageAdapter.class);

  protected final ProviderConfig config;
  private final S3Client s3Client;
  private final S3Presigner s3Presigner;

  public S3StorageAdapter(ProviderConfig config) {
    this(config, buildClient(config), buildPresigner(config));
  }

  public S3StorageAdapter(ProviderConfig config, S3Client s3Client, S3Presigner s3Presigner) {
    this.config = config;
    this.s3Client = s3Client;
    this.s3Presigner = s3Presigner;
    LOGGER.info("Initialized storage adapter: {}", config);
  }

  static S3Client buildClient(ProviderConfig config) {
    S3ClientBuilder builder =
        S3Client.builder()
            .region(Region.of(config.region()))
            .credentialsProvider(credentialsProvider(config))
            .forcePathStyle(config.pathStyle())
            .accelerate(config.accelerate())
            .overrideConfiguration(
                ClientOverrideConfiguration.builder()
                    .apiCallTimeout(config.timeout())
                    .retryPolicy(RetryPolicy.none())
                    .build());
    if (config.hasCustomEndpoint()) {
      builder.endpointOverride(URI.create(config.endpoint()));
    }
    return builder.build();
  }

  static S3Presigner buildPresigner(ProviderConfig config) {
    S3Presigner.Builder builder =
        S3Presigner.builder()
            .region(Region.of(config.region()))
            .credentialsProvider(credentialsProvider(config))
            .serviceConfiguration(
                S3Configuration.builder()
                    .pathStyleAccessEnabled(config.pathStyle())
                    .accelerateModeEnabled(config.accelerate())
                    .build());
    if (config.hasCustomEndpoint()) {
      builder.endpointOverride(URI.create(config.endpoint()));
    }
    return builder.build();
  }

  private static AwsCredentialsProvider credentialsProvider(ProviderConfig config) {
    if (!config.hasCredentials()) {
      return AnonymousCredentialsProvider.create();
    }
    return StaticCredentialsProvider.create(
        AwsBasicCredentials.create(config.accessKey(), config.secretKey()));
  }

  @Override
  public AdapterUploadResult upload(byte[] data, String key, UploadOptions options) {
    LOGGER.debug(
        "Uploading object: bucket={}, key={}, size={}, contentType={}",
        config.bucket(),
        key,
        data.length,
        options.effectiveContentType());

    try {
      PutObjectRequest.Builder request =
          PutObjectRequest.builder()
              .bucket(config.bucket())
              .key(key)
              .contentType(options.effectiveContentType())
              .contentLength((long) data.length)
              .metadata(options.metadata());
      if (options.cacheControl() != null) {
        request.cacheControl(options.cacheControl());
      }
      if (!options.tags().isEmpty()) {
        request.tagging(encodeTags(options.tags()));
      }
      if (supportsObjectAcl()) {
        request.acl(options.isPublic() ? ObjectCannedACL.PUBLIC_READ : ObjectCannedACL.PRIVATE);
      }
      customizeUpload(request, options);

      PutObjectResponse response = s3Client.putObject(request.build(), RequestBody.fromBytes(data));

      LOGGER.info(
          "Successfully uploaded object: provider={}, bucket={}, key={}",
          providerId(),
          config.bucket(),
          key);
      return new AdapterUploadResult(
          generatePublicUrl(key), key, data.length, stripQuotes(response.eTag()), providerId());

    } catch (Exception e) {
      throw failure("upload object", key, ErrorKind.UPLOAD, e);
    }
  }

  @Override
  public DeleteOutcome delete(String key) {
    LOGGER.debug("Deleting object: bucket={}, key={}", config.bucket(), key);

    // S3 deletes are idempotent and report success for missing keys, so probe first
    if (!exists(key)) {
      LOGGER.info("Object already absent: bucket={}, key={}", config.bucket(), key);
      return new DeleteOutcome(key, false);
    }

    try {
      s3Client.deleteObject(DeleteObjectRequest.builder().bucket(config.bucket()).key(key).build());
      LOGGER.info("Successfully deleted object: bucket={}, key={}", config.bucket(), key);
      return new DeleteOutcome(key, true);

    } catch (Exception e) {
      throw failure("delete object", key, ErrorKind.DELETE, e);
    }
  }

  @Override
  public boolean exists(String key) {
    try {
      s3Client.headObject(HeadObjectRequest.builder().bucket(config.bucket()).key(key).build());
      return true;

    } catch (NoSuchKeyException e) {
      return false;

    } catch (S3Exception e) {
      if (e.statusCode() == 404) {
        return false;
      }
      throw failure("check object", key, ErrorKind.STORAGE, e);

    } catch (Exception e) {
      throw failure("check object", key, ErrorKind.STORAGE, e);
    }
  }

  @Override
  public ObjectMetadata getMetadata(String key) {
    LOGGER.debug("Getting metadata for object: bucket={}, key={}", config.bucket(), key);

    try {
      HeadObjectResponse response =
          s3Client.headObject(HeadObjectRequest.builder().bucket(config.bucket()).key(key).build());
      return new ObjectMetadata(
          response.contentLength() != null ? response.contentLength() : 0L,
          response.contentType(),
          stripQuotes(response.eTag()),
          response.metadata(),
          response.lastModified());

    } catch (NoSuchKeyException e) {
      throw notFound(key, e);

    } catch (S3Exception e) {
      if (e.statusCode() == 404) {
        throw notFound(key, e);
      }
      throw failure("get metadata", key, ErrorKind.STORAGE, e);

    } catch (Exception e) {
      throw failure("get metadata", key, ErrorKind.STORAGE, e);
    }
  }

  @Override
  public ListPage list(String prefix, int maxKeys, String continuationToken) {
    LOGGER.debug(
        "Listing objects: bucket={}, prefix={}, maxKeys={}", config.bucket(), prefix, maxKeys);

    try {
      ListObjectsV2Request.Builder request =
          ListObjectsV2Request.builder().bucket(config.bucket()).maxKeys(maxKeys);
      if (prefix != null && !prefix.isEmpty()) {
        request.prefix(prefix);
      }
      if (continuationToken != null) {
        request.continuationToken(continuationToken);
      }

      ListObjectsV2Response response = s3Client.listObjectsV2(request.build());
      return new ListPage(
          response.contents().stream()
              .map(
                  object ->
                      new ObjectSummary(
                          object.key(),
                          object.size() != null ? object.size() : 0L,
                          stripQuotes(object.eTag()),
                          object.lastModified()))
              .toList(),
          Boolean.TRUE.equals(response.isTruncated()) ? response.nextContinuationToken() : null);

    } catch (Exception e) {
      throw failure("list objects", prefix, ErrorKind.STORAGE, e);
    }
  }

  @Override
  public StoredObject download(String key) {
    LOGGER.debug("Fetching object: bucket={}, key={}", config.bucket(), key);

    try {
      ResponseBytes<GetObjectResponse> bytes =
          s3Client.getObjectAsBytes(
              GetObjectRequest.builder().bucket(config.bucket()).key(key).build());
      GetObjectResponse response = bytes.response();
      return new StoredObject(
          bytes.asByteArray(),
          response.contentType(),
          response.metadata(),
          stripQuotes(response.eTag()));

    } catch (NoSuchKeyException e) {
      throw notFound(key, e);

    } catch (Exception e) {
      throw failure("download object", key, ErrorKind.STORAGE, e);
    }
  }

  @Override
  public String generateSignedUrl(String key, SignedUrlRequest request) {
    if (!config.hasCredentials()) {
      throw new StorageException(
          ErrorKind.CONFIGURATION,
          String.format("Signed URLs need credentials: provider=%s", providerId()),
          providerId(),
          key,
          null);
    }
    LOGGER.debug(
        "Generating presigned URL: bucket={}, key={}, operation={}, ttl={}",
        config.bucket(),
        key,
        request.operation(),
        request.expiresIn());

    try {
      if (request.operation() == SignedUrlRequest.SignedOperation.PUT) {
        PutObjectRequest.Builder putObject =
            PutObjectRequest.builder().bucket(config.bucket()).key(key);
        if (request.contentType() != null) {
          putObject.contentType(request.contentType());
        }
        PutObjectPresignRequest presignRequest =
            PutObjectPresignRequest.builder()
                .signatureDuration(request.expiresIn())
                .putObjectRequest(putObject.build())
                .build();
        return s3Presigner.presignPutObject(presignRequest).url().toString();
      }

      GetObjectRequest.Builder getObject =
          GetObjectRequest.builder().bucket(config.bucket()).key(key);
      Map<String, String> headers = request.responseHeaders();
      if (headers.containsKey(SignedUrlRequest.CONTENT_DISPOSITION)) {
        getObject.responseContentDisposition(headers.get(SignedUrlRequest.CONTENT_DISPOSITION));
      }
      if (headers.containsKey(SignedUrlRequest.CONTENT_TYPE)) {
        getObject.responseContentType(headers.get(SignedUrlRequest.CONTENT_TYPE));
      }
      GetObjectPresignRequest presignRequest =
          GetObjectPresignRequest.builder()
              .signatureDuration(request.expiresIn())
              .getObjectRequest(getObject.build())
              .build();
      return s3Presigner.presignGetObject(presignRequest).url().toString();

    } catch (Exception e) {
      throw failure("generate presigned URL", key, ErrorKind.STORAGE, e);
    }
  }

  @Override
  public String generatePublicUrl(String key) {
    String encodedKey = encodeKey(key);
    if (config.publicUrl() != null) {
      return stripTrailingSlash(config.publicUrl()) + "/" + encodedKey;
    }
    return nativePublicUrl(encodedKey);
  }

  /** Provider-specific public URL when no public base URL is configured. */
  protected String nativePublicUrl(String encodedKey) {
    URI endpoint = URI.create(stripTrailingSlash(config.endpoint()));
    if (config.pathStyle()) {
      return endpoint + "/" + config.bucket() + "/" + encodedKey;
    }
    return endpoint.getScheme()
        + "://"
        + config.bucket()
        + "."
        + endpoint.getAuthority()
        + "/"
        + encodedKey;
  }

  /** {@code https://{bucket}.{region}.{domain}/{key}}, or the path-style form. */
  protected String regionalUrl(String domain, String encodedKey) {
    if (config.pathStyle()) {
      return String.format(
          "https://%s.%s/%s/%s", config.region(), domain, config.bucket(), encodedKey);
    }
    return String.format(
        "https://%s.%s.%s/%s", config.bucket(), config.region(), domain, encodedKey);
  }

  @Override
  public void testConnection() {
    LOGGER.info("Testing connection: provider={}, bucket={}", providerId(), config.bucket());
    try {
      s3Client.headBucket(HeadBucketRequest.builder().bucket(config.bucket()).build());
      LOGGER.info("Connection test passed: provider={}", providerId());

    } catch (Exception e) {
      String reason = ErrorClassifier.connectionFailureReason(e, config.bucket());
      LOGGER.warn("Connection test failed: provider={}, reason={}", providerId(), reason);
      throw new StorageException(ErrorKind.CONNECTION, reason, providerId(), null, e);
    }
  }

  /** Whether uploads carry a canned ACL. */
  protected boolean supportsObjectAcl() {
    return true;
  }

  /** Hook for provider-specific upload parameters. */
  protected void customizeUpload(PutObjectRequest.Builder request, UploadOptions options) {}

  protected String displayName() {
    return "Custom S3-compatible";
  }

  @Override
  public ProviderCapabilities capabilities() {
    return config.capabilities();
  }

  @Override
  public ProviderType providerType() {
    return config.type();
  }

  @Override
  public ProviderInfo info() {
    return new ProviderInfo(
        providerId(),
        displayName(),
        config.region(),
        config.bucket(),
        config.endpoint(),
        capabilities());
  }

  public ProviderConfig config() {
    return config;
  }

  /**
   * Clean up resources when the adapter is no longer needed.
   *
   * <p>This should be called when the application shuts down to release connections and threads.
   */
  @Override
  public void close() {
    LOGGER.info("Closing storage adapter: provider={}", providerId());
    s3Client.close();
    s3Presigner.close();
  }

  private StorageException notFound(String key, Exception cause) {
    String message =
        String.format(
            "Object not found: provider=%s, bucket=%s, key=%s", providerId(), config.bucket(), key);
    LOGGER.debug(message);
    return new StorageException(ErrorKind.NOT_FOUND, message, providerId(), key, cause);
  }

  private StorageException failure(String action, String key, ErrorKind fallback, Exception e) {
    StorageException failure = ErrorClassifier.classify(e, fallback, providerId(), key);
    LOGGER.error(
        "Failed to {}: provider={}, bucket={}, key={}, kind={}",
        action,
        providerId(),
        config.bucket(),
        key,
        failure.kind());
    return failure;
  }

  static String encodeTags(Map<String, String> tags) {
    return tags.entrySet().stream()
        .map(
            e ->
                URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8)
                    + "="
                    + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
        .collect(Collectors.joining("&"));
  }

  static String encodeKey(String key) {
    return Arrays.stream(key.split("/", -1))
        .map(segment -> URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20"))
        .collect(Collectors.joining("/"));
  }

  static String stripTrailingSlash(String url) {
    String result = url;
    while (result.endsWith("/")) {
      result = result.substring(0, result.length() - 1);
    }
    return result;
  }

  private static String stripQuotes(String etag) {
    return etag != null ? etag.replace("\"", "") : null;
  }
}
