package com.scholary.storage.provider;

import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.ServerSideEncryption;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

/**
 * Amazon S3.
 *
 * <p>Adds storage class and optional AES256 server-side encryption to uploads. Public URLs use the
 * region-aware virtual-hosted form, with the legacy global host for us-east-1.
 */
public class AwsS3Adapter extends S3StorageAdapter {

  static final String GLOBAL_REGION = "us-east-1";

  public AwsS3Adapter(ProviderConfig config) {
    super(config);
  }

  public AwsS3Adapter(ProviderConfig config, S3Client s3Client, S3Presigner s3Presigner) {
    super(config, s3Client, s3Presigner);
  }

  /** Regional S3 endpoint, used for display and diagnostics. */
  public static String endpointFor(String region) {
    return GLOBAL_REGION.equals(region) || region == null
        ? "https://s3.amazonaws.com"
        : String.format("https://s3.%s.amazonaws.com", region);
  }

  @Override
  protected void customizeUpload(PutObjectRequest.Builder request, UploadOptions options) {
    request.storageClass(config.storageClass());
    if (config.encryption()) {
      request.serverSideEncryption(ServerSideEncryption.AES256);
    }
  }

  @Override
  protected String nativePublicUrl(String encodedKey) {
    if (config.hasCustomEndpoint()) {
      return super.nativePublicUrl(encodedKey);
    }
    String host =
        GLOBAL_REGION.equals(config.region())
            ? "s3.amazonaws.com"
            : String.format("s3.%s.amazonaws.com", config.region());
    if (config.pathStyle()) {
      return String.format("https://%s/%s/%s", host, config.bucket(), encodedKey);
    }
    return String.format("https://%s.%s/%s", config.bucket(), host, encodedKey);
  }

  @Override
  protected String displayName() {
    return "Amazon S3";
  }

  @Override
  public ProviderInfo info() {
    ProviderInfo info = super.info();
    if (info.endpoint() != null) {
      return info;
    }
    return new ProviderInfo(
        info.type(),
        info.name(),
        info.region(),
        info.bucket(),
        endpointFor(config.region()),
        info.capabilities());
  }
}
