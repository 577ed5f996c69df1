package com.scholary.storage.provider;

import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

/**
 * Cloudflare R2.
 *
 * <p>R2 has no object ACLs: public access comes from an r2.dev subdomain or a custom domain. When a
 * worker domain is configured, image transforms are served by the worker using Cloudflare's
 * one-letter resize parameters.
 */
public class CloudflareR2Adapter extends S3StorageAdapter {

  public CloudflareR2Adapter(ProviderConfig config) {
    super(config);
  }

  public CloudflareR2Adapter(ProviderConfig config, S3Client s3Client, S3Presigner s3Presigner) {
    super(config, s3Client, s3Presigner);
  }

  @Override
  protected boolean supportsObjectAcl() {
    return false;
  }

  @Override
  protected String nativePublicUrl(String encodedKey) {
    if (config.r2DevSubdomain() != null) {
      return String.format("https://%s.r2.dev/%s", config.r2DevSubdomain(), encodedKey);
    }
    return String.format(
        "https://%s.%s.r2.cloudflarestorage.com/%s",
        config.bucket(), config.accountId(), encodedKey);
  }

  @Override
  public String applyTransform(String key, String url, ImageTransform transform) {
    if (config.workerDomain() == null) {
      return url;
    }
    StringBuilder workerUrl =
        new StringBuilder("https://")
            .append(stripTrailingSlash(config.workerDomain()))
            .append('/')
            .append(encodeKey(key));
    String query = encodeTags(transform.queryParameters(true));
    if (!query.isEmpty()) {
      workerUrl.append('?').append(query);
    }
    return workerUrl.toString();
  }

  @Override
  protected String displayName() {
    return "Cloudflare R2";
  }
}
