package com.scholary.storage.provider;

import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

/** Vultr Object Storage. A CDN domain, when configured, replaces the regional host. */
public class VultrStorageAdapter extends S3StorageAdapter {

  private static final String DOMAIN = "vultrobjects.com";

  public VultrStorageAdapter(ProviderConfig config) {
    super(config);
  }

  public VultrStorageAdapter(ProviderConfig config, S3Client s3Client, S3Presigner s3Presigner) {
    super(config, s3Client, s3Presigner);
  }

  @Override
  protected String nativePublicUrl(String encodedKey) {
    if (config.cdnDomain() != null) {
      return String.format("https://%s/%s", stripTrailingSlash(config.cdnDomain()), encodedKey);
    }
    return regionalUrl(DOMAIN, encodedKey);
  }

  @Override
  protected String displayName() {
    return "Vultr Object Storage";
  }
}
