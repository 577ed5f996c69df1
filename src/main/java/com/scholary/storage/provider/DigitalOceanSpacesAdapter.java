package com.scholary.storage.provider;

import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

/**
 * DigitalOcean Spaces.
 *
 * <p>Public URLs go through the Spaces CDN unless it is disabled. A custom CDN domain wins over the
 * built-in CDN host.
 */
public class DigitalOceanSpacesAdapter extends S3StorageAdapter {

  private static final String DOMAIN = "digitaloceanspaces.com";

  public DigitalOceanSpacesAdapter(ProviderConfig config) {
    super(config);
  }

  public DigitalOceanSpacesAdapter(
      ProviderConfig config, S3Client s3Client, S3Presigner s3Presigner) {
    super(config, s3Client, s3Presigner);
  }

  @Override
  protected String nativePublicUrl(String encodedKey) {
    if (config.cdnDomain() != null) {
      return String.format("https://%s/%s", stripTrailingSlash(config.cdnDomain()), encodedKey);
    }
    if (config.cdnEnabled()) {
      return String.format(
          "https://%s.%s.cdn.%s/%s", config.bucket(), config.region(), DOMAIN, encodedKey);
    }
    return regionalUrl(DOMAIN, encodedKey);
  }

  @Override
  protected String displayName() {
    return "DigitalOcean Spaces";
  }
}
