package com.scholary.storage.provider;

import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

/** Linode (Akamai) Object Storage. */
public class LinodeStorageAdapter extends S3StorageAdapter {

  public LinodeStorageAdapter(ProviderConfig config) {
    super(config);
  }

  public LinodeStorageAdapter(ProviderConfig config, S3Client s3Client, S3Presigner s3Presigner) {
    super(config, s3Client, s3Presigner);
  }

  @Override
  protected String nativePublicUrl(String encodedKey) {
    return regionalUrl("linodeobjects.com", encodedKey);
  }

  @Override
  protected String displayName() {
    return "Linode Object Storage";
  }
}
