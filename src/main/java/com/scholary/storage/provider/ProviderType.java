package com.scholary.storage.provider;

import java.util.Arrays;
import java.util.Optional;

/** Storage backend families known at compile time. */
public enum ProviderType {
  AWS_S3("aws-s3"),
  CLOUDFLARE_R2("cloudflare-r2"),
  DIGITALOCEAN_SPACES("digitalocean-spaces"),
  VULTR_STORAGE("vultr-storage"),
  LINODE_STORAGE("linode-storage"),
  CUSTOM_S3("custom-s3");

  private final String id;

  ProviderType(String id) {
    this.id = id;
  }

  public String id() {
    return id;
  }

  public static Optional<ProviderType> fromId(String id) {
    if (id == null) {
      return Optional.empty();
    }
    String normalized = id.trim().toLowerCase();
    return Arrays.stream(values()).filter(type -> type.id.equals(normalized)).findFirst();
  }

  @Override
  public String toString() {
    return id;
  }
}
