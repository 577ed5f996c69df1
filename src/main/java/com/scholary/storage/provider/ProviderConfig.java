package com.scholary.storage.provider;

import java.time.Duration;
import java.util.Map;

/**
 * Validated, immutable configuration of one provider instance.
 *
 * <p>Only {@link ProviderFactory} builds these, after checking the raw settings against the
 * provider's required fields. {@link #toString()} never prints credentials.
 *
 * @param type provider family
 * @param bucket bucket name
 * @param region provider region ("auto" for R2)
 * @param endpoint endpoint URL, or null to let the AWS SDK resolve it
 * @param accessKey access key id
 * @param secretKey secret access key
 * @param pathStyle whether to address buckets by path instead of host
 * @param publicUrl optional base URL that replaces the native public URL
 * @param cdnDomain optional CDN host (Spaces, Vultr)
 * @param cdnEnabled whether the Spaces CDN host is used when no CDN domain is set
 * @param accountId Cloudflare account id
 * @param r2DevSubdomain optional r2.dev subdomain for public R2 buckets
 * @param workerDomain optional Cloudflare worker host serving image transforms
 * @param accelerate AWS transfer acceleration, always false for other providers
 * @param encryption AWS server-side encryption (AES256), always false for other providers
 * @param storageClass AWS storage class
 * @param timeout per-call API timeout
 * @param capabilities optional features of this instance
 */
public record ProviderConfig(
    ProviderType type,
    String bucket,
    String region,
    String endpoint,
    String accessKey,
    String secretKey,
    boolean pathStyle,
    String publicUrl,
    String cdnDomain,
    boolean cdnEnabled,
    String accountId,
    String r2DevSubdomain,
    String workerDomain,
    boolean accelerate,
    boolean encryption,
    String storageClass,
    Duration timeout,
    ProviderCapabilities capabilities) {

  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  /** Build a configuration from raw settings. Required fields must already be checked. */
  public static ProviderConfig from(ProviderDescriptor descriptor, Map<String, String> settings) {
    ProviderType type = descriptor.type();
    String region = valueOr(settings, ProviderSettings.REGION, descriptor.defaultRegion());
    String accountId = value(settings, ProviderSettings.ACCOUNT_ID);
    if (accountId == null) {
      accountId = value(settings, ProviderSettings.ACCOUNT_ID_ALIAS);
    }
    String endpoint = value(settings, ProviderSettings.CUSTOM_ENDPOINT);
    if (endpoint == null) {
      endpoint = descriptor.endpointFor(region, accountId);
    }
    String workerDomain = value(settings, ProviderSettings.WORKER_DOMAIN);

    ProviderCapabilities capabilities = descriptor.capabilities();
    if (type == ProviderType.CLOUDFLARE_R2) {
      capabilities = capabilities.withTransform(workerDomain != null);
    }

    String timeoutSeconds = value(settings, ProviderSettings.TIMEOUT_SECONDS);
    Duration timeout =
        timeoutSeconds != null
            ? Duration.ofSeconds(Long.parseLong(timeoutSeconds))
            : DEFAULT_TIMEOUT;

    return new ProviderConfig(
        type,
        value(settings, ProviderSettings.BUCKET_NAME),
        region,
        endpoint,
        value(settings, ProviderSettings.ACCESS_KEY_ID),
        value(settings, ProviderSettings.SECRET_ACCESS_KEY),
        flag(settings, ProviderSettings.PATH_STYLE, type == ProviderType.CUSTOM_S3),
        value(settings, ProviderSettings.PUBLIC_URL),
        value(settings, ProviderSettings.CDN_DOMAIN),
        flag(settings, ProviderSettings.ENABLE_CDN, true),
        accountId,
        value(settings, ProviderSettings.R2_DEV_SUBDOMAIN),
        workerDomain,
        type == ProviderType.AWS_S3 && flag(settings, ProviderSettings.ACCELERATION, false),
        type == ProviderType.AWS_S3 && flag(settings, ProviderSettings.ENCRYPTION, false),
        valueOr(settings, ProviderSettings.STORAGE_CLASS, "STANDARD"),
        timeout,
        capabilities);
  }

  public boolean hasCredentials() {
    return accessKey != null && !accessKey.isEmpty() && secretKey != null && !secretKey.isEmpty();
  }

  public boolean hasCustomEndpoint() {
    return endpoint != null && !endpoint.isEmpty();
  }

  /** Trimmed setting value, or null when absent or blank. */
  static String value(Map<String, String> settings, String name) {
    String raw = settings.get(name);
    if (raw == null) {
      return null;
    }
    String trimmed = raw.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }

  private static String valueOr(Map<String, String> settings, String name, String fallback) {
    String raw = value(settings, name);
    return raw != null ? raw : fallback;
  }

  private static boolean flag(Map<String, String> settings, String name, boolean fallback) {
    String raw = value(settings, name);
    return raw != null ? Boolean.parseBoolean(raw) : fallback;
  }

  @Override
  public String toString() {
    return "ProviderConfig{type="
        + type
        + ", bucket="
        + bucket
        + ", region="
        + region
        + ", endpoint="
        + endpoint
        + ", accessKey="
        + (accessKey != null ? "***" : "null")
        + ", secretKey="
        + (secretKey != null ? "***" : "null")
        + ", pathStyle="
        + pathStyle
        + ", timeout="
        + timeout
        + "}";
  }
}
