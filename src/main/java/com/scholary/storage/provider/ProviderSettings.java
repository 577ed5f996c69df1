package com.scholary.storage.provider;

/**
 * Names of the raw provider settings accepted by {@link ProviderFactory}.
 *
 * <p>The names follow the S3 SDK conventions used by most admin panels so a configuration can be
 * pasted between tools.
 */
public final class ProviderSettings {

  public static final String ACCESS_KEY_ID = "aws_access_key_id";
  public static final String SECRET_ACCESS_KEY = "aws_secret_access_key";
  public static final String BUCKET_NAME = "bucket_name";
  public static final String REGION = "aws_region";
  public static final String CUSTOM_ENDPOINT = "custom_endpoint";
  public static final String ACCOUNT_ID = "cloudflare_account_id";
  public static final String ACCOUNT_ID_ALIAS = "account_id";
  public static final String PUBLIC_URL = "public_url";
  public static final String CDN_DOMAIN = "cdn_domain";
  public static final String ENABLE_CDN = "enable_cdn";
  public static final String R2_DEV_SUBDOMAIN = "r2_dev_subdomain";
  public static final String WORKER_DOMAIN = "worker_domain";
  public static final String PATH_STYLE = "use_path_style";
  public static final String ACCELERATION = "use_acceleration";
  public static final String ENCRYPTION = "enable_encryption";
  public static final String STORAGE_CLASS = "storage_class";
  public static final String TIMEOUT_SECONDS = "timeout_seconds";

  private ProviderSettings() {}
}
