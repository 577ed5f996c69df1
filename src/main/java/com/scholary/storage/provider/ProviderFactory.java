package com.scholary.storage.provider;

import com.scholary.storage.error.ErrorKind;
import com.scholary.storage.error.StorageException;
import com.scholary.storage.error.StorageResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds validated {@link StorageAdapter}s from raw provider settings.
 *
 * <p>Validation runs in a fixed order and stops at the first failure:
 *
 * <ol>
 *   <li>the provider type must be registered
 *   <li>every required field must be present and non-blank
 *   <li>the adapter is constructed
 *   <li>a connection test is run against the bucket
 * </ol>
 *
 * <p>The first two steps never touch the network, so a bad configuration is reported without a
 * single request being sent.
 */
public class ProviderFactory {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProviderFactory.class);

  private final ProviderRegistry registry;

  public ProviderFactory(ProviderRegistry registry) {
    this.registry = registry;
  }

  /** Create an adapter and verify it can reach its bucket. */
  public StorageAdapter createProvider(String type, Map<String, String> settings) {
    return createProvider(type, settings, true);
  }

  /**
   * Create an adapter.
   *
   * @param type provider id such as {@code aws-s3}
   * @param settings raw settings keyed by {@link ProviderSettings} names
   * @param verifyConnection whether to run the connection test before returning
   * @throws StorageException CONFIGURATION for unknown types or missing fields, CONNECTION when the
   *     connection test fails
   */
  public StorageAdapter createProvider(
      String type, Map<String, String> settings, boolean verifyConnection) {
    ProviderDescriptor descriptor = resolve(type);
    ProviderConfig config = validate(descriptor, settings);

    LOGGER.info("Creating storage provider: {}", config);
    StorageAdapter adapter;
    try {
      adapter = descriptor.constructor().apply(config);
    } catch (StorageException e) {
      throw e;
    } catch (RuntimeException e) {
      String message =
          String.format("Failed to initialize provider %s: %s", descriptor.id(), e.getMessage());
      LOGGER.error(message, e);
      throw new StorageException(ErrorKind.CONFIGURATION, message, descriptor.id(), null, e);
    }

    if (verifyConnection) {
      try {
        adapter.testConnection();
      } catch (StorageException e) {
        adapter.close();
        String message =
            String.format("Connection test failed for %s: %s", descriptor.id(), e.getMessage());
        LOGGER.error(message);
        throw new StorageException(ErrorKind.CONNECTION, message, descriptor.id(), null, e);
      }
    }
    return adapter;
  }

  /**
   * Check a configuration end to end without keeping the adapter. Used by admin screens before
   * settings are saved.
   */
  public StorageResult<ProviderInfo> testProviderConfig(String type, Map<String, String> settings) {
    try {
      StorageAdapter adapter = createProvider(type, settings, true);
      try {
        return StorageResult.ok(adapter.info());
      } finally {
        adapter.close();
      }
    } catch (StorageException e) {
      LOGGER.warn("Provider configuration test failed: type={}, kind={}", type, e.kind());
      return StorageResult.failure(e);
    }
  }

  /**
   * Validate raw settings against the descriptor and build the immutable configuration.
   *
   * @throws StorageException CONFIGURATION listing every missing field
   */
  public ProviderConfig validate(ProviderDescriptor descriptor, Map<String, String> settings) {
    Map<String, String> safeSettings = settings != null ? settings : Map.of();
    List<String> missing = new ArrayList<>();
    for (String field : descriptor.requiredFields()) {
      if (!isPresent(safeSettings, field)) {
        missing.add(field);
      }
    }
    if (!missing.isEmpty()) {
      String message =
          String.format(
              "Missing required configuration for %s: %s",
              descriptor.id(), String.join(", ", missing));
      LOGGER.error(message);
      throw new StorageException(ErrorKind.CONFIGURATION, message, descriptor.id(), null, null);
    }

    String endpoint = ProviderConfig.value(safeSettings, ProviderSettings.CUSTOM_ENDPOINT);
    if (endpoint != null && !endpoint.startsWith("http://") && !endpoint.startsWith("https://")) {
      throw new StorageException(
          ErrorKind.CONFIGURATION,
          String.format(
              "Invalid %s for %s: must start with http:// or https://",
              ProviderSettings.CUSTOM_ENDPOINT, descriptor.id()),
          descriptor.id(),
          null,
          null);
    }

    try {
      return ProviderConfig.from(descriptor, safeSettings);
    } catch (NumberFormatException e) {
      throw new StorageException(
          ErrorKind.CONFIGURATION,
          String.format(
              "Invalid %s for %s: not a number", ProviderSettings.TIMEOUT_SECONDS, descriptor.id()),
          descriptor.id(),
          null,
          e);
    }
  }

  /** Descriptor for a provider id, or CONFIGURATION listing the valid ids. */
  public ProviderDescriptor resolve(String type) {
    return registry
        .find(type)
        .orElseThrow(
            () -> {
              String message =
                  String.format(
                      "Unknown storage provider '%s'. Available: %s",
                      type, String.join(", ", registry.ids()));
              LOGGER.error(message);
              return new StorageException(ErrorKind.CONFIGURATION, message, type, null, null);
            });
  }

  public List<ProviderDescriptor> availableProviders() {
    return List.copyOf(registry.all());
  }

  /**
   * Endpoint a provider uses in a region, without creating anything.
   *
   * @return endpoint URL, or null for custom-s3 which has no default
   */
  public String providerEndpoint(String type, String region) {
    ProviderDescriptor descriptor = resolve(type);
    if (descriptor.type() == ProviderType.AWS_S3) {
      return AwsS3Adapter.endpointFor(region != null ? region : descriptor.defaultRegion());
    }
    return descriptor.endpointFor(region, null);
  }

  private static boolean isPresent(Map<String, String> settings, String field) {
    if (ProviderConfig.value(settings, field) != null) {
      return true;
    }
    return ProviderSettings.ACCOUNT_ID.equals(field)
        && ProviderConfig.value(settings, ProviderSettings.ACCOUNT_ID_ALIAS) != null;
  }
}
