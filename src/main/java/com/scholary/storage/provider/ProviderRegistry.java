package com.scholary.storage.provider;

import static com.scholary.storage.provider.ProviderSettings.ACCESS_KEY_ID;
import static com.scholary.storage.provider.ProviderSettings.ACCOUNT_ID;
import static com.scholary.storage.provider.ProviderSettings.BUCKET_NAME;
import static com.scholary.storage.provider.ProviderSettings.CUSTOM_ENDPOINT;
import static com.scholary.storage.provider.ProviderSettings.REGION;
import static com.scholary.storage.provider.ProviderSettings.SECRET_ACCESS_KEY;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Compile-time table of provider families.
 *
 * <p>Every supported backend is listed here with its required settings, region list, capabilities
 * and adapter constructor. There is no runtime discovery: adding a provider means adding an entry.
 */
public final class ProviderRegistry {

  private static final List<String> COMMON_FIELDS =
      List.of(ACCESS_KEY_ID, SECRET_ACCESS_KEY, BUCKET_NAME);

  private final Map<ProviderType, ProviderDescriptor> descriptors;

  private ProviderRegistry(Map<ProviderType, ProviderDescriptor> descriptors) {
    this.descriptors = Collections.unmodifiableMap(new EnumMap<>(descriptors));
  }

  public static ProviderRegistry defaults() {
    Map<ProviderType, ProviderDescriptor> table = new EnumMap<>(ProviderType.class);
    register(
        table,
        new ProviderDescriptor(
            ProviderType.AWS_S3,
            "Amazon S3",
            fields(REGION),
            "us-east-1",
            List.of("us-east-1", "us-west-2", "eu-west-1", "ap-southeast-1"),
            new ProviderCapabilities(true, true, false),
            null,
            AwsS3Adapter::new));
    register(
        table,
        new ProviderDescriptor(
            ProviderType.CLOUDFLARE_R2,
            "Cloudflare R2",
            fields(ACCOUNT_ID),
            "auto",
            List.of("auto"),
            new ProviderCapabilities(false, false, false),
            "https://{accountId}.r2.cloudflarestorage.com",
            CloudflareR2Adapter::new));
    register(
        table,
        new ProviderDescriptor(
            ProviderType.DIGITALOCEAN_SPACES,
            "DigitalOcean Spaces",
            fields(REGION),
            "nyc3",
            List.of("nyc3", "sgp1", "fra1", "ams3"),
            ProviderCapabilities.none(),
            "https://{region}.digitaloceanspaces.com",
            DigitalOceanSpacesAdapter::new));
    register(
        table,
        new ProviderDescriptor(
            ProviderType.VULTR_STORAGE,
            "Vultr Object Storage",
            fields(REGION),
            "ewr1",
            List.of("ewr1", "sjc1", "ams1"),
            ProviderCapabilities.none(),
            "https://{region}.vultrobjects.com",
            VultrStorageAdapter::new));
    register(
        table,
        new ProviderDescriptor(
            ProviderType.LINODE_STORAGE,
            "Linode Object Storage",
            fields(REGION),
            "us-east-1",
            List.of("us-east-1", "eu-central-1", "ap-south-1"),
            ProviderCapabilities.none(),
            "https://{region}.linodeobjects.com",
            LinodeStorageAdapter::new));
    register(
        table,
        new ProviderDescriptor(
            ProviderType.CUSTOM_S3,
            "Custom S3-compatible",
            fields(CUSTOM_ENDPOINT),
            "us-east-1",
            List.of(),
            ProviderCapabilities.none(),
            null,
            S3StorageAdapter::new));
    return new ProviderRegistry(table);
  }

  /** Registry over an explicit set of descriptors. */
  public static ProviderRegistry of(Collection<ProviderDescriptor> entries) {
    Map<ProviderType, ProviderDescriptor> table = new EnumMap<>(ProviderType.class);
    entries.forEach(descriptor -> register(table, descriptor));
    return new ProviderRegistry(table);
  }

  /** Copy of this registry with one family's adapter constructor replaced. */
  public ProviderRegistry withConstructor(
      ProviderType type, Function<ProviderConfig, StorageAdapter> constructor) {
    Map<ProviderType, ProviderDescriptor> table = new EnumMap<>(descriptors);
    ProviderDescriptor existing = table.get(type);
    if (existing == null) {
      throw new IllegalArgumentException("Provider not registered: " + type);
    }
    table.put(type, existing.withConstructor(constructor));
    return new ProviderRegistry(table);
  }

  public Optional<ProviderDescriptor> find(String id) {
    return ProviderType.fromId(id).map(descriptors::get);
  }

  public Optional<ProviderDescriptor> find(ProviderType type) {
    return Optional.ofNullable(descriptors.get(type));
  }

  public Collection<ProviderDescriptor> all() {
    return descriptors.values();
  }

  public List<String> ids() {
    return descriptors.keySet().stream().map(ProviderType::id).toList();
  }

  private static void register(
      Map<ProviderType, ProviderDescriptor> table, ProviderDescriptor descriptor) {
    if (table.putIfAbsent(descriptor.type(), descriptor) != null) {
      throw new IllegalStateException("Duplicate provider registration: " + descriptor.id());
    }
  }

  private static List<String> fields(String... extra) {
    List<String> result = new ArrayList<>(COMMON_FIELDS);
    result.addAll(List.of(extra));
    return List.copyOf(result);
  }
}
