package com.scholary.storage.config;

import com.scholary.storage.provider.StorageAdapter;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** The primary adapter and the optional backup adapter built from {@link StorageProperties}. */
public class ConfiguredProviders implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConfiguredProviders.class);

  private final StorageAdapter primary;
  private final StorageAdapter backup;

  public ConfiguredProviders(StorageAdapter primary, StorageAdapter backup) {
    this.primary = primary;
    this.backup = backup;
  }

  public StorageAdapter primary() {
    return primary;
  }

  public Optional<StorageAdapter> backup() {
    return Optional.ofNullable(backup);
  }

  @Override
  public void close() {
    LOGGER.info("Closing storage providers");
    primary.close();
    if (backup != null) {
      backup.close();
    }
  }
}
