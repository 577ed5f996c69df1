package com.scholary.storage.config;

import com.scholary.storage.image.ImageVariant;
import com.scholary.storage.path.FolderLayout;
import com.scholary.storage.retry.BackoffPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the storage engine.
 *
 * <p>Provider settings are a free-form map using the provider field names ({@code
 * aws_access_key_id}, {@code bucket_name} ...). In YAML the keys must be written in brackets so
 * Spring keeps the underscores. The factory re-validates them, so a bad map fails with a
 * configuration error naming the missing fields.
 */
@ConfigurationProperties(prefix = "storage")
@Validated
public record StorageProperties(
    @Valid @NotNull ProviderProperties primary,
    @Valid ProviderProperties backup,
    @Valid @NotNull PathProperties paths,
    @Valid @NotNull ImageProperties images,
    @Valid @NotNull UrlProperties urls,
    @Valid @NotNull RetryProperties retry,
    @Valid @NotNull MigrationProperties migration,
    @Valid @NotNull SyncProperties sync,
    @Valid @NotNull AuditProperties audit,
    @Valid @NotNull ExecutorProperties executors) {

  public record ProviderProperties(
      @NotBlank String type, Map<String, String> settings, boolean verifyConnection) {

    public Map<String, String> settingsOrEmpty() {
      return settings != null ? settings : Map.of();
    }
  }

  public record PathProperties(
      @NotNull FolderLayout folderStructure,
      String customFolderPattern,
      @Positive long maxFileSize,
      List<String> allowedExtensions) {}

  public record ImageProperties(
      boolean autoOptimize,
      @Min(1) @Max(100) int quality,
      @Positive int maxWidth,
      @Positive int maxHeight,
      boolean generateVariants,
      List<ImageVariant> variants) {}

  public record UrlProperties(
      boolean privateFiles,
      @NotNull Duration signedUrlExpiry,
      @Positive long cacheMaxSize,
      @Positive int batchThreads) {}

  public record RetryProperties(
      @PositiveOrZero int maxRetries,
      @NotNull Duration baseDelay,
      @Positive double factor,
      @NotNull Duration maxDelay,
      @NotNull Duration jitter) {

    public BackoffPolicy toPolicy() {
      return new BackoffPolicy(maxRetries, baseDelay, factor, maxDelay, jitter);
    }
  }

  public record MigrationProperties(@Positive int batchSize, @NotNull Duration batchPause) {}

  public record SyncProperties(@Positive int pageSize) {}

  public record AuditProperties(boolean logOperations) {}

  public record ExecutorProperties(
      @Positive int imageThreads,
      @Positive int imageQueueSize,
      @Positive int listenerThreads,
      @Positive int listenerQueueSize) {}
}
