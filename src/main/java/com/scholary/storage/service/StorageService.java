package com.scholary.storage.service;

import com.scholary.storage.config.StorageProperties;
import com.scholary.storage.config.StorageProperties.ImageProperties;
import com.scholary.storage.error.ErrorKind;
import com.scholary.storage.error.ErrorSanitizer;
import com.scholary.storage.error.StorageException;
import com.scholary.storage.error.StorageResult;
import com.scholary.storage.event.StorageEvent;
import com.scholary.storage.event.StorageEventPublisher;
import com.scholary.storage.image.ImageOptimizationOptions;
import com.scholary.storage.image.ImageOptimizer;
import com.scholary.storage.image.ImageVariant;
import com.scholary.storage.image.OptimizedImage;
import com.scholary.storage.logging.StructuredLogger;
import com.scholary.storage.path.FileDescriptor;
import com.scholary.storage.path.ObjectKeys;
import com.scholary.storage.path.PathManager;
import com.scholary.storage.provider.AdapterUploadResult;
import com.scholary.storage.provider.ProviderFactory;
import com.scholary.storage.provider.ProviderInfo;
import com.scholary.storage.provider.StorageAdapter;
import com.scholary.storage.provider.StorageAdapter.DeleteOutcome;
import com.scholary.storage.provider.StorageAdapter.ObjectSummary;
import com.scholary.storage.provider.StorageAdapter.StoredObject;
import com.scholary.storage.provider.UploadOptions;
import com.scholary.storage.retry.RetryContext;
import com.scholary.storage.retry.RetryExecutor;
import com.scholary.storage.url.UrlOptions;
import com.scholary.storage.url.UrlService;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Entry point for applications: upload, delete, URLs, migration from local disk and
 * primary/backup synchronization.
 *
 * <p>Every operation returns a {@link StorageResult}; expected failures never escape as exceptions.
 * The primary provider is authoritative. Writes to the backup provider are attempted after the
 * primary succeeded and their failure only shows up as {@code backup=false} plus a warning.
 * Nothing is rolled back.
 */
public class StorageService {

  private static final Logger LOGGER = LoggerFactory.getLogger(StorageService.class);

  private final StorageAdapter primary;
  private final StorageAdapter backup;
  private final ProviderFactory providerFactory;
  private final PathManager pathManager;
  private final ImageOptimizer imageOptimizer;
  private final UrlService urlService;
  private final RetryExecutor retryExecutor;
  private final StorageEventPublisher eventPublisher;
  private final StorageProperties properties;
  private final Executor imageExecutor;
  private final Clock clock;
  private final RetryExecutor.Sleeper sleeper;
  private final StorageCounters counters = new StorageCounters();
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  public StorageService(
      StorageAdapter primary,
      StorageAdapter backup,
      ProviderFactory providerFactory,
      PathManager pathManager,
      ImageOptimizer imageOptimizer,
      UrlService urlService,
      RetryExecutor retryExecutor,
      StorageEventPublisher eventPublisher,
      StorageProperties properties,
      Executor imageExecutor,
      Clock clock) {
    this(
        primary,
        backup,
        providerFactory,
        pathManager,
        imageOptimizer,
        urlService,
        retryExecutor,
        eventPublisher,
        properties,
        imageExecutor,
        clock,
        Thread::sleep);
  }

  /**
   * @param backup backup provider, null when none is configured
   * @param sleeper pause between migration batches
   */
  public StorageService(
      StorageAdapter primary,
      StorageAdapter backup,
      ProviderFactory providerFactory,
      PathManager pathManager,
      ImageOptimizer imageOptimizer,
      UrlService urlService,
      RetryExecutor retryExecutor,
      StorageEventPublisher eventPublisher,
      StorageProperties properties,
      Executor imageExecutor,
      Clock clock,
      RetryExecutor.Sleeper sleeper) {
    this.primary = primary;
    this.backup = backup;
    this.providerFactory = providerFactory;
    this.pathManager = pathManager;
    this.imageOptimizer = imageOptimizer;
    this.urlService = urlService;
    this.retryExecutor = retryExecutor;
    this.eventPublisher = eventPublisher;
    this.properties = properties;
    this.imageExecutor = imageExecutor;
    this.clock = clock;
    this.sleeper = sleeper;
  }

  /**
   * Validate, optionally optimize, and store a file on the primary provider, then copy it to the
   * backup provider when one is configured.
   */
  public StorageResult<UploadResult> upload(UploadRequest request) {
    return run("upload", request.targetKey(), () -> doUpload(request));
  }

  /** Delete a key from the primary provider and, best effort, from the backup provider. */
  public StorageResult<DeleteResult> delete(String key) {
    return run("delete", key, () -> doDelete(key));
  }

  public StorageResult<String> generateUrl(String key, UrlOptions options) {
    return run(
        "generateUrl",
        key,
        () -> {
          String url = urlService.generateUrl(key, options);
          counters.recordDownload();
          return url;
        });
  }

  public StorageResult<String> generateDownloadUrl(
      String key, String filename, Duration expiresIn) {
    return run(
        "generateDownloadUrl",
        key,
        () -> {
          String url = urlService.generateDownloadUrl(key, filename, expiresIn);
          counters.recordDownload();
          return url;
        });
  }

  /** Signed PUT URL so a client can upload straight to the primary provider. */
  public StorageResult<String> generateUploadUrl(
      String key, String contentType, Duration expiresIn) {
    return run(
        "generateUploadUrl", key, () -> urlService.generateUploadUrl(key, contentType, expiresIn));
  }

  /** One URL per key, in input order. Fails as a whole when any key fails. */
  public StorageResult<List<String>> batchGenerateUrls(List<String> keys, UrlOptions options) {
    return run(
        "batchGenerateUrls",
        null,
        () -> {
          List<String> urls = urlService.batchGenerateUrls(keys, options);
          urls.forEach(url -> counters.recordDownload());
          return urls;
        });
  }

  /**
   * Copy files from a local source into the primary provider in fixed-size batches.
   *
   * <p>Per-file failures are collected in the report. The whole call fails only when the source
   * cannot be listed.
   */
  public StorageResult<MigrationReport> migrateFromLocal(
      LocalFileSource source, MigrationOptions options, CancellationSignal signal) {
    return run("migrate", null, () -> doMigrate(source, options, signal));
  }

  /** Compare both providers without copying anything. */
  public StorageResult<SyncPlan> planSync(SyncOptions options) {
    return run("planSync", options.prefix(), () -> buildPlan(options));
  }

  /**
   * Copy missing objects between the primary and the backup provider.
   *
   * <p>Fails outright when no backup is configured or a listing cannot be obtained. Otherwise every
   * key is copied independently and reported.
   */
  public StorageResult<SyncReport> syncProviders(SyncOptions options, CancellationSignal signal) {
    return run("sync", options.prefix(), () -> doSync(options, signal));
  }

  public StorageResult<StorageStatistics> getStatistics() {
    return StorageResult.ok(
        new StorageStatistics(
            counters.snapshot(),
            primary.info(),
            backup != null ? backup.info() : null,
            urlService.cacheStats()));
  }

  /** Build and connect a provider from raw settings without keeping it. */
  public StorageResult<ProviderInfo> testProviderConfig(String type, Map<String, String> settings) {
    return providerFactory.testProviderConfig(type, settings);
  }

  private UploadResult doUpload(UploadRequest request) {
    pathManager.validateUpload(request.originalName(), request.size());

    String key =
        request.targetKey() != null
            ? ObjectKeys.validate(request.targetKey())
            : pathManager.generateKey(
                new FileDescriptor(
                    request.originalName(), request.mimeType(), request.uploaderId()));
    StructuredLogger.setOperationContext(currentOperationId(), primary.providerId(), key);
    LOGGER.info(
        "Uploading object: key={}, size={}, public={}", key, request.size(), request.isPublic());

    // Optimize images before they leave the process
    boolean image = pathManager.isImage(request.mimeType(), request.originalName());
    byte[] payload = request.data();
    boolean optimized = false;
    if (image && properties.images().autoOptimize()) {
      OptimizedImage result = optimize(payload);
      if (result.optimized()) {
        payload = result.data();
        optimized = true;
      }
    }

    UploadOptions options =
        new UploadOptions(
            request.mimeType(),
            metadataFor(request),
            request.isPublic(),
            pathManager.cacheControl(key),
            tagsFor(request));
    byte[] body = payload;
    AdapterUploadResult stored =
        retryExecutor.execute(
            new RetryContext("upload", primary.providerId(), key, ErrorKind.UPLOAD),
            () -> primary.upload(body, key, options));
    counters.recordUpload(stored.size());

    Map<String, String> variantKeys =
        image && properties.images().generateVariants()
            ? uploadVariants(request.data(), key, options)
            : Map.of();

    BackupWrite backupWrite =
        writeBackup("upload", key, ErrorKind.UPLOAD, () -> backup.upload(body, key, options));
    urlService.evict(key);

    eventPublisher.publish(
        new StorageEvent(
            StorageEvent.Type.UPLOADED,
            key,
            primary.providerId(),
            stored.size(),
            backupWrite.done(),
            request.uploaderId(),
            clock.instant(),
            originalNameAttribute(request.originalName())));

    LOGGER.info(
        "Uploaded object: key={}, size={}, optimized={}, backup={}",
        key,
        stored.size(),
        optimized,
        backupWrite.done());
    return new UploadResult(
        key,
        stored.url(),
        stored.size(),
        stored.provider(),
        stored.etag(),
        optimized,
        backupWrite.done(),
        variantKeys,
        backupWrite.error());
  }

  private DeleteResult doDelete(String key) {
    ObjectKeys.validate(key);
    LOGGER.info("Deleting object: key={}", key);

    DeleteOutcome outcome =
        retryExecutor.execute(
            new RetryContext("delete", primary.providerId(), key, ErrorKind.DELETE),
            () -> primary.delete(key));
    if (outcome.deleted()) {
      counters.recordDelete();
    }
    if (properties.images().generateVariants() && pathManager.isImage(null, key)) {
      deleteVariants(key);
    }

    BackupWrite backupWrite =
        writeBackup("delete", key, ErrorKind.DELETE, () -> backup.delete(key));
    urlService.evict(key);

    if (outcome.deleted()) {
      eventPublisher.publish(
          new StorageEvent(
              StorageEvent.Type.DELETED,
              key,
              primary.providerId(),
              0L,
              backupWrite.done(),
              null,
              clock.instant(),
              Map.of()));
    }
    return new DeleteResult(
        key, outcome.deleted(), primary.providerId(), backupWrite.done(), backupWrite.error());
  }

  private MigrationReport doMigrate(
      LocalFileSource source, MigrationOptions options, CancellationSignal signal) {
    List<LocalFile> files = source.list();
    List<LocalFile> selected =
        options.filter() != null ? files.stream().filter(options.filter()).toList() : files;
    int batchSize =
        options.batchSize() > 0 ? options.batchSize() : properties.migration().batchSize();
    int total = selected.size();

    LOGGER.info(
        "Starting migration: files={}, batchSize={}, dryRun={}",
        total,
        batchSize,
        options.dryRun());

    List<MigrationReport.Item> items = new ArrayList<>(total);
    int migrated = 0;
    int skipped = 0;
    int failed = 0;
    boolean cancelled = false;

    for (int start = 0; start < total && !cancelled; start += batchSize) {
      if (start > 0 && !pauseBetweenBatches()) {
        cancelled = true;
        break;
      }
      int end = Math.min(total, start + batchSize);
      for (int i = start; i < end; i++) {
        if (signal.isCancelled()) {
          cancelled = true;
          break;
        }
        LocalFile file = selected.get(i);
        MigrationReport.Item item = migrateOne(source, file, options);
        items.add(item);
        if (item.status() == MigrationReport.Status.MIGRATED) {
          migrated++;
        } else if (item.status() == MigrationReport.Status.SKIPPED) {
          skipped++;
        } else {
          failed++;
        }
        notifyProgress(options, new MigrationProgress(items.size(), total, file.path()));
      }
      structuredLogger.logMigrationProgress(items.size(), total, migrated, skipped, failed);
    }

    if (cancelled) {
      LOGGER.warn("Migration cancelled after {} of {} files", items.size(), total);
    }
    return new MigrationReport(total, migrated, skipped, failed, cancelled, items);
  }

  private MigrationReport.Item migrateOne(
      LocalFileSource source, LocalFile file, MigrationOptions options) {
    String key = pathManager.generateKeyFromLocal(file.path(), file.mimeType());
    if (options.dryRun()) {
      return new MigrationReport.Item(file.path(), key, MigrationReport.Status.SKIPPED, "dry run");
    }

    try {
      if (options.skipExisting()
          && retryExecutor.execute(
              new RetryContext("exists", primary.providerId(), key, ErrorKind.STORAGE),
              () -> primary.exists(key))) {
        return new MigrationReport.Item(
            file.path(), key, MigrationReport.Status.SKIPPED, "already exists");
      }

      byte[] data = source.read(file);
      Map<String, String> metadata = new LinkedHashMap<>();
      metadata.put("originalPath", headerSafe(file.path()));
      metadata.put("migratedAt", clock.instant().toString());
      UploadOptions uploadOptions =
          new UploadOptions(
              file.mimeType(),
              metadata,
              file.isPublic(),
              pathManager.cacheControl(key),
              Map.of("source", "migration"));

      AdapterUploadResult stored =
          retryExecutor.execute(
              new RetryContext("migrate", primary.providerId(), key, ErrorKind.UPLOAD),
              () -> primary.upload(data, key, uploadOptions));
      counters.recordUpload(stored.size());
      BackupWrite backupWrite =
          writeBackup(
              "upload", key, ErrorKind.UPLOAD, () -> backup.upload(data, key, uploadOptions));

      eventPublisher.publish(
          new StorageEvent(
              StorageEvent.Type.MIGRATED,
              key,
              primary.providerId(),
              stored.size(),
              backupWrite.done(),
              null,
              clock.instant(),
              Map.of("localPath", file.path())));
      return new MigrationReport.Item(file.path(), key, MigrationReport.Status.MIGRATED, null);

    } catch (StorageException e) {
      counters.recordError();
      String reason = ErrorSanitizer.sanitize(e.getMessage());
      LOGGER.warn("Migration of {} failed: kind={}, reason={}", file.path(), e.kind(), reason);
      return new MigrationReport.Item(file.path(), key, MigrationReport.Status.FAILED, reason);
    }
  }

  private SyncPlan buildPlan(SyncOptions options) {
    if (backup == null) {
      throw new StorageException(ErrorKind.CONFIGURATION, "No backup provider configured");
    }
    Map<String, String> primaryEtags = listEtags(primary, options.prefix());
    Map<String, String> backupEtags = listEtags(backup, options.prefix());
    SyncPlan plan = SyncPlanner.plan(primaryEtags, backupEtags, options.direction());
    LOGGER.info(
        "Sync plan: direction={}, toBackup={}, toPrimary={}, conflicts={}",
        options.direction(),
        plan.toBackup().size(),
        plan.toPrimary().size(),
        plan.conflicts().size());
    return plan;
  }

  private SyncReport doSync(SyncOptions options, CancellationSignal signal) {
    SyncPlan plan = buildPlan(options);
    if (options.dryRun()) {
      return new SyncReport(options.direction(), true, plan, false, List.of());
    }

    List<SyncReport.Copy> copies = new ArrayList<>();
    boolean cancelled = copyAll(plan.toBackup(), SyncReport.Target.BACKUP, options, signal, copies);
    if (!cancelled) {
      cancelled = copyAll(plan.toPrimary(), SyncReport.Target.PRIMARY, options, signal, copies);
    }

    SyncReport report = new SyncReport(options.direction(), false, plan, cancelled, copies);
    structuredLogger.logSyncFinished(
        options.direction().name(),
        (int) report.succeeded(),
        (int) report.failed(),
        plan.conflicts().size());
    return report;
  }

  /** Returns true when the signal stopped the loop. */
  private boolean copyAll(
      Iterable<String> keys,
      SyncReport.Target target,
      SyncOptions options,
      CancellationSignal signal,
      List<SyncReport.Copy> copies) {
    StorageAdapter from = target == SyncReport.Target.BACKUP ? primary : backup;
    StorageAdapter to = target == SyncReport.Target.BACKUP ? backup : primary;
    for (String key : keys) {
      if (signal.isCancelled()) {
        LOGGER.warn("Sync cancelled: copied={}", copies.size());
        return true;
      }
      copies.add(copy(from, to, key, target, options));
    }
    return false;
  }

  private SyncReport.Copy copy(
      StorageAdapter from,
      StorageAdapter to,
      String key,
      SyncReport.Target target,
      SyncOptions options) {
    try {
      StoredObject object =
          retryExecutor.execute(
              new RetryContext("sync-download", from.providerId(), key, ErrorKind.STORAGE),
              () -> from.download(key));
      UploadOptions uploadOptions =
          new UploadOptions(
              object.contentType(),
              object.metadata(),
              options.publicCopies(),
              pathManager.cacheControl(key),
              Map.of("source", "sync"));
      retryExecutor.execute(
          new RetryContext("sync-upload", to.providerId(), key, ErrorKind.UPLOAD),
          () -> to.upload(object.data(), key, uploadOptions));
      if (target == SyncReport.Target.PRIMARY) {
        urlService.evict(key);
      }

      eventPublisher.publish(
          new StorageEvent(
              StorageEvent.Type.SYNCED,
              key,
              to.providerId(),
              object.data().length,
              target == SyncReport.Target.BACKUP,
              null,
              clock.instant(),
              Map.of("from", from.providerId())));
      LOGGER.debug(
          "Synced object: key={}, from={}, to={}", key, from.providerId(), to.providerId());
      return new SyncReport.Copy(key, target, true, null);

    } catch (StorageException e) {
      counters.recordError();
      String reason = ErrorSanitizer.sanitize(e.getMessage());
      LOGGER.warn("Sync copy failed: key={}, target={}, reason={}", key, target, reason);
      return new SyncReport.Copy(key, target, false, reason);
    }
  }

  private Map<String, String> listEtags(StorageAdapter adapter, String prefix) {
    List<ObjectSummary> objects =
        retryExecutor.execute(
            new RetryContext("list", adapter.providerId(), prefix, ErrorKind.STORAGE),
            () -> adapter.listAll(prefix, properties.sync().pageSize()));
    Map<String, String> etags = new HashMap<>();
    for (ObjectSummary object : objects) {
      etags.put(object.key(), object.etag());
    }
    return etags;
  }

  private OptimizedImage optimize(byte[] data) {
    ImageProperties images = properties.images();
    ImageOptimizationOptions options =
        new ImageOptimizationOptions(
            images.quality(), images.maxWidth(), images.maxHeight(), null);
    try {
      return CompletableFuture.supplyAsync(
              () -> imageOptimizer.optimize(data, options), imageExecutor)
          .join();
    } catch (CompletionException | RejectedExecutionException e) {
      LOGGER.warn("Image optimization unavailable, uploading original: {}", e.getMessage());
      return new OptimizedImage(data, false, null, 0, 0);
    }
  }

  private List<ImageVariant> configuredVariants() {
    return properties.images().variants() != null && !properties.images().variants().isEmpty()
        ? properties.images().variants()
        : List.of(ImageVariant.values());
  }

  private Map<String, String> uploadVariants(byte[] original, String key, UploadOptions options) {
    int quality = properties.images().quality();

    Map<String, String> variantKeys = new LinkedHashMap<>();
    for (ImageVariant variant : configuredVariants()) {
      Optional<OptimizedImage> rendered = renderVariant(original, variant, quality);
      if (rendered.isEmpty()) {
        continue;
      }
      String variantKey = pathManager.variantKey(key, variant.suffix());
      byte[] data = rendered.get().data();
      try {
        retryExecutor.execute(
            new RetryContext("upload-variant", primary.providerId(), variantKey, ErrorKind.UPLOAD),
            () -> primary.upload(data, variantKey, options));
        urlService.evict(variantKey);
        variantKeys.put(variant.suffix(), variantKey);
      } catch (StorageException e) {
        LOGGER.warn(
            "Variant upload failed: key={}, kind={}, reason={}",
            variantKey,
            e.kind(),
            ErrorSanitizer.sanitize(e.getMessage()));
      }
    }
    return variantKeys;
  }

  private void deleteVariants(String key) {
    for (ImageVariant variant : configuredVariants()) {
      String variantKey = pathManager.variantKey(key, variant.suffix());
      try {
        retryExecutor.execute(
            new RetryContext("delete-variant", primary.providerId(), variantKey, ErrorKind.DELETE),
            () -> primary.delete(variantKey));
        urlService.evict(variantKey);
      } catch (StorageException e) {
        LOGGER.warn(
            "Variant delete failed: key={}, kind={}, reason={}",
            variantKey,
            e.kind(),
            ErrorSanitizer.sanitize(e.getMessage()));
      }
    }
  }

  private Optional<OptimizedImage> renderVariant(byte[] data, ImageVariant variant, int quality) {
    try {
      return CompletableFuture.supplyAsync(
              () -> imageOptimizer.createVariant(data, variant, quality), imageExecutor)
          .join();
    } catch (CompletionException | RejectedExecutionException e) {
      LOGGER.warn("Variant {} not rendered: {}", variant.suffix(), e.getMessage());
      return Optional.empty();
    }
  }

  private BackupWrite writeBackup(
      String operation, String key, ErrorKind fallbackKind, Supplier<?> action) {
    if (backup == null) {
      return new BackupWrite(false, null);
    }
    try {
      retryExecutor.execute(
          new RetryContext("backup-" + operation, backup.providerId(), key, fallbackKind), action);
      return new BackupWrite(true, null);
    } catch (StorageException e) {
      counters.recordBackupFailure();
      String reason = ErrorSanitizer.sanitize(e.getMessage());
      structuredLogger.logBackupFailed(operation, backup.providerId(), reason);
      return new BackupWrite(false, reason);
    }
  }

  private boolean pauseBetweenBatches() {
    long pauseMs = properties.migration().batchPause().toMillis();
    if (pauseMs <= 0) {
      return true;
    }
    try {
      sleeper.sleep(pauseMs);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Migration interrupted between batches");
      return false;
    }
  }

  private static void notifyProgress(MigrationOptions options, MigrationProgress progress) {
    if (options.onProgress() == null) {
      return;
    }
    try {
      options.onProgress().accept(progress);
    } catch (RuntimeException e) {
      LOGGER.warn("Progress callback failed at {}/{}", progress.processed(), progress.total(), e);
    }
  }

  private Map<String, String> metadataFor(UploadRequest request) {
    Map<String, String> metadata = new LinkedHashMap<>();
    request.metadata().forEach((name, value) -> metadata.put(name, headerSafe(value)));
    if (request.originalName() != null) {
      metadata.put("originalName", headerSafe(request.originalName()));
    }
    metadata.put(
        "uploadedBy",
        request.uploaderId() != null ? headerSafe(request.uploaderId()) : "anonymous");
    metadata.put("uploadTimestamp", clock.instant().toString());
    return metadata;
  }

  private Map<String, String> tagsFor(UploadRequest request) {
    Map<String, String> tags = new LinkedHashMap<>();
    tags.put("source", "upload");
    tags.put("uploadDate", LocalDate.now(clock).toString());
    tags.putAll(request.tags());
    return tags;
  }

  private <T> StorageResult<T> run(String operation, String key, Supplier<T> action) {
    StructuredLogger.setOperationContext(
        UUID.randomUUID().toString(), primary.providerId(), key);
    try {
      return StorageResult.ok(action.get());
    } catch (StorageException e) {
      counters.recordError();
      LOGGER.warn(
          "Operation {} failed: kind={}, key={}, reason={}",
          operation,
          e.kind(),
          e.key() != null ? e.key() : key,
          ErrorSanitizer.sanitize(e.getMessage()));
      return StorageResult.failure(e);
    } finally {
      StructuredLogger.clearOperationContext();
    }
  }

  private static String currentOperationId() {
    String operationId = MDC.get("operationId");
    return operationId != null ? operationId : UUID.randomUUID().toString();
  }

  private static Map<String, String> originalNameAttribute(String originalName) {
    return originalName != null ? Map.of("originalName", originalName) : Map.of();
  }

  // metadata travels as HTTP headers, which must be ASCII
  private static String headerSafe(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

  private record BackupWrite(boolean done, String error) {}
}
