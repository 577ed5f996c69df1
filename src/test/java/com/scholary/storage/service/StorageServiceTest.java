package com.scholary.storage.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.scholary.storage.MutableClock;
import com.scholary.storage.config.StorageProperties;
import com.scholary.storage.config.TestStorageProperties;
import com.scholary.storage.error.ErrorKind;
import com.scholary.storage.error.StorageException;
import com.scholary.storage.error.StorageResult;
import com.scholary.storage.event.StorageEvent;
import com.scholary.storage.event.StorageEventPublisher;
import com.scholary.storage.image.ImageOptimizer;
import com.scholary.storage.path.PathManager;
import com.scholary.storage.provider.InMemoryStorageAdapter;
import com.scholary.storage.provider.ProviderFactory;
import com.scholary.storage.provider.ProviderInfo;
import com.scholary.storage.provider.ProviderRegistry;
import com.scholary.storage.provider.ProviderType;
import com.scholary.storage.provider.UploadOptions;
import com.scholary.storage.retry.BackoffPolicy;
import com.scholary.storage.retry.RetryExecutor;
import com.scholary.storage.url.UrlCache;
import com.scholary.storage.url.UrlOptions;
import com.scholary.storage.url.UrlService;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StorageServiceTest {

  private final MutableClock clock = new MutableClock(Instant.parse("2024-03-05T10:15:30Z"));
  private final List<StorageEvent> events = new CopyOnWriteArrayList<>();
  private final List<Long> pauses = new ArrayList<>();

  private InMemoryStorageAdapter primary;
  private InMemoryStorageAdapter backup;

  @BeforeEach
  void setUp() {
    primary = new InMemoryStorageAdapter(ProviderType.CUSTOM_S3, "primary");
    backup = new InMemoryStorageAdapter(ProviderType.AWS_S3, "backup");
  }

  @Test
  void uploadWritesPrimaryAndBackup() {
    StorageService service = service(TestStorageProperties.defaults(), backup);

    StorageResult<UploadResult> result =
        service.upload(
            UploadRequest.of(bytes("hello"), "Report Q1.pdf", "application/pdf")
                .withUploader("u-7"));

    assertThat(result.success()).isTrue();
    UploadResult upload = result.data();
    assertThat(upload.key()).matches("2024/03/report_q1-\\d+-[0-9a-f]{8}\\.pdf");
    assertThat(upload.url()).isEqualTo("https://primary.example.com/" + upload.key());
    assertThat(upload.size()).isEqualTo(5L);
    assertThat(upload.provider()).isEqualTo("custom-s3");
    assertThat(upload.backup()).isTrue();
    assertThat(upload.backupError()).isNull();
    assertThat(primary.content(upload.key())).isEqualTo(bytes("hello"));
    assertThat(backup.content(upload.key())).isEqualTo(bytes("hello"));

    UploadOptions options = primary.lastUploadOptions(upload.key());
    assertThat(options.contentType()).isEqualTo("application/pdf");
    assertThat(options.isPublic()).isTrue();
    assertThat(options.cacheControl()).isEqualTo("public, max-age=86400");
    assertThat(options.metadata())
        .containsEntry("originalName", "Report+Q1.pdf")
        .containsEntry("uploadedBy", "u-7")
        .containsEntry("uploadTimestamp", "2024-03-05T10:15:30Z");
    assertThat(options.tags())
        .containsEntry("source", "upload")
        .containsEntry("uploadDate", "2024-03-05");

    assertThat(events).hasSize(1);
    assertThat(events.get(0).type()).isEqualTo(StorageEvent.Type.UPLOADED);
    assertThat(events.get(0).actor()).isEqualTo("u-7");
    assertThat(events.get(0).backup()).isTrue();
  }

  @Test
  void uploadToSameKeyReplacesObject() {
    StorageService service = service(TestStorageProperties.defaults(), null);

    service.upload(
        UploadRequest.of(bytes("v1"), "a.txt", "text/plain").withTargetKey("docs/a.txt"));
    StorageResult<UploadResult> second =
        service.upload(
            UploadRequest.of(bytes("v2"), "a.txt", "text/plain").withTargetKey("docs/a.txt"));

    assertThat(second.data().key()).isEqualTo("docs/a.txt");
    assertThat(primary.keys()).containsExactly("docs/a.txt");
    assertThat(primary.content("docs/a.txt")).isEqualTo(bytes("v2"));
    assertThat(second.data().backup()).isFalse();
  }

  @Test
  void backupFailureDoesNotFailUpload() {
    backup.failAlways(
        "upload", new StorageException(ErrorKind.AUTHENTICATION, "Access denied for key AKIA123"));
    StorageService service = service(TestStorageProperties.defaults(), backup);

    StorageResult<UploadResult> result =
        service.upload(UploadRequest.of(bytes("data"), "a.txt", "text/plain"));

    assertThat(result.success()).isTrue();
    assertThat(result.data().backup()).isFalse();
    assertThat(result.data().backupError()).contains("Access denied");
    assertThat(primary.contains(result.data().key())).isTrue();
    assertThat(backup.calls("upload")).isEqualTo(1);
    assertThat(service.getStatistics().data().counters().backupFailures()).isEqualTo(1);
    assertThat(service.getStatistics().data().counters().uploads()).isEqualTo(1);
  }

  @Test
  void transientPrimaryFailuresAreRetried() {
    primary.failNext(
        "upload",
        new StorageException(ErrorKind.CONNECTION, "reset"),
        new StorageException(ErrorKind.TIMEOUT, "slow"));
    StorageService service = service(TestStorageProperties.defaults(), null);

    StorageResult<UploadResult> result =
        service.upload(UploadRequest.of(bytes("data"), "a.txt", "text/plain"));

    assertThat(result.success()).isTrue();
    assertThat(primary.calls("upload")).isEqualTo(3);
  }

  @Test
  void primaryFailureSkipsBackup() {
    primary.failAlways("upload", new StorageException(ErrorKind.CONNECTION, "down"));
    StorageService service = service(TestStorageProperties.defaults(), backup);

    StorageResult<UploadResult> result =
        service.upload(UploadRequest.of(bytes("data"), "a.txt", "text/plain"));

    assertThat(result.success()).isFalse();
    assertThat(result.error().kind()).isEqualTo(ErrorKind.CONNECTION);
    assertThat(primary.calls("upload")).isEqualTo(4);
    assertThat(backup.calls("upload")).isZero();
    assertThat(events).isEmpty();
  }

  @Test
  void rejectedFilesNeverReachProvider() {
    StorageService service = service(TestStorageProperties.defaults(), null);

    StorageResult<UploadResult> executable =
        service.upload(UploadRequest.of(bytes("MZ"), "setup.exe", "application/octet-stream"));
    StorageResult<UploadResult> empty =
        service.upload(UploadRequest.of(new byte[0], "empty.txt", "text/plain"));
    StorageResult<UploadResult> badKey =
        service.upload(UploadRequest.of(bytes("x"), "a.txt", "text/plain").withTargetKey(" a "));

    assertThat(executable.error().kind()).isEqualTo(ErrorKind.VALIDATION);
    assertThat(executable.error().message()).contains("Executable files are not allowed");
    assertThat(empty.error().kind()).isEqualTo(ErrorKind.VALIDATION);
    assertThat(badKey.error().kind()).isEqualTo(ErrorKind.VALIDATION);
    assertThat(primary.calls("upload")).isZero();
    assertThat(service.getStatistics().data().counters().errors()).isEqualTo(3);
  }

  @Test
  void oversizedImageIsDownscaledBeforeUpload() throws IOException {
    StorageService service =
        service(TestStorageProperties.withImages(TestStorageProperties.images(true, false)), null);
    byte[] wide = png(3000, 100);

    StorageResult<UploadResult> result =
        service.upload(UploadRequest.of(wide, "banner.png", "image/png"));

    assertThat(result.success()).isTrue();
    assertThat(result.data().optimized()).isTrue();
    BufferedImage stored =
        ImageIO.read(new ByteArrayInputStream(primary.content(result.data().key())));
    assertThat(stored.getWidth()).isEqualTo(2048);
  }

  @Test
  void variantsAreUploadedNextToOriginal() throws IOException {
    StorageService service =
        service(TestStorageProperties.withImages(TestStorageProperties.images(false, true)), null);

    StorageResult<UploadResult> result =
        service.upload(UploadRequest.of(png(600, 400), "cat.png", "image/png"));

    String key = result.data().key();
    String base = key.substring(0, key.length() - ".png".length());
    assertThat(result.data().variantKeys())
        .containsEntry("thumbnail", base + "-thumbnail.png")
        .containsEntry("small", base + "-small.png");
    assertThat(primary.keys()).contains(key, base + "-thumbnail.png", base + "-small.png");
  }

  @Test
  void failedVariantDoesNotFailUpload() throws IOException {
    StorageService service =
        service(TestStorageProperties.withImages(TestStorageProperties.images(false, true)), null);
    primary.failUploadsEndingWith(
        "-thumbnail.png", new StorageException(ErrorKind.VALIDATION, "rejected"));

    StorageResult<UploadResult> result =
        service.upload(UploadRequest.of(png(600, 400), "dog.png", "image/png"));

    assertThat(result.success()).isTrue();
    assertThat(result.data().variantKeys()).containsOnlyKeys("small");
    assertThat(primary.contains(result.data().key())).isTrue();
  }

  @Test
  void deleteRemovesImageVariants() throws IOException {
    StorageService service =
        service(TestStorageProperties.withImages(TestStorageProperties.images(false, true)), null);
    String key =
        service.upload(UploadRequest.of(png(600, 400), "cat.png", "image/png")).data().key();
    assertThat(primary.keys()).hasSize(3);

    StorageResult<DeleteResult> result = service.delete(key);

    assertThat(result.data().deleted()).isTrue();
    assertThat(primary.keys()).isEmpty();
    assertThat(service.getStatistics().data().counters().deletes()).isEqualTo(1);
  }

  @Test
  void deleteWithMissingVariantsStillSucceeds() {
    primary.seed("2024/03/old.png", "png");
    StorageService service =
        service(TestStorageProperties.withImages(TestStorageProperties.images(false, true)), null);

    StorageResult<DeleteResult> result = service.delete("2024/03/old.png");

    assertThat(result.success()).isTrue();
    assertThat(result.data().deleted()).isTrue();
    assertThat(primary.calls("delete")).isEqualTo(3);
  }

  @Test
  void callerMetadataIsEncodedForHeaders() {
    StorageService service = service(TestStorageProperties.defaults(), null);
    Map<String, String> metadata = new LinkedHashMap<>();
    metadata.put("caption", "café über");

    StorageResult<UploadResult> result =
        service.upload(
            UploadRequest.of(bytes("data"), "a.txt", "text/plain")
                .withUploader("zoë")
                .withMetadata(metadata));

    Map<String, String> stored = primary.lastUploadOptions(result.data().key()).metadata();
    assertThat(stored)
        .containsEntry("caption", "caf%C3%A9+%C3%BCber")
        .containsEntry("uploadedBy", "zo%C3%AB");
    assertThat(stored.values()).allMatch(value -> value.matches("\\p{ASCII}*"));
  }

  @Test
  void deleteOfMissingKeySucceeds() {
    StorageService service = service(TestStorageProperties.defaults(), backup);

    StorageResult<DeleteResult> result = service.delete("never/uploaded.txt");

    assertThat(result.success()).isTrue();
    assertThat(result.data().deleted()).isFalse();
    assertThat(events).isEmpty();
    assertThat(service.getStatistics().data().counters().deletes()).isZero();
  }

  @Test
  void deleteRemovesFromBothProviders() {
    primary.seed("docs/a.txt", "a");
    backup.seed("docs/a.txt", "a");
    StorageService service = service(TestStorageProperties.defaults(), backup);

    StorageResult<DeleteResult> result = service.delete("docs/a.txt");

    assertThat(result.data().deleted()).isTrue();
    assertThat(result.data().backup()).isTrue();
    assertThat(primary.contains("docs/a.txt")).isFalse();
    assertThat(backup.contains("docs/a.txt")).isFalse();
    assertThat(events).extracting(StorageEvent::type).containsExactly(StorageEvent.Type.DELETED);
  }

  @Test
  void deleteInvalidatesCachedUrls() {
    primary.seed("docs/a.txt", "a");
    StorageService service = service(TestStorageProperties.defaults(), null);
    UrlOptions signed = UrlOptions.signed(Duration.ofMinutes(10));
    String before = service.generateUrl("docs/a.txt", signed).data();

    service.delete("docs/a.txt");

    assertThat(service.generateUrl("docs/a.txt", signed).data()).isNotEqualTo(before);
    assertThat(service.getStatistics().data().counters().downloads()).isEqualTo(2);
  }

  @Test
  void urlFailuresAreReturnedNotThrown() {
    primary.withoutSigning();
    StorageService service = service(TestStorageProperties.defaults(), null);

    StorageResult<String> url = service.generateUrl("a.txt", UrlOptions.signed(null));
    StorageResult<List<String>> batch =
        service.batchGenerateUrls(List.of("a.txt", "b.txt"), UrlOptions.signed(null));

    assertThat(url.success()).isFalse();
    assertThat(url.error().kind()).isEqualTo(ErrorKind.CONFIGURATION);
    assertThat(batch.success()).isFalse();
  }

  @Test
  void downloadAndUploadUrls() {
    StorageService service = service(TestStorageProperties.defaults(), null);

    String download = service.generateDownloadUrl("docs/a.txt", "a.txt", null).data();
    String upload =
        service.generateUploadUrl("incoming/b.png", "image/png", Duration.ofMinutes(5)).data();

    assertThat(download).contains("op=GET").contains("response-content-disposition=");
    assertThat(upload).contains("op=PUT").contains("expires=300");
  }

  @Test
  void migrationRunsInBatchesWithPauses() {
    FakeSource source = new FakeSource();
    for (int i = 1; i <= 5; i++) {
      source.add("docs/file" + i + ".txt", "text/plain", "content " + i);
    }
    List<MigrationProgress> progress = new ArrayList<>();
    StorageService service = service(TestStorageProperties.defaults(), backup);

    MigrationReport report =
        service
            .migrateFromLocal(
                source,
                MigrationOptions.defaults().withBatchSize(2).withProgress(progress::add),
                CancellationSignal.none())
            .data();

    assertThat(report.total()).isEqualTo(5);
    assertThat(report.migrated()).isEqualTo(5);
    assertThat(report.cancelled()).isFalse();
    assertThat(pauses).containsExactly(100L, 100L);
    assertThat(primary.keys())
        .containsExactly(
            "documents/file1.txt",
            "documents/file2.txt",
            "documents/file3.txt",
            "documents/file4.txt",
            "documents/file5.txt");
    assertThat(backup.keys()).hasSize(5);
    assertThat(primary.lastUploadOptions("documents/file1.txt").tags())
        .containsEntry("source", "migration");
    assertThat(primary.lastUploadOptions("documents/file1.txt").metadata())
        .containsEntry("originalPath", "docs%2Ffile1.txt");
    assertThat(progress).hasSize(5);
    assertThat(progress.get(4).processed()).isEqualTo(5);
    assertThat(progress.get(4).total()).isEqualTo(5);
    assertThat(events).extracting(StorageEvent::type).containsOnly(StorageEvent.Type.MIGRATED);
  }

  @Test
  void dryRunMigrationWritesNothing() {
    FakeSource source = new FakeSource();
    source.add("a.jpg", "image/jpeg", "jpg");
    source.add("b.pdf", "application/pdf", "pdf");
    StorageService service = service(TestStorageProperties.defaults(), null);

    MigrationReport report =
        service
            .migrateFromLocal(
                source, MigrationOptions.defaults().asDryRun(), CancellationSignal.none())
            .data();

    assertThat(report.skipped()).isEqualTo(2);
    assertThat(report.items())
        .extracting(MigrationReport.Item::key)
        .containsExactly("images/a.jpg", "documents/b.pdf");
    assertThat(report.items()).extracting(MigrationReport.Item::reason).containsOnly("dry run");
    assertThat(primary.calls("upload")).isZero();
    assertThat(source.reads).isZero();
  }

  @Test
  void migrationStopsWhenCancelled() {
    FakeSource source = new FakeSource();
    for (int i = 1; i <= 6; i++) {
      source.add("f" + i + ".txt", "text/plain", "x");
    }
    CancellationSignal signal = new CancellationSignal();
    StorageService service = service(TestStorageProperties.defaults(), null);

    MigrationReport report =
        service
            .migrateFromLocal(
                source,
                MigrationOptions.defaults()
                    .withProgress(
                        p -> {
                          if (p.processed() == 2) {
                            signal.cancel();
                          }
                        }),
                signal)
            .data();

    assertThat(report.cancelled()).isTrue();
    assertThat(report.items()).hasSize(2);
    assertThat(primary.keys()).hasSize(2);
  }

  @Test
  void migrationRecordsPerFileFailures() {
    FakeSource source = new FakeSource();
    source.add("good.txt", "text/plain", "ok");
    source.add("broken.txt", "text/plain", "never read");
    source.add("existing.txt", "text/plain", "old");
    source.failing.add("broken.txt");
    primary.seed("documents/existing.txt", "already there");
    StorageService service = service(TestStorageProperties.defaults(), null);

    MigrationReport report =
        service
            .migrateFromLocal(
                source, MigrationOptions.defaults().skippingExisting(), CancellationSignal.none())
            .data();

    assertThat(report.migrated()).isEqualTo(1);
    assertThat(report.skipped()).isEqualTo(1);
    assertThat(report.failed()).isEqualTo(1);
    assertThat(report.failures())
        .extracting(MigrationReport.Item::path)
        .containsExactly("broken.txt");
    assertThat(primary.content("documents/existing.txt")).isEqualTo(bytes("already there"));
  }

  @Test
  void migrationFiltersFiles() {
    FakeSource source = new FakeSource();
    source.add("a.jpg", "image/jpeg", "jpg");
    source.add("b.txt", "text/plain", "txt");
    StorageService service = service(TestStorageProperties.defaults(), null);

    MigrationReport report =
        service
            .migrateFromLocal(
                source,
                MigrationOptions.defaults().withFilter(file -> file.path().endsWith(".jpg")),
                CancellationSignal.none())
            .data();

    assertThat(report.total()).isEqualTo(1);
    assertThat(primary.keys()).containsExactly("images/a.jpg");
  }

  @Test
  void syncCopiesMissingObjectsToBackup() {
    primary.seed("a.txt", "A");
    primary.seed("b.txt", "B");
    backup.seed("b.txt", "B");
    backup.seed("d.txt", "D");
    StorageService service = service(TestStorageProperties.defaults(), backup);

    SyncReport report =
        service.syncProviders(SyncOptions.defaults(), CancellationSignal.none()).data();

    assertThat(report.plan().toBackup()).containsExactly("a.txt");
    assertThat(report.succeeded()).isEqualTo(1);
    assertThat(backup.content("a.txt")).isEqualTo(bytes("A"));
    assertThat(backup.lastUploadOptions("a.txt").isPublic()).isFalse();
    assertThat(backup.lastUploadOptions("a.txt").tags()).containsEntry("source", "sync");
    assertThat(primary.contains("d.txt")).isFalse();
  }

  @Test
  void bidirectionalSyncReportsConflictsWithoutCopying() {
    primary.seed("a.txt", "A");
    primary.seed("c.txt", "primary version");
    backup.seed("c.txt", "backup version");
    backup.seed("d.txt", "D");
    StorageService service = service(TestStorageProperties.defaults(), backup);

    SyncReport report =
        service
            .syncProviders(SyncOptions.of(SyncDirection.BIDIRECTIONAL), CancellationSignal.none())
            .data();

    assertThat(report.plan().conflicts()).containsExactly("c.txt");
    assertThat(report.copies())
        .extracting(SyncReport.Copy::key, SyncReport.Copy::target)
        .containsExactly(
            tuple("a.txt", SyncReport.Target.BACKUP), tuple("d.txt", SyncReport.Target.PRIMARY));
    assertThat(primary.content("c.txt")).isEqualTo(bytes("primary version"));
    assertThat(backup.content("c.txt")).isEqualTo(bytes("backup version"));
  }

  @Test
  void dryRunSyncOnlyPlans() {
    primary.seed("a.txt", "A");
    StorageService service = service(TestStorageProperties.defaults(), backup);

    StorageResult<SyncPlan> plan = service.planSync(SyncOptions.defaults());
    SyncReport report =
        service.syncProviders(SyncOptions.defaults().asDryRun(), CancellationSignal.none()).data();

    assertThat(plan.data().toBackup()).containsExactly("a.txt");
    assertThat(report.dryRun()).isTrue();
    assertThat(report.copies()).isEmpty();
    assertThat(backup.calls("upload")).isZero();
  }

  @Test
  void syncContinuesPastFailedCopies() {
    primary.seed("a.txt", "A");
    primary.seed("b.txt", "B");
    backup.failNext("upload", new StorageException(ErrorKind.VALIDATION, "rejected"));
    StorageService service = service(TestStorageProperties.defaults(), backup);

    SyncReport report =
        service.syncProviders(SyncOptions.defaults(), CancellationSignal.none()).data();

    assertThat(report.failed()).isEqualTo(1);
    assertThat(report.succeeded()).isEqualTo(1);
    assertThat(backup.keys()).containsExactly("b.txt");
  }

  @Test
  void syncWithoutBackupFails() {
    StorageService service = service(TestStorageProperties.defaults(), null);

    StorageResult<SyncReport> result =
        service.syncProviders(SyncOptions.defaults(), CancellationSignal.none());

    assertThat(result.success()).isFalse();
    assertThat(result.error().kind()).isEqualTo(ErrorKind.CONFIGURATION);
  }

  @Test
  void syncFailsWhenListingFails() {
    backup.failAlways("list", new StorageException(ErrorKind.AUTHENTICATION, "denied"));
    StorageService service = service(TestStorageProperties.defaults(), backup);

    StorageResult<SyncReport> result =
        service.syncProviders(SyncOptions.defaults(), CancellationSignal.none());

    assertThat(result.success()).isFalse();
    assertThat(result.error().kind()).isEqualTo(ErrorKind.AUTHENTICATION);
  }

  @Test
  void statisticsDescribeBothProviders() {
    StorageService service = service(TestStorageProperties.defaults(), backup);
    service.upload(UploadRequest.of(bytes("12345"), "a.txt", "text/plain"));

    StorageStatistics statistics = service.getStatistics().data();

    assertThat(statistics.counters().uploads()).isEqualTo(1);
    assertThat(statistics.counters().bytesUploaded()).isEqualTo(5);
    assertThat(statistics.primary().type()).isEqualTo("custom-s3");
    assertThat(statistics.backup().type()).isEqualTo("aws-s3");
    assertThat(statistics.urlCache()).isNotNull();
  }

  @Test
  void providerConfigCheckReportsMissingFields() {
    StorageService service = service(TestStorageProperties.defaults(), null);

    StorageResult<ProviderInfo> result = service.testProviderConfig("aws-s3", Map.of());

    assertThat(result.success()).isFalse();
    assertThat(result.error().kind()).isEqualTo(ErrorKind.CONFIGURATION);
    assertThat(result.error().message()).contains("aws_access_key_id");
  }

  private StorageService service(
      StorageProperties properties, InMemoryStorageAdapter backupAdapter) {
    PathManager pathManager = new PathManager(properties.paths(), clock);
    UrlService urlService =
        new UrlService(
            primary, pathManager, properties.urls(), new UrlCache(1000, clock), Runnable::run);
    return new StorageService(
        primary,
        backupAdapter,
        new ProviderFactory(ProviderRegistry.defaults()),
        pathManager,
        new ImageOptimizer(),
        urlService,
        new RetryExecutor(BackoffPolicy.immediate(3)),
        new StorageEventPublisher(List.of(events::add), Runnable::run),
        properties,
        Runnable::run,
        clock,
        pauses::add);
  }

  private static byte[] bytes(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }

  private static byte[] png(int width, int height) throws IOException {
    BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    Graphics2D graphics = image.createGraphics();
    try {
      graphics.setColor(Color.ORANGE);
      graphics.fillRect(0, 0, width, height);
      graphics.setColor(Color.BLUE);
      graphics.fillOval(width / 4, height / 4, width / 2, height / 2);
    } finally {
      graphics.dispose();
    }
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    ImageIO.write(image, "png", out);
    return out.toByteArray();
  }

  /** Local files held in memory. */
  private static class FakeSource implements LocalFileSource {

    private final Map<String, LocalFile> files = new LinkedHashMap<>();
    private final Map<String, byte[]> contents = new LinkedHashMap<>();
    private final List<String> failing = new ArrayList<>();
    private int reads;

    void add(String path, String mimeType, String content) {
      byte[] data = content.getBytes(StandardCharsets.UTF_8);
      files.put(path, new LocalFile(path, mimeType, data.length, true));
      contents.put(path, data);
    }

    @Override
    public List<LocalFile> list() {
      return new ArrayList<>(files.values());
    }

    @Override
    public byte[] read(LocalFile file) {
      reads++;
      if (failing.contains(file.path())) {
        throw new StorageException(
            ErrorKind.STORAGE, "Failed to read " + file.path(), null, file.path(), null);
      }
      return contents.get(file.path());
    }
  }
}
