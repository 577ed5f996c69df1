package com.scholary.storage.path;

import com.scholary.storage.config.StorageProperties.PathProperties;
import com.scholary.storage.error.ErrorKind;
import com.scholary.storage.error.StorageException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns file names into object keys and decides per-key HTTP caching.
 *
 * <p>Generated keys look like {@code {folder}/{safe-name}-{epochMillis}-{8 hex}.{ext}}. The folder
 * depends on the configured {@link FolderLayout}. Key generation never fails: any problem,
 * including a key that would break {@link ObjectKeys}, yields
 * {@code files/{epochMillis}-{random}.bin}.
 */
public class PathManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(PathManager.class);

  static final String DEFAULT_CUSTOM_PATTERN = "{year}/{month}/";
  static final int MAX_BASE_NAME_LENGTH = 100;

  private static final Pattern UNSAFE_CHARS = Pattern.compile("[^a-zA-Z0-9.-]");
  private static final Pattern REPEATED_UNDERSCORES = Pattern.compile("_+");
  private static final Pattern EDGE_UNDERSCORES = Pattern.compile("^_+|_+$");

  private static final Set<String> EXECUTABLE_EXTENSIONS =
      Set.of(
          "exe", "bat", "cmd", "com", "pif", "scr", "vbs", "js", "jar", "app", "deb", "pkg",
          "rpm", "dmg", "sh", "run");
  private static final Set<String> FONT_EXTENSIONS = Set.of("woff", "woff2", "ttf", "otf", "eot");
  private static final Set<String> ASSET_EXTENSIONS = Set.of("css", "js");

  private final PathProperties properties;
  private final Clock clock;

  public PathManager(PathProperties properties, Clock clock) {
    this.properties = properties;
    this.clock = clock;
  }

  /** Unique key for an upload. Never throws. */
  public String generateKey(FileDescriptor file) {
    long timestamp = clock.millis();
    try {
      String originalName = file.originalName() != null ? file.originalName() : "";
      String extension = extension(originalName);
      String base = sanitize(baseName(originalName));
      if (base.isEmpty()) {
        base = "file";
      }
      String fileName =
          base + "-" + timestamp + "-" + randomHex() + (extension.isEmpty() ? "" : "." + extension);
      String folder = folderFor(file, extension, timestamp);
      String key = folder.isEmpty() ? fileName : folder + "/" + fileName;
      if (ObjectKeys.isValid(key)) {
        return key;
      }
      LOGGER.warn("Generated key breaks key rules, using fallback: originalName={}", originalName);
    } catch (RuntimeException e) {
      LOGGER.warn("Key generation failed, using fallback: {}", e.getMessage());
    }
    return fallbackKey(timestamp);
  }

  /**
   * Deterministic key for a file being migrated from local disk: type folder plus the sanitized
   * file name. Running a migration twice targets the same keys.
   */
  public String generateKeyFromLocal(String localPath, String mimeType) {
    String fileName = localPath;
    int slash = Math.max(localPath.lastIndexOf('/'), localPath.lastIndexOf('\\'));
    if (slash >= 0) {
      fileName = localPath.substring(slash + 1);
    }
    String extension = extension(fileName);
    String base = sanitize(baseName(fileName));
    if (base.isEmpty()) {
      base = "file";
    }
    String safeName = base + (extension.isEmpty() ? "" : "." + extension);
    String key = FileCategory.of(mimeType, extension).folder() + "/" + safeName;
    if (ObjectKeys.isValid(key)) {
      return key;
    }
    return "migrated/" + safeName;
  }

  /** Cache-Control value for a key, decided by its extension only. */
  public String cacheControl(String key) {
    String extension = extension(key);
    if (FileCategory.IMAGE.extensions().contains(extension)) {
      return "public, max-age=31536000, immutable";
    }
    if (FONT_EXTENSIONS.contains(extension)) {
      return "public, max-age=31536000";
    }
    if (ASSET_EXTENSIONS.contains(extension)) {
      return "public, max-age=2592000";
    }
    if (FileCategory.VIDEO.extensions().contains(extension)) {
      return "public, max-age=604800";
    }
    if (FileCategory.AUDIO.extensions().contains(extension)) {
      return "public, max-age=259200";
    }
    if (FileCategory.DOCUMENT.extensions().contains(extension)) {
      return "public, max-age=86400";
    }
    return "public, max-age=3600";
  }

  public boolean isImage(String mimeType, String name) {
    return FileCategory.of(mimeType, name != null ? extension(name) : "") == FileCategory.IMAGE;
  }

  /**
   * Check an upload against the size limit and the extension rules.
   *
   * @throws StorageException VALIDATION naming the broken rule
   */
  public void validateUpload(String originalName, long size) {
    if (size <= 0) {
      throw invalid(originalName, "File is empty");
    }
    if (size > properties.maxFileSize()) {
      throw invalid(
          originalName,
          String.format(
              "File size %d exceeds maximum of %d bytes", size, properties.maxFileSize()));
    }
    String extension = extension(originalName != null ? originalName : "");
    if (EXECUTABLE_EXTENSIONS.contains(extension)) {
      throw invalid(originalName, "Executable files are not allowed: ." + extension);
    }
    if (properties.allowedExtensions() != null
        && !properties.allowedExtensions().isEmpty()
        && !properties.allowedExtensions().contains(extension)) {
      throw invalid(originalName, String.format("File extension '.%s' is not allowed", extension));
    }
  }

  /** Key of a rendition: {@code photo.jpg} becomes {@code photo-thumbnail.jpg}. */
  public String variantKey(String key, String variant) {
    int slash = key.lastIndexOf('/');
    int dot = key.lastIndexOf('.');
    if (dot <= slash) {
      return key + "-" + variant;
    }
    return key.substring(0, dot) + "-" + variant + key.substring(dot);
  }

  /** Lowercase extension without the dot, empty when there is none. */
  public static String extension(String name) {
    int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
    int dot = name.lastIndexOf('.');
    if (dot <= slash + 1 || dot == name.length() - 1) {
      return "";
    }
    return name.substring(dot + 1).toLowerCase(Locale.ROOT);
  }

  /**
   * Replace anything outside {@code [a-zA-Z0-9.-]} with underscores, collapse and trim them, then
   * lowercase and bound the length.
   */
  public static String sanitize(String name) {
    String safe = UNSAFE_CHARS.matcher(name).replaceAll("_");
    safe = REPEATED_UNDERSCORES.matcher(safe).replaceAll("_");
    safe = EDGE_UNDERSCORES.matcher(safe).replaceAll("");
    safe = safe.toLowerCase(Locale.ROOT);
    return safe.length() > MAX_BASE_NAME_LENGTH ? safe.substring(0, MAX_BASE_NAME_LENGTH) : safe;
  }

  private String folderFor(FileDescriptor file, String extension, long timestamp) {
    LocalDate today = LocalDate.now(clock);
    switch (properties.folderStructure()) {
      case DATE_BASED:
        return String.format("%04d/%02d", today.getYear(), today.getMonthValue());
      case TYPE_BASED:
        return FileCategory.of(file.mimeType(), extension).folder();
      case USER_BASED:
        return "users/" + uploaderSegment(file.uploaderId());
      case CUSTOM:
        return customFolder(file, extension, today, timestamp);
      default:
        return "";
    }
  }

  private String customFolder(
      FileDescriptor file, String extension, LocalDate today, long timestamp) {
    String pattern =
        properties.customFolderPattern() != null && !properties.customFolderPattern().isBlank()
            ? properties.customFolderPattern()
            : DEFAULT_CUSTOM_PATTERN;
    String folder =
        pattern
            .replace("{year}", String.format("%04d", today.getYear()))
            .replace("{month}", String.format("%02d", today.getMonthValue()))
            .replace("{day}", String.format("%02d", today.getDayOfMonth()))
            .replace("{type}", FileCategory.of(file.mimeType(), extension).folder())
            .replace("{userId}", uploaderSegment(file.uploaderId()))
            .replace("{timestamp}", String.valueOf(timestamp));
    folder = folder.replaceAll("/{2,}", "/");
    while (folder.startsWith("/")) {
      folder = folder.substring(1);
    }
    while (folder.endsWith("/")) {
      folder = folder.substring(0, folder.length() - 1);
    }
    return folder;
  }

  private static String uploaderSegment(String uploaderId) {
    if (uploaderId == null || uploaderId.isBlank()) {
      return "anonymous";
    }
    String safe = sanitize(uploaderId);
    return safe.isEmpty() ? "anonymous" : safe;
  }

  private static String baseName(String name) {
    int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
    String fileName = slash >= 0 ? name.substring(slash + 1) : name;
    int dot = fileName.lastIndexOf('.');
    return dot > 0 ? fileName.substring(0, dot) : fileName;
  }

  private String fallbackKey(long timestamp) {
    return "files/" + timestamp + "-" + randomHex() + ".bin";
  }

  private static String randomHex() {
    return UUID.randomUUID().toString().replace("-", "").substring(0, 8);
  }

  private static StorageException invalid(String originalName, String rule) {
    return new StorageException(ErrorKind.VALIDATION, rule, null, originalName, null);
  }
}
