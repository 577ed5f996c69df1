package com.scholary.storage.path;

import java.util.Set;

/** Broad file kinds, used for type-based folders and for upload rules. */
public enum FileCategory {
  IMAGE("images", Set.of("jpg", "jpeg", "png", "gif", "webp", "svg", "bmp", "tiff", "avif")),
  VIDEO("videos", Set.of("mp4", "avi", "mov", "wmv", "flv", "webm", "mkv")),
  AUDIO("audio", Set.of("mp3", "wav", "ogg", "aac", "flac", "m4a")),
  DOCUMENT(
      "documents", Set.of("pdf", "doc", "docx", "xls", "xlsx", "ppt", "pptx", "txt", "csv", "rtf")),
  ARCHIVE("archives", Set.of("zip", "rar", "7z", "tar", "gz", "bz2")),
  OTHER("files", Set.of());

  private final String folder;
  private final Set<String> extensions;

  FileCategory(String folder, Set<String> extensions) {
    this.folder = folder;
    this.extensions = extensions;
  }

  public String folder() {
    return folder;
  }

  public Set<String> extensions() {
    return extensions;
  }

  /**
   * Category from the MIME type when it is specific enough, otherwise from the extension.
   *
   * @param mimeType MIME type, may be null
   * @param extension lowercase extension without the dot, may be empty
   */
  public static FileCategory of(String mimeType, String extension) {
    if (mimeType != null) {
      if (mimeType.startsWith("image/")) {
        return IMAGE;
      }
      if (mimeType.startsWith("video/")) {
        return VIDEO;
      }
      if (mimeType.startsWith("audio/")) {
        return AUDIO;
      }
    }
    return ofExtension(extension);
  }

  public static FileCategory ofExtension(String extension) {
    for (FileCategory category : values()) {
      if (category.extensions.contains(extension)) {
        return category;
      }
    }
    return OTHER;
  }
}
