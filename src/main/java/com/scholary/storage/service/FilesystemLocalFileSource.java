package com.scholary.storage.service;

import com.scholary.storage.error.ErrorKind;
import com.scholary.storage.error.StorageException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLConnection;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link LocalFileSource} over a directory tree, typically the old local upload folder.
 *
 * <p>Hidden files are skipped. Paths are reported relative to the root and sorted so that repeated
 * runs see the same order.
 */
public class FilesystemLocalFileSource implements LocalFileSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(FilesystemLocalFileSource.class);

  private final Path root;
  private final boolean publicByDefault;

  public FilesystemLocalFileSource(Path root, boolean publicByDefault) {
    this.root = root.toAbsolutePath().normalize();
    this.publicByDefault = publicByDefault;
  }

  @Override
  public List<LocalFile> list() {
    if (!Files.isDirectory(root)) {
      throw new StorageException(
          ErrorKind.CONFIGURATION, "Migration source is not a directory: " + root);
    }
    try (Stream<Path> paths = Files.walk(root)) {
      List<LocalFile> files =
          paths
              .filter(Files::isRegularFile)
              .filter(path -> !isHidden(root.relativize(path)))
              .sorted(Comparator.comparing(Path::toString))
              .map(this::toLocalFile)
              .collect(Collectors.toList());
      LOGGER.info("Found {} files to migrate under {}", files.size(), root);
      return files;
    } catch (IOException | UncheckedIOException e) {
      String errorMsg = String.format("Failed to list migration source %s", root);
      LOGGER.error(errorMsg, e);
      throw new StorageException(ErrorKind.STORAGE, errorMsg, e);
    }
  }

  @Override
  public byte[] read(LocalFile file) {
    Path path = root.resolve(file.path()).normalize();
    if (!path.startsWith(root)) {
      throw new StorageException(
          ErrorKind.VALIDATION, "Path escapes migration source: " + file.path());
    }
    try {
      return Files.readAllBytes(path);
    } catch (IOException e) {
      String errorMsg = String.format("Failed to read %s", file.path());
      LOGGER.error(errorMsg, e);
      throw new StorageException(ErrorKind.STORAGE, errorMsg, null, file.path(), e);
    }
  }

  private LocalFile toLocalFile(Path path) {
    String relative = root.relativize(path).toString().replace('\\', '/');
    try {
      return new LocalFile(
          relative,
          URLConnection.guessContentTypeFromName(path.getFileName().toString()),
          Files.size(path),
          publicByDefault);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private static boolean isHidden(Path relative) {
    for (Path part : relative) {
      if (part.toString().startsWith(".")) {
        return true;
      }
    }
    return false;
  }
}
