package com.scholary.storage.service;

import java.util.List;

/** Files to migrate into object storage, plus access to their bytes. */
public interface LocalFileSource {

  /**
   * Enumerate the files of this source.
   *
   * @throws com.scholary.storage.error.StorageException when the source cannot be listed
   */
  List<LocalFile> list();

  /**
   * Read one file.
   *
   * @throws com.scholary.storage.error.StorageException when the file cannot be read
   */
  byte[] read(LocalFile file);
}
