package com.scholary.storage.path;

import com.scholary.storage.error.ErrorKind;
import com.scholary.storage.error.StorageException;
import java.nio.charset.StandardCharsets;

/** Rules every object key must satisfy before it is sent to a provider. */
public final class ObjectKeys {

  public static final int MAX_KEY_BYTES = 1024;

  private ObjectKeys() {}

  public static boolean isValid(String key) {
    return violation(key) == null;
  }

  /**
   * @throws StorageException VALIDATION naming the broken rule
   */
  public static String validate(String key) {
    String violation = violation(key);
    if (violation != null) {
      throw new StorageException(
          ErrorKind.VALIDATION, "Invalid object key: " + violation, null, key, null);
    }
    return key;
  }

  private static String violation(String key) {
    if (key == null || key.isEmpty()) {
      return "key is empty";
    }
    if (key.getBytes(StandardCharsets.UTF_8).length > MAX_KEY_BYTES) {
      return "key exceeds " + MAX_KEY_BYTES + " bytes";
    }
    if (!key.equals(key.strip())) {
      return "key has leading or trailing whitespace";
    }
    for (int i = 0; i < key.length(); i++) {
      if (Character.isISOControl(key.charAt(i))) {
        return "key contains control characters";
      }
    }
    return null;
  }
}
