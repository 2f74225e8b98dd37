package com.clouddeploy.vault;

import java.util.Objects;

/**
 * Points at one key of a KV version 2 secret.
 *
 * @param path full secret path including the {@code data} segment, e.g. {@code secret/data/myapp/database}
 * @param key key inside the secret's {@code data} map, e.g. {@code url}
 */
public record SecretReference(String path, String key) {
  public SecretReference {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(key, "key");
    if (path.isBlank()) {
      throw new IllegalArgumentException("path must be non-blank");
    }
    if (key.isBlank()) {
      throw new IllegalArgumentException("key must be non-blank");
    }
  }
}
