package com.clouddeploy.registry;

import com.google.cloud.tools.jib.api.Credential;
import java.util.concurrent.CompletableFuture;

/**
 * A cloud container registry an image can be distributed to.
 * <p>
 * The registry URL and image reference depend on identifiers that are only known once
 * {@link #authenticate()} has run (account id, login server, ...), so both are only meaningful after
 * a successful authentication.
 */
public interface ContainerRegistry {
  /**
   * Registry host (and path prefix, where the registry has one). Empty before {@link #authenticate()}.
   */
  String registryUrl();

  /**
   * Ensures the remote repository exists (creating it if needed) and obtains push credentials.
   */
  CompletableFuture<Credential> authenticate();

  /**
   * Full target reference {@code <registry>/<image>:<tag>}.
   *
   * @throws IllegalStateException before a successful {@link #authenticate()}
   */
  String imageReference();

  /**
   * Image URI reported to callers once the push has succeeded.
   */
  default String imageUri() {
    return imageReference();
  }
}
