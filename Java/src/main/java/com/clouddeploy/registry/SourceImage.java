package com.clouddeploy.registry;

import com.google.cloud.tools.jib.api.Credential;
import com.google.cloud.tools.jib.api.ImageReference;
import java.util.concurrent.CompletableFuture;

/**
 * A loaded local image.
 */
public interface SourceImage {
  String reference();

  /**
   * Pushes the image to {@code target}.
   *
   * @return the digest of the pushed manifest
   */
  CompletableFuture<String> pushTo(ImageReference target, Credential credential);
}
