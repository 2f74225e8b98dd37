package com.clouddeploy.registry;

import java.util.concurrent.CompletableFuture;

/**
 * Where the image to distribute is read from.
 */
public interface LocalImageStore {
  /**
   * Resolves {@code imageReference} once; the returned image can be pushed to any number of targets.
   */
  CompletableFuture<SourceImage> load(String imageReference);
}
