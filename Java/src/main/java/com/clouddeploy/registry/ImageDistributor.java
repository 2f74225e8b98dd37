package com.clouddeploy.registry;

import com.clouddeploy.CancellationScope;
import com.clouddeploy.CloudDeployException;
import com.clouddeploy.ErrorKind;
import com.clouddeploy.ImageDistributionException;
import com.google.cloud.tools.jib.api.ImageReference;
import com.google.cloud.tools.jib.api.InvalidImageReferenceException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pushes one local image to a list of registries, one registry after another.
 * <p>
 * Registries are processed in registration order. The first failure aborts the distribution:
 * later registries are not attempted, and pushes that already succeeded stay in place (they are
 * reported by {@link ImageDistributionException#completedPushes()}).
 * <p>
 * A distributor is single-use: once {@link #distribute()} has been called it accepts no more
 * registries and cannot be run again. Not safe for concurrent use.
 */
public final class ImageDistributor {
  private static final Logger DEFAULT_LOGGER = LoggerFactory.getLogger(ImageDistributor.class);

  private final String sourceImage;
  private final LocalImageStore imageStore;
  private final Logger logger;

  private final List<ContainerRegistry> registries = new ArrayList<>();
  private boolean consumed;

  public ImageDistributor(String sourceImage, LocalImageStore imageStore) {
    this(sourceImage, imageStore, DEFAULT_LOGGER);
  }

  public ImageDistributor(String sourceImage, LocalImageStore imageStore, Logger logger) {
    this.sourceImage = Objects.requireNonNull(sourceImage, "sourceImage");
    this.imageStore = Objects.requireNonNull(imageStore, "imageStore");
    this.logger = Objects.requireNonNull(logger, "logger");
  }

  /**
   * Appends a target registry.
   *
   * @throws IllegalStateException after {@link #distribute()} has been called
   */
  public synchronized ImageDistributor addRegistry(ContainerRegistry registry) {
    Objects.requireNonNull(registry, "registry");
    if (consumed) {
      throw new IllegalStateException("image distributor has already been used");
    }
    registries.add(registry);
    return this;
  }

  public synchronized List<ContainerRegistry> registries() {
    return List.copyOf(registries);
  }

  /**
   * Loads the source image once and pushes it to every registry.
   *
   * @return registry URL to image URI, in push order
   */
  public CompletableFuture<Map<String, String>> distribute() {
    List<ContainerRegistry> targets;
    synchronized (this) {
      if (consumed) {
        return CompletableFuture.failedFuture(new IllegalStateException("image distributor has already been used"));
      }
      consumed = true;
      targets = List.copyOf(registries);
    }

    CompletableFuture<Map<String, String>> result = new CompletableFuture<>();
    CancellationScope scope = CancellationScope.of(result);
    Map<String, String> pushed = new LinkedHashMap<>();

    logger.info("Distributing {} to {} registries", sourceImage, targets.size());

    CompletableFuture<SourceImage> loaded = scope.track(() -> imageStore.load(sourceImage))
        .handle((image, error) -> {
          if (error != null) {
            throw CloudDeployException.wrap("failed to load image " + sourceImage, error, ErrorKind.BACKEND);
          }
          return image;
        });

    CompletableFuture<Void> chain = loaded.thenCompose(image -> {
      CompletableFuture<Void> steps = CompletableFuture.completedFuture(null);
      for (ContainerRegistry registry : targets) {
        steps = steps.thenCompose(ignored -> {
          scope.ensureActive("pushing to " + registry);
          return pushTo(registry, image, pushed, scope);
        });
      }
      return steps;
    });

    chain.whenComplete((ignored, error) -> {
      if (error == null) {
        logger.info("Distributed {} to {} registries", sourceImage, pushed.size());
        result.complete(Collections.unmodifiableMap(new LinkedHashMap<>(pushed)));
        return;
      }

      Throwable cause = CloudDeployException.unwrap(error);
      if (cause instanceof CancellationException) {
        result.completeExceptionally(cause);
        return;
      }
      ErrorKind kind = cause instanceof CloudDeployException
          ? ((CloudDeployException) cause).kind()
          : ErrorKind.TRANSIENT_NETWORK;
      logger.error("Distribution of {} aborted after {} of {} registries: {}",
          sourceImage, pushed.size(), targets.size(), cause.getMessage());
      result.completeExceptionally(new ImageDistributionException(kind, cause.getMessage(), cause, pushed));
    });
    return result;
  }

  private CompletableFuture<Void> pushTo(
      ContainerRegistry registry,
      SourceImage image,
      Map<String, String> pushed,
      CancellationScope scope) {
    logger.info("Authenticating with {}", registry);

    return scope.track(registry::authenticate)
        .handle((credential, error) -> {
          if (error != null) {
            throw CloudDeployException.wrap(
                "failed to authenticate with registry " + describe(registry), error, ErrorKind.AUTHENTICATION);
          }
          return credential;
        })
        .thenCompose(credential -> {
          scope.ensureActive("pushing to " + registry);
          String reference = registry.imageReference();
          ImageReference target = parseTarget(reference, registry);

          logger.info("Pushing {} to {}", image.reference(), reference);
          return scope.track(() -> image.pushTo(target, credential)).handle((digest, error) -> {
            if (error != null) {
              throw CloudDeployException.wrap(
                  "failed to push image to registry " + describe(registry), error, ErrorKind.TRANSIENT_NETWORK);
            }
            logger.info("Pushed {} ({})", reference, digest);
            pushed.put(registry.registryUrl(), registry.imageUri());
            return null;
          });
        });
  }

  private static ImageReference parseTarget(String reference, ContainerRegistry registry) {
    try {
      return ImageReference.parse(reference);
    } catch (InvalidImageReferenceException e) {
      throw new CloudDeployException(
          ErrorKind.CONFIGURATION,
          "invalid image reference " + reference + " for registry " + describe(registry),
          e);
    }
  }

  static String describe(ContainerRegistry registry) {
    String url = registry.registryUrl();
    return url == null || url.isEmpty() ? registry.toString() : url;
  }
}
