package com.clouddeploy.registry;

import com.clouddeploy.CancellationScope;
import com.clouddeploy.CloudDeployException;
import com.clouddeploy.ErrorKind;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;

/**
 * Create-if-absent for remote repositories.
 * <p>
 * Fetch the resource; on "not found" create it; if the create reports that the resource already
 * exists (another caller won the race) fetch it again and carry on. Every other failure is fatal.
 * Cancelling the returned future cancels the remote call in progress.
 */
final class RepositoryProvisioning {
  private RepositoryProvisioning() {
  }

  static <T> CompletableFuture<T> ensureExists(
      String resource,
      Supplier<CompletableFuture<T>> fetch,
      Supplier<CompletableFuture<T>> create,
      Predicate<Throwable> isNotFound,
      Predicate<Throwable> isAlreadyExists,
      Logger logger) {
    logger.info("Ensuring {} exists", resource);

    CompletableFuture<T> result = new CompletableFuture<>();
    CancellationScope scope = CancellationScope.of(result);

    scope.track(fetch).handle((existing, fetchError) -> {
      if (fetchError == null) {
        logger.info("{} already exists", resource);
        return CompletableFuture.completedFuture(existing);
      }

      Throwable fetchCause = CloudDeployException.unwrap(fetchError);
      if (fetchCause instanceof CancellationException) {
        return CompletableFuture.<T>failedFuture(fetchCause);
      }
      if (!isNotFound.test(fetchCause)) {
        return CompletableFuture.<T>failedFuture(
            CloudDeployException.wrap("failed to look up " + resource, fetchCause, ErrorKind.TRANSIENT_NETWORK));
      }

      logger.info("Creating {}", resource);
      return scope.track(create).handle((created, createError) -> {
        if (createError == null) {
          logger.info("Created {}", resource);
          return CompletableFuture.completedFuture(created);
        }

        Throwable createCause = CloudDeployException.unwrap(createError);
        if (isAlreadyExists.test(createCause)) {
          logger.warn("{} was created concurrently; using the existing one", resource);
          return scope.track(fetch).handle((raced, refetchError) -> {
            if (refetchError != null) {
              throw CloudDeployException.wrap("failed to look up " + resource, refetchError, ErrorKind.TRANSIENT_NETWORK);
            }
            return raced;
          });
        }

        return CompletableFuture.<T>failedFuture(
            CloudDeployException.wrap("failed to create " + resource, createCause, ErrorKind.TRANSIENT_NETWORK));
      }).thenCompose(Function.identity());
    }).thenCompose(Function.identity()).whenComplete((value, error) -> {
      if (error != null) {
        result.completeExceptionally(CloudDeployException.unwrap(error));
      } else {
        result.complete(value);
      }
    });
    return result;
  }

  /**
   * True when the message of {@code error} or one of its causes says the resource already exists.
   */
  static boolean indicatesAlreadyExists(Throwable error) {
    Throwable current = error;
    while (current != null) {
      String message = current.getMessage();
      if (message != null) {
        String normalized = message.toLowerCase(Locale.ROOT);
        if (normalized.contains("already exists") || normalized.contains("alreadyexists")) {
          return true;
        }
      }
      current = current.getCause() == current ? null : current.getCause();
    }
    return false;
  }
}
