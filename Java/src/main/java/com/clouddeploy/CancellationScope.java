package com.clouddeploy;

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * The remote call a multi-step operation is currently waiting on.
 * <p>
 * Every step is started through {@link #track}; cancelling the owner future then cancels the call
 * that is in flight, not only the stages chained behind it.
 */
public final class CancellationScope {
  private final CompletableFuture<?> owner;
  private final AtomicReference<Future<?>> current = new AtomicReference<>();

  private CancellationScope(CompletableFuture<?> owner) {
    this.owner = owner;
  }

  public static CancellationScope of(CompletableFuture<?> owner) {
    CancellationScope scope = new CancellationScope(Objects.requireNonNull(owner, "owner"));
    owner.whenComplete((ignored, error) -> {
      if (owner.isCancelled()) {
        scope.cancelCurrent();
      }
    });
    return scope;
  }

  /**
   * Cancelling {@code derived} also cancels {@code upstream}. Returns {@code derived}.
   */
  public static <T> CompletableFuture<T> forwardCancellation(CompletableFuture<T> derived, Future<?> upstream) {
    Objects.requireNonNull(upstream, "upstream");
    derived.whenComplete((ignored, error) -> {
      if (derived.isCancelled()) {
        upstream.cancel(true);
      }
    });
    return derived;
  }

  /**
   * Starts the next step. A supplier that throws yields a failed future; after cancellation no step
   * is started.
   */
  public <T> CompletableFuture<T> track(Supplier<? extends CompletableFuture<T>> call) {
    if (owner.isCancelled()) {
      return CompletableFuture.failedFuture(new CancellationException("operation was cancelled"));
    }

    CompletableFuture<T> future;
    try {
      future = Objects.requireNonNull(call.get(), "future");
    } catch (RuntimeException e) {
      future = CompletableFuture.failedFuture(e);
    }
    current.set(future);
    if (owner.isCancelled()) {
      future.cancel(true);
    }
    return future;
  }

  public boolean isCancelled() {
    return owner.isCancelled();
  }

  /**
   * @throws CancellationException when the owner has been cancelled
   */
  public void ensureActive(String nextStep) {
    if (owner.isCancelled()) {
      throw new CancellationException("cancelled before " + nextStep);
    }
  }

  private void cancelCurrent() {
    Future<?> future = current.get();
    if (future != null) {
      future.cancel(true);
    }
  }
}
