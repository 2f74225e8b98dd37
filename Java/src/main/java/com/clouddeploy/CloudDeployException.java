package com.clouddeploy;

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Terminal failure of a credential resolution, Vault operation or registry operation.
 * <p>
 * Asynchronous operations complete their futures exceptionally with this type; a caller that
 * {@code join()}s sees it as the cause of a {@link CompletionException}.
 */
public class CloudDeployException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final ErrorKind kind;

  public CloudDeployException(ErrorKind kind, String message) {
    this(kind, message, null);
  }

  public CloudDeployException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public ErrorKind kind() {
    return kind;
  }

  public boolean is(ErrorKind other) {
    return kind == other;
  }

  /**
   * Adds {@code context} to a failure. The kind of an existing {@link CloudDeployException} is kept;
   * anything else is classified as {@code fallbackKind}. Cancellation is returned unchanged.
   */
  public static RuntimeException wrap(String context, Throwable error, ErrorKind fallbackKind) {
    Objects.requireNonNull(context, "context");
    Throwable cause = unwrap(error);

    if (cause instanceof CancellationException) {
      return (CancellationException) cause;
    }

    if (cause instanceof CloudDeployException) {
      CloudDeployException known = (CloudDeployException) cause;
      return new CloudDeployException(known.kind(), context + ": " + known.getMessage(), known);
    }

    return new CloudDeployException(fallbackKind, context + ": " + describe(cause), cause);
  }

  /**
   * Strips {@link CompletionException} and {@link ExecutionException} wrappers added by futures.
   */
  public static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  /**
   * Returns true when {@code error} (after unwrapping) is a {@link CloudDeployException} of {@code kind}.
   */
  public static boolean isKind(Throwable error, ErrorKind kind) {
    Throwable cause = unwrap(error);
    return cause instanceof CloudDeployException && ((CloudDeployException) cause).is(kind);
  }

  private static String describe(Throwable cause) {
    if (cause == null) {
      return "unknown error";
    }
    String message = cause.getMessage();
    return (message == null || message.isBlank()) ? cause.getClass().getSimpleName() : message;
  }
}
