package com.clouddeploy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Failure of a multi-registry distribution.
 * <p>
 * The distribution is fail-fast and returns no result map. Pushes that completed before the
 * failure are not rolled back; they are reported here for callers that want best-effort semantics.
 */
public final class ImageDistributionException extends CloudDeployException {
  private static final long serialVersionUID = 1L;

  private final transient Map<String, String> completedPushes;

  public ImageDistributionException(
      ErrorKind kind,
      String message,
      Throwable cause,
      Map<String, String> completedPushes) {
    super(kind, message, cause);
    this.completedPushes = Collections.unmodifiableMap(new LinkedHashMap<>(completedPushes));
  }

  /**
   * Registry URL to image URI for every registry pushed before the failure, in push order.
   */
  public Map<String, String> completedPushes() {
    return completedPushes;
  }
}
