package com.clouddeploy.vault;

import com.clouddeploy.CloudDeployException;
import com.clouddeploy.ErrorKind;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Connection settings for a Vault-compatible server.
 * <p>
 * Credentials for a provider are read from {@code <mount>/data/<application>/<provider>/credentials}.
 */
public final class VaultConfig {
  public static final String DEFAULT_MOUNT = "secret";
  public static final String DEFAULT_APPLICATION = "cloud-deploy";
  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

  private final URI address;
  private final VaultAuthConfig auth;
  private final String namespace;
  private final String mount;
  private final String application;
  private final Duration requestTimeout;

  public VaultConfig(String address, VaultAuthConfig auth) {
    this(address, auth, null, DEFAULT_MOUNT, DEFAULT_APPLICATION, DEFAULT_REQUEST_TIMEOUT);
  }

  /**
   * @param address Vault server address, e.g. {@code http://127.0.0.1:8200}
   * @param auth authentication settings
   * @param namespace optional Vault Enterprise namespace; null/blank for none
   * @param mount KV v2 mount point
   * @param application application segment of the credential path
   * @param requestTimeout timeout applied to each HTTP request
   */
  public VaultConfig(
      String address,
      VaultAuthConfig auth,
      String namespace,
      String mount,
      String application,
      Duration requestTimeout) {
    if (address == null || address.isBlank()) {
      throw new CloudDeployException(ErrorKind.CONFIGURATION, "vault address is required");
    }
    try {
      this.address = URI.create(stripTrailingSlash(address.trim()));
    } catch (IllegalArgumentException e) {
      throw new CloudDeployException(ErrorKind.CONFIGURATION, "invalid vault address: " + address, e);
    }
    this.auth = Objects.requireNonNull(auth, "auth");
    this.namespace = (namespace == null || namespace.isBlank()) ? null : namespace.trim();
    this.mount = requireNonBlank(mount, "mount");
    this.application = requireNonBlank(application, "application");
    this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    if (requestTimeout.isNegative() || requestTimeout.isZero()) {
      throw new IllegalArgumentException("requestTimeout must be positive");
    }
  }

  public URI address() {
    return address;
  }

  public VaultAuthConfig auth() {
    return auth;
  }

  /**
   * Namespace sent as {@code X-Vault-Namespace}, or null.
   */
  public String namespace() {
    return namespace;
  }

  public String mount() {
    return mount;
  }

  public String application() {
    return application;
  }

  public Duration requestTimeout() {
    return requestTimeout;
  }

  /**
   * KV v2 path holding the credentials of {@code provider}.
   */
  public String credentialsPath(String provider) {
    return mount + "/data/" + application + "/" + requireNonBlank(provider, "provider") + "/credentials";
  }

  private static String requireNonBlank(String value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isBlank()) {
      throw new IllegalArgumentException(name + " must be non-blank");
    }
    return value;
  }

  private static String stripTrailingSlash(String value) {
    String result = value;
    while (result.endsWith("/")) {
      result = result.substring(0, result.length() - 1);
    }
    return result;
  }
}
