package com.clouddeploy.credentials;

import com.clouddeploy.vault.VaultConfig;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

public final class CredentialManagerOptions {
  private final CredentialSource source;
  private final Map<CloudProvider, String> secretIds;
  private final String secretsRegion;
  private final VaultConfig vaultConfig;
  private final EnvironmentLookup environment;

  public CredentialManagerOptions() {
    this(CredentialSource.ENVIRONMENT, Map.of(), null, null, EnvironmentLookup.system());
  }

  /**
   * @param source active credential backend
   * @param secretIds secrets-store secret name or ARN per provider
   * @param secretsRegion optional secrets-store region
   * @param vaultConfig Vault connection; required only by the vault source, may be null otherwise
   * @param environment lookup used by the environment source
   */
  public CredentialManagerOptions(
      CredentialSource source,
      Map<CloudProvider, String> secretIds,
      String secretsRegion,
      VaultConfig vaultConfig,
      EnvironmentLookup environment) {
    this.source = Objects.requireNonNull(source, "source");
    Objects.requireNonNull(secretIds, "secretIds");
    this.secretIds = secretIds.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(secretIds));
    this.secretsRegion = secretsRegion;
    this.vaultConfig = vaultConfig;
    this.environment = Objects.requireNonNull(environment, "environment");
  }

  public static CredentialManagerOptions environment(EnvironmentLookup environment) {
    return new CredentialManagerOptions(CredentialSource.ENVIRONMENT, Map.of(), null, null, environment);
  }

  public static CredentialManagerOptions secretsStore(Map<CloudProvider, String> secretIds, String region) {
    return new CredentialManagerOptions(CredentialSource.SECRETS_STORE, secretIds, region, null, EnvironmentLookup.system());
  }

  public static CredentialManagerOptions vault(VaultConfig vaultConfig) {
    return new CredentialManagerOptions(CredentialSource.VAULT, Map.of(), null, vaultConfig, EnvironmentLookup.system());
  }

  public CredentialSource source() {
    return source;
  }

  public Map<CloudProvider, String> secretIds() {
    return secretIds;
  }

  public String secretsRegion() {
    return secretsRegion;
  }

  /**
   * Vault connection, or null when none is configured.
   */
  public VaultConfig vaultConfig() {
    return vaultConfig;
  }

  public EnvironmentLookup environment() {
    return environment;
  }
}
