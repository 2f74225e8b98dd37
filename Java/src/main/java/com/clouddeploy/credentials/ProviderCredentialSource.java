package com.clouddeploy.credentials;

import java.util.concurrent.CompletableFuture;

/**
 * Resolves a provider's credential bundle from one backend (environment, secrets store, Vault).
 * <p>
 * Implementations may perform network calls; {@link CredentialManager} validates whatever they return.
 */
public interface ProviderCredentialSource {
  /**
   * Fetches the credentials of {@code provider}.
   */
  CompletableFuture<ProviderCredentials> getCredentials(CloudProvider provider);
}
