package com.clouddeploy.credentials;

import com.clouddeploy.CloudDeployException;
import com.clouddeploy.ErrorKind;
import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves a cloud provider's credential bundle from the configured backend.
 * <ul>
 *   <li>{@code environment}: provider-specific environment variables.</li>
 *   <li>{@code secrets-store}: one JSON secret per provider in AWS Secrets Manager.</li>
 *   <li>{@code vault}: fixed KV v2 paths, one fresh {@code VaultSession} per resolution.</li>
 *   <li>{@code encrypted-file}: not implemented; always fails with {@link ErrorKind#UNSUPPORTED}.</li>
 * </ul>
 * Whatever the backend returns is checked with {@link #validateCredentials} before it is handed out.
 */
public final class CredentialManager {
  private static final Logger DEFAULT_LOGGER = LoggerFactory.getLogger(CredentialManager.class);

  private final CredentialSource sourceKind;
  private final ProviderCredentialSource source;
  private final Logger logger;

  public CredentialManager(CredentialSource sourceKind, ProviderCredentialSource source) {
    this(sourceKind, source, DEFAULT_LOGGER);
  }

  public CredentialManager(CredentialSource sourceKind, ProviderCredentialSource source, Logger logger) {
    this.sourceKind = Objects.requireNonNull(sourceKind, "sourceKind");
    this.source = Objects.requireNonNull(source, "source");
    this.logger = Objects.requireNonNull(logger, "logger");
  }

  /**
   * Creates a manager for the backend selected by {@code options}.
   */
  public static CredentialManager create(CredentialManagerOptions options) {
    Objects.requireNonNull(options, "options");

    ProviderCredentialSource backend = switch (options.source()) {
      case ENVIRONMENT -> new EnvironmentCredentialSource(options.environment());
      case SECRETS_STORE -> SecretsManagerCredentialSource.create(options.secretsRegion(), options.secretIds());
      case VAULT -> options.vaultConfig() == null
          ? unavailable(ErrorKind.CONFIGURATION, "vault configuration is required when using vault credentials")
          : new VaultCredentialSource(HttpClient.newHttpClient(), options.vaultConfig());
      case ENCRYPTED_FILE -> unavailable(ErrorKind.UNSUPPORTED, "encrypted file integration not yet implemented");
    };

    return new CredentialManager(options.source(), backend);
  }

  public CredentialSource sourceKind() {
    return sourceKind;
  }

  /**
   * Resolves credentials by provider name ({@code aws}, {@code gcp}, {@code azure}, {@code cloudflare}).
   */
  public CompletableFuture<ProviderCredentials> getCredentials(String providerName) {
    CloudProvider provider;
    try {
      provider = CloudProvider.fromName(providerName);
    } catch (CloudDeployException e) {
      return CompletableFuture.failedFuture(e);
    }
    return getCredentials(provider);
  }

  /**
   * Resolves and validates the credentials of {@code provider}.
   * <p>
   * The future fails with a {@link CloudDeployException} whose kind comes from the backend
   * ({@code MISSING_CREDENTIALS}, {@code CONFIGURATION}, {@code BACKEND}, ...). Cancelling it stops
   * the backend from issuing further requests.
   */
  public CompletableFuture<ProviderCredentials> getCredentials(CloudProvider provider) {
    Objects.requireNonNull(provider, "provider");
    logger.info("Resolving {} credentials from {}", provider.configName(), sourceKind.configName());

    CompletableFuture<ProviderCredentials> pending;
    try {
      pending = source.getCredentials(provider);
    } catch (RuntimeException e) {
      pending = CompletableFuture.failedFuture(e);
    }

    CompletableFuture<ProviderCredentials> result = new CompletableFuture<>();
    CompletableFuture<ProviderCredentials> backend = pending;
    backend.whenComplete((credentials, error) -> {
      if (error != null) {
        result.completeExceptionally(CloudDeployException.wrap(
            "failed to resolve " + provider.configName() + " credentials from " + sourceKind.configName(),
            error,
            ErrorKind.BACKEND));
        return;
      }

      try {
        validateCredentials(credentials, provider);
        logger.info("Resolved {} credentials from {}", provider.configName(), sourceKind.configName());
        result.complete(credentials);
      } catch (RuntimeException e) {
        result.completeExceptionally(e);
      }
    });
    result.whenComplete((ignored, error) -> {
      if (result.isCancelled()) {
        backend.cancel(true);
      }
    });
    return result;
  }

  /**
   * Checks that every required field of {@code provider}'s sub-record is non-empty.
   * <p>
   * Depends only on the bundle contents, never on how it was obtained.
   *
   * @throws CloudDeployException of kind {@link ErrorKind#MISSING_CREDENTIALS} when incomplete
   */
  public static void validateCredentials(ProviderCredentials credentials, CloudProvider provider) {
    Objects.requireNonNull(provider, "provider");
    if (credentials == null) {
      throw incomplete(provider, List.of("<bundle>"));
    }

    List<String> missing = new ArrayList<>();
    switch (provider) {
      case AWS -> {
        ProviderCredentials.Aws aws = credentials.aws();
        if (aws == null) {
          missing.add("aws");
        } else {
          requireField(missing, "access_key_id", aws.accessKeyId());
          requireField(missing, "secret_access_key", aws.secretAccessKey());
        }
      }
      case GCP -> {
        ProviderCredentials.Gcp gcp = credentials.gcp();
        if (gcp == null) {
          missing.add("gcp");
        } else {
          requireField(missing, "project_id", gcp.projectId());
          requireField(missing, "service_account_key", gcp.serviceAccountKey());
        }
      }
      case AZURE -> {
        ProviderCredentials.Azure azure = credentials.azure();
        if (azure == null) {
          missing.add("azure");
        } else {
          requireField(missing, "tenant_id", azure.tenantId());
          requireField(missing, "client_id", azure.clientId());
          requireField(missing, "client_secret", azure.clientSecret());
        }
      }
      case CLOUDFLARE -> {
        ProviderCredentials.Cloudflare cloudflare = credentials.cloudflare();
        if (cloudflare == null) {
          missing.add("cloudflare");
        } else {
          requireField(missing, "api_token", cloudflare.apiToken());
        }
      }
    }

    if (!missing.isEmpty()) {
      throw incomplete(provider, missing);
    }
  }

  private static void requireField(List<String> missing, String name, String value) {
    if (ProviderCredentials.isBlank(value)) {
      missing.add(name);
    }
  }

  private static CloudDeployException incomplete(CloudProvider provider, List<String> missing) {
    return new CloudDeployException(
        ErrorKind.MISSING_CREDENTIALS,
        provider.configName() + " credentials are incomplete (missing " + String.join(", ", missing) + ")");
  }

  private static ProviderCredentialSource unavailable(ErrorKind kind, String message) {
    return provider -> CompletableFuture.failedFuture(new CloudDeployException(kind, message));
  }
}
