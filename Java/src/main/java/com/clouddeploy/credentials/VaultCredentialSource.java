package com.clouddeploy.credentials;

import com.clouddeploy.CancellationScope;
import com.clouddeploy.CloudDeployException;
import com.clouddeploy.ErrorKind;
import com.clouddeploy.vault.VaultConfig;
import com.clouddeploy.vault.VaultSession;
import java.net.http.HttpClient;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Credential source backed by Vault.
 * <p>
 * Every resolution opens its own {@link VaultSession}, authenticates it, reads one key per field
 * from {@code <mount>/data/<application>/<provider>/credentials} and drops the session. A missing
 * optional key resolves to {@code ""}; a missing required key fails the resolution.
 */
public final class VaultCredentialSource implements ProviderCredentialSource {
  private static final Logger DEFAULT_LOGGER = LoggerFactory.getLogger(VaultCredentialSource.class);

  private static final List<Field> AWS_FIELDS = List.of(
      Field.requiredKey("access_key_id"),
      Field.requiredKey("secret_access_key"),
      Field.optionalKey("session_token"));
  private static final List<Field> GCP_FIELDS = List.of(
      Field.requiredKey("project_id"),
      Field.requiredKey("service_account_key"),
      Field.optionalKey("service_account_email"));
  private static final List<Field> AZURE_FIELDS = List.of(
      Field.requiredKey("subscription_id"),
      Field.requiredKey("client_id"),
      Field.requiredKey("client_secret"),
      Field.requiredKey("tenant_id"));
  private static final List<Field> CLOUDFLARE_FIELDS = List.of(
      Field.requiredKey("api_token"),
      Field.optionalKey("account_id"),
      Field.optionalKey("email"));

  private final HttpClient httpClient;
  private final VaultConfig config;
  private final Logger logger;

  public VaultCredentialSource(HttpClient httpClient, VaultConfig config) {
    this(httpClient, config, DEFAULT_LOGGER);
  }

  public VaultCredentialSource(HttpClient httpClient, VaultConfig config, Logger logger) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.config = Objects.requireNonNull(config, "config");
    this.logger = Objects.requireNonNull(logger, "logger");
  }

  @Override
  public CompletableFuture<ProviderCredentials> getCredentials(CloudProvider provider) {
    Objects.requireNonNull(provider, "provider");

    CompletableFuture<ProviderCredentials> result = new CompletableFuture<>();
    CancellationScope scope = CancellationScope.of(result);
    VaultSession session = new VaultSession(httpClient, config, logger);
    String path = config.credentialsPath(provider.configName());

    logger.info("Fetching {} credentials from vault path {}", provider.configName(), path);

    scope.track(session::authenticate)
        .handle((ignored, error) -> {
          if (error != null) {
            throw CloudDeployException.wrap("failed to authenticate to vault", error, ErrorKind.AUTHENTICATION);
          }
          return null;
        })
        .thenCompose(ignored -> readFields(session, provider, path, fieldsOf(provider), scope))
        .thenApply(values -> toCredentials(provider, values))
        .whenComplete((credentials, error) -> {
          if (error != null) {
            result.completeExceptionally(CloudDeployException.unwrap(error));
          } else {
            result.complete(credentials);
          }
        });
    return result;
  }

  private CompletableFuture<Map<String, String>> readFields(
      VaultSession session,
      CloudProvider provider,
      String path,
      List<Field> fields,
      CancellationScope scope) {
    Map<String, String> values = new LinkedHashMap<>();
    CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);

    for (Field field : fields) {
      chain = chain.thenCompose(ignored -> {
        scope.ensureActive("reading " + provider.configName() + " " + field.key() + " from vault");
        return scope.track(() -> session.getSecret(path, field.key())).handle((value, error) -> {
          if (error == null) {
            values.put(field.key(), value);
            return null;
          }
          if (!field.required() && CloudDeployException.isKind(error, ErrorKind.NOT_FOUND)) {
            logger.debug("Optional {} field {} not present in vault; using empty value", provider.configName(), field.key());
            values.put(field.key(), "");
            return null;
          }
          throw CloudDeployException.wrap(
              "failed to fetch " + provider.configName() + " " + field.key() + " from vault",
              error,
              ErrorKind.TRANSIENT_NETWORK);
        });
      });
    }

    return chain.thenApply(ignored -> values);
  }

  private static List<Field> fieldsOf(CloudProvider provider) {
    return switch (provider) {
      case AWS -> AWS_FIELDS;
      case GCP -> GCP_FIELDS;
      case AZURE -> AZURE_FIELDS;
      case CLOUDFLARE -> CLOUDFLARE_FIELDS;
    };
  }

  private static ProviderCredentials toCredentials(CloudProvider provider, Map<String, String> values) {
    return switch (provider) {
      case AWS -> ProviderCredentials.ofAws(new ProviderCredentials.Aws(
          values.get("access_key_id"),
          values.get("secret_access_key"),
          values.get("session_token")));
      case GCP -> ProviderCredentials.ofGcp(new ProviderCredentials.Gcp(
          values.get("project_id"),
          values.get("service_account_key"),
          values.get("service_account_email")));
      case AZURE -> ProviderCredentials.ofAzure(new ProviderCredentials.Azure(
          values.get("tenant_id"),
          values.get("client_id"),
          values.get("client_secret"),
          values.get("subscription_id")));
      case CLOUDFLARE -> ProviderCredentials.ofCloudflare(new ProviderCredentials.Cloudflare(
          values.get("api_token"),
          values.get("account_id"),
          values.get("email")));
    };
  }

  private record Field(String key, boolean required) {
    static Field requiredKey(String key) {
      return new Field(key, true);
    }

    static Field optionalKey(String key) {
      return new Field(key, false);
    }
  }
}
