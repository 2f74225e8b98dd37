package com.clouddeploy.credentials;

import com.clouddeploy.CancellationScope;
import com.clouddeploy.CloudDeployException;
import com.clouddeploy.ErrorKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerAsyncClient;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerAsyncClientBuilder;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueResponse;

/**
 * Credential source backed by AWS Secrets Manager.
 * <p>
 * Each provider maps to one secret (name or ARN) whose string value is the JSON form of
 * {@link ProviderCredentials}. The Secrets Manager client itself authenticates through the default
 * AWS credential chain and is created on first use.
 */
public final class SecretsManagerCredentialSource implements ProviderCredentialSource {
  private static final Logger LOGGER = LoggerFactory.getLogger(SecretsManagerCredentialSource.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final Supplier<SecretsManagerAsyncClient> clientFactory;
  private final Map<CloudProvider, String> secretIds;

  private final Object clientGate = new Object();
  private SecretsManagerAsyncClient client;

  /**
   * @param client configured Secrets Manager client
   * @param secretIds secret name or ARN per provider
   */
  public SecretsManagerCredentialSource(SecretsManagerAsyncClient client, Map<CloudProvider, String> secretIds) {
    this(constant(Objects.requireNonNull(client, "client")), secretIds);
  }

  SecretsManagerCredentialSource(Supplier<SecretsManagerAsyncClient> clientFactory, Map<CloudProvider, String> secretIds) {
    this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
    Objects.requireNonNull(secretIds, "secretIds");
    this.secretIds = secretIds.isEmpty() ? Map.of() : new EnumMap<>(secretIds);
  }

  /**
   * Creates a source whose client uses the default credential chain.
   *
   * @param region optional region; null/blank to use the default region provider chain
   */
  public static SecretsManagerCredentialSource create(String region, Map<CloudProvider, String> secretIds) {
    return new SecretsManagerCredentialSource(() -> {
      SecretsManagerAsyncClientBuilder builder = SecretsManagerAsyncClient.builder();
      if (region != null && !region.isBlank()) {
        builder.region(Region.of(region));
      }
      return builder.build();
    }, secretIds);
  }

  @Override
  public CompletableFuture<ProviderCredentials> getCredentials(CloudProvider provider) {
    Objects.requireNonNull(provider, "provider");

    String secretId = secretIds.get(provider);
    if (secretId == null || secretId.isBlank()) {
      return CompletableFuture.failedFuture(new CloudDeployException(
          ErrorKind.CONFIGURATION, "no secret configured for provider: " + provider.configName()));
    }

    SecretsManagerAsyncClient secretsClient;
    try {
      secretsClient = client();
    } catch (SdkException e) {
      return CompletableFuture.failedFuture(new CloudDeployException(
          ErrorKind.CONFIGURATION, "failed to load AWS config: " + e.getMessage(), e));
    }

    LOGGER.info("Fetching {} credentials from secrets store secret {}", provider.configName(), secretId);

    GetSecretValueRequest request = GetSecretValueRequest.builder().secretId(secretId).build();
    CompletableFuture<GetSecretValueResponse> call = secretsClient.getSecretValue(request);
    return CancellationScope.forwardCancellation(call.handle((response, error) -> {
      if (error != null) {
        throw CloudDeployException.wrap("failed to retrieve secret " + secretId, error, ErrorKind.BACKEND);
      }
      if (response.secretString() == null) {
        throw new CloudDeployException(ErrorKind.BACKEND, "secret " + secretId + " has no string value");
      }
      return parse(response.secretString(), secretId);
    }), call);
  }

  static ProviderCredentials parse(String secretJson, String secretId) {
    try {
      ProviderCredentials credentials = MAPPER.readValue(secretJson, ProviderCredentials.class);
      if (credentials == null) {
        throw new CloudDeployException(ErrorKind.BACKEND, "secret " + secretId + " is empty");
      }
      return credentials;
    } catch (IOException e) {
      // the secret value stays out of the message
      throw new CloudDeployException(ErrorKind.BACKEND, "failed to parse secret JSON of " + secretId, e);
    }
  }

  private SecretsManagerAsyncClient client() {
    synchronized (clientGate) {
      if (client == null) {
        client = clientFactory.get();
      }
      return client;
    }
  }

  private static Supplier<SecretsManagerAsyncClient> constant(SecretsManagerAsyncClient client) {
    return () -> client;
  }
}
