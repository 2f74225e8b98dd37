package com.clouddeploy.vault;

import com.clouddeploy.CancellationScope;
import com.clouddeploy.CloudDeployException;
import com.clouddeploy.ErrorKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authenticated conversation with a Vault-compatible server, reading KV version 2 secrets over its HTTP API.
 * <p>
 * Lifecycle: a session is created unauthenticated, {@link #authenticate()} moves it to the
 * authenticated state exactly once, and secret reads are only allowed afterwards. There is no token
 * renewal or re-authentication: one session covers one resolution and is then discarded.
 * <p>
 * A session is owned by the caller that created it and must not be shared between concurrent
 * resolutions.
 */
public final class VaultSession {
  private static final Logger DEFAULT_LOGGER = LoggerFactory.getLogger(VaultSession.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  static final String TOKEN_HEADER = "X-Vault-Token";
  static final String NAMESPACE_HEADER = "X-Vault-Namespace";

  private final HttpClient httpClient;
  private final VaultConfig config;
  private final Logger logger;

  private final Object stateGate = new Object();
  private boolean authenticating;
  private volatile String token;

  public VaultSession(HttpClient httpClient, VaultConfig config) {
    this(httpClient, config, DEFAULT_LOGGER);
  }

  public VaultSession(HttpClient httpClient, VaultConfig config, Logger logger) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.config = Objects.requireNonNull(config, "config");
    this.logger = Objects.requireNonNull(logger, "logger");
  }

  /**
   * Opens a session, authenticates it, resolves {@code references} and discards the session.
   *
   * @return secret values keyed by the logical names of {@code references}
   */
  public static CompletableFuture<Map<String, String>> fetchSecrets(
      HttpClient httpClient,
      VaultConfig config,
      Map<String, SecretReference> references) {
    VaultSession session = new VaultSession(httpClient, config);
    CompletableFuture<Map<String, String>> result = new CompletableFuture<>();
    CancellationScope scope = CancellationScope.of(result);

    scope.track(session::authenticate)
        .handle((ignored, error) -> {
          if (error != null) {
            throw CloudDeployException.wrap("failed to authenticate to vault", error, ErrorKind.AUTHENTICATION);
          }
          return session;
        })
        .thenCompose(authenticated -> scope.track(() -> authenticated.getSecrets(references)))
        .whenComplete((values, error) -> {
          if (error != null) {
            result.completeExceptionally(CloudDeployException.unwrap(error));
          } else {
            result.complete(values);
          }
        });
    return result;
  }

  public VaultConfig config() {
    return config;
  }

  public boolean isAuthenticated() {
    return token != null;
  }

  /**
   * Authenticates using the configured method.
   * <ul>
   *   <li>{@code token}: adopts the configured token; no network call.</li>
   *   <li>{@code approle}: exchanges role id and secret id for a session token.</li>
   *   <li>{@code aws-iam}, {@code gcp-iam}: not implemented; always fail with {@link ErrorKind#UNSUPPORTED}.</li>
   * </ul>
   */
  public CompletableFuture<Void> authenticate() {
    synchronized (stateGate) {
      if (token != null || authenticating) {
        return CompletableFuture.failedFuture(
            new IllegalStateException("vault session is already authenticated"));
      }
      authenticating = true;
    }

    VaultAuthConfig auth = config.auth();
    CompletableFuture<Void> attempt = switch (auth.method()) {
      case TOKEN -> authenticateWithToken(auth);
      case APPROLE -> authenticateWithAppRole(auth);
      case AWS_IAM, GCP_IAM -> CompletableFuture.failedFuture(new CloudDeployException(
          ErrorKind.UNSUPPORTED,
          auth.method().configName() + " authentication not yet implemented"));
    };

    return CancellationScope.forwardCancellation(attempt.whenComplete((ignored, error) -> {
      synchronized (stateGate) {
        authenticating = false;
      }
    }), attempt);
  }

  private CompletableFuture<Void> authenticateWithToken(VaultAuthConfig auth) {
    if (auth.token().isBlank()) {
      return CompletableFuture.failedFuture(new CloudDeployException(
          ErrorKind.CONFIGURATION, "vault token is required for token authentication"));
    }

    token = auth.token();
    logger.info("Authenticated to vault at {} with a static token", config.address());
    return CompletableFuture.completedFuture(null);
  }

  private CompletableFuture<Void> authenticateWithAppRole(VaultAuthConfig auth) {
    if (auth.roleId().isBlank()) {
      return CompletableFuture.failedFuture(new CloudDeployException(
          ErrorKind.CONFIGURATION, "role_id is required for approle authentication"));
    }
    if (auth.secretId().isBlank()) {
      return CompletableFuture.failedFuture(new CloudDeployException(
          ErrorKind.CONFIGURATION, "secret_id is required for approle authentication"));
    }

    ObjectNode body = MAPPER.createObjectNode()
        .put("role_id", auth.roleId())
        .put("secret_id", auth.secretId());

    HttpRequest request;
    try {
      request = newRequest("auth/approle/login")
          .header("Content-Type", "application/json")
          .POST(HttpRequest.BodyPublishers.ofString(body.toString(), StandardCharsets.UTF_8))
          .build();
    } catch (IllegalArgumentException e) {
      return CompletableFuture.failedFuture(
          new CloudDeployException(ErrorKind.CONFIGURATION, "invalid vault address " + config.address(), e));
    }

    logger.info("Authenticating to vault at {} with approle", config.address());

    CompletableFuture<HttpResponse<byte[]>> response = send(request, "approle login failed");
    return CancellationScope.forwardCancellation(response.thenApply(login -> {
      if (!isSuccess(login.statusCode())) {
        throw new CloudDeployException(
            ErrorKind.AUTHENTICATION,
            "approle login failed with HTTP " + login.statusCode() + vaultErrors(login.body()));
      }

      JsonNode clientToken = readTree(login.body(), "approle login response").path("auth").path("client_token");
      if (!clientToken.isTextual() || clientToken.asText().isBlank()) {
        throw new CloudDeployException(ErrorKind.AUTHENTICATION, "approle login returned no auth token");
      }

      token = clientToken.asText();
      logger.info("Authenticated to vault at {} with approle", config.address());
      return null;
    }), response);
  }

  /**
   * Reads {@code key} from the KV v2 secret at {@code path}.
   * <p>
   * Fails with {@link ErrorKind#NOT_FOUND} when the path has no secret, the response carries no
   * {@code data} wrapper, or the key is absent; with {@link ErrorKind#TYPE_MISMATCH} when the value
   * is not a string.
   *
   * @param path full path including the {@code data} segment, e.g. {@code secret/data/myapp/database}
   */
  public CompletableFuture<String> getSecret(String path, String key) {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(key, "key");

    String currentToken = token;
    if (currentToken == null) {
      return CompletableFuture.failedFuture(new IllegalStateException("vault session is not authenticated"));
    }

    String normalizedPath = stripLeadingSlash(path);
    logger.debug("Reading vault secret {} at {}", key, normalizedPath);

    HttpRequest request;
    try {
      request = newRequest(normalizedPath)
          .header(TOKEN_HEADER, currentToken)
          .GET()
          .build();
    } catch (IllegalArgumentException e) {
      return CompletableFuture.failedFuture(
          new CloudDeployException(ErrorKind.CONFIGURATION, "invalid vault secret path: " + path, e));
    }

    CompletableFuture<HttpResponse<byte[]>> response = send(request, "failed to read secret at " + path);
    return CancellationScope.forwardCancellation(
        response.thenApply(secret -> extractValue(secret.statusCode(), secret.body(), path, key)),
        response);
  }

  /**
   * Reads several secrets, one after another in the iteration order of {@code references}.
   * <p>
   * All-or-nothing: the first failure aborts the remaining reads and is reported with the logical
   * name of the failing reference. Cancelling the returned future aborts the read in progress.
   */
  public CompletableFuture<Map<String, String>> getSecrets(Map<String, SecretReference> references) {
    Objects.requireNonNull(references, "references");
    List<Map.Entry<String, SecretReference>> entries = new ArrayList<>(references.entrySet());

    CompletableFuture<Map<String, String>> result = new CompletableFuture<>();
    CancellationScope scope = CancellationScope.of(result);
    Map<String, String> values = new LinkedHashMap<>();

    CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
    for (Map.Entry<String, SecretReference> entry : entries) {
      String name = entry.getKey();
      SecretReference reference = Objects.requireNonNull(entry.getValue(), "reference for " + name);

      chain = chain.thenCompose(ignored -> {
        scope.ensureActive("reading secret " + name);
        return scope.track(() -> getSecret(reference.path(), reference.key())).handle((value, error) -> {
          if (error != null) {
            throw CloudDeployException.wrap("failed to fetch secret " + name, error, ErrorKind.TRANSIENT_NETWORK);
          }
          values.put(name, value);
          return null;
        });
      });
    }

    chain.whenComplete((ignored, error) -> {
      if (error != null) {
        result.completeExceptionally(CloudDeployException.unwrap(error));
      } else {
        result.complete(Collections.unmodifiableMap(values));
      }
    });
    return result;
  }

  static String extractValue(int statusCode, byte[] body, String path, String key) {
    if (statusCode == 404) {
      throw new CloudDeployException(ErrorKind.NOT_FOUND, "secret not found at path: " + path);
    }
    if (statusCode == 401 || statusCode == 403) {
      throw new CloudDeployException(
          ErrorKind.AUTHENTICATION, "permission denied reading secret at path: " + path + vaultErrors(body));
    }
    if (!isSuccess(statusCode)) {
      throw new CloudDeployException(
          ErrorKind.BACKEND, "vault returned HTTP " + statusCode + " for secret at path: " + path + vaultErrors(body));
    }

    // KV v2 nests the stored values under data.data.
    JsonNode data = readTree(body, "secret at path " + path).path("data").path("data");
    if (!data.isObject()) {
      throw new CloudDeployException(ErrorKind.NOT_FOUND, "unexpected secret format at path: " + path);
    }

    JsonNode value = data.get(key);
    if (value == null) {
      throw new CloudDeployException(
          ErrorKind.NOT_FOUND, "key " + key + " not found in secret at path: " + path);
    }
    if (!value.isTextual()) {
      throw new CloudDeployException(
          ErrorKind.TYPE_MISMATCH, "value for key " + key + " is not a string at path: " + path);
    }
    return value.asText();
  }

  private HttpRequest.Builder newRequest(String apiPath) {
    HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(config.address() + "/v1/" + apiPath))
        .timeout(config.requestTimeout())
        .header("Accept", "application/json");
    if (config.namespace() != null) {
      builder.header(NAMESPACE_HEADER, config.namespace());
    }
    return builder;
  }

  private CompletableFuture<HttpResponse<byte[]>> send(HttpRequest request, String context) {
    CompletableFuture<HttpResponse<byte[]>> exchange =
        httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray());
    return CancellationScope.forwardCancellation(exchange.handle((response, error) -> {
      if (error != null) {
        throw CloudDeployException.wrap(context, error, ErrorKind.TRANSIENT_NETWORK);
      }
      return response;
    }), exchange);
  }

  private static JsonNode readTree(byte[] body, String what) {
    try {
      return MAPPER.readTree(body);
    } catch (IOException e) {
      throw new CloudDeployException(ErrorKind.BACKEND, "failed to parse vault response for " + what, e);
    }
  }

  private static String vaultErrors(byte[] body) {
    if (body == null || body.length == 0) {
      return "";
    }
    try {
      JsonNode errors = MAPPER.readTree(body).path("errors");
      if (errors.isArray() && errors.size() > 0) {
        List<String> messages = new ArrayList<>();
        errors.forEach(node -> messages.add(node.asText()));
        return " (" + String.join("; ", messages) + ")";
      }
    } catch (IOException e) {
      // not JSON; the status code is all we report
      return "";
    }
    return "";
  }

  private static boolean isSuccess(int statusCode) {
    return statusCode >= 200 && statusCode < 300;
  }

  private static String stripLeadingSlash(String path) {
    String result = path;
    while (result.startsWith("/")) {
      result = result.substring(1);
    }
    return result;
  }
}
