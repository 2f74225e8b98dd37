package com.clouddeploy.vault;

import com.clouddeploy.CloudDeployException;
import com.clouddeploy.ErrorKind;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class VaultSessionTests {
  private static final HttpClient HTTP = HttpClient.newHttpClient();

  @Test
  void tokenAuth_readsStoredString() throws Exception {
    try (FakeVaultServer vault = new FakeVaultServer()
        .acceptToken("root")
        .putSecret("secret/data/app/db", Map.of("url", "postgres://x"))) {

      VaultSession session = new VaultSession(HTTP, new VaultConfig(vault.address(), VaultAuthConfig.token("root")));
      session.authenticate().get(5, TimeUnit.SECONDS);

      assertTrue(session.isAuthenticated());
      assertEquals("postgres://x", session.getSecret("secret/data/app/db", "url").get(5, TimeUnit.SECONDS));
      assertEquals(List.of("GET /v1/secret/data/app/db"), vault.requests());
    }
  }

  @Test
  void getSecret_toleratesLeadingSlashAndSendsNamespace() throws Exception {
    try (FakeVaultServer vault = new FakeVaultServer()
        .acceptToken("root")
        .putSecret("secret/data/app/db", Map.of("url", "postgres://x"))) {

      VaultConfig config = new VaultConfig(
          vault.address() + "/", VaultAuthConfig.token("root"), "team-a", "secret", "app", Duration.ofSeconds(5));
      VaultSession session = new VaultSession(HTTP, config);
      session.authenticate().get(5, TimeUnit.SECONDS);

      assertEquals("postgres://x", session.getSecret("/secret/data/app/db", "url").get(5, TimeUnit.SECONDS));
      assertEquals(List.of("team-a"), vault.namespaces());
    }
  }

  @Test
  void getSecret_unknownKey_isNotFound() throws Exception {
    try (FakeVaultServer vault = new FakeVaultServer()
        .acceptToken("root")
        .putSecret("secret/data/app/db", Map.of("url", "postgres://x"))) {

      VaultSession session = authenticated(vault, "root");
      CloudDeployException error = failure(session.getSecret("secret/data/app/db", "password"));

      assertEquals(ErrorKind.NOT_FOUND, error.kind());
      assertTrue(error.getMessage().contains("password"));
      assertTrue(error.getMessage().contains("secret/data/app/db"));
    }
  }

  @Test
  void getSecret_unknownPath_isNotFound() throws Exception {
    try (FakeVaultServer vault = new FakeVaultServer().acceptToken("root")) {
      VaultSession session = authenticated(vault, "root");
      CloudDeployException error = failure(session.getSecret("secret/data/missing", "url"));

      assertEquals(ErrorKind.NOT_FOUND, error.kind());
      assertTrue(error.getMessage().contains("secret/data/missing"));
    }
  }

  @Test
  void getSecret_nonStringValue_isTypeMismatch() throws Exception {
    try (FakeVaultServer vault = new FakeVaultServer()
        .acceptToken("root")
        .putSecret("secret/data/app/db", Map.of("port", 5432))) {

      VaultSession session = authenticated(vault, "root");
      CloudDeployException error = failure(session.getSecret("secret/data/app/db", "port"));

      assertEquals(ErrorKind.TYPE_MISMATCH, error.kind());
    }
  }

  @Test
  void getSecret_rejectedToken_isAuthenticationError() throws Exception {
    try (FakeVaultServer vault = new FakeVaultServer()
        .acceptToken("root")
        .putSecret("secret/data/app/db", Map.of("url", "postgres://x"))) {

      VaultSession session = authenticated(vault, "wrong");
      CloudDeployException error = failure(session.getSecret("secret/data/app/db", "url"));

      assertEquals(ErrorKind.AUTHENTICATION, error.kind());
    }
  }

  @Test
  void getSecret_beforeAuthenticate_isRejected() {
    VaultSession session = new VaultSession(HTTP, new VaultConfig("http://127.0.0.1:1", VaultAuthConfig.token("root")));

    ExecutionException ex = assertThrows(
        ExecutionException.class,
        () -> session.getSecret("secret/data/app/db", "url").get(5, TimeUnit.SECONDS));
    assertTrue(ex.getCause() instanceof IllegalStateException);
  }

  @Test
  void extractValue_missingDataWrapper_isNotFound() {
    byte[] body = "{\"data\":{\"url\":\"postgres://x\"}}".getBytes(StandardCharsets.UTF_8);

    CloudDeployException error = assertThrows(
        CloudDeployException.class,
        () -> VaultSession.extractValue(200, body, "secret/app/db", "url"));
    assertEquals(ErrorKind.NOT_FOUND, error.kind());
    assertTrue(error.getMessage().startsWith("unexpected secret format"));
  }

  @Test
  void extractValue_serverError_isBackendError() {
    byte[] body = "{\"errors\":[\"sealed\"]}".getBytes(StandardCharsets.UTF_8);

    CloudDeployException error = assertThrows(
        CloudDeployException.class,
        () -> VaultSession.extractValue(503, body, "secret/data/app/db", "url"));
    assertEquals(ErrorKind.BACKEND, error.kind());
    assertTrue(error.getMessage().contains("sealed"));
  }

  @Test
  void tokenAuth_emptyToken_isConfigurationError() {
    VaultSession session = new VaultSession(HTTP, new VaultConfig("http://127.0.0.1:1", VaultAuthConfig.token("")));

    CloudDeployException error = failure(session.authenticate());
    assertEquals(ErrorKind.CONFIGURATION, error.kind());
    assertFalse(session.isAuthenticated());
  }

  @Test
  void appRole_emptyIds_failBeforeAnyRequest() throws Exception {
    try (FakeVaultServer vault = new FakeVaultServer().acceptAppRole("role", "secret")) {
      VaultSession noRole = new VaultSession(HTTP, new VaultConfig(vault.address(), VaultAuthConfig.appRole("", "secret")));
      VaultSession noSecret = new VaultSession(HTTP, new VaultConfig(vault.address(), VaultAuthConfig.appRole("role", "")));

      assertEquals(ErrorKind.CONFIGURATION, failure(noRole.authenticate()).kind());
      assertEquals(ErrorKind.CONFIGURATION, failure(noSecret.authenticate()).kind());
      assertTrue(vault.requests().isEmpty(), "no login request expected");
    }
  }

  @Test
  void appRole_login_usesIssuedToken() throws Exception {
    try (FakeVaultServer vault = new FakeVaultServer()
        .acceptAppRole("role", "secret")
        .putSecret("secret/data/app/db", Map.of("url", "postgres://x"))) {

      VaultSession session = new VaultSession(HTTP, new VaultConfig(vault.address(), VaultAuthConfig.appRole("role", "secret")));
      session.authenticate().get(5, TimeUnit.SECONDS);

      assertEquals("postgres://x", session.getSecret("secret/data/app/db", "url").get(5, TimeUnit.SECONDS));
      assertEquals(List.of("POST /v1/auth/approle/login", "GET /v1/secret/data/app/db"), vault.requests());
    }
  }

  @Test
  void appRole_rejectedLogin_isAuthenticationError() throws Exception {
    try (FakeVaultServer vault = new FakeVaultServer().acceptAppRole("role", "secret")) {
      VaultSession session = new VaultSession(HTTP, new VaultConfig(vault.address(), VaultAuthConfig.appRole("role", "nope")));

      CloudDeployException error = failure(session.authenticate());
      assertEquals(ErrorKind.AUTHENTICATION, error.kind());
      assertFalse(session.isAuthenticated());
    }
  }

  @Test
  void appRole_responseWithoutToken_isAuthenticationError() throws Exception {
    try (FakeVaultServer vault = new FakeVaultServer().acceptAppRole("role", "secret").approleOmitsToken()) {
      VaultSession session = new VaultSession(HTTP, new VaultConfig(vault.address(), VaultAuthConfig.appRole("role", "secret")));

      CloudDeployException error = failure(session.authenticate());
      assertEquals(ErrorKind.AUTHENTICATION, error.kind());
      assertEquals("approle login returned no auth token", error.getMessage());
    }
  }

  @Test
  void iamMethods_areUnsupported() {
    VaultSession aws = new VaultSession(HTTP, new VaultConfig("http://127.0.0.1:1", VaultAuthConfig.awsIam("deployer")));
    VaultSession gcp = new VaultSession(HTTP, new VaultConfig("http://127.0.0.1:1", VaultAuthConfig.gcpIam("deployer")));

    assertEquals(ErrorKind.UNSUPPORTED, failure(aws.authenticate()).kind());
    assertEquals(ErrorKind.UNSUPPORTED, failure(gcp.authenticate()).kind());
  }

  @Test
  void authenticate_twice_isRejected() throws Exception {
    VaultSession session = new VaultSession(HTTP, new VaultConfig("http://127.0.0.1:1", VaultAuthConfig.token("root")));
    session.authenticate().get(5, TimeUnit.SECONDS);

    ExecutionException ex = assertThrows(ExecutionException.class, () -> session.authenticate().get(5, TimeUnit.SECONDS));
    assertTrue(ex.getCause() instanceof IllegalStateException);
  }

  @Test
  void getSecrets_returnsAllValuesByName() throws Exception {
    try (FakeVaultServer vault = new FakeVaultServer()
        .acceptToken("root")
        .putSecret("secret/data/app/db", Map.of("url", "postgres://x", "user", "app"))
        .putSecret("secret/data/app/cache", Map.of("url", "redis://y"))) {

      Map<String, SecretReference> references = new LinkedHashMap<>();
      references.put("db", new SecretReference("secret/data/app/db", "url"));
      references.put("dbUser", new SecretReference("secret/data/app/db", "user"));
      references.put("cache", new SecretReference("secret/data/app/cache", "url"));

      Map<String, String> values = authenticated(vault, "root").getSecrets(references).get(5, TimeUnit.SECONDS);

      assertEquals(Map.of("db", "postgres://x", "dbUser", "app", "cache", "redis://y"), values);
      assertEquals(List.of("db", "dbUser", "cache"), List.copyOf(values.keySet()));
    }
  }

  @Test
  void getSecrets_secondMissing_failsWithItsNameAndStops() throws Exception {
    try (FakeVaultServer vault = new FakeVaultServer()
        .acceptToken("root")
        .putSecret("secret/data/app/db", Map.of("url", "postgres://x"))
        .putSecret("secret/data/app/cache", Map.of("url", "redis://y"))) {

      Map<String, SecretReference> references = new LinkedHashMap<>();
      references.put("db", new SecretReference("secret/data/app/db", "url"));
      references.put("queue", new SecretReference("secret/data/app/queue", "url"));
      references.put("cache", new SecretReference("secret/data/app/cache", "url"));

      CloudDeployException error = failure(authenticated(vault, "root").getSecrets(references));

      assertEquals(ErrorKind.NOT_FOUND, error.kind());
      assertTrue(error.getMessage().contains("queue"), error.getMessage());
      assertFalse(vault.requests().contains("GET /v1/secret/data/app/cache"), "third reference must not be read");
    }
  }

  @Test
  void fetchSecrets_authenticatesAndResolves() throws Exception {
    try (FakeVaultServer vault = new FakeVaultServer()
        .acceptAppRole("role", "secret")
        .putSecret("secret/data/app/db", Map.of("url", "postgres://x"))) {

      Map<String, String> values = VaultSession.fetchSecrets(
              HTTP,
              new VaultConfig(vault.address(), VaultAuthConfig.appRole("role", "secret")),
              Map.of("db", new SecretReference("secret/data/app/db", "url")))
          .get(5, TimeUnit.SECONDS);

      assertEquals(Map.of("db", "postgres://x"), values);
    }
  }

  @Test
  void getSecrets_cancel_abortsRequestInFlight() throws Exception {
    HangingHttpClient client = new HangingHttpClient();
    VaultSession session = new VaultSession(client, new VaultConfig("http://vault.invalid:8200", VaultAuthConfig.token("root")));
    session.authenticate().get(5, TimeUnit.SECONDS);

    CompletableFuture<Map<String, String>> result = session.getSecrets(Map.of(
        "db", new SecretReference("secret/data/app/db", "url")));
    assertEquals(1, client.exchanges().size());

    result.cancel(true);

    assertTrue(client.exchanges().get(0).isCancelled());
  }

  @Test
  void approleLogin_cancel_abortsRequestInFlight() {
    HangingHttpClient client = new HangingHttpClient();
    VaultSession session = new VaultSession(
        client, new VaultConfig("http://vault.invalid:8200", VaultAuthConfig.appRole("role", "secret")));

    session.authenticate().cancel(true);

    assertTrue(client.exchanges().get(0).isCancelled());
    assertFalse(session.isAuthenticated());
  }

  @Test
  void fetchSecrets_cancel_abortsRequestInFlight() {
    HangingHttpClient client = new HangingHttpClient();

    VaultSession.fetchSecrets(
            client,
            new VaultConfig("http://vault.invalid:8200", VaultAuthConfig.token("root")),
            Map.of("db", new SecretReference("secret/data/app/db", "url")))
        .cancel(true);

    assertTrue(client.exchanges().get(0).isCancelled());
  }

  @Test
  void getSecret_pathWithIllegalCharacters_failsAsConfigurationError() throws Exception {
    try (FakeVaultServer vault = new FakeVaultServer().acceptToken("root")) {
      VaultSession session = authenticated(vault, "root");

      CompletableFuture<String> pending = session.getSecret("secret/data/app db", "url");

      assertEquals(ErrorKind.CONFIGURATION, failure(pending).kind());
      assertTrue(vault.requests().isEmpty());
    }
  }

  private static VaultSession authenticated(FakeVaultServer vault, String token) throws Exception {
    VaultSession session = new VaultSession(HTTP, new VaultConfig(vault.address(), VaultAuthConfig.token(token)));
    session.authenticate().get(5, TimeUnit.SECONDS);
    return session;
  }

  private static CloudDeployException failure(CompletableFuture<?> future) {
    ExecutionException ex = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
    assertTrue(ex.getCause() instanceof CloudDeployException, () -> "unexpected failure: " + ex.getCause());
    return (CloudDeployException) ex.getCause();
  }
}
