package com.clouddeploy.credentials;

import com.clouddeploy.CloudDeployException;
import com.clouddeploy.ErrorKind;
import com.clouddeploy.vault.FakeVaultServer;
import com.clouddeploy.vault.HangingHttpClient;
import com.clouddeploy.vault.VaultAuthConfig;
import com.clouddeploy.vault.VaultConfig;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class VaultCredentialSourceTests {
  private static final HttpClient HTTP = HttpClient.newHttpClient();

  @Test
  void aws_readsConventionalPath_andDefaultsOptionalFields() throws Exception {
    try (FakeVaultServer vault = new FakeVaultServer()
        .acceptToken("root")
        .putSecret("secret/data/cloud-deploy/aws/credentials", Map.of(
            "access_key_id", "AKIAEXAMPLE",
            "secret_access_key", "secret"))) {

      VaultCredentialSource source = new VaultCredentialSource(
          HTTP, new VaultConfig(vault.address(), VaultAuthConfig.token("root")));

      ProviderCredentials credentials = source.getCredentials(CloudProvider.AWS).get(5, TimeUnit.SECONDS);

      assertEquals("AKIAEXAMPLE", credentials.aws().accessKeyId());
      assertEquals("secret", credentials.aws().secretAccessKey());
      assertEquals("", credentials.aws().sessionToken());
    }
  }

  @Test
  void azure_usesConfiguredMountAndApplication_withApprole() throws Exception {
    try (FakeVaultServer vault = new FakeVaultServer()
        .acceptAppRole("role", "secret")
        .putSecret("kv/data/shop/azure/credentials", Map.of(
            "subscription_id", "sub",
            "client_id", "client",
            "client_secret", "pw",
            "tenant_id", "tenant"))) {

      VaultConfig config = new VaultConfig(
          vault.address(), VaultAuthConfig.appRole("role", "secret"), null, "kv", "shop", Duration.ofSeconds(5));
      ProviderCredentials credentials = new VaultCredentialSource(HTTP, config)
          .getCredentials(CloudProvider.AZURE)
          .get(5, TimeUnit.SECONDS);

      assertEquals("tenant", credentials.azure().tenantId());
      assertEquals("sub", credentials.azure().subscriptionId());
    }
  }

  @Test
  void requiredFieldMissing_failsWithFieldName() throws Exception {
    try (FakeVaultServer vault = new FakeVaultServer()
        .acceptToken("root")
        .putSecret("secret/data/cloud-deploy/gcp/credentials", Map.of("project_id", "myproj"))) {

      VaultCredentialSource source = new VaultCredentialSource(
          HTTP, new VaultConfig(vault.address(), VaultAuthConfig.token("root")));

      ExecutionException ex = assertThrows(
          ExecutionException.class,
          () -> source.getCredentials(CloudProvider.GCP).get(5, TimeUnit.SECONDS));
      CloudDeployException error = (CloudDeployException) ex.getCause();
      assertEquals(ErrorKind.NOT_FOUND, error.kind());
      assertTrue(error.getMessage().contains("service_account_key"), error.getMessage());
    }
  }

  @Test
  void authenticationFailure_isReported() throws Exception {
    try (FakeVaultServer vault = new FakeVaultServer().acceptAppRole("role", "secret")) {
      VaultCredentialSource source = new VaultCredentialSource(
          HTTP, new VaultConfig(vault.address(), VaultAuthConfig.appRole("role", "wrong")));

      ExecutionException ex = assertThrows(
          ExecutionException.class,
          () -> source.getCredentials(CloudProvider.CLOUDFLARE).get(5, TimeUnit.SECONDS));
      CloudDeployException error = (CloudDeployException) ex.getCause();
      assertEquals(ErrorKind.AUTHENTICATION, error.kind());
      assertTrue(error.getMessage().startsWith("failed to authenticate to vault"));
      assertEquals(1, vault.requests().size(), "no secret read after failed login");
    }
  }

  @Test
  void cancel_abortsVaultRequestInFlight() {
    HangingHttpClient client = new HangingHttpClient();
    VaultCredentialSource source = new VaultCredentialSource(
        client, new VaultConfig("http://vault.invalid:8200", VaultAuthConfig.token("root")));

    source.getCredentials(CloudProvider.AWS).cancel(true);

    assertEquals(1, client.exchanges().size(), "no further field is read");
    assertTrue(client.exchanges().get(0).isCancelled());
  }
}
