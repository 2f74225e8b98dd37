package com.clouddeploy.vault;

import com.clouddeploy.CloudDeployException;
import com.clouddeploy.ErrorKind;
import java.time.Duration;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class VaultConfigTests {
  @Test
  void defaults_applyToShortConstructor() {
    VaultConfig config = new VaultConfig("https://vault.example.com:8200/", VaultAuthConfig.token("t"));

    assertEquals("https://vault.example.com:8200", config.address().toString());
    assertEquals("secret", config.mount());
    assertEquals("cloud-deploy", config.application());
    assertEquals(Duration.ofSeconds(30), config.requestTimeout());
    assertNull(config.namespace());
  }

  @Test
  void credentialsPath_followsMountAndApplication() {
    VaultConfig config = new VaultConfig(
        "http://127.0.0.1:8200", VaultAuthConfig.token("t"), " ", "kv", "shop", Duration.ofSeconds(5));

    assertEquals("kv/data/shop/aws/credentials", config.credentialsPath("aws"));
    assertNull(config.namespace());
  }

  @Test
  void blankAddress_isConfigurationError() {
    CloudDeployException error = assertThrows(
        CloudDeployException.class,
        () -> new VaultConfig("  ", VaultAuthConfig.token("t")));
    assertEquals(ErrorKind.CONFIGURATION, error.kind());
  }

  @Test
  void authMethod_parsesConfigNames() {
    assertEquals(VaultAuthMethod.APPROLE, VaultAuthMethod.fromName("AppRole"));
    assertEquals(VaultAuthMethod.AWS_IAM, VaultAuthMethod.fromName("aws-iam"));

    CloudDeployException error = assertThrows(CloudDeployException.class, () -> VaultAuthMethod.fromName("kerberos"));
    assertEquals(ErrorKind.CONFIGURATION, error.kind());
  }

  @Test
  void authConfig_toStringRedactsSecrets() {
    String text = VaultAuthConfig.appRole("role-123", "secret-456").toString();

    assertFalse(text.contains("role-123"));
    assertFalse(text.contains("secret-456"));
    assertTrue(text.contains("approle"));
  }
}
