package com.clouddeploy.credentials;

import com.clouddeploy.CloudDeployException;
import com.clouddeploy.ErrorKind;
import java.util.Locale;

/**
 * Backend a {@link CredentialManager} resolves credentials from. Exactly one is active per manager.
 */
public enum CredentialSource {
  ENVIRONMENT("environment"),
  /** AWS Secrets Manager. */
  SECRETS_STORE("secrets-store"),
  VAULT("vault"),
  /** Reserved; not implemented. */
  ENCRYPTED_FILE("encrypted-file");

  private static final String SECRETS_MANAGER_ALIAS = "secrets-manager";

  private final String configName;

  CredentialSource(String configName) {
    this.configName = configName;
  }

  public String configName() {
    return configName;
  }

  public static CredentialSource fromName(String name) {
    if (name != null) {
      String normalized = name.trim().toLowerCase(Locale.ROOT);
      if (SECRETS_MANAGER_ALIAS.equals(normalized)) {
        return SECRETS_STORE;
      }
      for (CredentialSource source : values()) {
        if (source.configName.equals(normalized)) {
          return source;
        }
      }
    }
    throw new CloudDeployException(ErrorKind.CONFIGURATION, "unknown credentials source: " + name);
  }
}
