package com.clouddeploy.vault;

import com.clouddeploy.CloudDeployException;
import com.clouddeploy.ErrorKind;
import java.util.Locale;

public enum VaultAuthMethod {
  TOKEN("token"),
  APPROLE("approle"),
  AWS_IAM("aws-iam"),
  GCP_IAM("gcp-iam");

  private final String configName;

  VaultAuthMethod(String configName) {
    this.configName = configName;
  }

  public String configName() {
    return configName;
  }

  /**
   * Parses the configuration name ({@code token}, {@code approle}, {@code aws-iam}, {@code gcp-iam}).
   */
  public static VaultAuthMethod fromName(String name) {
    if (name != null) {
      String normalized = name.trim().toLowerCase(Locale.ROOT);
      for (VaultAuthMethod method : values()) {
        if (method.configName.equals(normalized)) {
          return method;
        }
      }
    }
    throw new CloudDeployException(ErrorKind.CONFIGURATION, "unsupported vault auth method: " + name);
  }
}
