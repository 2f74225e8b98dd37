package com.clouddeploy.vault;

import java.util.Objects;

/**
 * How a {@link VaultSession} authenticates. Only the fields of the selected method are used.
 */
public final class VaultAuthConfig {
  private final VaultAuthMethod method;
  private final String token;
  private final String roleId;
  private final String secretId;
  private final String role;

  public VaultAuthConfig(VaultAuthMethod method, String token, String roleId, String secretId, String role) {
    this.method = Objects.requireNonNull(method, "method");
    this.token = emptyIfNull(token);
    this.roleId = emptyIfNull(roleId);
    this.secretId = emptyIfNull(secretId);
    this.role = emptyIfNull(role);
  }

  public static VaultAuthConfig token(String token) {
    return new VaultAuthConfig(VaultAuthMethod.TOKEN, token, null, null, null);
  }

  public static VaultAuthConfig appRole(String roleId, String secretId) {
    return new VaultAuthConfig(VaultAuthMethod.APPROLE, null, roleId, secretId, null);
  }

  public static VaultAuthConfig awsIam(String role) {
    return new VaultAuthConfig(VaultAuthMethod.AWS_IAM, null, null, null, role);
  }

  public static VaultAuthConfig gcpIam(String role) {
    return new VaultAuthConfig(VaultAuthMethod.GCP_IAM, null, null, null, role);
  }

  public VaultAuthMethod method() {
    return method;
  }

  public String token() {
    return token;
  }

  public String roleId() {
    return roleId;
  }

  public String secretId() {
    return secretId;
  }

  /**
   * Role name for the cloud IAM methods.
   */
  public String role() {
    return role;
  }

  @Override
  public String toString() {
    return "VaultAuthConfig{method=" + method.configName()
        + ", token=" + redact(token)
        + ", roleId=" + redact(roleId)
        + ", secretId=" + redact(secretId)
        + ", role=" + role + "}";
  }

  private static String redact(String value) {
    return value.isEmpty() ? "<unset>" : "<redacted>";
  }

  private static String emptyIfNull(String value) {
    return value == null ? "" : value;
  }
}
