package com.clouddeploy;

/**
 * Classifies {@link CloudDeployException} failures so callers can decide whether to retry,
 * fix configuration, or surface the error to an operator.
 */
public enum ErrorKind {
  /** Missing or invalid setup (unset Vault address, unmapped secret id, unknown source). */
  CONFIGURATION,
  /** A required credential is absent or empty after resolution. */
  MISSING_CREDENTIALS,
  /** Bad token, failed AppRole exchange, missing registry admin credentials. */
  AUTHENTICATION,
  /** Missing secret path/key or a remote repository that does not exist yet. */
  NOT_FOUND,
  /** Remote repository already exists. Recovered locally during provisioning. */
  ALREADY_EXISTS,
  /** A secret value has an unexpected type. */
  TYPE_MISMATCH,
  /** A secret backend returned something that could not be used. */
  BACKEND,
  /** Arbitrary SDK or network failure. The caller may retry the whole operation. */
  TRANSIENT_NETWORK,
  /** Unimplemented auth method or credential backend. */
  UNSUPPORTED
}
