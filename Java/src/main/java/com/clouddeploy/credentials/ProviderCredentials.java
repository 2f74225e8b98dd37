package com.clouddeploy.credentials;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Credential bundle with at most one sub-record per cloud provider.
 * <p>
 * The JSON form (used by the secrets store) is
 * {@code {"aws":{"access_key_id":..,"secret_access_key":..}, "gcp":{..}, "azure":{..}, "cloudflare":{..}}}.
 * Absent sub-records are null. {@link #toString()} never prints secret material.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderCredentials(
    @JsonProperty("aws") Aws aws,
    @JsonProperty("gcp") Gcp gcp,
    @JsonProperty("azure") Azure azure,
    @JsonProperty("cloudflare") Cloudflare cloudflare) {

  public static ProviderCredentials ofAws(Aws aws) {
    return new ProviderCredentials(aws, null, null, null);
  }

  public static ProviderCredentials ofGcp(Gcp gcp) {
    return new ProviderCredentials(null, gcp, null, null);
  }

  public static ProviderCredentials ofAzure(Azure azure) {
    return new ProviderCredentials(null, null, azure, null);
  }

  public static ProviderCredentials ofCloudflare(Cloudflare cloudflare) {
    return new ProviderCredentials(null, null, null, cloudflare);
  }

  @Override
  public String toString() {
    return "ProviderCredentials{aws=" + (aws != null ? "<present>" : "<absent>")
        + ", gcp=" + (gcp != null ? "<present>" : "<absent>")
        + ", azure=" + (azure != null ? "<present>" : "<absent>")
        + ", cloudflare=" + (cloudflare != null ? "<present>" : "<absent>") + "}";
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Aws(
      @JsonProperty("access_key_id") String accessKeyId,
      @JsonProperty("secret_access_key") String secretAccessKey,
      @JsonProperty("session_token") String sessionToken) {
    @Override
    public String toString() {
      return "Aws{accessKeyId=<redacted>, secretAccessKey=<redacted>, sessionToken="
          + (isBlank(sessionToken) ? "<unset>" : "<redacted>") + "}";
    }
  }

  /**
   * @param serviceAccountKey service-account key JSON document
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Gcp(
      @JsonProperty("project_id") String projectId,
      @JsonProperty("service_account_key") String serviceAccountKey,
      @JsonProperty("service_account_email") String serviceAccountEmail) {
    @Override
    public String toString() {
      return "Gcp{projectId=" + projectId + ", serviceAccountKey=<redacted>, serviceAccountEmail="
          + serviceAccountEmail + "}";
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Azure(
      @JsonProperty("tenant_id") String tenantId,
      @JsonProperty("client_id") String clientId,
      @JsonProperty("client_secret") String clientSecret,
      @JsonProperty("subscription_id") String subscriptionId) {
    @Override
    public String toString() {
      return "Azure{tenantId=" + tenantId + ", clientId=" + clientId
          + ", clientSecret=<redacted>, subscriptionId=" + subscriptionId + "}";
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Cloudflare(
      @JsonProperty("api_token") String apiToken,
      @JsonProperty("account_id") String accountId,
      @JsonProperty("email") String email) {
    @Override
    public String toString() {
      return "Cloudflare{apiToken=<redacted>, accountId=" + accountId + ", email=" + email + "}";
    }
  }

  static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
