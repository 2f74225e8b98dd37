package com.clouddeploy.credentials;

import com.clouddeploy.CloudDeployException;
import com.clouddeploy.ErrorKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Reads provider credentials from environment variables.
 * <table>
 *   <caption>Variables per provider (optional ones in brackets)</caption>
 *   <tr><td>aws</td><td>AWS_ACCESS_KEY_ID, AWS_SECRET_ACCESS_KEY, [AWS_SESSION_TOKEN]</td></tr>
 *   <tr><td>gcp</td><td>GCP_PROJECT_ID, GCP_SERVICE_ACCOUNT_KEY, [GCP_SERVICE_ACCOUNT_EMAIL]</td></tr>
 *   <tr><td>azure</td><td>AZURE_TENANT_ID, AZURE_CLIENT_ID, AZURE_CLIENT_SECRET, [AZURE_SUBSCRIPTION_ID]</td></tr>
 *   <tr><td>cloudflare</td><td>CLOUDFLARE_API_TOKEN, [CLOUDFLARE_ACCOUNT_ID], [CLOUDFLARE_EMAIL]</td></tr>
 * </table>
 * Any missing or empty required variable fails the whole resolution; no partial bundle is returned.
 */
public final class EnvironmentCredentialSource implements ProviderCredentialSource {
  static final String AWS_ACCESS_KEY_ID = "AWS_ACCESS_KEY_ID";
  static final String AWS_SECRET_ACCESS_KEY = "AWS_SECRET_ACCESS_KEY";
  static final String AWS_SESSION_TOKEN = "AWS_SESSION_TOKEN";
  static final String GCP_PROJECT_ID = "GCP_PROJECT_ID";
  static final String GCP_SERVICE_ACCOUNT_KEY = "GCP_SERVICE_ACCOUNT_KEY";
  static final String GCP_SERVICE_ACCOUNT_EMAIL = "GCP_SERVICE_ACCOUNT_EMAIL";
  static final String AZURE_TENANT_ID = "AZURE_TENANT_ID";
  static final String AZURE_CLIENT_ID = "AZURE_CLIENT_ID";
  static final String AZURE_CLIENT_SECRET = "AZURE_CLIENT_SECRET";
  static final String AZURE_SUBSCRIPTION_ID = "AZURE_SUBSCRIPTION_ID";
  static final String CLOUDFLARE_API_TOKEN = "CLOUDFLARE_API_TOKEN";
  static final String CLOUDFLARE_ACCOUNT_ID = "CLOUDFLARE_ACCOUNT_ID";
  static final String CLOUDFLARE_EMAIL = "CLOUDFLARE_EMAIL";

  private final EnvironmentLookup environment;

  public EnvironmentCredentialSource() {
    this(EnvironmentLookup.system());
  }

  public EnvironmentCredentialSource(EnvironmentLookup environment) {
    this.environment = Objects.requireNonNull(environment, "environment");
  }

  @Override
  public CompletableFuture<ProviderCredentials> getCredentials(CloudProvider provider) {
    Objects.requireNonNull(provider, "provider");
    try {
      return CompletableFuture.completedFuture(read(provider));
    } catch (CloudDeployException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  private ProviderCredentials read(CloudProvider provider) {
    return switch (provider) {
      case AWS -> {
        require(provider, AWS_ACCESS_KEY_ID, AWS_SECRET_ACCESS_KEY);
        yield ProviderCredentials.ofAws(new ProviderCredentials.Aws(
            environment.get(AWS_ACCESS_KEY_ID),
            environment.get(AWS_SECRET_ACCESS_KEY),
            environment.getOrEmpty(AWS_SESSION_TOKEN)));
      }
      case GCP -> {
        require(provider, GCP_PROJECT_ID, GCP_SERVICE_ACCOUNT_KEY);
        yield ProviderCredentials.ofGcp(new ProviderCredentials.Gcp(
            environment.get(GCP_PROJECT_ID),
            environment.get(GCP_SERVICE_ACCOUNT_KEY),
            environment.getOrEmpty(GCP_SERVICE_ACCOUNT_EMAIL)));
      }
      case AZURE -> {
        require(provider, AZURE_TENANT_ID, AZURE_CLIENT_ID, AZURE_CLIENT_SECRET);
        yield ProviderCredentials.ofAzure(new ProviderCredentials.Azure(
            environment.get(AZURE_TENANT_ID),
            environment.get(AZURE_CLIENT_ID),
            environment.get(AZURE_CLIENT_SECRET),
            environment.getOrEmpty(AZURE_SUBSCRIPTION_ID)));
      }
      case CLOUDFLARE -> {
        require(provider, CLOUDFLARE_API_TOKEN);
        yield ProviderCredentials.ofCloudflare(new ProviderCredentials.Cloudflare(
            environment.get(CLOUDFLARE_API_TOKEN),
            environment.getOrEmpty(CLOUDFLARE_ACCOUNT_ID),
            environment.getOrEmpty(CLOUDFLARE_EMAIL)));
      }
    };
  }

  private void require(CloudProvider provider, String... names) {
    List<String> missing = new ArrayList<>();
    for (String name : names) {
      if (ProviderCredentials.isBlank(environment.get(name))) {
        missing.add(name);
      }
    }
    if (!missing.isEmpty()) {
      throw new CloudDeployException(
          ErrorKind.MISSING_CREDENTIALS,
          provider.configName() + " credentials not found in environment (missing " + String.join(", ", missing) + ")");
    }
  }
}
