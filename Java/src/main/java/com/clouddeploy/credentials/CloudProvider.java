package com.clouddeploy.credentials;

import com.clouddeploy.CloudDeployException;
import com.clouddeploy.ErrorKind;
import java.util.Locale;

/**
 * Cloud providers whose credentials can be resolved. {@link #CLOUDFLARE} is the edge/CDN provider.
 */
public enum CloudProvider {
  AWS("aws"),
  GCP("gcp"),
  AZURE("azure"),
  CLOUDFLARE("cloudflare");

  private final String configName;

  CloudProvider(String configName) {
    this.configName = configName;
  }

  /**
   * Lower-case name used in manifests, secret-store mappings and Vault paths.
   */
  public String configName() {
    return configName;
  }

  public static CloudProvider fromName(String name) {
    if (name != null) {
      String normalized = name.trim().toLowerCase(Locale.ROOT);
      for (CloudProvider provider : values()) {
        if (provider.configName.equals(normalized)) {
          return provider;
        }
      }
    }
    throw new CloudDeployException(ErrorKind.CONFIGURATION, "unknown provider: " + name);
  }
}
