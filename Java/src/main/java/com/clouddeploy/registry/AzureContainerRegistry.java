package com.clouddeploy.registry;

import com.azure.core.credential.TokenCredential;
import com.azure.core.management.AzureEnvironment;
import com.azure.core.management.exception.ManagementException;
import com.azure.core.management.profile.AzureProfile;
import com.azure.resourcemanager.containerregistry.ContainerRegistryManager;
import com.azure.resourcemanager.containerregistry.models.AccessKeyType;
import com.azure.resourcemanager.containerregistry.models.Registries;
import com.azure.resourcemanager.containerregistry.models.Registry;
import com.azure.resourcemanager.containerregistry.models.RegistryCredentials;
import com.clouddeploy.CancellationScope;
import com.clouddeploy.CloudDeployException;
import com.clouddeploy.ErrorKind;
import com.google.cloud.tools.jib.api.Credential;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Azure Container Registry managed through Azure Resource Manager.
 * <p>
 * The registry is created (Basic SKU, admin user enabled) when it does not exist; pushes use the
 * admin user credentials.
 * <p>
 * Requires RBAC permissions to read, create and {@code listCredentials} on
 * {@code Microsoft.ContainerRegistry/registries}.
 */
public final class AzureContainerRegistry implements ContainerRegistry {
  private static final Logger LOGGER = LoggerFactory.getLogger(AzureContainerRegistry.class);

  private final ContainerRegistryManager registryManager;
  private final String resourceGroupName;
  private final String registryName;
  private final String location;
  private final String imageName;
  private final String imageTag;

  private volatile String registryUrl = "";
  private volatile String imageReference;

  /**
   * @param credential Azure credential (for example a client secret credential).
   * @param tenantId Optional tenant ID; may be null/blank to defer to the credential defaults.
   * @param subscriptionId Azure subscription ID.
   */
  public AzureContainerRegistry(
      TokenCredential credential,
      String tenantId,
      String subscriptionId,
      String resourceGroupName,
      String registryName,
      String location,
      String imageName,
      String imageTag) {
    this(
        ContainerRegistryManager.authenticate(
            Objects.requireNonNull(credential, "credential"),
            new AzureProfile(
                normalizeOptional(tenantId),
                ElasticContainerRegistry.requireText(subscriptionId, "subscriptionId"),
                AzureEnvironment.AZURE)),
        resourceGroupName,
        registryName,
        location,
        imageName,
        imageTag);
  }

  public AzureContainerRegistry(
      ContainerRegistryManager registryManager,
      String resourceGroupName,
      String registryName,
      String location,
      String imageName,
      String imageTag) {
    this.registryManager = Objects.requireNonNull(registryManager, "registryManager");
    this.resourceGroupName = ElasticContainerRegistry.requireText(resourceGroupName, "resourceGroupName");
    this.registryName = ElasticContainerRegistry.requireText(registryName, "registryName");
    this.location = ElasticContainerRegistry.requireText(location, "location");
    this.imageName = ElasticContainerRegistry.requireText(imageName, "imageName");
    this.imageTag = ElasticContainerRegistry.requireText(imageTag, "imageTag");
  }

  /**
   * Repository name of a local image reference: the last path segment without tag or digest,
   * e.g. {@code myapp} for {@code registry.local:5000/team/myapp:1.0}.
   */
  public static String imageNameOf(String sourceImage) {
    String name = ElasticContainerRegistry.requireText(sourceImage, "sourceImage");
    int digest = name.indexOf('@');
    if (digest >= 0) {
      name = name.substring(0, digest);
    }
    int slash = name.lastIndexOf('/');
    if (slash >= 0) {
      name = name.substring(slash + 1);
    }
    int tag = name.indexOf(':');
    if (tag >= 0) {
      name = name.substring(0, tag);
    }
    if (name.isBlank()) {
      throw new CloudDeployException(ErrorKind.CONFIGURATION, "cannot derive image name from " + sourceImage);
    }
    return name;
  }

  @Override
  public String registryUrl() {
    return registryUrl;
  }

  @Override
  public CompletableFuture<Credential> authenticate() {
    Registries registries = registryManager.containerRegistries();
    CompletableFuture<Credential> result = new CompletableFuture<>();
    CancellationScope scope = CancellationScope.of(result);

    scope.track(() -> RepositoryProvisioning.<Registry>ensureExists(
            "ACR registry " + resourceGroupName + "/" + registryName,
            () -> registries.getByResourceGroupAsync(resourceGroupName, registryName)
                .toFuture()
                .thenApply(this::requireFound),
            () -> registries.define(registryName)
                .withRegion(location)
                .withExistingResourceGroup(resourceGroupName)
                .withBasicSku()
                .withRegistryNameAsAdminUser()
                .createAsync()
                .toFuture(),
            AzureContainerRegistry::isNotFound,
            AzureContainerRegistry::isAlreadyExists,
            LOGGER))
        .thenCompose(registry -> {
          String loginServer = registry.loginServerUrl();
          if (loginServer == null || loginServer.isBlank()) {
            throw new CloudDeployException(ErrorKind.BACKEND, "ACR registry " + registryName + " has no login server");
          }
          registryUrl = loginServer;

          return scope.track(() -> registry.getCredentialsAsync().toFuture()).handle((credentials, error) -> {
            if (error != null) {
              throw CloudDeployException.wrap("failed to get ACR credentials", error, ErrorKind.AUTHENTICATION);
            }
            Credential credential = toCredential(credentials);
            imageReference = loginServer + "/" + imageName + ":" + imageTag;
            LOGGER.info("Authenticated to ACR registry {}", loginServer);
            return credential;
          });
        })
        .whenComplete((credential, error) -> {
          if (error != null) {
            result.completeExceptionally(CloudDeployException.unwrap(error));
          } else {
            result.complete(credential);
          }
        });
    return result;
  }

  static Credential toCredential(RegistryCredentials credentials) {
    if (credentials == null) {
      throw new CloudDeployException(ErrorKind.AUTHENTICATION, "no admin credentials available for ACR");
    }
    return toCredential(credentials.username(), credentials.accessKeys());
  }

  static Credential toCredential(String username, Map<AccessKeyType, String> keys) {
    if (username == null || username.isBlank() || keys == null || keys.isEmpty()) {
      throw new CloudDeployException(ErrorKind.AUTHENTICATION, "no admin credentials available for ACR");
    }

    String password = keys.get(AccessKeyType.PRIMARY);
    if (password == null || password.isBlank()) {
      password = keys.values().stream()
          .filter(value -> value != null && !value.isBlank())
          .findFirst()
          .orElseThrow(() -> new CloudDeployException(ErrorKind.AUTHENTICATION, "no admin credentials available for ACR"));
    }
    return Credential.from(username, password);
  }

  private Registry requireFound(Registry registry) {
    if (registry == null) {
      throw new CloudDeployException(ErrorKind.NOT_FOUND, "ACR registry " + registryName + " not found");
    }
    return registry;
  }

  static boolean isNotFound(Throwable error) {
    if (CloudDeployException.isKind(error, ErrorKind.NOT_FOUND)) {
      return true;
    }
    return error instanceof ManagementException && statusCode((ManagementException) error) == 404;
  }

  static boolean isAlreadyExists(Throwable error) {
    if (error instanceof ManagementException && statusCode((ManagementException) error) == 409) {
      return true;
    }
    return RepositoryProvisioning.indicatesAlreadyExists(error);
  }

  private static int statusCode(ManagementException error) {
    return error.getResponse() == null ? -1 : error.getResponse().getStatusCode();
  }

  @Override
  public String imageReference() {
    String reference = imageReference;
    if (reference == null) {
      throw new IllegalStateException("image reference is only known after authenticate() for " + this);
    }
    return reference;
  }

  @Override
  public String toString() {
    return "ACR registry " + resourceGroupName + "/" + registryName;
  }

  private static String normalizeOptional(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    return value;
  }
}
