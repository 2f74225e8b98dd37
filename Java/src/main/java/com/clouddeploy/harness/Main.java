package com.clouddeploy.harness;

import com.azure.core.credential.TokenCredential;
import com.azure.identity.ClientSecretCredentialBuilder;
import com.clouddeploy.CloudDeployException;
import com.clouddeploy.ErrorKind;
import com.clouddeploy.ImageDistributionException;
import com.clouddeploy.credentials.CloudProvider;
import com.clouddeploy.credentials.CredentialManager;
import com.clouddeploy.credentials.CredentialManagerOptions;
import com.clouddeploy.credentials.CredentialSource;
import com.clouddeploy.credentials.EnvironmentLookup;
import com.clouddeploy.credentials.ProviderCredentials;
import com.clouddeploy.registry.AzureContainerRegistry;
import com.clouddeploy.registry.ContainerRegistry;
import com.clouddeploy.registry.DockerDaemonImageStore;
import com.clouddeploy.registry.ElasticContainerRegistry;
import com.clouddeploy.registry.GoogleArtifactRegistry;
import com.clouddeploy.registry.ImageDistributor;
import com.clouddeploy.vault.VaultAuthConfig;
import com.clouddeploy.vault.VaultAuthMethod;
import com.clouddeploy.vault.VaultConfig;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentials;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;

public final class Main {
  private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

  static final Path DEFAULT_CONFIG_PATH = Path.of("samples", "cloud-deploy", "config.json");

  private static final Path TEMPLATE_CONFIG_PATH = Path.of("samples", "cloud-deploy", "config.example.json");

  private Main() {
  }

  public static void main(String[] args) {
    try {
      Path configPath = parseConfigPath(args);
      HarnessConfig config = loadConfig(configPath);
      EnvironmentLookup environment = EnvironmentLookup.system();

      System.out.println("Config: " + configPath.toAbsolutePath());
      System.out.println("Credentials source: " + config.credentials.source);
      System.out.println("Source image: " + config.image.source + " (tag " + config.image.tag + ")");

      CredentialManager credentialManager = CredentialManager.create(toCredentialManagerOptions(config, environment));
      Map<String, String> pushed = distribute(config, credentialManager);

      System.out.println("\nPushed images:");
      pushed.forEach((registry, imageUri) -> System.out.println("  " + registry + " -> " + imageUri));
      System.out.println("\nSUCCESS: image distributed to " + pushed.size() + " registries.");
    } catch (Exception ex) {
      Throwable cause = CloudDeployException.unwrap(ex);
      System.err.println("\nFAILED: " + cause.getMessage());
      if (cause instanceof ImageDistributionException) {
        ((ImageDistributionException) cause).completedPushes()
            .forEach((registry, imageUri) -> System.err.println("  already pushed: " + registry + " -> " + imageUri));
      }
      cause.printStackTrace(System.err);
      System.exit(1);
    }
  }

  static Path parseConfigPath(String[] args) {
    if (args == null || args.length == 0) {
      return DEFAULT_CONFIG_PATH;
    }

    if (args.length == 2 && "--config".equals(args[0])) {
      return Path.of(args[1]);
    }

    throw new IllegalArgumentException("Usage: Main [--config <path-to-config.json>]");
  }

  static HarnessConfig loadConfig(Path path) throws IOException {
    Objects.requireNonNull(path, "path");

    if (!Files.exists(path)) {
      String message = "Config file not found: " + path.toAbsolutePath()
          + System.lineSeparator()
          + "Create it by copying the template:"
          + System.lineSeparator()
          + "  cp " + TEMPLATE_CONFIG_PATH + " " + path
          + System.lineSeparator()
          + "Or run with: --config <path-to-config.json>";
      throw new IllegalStateException(message);
    }

    ObjectMapper mapper = new ObjectMapper();
    HarnessConfig config = mapper.readValue(Files.readString(path), HarnessConfig.class);
    config.validate();
    return config;
  }

  static CredentialManagerOptions toCredentialManagerOptions(HarnessConfig config, EnvironmentLookup environment) {
    CredentialsSection section = config.credentials;
    CredentialSource source = CredentialSource.fromName(section.source);

    Map<CloudProvider, String> secretIds = new EnumMap<>(CloudProvider.class);
    section.secretIds.forEach((provider, secretId) -> secretIds.put(CloudProvider.fromName(provider), secretId));

    VaultConfig vaultConfig = section.vault == null ? null : section.vault.toVaultConfig(environment);
    return new CredentialManagerOptions(source, secretIds, section.secretsRegion, vaultConfig, environment);
  }

  private static Map<String, String> distribute(HarnessConfig config, CredentialManager credentialManager)
      throws IOException {
    Map<CloudProvider, ProviderCredentials> resolved = new EnumMap<>(CloudProvider.class);
    List<AutoCloseable> resources = new ArrayList<>();

    try (DockerDaemonImageStore imageStore = new DockerDaemonImageStore()) {
      ImageDistributor distributor = new ImageDistributor(config.image.source, imageStore);

      for (RegistrySection section : config.registries) {
        CloudProvider provider = section.provider();
        ProviderCredentials credentials = resolved.get(provider);
        if (credentials == null) {
          LOGGER.info("Resolving {} credentials", provider.configName());
          credentials = credentialManager.getCredentials(provider).join();
          resolved.put(provider, credentials);
        }

        ContainerRegistry registry = createRegistry(section, credentials, config.image);
        if (registry instanceof AutoCloseable) {
          resources.add((AutoCloseable) registry);
        }
        System.out.println("Target: " + registry);
        distributor.addRegistry(registry);
      }

      return distributor.distribute().join();
    } finally {
      for (AutoCloseable resource : resources) {
        try {
          resource.close();
        } catch (Exception e) {
          LOGGER.warn("Failed to close {}", resource, e);
        }
      }
    }
  }

  static ContainerRegistry createRegistry(RegistrySection section, ProviderCredentials credentials, ImageSection image)
      throws IOException {
    switch (section.provider()) {
      case AWS -> {
        ProviderCredentials.Aws aws = credentials.aws();
        AwsCredentials awsCredentials = aws.sessionToken() == null || aws.sessionToken().isBlank()
            ? AwsBasicCredentials.create(aws.accessKeyId(), aws.secretAccessKey())
            : AwsSessionCredentials.create(aws.accessKeyId(), aws.secretAccessKey(), aws.sessionToken());
        return ElasticContainerRegistry.create(
            StaticCredentialsProvider.create(awsCredentials), section.region, section.repository, image.tag);
      }
      case AZURE -> {
        ProviderCredentials.Azure azure = credentials.azure();
        TokenCredential credential = new ClientSecretCredentialBuilder()
            .tenantId(azure.tenantId())
            .clientId(azure.clientId())
            .clientSecret(azure.clientSecret())
            .build();
        String subscriptionId = firstNonBlank(section.subscriptionId, azure.subscriptionId());
        return new AzureContainerRegistry(
            credential,
            azure.tenantId(),
            subscriptionId,
            section.resourceGroup,
            section.registryName,
            section.location,
            AzureContainerRegistry.imageNameOf(image.source),
            image.tag);
      }
      case GCP -> {
        ProviderCredentials.Gcp gcp = credentials.gcp();
        return GoogleArtifactRegistry.create(
            gcp.serviceAccountKey(),
            firstNonBlank(section.projectId, gcp.projectId()),
            section.region,
            section.repository,
            image.tag);
      }
      default -> throw new CloudDeployException(
          ErrorKind.UNSUPPORTED, "no container registry for provider " + section.type);
    }
  }

  private static String firstNonBlank(String preferred, String fallback) {
    return preferred != null && !preferred.isBlank() ? preferred : fallback;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  static final class HarnessConfig {
    public CredentialsSection credentials = new CredentialsSection();
    public ImageSection image;
    public List<RegistrySection> registries = new ArrayList<>();

    void validate() {
      if (image == null || image.source == null || image.source.isBlank()) {
        throw new CloudDeployException(ErrorKind.CONFIGURATION, "image.source is required");
      }
      if (image.tag == null || image.tag.isBlank()) {
        throw new CloudDeployException(ErrorKind.CONFIGURATION, "image.tag is required");
      }
      if (registries == null || registries.isEmpty()) {
        throw new CloudDeployException(ErrorKind.CONFIGURATION, "at least one registry is required");
      }
      registries.forEach(RegistrySection::provider);
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  static final class CredentialsSection {
    public String source = CredentialSource.ENVIRONMENT.configName();
    public String secretsRegion;
    public Map<String, String> secretIds = new LinkedHashMap<>();
    public VaultSection vault;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  static final class VaultSection {
    public String address;
    public String namespace;
    public String authMethod = VaultAuthMethod.TOKEN.configName();
    public String token;
    public String roleId;
    public String secretId;
    public String role;
    public String mount = VaultConfig.DEFAULT_MOUNT;
    public String application = VaultConfig.DEFAULT_APPLICATION;
    public long timeoutSeconds = VaultConfig.DEFAULT_REQUEST_TIMEOUT.getSeconds();

    VaultConfig toVaultConfig(EnvironmentLookup environment) {
      VaultAuthConfig auth = new VaultAuthConfig(
          VaultAuthMethod.fromName(authMethod),
          environment.expand(token),
          environment.expand(roleId),
          environment.expand(secretId),
          role);
      return new VaultConfig(
          environment.expand(address),
          auth,
          environment.expand(namespace),
          mount,
          application,
          Duration.ofSeconds(timeoutSeconds));
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  static final class ImageSection {
    public String source;
    public String tag;
  }

  /**
   * {@code type} is {@code ecr}, {@code acr} or {@code artifact-registry}.
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  static final class RegistrySection {
    public String type;
    public String region;
    public String repository;
    public String projectId;
    public String subscriptionId;
    public String resourceGroup;
    public String registryName;
    public String location;

    CloudProvider provider() {
      String normalized = type == null ? "" : type.trim().toLowerCase(Locale.ROOT);
      return switch (normalized) {
        case "ecr" -> CloudProvider.AWS;
        case "acr" -> CloudProvider.AZURE;
        case "artifact-registry", "gcr" -> CloudProvider.GCP;
        default -> throw new CloudDeployException(ErrorKind.CONFIGURATION, "unknown registry type: " + type);
      };
    }
  }
}
