package com.clouddeploy.registry;

import com.clouddeploy.CancellationScope;
import com.clouddeploy.CloudDeployException;
import com.clouddeploy.ErrorKind;
import com.google.api.gax.core.FixedCredentialsProvider;
import com.google.api.gax.rpc.AlreadyExistsException;
import com.google.api.gax.rpc.NotFoundException;
import com.google.auth.oauth2.AccessToken;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.tools.jib.api.Credential;
import com.google.devtools.artifactregistry.v1.ArtifactRegistryClient;
import com.google.devtools.artifactregistry.v1.ArtifactRegistrySettings;
import com.google.devtools.artifactregistry.v1.LocationName;
import com.google.devtools.artifactregistry.v1.Repository;
import com.google.devtools.artifactregistry.v1.RepositoryName;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Docker repository in Google Artifact Registry, {@code <region>-docker.pkg.dev/<project>/<repository>}.
 * <p>
 * Pushes authenticate with an OAuth2 access token of the configured credentials under the
 * {@value #OAUTH2_USERNAME} user name.
 */
public final class GoogleArtifactRegistry implements ContainerRegistry, AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(GoogleArtifactRegistry.class);

  static final String CLOUD_PLATFORM_SCOPE = "https://www.googleapis.com/auth/cloud-platform";
  static final String OAUTH2_USERNAME = "oauth2accesstoken";

  /**
   * The blocking Artifact Registry calls this class makes.
   */
  public interface RepositoryClient extends AutoCloseable {
    Repository getRepository(RepositoryName name);

    Repository createRepository(LocationName parent, String repositoryId, Repository repository)
        throws InterruptedException, ExecutionException;

    @Override
    default void close() {
    }

    static RepositoryClient of(ArtifactRegistryClient client) {
      Objects.requireNonNull(client, "client");
      return new RepositoryClient() {
        @Override
        public Repository getRepository(RepositoryName name) {
          return client.getRepository(name);
        }

        @Override
        public Repository createRepository(LocationName parent, String repositoryId, Repository repository)
            throws InterruptedException, ExecutionException {
          return client.createRepositoryAsync(parent, repository, repositoryId).get();
        }

        @Override
        public void close() {
          client.close();
        }
      };
    }
  }

  private final RepositoryClient repositories;
  private final GoogleCredentials credentials;
  private final Executor executor;
  private final String projectId;
  private final String region;
  private final String repositoryName;
  private final String imageTag;

  private volatile String registryUrl = "";
  private volatile String imageReference;

  public GoogleArtifactRegistry(
      RepositoryClient repositories,
      GoogleCredentials credentials,
      Executor executor,
      String projectId,
      String region,
      String repositoryName,
      String imageTag) {
    this.repositories = Objects.requireNonNull(repositories, "repositories");
    this.credentials = Objects.requireNonNull(credentials, "credentials");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.projectId = ElasticContainerRegistry.requireText(projectId, "projectId");
    this.region = ElasticContainerRegistry.requireText(region, "region");
    this.repositoryName = ElasticContainerRegistry.requireText(repositoryName, "repositoryName");
    this.imageTag = ElasticContainerRegistry.requireText(imageTag, "imageTag");
  }

  /**
   * Creates a registry client from a service account key, or from application default credentials
   * when {@code serviceAccountKeyJson} is blank.
   */
  public static GoogleArtifactRegistry create(
      String serviceAccountKeyJson,
      String projectId,
      String region,
      String repositoryName,
      String imageTag) throws IOException {
    GoogleCredentials base = serviceAccountKeyJson == null || serviceAccountKeyJson.isBlank()
        ? GoogleCredentials.getApplicationDefault()
        : GoogleCredentials.fromStream(new ByteArrayInputStream(serviceAccountKeyJson.getBytes(StandardCharsets.UTF_8)));
    GoogleCredentials scoped = base.createScoped(CLOUD_PLATFORM_SCOPE);

    ArtifactRegistrySettings settings = ArtifactRegistrySettings.newBuilder()
        .setCredentialsProvider(FixedCredentialsProvider.create(scoped))
        .build();
    ArtifactRegistryClient client = ArtifactRegistryClient.create(settings);

    return new GoogleArtifactRegistry(
        RepositoryClient.of(client), scoped, ForkJoinPool.commonPool(), projectId, region, repositoryName, imageTag);
  }

  static String registryUrl(String region, String projectId, String repositoryName) {
    return region + "-docker.pkg.dev/" + projectId + "/" + repositoryName;
  }

  @Override
  public String registryUrl() {
    return registryUrl;
  }

  @Override
  public CompletableFuture<Credential> authenticate() {
    RepositoryName name = RepositoryName.of(projectId, region, repositoryName);
    LocationName parent = LocationName.of(projectId, region);
    CompletableFuture<Credential> result = new CompletableFuture<>();
    CancellationScope scope = CancellationScope.of(result);

    scope.track(() -> RepositoryProvisioning.<Repository>ensureExists(
            "Artifact Registry repository " + name,
            () -> CompletableFuture.supplyAsync(() -> repositories.getRepository(name), executor),
            () -> CompletableFuture.supplyAsync(() -> createRepository(parent), executor),
            error -> error instanceof NotFoundException,
            error -> error instanceof AlreadyExistsException || RepositoryProvisioning.indicatesAlreadyExists(error),
            LOGGER))
        .thenApplyAsync(ignored -> {
          scope.ensureActive("requesting an OAuth2 token for " + name);
          String token = accessToken();
          String url = registryUrl(region, projectId, repositoryName);
          registryUrl = url;
          imageReference = url + "/" + repositoryName + ":" + imageTag;
          LOGGER.info("Authenticated to Artifact Registry {}", url);
          return Credential.from(OAUTH2_USERNAME, token);
        }, executor)
        .whenComplete((credential, error) -> {
          if (error != null) {
            result.completeExceptionally(CloudDeployException.unwrap(error));
          } else {
            result.complete(credential);
          }
        });
    return result;
  }

  private Repository createRepository(LocationName parent) {
    Repository repository = Repository.newBuilder()
        .setFormat(Repository.Format.DOCKER)
        .setDescription("Docker repository for " + repositoryName)
        .build();
    try {
      return repositories.createRepository(parent, repositoryName, repository);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CancellationException("creation of repository " + repositoryName + " was interrupted");
    } catch (ExecutionException e) {
      throw new CompletionException(e.getCause() != null ? e.getCause() : e);
    }
  }

  private String accessToken() {
    try {
      credentials.refreshIfExpired();
    } catch (IOException e) {
      throw new CloudDeployException(ErrorKind.AUTHENTICATION, "failed to get OAuth2 token", e);
    }

    AccessToken token = credentials.getAccessToken();
    if (token == null || token.getTokenValue() == null || token.getTokenValue().isBlank()) {
      throw new CloudDeployException(ErrorKind.AUTHENTICATION, "failed to get OAuth2 token");
    }
    return token.getTokenValue();
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
  public void close() {
    repositories.close();
  }

  @Override
  public String toString() {
    return "Artifact Registry repository " + projectId + "/" + region + "/" + repositoryName;
  }
}
