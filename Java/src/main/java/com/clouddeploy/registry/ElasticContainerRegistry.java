package com.clouddeploy.registry;

import com.clouddeploy.CancellationScope;
import com.clouddeploy.CloudDeployException;
import com.clouddeploy.ErrorKind;
import com.google.cloud.tools.jib.api.Credential;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ecr.EcrAsyncClient;
import software.amazon.awssdk.services.ecr.model.AuthorizationData;
import software.amazon.awssdk.services.ecr.model.CreateRepositoryRequest;
import software.amazon.awssdk.services.ecr.model.DescribeRepositoriesRequest;
import software.amazon.awssdk.services.ecr.model.GetAuthorizationTokenRequest;
import software.amazon.awssdk.services.ecr.model.Repository;
import software.amazon.awssdk.services.ecr.model.RepositoryAlreadyExistsException;
import software.amazon.awssdk.services.ecr.model.RepositoryNotFoundException;
import software.amazon.awssdk.services.sts.StsAsyncClient;
import software.amazon.awssdk.services.sts.model.GetCallerIdentityRequest;

/**
 * Amazon ECR repository {@code <account>.dkr.ecr.<region>.amazonaws.com/<repository>}.
 * <p>
 * The account id is looked up through STS on {@link #authenticate()}; the repository is created when
 * it does not exist yet.
 */
public final class ElasticContainerRegistry implements ContainerRegistry, AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(ElasticContainerRegistry.class);

  private final StsAsyncClient stsClient;
  private final EcrAsyncClient ecrClient;
  private final String region;
  private final String repositoryName;
  private final String imageTag;

  private volatile String registryUrl = "";
  private volatile String imageReference;

  public ElasticContainerRegistry(
      StsAsyncClient stsClient,
      EcrAsyncClient ecrClient,
      String region,
      String repositoryName,
      String imageTag) {
    this.stsClient = Objects.requireNonNull(stsClient, "stsClient");
    this.ecrClient = Objects.requireNonNull(ecrClient, "ecrClient");
    this.region = requireText(region, "region");
    this.repositoryName = requireText(repositoryName, "repositoryName");
    this.imageTag = requireText(imageTag, "imageTag");
  }

  public static ElasticContainerRegistry create(
      AwsCredentialsProvider credentialsProvider,
      String region,
      String repositoryName,
      String imageTag) {
    Objects.requireNonNull(credentialsProvider, "credentialsProvider");
    Region awsRegion = Region.of(requireText(region, "region"));

    StsAsyncClient sts = StsAsyncClient.builder()
        .region(awsRegion)
        .credentialsProvider(credentialsProvider)
        .build();
    EcrAsyncClient ecr = EcrAsyncClient.builder()
        .region(awsRegion)
        .credentialsProvider(credentialsProvider)
        .build();
    return new ElasticContainerRegistry(sts, ecr, region, repositoryName, imageTag);
  }

  static String registryUrl(String accountId, String region) {
    return accountId + ".dkr.ecr." + region + ".amazonaws.com";
  }

  @Override
  public String registryUrl() {
    return registryUrl;
  }

  @Override
  public CompletableFuture<Credential> authenticate() {
    CompletableFuture<Credential> result = new CompletableFuture<>();
    CancellationScope scope = CancellationScope.of(result);

    scope.track(() -> stsClient.getCallerIdentity(GetCallerIdentityRequest.builder().build()))
        .handle((identity, error) -> {
          if (error != null) {
            throw CloudDeployException.wrap("failed to get AWS account ID", error, ErrorKind.AUTHENTICATION);
          }
          if (identity.account() == null || identity.account().isBlank()) {
            throw new CloudDeployException(ErrorKind.AUTHENTICATION, "STS returned no AWS account ID");
          }
          return identity.account();
        })
        .thenCompose(accountId -> {
          registryUrl = registryUrl(accountId, region);
          return scope.track(this::ensureRepository);
        })
        .thenCompose(ignored -> scope.track(
                () -> ecrClient.getAuthorizationToken(GetAuthorizationTokenRequest.builder().build()))
            .handle((response, error) -> {
              if (error != null) {
                throw CloudDeployException.wrap("failed to get ECR authorization token", error, ErrorKind.AUTHENTICATION);
              }
              Credential credential = decodeAuthorizationToken(response.authorizationData());
              imageReference = registryUrl + "/" + repositoryName + ":" + imageTag;
              LOGGER.info("Authenticated to ECR registry {}", registryUrl);
              return credential;
            }))
        .whenComplete((credential, error) -> {
          if (error != null) {
            result.completeExceptionally(CloudDeployException.unwrap(error));
          } else {
            result.complete(credential);
          }
        });
    return result;
  }

  private CompletableFuture<Repository> ensureRepository() {
    return RepositoryProvisioning.ensureExists(
        "ECR repository " + repositoryName,
        () -> ecrClient.describeRepositories(DescribeRepositoriesRequest.builder()
                .repositoryNames(repositoryName)
                .build())
            .thenApply(response -> {
              if (!response.hasRepositories() || response.repositories().isEmpty()) {
                throw new CloudDeployException(ErrorKind.NOT_FOUND, "ECR repository " + repositoryName + " not found");
              }
              return response.repositories().get(0);
            }),
        () -> ecrClient.createRepository(CreateRepositoryRequest.builder()
                .repositoryName(repositoryName)
                .build())
            .thenApply(response -> response.repository()),
        error -> error instanceof RepositoryNotFoundException || CloudDeployException.isKind(error, ErrorKind.NOT_FOUND),
        error -> error instanceof RepositoryAlreadyExistsException || RepositoryProvisioning.indicatesAlreadyExists(error),
        LOGGER);
  }

  /**
   * Decodes the first ECR authorization token, base64 of {@code AWS:<password>}.
   */
  static Credential decodeAuthorizationToken(List<AuthorizationData> authorizationData) {
    if (authorizationData == null || authorizationData.isEmpty()) {
      throw new CloudDeployException(ErrorKind.AUTHENTICATION, "no authorization data returned from ECR");
    }

    String token = authorizationData.get(0).authorizationToken();
    if (token == null || token.isBlank()) {
      throw new CloudDeployException(ErrorKind.AUTHENTICATION, "ECR returned an empty authorization token");
    }

    String decoded;
    try {
      decoded = new String(Base64.getDecoder().decode(token), StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      throw new CloudDeployException(ErrorKind.AUTHENTICATION, "failed to decode ECR authorization token", e);
    }

    int separator = decoded.indexOf(':');
    if (separator <= 0) {
      throw new CloudDeployException(ErrorKind.AUTHENTICATION, "invalid ECR authorization token format");
    }
    return Credential.from(decoded.substring(0, separator), decoded.substring(separator + 1));
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
    ecrClient.close();
    stsClient.close();
  }

  @Override
  public String toString() {
    return "ECR repository " + repositoryName + " (" + region + ")";
  }

  static String requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new CloudDeployException(ErrorKind.CONFIGURATION, name + " is required");
    }
    return value.trim();
  }
}
