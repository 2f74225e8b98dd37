package com.clouddeploy.registry;

import com.clouddeploy.CancellationScope;
import com.clouddeploy.CloudDeployException;
import com.clouddeploy.ErrorKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.cloud.tools.jib.api.Containerizer;
import com.google.cloud.tools.jib.api.Credential;
import com.google.cloud.tools.jib.api.DockerClient;
import com.google.cloud.tools.jib.api.ImageReference;
import com.google.cloud.tools.jib.api.InvalidImageReferenceException;
import com.google.cloud.tools.jib.api.Jib;
import com.google.cloud.tools.jib.api.JibContainer;
import com.google.cloud.tools.jib.api.JibContainerBuilder;
import com.google.cloud.tools.jib.api.RegistryImage;
import com.google.cloud.tools.jib.api.RegistryUnauthorizedException;
import com.google.cloud.tools.jib.api.TarImage;
import com.google.cloud.tools.jib.docker.CliDockerClient;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;
import java.util.stream.Stream;
import org.apache.commons.compress.archivers.ArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Images from the local Docker daemon, pushed with Jib.
 * <p>
 * {@link #load} checks that the daemon has the image and exports it once ({@code docker save}) into a
 * work directory. Every push of that image is built from the export with the source's creation time,
 * and all pushes share one layer cache. Work directories are deleted on {@link #close()}.
 */
public final class DockerDaemonImageStore implements LocalImageStore, AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(DockerDaemonImageStore.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  static final String TOOL_NAME = "cloud-deploy";
  static final String EXPORT_FILE = "image.tar";

  private final DockerClient dockerClient;
  private final ExecutorService executor;
  private final Path layersCache;
  private final List<Path> workDirectories = new ArrayList<>();

  public DockerDaemonImageStore() {
    this(
        new CliDockerClient(CliDockerClient.DEFAULT_DOCKER_CLIENT, Collections.emptyMap()),
        Executors.newSingleThreadExecutor(runnable -> {
          Thread thread = new Thread(runnable, "cloud-deploy-image");
          thread.setDaemon(true);
          return thread;
        }),
        null);
  }

  /**
   * @param layersCache cache directory for the image layers; inside the work directory of each loaded image when null
   */
  public DockerDaemonImageStore(DockerClient dockerClient, ExecutorService executor, Path layersCache) {
    this.dockerClient = Objects.requireNonNull(dockerClient, "dockerClient");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.layersCache = layersCache;
  }

  /**
   * Fails with {@link ErrorKind#NOT_FOUND} when the daemon has no such image and with
   * {@link ErrorKind#BACKEND} when the daemon cannot be reached or the export is unreadable.
   */
  @Override
  public CompletableFuture<SourceImage> load(String imageReference) {
    ImageReference source;
    try {
      source = ImageReference.parse(Objects.requireNonNull(imageReference, "imageReference"));
    } catch (InvalidImageReferenceException e) {
      return CompletableFuture.failedFuture(
          new CloudDeployException(ErrorKind.CONFIGURATION, "invalid source image reference " + imageReference, e));
    }

    return submit(
        () -> export(source),
        e -> new CloudDeployException(ErrorKind.BACKEND, "failed to export " + source + " from the Docker daemon", e));
  }

  private SourceImage export(ImageReference source) throws IOException, InterruptedException {
    try {
      dockerClient.inspect(source);
    } catch (IOException e) {
      if (indicatesMissingImage(e)) {
        throw new CloudDeployException(ErrorKind.NOT_FOUND, "image " + source + " not found in the local Docker daemon", e);
      }
      throw e;
    }

    Path workDirectory = Files.createTempDirectory("cloud-deploy-image");
    synchronized (workDirectories) {
      workDirectories.add(workDirectory);
    }

    Path tarball = workDirectory.resolve(EXPORT_FILE);
    LOGGER.info("Exporting {} from the Docker daemon to {}", source, tarball);
    dockerClient.save(source, tarball, written -> {
    });

    Instant created = readCreationTime(tarball);
    Path cache = layersCache != null ? layersCache : workDirectory.resolve("layers");
    JibContainerBuilder builder = Jib.from(TarImage.at(tarball)).setCreationTime(created);
    LOGGER.info("Loaded {} (created {})", source, created);
    return new DaemonImage(source, tarball, builder, cache);
  }

  static boolean indicatesMissingImage(IOException error) {
    String message = error.getMessage();
    return message != null && message.toLowerCase(Locale.ROOT).contains("no such");
  }

  /**
   * Creation time recorded in the image config of a {@code docker save} tarball.
   */
  static Instant readCreationTime(Path tarball) throws IOException {
    JsonNode manifest = MAPPER.readTree(readEntry(tarball, "manifest.json"));
    String configName = manifest.path(0).path("Config").asText("");
    if (configName.isEmpty()) {
      throw new IOException("image export " + tarball + " has no config in manifest.json");
    }

    JsonNode created = MAPPER.readTree(readEntry(tarball, configName)).path("created");
    if (!created.isTextual()) {
      LOGGER.warn("Image config {} has no creation time; using the epoch", configName);
      return Instant.EPOCH;
    }
    try {
      return OffsetDateTime.parse(created.asText()).toInstant();
    } catch (DateTimeParseException e) {
      throw new IOException("image config " + configName + " has an invalid creation time " + created.asText(), e);
    }
  }

  private static byte[] readEntry(Path tarball, String name) throws IOException {
    try (InputStream in = new BufferedInputStream(Files.newInputStream(tarball));
         TarArchiveInputStream tar = new TarArchiveInputStream(in)) {
      ArchiveEntry entry;
      while ((entry = tar.getNextEntry()) != null) {
        if (!entry.isDirectory() && stripDotSlash(entry.getName()).equals(name)) {
          return tar.readAllBytes();
        }
      }
    }
    throw new IOException("image export " + tarball + " has no entry " + name);
  }

  private static String stripDotSlash(String name) {
    return name.startsWith("./") ? name.substring(2) : name;
  }

  /**
   * Stops pending work and deletes the work directories of every loaded image.
   */
  @Override
  public void close() {
    executor.shutdownNow();

    List<Path> directories;
    synchronized (workDirectories) {
      directories = List.copyOf(workDirectories);
      workDirectories.clear();
    }
    directories.forEach(DockerDaemonImageStore::deleteRecursively);
  }

  private static void deleteRecursively(Path directory) {
    try (Stream<Path> paths = Files.walk(directory)) {
      paths.sorted(Comparator.reverseOrder()).forEach(path -> {
        try {
          Files.deleteIfExists(path);
        } catch (IOException e) {
          throw new UncheckedIOException(e);
        }
      });
    } catch (IOException | UncheckedIOException e) {
      LOGGER.warn("Failed to delete image work directory {}", directory, e);
    }
  }

  private interface BlockingCall<T> {
    T call() throws Exception;
  }

  private <T> CompletableFuture<T> submit(BlockingCall<T> call, Function<Exception, RuntimeException> failure) {
    CompletableFuture<T> result = new CompletableFuture<>();
    Future<?> task;
    try {
      task = executor.submit(() -> {
        try {
          result.complete(call.call());
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          result.completeExceptionally(new CancellationException("image operation was interrupted"));
        } catch (CloudDeployException e) {
          result.completeExceptionally(e);
        } catch (Exception e) {
          result.completeExceptionally(failure.apply(e));
        }
      });
    } catch (RejectedExecutionException e) {
      return CompletableFuture.failedFuture(new IllegalStateException("image store is closed", e));
    }
    return CancellationScope.forwardCancellation(result, task);
  }

  final class DaemonImage implements SourceImage {
    private final ImageReference source;
    private final Path tarball;
    private final JibContainerBuilder builder;
    private final Path cache;

    DaemonImage(ImageReference source, Path tarball, JibContainerBuilder builder, Path cache) {
      this.source = source;
      this.tarball = tarball;
      this.builder = builder;
      this.cache = cache;
    }

    @Override
    public String reference() {
      return source.toString();
    }

    Path tarball() {
      return tarball;
    }

    JibContainerBuilder builder() {
      return builder;
    }

    @Override
    public CompletableFuture<String> pushTo(ImageReference target, Credential credential) {
      return submit(() -> {
        try {
          Containerizer containerizer = Containerizer
              .to(RegistryImage.named(target).addCredential(credential.getUsername(), credential.getPassword()))
              .setBaseImageLayersCache(cache)
              .setToolName(TOOL_NAME);
          JibContainer container = builder.containerize(containerizer);
          return container.getDigest().toString();
        } catch (RegistryUnauthorizedException e) {
          throw new CloudDeployException(ErrorKind.AUTHENTICATION, "registry rejected credentials for " + target, e);
        }
      }, e -> new CloudDeployException(ErrorKind.TRANSIENT_NETWORK, "failed to push " + source + " to " + target, e));
    }
  }
}
