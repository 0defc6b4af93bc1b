package org.chagres.bridge.provisioning;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Copies artifacts into a staging directory, from which a runtime adds them to its classpath.
 *
 * <p>Maven artifacts are taken from the local Maven repository when present there, otherwise
 * downloaded from each configured remote repository in turn until one succeeds. Local jars are
 * copied as they are.
 */
public final class ArtifactDeployer {
  private static final Logger LOG = Logger.getLogger(ArtifactDeployer.class.getName());

  private final Path stagingDirectory;
  private final Path localRepository;
  private final MavenSettings settings;

  public ArtifactDeployer(Path stagingDirectory, Path localRepository, MavenSettings settings) {
    this.stagingDirectory = stagingDirectory;
    this.localRepository = localRepository;
    this.settings = settings;
  }

  public Path stagingDirectory() {
    return stagingDirectory;
  }

  /**
   * Stage {@code artifact}.
   *
   * @return the staged jar
   * @throws ArtifactDeploymentException if the artifact kind is unknown, the file is missing or
   *     every download failed
   */
  public Path deploy(JavaArtifact artifact) throws ArtifactDeploymentException {
    if (artifact instanceof LocalJarArtifact local) {
      return deployLocal(local);
    }
    if (artifact instanceof MavenArtifact maven) {
      return deployMaven(maven);
    }
    String type = artifact == null ? "null" : artifact.getClass().getName();
    throw new ArtifactDeploymentException("Unsupported artifact type: " + type);
  }

  private Path deployLocal(LocalJarArtifact artifact) throws ArtifactDeploymentException {
    Path source = artifact.path();
    if (!Files.isRegularFile(source)) {
      throw new ArtifactDeploymentException("Jar not found: " + source.toAbsolutePath());
    }
    return stage(source, artifact.fileName());
  }

  private Path deployMaven(MavenArtifact artifact) throws ArtifactDeploymentException {
    Path local = localRepository.resolve(artifact.repositoryPath());
    if (Files.isRegularFile(local)) {
      LOG.fine("Found " + artifact + " in local repository " + localRepository);
      return stage(local, artifact.fileName());
    }

    List<String> failures = new ArrayList<>();
    for (MavenArtifactRepo repo : settings.repositories()) {
      String url = repo.urlOf(artifact);
      try {
        Path staged = download(url, artifact.fileName());
        LOG.info("Downloaded " + artifact + " from " + repo.id());
        return staged;
      } catch (IOException | URISyntaxException | IllegalArgumentException e) {
        LOG.fine("Could not fetch " + url + ": " + e);
        failures.add(repo.id() + ": " + e.getMessage());
      }
    }
    throw new ArtifactDeploymentException(
        "Could not resolve "
            + artifact
            + " (local repository "
            + localRepository
            + ", remote "
            + failures
            + ")");
  }

  private Path download(String url, String fileName) throws IOException, URISyntaxException {
    ensureStagingDirectory();
    Path target = stagingDirectory.resolve(fileName);
    Path partial = Files.createTempFile(stagingDirectory, fileName, ".part");
    try (InputStream in = new URI(url).toURL().openStream()) {
      Files.copy(in, partial, StandardCopyOption.REPLACE_EXISTING);
      return Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
    } finally {
      Files.deleteIfExists(partial);
    }
  }

  private Path stage(Path source, String fileName) throws ArtifactDeploymentException {
    try {
      ensureStagingDirectory();
      Path target = stagingDirectory.resolve(fileName);
      if (Files.exists(target) && Files.isSameFile(source, target)) {
        return target;
      }
      return Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      throw new ArtifactDeploymentException(
          "Could not stage " + source + " into " + stagingDirectory, e);
    }
  }

  private void ensureStagingDirectory() throws IOException {
    Files.createDirectories(stagingDirectory);
  }
}
