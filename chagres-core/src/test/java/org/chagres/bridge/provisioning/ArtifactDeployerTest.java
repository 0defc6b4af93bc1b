package org.chagres.bridge.provisioning;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ArtifactDeployerTest {

  @TempDir Path work;

  private static Path jar(Path path) throws IOException {
    Files.createDirectories(path.getParent());
    try (OutputStream file = Files.newOutputStream(path);
        JarOutputStream out = new JarOutputStream(file)) {
      out.putNextEntry(new JarEntry("marker.txt"));
      out.write(path.getFileName().toString().getBytes(StandardCharsets.UTF_8));
      out.closeEntry();
    }
    return path;
  }

  private ArtifactDeployer deployer(MavenSettings settings) {
    return new ArtifactDeployer(work.resolve("staging"), work.resolve("m2"), settings);
  }

  @Test
  void local_jar_is_copied_into_staging() throws Exception {
    Path source = jar(work.resolve("libs/tool.jar"));

    Path staged = deployer(MavenSettings.defaults()).deploy(new LocalJarArtifact(source));

    assertThat(staged).isEqualTo(work.resolve("staging/tool.jar"));
    assertThat(staged).hasSameBinaryContentAs(source);
  }

  @Test
  void redeploying_from_staging_is_a_no_op() throws Exception {
    ArtifactDeployer deployer = deployer(MavenSettings.defaults());
    Path staged = deployer.deploy(new LocalJarArtifact(jar(work.resolve("libs/tool.jar"))));

    assertThat(deployer.deploy(new LocalJarArtifact(staged))).isEqualTo(staged);
  }

  @Test
  void missing_local_jar_fails() {
    assertThatThrownBy(
            () ->
                deployer(MavenSettings.defaults())
                    .deploy(new LocalJarArtifact(work.resolve("nope.jar"))))
        .isInstanceOf(ArtifactDeploymentException.class)
        .hasMessageContaining("Jar not found");
  }

  @Test
  void local_repository_wins_over_remotes() throws Exception {
    MavenArtifact artifact = MavenArtifact.parse("org.example:lib:1.0");
    Path cached = jar(work.resolve("m2").resolve(artifact.repositoryPath()));
    MavenSettings unreachable =
        MavenSettings.of(new MavenArtifactRepo("offline", "http://127.0.0.1:9/maven2"));

    Path staged = deployer(unreachable).deploy(artifact);

    assertThat(staged).hasSameBinaryContentAs(cached);
  }

  @Test
  void remotes_are_tried_in_order() throws Exception {
    MavenArtifact artifact = MavenArtifact.parse("org.example:lib:1.0");
    Path second = work.resolve("second");
    Path published = jar(second.resolve(artifact.repositoryPath()));
    MavenSettings settings =
        MavenSettings.of(
            new MavenArtifactRepo("first", work.resolve("first").toUri().toString()),
            new MavenArtifactRepo("second", second.toUri().toString()));

    Path staged = deployer(settings).deploy(artifact);

    assertThat(staged).isEqualTo(work.resolve("staging/lib-1.0.jar"));
    assertThat(staged).hasSameBinaryContentAs(published);
    try (var leftovers = Files.list(work.resolve("staging"))) {
      assertThat(leftovers).allMatch(p -> p.toString().endsWith(".jar"));
    }
  }

  @Test
  void failure_lists_every_repository() {
    MavenSettings settings =
        MavenSettings.of(
            new MavenArtifactRepo("first", work.resolve("first").toUri().toString()),
            new MavenArtifactRepo("second", work.resolve("second").toUri().toString()));

    assertThatThrownBy(() -> deployer(settings).deploy(MavenArtifact.parse("org.example:x:1")))
        .isInstanceOf(ArtifactDeploymentException.class)
        .hasMessageContaining("first:")
        .hasMessageContaining("second:");
  }

  @Test
  void unknown_artifact_kind_is_rejected() {
    JavaArtifact custom = () -> "custom.jar";

    assertThatThrownBy(() -> deployer(MavenSettings.defaults()).deploy(custom))
        .isInstanceOf(ArtifactDeploymentException.class)
        .hasMessageContaining("Unsupported artifact type");
  }
}
