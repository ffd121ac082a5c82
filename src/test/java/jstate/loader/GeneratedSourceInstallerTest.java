package jstate.loader;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GeneratedSourceInstallerTest {

  @TempDir
  Path root;

  @Test
  void placesModuleUnderNamespace() {
    final var installer = new GeneratedSourceInstaller(root);

    assertThat(installer.targetFile("com.example", "com.example.Doors")).isEqualTo(root.resolve("com/example/Doors.java"));
    assertThat(installer.targetFile("lights", "Blink")).isEqualTo(root.resolve("lights/Blink.java"));
    assertThat(installer.targetFile("", "Blink")).isEqualTo(root.resolve("Blink.java"));
  }

  @Test
  void overwritesPreviousInstall() throws IOException {
    final var installer = new GeneratedSourceInstaller(root);
    final var source = new StateModuleSource("Blink", "", null);

    installer.install("lights", source, "old");
    installer.install("lights", source, "new");

    assertThat(Files.readString(root.resolve("lights/Blink.java"))).isEqualTo("new");
  }
}
