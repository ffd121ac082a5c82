package jstate.loader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SuffixSourceProviderTest {

  @TempDir
  Path root;

  @Test
  void mapsModuleNamesToFiles() {
    final var provider = new SuffixSourceProvider(List.of(root));

    assertThat(provider.getSuffix()).isEqualTo(SuffixSourceProvider.DEFAULT_SUFFIX);
    assertThat(provider.relativePath("com.example.Doors")).isEqualTo("com/example/Doors.jstate");
    assertThat(new SuffixSourceProvider(List.of(root), "sm").relativePath("Doors")).isEqualTo("Doors.sm");
  }

  @Test
  void firstDirectoryOnSearchPathWins() throws IOException {
    final Path first = Files.createDirectories(root.resolve("first"));
    final Path second = Files.createDirectories(root.resolve("second"));
    Files.writeString(first.resolve("Doors.jstate"), "first");
    Files.writeString(second.resolve("Doors.jstate"), "second");

    final var provider = new SuffixSourceProvider(List.of(first, second));
    assertThat(provider.find("Doors")).hasValueSatisfying(source -> {
      assertThat(source.sourceText()).isEqualTo("first");
      assertThat(source.origin()).isEqualTo(first.resolve("Doors.jstate"));
    });
  }

  @Test
  void ignoresFilesWithOtherSuffix() throws IOException {
    Files.writeString(root.resolve("Doors.java"), "class Doors { }");

    assertThat(new SuffixSourceProvider(List.of(root)).find("Doors")).isEmpty();
  }

  @Test
  void rejectsEmptyNames() {
    assertThatThrownBy(() -> new SuffixSourceProvider(List.of(root), ""))
      .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new SuffixSourceProvider(List.of(root)).find(" "))
      .isInstanceOf(IllegalArgumentException.class);
  }
}
