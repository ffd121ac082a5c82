package jstate.loader;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Finds modules as files with a fixed suffix on a search path.
 *
 * <p>Module {@code com.example.Doors} is looked up as
 * {@code com/example/Doors.<suffix>} under each directory of the search path,
 * in order. The first match wins.
 */
public final class SuffixSourceProvider implements SourceProvider {

  private static final Logger logger = LogManager.getLogger(SuffixSourceProvider.class.getSimpleName());

  public static final String DEFAULT_SUFFIX = "jstate";

  private final List<Path> searchPath;
  private final String suffix;

  /**
   * @param searchPath directories to search, in order
   * @param suffix file extension of modules (without the dot)
   */
  public SuffixSourceProvider(List<Path> searchPath, String suffix) {
    if (suffix == null || suffix.isEmpty()) {
      throw new IllegalArgumentException("Module suffix cannot be empty");
    }
    this.searchPath = List.copyOf(searchPath);
    this.suffix = suffix;
  }

  public SuffixSourceProvider(List<Path> searchPath) {
    this(searchPath, DEFAULT_SUFFIX);
  }

  public String getSuffix() {
    return suffix;
  }

  /**
   * Path of a module relative to a search path directory.
   *
   * @param moduleName dotted module name
   * @return relative file path
   */
  public String relativePath(String moduleName) {
    return moduleName.replace('.', '/') + "." + suffix;
  }

  @Override
  public Optional<StateModuleSource> find(String moduleName) throws IOException {
    if (moduleName == null || moduleName.isBlank()) {
      throw new IllegalArgumentException("Module name cannot be empty");
    }

    final String relative = relativePath(moduleName);
    for (Path directory : searchPath) {
      final Path candidate = directory.resolve(relative);
      if (Files.isRegularFile(candidate)) {
        if (logger.isDebugEnabled()) {
          logger.debug("Found module " + moduleName + " at " + candidate);
        }
        final String text = Files.readString(candidate, StandardCharsets.UTF_8);
        return Optional.of(new StateModuleSource(moduleName, text, candidate));
      }
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return "SuffixSourceProvider [suffix=" + suffix + ", searchPath=" + searchPath + "]";
  }
}
