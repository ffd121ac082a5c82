package jstate.loader;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Installs compiled modules as Java source files in a generated sources root.
 *
 * <p>Module {@code Doors} installed into namespace {@code com.example} ends up
 * in {@code <root>/com/example/Doors.java}, ready to be picked up by the Java
 * compiler. An existing file is overwritten.
 */
public final class GeneratedSourceInstaller implements NamespaceInstaller {

  private static final Logger logger = LogManager.getLogger(GeneratedSourceInstaller.class.getSimpleName());

  private final Path outputRoot;

  public GeneratedSourceInstaller(Path outputRoot) {
    this.outputRoot = outputRoot;
  }

  /**
   * File into which a module is installed.
   *
   * @param namespace dotted package name (empty for the default package)
   * @param moduleName dotted module name (only the last segment is used)
   * @return target file
   */
  public Path targetFile(String namespace, String moduleName) {
    final Path directory = namespace.isEmpty()
      ? outputRoot
      : outputRoot.resolve(namespace.replace('.', '/'));
    final String simpleName = moduleName.substring(moduleName.lastIndexOf('.') + 1);
    return directory.resolve(simpleName + ".java");
  }

  @Override
  public void install(String namespace, StateModuleSource source, String transformedText) throws IOException {
    final Path target = targetFile(namespace, source.moduleName());
    Files.createDirectories(target.getParent());
    Files.writeString(target, transformedText, StandardCharsets.UTF_8);
    logger.info("Installed module " + source.moduleName() + " into " + target);
  }
}
