package jstate.loader;

import java.io.IOException;
import java.util.Optional;

/**
 * Locates the source of state machine modules.
 */
@FunctionalInterface
public interface SourceProvider {

  /**
   * Find and read a module.
   *
   * @param moduleName name of the module
   * @return the module source, or empty if there is no such module
   */
  public Optional<StateModuleSource> find(String moduleName) throws IOException;
}
