package jstate.loader;

import java.io.IOException;

/**
 * Makes compiled state machine modules available under a namespace.
 */
@FunctionalInterface
public interface NamespaceInstaller {

  /**
   * Install a compiled module. Once this returns, the module is available.
   *
   * @param namespace target namespace (eg. a Java package name)
   * @param source module which was compiled
   * @param transformedText module text with every block replaced by generated code
   */
  public void install(String namespace, StateModuleSource source, String transformedText) throws IOException;
}
