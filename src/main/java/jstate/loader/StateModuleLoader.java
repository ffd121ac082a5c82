package jstate.loader;

import jstate.StateMachineCompiler;
import jstate.StateMachineDefinition;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Ties module lookup, compilation, and installation together.
 *
 * <p>The loader owns none of the three steps: it asks the provider for the
 * module source, the compiler for the transformed text, and hands the result
 * to the installer. Syntax errors in the module propagate unchanged and
 * nothing gets installed.
 */
public final class StateModuleLoader {

  private static final Logger logger = LogManager.getLogger(StateModuleLoader.class.getSimpleName());

  private final SourceProvider provider;
  private final StateMachineCompiler compiler;
  private final NamespaceInstaller installer;

  public StateModuleLoader(
    SourceProvider provider,
    StateMachineCompiler compiler,
    NamespaceInstaller installer
  ) {
    this.provider = provider;
    this.compiler = compiler;
    this.installer = installer;
  }

  /**
   * Compile a module and install it under a namespace.
   *
   * @param moduleName name of the module to load
   * @param namespace namespace into which the compiled module is installed
   * @return source of the module which was installed
   * @throws NoSuchFileException if the provider does not know the module
   */
  public StateModuleSource load(String moduleName, String namespace) throws IOException {
    final StateModuleSource source = findModule(moduleName);
    final String transformed = compiler.compile(source.sourceText());
    installer.install(namespace, source, transformed);
    logger.info("Loaded module " + moduleName + " from " + source.origin());
    return source;
  }

  /**
   * Build compiled definitions for every state machine in a module, without
   * installing anything.
   *
   * @param moduleName name of the module to load
   * @return definitions in source order
   * @throws NoSuchFileException if the provider does not know the module
   */
  public List<StateMachineDefinition> define(String moduleName) throws IOException {
    final StateModuleSource source = findModule(moduleName);
    final List<StateMachineDefinition> definitions = compiler.definitions(source.sourceText());
    logger.info("Defined " + definitions.size() + " state machines from module " + moduleName);
    return definitions;
  }

  private StateModuleSource findModule(String moduleName) throws IOException {
    return provider
      .find(moduleName)
      .orElseThrow(() -> new NoSuchFileException(moduleName, null, "No state machine module found"));
  }
}
