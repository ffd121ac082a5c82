package jstate.loader;

import java.nio.file.Path;

/**
 * Source text of a state machine module, along with where it came from.
 *
 * @param moduleName name of the module (eg. {@code com.example.Doors})
 * @param sourceText contents of the module
 * @param origin file from which the module was read
 */
public record StateModuleSource(String moduleName, String sourceText, Path origin) { }
