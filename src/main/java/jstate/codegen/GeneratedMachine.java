package jstate.codegen;

import java.util.Map;

/**
 * Class files generated for one state machine.
 *
 * <p>All names are binary names (eg. {@code jstate.generated.Door$Open}).
 *
 * @param baseClassName class extended by every state class
 * @param stateClassNames class of each state, keyed by state name
 * @param classFiles bytes of every generated class, keyed by class name
 */
public record GeneratedMachine(
  String baseClassName,
  Map<String, String> stateClassNames,
  Map<String, byte[]> classFiles
) {

  public GeneratedMachine {
    stateClassNames = Map.copyOf(stateClassNames);
    classFiles = Map.copyOf(classFiles);
  }

  /**
   * Define the generated classes in a fresh class loader.
   *
   * @param parent class loader from which {@code jstate.MachineState} is visible
   * @return class loader owning the generated classes
   */
  public MachineClassLoader defineClasses(ClassLoader parent) {
    return new MachineClassLoader(parent, classFiles);
  }
}
