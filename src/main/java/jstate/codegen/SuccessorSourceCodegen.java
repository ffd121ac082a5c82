package jstate.codegen;

import jstate.MachineState;
import jstate.graph.SuccessorGraph;

/**
 * Generates Java source for a machine with unnamed transitions.
 *
 * <p>The machine becomes an abstract class extending {@link MachineState},
 * with one nested subclass per state. States with a successor override
 * {@code nextState()} to construct a fresh instance of the successor; terminal
 * states inherit the default, which throws.
 */
public final class SuccessorSourceCodegen extends SourceHelpers {

  private static final String MACHINE_STATE = MachineState.class.getName();

  private final SuccessorGraph graph;

  private SuccessorSourceCodegen(SuccessorGraph graph, SourceLayout layout) {
    super(layout);
    this.graph = graph;
  }

  /**
   * Generate the source for a machine.
   *
   * @param graph graph of the machine
   * @param layout placement of the block being replaced
   * @return Java source (with no trailing line separator)
   */
  public static String generate(SuccessorGraph graph, SourceLayout layout) {
    final var codegen = new SuccessorSourceCodegen(graph, layout);
    codegen.generateMachine();
    return codegen.render();
  }

  private void generateMachine() {
    final String machine = graph.name;

    open(outerClass("abstract class " + machine + " extends " + MACHINE_STATE));
    returningMethod(OVERRIDE, "public final " + STRING + " machineName()", literal(machine));

    for (String state : graph.states) {
      blankLine();
      open("static final class " + state + " extends " + machine);
      returningMethod(OVERRIDE, "public " + STRING + " stateName()", literal(state));
      blankLine();
      returningMethod(OVERRIDE, "public boolean isTerminal()", Boolean.toString(graph.isTerminal(state)));

      final var successor = graph.successor(state);
      if (successor.isPresent()) {
        blankLine();
        returningMethod(OVERRIDE, "public " + machine + " nextState()", "new " + successor.get() + "()");
      }
      close();
    }

    close();
  }
}
