package jstate.codegen;

import jstate.MachineState;
import jstate.Transition;
import jstate.graph.TransitionGraph;
import java.util.Map;

/**
 * Generates Java source for a machine with named transitions.
 *
 * <p>The output has two top-level classes:
 *
 * <ul>
 *   <li>{@code <Machine>Transition}, holding one singleton per transition name
 *   <li>{@code <Machine>}, an abstract subclass of {@link MachineState} with
 *       one nested subclass per state
 * </ul>
 *
 * <p>Each state class gets a table from transition name to successor
 * constructor, a {@code transition(String)} override that looks up the table
 * (failing with {@code InvalidTransitionException} on a miss), and one method
 * per supported transition. Transitions named like a method every state
 * already has ({@code wait}, {@code toString}, {@code nextState}, ...) get no
 * method of their own and are only reachable through {@code transition}.
 */
public final class TransitionSourceCodegen extends SourceHelpers {

  private static final String MACHINE_STATE = MachineState.class.getName();
  private static final String TRANSITION = Transition.class.getName();
  private static final String MAP = "java.util.Map";
  private static final String LINKED_HASH_MAP = "java.util.LinkedHashMap";
  private static final String SUPPLIER = "java.util.function.Supplier";
  private static final String SET = "java.util.Set";
  private static final String COLLECTIONS = "java.util.Collections";

  private final TransitionGraph graph;

  private TransitionSourceCodegen(TransitionGraph graph, SourceLayout layout) {
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
  public static String generate(TransitionGraph graph, SourceLayout layout) {
    final var codegen = new TransitionSourceCodegen(graph, layout);
    codegen.generateTransitionClass();
    codegen.blankLine();
    codegen.generateMachine();
    return codegen.render();
  }

  /**
   * Name of the class holding the transition values of a machine.
   *
   * @param machine name of the machine
   * @return class name
   */
  public static String transitionClassName(String machine) {
    return machine + "Transition";
  }

  private void generateTransitionClass() {
    final String transitionClass = transitionClassName(graph.name);

    open(outerClass("final class " + transitionClass + " extends " + TRANSITION));
    for (String transition : graph.transitionNames) {
      line(
        "static final " + transitionClass + " " + transition
          + " = new " + transitionClass + "(" + literal(transition) + ");"
      );
    }
    blankLine();
    open("private " + transitionClass + "(" + STRING + " name)");
    line("super(name);");
    close();
    close();
  }

  private void generateMachine() {
    final String machine = graph.name;
    final String supplier = SUPPLIER + "<" + machine + ">";

    open(outerClass("abstract class " + machine + " extends " + MACHINE_STATE));
    returningMethod(OVERRIDE, "public final " + STRING + " machineName()", literal(machine));

    for (String state : graph.states) {
      final Map<String, String> transitions = graph.transitionsFrom(state);

      blankLine();
      open("static final class " + state + " extends " + machine);

      // Transition table
      line("private static final " + MAP + "<" + STRING + ", " + supplier + "> TRANSITIONS =");
      line("    new " + LINKED_HASH_MAP + "<>();");
      if (!transitions.isEmpty()) {
        blankLine();
        open("static");
        for (Map.Entry<String, String> entry : transitions.entrySet()) {
          line("TRANSITIONS.put(" + literal(entry.getKey()) + ", " + entry.getValue() + "::new);");
        }
        close();
      }

      blankLine();
      returningMethod(OVERRIDE, "public " + STRING + " stateName()", literal(state));
      blankLine();
      returningMethod(OVERRIDE, "public boolean isTerminal()", "TRANSITIONS.isEmpty()");
      blankLine();
      returningMethod(
        OVERRIDE,
        "public " + SET + "<" + STRING + "> transitionNames()",
        COLLECTIONS + ".unmodifiableSet(TRANSITIONS.keySet())"
      );

      // Name-dispatched transition, falling back to the failure in `MachineState`
      blankLine();
      line(OVERRIDE);
      open("public " + machine + " transition(" + STRING + " name)");
      line("final " + supplier + " next = TRANSITIONS.get(name);");
      open("if (next == null)");
      line("return (" + machine + ") super.transition(name);");
      close();
      line("return next.get();");
      close();

      // One binding per supported transition
      for (Map.Entry<String, String> entry : transitions.entrySet()) {
        if (!Method.hasTransitionBinding(entry.getKey())) {
          continue;
        }
        blankLine();
        returningMethod(null, "public " + machine + " " + entry.getKey() + "()", "new " + entry.getValue() + "()");
      }

      close();
    }

    close();
  }
}
