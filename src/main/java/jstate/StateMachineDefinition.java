package jstate;

import jstate.codegen.GeneratedMachine;
import jstate.codegen.MachineClassCodegen;
import jstate.codegen.MachineClassLoader;
import jstate.graph.StateGraph;
import jstate.graph.SuccessorGraph;
import jstate.graph.TransitionGraph;
import jstate.parser.Dialect;
import jstate.parser.StateMachineParser;
import jstate.parser.StateMachineSyntaxException;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Executable definition of a state machine.
 *
 * <p>A definition is built from a single {@code statemachine} block and hands
 * out instances of the machine's states, which can then be driven with
 * {@link MachineState#nextState()} or {@link MachineState#transition(String)}.
 *
 * <p>Like the generated Java source, there are two flavours: compiled
 * definitions generate real classes for the machine and its states, while
 * interpreted definitions walk the state graph directly.
 */
abstract public class StateMachineDefinition {

  private final StateGraph graph;

  // Transition values, one per name (empty for unnamed transitions)
  private final Map<String, Transition> transitions;

  protected StateMachineDefinition(StateGraph graph) {
    this.graph = graph;

    final var transitions = new LinkedHashMap<String, Transition>();
    if (graph instanceof TransitionGraph transitionGraph) {
      for (String name : transitionGraph.transitionNames) {
        transitions.put(name, new Transition(name));
      }
    }
    this.transitions = Collections.unmodifiableMap(transitions);
  }

  /**
   * Compiles a single state machine block into freshly generated classes.
   *
   * @param source source of exactly one {@code statemachine} block
   * @return compiled definition
   */
  public static StateMachineDefinition compile(String source) throws StateMachineSyntaxException {
    return new CompiledStateMachineDefinition(StateGraph.fromBlock(StateMachineParser.parseSingle(source)));
  }

  /**
   * Compiles a single state machine block into an interpreted definition.
   *
   * <p>This functions like {@link #compile(String source)}, but no bytecode is
   * generated.
   *
   * @param source source of exactly one {@code statemachine} block
   * @return interpreted definition
   */
  public static StateMachineDefinition interpreted(String source) throws StateMachineSyntaxException {
    return new InterpretedStateMachineDefinition(StateGraph.fromBlock(StateMachineParser.parseSingle(source)));
  }

  /**
   * Build a definition out of an existing graph.
   *
   * @param graph graph of the machine
   * @param compiled generate classes (as opposed to interpreting the graph)
   * @return definition
   */
  public static StateMachineDefinition fromGraph(StateGraph graph, boolean compiled) {
    return compiled
      ? new CompiledStateMachineDefinition(graph)
      : new InterpretedStateMachineDefinition(graph);
  }

  /**
   * Name of the machine.
   */
  public String name() {
    return graph.name();
  }

  /**
   * Dialect in which the machine was written.
   */
  public Dialect dialect() {
    return graph.dialect();
  }

  /**
   * Graph from which the definition was built.
   */
  public StateGraph graph() {
    return graph;
  }

  /**
   * Names of all states in the machine.
   */
  public Set<String> stateNames() {
    return graph.states();
  }

  /**
   * Transition values of the machine, one per transition name.
   */
  public Collection<Transition> transitions() {
    return transitions.values();
  }

  /**
   * Look up a transition value by name.
   *
   * @param name name of the transition
   * @return the transition value, or empty if no state uses that name
   */
  public Optional<Transition> transition(String name) {
    return Optional.ofNullable(transitions.get(name));
  }

  /**
   * Construct a fresh instance of a state.
   *
   * @param stateName name of the state
   * @return new state instance
   * @throws IllegalArgumentException if the machine has no such state
   */
  public final MachineState newState(String stateName) {
    if (!graph.states().contains(stateName)) {
      throw new IllegalArgumentException("State machine " + name() + " has no state " + stateName);
    }
    return instantiate(stateName);
  }

  /**
   * Construct a fresh instance of a state known to be in the graph.
   */
  protected abstract MachineState instantiate(String stateName);


  final static public class CompiledStateMachineDefinition extends StateMachineDefinition {

    // Method handles for constructing each of the state classes
    private final Map<String, MethodHandle> constructors;

    @Override
    public String toString() {
      return "StateMachineDefinition.CompiledStateMachineDefinition(" + name() + ")";
    }

    @Override
    protected MachineState instantiate(String stateName) {
      try {
        return (MachineState)constructors.get(stateName).invoke();
      } catch (Throwable error) {
        throw new IllegalStateException("Failed to construct state " + stateName, error);
      }
    }

    public CompiledStateMachineDefinition(StateGraph graph) {
      super(graph);

      final GeneratedMachine generated = MachineClassCodegen.generate(graph);
      final MachineClassLoader loader = generated.defineClasses(MachineState.class.getClassLoader());

      // Load the classes and get a handle on their constructors
      final var constructors = new HashMap<String, MethodHandle>();
      try {
        final MethodHandles.Lookup lookup = MethodHandles.lookup();
        for (Map.Entry<String, String> entry : generated.stateClassNames().entrySet()) {
          final Class<?> stateClass = loader.loadClass(entry.getValue());
          constructors.put(
            entry.getKey(),
            lookup.findConstructor(stateClass, MethodType.methodType(void.class))
          );
        }
      } catch (ClassNotFoundException | NoSuchMethodException | IllegalAccessException error) {
        throw new IllegalStateException("Failed to load generated classes for " + graph.name(), error);
      }
      this.constructors = Collections.unmodifiableMap(constructors);
    }
  }

  final static public class InterpretedStateMachineDefinition extends StateMachineDefinition {

    @Override
    public String toString() {
      return "StateMachineDefinition.InterpretedStateMachineDefinition(" + name() + ")";
    }

    @Override
    protected MachineState instantiate(String stateName) {
      return new InterpretedState(stateName);
    }

    public InterpretedStateMachineDefinition(StateGraph graph) {
      super(graph);
    }

    /**
     * State which looks up its successors in the graph every time.
     */
    private final class InterpretedState extends MachineState {
      private final String state;

      InterpretedState(String state) {
        this.state = state;
      }

      @Override
      public String machineName() {
        return name();
      }

      @Override
      public String stateName() {
        return state;
      }

      @Override
      public boolean isTerminal() {
        return graph().isTerminal(state);
      }

      @Override
      public Set<String> transitionNames() {
        if (graph() instanceof TransitionGraph transitionGraph) {
          return transitionGraph.transitionsFrom(state).keySet();
        }
        return super.transitionNames();
      }

      @Override
      public MachineState nextState() {
        if (graph() instanceof SuccessorGraph successorGraph) {
          final Optional<String> successor = successorGraph.successor(state);
          if (successor.isPresent()) {
            return new InterpretedState(successor.get());
          }
        }
        return super.nextState();
      }

      @Override
      public MachineState transition(String transitionName) {
        if (graph() instanceof TransitionGraph transitionGraph) {
          final Optional<String> successor = transitionGraph.successor(state, transitionName);
          if (successor.isPresent()) {
            return new InterpretedState(successor.get());
          }
        }
        return super.transition(transitionName);
      }
    }
  }
}
