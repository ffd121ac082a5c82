package jstate.graph;

import jstate.parser.Dialect;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Graph of a machine with named transitions.
 *
 * <p>Every state has an entry in the transition table, even terminal ones
 * (which map to an empty table). The same transition name may be used out of
 * several states, in which case it still refers to a single transition.
 */
public final class TransitionGraph implements StateGraph {

  /**
   * Name of the machine.
   */
  public final String name;

  /**
   * All states, in order of first appearance.
   */
  public final Set<String> states;

  /**
   * All transition names, in order of first appearance.
   */
  public final Set<String> transitionNames;

  /**
   * Transitions out of each state: state to transition name to successor.
   */
  public final Map<String, Map<String, String>> table;

  private TransitionGraph(
    String name,
    Set<String> states,
    Set<String> transitionNames,
    Map<String, Map<String, String>> table
  ) {
    this.name = name;
    this.states = states;
    this.transitionNames = transitionNames;
    this.table = table;
  }

  /**
   * Build up the graph from edges.
   *
   * <p>If the same transition out of the same state is declared twice, the
   * last declaration wins. As with {@link SuccessorGraph}, this reproduces the
   * observed behavior without it being confirmed as intentional.
   *
   * @param name name of the machine
   * @param edges edges in declaration order
   * @return graph of the machine
   */
  public static TransitionGraph fromEdges(String name, List<jstate.parser.Edge.Named> edges) {
    final var states = new LinkedHashSet<String>();
    final var transitionNames = new LinkedHashSet<String>();
    final var table = new LinkedHashMap<String, Map<String, String>>();

    for (jstate.parser.Edge.Named edge : edges) {
      states.add(edge.from());
      states.add(edge.to());
      transitionNames.add(edge.transition());
      table.computeIfAbsent(edge.from(), s -> new LinkedHashMap<>()).put(edge.transition(), edge.to());
    }

    // Terminal states still get a (empty) table, and the table follows state order
    final var fullTable = new LinkedHashMap<String, Map<String, String>>();
    for (String state : states) {
      final Map<String, String> transitions = table.getOrDefault(state, Collections.emptyMap());
      fullTable.put(state, Collections.unmodifiableMap(transitions));
    }

    return new TransitionGraph(
      name,
      Collections.unmodifiableSet(states),
      Collections.unmodifiableSet(transitionNames),
      Collections.unmodifiableMap(fullTable)
    );
  }

  /**
   * Transitions out of a state.
   *
   * @param state state in the graph
   * @return transition name to successor (empty for terminal or unknown states)
   */
  public Map<String, String> transitionsFrom(String state) {
    return table.getOrDefault(state, Collections.emptyMap());
  }

  /**
   * Follow a transition.
   *
   * @param state starting state
   * @param transition transition name
   * @return successor state, or empty if the state does not support the transition
   */
  public Optional<String> successor(String state, String transition) {
    return Optional.ofNullable(transitionsFrom(state).get(transition));
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public Set<String> states() {
    return states;
  }

  @Override
  public Dialect dialect() {
    return Dialect.NAMED;
  }

  @Override
  public boolean isTerminal(String state) {
    return transitionsFrom(state).isEmpty();
  }

  @Override
  public Stream<Vertex<String>> vertices() {
    return states.stream().map(state -> new Vertex<>(state, isTerminal(state)));
  }

  @Override
  public Stream<Edge<String, String>> edges() {
    return table
      .entrySet()
      .stream()
      .flatMap((Map.Entry<String, Map<String, String>> from) -> {
        return from
          .getValue()
          .entrySet()
          .stream()
          .map(entry -> new Edge<String, String>(from.getKey(), entry.getValue(), entry.getKey()));
      });
  }

  @Override
  public String toString() {
    return "TransitionGraph(" + name + ", " + table + ")";
  }
}
