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
 * Graph of a machine with unnamed transitions, where every state has at most
 * one successor.
 */
public final class SuccessorGraph implements StateGraph {

  /**
   * Name of the machine.
   */
  public final String name;

  /**
   * All states, in order of first appearance.
   */
  public final Set<String> states;

  /**
   * Successor of every state which has one. States missing from this map are
   * terminal.
   */
  public final Map<String, String> successors;

  private SuccessorGraph(String name, Set<String> states, Map<String, String> successors) {
    this.name = name;
    this.states = states;
    this.successors = successors;
  }

  /**
   * Build up the graph from edges.
   *
   * <p>If multiple edges leave the same state, the last one wins. This matches
   * the observed behavior of the DSL, but it has not been confirmed that it is
   * intentional (as opposed to rejecting the duplicate).
   *
   * @param name name of the machine
   * @param edges edges in declaration order
   * @return graph of the machine
   */
  public static SuccessorGraph fromEdges(String name, List<jstate.parser.Edge.Unnamed> edges) {
    final var states = new LinkedHashSet<String>();
    final var successors = new LinkedHashMap<String, String>();
    for (jstate.parser.Edge.Unnamed edge : edges) {
      states.add(edge.from());
      states.add(edge.to());
      successors.put(edge.from(), edge.to());
    }
    return new SuccessorGraph(
      name,
      Collections.unmodifiableSet(states),
      Collections.unmodifiableMap(successors)
    );
  }

  /**
   * Successor of a state.
   *
   * @param state state in the graph
   * @return successor, or empty if the state is terminal
   */
  public Optional<String> successor(String state) {
    return Optional.ofNullable(successors.get(state));
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
    return Dialect.UNNAMED;
  }

  @Override
  public boolean isTerminal(String state) {
    return !successors.containsKey(state);
  }

  @Override
  public Stream<Vertex<String>> vertices() {
    return states.stream().map(state -> new Vertex<>(state, isTerminal(state)));
  }

  @Override
  public Stream<Edge<String, String>> edges() {
    return successors
      .entrySet()
      .stream()
      .map(entry -> new Edge<String, String>(entry.getKey(), entry.getValue(), null));
  }

  @Override
  public String toString() {
    return "SuccessorGraph(" + name + ", " + successors + ")";
  }
}
