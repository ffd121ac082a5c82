package jstate.graph;

import jstate.parser.Dialect;
import jstate.parser.StateMachineBlock;
import java.util.List;
import java.util.Set;

/**
 * States of a machine and the way they connect, built from the edges of one
 * parsed block.
 *
 * <p>Graphs are immutable. States are kept in order of first appearance in the
 * block so that everything generated from a graph is deterministic.
 */
public interface StateGraph extends DotGraph<String, String> {

  /**
   * Name of the machine.
   */
  public String name();

  /**
   * Every state mentioned on either side of an edge.
   */
  public Set<String> states();

  /**
   * Which dialect the machine was written in.
   */
  public Dialect dialect();

  /**
   * Does the state have no way out?
   *
   * @param state state in the graph
   * @return whether the state has no outgoing edges
   */
  public boolean isTerminal(String state);

  /**
   * Build the graph for a parsed block, according to its dialect.
   *
   * @param block parsed block
   * @return graph of the block
   */
  public static StateGraph fromBlock(StateMachineBlock block) {
    switch (block.dialect()) {
      case UNNAMED:
        return SuccessorGraph.fromEdges(block.name(), narrow(block.edges(), jstate.parser.Edge.Unnamed.class));
      case NAMED:
        return TransitionGraph.fromEdges(block.name(), narrow(block.edges(), jstate.parser.Edge.Named.class));
      default:
        throw new IllegalArgumentException("Unknown dialect " + block.dialect());
    }
  }

  private static <T extends jstate.parser.Edge> List<T> narrow(
    List<jstate.parser.Edge> edges,
    Class<T> edgeClass
  ) {
    return edges.stream().map(edgeClass::cast).toList();
  }
}
