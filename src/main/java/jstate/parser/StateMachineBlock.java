package jstate.parser;

import java.util.List;

/**
 * One {@code statemachine <name>: <edge>+} block found in source text.
 *
 * @param name name of the machine
 * @param dialect shape shared by all of the edges
 * @param edges edges, in declaration order
 * @param start offset of the {@code statemachine} keyword
 * @param end offset just past the last edge
 * @param nested does the block sit inside the body of another type?
 */
public record StateMachineBlock(
  String name,
  Dialect dialect,
  List<Edge> edges,
  int start,
  int end,
  boolean nested
) {

  public StateMachineBlock {
    edges = List.copyOf(edges);
  }
}
