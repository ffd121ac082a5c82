package jstate.graph;

import java.util.stream.Stream;

/**
 * Graphs which can be rendered using the DOT language.
 *
 * @param <V> vertex in the graph
 * @param <E> edge label in the graph
 */
public interface DotGraph<V, E> {

  /**
   * Vertex in the dot graph.
   *
   * @param id unique identifier for the vertex
   * @param terminal does the vertex have no way out?
   */
  record Vertex<V>(V id, boolean terminal) { }

  /**
   * Edge in the dot graph.
   *
   * @param from vertex where the edge starts
   * @param to vertex where the edge ends
   * @param label label on the edge (or {@code null} for no label)
   */
  record Edge<V, E>(V from, V to, E label) { }

  /**
   * List out the vertices in the graph.
   *
   * @return all vertices
   */
  public Stream<Vertex<V>> vertices();

  /**
   * List out the edges in the graph.
   *
   * @return all edges
   */
  public Stream<Edge<V, E>> edges();

  /**
   * Render the graph into its DOT source.
   *
   * @param name title given to the graph
   * @return source code for the graph
   */
  default String dotGraph(String name) {
    final var builder = new StringBuilder();
    builder.append("digraph " + escapeId(name) + " {\n");
    builder.append("  rankdir = LR;\n");

    final Iterable<Vertex<V>> vs = () -> vertices().iterator();
    for (Vertex<V> vertex : vs) {
      final var id = escapeId(vertex.id().toString());
      final var shape = vertex.terminal() ? "doublecircle" : "circle";
      builder.append("  " + id + " [shape = " + shape + "];\n");
    }

    final Iterable<Edge<V, E>> es = () -> edges().iterator();
    for (Edge<V, E> edge : es) {
      final var from = escapeId(edge.from().toString());
      final var to = escapeId(edge.to().toString());
      final E label = edge.label();
      if (label == null) {
        builder.append("  " + from + " -> " + to + ";\n");
      } else {
        builder.append("  " + from + " -> " + to + " [label = " + escapeId(label.toString()) + "];\n");
      }
    }

    builder.append("}");
    return builder.toString();
  }

  /**
   * Turn a string into a Dot ID.
   *
   * <p>As per the docs, an ID can be "any double-quoted string ("...") possibly
   * containing escaped quotes (\")".
   *
   * @param str string to escape into an ID
   */
  private static String escapeId(String str) {
    return "\"" + str.replace("\"", "\\\"") + "\"";
  }
}
