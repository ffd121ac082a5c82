package jstate.parser;

/**
 * Edge parsed out of a state machine block.
 */
public interface Edge {

  /**
   * State the edge leaves from.
   */
  public String from();

  /**
   * State the edge leads to.
   */
  public String to();

  /**
   * Dialect in which this sort of edge is written.
   */
  public Dialect dialect();

  /**
   * Edge written as {@code From -> To}.
   *
   * @param from source state
   * @param to successor state
   */
  record Unnamed(String from, String to) implements Edge {

    @Override
    public Dialect dialect() {
      return Dialect.UNNAMED;
    }

    @Override
    public String toString() {
      return from + " -> " + to;
    }
  }

  /**
   * Edge written as {@code From -(transition)-> To}.
   *
   * @param from source state
   * @param transition name of the transition
   * @param to successor state
   */
  record Named(String from, String transition, String to) implements Edge {

    @Override
    public Dialect dialect() {
      return Dialect.NAMED;
    }

    @Override
    public String toString() {
      return from + " -(" + transition + ")-> " + to;
    }
  }
}
