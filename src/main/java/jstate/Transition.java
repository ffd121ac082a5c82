package jstate;

/**
 * Named transition of a state machine.
 *
 * <p>There is one transition value per transition name in a machine, shared
 * by every state that supports the transition. It displays as its name.
 */
public class Transition {

  private final String name;

  public Transition(String name) {
    this.name = name;
  }

  /**
   * Name of the transition.
   */
  public final String name() {
    return name;
  }

  @Override
  public String toString() {
    return name;
  }
}
