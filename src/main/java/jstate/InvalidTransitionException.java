package jstate;

/**
 * Thrown when a state is asked to follow a transition it does not support.
 *
 * <p>This is never thrown while compiling state machines, only while running
 * them.
 */
public class InvalidTransitionException extends RuntimeException {

  @java.io.Serial
  private static final long serialVersionUID = 3920583374610527188L;

  /**
   * Name of the machine whose state rejected the transition.
   */
  public final String machineName;

  /**
   * Name of the state which rejected the transition.
   */
  public final String stateName;

  /**
   * Transition which was attempted.
   */
  public final String transitionName;

  public InvalidTransitionException(String machineName, String stateName, String transitionName) {
    super(machineName + "." + stateName + " does not support transition \"" + transitionName + "\"");
    this.machineName = machineName;
    this.stateName = stateName;
    this.transitionName = transitionName;
  }
}
