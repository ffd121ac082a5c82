package jstate;

import java.util.Set;

/**
 * Instance of a state in a compiled state machine.
 *
 * <p>Every state machine gets its own subclass of this, and every state of the
 * machine a subclass of that. States are not singletons: moving to another
 * state always constructs a fresh instance. Two instances of the same state
 * display the same way but are never {@code ==}.
 *
 * <p>Subclasses generated for machines with unnamed transitions override
 * {@link #nextState()}, while those for machines with named transitions
 * override {@link #transition(String)} and {@link #transitionNames()}.
 */
public abstract class MachineState {

  protected MachineState() { }

  /**
   * Name of the machine this state belongs to.
   */
  public abstract String machineName();

  /**
   * Name of this state.
   */
  public abstract String stateName();

  /**
   * Is there no way out of this state?
   */
  public abstract boolean isTerminal();

  /**
   * Names of the transitions out of this state (empty when using unnamed
   * transitions).
   */
  public Set<String> transitionNames() {
    return Set.of();
  }

  /**
   * Move to the successor of this state.
   *
   * @return fresh instance of the successor state
   * @throws UnsupportedOperationException if this state has no successor
   */
  public MachineState nextState() {
    throw new UnsupportedOperationException(
      machineName() + "." + stateName() + " has no next state"
    );
  }

  /**
   * Follow a named transition out of this state.
   *
   * @param transitionName name of the transition
   * @return fresh instance of the state at the other end of the transition
   * @throws InvalidTransitionException if this state does not support the transition
   */
  public MachineState transition(String transitionName) {
    throw new InvalidTransitionException(machineName(), stateName(), transitionName);
  }

  /**
   * Follow a named transition out of this state.
   *
   * @param transition transition value
   * @return fresh instance of the state at the other end of the transition
   * @throws InvalidTransitionException if this state does not support the transition
   */
  public final MachineState transition(Transition transition) {
    return transition(transition.name());
  }

  @Override
  public String toString() {
    return stateName();
  }
}
