package jstate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;

import jstate.parser.Dialect;
import jstate.parser.StateMachineSyntaxException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class StateMachineDefinitionTest {

  private static StateMachineDefinition define(String source, boolean compiled) {
    return compiled ? StateMachineDefinition.compile(source) : StateMachineDefinition.interpreted(source);
  }

  @ParameterizedTest
  @ValueSource(booleans = {true, false})
  void cyclesThroughSuccessors(boolean compiled) {
    final var light = define("statemachine Light: Red -> Green Green -> Yellow Yellow -> Red", compiled);

    assertThat(light.name()).isEqualTo("Light");
    assertThat(light.dialect()).isEqualTo(Dialect.UNNAMED);
    assertThat(light.stateNames()).containsExactly("Red", "Green", "Yellow");
    assertThat(light.transitions()).isEmpty();

    final MachineState red = light.newState("Red");
    final MachineState green = red.nextState();
    final MachineState yellow = green.nextState();
    final MachineState back = yellow.nextState();

    assertThat(green).hasToString("Green");
    assertThat(yellow).hasToString("Yellow");
    assertThat(back).hasToString("Red");
    assertThat(back).isNotSameAs(red);
    assertThat(back.machineName()).isEqualTo("Light");
  }

  @ParameterizedTest
  @ValueSource(booleans = {true, false})
  void lastEdgeOutOfStateWins(boolean compiled) {
    final var dup = define("statemachine Dup: A -> B A -> C", compiled);

    assertThat(dup.newState("A").nextState()).hasToString("C");
    assertThat(dup.newState("B").isTerminal()).isTrue();
  }

  @ParameterizedTest
  @ValueSource(booleans = {true, false})
  void terminalStateHasNoNextState(boolean compiled) {
    final var line = define("statemachine Line: First -> Second", compiled);
    final MachineState second = line.newState("Second");

    assertThat(second.isTerminal()).isTrue();
    assertThatThrownBy(second::nextState)
      .isInstanceOf(UnsupportedOperationException.class)
      .hasMessage("Line.Second has no next state");
  }

  @ParameterizedTest
  @ValueSource(booleans = {true, false})
  void unnamedStatesRejectNamedTransitions(boolean compiled) {
    final var line = define("statemachine Line: First -> Second", compiled);

    assertThat(line.newState("First").transitionNames()).isEmpty();
    assertThatThrownBy(() -> line.newState("First").transition("next"))
      .isInstanceOf(InvalidTransitionException.class);
  }

  @ParameterizedTest
  @ValueSource(booleans = {true, false})
  void followsNamedTransitions(boolean compiled) {
    final var door = define("statemachine Door: Closed -(open)-> Open Open -(close)-> Closed", compiled);

    assertThat(door.dialect()).isEqualTo(Dialect.NAMED);

    final MachineState closed = door.newState("Closed");
    final MachineState open = closed.transition("open");
    assertThat(open).hasToString("Open");
    assertThat(open.transition("close")).hasToString("Closed");
    assertThat(closed.transitionNames()).containsExactly("open");
  }

  @ParameterizedTest
  @ValueSource(booleans = {true, false})
  void rejectsUnsupportedTransition(boolean compiled) {
    final var door = define("statemachine Door: Closed -(open)-> Open Open -(close)-> Closed", compiled);
    final MachineState open = door.newState("Open");

    final var error = assertThrows(InvalidTransitionException.class, () -> open.transition("open"));
    assertThat(error.machineName).isEqualTo("Door");
    assertThat(error.stateName).isEqualTo("Open");
    assertThat(error.transitionName).isEqualTo("open");
    assertThat(error).hasMessage("Door.Open does not support transition \"open\"");
  }

  @ParameterizedTest
  @ValueSource(booleans = {true, false})
  void terminalNamedStateRejectsEveryTransition(boolean compiled) {
    final var job = define("statemachine Job: Queued -(start)-> Running Running -(finish)-> Done", compiled);
    final MachineState done = job.newState("Queued").transition("start").transition("finish");

    assertThat(done).hasToString("Done");
    assertThat(done.isTerminal()).isTrue();
    assertThat(done.transitionNames()).isEmpty();
    assertThatThrownBy(() -> done.transition("start")).isInstanceOf(InvalidTransitionException.class);
    assertThatThrownBy(done::nextState).isInstanceOf(UnsupportedOperationException.class);
  }

  @ParameterizedTest
  @ValueSource(booleans = {true, false})
  void transitionValuesAreSingletons(boolean compiled) {
    final var door = define("statemachine Door: Closed -(open)-> Open Open -(close)-> Closed", compiled);

    assertThat(door.transitions()).extracting(Transition::name).containsExactly("open", "close");
    assertThat(door.transition("open")).isPresent();
    assertThat(door.transition("open").get()).isSameAs(door.transition("open").get());
    assertThat(door.transition("slam")).isEmpty();

    final Transition open = door.transition("open").get();
    assertThat(door.newState("Closed").transition(open)).hasToString("Open");
  }

  @ParameterizedTest
  @ValueSource(booleans = {true, false})
  void statesAreFreshInstances(boolean compiled) {
    final var light = define("statemachine Light: Red -> Green Green -> Red", compiled);

    final MachineState first = light.newState("Red");
    final MachineState second = light.newState("Red");
    assertThat(first).hasToString(second.toString());
    assertThat(first).isNotSameAs(second);
  }

  @ParameterizedTest
  @ValueSource(booleans = {true, false})
  void rejectsUnknownState(boolean compiled) {
    final var light = define("statemachine Light: Red -> Green", compiled);

    assertThatThrownBy(() -> light.newState("Blue"))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessage("State machine Light has no state Blue");
  }

  @Test
  void rejectsInvalidSource() {
    assertThatThrownBy(() -> StateMachineDefinition.compile("statemachine Bad: A -> B B -(go)-> C"))
      .isInstanceOf(StateMachineSyntaxException.class);
    assertThatThrownBy(() -> StateMachineDefinition.interpreted("statemachine Light: Red -> Green;"))
      .isInstanceOf(StateMachineSyntaxException.class);
  }

  @Test
  void describesFlavourInToString() {
    assertThat(StateMachineDefinition.compile("statemachine Light: Red -> Green"))
      .hasToString("StateMachineDefinition.CompiledStateMachineDefinition(Light)");
    assertThat(StateMachineDefinition.interpreted("statemachine Light: Red -> Green"))
      .hasToString("StateMachineDefinition.InterpretedStateMachineDefinition(Light)");
  }
}
