package jstate.graph;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import jstate.parser.Dialect;
import jstate.parser.StateMachineParser;
import org.junit.jupiter.api.Test;

class TransitionGraphTest {

  private static StateGraph graphOf(String source) {
    return StateGraph.fromBlock(StateMachineParser.parseSingle(source));
  }

  @Test
  void buildsTransitionTable() {
    final StateGraph graph = graphOf("statemachine Door: Closed -(open)-> Open Open -(close)-> Closed");

    assertThat(graph).isInstanceOf(TransitionGraph.class);
    assertThat(graph.dialect()).isEqualTo(Dialect.NAMED);

    final var door = (TransitionGraph) graph;
    assertThat(door.states).containsExactly("Closed", "Open");
    assertThat(door.transitionNames).containsExactly("open", "close");
    assertThat(door.table).containsExactly(
      Map.entry("Closed", Map.of("open", "Open")),
      Map.entry("Open", Map.of("close", "Closed"))
    );
    assertThat(door.successor("Closed", "open")).contains("Open");
    assertThat(door.successor("Closed", "close")).isEmpty();
  }

  @Test
  void terminalStatesHaveEmptyTable() {
    final var graph = (TransitionGraph) graphOf("statemachine Job: Queued -(start)-> Running Running -(finish)-> Done");

    assertThat(graph.table).containsKey("Done");
    assertThat(graph.transitionsFrom("Done")).isEmpty();
    assertThat(graph.isTerminal("Done")).isTrue();
    assertThat(graph.isTerminal("Running")).isFalse();
    assertThat(graph.transitionsFrom("Unknown")).isEmpty();
  }

  @Test
  void sharedTransitionNamesAreListedOnce() {
    final var graph = (TransitionGraph) graphOf("statemachine Steps: A -(go)-> B B -(go)-> C C -(back)-> A");

    assertThat(graph.transitionNames).containsExactly("go", "back");
    assertThat(graph.successor("A", "go")).contains("B");
    assertThat(graph.successor("B", "go")).contains("C");
  }

  @Test
  void lastDeclarationOfTransitionWins() {
    final var graph = (TransitionGraph) graphOf("statemachine Fork: A -(go)-> B A -(go)-> C");

    assertThat(graph.states).containsExactly("A", "B", "C");
    assertThat(graph.transitionsFrom("A")).containsExactly(Map.entry("go", "C"));
  }

  @Test
  void rendersLabelledEdges() {
    final String dot = graphOf("statemachine Door: Closed -(open)-> Open").dotGraph("Door");

    assertThat(dot).contains("  \"Closed\" -> \"Open\" [label = \"open\"];\n");
    assertThat(dot).contains("  \"Open\" [shape = doublecircle];\n");
  }
}
