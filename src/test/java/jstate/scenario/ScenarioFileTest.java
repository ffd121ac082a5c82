package jstate.scenario;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ScenarioFileTest {

  @ParameterizedTest
  @ValueSource(strings = {"scenarios/unnamed.txt", "scenarios/named.txt", "scenarios/errors.txt"})
  void runsScenarioFile(String resourceName) throws IOException {
    final List<String> failures = new ArrayList<>();
    final int[] passed = {0};

    final ScenarioReporter reporter = new ScenarioReporter() {
      @Override
      public void onUnexpectedOutput(ScenarioCase scenario, String flavour, String foundOutput) {
        failures.add(scenario.getSummary() + " [" + flavour + "] expected <" + scenario.output
          + "> but found <" + foundOutput + ">");
      }

      @Override
      public void onSuccess(ScenarioCase scenario, boolean expectedFailure) {
        passed[0]++;
      }
    };

    for (boolean compiled : new boolean[] { true, false }) {
      try (var reader = ScenarioFileReader.fromResource(resourceName)) {
        reader.forEachScenario(new ScenarioRunner(reporter, compiled));
      }
    }

    assertThat(failures).isEmpty();
    assertThat(passed[0]).isPositive();
  }
}
