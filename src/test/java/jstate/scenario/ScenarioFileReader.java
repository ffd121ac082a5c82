package jstate.scenario;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;

/**
 * Skips over comment and blank lines, grouping the rest into scenarios.
 */
public class ScenarioFileReader implements Closeable {

  private final BufferedReader reader;

  private final String filePath;

  private int lineNumber = 0;

  public ScenarioFileReader(Reader reader, String filePath) {
    this.reader = new BufferedReader(reader);
    this.filePath = filePath;
  }

  /**
   * Open a scenario file on the test classpath.
   *
   * @param resourceName name of the resource
   * @return reader over the resource
   */
  public static ScenarioFileReader fromResource(String resourceName) throws IOException {
    final InputStream stream = ScenarioFileReader.class.getClassLoader().getResourceAsStream(resourceName);
    if (stream == null) {
      throw new FileNotFoundException(resourceName);
    }
    return new ScenarioFileReader(new InputStreamReader(stream, StandardCharsets.UTF_8), resourceName);
  }

  /**
   * Read the next meaningful line from the input.
   */
  public String readLine() throws IOException {
    String line;

    while (true) {
      line = reader.readLine();
      lineNumber++;
      if (line == null) {
        return line; // EOF
      } else if (line.startsWith("//") || line.isBlank()) {
        continue; // Not a valid line
      }
      break;
    }

    return line;
  }

  /**
   * Read the next scenario from the input.
   */
  public ScenarioCase readScenario() throws IOException {

    // Scenario data
    final String source = readLine();
    if (source == null) {
      return null;
    }
    final int lineNumber = this.lineNumber;
    final String script = readLine();
    final String output = readLine();
    if (script == null || output == null) {
      throw new IOException("Incomplete scenario at " + filePath + ":" + lineNumber);
    }

    return new ScenarioCase(source, script, output, filePath, lineNumber);
  }

  /**
   * Run an action for every remaining scenario in the file.
   *
   * @param action action to run on each scenario
   */
  public void forEachScenario(Consumer<? super ScenarioCase> action) throws IOException {
    ScenarioCase scenario;
    while ((scenario = readScenario()) != null) {
      action.accept(scenario);
    }
  }

  @Override
  public void close() throws IOException {
    reader.close();
  }
}
