package jstate;

import jstate.codegen.SourceLayout;
import jstate.codegen.SuccessorSourceCodegen;
import jstate.codegen.TransitionSourceCodegen;
import jstate.graph.StateGraph;
import jstate.graph.SuccessorGraph;
import jstate.graph.TransitionGraph;
import jstate.parser.StateMachineBlock;
import jstate.parser.StateMachineParser;
import jstate.parser.StateMachineSyntaxException;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Compiles {@code statemachine} blocks embedded in Java source.
 *
 * <p>Every block is parsed, turned into a graph, and replaced by generated
 * Java source. Everything outside of blocks (comments included) is left
 * exactly as it was. Blocks are compiled independently of each other.
 *
 * <p>The compiler holds no state, so a single instance can be shared freely
 * between threads.
 */
public final class StateMachineCompiler {

  private static final Logger logger = LogManager.getLogger(StateMachineCompiler.class.getSimpleName());

  /**
   * Replace every state machine block in the source with generated code.
   *
   * <p>The generated code is indented to line up with the column at which the
   * block started, and uses the same line separator as the line of the block.
   * Blocks inside the body of another type become static member classes. If
   * any block fails to parse, nothing is returned.
   *
   * @param source Java source containing state machine blocks
   * @return transformed source (the same text if there are no blocks)
   */
  public String compile(String source) throws StateMachineSyntaxException {
    final List<StateMachineBlock> blocks = StateMachineParser.parseAll(source);
    if (blocks.isEmpty()) {
      return source;
    }

    final var output = new StringBuilder(source.length());
    int copiedUpTo = 0;
    for (StateMachineBlock block : blocks) {
      output.append(source, copiedUpTo, block.start());

      final StateGraph graph = StateGraph.fromBlock(block);
      final var layout = new SourceLayout(
        indentationAt(source, block.start()),
        lineSeparatorAt(source, block.start()),
        block.nested()
      );
      final String generated = generateSource(graph, layout);
      if (logger.isDebugEnabled()) {
        logger.debug("Compiled state machine " + graph.name() + " (" + graph.dialect() + ", "
          + graph.states().size() + " states):\n" + generated);
      }
      output.append(generated);
      copiedUpTo = block.end();
    }
    output.append(source, copiedUpTo, source.length());

    return output.toString();
  }

  /**
   * Build the graphs of every state machine block in the source.
   *
   * @param source Java source containing state machine blocks
   * @return graphs, in source order
   */
  public List<StateGraph> graphs(String source) throws StateMachineSyntaxException {
    return StateMachineParser
      .parseAll(source)
      .stream()
      .map(StateGraph::fromBlock)
      .collect(Collectors.toList());
  }

  /**
   * Build compiled definitions for every state machine block in the source.
   *
   * @param source Java source containing state machine blocks
   * @return definitions backed by generated classes, in source order
   */
  public List<StateMachineDefinition> definitions(String source) throws StateMachineSyntaxException {
    return graphs(source)
      .stream()
      .map(graph -> StateMachineDefinition.fromGraph(graph, true))
      .collect(Collectors.toList());
  }

  /**
   * Build interpreted definitions for every state machine block in the source.
   *
   * @param source Java source containing state machine blocks
   * @return definitions walking the graphs directly, in source order
   */
  public List<StateMachineDefinition> interpretedDefinitions(String source) throws StateMachineSyntaxException {
    return graphs(source)
      .stream()
      .map(graph -> StateMachineDefinition.fromGraph(graph, false))
      .collect(Collectors.toList());
  }

  /**
   * Generate the Java source for a graph.
   *
   * @param graph graph of the machine
   * @param layout placement of the generated source
   * @return generated source
   */
  public static String generateSource(StateGraph graph, SourceLayout layout) {
    if (graph instanceof SuccessorGraph successorGraph) {
      return SuccessorSourceCodegen.generate(successorGraph, layout);
    } else if (graph instanceof TransitionGraph transitionGraph) {
      return TransitionSourceCodegen.generate(transitionGraph, layout);
    } else {
      throw new IllegalArgumentException("Unknown state graph " + graph);
    }
  }

  /**
   * Indentation matching the column of a position in the source.
   *
   * <p>Tabs before the position are kept, anything else becomes a space, so
   * that generated lines line up regardless of how the source is indented.
   *
   * @param source source text
   * @param index position in the source
   * @return whitespace as wide as the text before the position on its line
   */
  static String indentationAt(String source, int index) {
    final int lineStart = source.lastIndexOf('\n', index - 1) + 1;
    final var indent = new StringBuilder(index - lineStart);
    for (int i = lineStart; i < index; i++) {
      indent.append(source.charAt(i) == '\t' ? '\t' : ' ');
    }
    return indent.toString();
  }

  /**
   * Line separator used around a position in the source.
   *
   * <p>This is the separator ending the line of the position or, on the last
   * line, the one ending the line before. Sources without line breaks get
   * {@code "\n"}.
   *
   * @param source source text
   * @param index position in the source
   * @return {@code "\r\n"} or {@code "\n"}
   */
  static String lineSeparatorAt(String source, int index) {
    int newline = source.indexOf('\n', index);
    if (newline < 0) {
      newline = source.lastIndexOf('\n', index);
    }
    return (newline > 0 && source.charAt(newline - 1) == '\r') ? "\r\n" : "\n";
  }
}
