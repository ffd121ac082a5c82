package jstate.parser;

/**
 * Unchecked exception thrown when a state machine block cannot be parsed.
 *
 * <p>This plays the same role as {@code java.util.regex.PatternSyntaxException}:
 * the location of the error is reported as an offset into the source, and the
 * message renders the offending line with a caret under the error.
 */
public class StateMachineSyntaxException extends IllegalArgumentException {

  @java.io.Serial
  private static final long serialVersionUID = -2719563390474721684L;

  private final String description;
  private final String source;
  private final int index;
  private final int line;
  private final int column;

  public StateMachineSyntaxException(String description, String source, int index) {
    super(description);
    this.description = description;
    this.source = source;
    this.index = index;

    int lineNumber = 1;
    int lineStart = 0;
    for (int i = 0; i < index && i < source.length(); i++) {
      if (source.charAt(i) == '\n') {
        lineNumber++;
        lineStart = i + 1;
      }
    }
    this.line = lineNumber;
    this.column = index - lineStart + 1;
  }

  /**
   * Description of the error (without location information).
   */
  public String getDescription() {
    return description;
  }

  /**
   * Source text in which the error was found.
   */
  public String getSource() {
    return source;
  }

  /**
   * Offset of the error in the source.
   */
  public int getIndex() {
    return index;
  }

  /**
   * Line of the error (1-based).
   */
  public int getLine() {
    return line;
  }

  /**
   * Column of the error (1-based).
   */
  public int getColumn() {
    return column;
  }

  @Override
  public String getMessage() {
    final int lineStart = index - column + 1;
    int lineEnd = source.indexOf('\n', lineStart);
    if (lineEnd < 0) {
      lineEnd = source.length();
    }
    final var sourceLine = source.substring(lineStart, lineEnd).stripTrailing();

    final var message = new StringBuilder();
    message.append(description);
    message.append(" (line ").append(line).append(", column ").append(column).append(")");
    message.append(System.lineSeparator()).append(sourceLine);
    message.append(System.lineSeparator()).append(" ".repeat(column - 1)).append('^');
    return message.toString();
  }
}
