package jstate.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for state machine blocks embedded in Java source.
 *
 * <p>This is a small recursive descent parser over the grammar
 *
 * <pre>
 *   block    ::= 'statemachine' ident ':' edge+
 *   edge     ::= ident '->' ident                  (unnamed dialect)
 *              | ident '-(' ident ')->' ident      (named dialect)
 * </pre>
 *
 * <p>Whitespace and Java comments between tokens are skipped. The dialect of a
 * block is fixed by its first edge and the two edge shapes are told apart by
 * the {@code -(} marker, so no backtracking between dialects is needed. A block
 * ends at the first point where the upcoming tokens no longer look like the
 * start of an edge (an identifier followed by an arrow).
 */
public final class StateMachineParser {

  public static final String KEYWORD = "statemachine";

  private static final String UNNAMED_ARROW = "->";
  private static final String NAMED_ARROW_OPEN = "-(";
  private static final String NAMED_ARROW_CLOSE = ")->";

  // Bookeeping around position in source
  private final String input;
  private final int length;
  private int position = 0;

  private StateMachineParser(String input) {
    this.input = input;
    this.length = input.length();
  }

  /**
   * Parse a single state machine block starting at an offset.
   *
   * @param input source text
   * @param offset where to start parsing (leading whitespace is allowed)
   * @return parsed block
   */
  public static StateMachineBlock parse(
    String input,
    int offset
  ) throws StateMachineSyntaxException {
    final var parser = new StateMachineParser(input);
    parser.position = offset;
    parser.skipSpaceAndComments();
    return parser.parseBlock(false);
  }

  /**
   * Parse source text made up of exactly one state machine block.
   *
   * @param input source text
   * @return parsed block
   */
  public static StateMachineBlock parseSingle(String input) throws StateMachineSyntaxException {
    final var parser = new StateMachineParser(input);
    parser.skipSpaceAndComments();
    final var block = parser.parseBlock(false);
    parser.skipSpaceAndComments();
    if (parser.position < parser.length) {
      throw parser.error("Expected the end of the state machine source");
    }
    return block;
  }

  /**
   * Find and parse every state machine block in a Java compilation unit.
   *
   * <p>Comments and string, character, and text block literals are skipped.
   * The {@code statemachine} keyword only starts a block when it is a whole
   * word followed by an identifier and a colon, so that text like
   * {@code statemachine.Foo} or {@code statemachine instanceof Foo} passes
   * through untouched. Blocks found inside braces are marked as nested.
   *
   * @param input source text
   * @return all blocks, ordered by their position in the source
   */
  public static List<StateMachineBlock> parseAll(String input) throws StateMachineSyntaxException {
    final var parser = new StateMachineParser(input);
    final var blocks = new ArrayList<StateMachineBlock>();
    int braceDepth = 0;

    while (parser.position < parser.length) {
      final char c = input.charAt(parser.position);
      if (parser.atComment()) {
        parser.skipComment();
      } else if (c == '"') {
        parser.skipStringLiteral();
      } else if (c == '\'') {
        parser.skipQuoted('\'');
      } else if (Identifiers.isIdentifierPart(c)) {
        final int wordStart = parser.position;
        final String word = parser.readWord();
        if (word.equals(KEYWORD) && parser.atBlockBody()) {
          parser.position = wordStart;
          blocks.add(parser.parseBlock(braceDepth > 0));
        }
      } else {
        if (c == '{') {
          braceDepth++;
        } else if (c == '}' && braceDepth > 0) {
          braceDepth--;
        }
        parser.position++;
      }
    }

    return blocks;
  }

  private StateMachineSyntaxException error(String message) {
    return new StateMachineSyntaxException(message, input, position);
  }

  private StateMachineSyntaxException error(String message, int position) {
    return new StateMachineSyntaxException(message, input, position);
  }

  /**
   * Parse one block, starting exactly at the {@code statemachine} keyword.
   *
   * @param nested is the block inside the body of another type?
   */
  private StateMachineBlock parseBlock(boolean nested) {
    final int start = position;
    if (!input.startsWith(KEYWORD, position) || isIdentifierPartAt(position + KEYWORD.length())) {
      throw error("Expected '" + KEYWORD + "'");
    }
    position += KEYWORD.length();

    skipSpaceAndComments();
    final String name = parseIdentifier("state machine name");

    skipSpaceAndComments();
    if (!nextCharIf(':')) {
      throw error("Expected ':' after the state machine name");
    }

    // The first edge is mandatory and decides the dialect
    skipSpaceAndComments();
    final var edges = new ArrayList<Edge>();
    final Edge first = parseEdge(name, null);
    edges.add(first);
    int end = position;

    while (true) {
      skipSpaceAndComments();
      if (!atEdge()) {
        break;
      }
      edges.add(parseEdge(name, first.dialect()));
      end = position;
    }

    // Trailing whitespace and comments belong to the surrounding text
    position = end;
    return new StateMachineBlock(name, first.dialect(), edges, start, end, nested);
  }

  /**
   * Parse an edge.
   *
   * @param machine name of the machine
   * @param dialect dialect of the block, or {@code null} for the first edge
   * @return parsed edge
   */
  private Edge parseEdge(String machine, Dialect dialect) {
    final String from = parseStateName(machine);
    skipSpaceAndComments();

    final int arrowPosition = position;
    if (input.startsWith(NAMED_ARROW_OPEN, position)) {
      if (dialect == Dialect.UNNAMED) {
        throw error(
          "Cannot mix named transitions into a state machine with unnamed transitions",
          arrowPosition
        );
      }
      position += NAMED_ARROW_OPEN.length();

      skipSpaceAndComments();
      final String transition = parseIdentifier("transition name");

      skipSpaceAndComments();
      if (!input.startsWith(NAMED_ARROW_CLOSE, position)) {
        throw error("Expected '" + NAMED_ARROW_CLOSE + "' after transition '" + transition + "'");
      }
      position += NAMED_ARROW_CLOSE.length();

      skipSpaceAndComments();
      final String to = parseStateName(machine);
      return new Edge.Named(from, transition, to);
    } else if (input.startsWith(UNNAMED_ARROW, position)) {
      if (dialect == Dialect.NAMED) {
        throw error(
          "Cannot mix unnamed transitions into a state machine with named transitions",
          arrowPosition
        );
      }
      position += UNNAMED_ARROW.length();

      skipSpaceAndComments();
      final String to = parseStateName(machine);
      return new Edge.Unnamed(from, to);
    } else {
      throw error("Expected '" + UNNAMED_ARROW + "' or '" + NAMED_ARROW_OPEN + "' after state '" + from + "'");
    }
  }

  /**
   * Parse an identifier, rejecting reserved words.
   *
   * @param what what the identifier names (used in error messages)
   * @return identifier
   */
  private String parseIdentifier(String what) {
    final int start = position;
    if (position >= length || !Identifiers.isIdentifierStart(input.charAt(position))) {
      throw error("Expected " + what);
    }
    final String word = readWord();
    if (Identifiers.isReserved(word)) {
      throw error("Cannot use the Java keyword '" + word + "' as a " + what, start);
    }
    if (Identifiers.hidesGeneratedPackage(word)) {
      throw error("Cannot use '" + word + "' as a " + what + ", it hides a package used by generated code", start);
    }
    return word;
  }

  /**
   * Parse a state name. States become classes nested in the machine's class,
   * so they cannot share its name.
   *
   * @param machine name of the machine
   * @return state name
   */
  private String parseStateName(String machine) {
    final int start = position;
    final String state = parseIdentifier("state name");
    if (state.equals(machine)) {
      throw error("State '" + state + "' cannot have the same name as its state machine", start);
    }
    return state;
  }

  /**
   * Do the upcoming tokens look like the start of an edge? Does not advance.
   */
  private boolean atEdge() {
    final int saved = position;
    try {
      if (position >= length || !Identifiers.isIdentifierStart(input.charAt(position))) {
        return false;
      }
      readWord();
      skipSpaceAndComments();
      return input.startsWith(UNNAMED_ARROW, position) || input.startsWith(NAMED_ARROW_OPEN, position);
    } finally {
      position = saved;
    }
  }

  /**
   * Is the cursor (just past the keyword) followed by a machine name and a
   * colon? Does not advance.
   */
  private boolean atBlockBody() {
    final int saved = position;
    try {
      skipSpaceAndComments();
      if (position >= length || !Identifiers.isIdentifierStart(input.charAt(position))) {
        return false;
      }
      readWord();
      skipSpaceAndComments();
      return position < length && input.charAt(position) == ':';
    } finally {
      position = saved;
    }
  }

  /**
   * Read a run of identifier characters.
   */
  private String readWord() {
    final int start = position;
    while (isIdentifierPartAt(position)) {
      position++;
    }
    return input.substring(start, position);
  }

  private boolean isIdentifierPartAt(int index) {
    return index < length && Identifiers.isIdentifierPart(input.charAt(index));
  }

  /**
   * Advance past the next character only if it matches the expected.
   *
   * @param matching desired character
   * @return whether the character was found
   */
  private boolean nextCharIf(char matching) {
    final boolean matches = position < length && input.charAt(position) == matching;
    if (matches) {
      position++;
    }
    return matches;
  }

  /**
   * Advance the cursor past any whitespace or comments.
   */
  private void skipSpaceAndComments() {
    while (position < length) {
      if (atComment()) {
        skipComment();
      } else if (Character.isWhitespace(input.charAt(position))) {
        position++;
      } else {
        break;
      }
    }
  }

  private boolean atComment() {
    return position + 1 < length
      && input.charAt(position) == '/'
      && (input.charAt(position + 1) == '/' || input.charAt(position + 1) == '*');
  }

  /**
   * Advance past a line or block comment. An unterminated block comment runs
   * to the end of the input.
   */
  private void skipComment() {
    if (input.charAt(position + 1) == '/') {
      final int newline = input.indexOf('\n', position);
      position = (newline < 0) ? length : newline + 1;
    } else {
      final int close = input.indexOf("*/", position + 2);
      position = (close < 0) ? length : close + 2;
    }
  }

  /**
   * Advance past a string literal or text block.
   */
  private void skipStringLiteral() {
    if (input.startsWith("\"\"\"", position)) {
      position += 3;
      while (position < length) {
        final char c = input.charAt(position);
        if (c == '\\') {
          position += 2;
        } else if (input.startsWith("\"\"\"", position)) {
          position += 3;
          return;
        } else {
          position++;
        }
      }
      position = length;
    } else {
      skipQuoted('"');
    }
  }

  /**
   * Advance past a single line literal delimited by {@code quote}.
   */
  private void skipQuoted(char quote) {
    position++;
    while (position < length) {
      final char c = input.charAt(position);
      if (c == '\\') {
        position += 2;
      } else if (c == quote || c == '\n') {
        position++;
        return;
      } else {
        position++;
      }
    }
    position = length;
  }
}
