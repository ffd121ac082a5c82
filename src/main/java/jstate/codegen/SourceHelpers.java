package jstate.codegen;

/**
 * Superclass containing utility methods for emitting Java source.
 *
 * <p>Generated source replaces a block that may itself be indented, so every
 * line after the first is prefixed with the indentation of the block. The
 * first line is not: it is written at the position where the block started,
 * after whatever indentation was already there. Lines are joined with the
 * line separator of the surrounding text.
 *
 * <p>Types are always written fully qualified, since state names are free to
 * hide simple names like {@code String} or {@code Override}.
 */
class SourceHelpers {

  private static final String INDENT_UNIT = "  ";

  protected static final String STRING = "java.lang.String";
  protected static final String OVERRIDE = "@java.lang.Override";

  /**
   * Buffer into which source is emitted.
   */
  private final StringBuilder out = new StringBuilder();

  /**
   * Placement of the generated source.
   */
  private final SourceLayout layout;

  /**
   * Current nesting depth of braces.
   */
  private int depth = 0;

  protected SourceHelpers(SourceLayout layout) {
    this.layout = layout;
  }

  /**
   * Emit a full line of code at the current nesting depth.
   *
   * @param code contents of the line (without indentation or newline)
   */
  protected void line(String code) {
    if (out.length() > 0) {
      out.append(layout.lineSeparator()).append(layout.indent());
    }
    out.append(INDENT_UNIT.repeat(depth)).append(code);
  }

  /**
   * Emit an empty line.
   */
  protected void blankLine() {
    out.append(layout.lineSeparator());
  }

  /**
   * Header of a class declared at the outermost level of the generated
   * source. Inside another type, such classes must be {@code static} so that
   * they need no enclosing instance.
   *
   * @param header class header, starting with its modifiers
   * @return header to emit
   */
  protected String outerClass(String header) {
    return layout.nested() ? "static " + header : header;
  }

  /**
   * Emit a line ending in an opening brace, and nest further lines.
   *
   * @param header code before the brace
   */
  protected void open(String header) {
    line(header + " {");
    depth++;
  }

  /**
   * Close the innermost brace opened with {@link #open(String)}.
   */
  protected void close() {
    depth--;
    line("}");
  }

  /**
   * Emit a method returning a single expression.
   *
   * @param annotation annotation line (or {@code null} for none)
   * @param signature method signature
   * @param expression returned expression
   */
  protected void returningMethod(String annotation, String signature, String expression) {
    if (annotation != null) {
      line(annotation);
    }
    open(signature);
    line("return " + expression + ";");
    close();
  }

  /**
   * Quote a string as a Java literal.
   *
   * <p>Only identifiers are ever quoted, so there is nothing to escape.
   *
   * @param value identifier to quote
   * @return string literal
   */
  protected static String literal(String value) {
    return "\"" + value + "\"";
  }

  /**
   * Source emitted so far.
   */
  protected String render() {
    return out.toString();
  }
}
