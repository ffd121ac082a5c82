package jstate.codegen;

/**
 * Where generated source lands in the surrounding text.
 *
 * @param indent prefix for every generated line after the first
 * @param lineSeparator line separator of the surrounding text
 * @param nested are the generated classes members of another type?
 */
public record SourceLayout(String indent, String lineSeparator, boolean nested) {

  /**
   * Source on its own, at the top level of a compilation unit.
   */
  public static final SourceLayout TOP_LEVEL = new SourceLayout("", "\n", false);
}
