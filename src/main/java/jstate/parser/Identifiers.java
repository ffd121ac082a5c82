package jstate.parser;

import java.util.Set;

/**
 * Validation of state, transition, and machine identifiers.
 *
 * <p>Identifiers end up as class, field, and method names in generated Java
 * code, so on top of matching {@code [A-Za-z_][A-Za-z0-9_$]*} they must not be
 * one of Java's reserved keywords or literals. Nor can they be the first
 * segment of a package that generated code refers to by qualified name, since
 * a class or field of that name would hide the package.
 */
public final class Identifiers {

  // JLS 3.9 keywords (including the unused `const`, `goto`, and `_`) and 3.10 literals
  private static final Set<String> RESERVED = Set.of(
    "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char",
    "class", "const", "continue", "default", "do", "double", "else", "enum",
    "extends", "final", "finally", "float", "for", "goto", "if", "implements",
    "import", "instanceof", "int", "interface", "long", "native", "new",
    "package", "private", "protected", "public", "return", "short", "static",
    "strictfp", "super", "switch", "synchronized", "this", "throw", "throws",
    "transient", "try", "void", "volatile", "while", "_",
    "true", "false", "null"
  );

  // Generated code names `java.lang.String`, `java.util.Map`, `jstate.MachineState`, ...
  private static final Set<String> GENERATED_PACKAGE_ROOTS = Set.of("java", "jstate");

  private Identifiers() { }

  /**
   * Can the character start an identifier?
   *
   * @param ch character to check
   * @return whether it is in {@code [A-Za-z_]}
   */
  public static boolean isIdentifierStart(int ch) {
    return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || ch == '_';
  }

  /**
   * Can the character continue an identifier?
   *
   * @param ch character to check
   * @return whether it is in {@code [A-Za-z0-9_$]}
   */
  public static boolean isIdentifierPart(int ch) {
    return isIdentifierStart(ch) || (ch >= '0' && ch <= '9') || ch == '$';
  }

  /**
   * Is the token a reserved word of the Java language?
   *
   * @param token candidate identifier
   * @return whether the token is a keyword or literal
   */
  public static boolean isReserved(String token) {
    return RESERVED.contains(token);
  }

  /**
   * Would a class or field with this name hide a package used by generated code?
   *
   * @param token candidate identifier
   * @return whether the token is the root of such a package
   */
  public static boolean hidesGeneratedPackage(String token) {
    return GENERATED_PACKAGE_ROOTS.contains(token);
  }

  /**
   * Check whether a token is usable as an identifier in a state machine.
   *
   * @param token candidate identifier
   * @return whether the token is well-formed, not reserved, and hides no package
   */
  public static boolean isValid(String token) {
    if (token == null || token.isEmpty() || !isIdentifierStart(token.charAt(0))) {
      return false;
    }
    for (int i = 1; i < token.length(); i++) {
      if (!isIdentifierPart(token.charAt(i))) {
        return false;
      }
    }
    return !isReserved(token) && !hidesGeneratedPackage(token);
  }
}
