package me.christianrobert.polyglotconv.transformer.util;

import java.util.Map;
import java.util.Set;

/**
 * Lexical tables of the Java target.
 *
 * <p>Method names produced from ReQL attribute names must not collide with Java reserved
 * words (the driver API could not declare them) or with the methods every Java object
 * inherits from {@code java.lang.Object}. Colliding names get a trailing underscore, the
 * spelling the Java driver uses ({@code default_}, {@code do_}).</p>
 */
public class JavaTermInfo {

  /**
   * Java keywords plus the reserved literals {@code true}, {@code false} and {@code null}.
   */
  public static final Set<String> JAVA_KEYWORDS = Set.of(
      "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class",
      "const", "continue", "default", "do", "double", "else", "enum", "extends", "final",
      "finally", "float", "for", "goto", "if", "implements", "import", "instanceof", "int",
      "interface", "long", "native", "new", "package", "private", "protected", "public",
      "return", "short", "static", "strictfp", "super", "switch", "synchronized", "this",
      "throw", "throws", "transient", "try", "void", "volatile", "while",
      "true", "false", "null");

  /**
   * Methods declared by {@code java.lang.Object}.
   */
  public static final Set<String> OBJECT_METHODS = Set.of(
      "clone", "equals", "finalize", "getClass", "hashCode", "notify", "notifyAll",
      "toString", "wait");

  /**
   * Host-language constant names and their Java spelling.
   * Some producers emit these as plain names instead of constant nodes.
   */
  public static final Map<String, String> CONSTANT_NAMES = Map.of(
      "True", "true",
      "False", "false",
      "None", "null",
      "nil", "null");

  public static final String ESCAPE_SUFFIX = "_";

  private JavaTermInfo() {
  }

  /**
   * Maps {@code True/False/None/nil} to their Java spelling; other names pass through.
   */
  public static String translateName(String name) {
    return CONSTANT_NAMES.getOrDefault(name, name);
  }

  public static boolean needsEscape(String identifier) {
    return JAVA_KEYWORDS.contains(identifier) || OBJECT_METHODS.contains(identifier);
  }

  /**
   * Appends the escape suffix to identifiers that collide with a keyword or an
   * {@code Object} method.
   *
   * <p>Examples: {@code default -> default_}, {@code toString -> toString_},
   * {@code filter -> filter}</p>
   */
  public static String escapeIdentifier(String identifier) {
    return needsEscape(identifier) ? identifier + ESCAPE_SUFFIX : identifier;
  }
}
