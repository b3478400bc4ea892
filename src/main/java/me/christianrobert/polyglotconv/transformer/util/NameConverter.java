package me.christianrobert.polyglotconv.transformer.util;

import java.util.Map;

/**
 * Converts host-language (snake_case) names to Java naming conventions.
 */
public class NameConverter {

  /**
   * ReQL methods whose host-language spelling carries a trailing underscore only to dodge
   * a host keyword. The Java driver spells them without it.
   */
  private static final Map<String, String> HOST_KEYWORD_CLASHES = Map.of(
      "or_", "or",
      "and_", "and");

  private NameConverter() {
  }

  /**
   * Converts a snake_case name to UpperCamelCase.
   *
   * <p>Each underscore-separated part is title-cased (first letter of every letter run
   * upper case, the rest lower case), then the parts are joined.</p>
   *
   * <p>Examples:
   * <ul>
   *   <li>get_field -> GetField</li>
   *   <li>to_iso8601 -> ToIso8601</li>
   *   <li>regression_1133 -> Regression1133</li>
   *   <li>ISO8601 -> Iso8601</li>
   * </ul>
   *
   * @param name snake_case name
   * @return UpperCamelCase name (empty for null/empty input)
   */
  public static String camel(String name) {
    if (name == null || name.isEmpty()) {
      return "";
    }
    StringBuilder sb = new StringBuilder(name.length());
    for (String part : name.split("_")) {
      sb.append(titleCase(part));
    }
    return sb.toString();
  }

  /**
   * Converts a snake_case name to lowerCamelCase ("dromedary case").
   *
   * <p>Examples: get_field -> getField, ISO8601 -> iso8601, table -> table</p>
   */
  public static String dromedary(String name) {
    String camel = camel(name);
    if (camel.isEmpty()) {
      return camel;
    }
    return Character.toLowerCase(camel.charAt(0)) + camel.substring(1);
  }

  /**
   * Converts a ReQL attribute name to the Java driver's method name.
   *
   * <p>Applies the host keyword clash table, then dromedary case, then escapes names
   * colliding with Java keywords or {@code Object} methods.</p>
   *
   * <p>Examples: or_ -> or, get_field -> getField, default -> default_, do -> do_</p>
   */
  public static String reqlMethodName(String attribute) {
    String initial = HOST_KEYWORD_CLASHES.get(attribute);
    if (initial == null) {
      initial = dromedary(attribute);
    }
    return JavaTermInfo.escapeIdentifier(initial);
  }

  /**
   * Derives a test class name from a test file path.
   *
   * <p>Strips everything from the first dot, replaces path separators with underscores
   * and camel-cases the result: {@code regression/1133.yaml -> Regression1133},
   * {@code math_logic/add.yaml -> MathLogicAdd}.</p>
   */
  public static String moduleName(String filename) {
    if (filename == null || filename.isEmpty()) {
      return "";
    }
    int dot = filename.indexOf('.');
    String base = dot >= 0 ? filename.substring(0, dot) : filename;
    return camel(base.replace('/', '_'));
  }

  private static String titleCase(String part) {
    StringBuilder sb = new StringBuilder(part.length());
    boolean previousIsLetter = false;
    for (int i = 0; i < part.length(); i++) {
      char c = part.charAt(i);
      if (Character.isLetter(c)) {
        sb.append(previousIsLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
        previousIsLetter = true;
      } else {
        sb.append(c);
        previousIsLetter = false;
      }
    }
    return sb.toString();
  }
}
