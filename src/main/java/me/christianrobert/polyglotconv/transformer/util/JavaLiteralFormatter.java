package me.christianrobert.polyglotconv.transformer.util;

import me.christianrobert.polyglotconv.transformer.context.UnhandledConstructException;

import java.math.BigInteger;

/**
 * Formats host-language literal values as Java source literals.
 */
public class JavaLiteralFormatter {

  private static final BigInteger INT_MAX = BigInteger.valueOf(Integer.MAX_VALUE);

  private JavaLiteralFormatter() {
  }

  /**
   * Formats a string as a double-quoted Java string literal.
   *
   * <p>Quotes and backslashes are escaped, common control characters use their short
   * escapes, every other character outside printable ASCII becomes a {@code \\uXXXX}
   * escape so the generated source is plain ASCII. Line terminators are never written as
   * unicode escapes: Java translates those before lexing.</p>
   *
   * @param value string to format
   * @return Java string literal including the surrounding quotes
   */
  public static String stringLiteral(String value) {
    StringBuilder sb = new StringBuilder(value.length() + 2);
    sb.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        case '\b':
          sb.append("\\b");
          break;
        case '\f':
          sb.append("\\f");
          break;
        default:
          if (c < 0x20 || c > 0x7e) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    sb.append('"');
    return sb.toString();
  }

  /**
   * Formats an integer literal.
   *
   * <p>Values outside the 32-bit signed range get a {@code .0} suffix, turning them into
   * double literals: an undecorated literal that large would not compile as {@code int},
   * and the driver treats all numbers as doubles anyway.</p>
   *
   * <p>Examples: 42 -> 42, 2147483647 -> 2147483647, 2147483648 -> 2147483648.0</p>
   */
  public static String integerLiteral(BigInteger value) {
    String text = value.toString();
    if (value.abs().compareTo(INT_MAX) > 0) {
      return text + ".0";
    }
    return text;
  }

  /**
   * Formats a float literal using the shortest representation that reads back as the
   * same double.
   *
   * @throws UnhandledConstructException for infinities and NaN, which have no literal form
   */
  public static String floatLiteral(double value) {
    if (Double.isInfinite(value) || Double.isNaN(value)) {
      throw new UnhandledConstructException("No Java literal for float value " + value);
    }
    return Double.toString(value);
  }
}
