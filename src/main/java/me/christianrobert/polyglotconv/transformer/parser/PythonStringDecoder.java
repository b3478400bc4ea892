package me.christianrobert.polyglotconv.transformer.parser;

import me.christianrobert.polyglotconv.transformer.context.UnhandledConstructException;

import java.util.Locale;

/**
 * Decodes the text of a STRING token into its value.
 *
 * <p>Handles the {@code r}, {@code b} and {@code u} prefixes, single, double and triple
 * quotes, and the host-language escape sequences. Unknown escapes are kept verbatim,
 * backslash included, as the host language does.</p>
 *
 * <p>Bytes values are returned one char per byte. {@code \\u} and {@code \\U} escapes are
 * only recognized in text strings.</p>
 */
public class PythonStringDecoder {

  /**
   * A decoded string token.
   */
  public static class DecodedString {
    private final String value;
    private final boolean bytes;

    DecodedString(String value, boolean bytes) {
      this.value = value;
      this.bytes = bytes;
    }

    public String getValue() {
      return value;
    }

    public boolean isBytes() {
      return bytes;
    }
  }

  private PythonStringDecoder() {
  }

  public static DecodedString decode(String token) {
    int prefixLength = 0;
    while (prefixLength < token.length() && token.charAt(prefixLength) != '\'' && token.charAt(prefixLength) != '"') {
      prefixLength++;
    }
    String prefix = token.substring(0, prefixLength).toLowerCase(Locale.ROOT);
    boolean raw = prefix.contains("r");
    boolean bytes = prefix.contains("b");

    String quoted = token.substring(prefixLength);
    int quoteLength = quoted.startsWith("'''") || quoted.startsWith("\"\"\"") ? 3 : 1;
    if (quoted.length() < 2 * quoteLength) {
      throw new UnhandledConstructException("Malformed string literal", token, "string literal");
    }
    String body = quoted.substring(quoteLength, quoted.length() - quoteLength);

    String value = raw ? body : unescape(body, bytes, token);
    if (bytes) {
      checkBytes(value, token);
    }
    return new DecodedString(value, bytes);
  }

  private static String unescape(String body, boolean bytes, String token) {
    StringBuilder sb = new StringBuilder(body.length());
    int i = 0;
    while (i < body.length()) {
      char c = body.charAt(i);
      if (c != '\\' || i + 1 >= body.length()) {
        sb.append(c);
        i++;
        continue;
      }

      char next = body.charAt(i + 1);
      i += 2;
      switch (next) {
        case '\n':
          // line continuation inside the literal
          break;
        case '\r':
          if (i < body.length() && body.charAt(i) == '\n') {
            i++;
          }
          break;
        case '\\':
          sb.append('\\');
          break;
        case '\'':
          sb.append('\'');
          break;
        case '"':
          sb.append('"');
          break;
        case 'a':
          sb.append('\007');
          break;
        case 'b':
          sb.append('\b');
          break;
        case 'f':
          sb.append('\f');
          break;
        case 'n':
          sb.append('\n');
          break;
        case 'r':
          sb.append('\r');
          break;
        case 't':
          sb.append('\t');
          break;
        case 'v':
          sb.append('\013');
          break;
        case 'x':
          sb.appendCodePoint(hex(body, i, 2, token));
          i += 2;
          break;
        case 'u':
          if (bytes) {
            sb.append('\\').append(next);
          } else {
            sb.appendCodePoint(hex(body, i, 4, token));
            i += 4;
          }
          break;
        case 'U':
          if (bytes) {
            sb.append('\\').append(next);
          } else {
            sb.appendCodePoint(hex(body, i, 8, token));
            i += 8;
          }
          break;
        default:
          if (next >= '0' && next <= '7') {
            // up to three octal digits, the first one already consumed
            int end = i;
            while (end < body.length() && end < i + 2 && body.charAt(end) >= '0' && body.charAt(end) <= '7') {
              end++;
            }
            sb.appendCodePoint(Integer.parseInt(next + body.substring(i, end), 8));
            i = end;
          } else {
            sb.append('\\').append(next);
          }
      }
    }
    return sb.toString();
  }

  private static int hex(String body, int start, int digits, String token) {
    if (start + digits > body.length()) {
      throw new UnhandledConstructException("Truncated escape sequence", token, "string literal");
    }
    try {
      int codePoint = Integer.parseInt(body.substring(start, start + digits), 16);
      if (!Character.isValidCodePoint(codePoint)) {
        throw new UnhandledConstructException("Invalid code point in escape sequence", token, "string literal");
      }
      return codePoint;
    } catch (NumberFormatException e) {
      throw new UnhandledConstructException("Invalid escape sequence", token, "string literal", e);
    }
  }

  private static void checkBytes(String value, String token) {
    for (int i = 0; i < value.length(); i++) {
      if (value.charAt(i) > 0xff) {
        throw new UnhandledConstructException("Bytes literal can only contain byte values", token, "string literal");
      }
    }
  }
}
