package me.christianrobert.polyglotconv.transformer.builder;

import me.christianrobert.polyglotconv.transformer.ast.LiteralNode;
import me.christianrobert.polyglotconv.transformer.context.UnhandledConstructException;

import static me.christianrobert.polyglotconv.transformer.util.JavaLiteralFormatter.floatLiteral;
import static me.christianrobert.polyglotconv.transformer.util.JavaLiteralFormatter.integerLiteral;
import static me.christianrobert.polyglotconv.transformer.util.JavaLiteralFormatter.stringLiteral;

public class VisitLiteral {
  public static String v(LiteralNode node, JavaCodeBuilder b) {
    switch (node.getKind()) {
      case STRING:
        return stringLiteral(node.getStringValue());
      case BYTES:
        return stringLiteral(node.getStringValue()) + ".getBytes(StandardCharsets." + bytesCharset(node.getStringValue()) + ")";
      case INTEGER:
        return integerLiteral(node.getIntegerValue());
      case FLOAT:
        return floatLiteral(node.getFloatValue());
      case BOOLEAN:
        return node.getBooleanValue() ? "true" : "false";
      case NONE:
        return "null";
      default:
        throw new UnhandledConstructException("Don't know how to convert literal of kind " + node.getKind());
    }
  }

  // Bytes are held one char per byte; Latin-1 maps each char back to the same byte value
  private static String bytesCharset(String bytes) {
    for (int i = 0; i < bytes.length(); i++) {
      if (bytes.charAt(i) >= 0x80) {
        return "ISO_8859_1";
      }
    }
    return "UTF_8";
  }
}
