package me.christianrobert.polyglotconv.transformer.builder;

import me.christianrobert.polyglotconv.transformer.ast.CollectionNode;
import me.christianrobert.polyglotconv.transformer.ast.ExpressionNode;
import me.christianrobert.polyglotconv.transformer.context.UnhandledConstructException;

import java.util.List;

public class VisitCollection {
  public static String v(CollectionNode node, JavaCodeBuilder b) {
    switch (node.getKind()) {
      case LIST:
      case TUPLE:
        // Tuples have no Java counterpart, both become fixed-size lists
        return "Arrays.asList(" + b.join(node.getElements(), ", ") + ")";
      case MAP:
        return visitMap(node, b);
      default:
        throw new UnhandledConstructException("Unknown collection kind: " + node.getKind());
    }
  }

  private static String visitMap(CollectionNode node, JavaCodeBuilder b) {
    List<ExpressionNode> keys = node.getKeys();
    List<ExpressionNode> values = node.getValues();

    StringBuilder sb = new StringBuilder("new MapObject()");
    for (int i = 0; i < keys.size(); i++) {
      sb.append(".with(")
          .append(b.visit(keys.get(i)))
          .append(", ")
          .append(b.visit(values.get(i)))
          .append(")");
    }
    return sb.toString();
  }
}
