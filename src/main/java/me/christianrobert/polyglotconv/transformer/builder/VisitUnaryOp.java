package me.christianrobert.polyglotconv.transformer.builder;

import me.christianrobert.polyglotconv.transformer.ast.UnaryOpNode;
import me.christianrobert.polyglotconv.transformer.context.UnhandledConstructException;

public class VisitUnaryOp {
  public static String v(UnaryOpNode node, JavaCodeBuilder b) {
    String operator;
    switch (node.getOperator()) {
      case NEGATE:
        operator = "-";
        break;
      case PLUS:
        operator = "+";
        break;
      case NOT:
        operator = "!";
        break;
      case INVERT:
        operator = "~";
        break;
      default:
        throw new UnhandledConstructException("No Java operator for unary " + node.getOperator());
    }

    // - -x would lex as the decrement operator
    if (node.getOperand() instanceof UnaryOpNode) {
      return operator + "(" + b.visit(node.getOperand()) + ")";
    }
    return operator + b.parenthesize(node.getOperand(), EmissionMode.PRECEDENCE_UNARY);
  }
}
