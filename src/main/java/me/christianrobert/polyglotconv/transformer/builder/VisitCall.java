package me.christianrobert.polyglotconv.transformer.builder;

import me.christianrobert.polyglotconv.transformer.ast.CallNode;
import me.christianrobert.polyglotconv.transformer.ast.KeywordArgument;
import me.christianrobert.polyglotconv.transformer.context.UnhandledConstructException;
import me.christianrobert.polyglotconv.transformer.util.ExpressionTreeFormatter;

import static me.christianrobert.polyglotconv.transformer.util.JavaLiteralFormatter.stringLiteral;

public class VisitCall {
  public static String v(CallNode node, JavaCodeBuilder b) {

    // f(*args) / f(**kwargs) have no static Java counterpart
    if (node.hasSplatArguments()) {
      throw new UnhandledConstructException(
          "Variadic (*args) and keyword splat (**kwargs) arguments are not supported",
          ExpressionTreeFormatter.dump(node), "call");
    }

    StringBuilder sb = new StringBuilder();
    sb.append(b.parenthesize(node.getFunction(), EmissionMode.PRECEDENCE_PRIMARY));
    sb.append("(").append(b.join(node.getArguments(), ", ")).append(")");

    // Keyword arguments become optional arguments on the returned term
    for (KeywordArgument keyword : node.getKeywords()) {
      sb.append(".optArg(")
          .append(stringLiteral(keyword.getName()))
          .append(", ")
          .append(b.visit(keyword.getValue()))
          .append(")");
    }
    return sb.toString();
  }
}
