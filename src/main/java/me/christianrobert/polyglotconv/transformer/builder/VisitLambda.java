package me.christianrobert.polyglotconv.transformer.builder;

import me.christianrobert.polyglotconv.transformer.ast.LambdaNode;

import java.util.List;

public class VisitLambda {
  public static String v(LambdaNode node, JavaCodeBuilder b) {
    List<String> parameters = node.getParameters();

    // Single parameter: x -> body; none or several: (a, b) -> body
    String head = parameters.size() == 1
        ? parameters.get(0)
        : "(" + String.join(", ", parameters) + ")";

    return head + " -> " + b.visit(node.getBody());
  }
}
