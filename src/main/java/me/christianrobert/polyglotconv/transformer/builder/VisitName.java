package me.christianrobert.polyglotconv.transformer.builder;

import me.christianrobert.polyglotconv.transformer.ast.NameNode;
import me.christianrobert.polyglotconv.transformer.util.JavaTermInfo;

public class VisitName {
  public static String v(NameNode node, JavaCodeBuilder b) {
    // True/False/None/nil map to Java constants, every other name passes through
    return JavaTermInfo.translateName(node.getId());
  }
}
