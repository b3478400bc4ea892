package me.christianrobert.polyglotconv.transformer.builder;

import me.christianrobert.polyglotconv.transformer.ast.AssignNode;
import me.christianrobert.polyglotconv.transformer.ast.ExpressionNode;
import me.christianrobert.polyglotconv.transformer.ast.NameNode;
import me.christianrobert.polyglotconv.transformer.context.ConversionContext;
import me.christianrobert.polyglotconv.transformer.context.UnhandledConstructException;
import me.christianrobert.polyglotconv.transformer.util.ExpressionTreeFormatter;

/**
 * Emits a local variable declaration for {@code name = value}.
 *
 * <p>The declared type depends on the value: ReQL terms are declared with the context's
 * ReQL term type and emitted in ReQL mode, everything else with the opaque type.</p>
 */
public class VisitAssign {
  public static String v(AssignNode node, JavaCodeBuilder b) {
    if (node.getTargets().size() != 1) {
      throw new UnhandledConstructException(
          "We only support assigning to one variable at a time, got " + node.getTargets().size() + " targets");
    }

    ExpressionNode target = node.getTargets().get(0);
    if (!(target instanceof NameNode)) {
      throw new UnhandledConstructException(
          "Only simple names can be assigned to", ExpressionTreeFormatter.dump(target), "assignment target");
    }
    String name = ((NameNode) target).getId();

    ConversionContext context = b.getContext();
    ExpressionNode value = node.getValue();
    if (context.isReql(value)) {
      String code = b.withMode(EmissionMode.REQL).visit(value);
      return context.getReqlTermType() + " " + name + " = " + code + ";";
    }
    String code = b.withMode(EmissionMode.PLAIN).visit(value);
    return context.getOpaqueType() + " " + name + " = " + code + ";";
  }
}
