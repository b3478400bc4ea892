package me.christianrobert.polyglotconv.transformer.builder;

import me.christianrobert.polyglotconv.transformer.ast.CallNode;
import me.christianrobert.polyglotconv.transformer.ast.ComprehensionGenerator;
import me.christianrobert.polyglotconv.transformer.ast.ExpressionNode;
import me.christianrobert.polyglotconv.transformer.ast.ListComprehensionNode;
import me.christianrobert.polyglotconv.transformer.ast.NameNode;
import me.christianrobert.polyglotconv.transformer.context.UnhandledConstructException;
import me.christianrobert.polyglotconv.transformer.util.ExpressionTreeFormatter;

import java.util.List;

/**
 * Emits {@code [elt for x in range(...)]} as an {@code IntStream} pipeline.
 *
 * <p>Only the counting form is supported: one generator, no conditions, a plain name
 * as loop variable and a one or two argument {@code range}/{@code xrange} call as iterable.</p>
 */
public class VisitListComprehension {
  public static String v(ListComprehensionNode node, JavaCodeBuilder b) {
    List<ComprehensionGenerator> generators = node.getGenerators();
    if (generators.size() != 1) {
      throw new UnhandledConstructException(
          "Only list comprehensions with a single generator are supported, got " + generators.size());
    }

    ComprehensionGenerator generator = generators.get(0);
    if (!generator.getConditions().isEmpty()) {
      throw new UnhandledConstructException("Filtered list comprehensions (... if ...) are not supported");
    }
    if (!(generator.getTarget() instanceof NameNode)) {
      throw new UnhandledConstructException(
          "List comprehension target must be a simple name",
          ExpressionTreeFormatter.dump(generator.getTarget()), "comprehension target");
    }

    String range = rangeStream(generator.getIterable(), b);
    String variable = b.visit(generator.getTarget());
    String element = b.visit(node.getElement());

    return range + ".boxed().map(" + variable + " -> " + element + ").collect(Collectors.toList())";
  }

  private static String rangeStream(ExpressionNode iterable, JavaCodeBuilder b) {
    if (!isRangeCall(iterable)) {
      throw new UnhandledConstructException(
          "List comprehensions can only iterate over range()",
          ExpressionTreeFormatter.dump(iterable), "comprehension iterable");
    }

    List<ExpressionNode> arguments = ((CallNode) iterable).getArguments();
    if (arguments.size() == 1) {
      return "IntStream.range(0, " + b.visit(arguments.get(0)) + ")";
    }
    return "IntStream.range(" + b.visit(arguments.get(0)) + ", " + b.visit(arguments.get(1)) + ")";
  }

  private static boolean isRangeCall(ExpressionNode iterable) {
    if (!(iterable instanceof CallNode)) {
      return false;
    }
    CallNode call = (CallNode) iterable;
    if (!(call.getFunction() instanceof NameNode) || call.hasSplatArguments() || !call.getKeywords().isEmpty()) {
      return false;
    }
    String function = ((NameNode) call.getFunction()).getId();
    int arity = call.getArguments().size();
    return function.endsWith("range") && arity >= 1 && arity <= 2;
  }
}
