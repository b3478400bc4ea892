package me.christianrobert.polyglotconv.transformer.util;

import me.christianrobert.polyglotconv.transformer.ast.AssignNode;
import me.christianrobert.polyglotconv.transformer.ast.AttributeNode;
import me.christianrobert.polyglotconv.transformer.ast.BinaryOpNode;
import me.christianrobert.polyglotconv.transformer.ast.CallNode;
import me.christianrobert.polyglotconv.transformer.ast.CollectionNode;
import me.christianrobert.polyglotconv.transformer.ast.CompareNode;
import me.christianrobert.polyglotconv.transformer.ast.ComprehensionGenerator;
import me.christianrobert.polyglotconv.transformer.ast.ExpressionNode;
import me.christianrobert.polyglotconv.transformer.ast.ExpressionVisitor;
import me.christianrobert.polyglotconv.transformer.ast.KeywordArgument;
import me.christianrobert.polyglotconv.transformer.ast.LambdaNode;
import me.christianrobert.polyglotconv.transformer.ast.ListComprehensionNode;
import me.christianrobert.polyglotconv.transformer.ast.LiteralNode;
import me.christianrobert.polyglotconv.transformer.ast.NameNode;
import me.christianrobert.polyglotconv.transformer.ast.SubscriptNode;
import me.christianrobert.polyglotconv.transformer.ast.UnaryOpNode;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Formats expression trees (and the ANTLR parse trees they are built from) into
 * human-readable text for diagnostics.
 *
 * <p>Indented form ({@link #format(ExpressionNode)}):</p>
 * <pre>
 * Call
 *   function: Attribute .filter
 *     owner: Name t
 *   arg: Lambda (x)
 *     body: Compare [&gt;]
 *       left: Name x
 *       comparator: Literal INTEGER 1
 * </pre>
 *
 * <p>Single-line form ({@link #dump(ExpressionNode)}), used in failure reasons:</p>
 * <pre>
 * Call(Attribute(Name(t), filter), [Lambda([x], Compare(Name(x), [&gt;], [Literal(1)]))])
 * </pre>
 */
public class ExpressionTreeFormatter {

  private static final String INDENT = "  ";
  private static final int MAX_TEXT_LENGTH = 50;

  private ExpressionTreeFormatter() {
  }

  /**
   * Formats an expression tree into indented text, one node per line.
   *
   * @param node Root of the expression tree
   * @return Formatted string representation
   */
  public static String format(ExpressionNode node) {
    if (node == null) {
      return "(null tree)";
    }
    StringBuilder sb = new StringBuilder();
    formatNode(null, node, 0, sb);
    return sb.toString();
  }

  /**
   * Formats an expression tree on a single line.
   */
  public static String dump(ExpressionNode node) {
    if (node == null) {
      return "null";
    }
    return node.accept(DUMP);
  }

  /**
   * Formats an ANTLR parse tree into indented text.
   *
   * @param tree Root of the parse tree
   * @return Formatted string representation
   */
  public static String format(ParseTree tree) {
    if (tree == null) {
      return "(null tree)";
    }
    StringBuilder sb = new StringBuilder();
    formatParseTree(tree, 0, sb);
    return sb.toString();
  }

  // ========== Expression tree ==========

  private static void formatNode(String role, ExpressionNode node, int depth, StringBuilder sb) {
    for (int i = 0; i < depth; i++) {
      sb.append(INDENT);
    }
    if (role != null) {
      sb.append(role).append(": ");
    }
    sb.append(node.accept(LABEL)).append("\n");

    for (Child child : node.accept(CHILDREN)) {
      formatNode(child.role, child.node, depth + 1, sb);
    }
  }

  private static final class Child {
    final String role;
    final ExpressionNode node;

    Child(String role, ExpressionNode node) {
      this.role = role;
      this.node = node;
    }
  }

  private static final ExpressionVisitor<String> LABEL = new ExpressionVisitor<String>() {
    @Override
    public String visitLiteral(LiteralNode node) {
      if (node.getKind() == LiteralNode.Kind.NONE) {
        return "Literal NONE";
      }
      return "Literal " + node.getKind() + " " + escapeAndTruncate(String.valueOf(node.getValue()));
    }

    @Override
    public String visitName(NameNode node) {
      return "Name " + node.getId();
    }

    @Override
    public String visitAttribute(AttributeNode node) {
      return "Attribute ." + node.getMember();
    }

    @Override
    public String visitCall(CallNode node) {
      return "Call";
    }

    @Override
    public String visitSubscript(SubscriptNode node) {
      return "Subscript " + node.getSliceKind() + (node.hasStep() ? " (step)" : "");
    }

    @Override
    public String visitCollection(CollectionNode node) {
      return "Collection " + node.getKind();
    }

    @Override
    public String visitLambda(LambdaNode node) {
      return "Lambda (" + String.join(", ", node.getParameters()) + ")";
    }

    @Override
    public String visitUnaryOp(UnaryOpNode node) {
      return "UnaryOp " + node.getOperator().getSymbol();
    }

    @Override
    public String visitBinaryOp(BinaryOpNode node) {
      return "BinaryOp " + node.getOperator().getSymbol();
    }

    @Override
    public String visitCompare(CompareNode node) {
      return "Compare " + node.getOperators().stream()
          .map(op -> op.getSymbol())
          .collect(Collectors.toList());
    }

    @Override
    public String visitAssign(AssignNode node) {
      return "Assign";
    }

    @Override
    public String visitListComprehension(ListComprehensionNode node) {
      return "ListComprehension";
    }
  };

  private static final ExpressionVisitor<List<Child>> CHILDREN = new ExpressionVisitor<List<Child>>() {
    @Override
    public List<Child> visitLiteral(LiteralNode node) {
      return List.of();
    }

    @Override
    public List<Child> visitName(NameNode node) {
      return List.of();
    }

    @Override
    public List<Child> visitAttribute(AttributeNode node) {
      return List.of(new Child("owner", node.getOwner()));
    }

    @Override
    public List<Child> visitCall(CallNode node) {
      List<Child> children = new ArrayList<>();
      children.add(new Child("function", node.getFunction()));
      for (ExpressionNode arg : node.getArguments()) {
        children.add(new Child("arg", arg));
      }
      for (KeywordArgument keyword : node.getKeywords()) {
        children.add(new Child(keyword.getName(), keyword.getValue()));
      }
      for (ExpressionNode star : node.getStarArguments()) {
        children.add(new Child("*", star));
      }
      for (ExpressionNode doubleStar : node.getDoubleStarArguments()) {
        children.add(new Child("**", doubleStar));
      }
      return children;
    }

    @Override
    public List<Child> visitSubscript(SubscriptNode node) {
      List<Child> children = new ArrayList<>();
      children.add(new Child("value", node.getValue()));
      switch (node.getSliceKind()) {
        case INDEX:
          children.add(new Child("index", node.getIndex()));
          break;
        case SLICE:
          addIfPresent(children, "lower", node.getLower());
          addIfPresent(children, "upper", node.getUpper());
          addIfPresent(children, "step", node.getStep());
          break;
        default:
          for (SubscriptNode dimension : node.getDimensions()) {
            children.add(new Child("dimension", dimension));
          }
      }
      return children;
    }

    @Override
    public List<Child> visitCollection(CollectionNode node) {
      List<Child> children = new ArrayList<>();
      if (node.getKind() == CollectionNode.Kind.MAP) {
        for (int i = 0; i < node.getKeys().size(); i++) {
          children.add(new Child("key", node.getKeys().get(i)));
          children.add(new Child("value", node.getValues().get(i)));
        }
      } else {
        for (ExpressionNode element : node.getElements()) {
          children.add(new Child("element", element));
        }
      }
      return children;
    }

    @Override
    public List<Child> visitLambda(LambdaNode node) {
      return List.of(new Child("body", node.getBody()));
    }

    @Override
    public List<Child> visitUnaryOp(UnaryOpNode node) {
      return List.of(new Child("operand", node.getOperand()));
    }

    @Override
    public List<Child> visitBinaryOp(BinaryOpNode node) {
      return List.of(new Child("left", node.getLeft()), new Child("right", node.getRight()));
    }

    @Override
    public List<Child> visitCompare(CompareNode node) {
      List<Child> children = new ArrayList<>();
      children.add(new Child("left", node.getLeft()));
      for (ExpressionNode comparator : node.getComparators()) {
        children.add(new Child("comparator", comparator));
      }
      return children;
    }

    @Override
    public List<Child> visitAssign(AssignNode node) {
      List<Child> children = new ArrayList<>();
      for (ExpressionNode target : node.getTargets()) {
        children.add(new Child("target", target));
      }
      children.add(new Child("value", node.getValue()));
      return children;
    }

    @Override
    public List<Child> visitListComprehension(ListComprehensionNode node) {
      List<Child> children = new ArrayList<>();
      children.add(new Child("element", node.getElement()));
      for (ComprehensionGenerator generator : node.getGenerators()) {
        children.add(new Child("for", generator.getTarget()));
        children.add(new Child("in", generator.getIterable()));
        for (ExpressionNode condition : generator.getConditions()) {
          children.add(new Child("if", condition));
        }
      }
      return children;
    }
  };

  private static void addIfPresent(List<Child> children, String role, ExpressionNode node) {
    if (node != null) {
      children.add(new Child(role, node));
    }
  }

  private static final ExpressionVisitor<String> DUMP = new ExpressionVisitor<String>() {
    @Override
    public String visitLiteral(LiteralNode node) {
      if (node.getKind() == LiteralNode.Kind.STRING || node.getKind() == LiteralNode.Kind.BYTES) {
        return "Literal(" + JavaLiteralFormatter.stringLiteral(node.getStringValue()) + ")";
      }
      return "Literal(" + node.getValue() + ")";
    }

    @Override
    public String visitName(NameNode node) {
      return "Name(" + node.getId() + ")";
    }

    @Override
    public String visitAttribute(AttributeNode node) {
      return "Attribute(" + node.getOwner().accept(this) + ", " + node.getMember() + ")";
    }

    @Override
    public String visitCall(CallNode node) {
      StringBuilder sb = new StringBuilder("Call(");
      sb.append(node.getFunction().accept(this)).append(", ").append(list(node.getArguments()));
      for (KeywordArgument keyword : node.getKeywords()) {
        sb.append(", ").append(keyword.getName()).append("=").append(keyword.getValue().accept(this));
      }
      for (ExpressionNode star : node.getStarArguments()) {
        sb.append(", *").append(star.accept(this));
      }
      for (ExpressionNode doubleStar : node.getDoubleStarArguments()) {
        sb.append(", **").append(doubleStar.accept(this));
      }
      return sb.append(")").toString();
    }

    @Override
    public String visitSubscript(SubscriptNode node) {
      String value = node.getValue().accept(this);
      switch (node.getSliceKind()) {
        case INDEX:
          return "Subscript(" + value + ", Index(" + node.getIndex().accept(this) + "))";
        case SLICE:
          return "Subscript(" + value + ", Slice(" + optional(node.getLower()) + ", " + optional(node.getUpper())
              + (node.hasStep() ? ", " + optional(node.getStep()) : "") + "))";
        default:
          return "Subscript(" + value + ", ExtSlice(" + node.getDimensions().size() + " dims))";
      }
    }

    @Override
    public String visitCollection(CollectionNode node) {
      if (node.getKind() == CollectionNode.Kind.MAP) {
        return "Map(" + list(node.getKeys()) + ", " + list(node.getValues()) + ")";
      }
      String kind = node.getKind() == CollectionNode.Kind.LIST ? "List" : "Tuple";
      return kind + "(" + list(node.getElements()) + ")";
    }

    @Override
    public String visitLambda(LambdaNode node) {
      return "Lambda(" + node.getParameters() + ", " + node.getBody().accept(this) + ")";
    }

    @Override
    public String visitUnaryOp(UnaryOpNode node) {
      return "UnaryOp(" + node.getOperator().getSymbol() + ", " + node.getOperand().accept(this) + ")";
    }

    @Override
    public String visitBinaryOp(BinaryOpNode node) {
      return "BinaryOp(" + node.getLeft().accept(this) + ", " + node.getOperator().getSymbol() + ", "
          + node.getRight().accept(this) + ")";
    }

    @Override
    public String visitCompare(CompareNode node) {
      return "Compare(" + node.getLeft().accept(this) + ", "
          + node.getOperators().stream().map(op -> op.getSymbol()).collect(Collectors.toList()) + ", "
          + list(node.getComparators()) + ")";
    }

    @Override
    public String visitAssign(AssignNode node) {
      return "Assign(" + list(node.getTargets()) + ", " + node.getValue().accept(this) + ")";
    }

    @Override
    public String visitListComprehension(ListComprehensionNode node) {
      StringBuilder sb = new StringBuilder("ListComp(");
      sb.append(node.getElement().accept(this));
      for (ComprehensionGenerator generator : node.getGenerators()) {
        sb.append(", for ").append(generator.getTarget().accept(this))
            .append(" in ").append(generator.getIterable().accept(this));
        for (ExpressionNode condition : generator.getConditions()) {
          sb.append(" if ").append(condition.accept(this));
        }
      }
      return sb.append(")").toString();
    }

    private String list(List<ExpressionNode> nodes) {
      return nodes.stream().map(n -> n.accept(this)).collect(Collectors.joining(", ", "[", "]"));
    }

    private String optional(ExpressionNode node) {
      return node == null ? "None" : node.accept(this);
    }
  };

  // ========== ANTLR parse tree ==========

  private static void formatParseTree(ParseTree tree, int depth, StringBuilder sb) {
    for (int i = 0; i < depth; i++) {
      sb.append(INDENT);
    }

    if (tree instanceof TerminalNode) {
      sb.append("\"").append(escapeAndTruncate(tree.getText())).append("\"\n");

    } else if (tree instanceof ParserRuleContext) {
      ParserRuleContext ctx = (ParserRuleContext) tree;
      sb.append(getRuleName(ctx));

      // Show text snippet for small nodes (helpful for identification)
      if (ctx.getChildCount() <= 2) {
        String text = ctx.getText();
        if (text.length() <= 30) {
          sb.append(" [").append(escapeAndTruncate(text)).append("]");
        }
      }
      sb.append("\n");

      for (int i = 0; i < ctx.getChildCount(); i++) {
        formatParseTree(ctx.getChild(i), depth + 1, sb);
      }

    } else {
      sb.append("(unknown: ").append(tree.getClass().getSimpleName()).append(")\n");
    }
  }

  private static String getRuleName(ParserRuleContext ctx) {
    String className = ctx.getClass().getSimpleName();
    if (className.endsWith("Context")) {
      className = className.substring(0, className.length() - "Context".length());
    }
    return className;
  }

  private static String escapeAndTruncate(String text) {
    if (text == null) {
      return "";
    }

    text = text.replace("\n", "\\n")
               .replace("\r", "\\r")
               .replace("\t", "\\t");

    if (text.length() > MAX_TEXT_LENGTH) {
      text = text.substring(0, MAX_TEXT_LENGTH) + "...";
    }

    return text;
  }
}
