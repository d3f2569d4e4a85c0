package io.treepath.ast;

import java.math.BigDecimal;
import java.util.stream.Collectors;

/**
 * Renders a tree back to compact expression text with every binary and unary application
 * parenthesized, e.g. {@code (1 + (2 * 3))}. Implicit {@code $this} receivers are omitted, so
 * {@code Patient.name} prints as written.
 */
public final class NodePrinter implements NodeVisitor<String> {

  private static final NodePrinter INSTANCE = new NodePrinter();

  private NodePrinter() {}

  public static String print(Node node) {
    return node == null ? "" : node.accept(INSTANCE);
  }

  @Override
  public String visitLiteral(Literal node) {
    return switch (node.kind()) {
      case STRING -> "'" + escape((String) node.value()) + "'";
      case DATE, DATETIME, TIME -> "@" + node.value();
      case DECIMAL -> ((BigDecimal) node.value()).toPlainString();
      case INTEGER, BOOLEAN -> String.valueOf(node.value());
    };
  }

  @Override
  public String visitIdentifier(Identifier node) {
    return node.name();
  }

  @Override
  public String visitSpecialVariable(SpecialVariable node) {
    return node.name();
  }

  @Override
  public String visitEnvironmentVariable(EnvironmentVariable node) {
    return isPlainName(node.name()) ? "%" + node.name() : "%`" + node.name() + "`";
  }

  @Override
  public String visitMember(Member node) {
    return receiver(node.object()) + name(node.name());
  }

  @Override
  public String visitInvocation(Invocation node) {
    String args =
        node.arguments().stream().map(NodePrinter::print).collect(Collectors.joining(", "));
    return receiver(node.object()) + name(node.name()) + "(" + args + ")";
  }

  @Override
  public String visitIndex(Index node) {
    return print(node.object()) + "[" + print(node.index()) + "]";
  }

  @Override
  public String visitBinary(Binary node) {
    return "(" + print(node.left()) + " " + node.op().symbol() + " " + print(node.right()) + ")";
  }

  @Override
  public String visitUnary(Unary node) {
    String sep = node.op() == Node.UnaryOp.NOT ? " " : "";
    return "(" + node.op().symbol() + sep + print(node.operand()) + ")";
  }

  @Override
  public String visitIif(Iif node) {
    StringBuilder sb = new StringBuilder(receiver(node.object()));
    sb.append("iif(").append(print(node.condition())).append(", ").append(print(node.then()));
    if (node.hasOtherwise()) {
      sb.append(", ").append(print(node.otherwise()));
    }
    return sb.append(")").toString();
  }

  @Override
  public String visitStandaloneCall(StandaloneCall node) {
    return node.name() + "()";
  }

  @Override
  public String visitQuantity(Quantity node) {
    String unit = node.calendarUnit() ? node.unit() : "'" + escape(node.unit()) + "'";
    return node.value().toPlainString() + " " + unit;
  }

  @Override
  public String visitEmptyCollection(EmptyCollection node) {
    return "{}";
  }

  @Override
  public String visitError(ErrorNode node) {
    return "<error>";
  }

  @Override
  public String visitIncomplete(IncompleteNode node) {
    return receiver(node.receiver()) + "<incomplete>";
  }

  private static String receiver(Node object) {
    if (object instanceof SpecialVariable v && v.implicit()) {
      return "";
    }
    return print(object) + ".";
  }

  private static String name(String name) {
    return isPlainName(name) ? name : "`" + name + "`";
  }

  private static boolean isPlainName(String name) {
    if (name.isEmpty() || !(Character.isLetter(name.charAt(0)) || name.charAt(0) == '_')) {
      return false;
    }
    for (int i = 1; i < name.length(); i++) {
      char c = name.charAt(i);
      if (!(Character.isLetterOrDigit(c) || c == '_')) {
        return false;
      }
    }
    return true;
  }

  private static String escape(String s) {
    return s.replace("\\", "\\\\").replace("'", "\\'");
  }
}
