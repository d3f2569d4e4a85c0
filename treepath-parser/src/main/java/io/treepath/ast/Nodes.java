package io.treepath.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/** Structural helpers over {@link Node} trees. */
public final class Nodes {

  private static final NodeVisitor<List<Node>> CHILDREN = new ChildrenVisitor();

  private Nodes() {}

  /** Direct children of {@code node} in evaluation order. */
  public static List<Node> children(Node node) {
    return node.accept(CHILDREN);
  }

  /** All nodes of the tree rooted at {@code root}, parents before children. */
  public static List<Node> preOrder(Node root) {
    List<Node> out = new ArrayList<>();
    Deque<Node> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      Node node = stack.pop();
      out.add(node);
      List<Node> kids = children(node);
      for (int i = kids.size() - 1; i >= 0; i--) {
        stack.push(kids.get(i));
      }
    }
    return out;
  }

  /** First {@link IncompleteNode} in pre-order, or null. */
  public static IncompleteNode findIncomplete(Node root) {
    for (Node node : preOrder(root)) {
      if (node instanceof IncompleteNode incomplete) {
        return incomplete;
      }
    }
    return null;
  }

  private static final class ChildrenVisitor implements NodeVisitor<List<Node>> {

    @Override
    public List<Node> visitLiteral(Literal node) {
      return List.of();
    }

    @Override
    public List<Node> visitIdentifier(Identifier node) {
      return List.of();
    }

    @Override
    public List<Node> visitSpecialVariable(SpecialVariable node) {
      return List.of();
    }

    @Override
    public List<Node> visitEnvironmentVariable(EnvironmentVariable node) {
      return List.of();
    }

    @Override
    public List<Node> visitMember(Member node) {
      return List.of(node.object());
    }

    @Override
    public List<Node> visitInvocation(Invocation node) {
      List<Node> out = new ArrayList<>(node.arguments().size() + 1);
      out.add(node.object());
      out.addAll(node.arguments());
      return out;
    }

    @Override
    public List<Node> visitIndex(Index node) {
      return List.of(node.object(), node.index());
    }

    @Override
    public List<Node> visitBinary(Binary node) {
      return List.of(node.left(), node.right());
    }

    @Override
    public List<Node> visitUnary(Unary node) {
      return List.of(node.operand());
    }

    @Override
    public List<Node> visitIif(Iif node) {
      return node.hasOtherwise()
          ? List.of(node.object(), node.condition(), node.then(), node.otherwise())
          : List.of(node.object(), node.condition(), node.then());
    }

    @Override
    public List<Node> visitStandaloneCall(StandaloneCall node) {
      return List.of();
    }

    @Override
    public List<Node> visitQuantity(Quantity node) {
      return List.of();
    }

    @Override
    public List<Node> visitEmptyCollection(EmptyCollection node) {
      return List.of();
    }

    @Override
    public List<Node> visitError(ErrorNode node) {
      return List.of();
    }

    @Override
    public List<Node> visitIncomplete(IncompleteNode node) {
      return List.of(node.receiver());
    }
  }
}
