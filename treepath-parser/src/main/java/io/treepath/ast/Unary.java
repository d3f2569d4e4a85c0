package io.treepath.ast;

import io.treepath.lexer.Range;

/** Prefix operator application. */
public record Unary(UnaryOp op, Node operand, Range range) implements Node {

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitUnary(this);
  }

  @Override
  public String toString() {
    return NodePrinter.print(this);
  }
}
