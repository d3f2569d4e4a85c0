package io.treepath.ast;

import io.treepath.lexer.Range;

/**
 * Binary operator application. For {@link BinaryOp#IS} and {@link BinaryOp#AS} the right operand is
 * an {@link Identifier} naming the type.
 */
public record Binary(BinaryOp op, Node left, Node right, Range range) implements Node {

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitBinary(this);
  }

  @Override
  public String toString() {
    return NodePrinter.print(this);
  }
}
