package io.treepath.ast;

import io.treepath.lexer.Range;

/** The empty collection literal {@code {}}. */
public record EmptyCollection(Range range) implements Node {

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitEmptyCollection(this);
  }

  @Override
  public String toString() {
    return "{}";
  }
}
