package io.treepath.ast;

import io.treepath.lexer.Range;

/** Placeholder for a region the parser skipped while recovering from an error. */
public record ErrorNode(String message, Range range) implements Node {

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitError(this);
  }

  @Override
  public String toString() {
    return "<error>";
  }
}
