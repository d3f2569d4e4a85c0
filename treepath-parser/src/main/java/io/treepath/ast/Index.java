package io.treepath.ast;

import io.treepath.lexer.Range;

/** Indexer: {@code object[index]}. */
public record Index(Node object, Node index, Range range) implements Node {

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitIndex(this);
  }

  @Override
  public String toString() {
    return NodePrinter.print(this);
  }
}
