package io.treepath.ast;

import io.treepath.lexer.Range;

/** An environment variable reference. {@code name} excludes the {@code %} prefix and quoting. */
public record EnvironmentVariable(String name, Range range) implements Node {

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitEnvironmentVariable(this);
  }

  @Override
  public String toString() {
    return NodePrinter.print(this);
  }
}
