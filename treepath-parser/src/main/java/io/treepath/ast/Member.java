package io.treepath.ast;

import io.treepath.lexer.Range;

/** Property navigation: {@code object.name}. */
public record Member(Node object, String name, Range range) implements Node {

  public Member {
    if (object == null || name == null) {
      throw new IllegalArgumentException("Member requires an object and a name");
    }
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitMember(this);
  }

  @Override
  public String toString() {
    return NodePrinter.print(this);
  }
}
