package io.treepath.ast;

import io.treepath.lexer.Range;

/**
 * Conditional {@code iif(condition, then[, otherwise])}. Branches are evaluated lazily, so this is
 * a node of its own rather than an {@link Invocation}.
 *
 * @param object receiver, an implicit {@code $this} when written bare
 * @param condition boolean criterion
 * @param then result when the criterion is true
 * @param otherwise result otherwise, or null when omitted
 * @param range source span
 */
public record Iif(Node object, Node condition, Node then, Node otherwise, Range range)
    implements Node {

  public boolean hasOtherwise() {
    return otherwise != null;
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitIif(this);
  }

  @Override
  public String toString() {
    return NodePrinter.print(this);
  }
}
