package io.treepath.ast;

import io.treepath.lexer.Range;

/**
 * Placeholder where input ended before a member name or operand. Completion tooling reads the type
 * of {@code receiver} to suggest what may follow.
 *
 * @param receiver expression the missing part applies to; an implicit {@code $this} at the start of
 *     an expression
 * @param range empty span at the end of input
 */
public record IncompleteNode(Node receiver, Range range) implements Node {

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitIncomplete(this);
  }

  @Override
  public String toString() {
    return NodePrinter.print(this);
  }
}
