package io.treepath.ast;

import io.treepath.lexer.Range;
import java.math.BigDecimal;

/**
 * A literal value.
 *
 * <p>Values by kind: STRING is the decoded {@link String}, INTEGER a {@link Long}, DECIMAL a {@link
 * BigDecimal}, BOOLEAN a {@link Boolean}, and DATE, DATETIME and TIME the literal text without the
 * leading {@code @}.
 */
public record Literal(LiteralKind kind, Object value, Range range) implements Node {

  public Literal {
    if (kind == null || value == null) {
      throw new IllegalArgumentException("Literal kind and value are required");
    }
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitLiteral(this);
  }

  @Override
  public String toString() {
    return NodePrinter.print(this);
  }
}
