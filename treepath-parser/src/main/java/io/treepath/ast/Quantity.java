package io.treepath.ast;

import io.treepath.lexer.Range;
import java.math.BigDecimal;

/**
 * Quantity literal such as {@code 5 'mg'} or {@code 3 days}.
 *
 * @param value numeric magnitude
 * @param unit unit string or calendar-duration word
 * @param calendarUnit true when the unit was written as a calendar-duration word
 * @param range source span
 */
public record Quantity(BigDecimal value, String unit, boolean calendarUnit, Range range)
    implements Node {

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitQuantity(this);
  }

  @Override
  public String toString() {
    return NodePrinter.print(this);
  }
}
