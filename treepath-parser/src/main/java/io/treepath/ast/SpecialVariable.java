package io.treepath.ast;

import io.treepath.lexer.Range;

/**
 * One of {@code $this}, {@code $index} or {@code $total}.
 *
 * @param name variable name including the {@code $}
 * @param implicit true when the parser synthesised this receiver for a bare identifier or call
 * @param range source span; for implicit receivers an empty span at the start of the wrapped node
 */
public record SpecialVariable(String name, boolean implicit, Range range) implements Node {

  public static final String THIS = "$this";
  public static final String INDEX = "$index";
  public static final String TOTAL = "$total";

  /** Creates the implicit {@code $this} receiver positioned at {@code at}. */
  public static SpecialVariable implicitThis(Range at) {
    return new SpecialVariable(THIS, true, Range.at(at.start()));
  }

  public boolean isThis() {
    return THIS.equals(name);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitSpecialVariable(this);
  }

  @Override
  public String toString() {
    return name;
  }
}
