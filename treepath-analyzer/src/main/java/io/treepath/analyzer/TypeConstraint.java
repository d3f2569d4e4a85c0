package io.treepath.analyzer;

import io.treepath.model.PrimitiveType;
import io.treepath.model.TypeInfo;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Set of primitive types an operand or argument may have, e.g. {@code Integer | Decimal |
 * Quantity}.
 *
 * <p>A type satisfies the constraint when it is unknown, when it converts implicitly to one of the
 * alternatives, or, for a union, when any of its choices does. Complex model types only satisfy
 * {@link #ANY}.
 */
public record TypeConstraint(Set<PrimitiveType> alternatives) {

  public static final TypeConstraint ANY = of(PrimitiveType.ANY);
  public static final TypeConstraint BOOLEAN = of(PrimitiveType.BOOLEAN);
  public static final TypeConstraint STRING = of(PrimitiveType.STRING);
  public static final TypeConstraint INTEGER = of(PrimitiveType.INTEGER);
  public static final TypeConstraint NUMERIC =
      of(PrimitiveType.INTEGER, PrimitiveType.LONG, PrimitiveType.DECIMAL);
  public static final TypeConstraint NUMERIC_OR_QUANTITY =
      of(PrimitiveType.INTEGER, PrimitiveType.LONG, PrimitiveType.DECIMAL, PrimitiveType.QUANTITY);
  public static final TypeConstraint QUANTITY = of(PrimitiveType.QUANTITY);
  public static final TypeConstraint DATE_OR_DATETIME =
      of(PrimitiveType.DATE, PrimitiveType.DATETIME);
  public static final TypeConstraint TEMPORAL =
      of(PrimitiveType.DATE, PrimitiveType.DATETIME, PrimitiveType.TIME);
  public static final TypeConstraint TIME = of(PrimitiveType.TIME);

  public TypeConstraint {
    if (alternatives == null || alternatives.isEmpty()) {
      throw new IllegalArgumentException("A type constraint needs at least one alternative");
    }
    alternatives = Collections.unmodifiableSet(EnumSet.copyOf(alternatives));
  }

  public static TypeConstraint of(PrimitiveType first, PrimitiveType... rest) {
    return new TypeConstraint(EnumSet.of(first, rest));
  }

  public boolean isAny() {
    return alternatives.contains(PrimitiveType.ANY);
  }

  /** Checks whether {@code type} satisfies this constraint. */
  public boolean accepts(TypeInfo type) {
    if (isAny()) {
      return true;
    }
    if (type.isUnion()) {
      return type.choices().stream().anyMatch(this::accepts);
    }
    if (type.isAny()) {
      return true;
    }
    if (type.isComplex()) {
      return false;
    }
    return alternatives.stream().anyMatch(alt -> type.baseType().isConvertibleTo(alt));
  }

  @Override
  public String toString() {
    return alternatives.stream().map(PrimitiveType::typeName).collect(Collectors.joining(" | "));
  }
}
