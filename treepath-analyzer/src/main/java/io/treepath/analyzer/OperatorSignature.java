package io.treepath.analyzer;

import io.treepath.model.TypeInfo;
import java.util.List;

/**
 * One accepted operand combination of an operator. Unary operators leave {@code right} null.
 *
 * @param left accepted left (or only) operand types
 * @param right accepted right operand types, null for unary operators
 * @param result result rule, applied to the left operand and a list holding the right operand
 */
public record OperatorSignature(TypeConstraint left, TypeConstraint right, ResultRule result) {

  public boolean isUnary() {
    return right == null;
  }

  public boolean accepts(TypeInfo leftType, TypeInfo rightType) {
    return left.accepts(leftType) && (right == null || right.accepts(rightType));
  }

  public TypeInfo resultType(TypeInfo leftType, TypeInfo rightType) {
    return result.apply(leftType, rightType == null ? List.of() : List.of(rightType));
  }
}
