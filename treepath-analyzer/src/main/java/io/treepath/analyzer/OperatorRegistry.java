package io.treepath.analyzer;

import static io.treepath.model.PrimitiveType.*;

import io.treepath.analyzer.ResultRule.Cardinality;
import io.treepath.ast.Node.BinaryOp;
import io.treepath.ast.Node.UnaryOp;
import io.treepath.model.TypeInfo;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Operand and result types of the binary and unary operators. Signatures of an operator are tried
 * in registration order and the first one accepting both operands wins.
 *
 * <p>{@code is} and {@code as} are absent: their right operand is a type name and they are typed
 * against the model.
 */
public final class OperatorRegistry {

  private static final Map<BinaryOp, List<OperatorSignature>> BINARY =
      new EnumMap<>(BinaryOp.class);
  private static final Map<UnaryOp, List<OperatorSignature>> UNARY = new EnumMap<>(UnaryOp.class);

  private static final ResultRule BOOL = ResultRule.fixed(BOOLEAN);
  private static final ResultRule LEFT = ResultRule.preserveInput(Cardinality.SINGLETON);

  static {
    registerArithmetic();
    registerComparison();
    registerLogical();
    registerCollections();

    unary(UnaryOp.PLUS, TypeConstraint.NUMERIC_OR_QUANTITY, LEFT);
    unary(UnaryOp.MINUS, TypeConstraint.NUMERIC_OR_QUANTITY, LEFT);
    unary(UnaryOp.NOT, TypeConstraint.BOOLEAN, BOOL);
  }

  private static void registerArithmetic() {
    ResultRule promote = ResultRule.numericPromotion();
    ResultRule quantity = ResultRule.fixed(QUANTITY);

    binary(BinaryOp.PLUS, TypeConstraint.NUMERIC, TypeConstraint.NUMERIC, promote);
    binary(BinaryOp.PLUS, TypeConstraint.STRING, TypeConstraint.STRING, ResultRule.fixed(STRING));
    binary(BinaryOp.PLUS, TypeConstraint.QUANTITY, TypeConstraint.QUANTITY, quantity);
    binary(BinaryOp.PLUS, TypeConstraint.TEMPORAL, TypeConstraint.QUANTITY, LEFT);

    binary(BinaryOp.MINUS, TypeConstraint.NUMERIC, TypeConstraint.NUMERIC, promote);
    binary(BinaryOp.MINUS, TypeConstraint.QUANTITY, TypeConstraint.QUANTITY, quantity);
    binary(BinaryOp.MINUS, TypeConstraint.TEMPORAL, TypeConstraint.QUANTITY, LEFT);

    binary(BinaryOp.MULTIPLY, TypeConstraint.NUMERIC, TypeConstraint.NUMERIC, promote);
    binary(BinaryOp.MULTIPLY, TypeConstraint.QUANTITY, TypeConstraint.QUANTITY, quantity);

    binary(
        BinaryOp.DIVIDE, TypeConstraint.NUMERIC, TypeConstraint.NUMERIC, ResultRule.fixed(DECIMAL));
    binary(BinaryOp.DIVIDE, TypeConstraint.QUANTITY, TypeConstraint.QUANTITY, quantity);

    binary(BinaryOp.DIV, TypeConstraint.NUMERIC, TypeConstraint.NUMERIC, ResultRule.fixed(INTEGER));
    binary(BinaryOp.MOD, TypeConstraint.NUMERIC, TypeConstraint.NUMERIC, promote);

    binary(BinaryOp.CONCAT, TypeConstraint.STRING, TypeConstraint.STRING, ResultRule.fixed(STRING));
  }

  private static void registerComparison() {
    List<TypeConstraint> ordered =
        List.of(
            TypeConstraint.NUMERIC,
            TypeConstraint.STRING,
            TypeConstraint.DATE_OR_DATETIME,
            TypeConstraint.TIME,
            TypeConstraint.QUANTITY);
    for (BinaryOp op :
        List.of(
            BinaryOp.LESS_THAN,
            BinaryOp.LESS_OR_EQUAL,
            BinaryOp.GREATER_THAN,
            BinaryOp.GREATER_OR_EQUAL)) {
      for (TypeConstraint family : ordered) {
        binary(op, family, family, BOOL);
      }
    }
    for (BinaryOp op :
        List.of(
            BinaryOp.EQUALS, BinaryOp.NOT_EQUALS, BinaryOp.EQUIVALENT, BinaryOp.NOT_EQUIVALENT)) {
      binary(op, TypeConstraint.ANY, TypeConstraint.ANY, BOOL);
    }
  }

  private static void registerLogical() {
    for (BinaryOp op : List.of(BinaryOp.AND, BinaryOp.OR, BinaryOp.XOR, BinaryOp.IMPLIES)) {
      binary(op, TypeConstraint.BOOLEAN, TypeConstraint.BOOLEAN, BOOL);
    }
  }

  private static void registerCollections() {
    binary(BinaryOp.IN, TypeConstraint.ANY, TypeConstraint.ANY, BOOL);
    binary(BinaryOp.CONTAINS, TypeConstraint.ANY, TypeConstraint.ANY, BOOL);
    binary(
        BinaryOp.UNION,
        TypeConstraint.ANY,
        TypeConstraint.ANY,
        ResultRule.computed(
            "union of both operands",
            (left, args) -> TypeInfo.union(List.of(left, args.get(0)), false)));
  }

  private static void binary(
      BinaryOp op, TypeConstraint left, TypeConstraint right, ResultRule result) {
    BINARY
        .computeIfAbsent(op, k -> new ArrayList<>())
        .add(new OperatorSignature(left, right, result));
  }

  private static void unary(UnaryOp op, TypeConstraint operand, ResultRule result) {
    UNARY
        .computeIfAbsent(op, k -> new ArrayList<>())
        .add(new OperatorSignature(operand, null, result));
  }

  // === PUBLIC API ===

  /** First signature of {@code op} accepting both operand types, or null. */
  public static OperatorSignature resolve(BinaryOp op, TypeInfo left, TypeInfo right) {
    for (OperatorSignature signature : signatures(op)) {
      if (signature.accepts(left, right)) {
        return signature;
      }
    }
    return null;
  }

  /** First signature of {@code op} accepting the operand type, or null. */
  public static OperatorSignature resolve(UnaryOp op, TypeInfo operand) {
    for (OperatorSignature signature : UNARY.getOrDefault(op, List.of())) {
      if (signature.accepts(operand, null)) {
        return signature;
      }
    }
    return null;
  }

  public static List<OperatorSignature> signatures(BinaryOp op) {
    return Collections.unmodifiableList(BINARY.getOrDefault(op, List.of()));
  }

  private OperatorRegistry() {
    // Prevent instantiation
  }
}
