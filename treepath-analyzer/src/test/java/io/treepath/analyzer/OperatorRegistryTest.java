package io.treepath.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import io.treepath.ast.Node.BinaryOp;
import io.treepath.ast.Node.UnaryOp;
import io.treepath.model.PrimitiveType;
import io.treepath.model.TypeInfo;
import org.junit.jupiter.api.Test;

class OperatorRegistryTest {

  private static final TypeInfo LONG = TypeInfo.system(PrimitiveType.LONG);
  private static final TypeInfo QUANTITY = TypeInfo.system(PrimitiveType.QUANTITY);
  private static final TypeInfo DATE = TypeInfo.system(PrimitiveType.DATE);
  private static final TypeInfo DATETIME = TypeInfo.system(PrimitiveType.DATETIME);
  private static final TypeInfo TIME = TypeInfo.system(PrimitiveType.TIME);

  private static TypeInfo result(BinaryOp op, TypeInfo left, TypeInfo right) {
    OperatorSignature signature = OperatorRegistry.resolve(op, left, right);
    assertNotNull(signature, () -> op + " " + left + " " + right);
    return signature.resultType(left, right);
  }

  @Test
  void numericPromotion() {
    assertEquals(TypeInfo.INTEGER, result(BinaryOp.PLUS, TypeInfo.INTEGER, TypeInfo.INTEGER));
    assertEquals(LONG, result(BinaryOp.MULTIPLY, TypeInfo.INTEGER, LONG));
    assertEquals(TypeInfo.DECIMAL, result(BinaryOp.MINUS, LONG, TypeInfo.DECIMAL));
    assertEquals(TypeInfo.DECIMAL, result(BinaryOp.DIVIDE, TypeInfo.INTEGER, TypeInfo.INTEGER));
    assertEquals(TypeInfo.INTEGER, result(BinaryOp.DIV, TypeInfo.DECIMAL, TypeInfo.DECIMAL));
    assertEquals(QUANTITY, result(BinaryOp.PLUS, QUANTITY, QUANTITY));
  }

  @Test
  void temporalArithmetic() {
    assertEquals(DATETIME, result(BinaryOp.MINUS, DATETIME, QUANTITY));
    assertEquals(TIME, result(BinaryOp.PLUS, TIME, QUANTITY));
    assertNull(OperatorRegistry.resolve(BinaryOp.PLUS, QUANTITY, DATE));
  }

  @Test
  void comparisonsNeedOneFamily() {
    assertEquals(TypeInfo.BOOLEAN, result(BinaryOp.LESS_THAN, TypeInfo.INTEGER, TypeInfo.DECIMAL));
    assertEquals(TypeInfo.BOOLEAN, result(BinaryOp.GREATER_OR_EQUAL, DATE, DATETIME));
    assertNull(OperatorRegistry.resolve(BinaryOp.LESS_THAN, TypeInfo.STRING, TypeInfo.INTEGER));
    assertNull(OperatorRegistry.resolve(BinaryOp.LESS_THAN, TIME, DATE));
  }

  @Test
  void equalityAcceptsAnything() {
    assertEquals(TypeInfo.BOOLEAN, result(BinaryOp.EQUALS, TypeInfo.STRING, TypeInfo.INTEGER));
    assertEquals(TypeInfo.BOOLEAN, result(BinaryOp.NOT_EQUIVALENT, DATE, QUANTITY));
  }

  @Test
  void logicalOperatorsNeedBooleans() {
    assertEquals(TypeInfo.BOOLEAN, result(BinaryOp.XOR, TypeInfo.BOOLEAN, TypeInfo.BOOLEAN));
    assertNull(OperatorRegistry.resolve(BinaryOp.AND, TypeInfo.INTEGER, TypeInfo.BOOLEAN));
  }

  @Test
  void unknownOperandsAreAccepted() {
    assertEquals(
        TypeInfo.ANY_SINGLETON, result(BinaryOp.PLUS, TypeInfo.ANY_SINGLETON, TypeInfo.INTEGER));
    assertEquals(TypeInfo.BOOLEAN, result(BinaryOp.AND, TypeInfo.ANY, TypeInfo.BOOLEAN));
  }

  @Test
  void unionOperatorMergesTypes() {
    TypeInfo merged = result(BinaryOp.UNION, TypeInfo.INTEGER, TypeInfo.STRING);

    assertTrue(merged.isUnion());
    assertFalse(merged.singleton());
    assertEquals(
        TypeInfo.INTEGER.asCollection(),
        result(BinaryOp.UNION, TypeInfo.INTEGER, TypeInfo.INTEGER));
  }

  @Test
  void unaryOperators() {
    OperatorSignature minus = OperatorRegistry.resolve(UnaryOp.MINUS, TypeInfo.DECIMAL);
    assertNotNull(minus);
    assertTrue(minus.isUnary());
    assertEquals(TypeInfo.DECIMAL, minus.resultType(TypeInfo.DECIMAL, null));
    assertNull(OperatorRegistry.resolve(UnaryOp.MINUS, TypeInfo.STRING));
    assertNull(OperatorRegistry.resolve(UnaryOp.NOT, TypeInfo.INTEGER));
  }

  @Test
  void typeOperatorsAreNotRegistered() {
    assertTrue(OperatorRegistry.signatures(BinaryOp.IS).isEmpty());
    assertTrue(OperatorRegistry.signatures(BinaryOp.AS).isEmpty());
  }
}
