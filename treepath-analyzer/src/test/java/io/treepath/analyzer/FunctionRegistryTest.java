package io.treepath.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import io.treepath.analyzer.FunctionSignature.FunctionCategory;
import io.treepath.analyzer.ParamSpec.ParamKind;
import io.treepath.ast.Invocation;
import io.treepath.model.PrimitiveType;
import io.treepath.model.TypeInfo;
import io.treepath.parser.Parser;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for the FunctionRegistry to ensure the built-in functions are properly defined. */
class FunctionRegistryTest {

  @Nested
  class Catalogue {

    @Test
    void everyCategoryIsPopulated() {
      for (FunctionCategory category : FunctionCategory.values()) {
        assertFalse(FunctionRegistry.getFunctions(category).isEmpty(), category.name());
      }
    }

    @Test
    void commonFunctionsRegistered() {
      List<String> expected =
          List.of(
              "empty", "exists", "all", "count", "distinct", "where", "select", "repeat",
              "first", "last", "tail", "skip", "take", "union", "combine", "toString",
              "convertsToInteger", "substring", "matches", "abs", "round", "children",
              "descendants", "trace", "not", "aggregate", "sum", "ofType");
      for (String name : expected) {
        assertTrue(FunctionRegistry.exists(name), "Missing function: " + name);
      }
      assertNull(FunctionRegistry.get("frobnicate"));
    }

    @Test
    void lambdaFunctionsMatchParser() {
      assertEquals(Parser.LAMBDA_FUNCTIONS, FunctionRegistry.lambdaFunctionNames());
    }

    @Test
    void typeFunctionsTakeTypeNames() {
      for (String name : Invocation.TYPE_FUNCTIONS) {
        FunctionSignature signature = FunctionRegistry.get(name);
        assertNotNull(signature, name);
        assertEquals(ParamKind.TYPE_NAME, signature.parameter(0).kind());
        assertEquals(FunctionCategory.TYPE, signature.category());
      }
    }

    @Test
    void allFunctionsAreListed() {
      int byCategory = 0;
      for (FunctionCategory category : FunctionCategory.values()) {
        byCategory += FunctionRegistry.getFunctions(category).size();
      }
      assertEquals(FunctionRegistry.getAllFunctions().size(), byCategory);
      assertThrows(
          UnsupportedOperationException.class,
          () -> FunctionRegistry.getAllFunctions().clear());
    }
  }

  @Nested
  class Signatures {

    @Test
    void substringArity() {
      FunctionSignature substring = FunctionRegistry.get("substring");
      assertEquals(1, substring.minArity());
      assertEquals(2, substring.maxArity());
      assertEquals("1..2", substring.arityText());
      assertTrue(substring.acceptsArity(2));
      assertFalse(substring.acceptsArity(3));
      assertEquals(TypeConstraint.STRING, substring.input());
    }

    @Test
    void whereTakesBooleanCriteria() {
      FunctionSignature where = FunctionRegistry.get("where");
      ParamSpec criteria = where.parameter(0);

      assertTrue(where.isLambda());
      assertEquals(ParamKind.EXPRESSION, criteria.kind());
      assertEquals(TypeConstraint.BOOLEAN, criteria.type());
      assertTrue(criteria.required());
      assertNull(where.parameter(1));
    }

    @Test
    void existsCriteriaIsOptional() {
      FunctionSignature exists = FunctionRegistry.get("exists");
      assertTrue(exists.acceptsArity(0));
      assertTrue(exists.acceptsArity(1));
      assertTrue(exists.isLambda());
    }

    @Test
    void booleanAggregatesRequireBooleanInput() {
      for (String name : List.of("allTrue", "anyTrue", "allFalse", "anyFalse")) {
        assertEquals(TypeConstraint.BOOLEAN, FunctionRegistry.get(name).input(), name);
      }
    }

    @Test
    void conversionResults() {
      TypeInfo result =
          FunctionRegistry.get("toDecimal").result().apply(TypeInfo.STRING, List.of());
      assertEquals(TypeInfo.DECIMAL, result);
      TypeInfo check =
          FunctionRegistry.get("convertsToDate").result().apply(TypeInfo.STRING, List.of());
      assertEquals(TypeInfo.BOOLEAN, check);
    }

    @Test
    void sumPromotesInput() {
      ResultRule sum = FunctionRegistry.get("sum").result();
      assertEquals(TypeInfo.DECIMAL, sum.apply(TypeInfo.DECIMAL.asCollection(), List.of()));
      assertEquals(
          TypeInfo.system(PrimitiveType.QUANTITY),
          sum.apply(TypeInfo.systemCollection(PrimitiveType.QUANTITY), List.of()));
    }
  }

  @Nested
  class Validation {

    @Test
    void requiredAfterOptionalIsRejected() {
      FunctionSignature.Builder builder =
          FunctionSignature.builder("broken")
              .optionalValue("a", TypeConstraint.ANY, "")
              .value("b", TypeConstraint.ANY, "")
              .returns(PrimitiveType.BOOLEAN);

      assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void resultRuleIsRequired() {
      assertThrows(
          IllegalArgumentException.class, () -> FunctionSignature.builder("noResult").build());
    }
  }
}
