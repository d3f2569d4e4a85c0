package io.treepath.analyzer;

import io.treepath.model.PrimitiveType;
import io.treepath.model.TypeInfo;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;

/**
 * How the result type of a function or operator is derived. Rules receive the input type (the
 * receiver of a function, the left operand of an operator) and the argument types in order.
 */
public sealed interface ResultRule {

  TypeInfo apply(TypeInfo input, List<TypeInfo> arguments);

  /** Result cardinality relative to the input. */
  enum Cardinality {
    SINGLETON,
    COLLECTION,
    SAME_AS_INPUT
  }

  static ResultRule fixed(PrimitiveType type) {
    return new Fixed(type, true);
  }

  static ResultRule fixedCollection(PrimitiveType type) {
    return new Fixed(type, false);
  }

  static ResultRule preserveInput(Cardinality cardinality) {
    return new PreserveInput(cardinality);
  }

  static ResultRule numericPromotion() {
    return new NumericPromotion();
  }

  static ResultRule computed(
      String description, BiFunction<TypeInfo, List<TypeInfo>, TypeInfo> fn) {
    return new Computed(description, fn);
  }

  /** A fixed built-in type. */
  record Fixed(PrimitiveType type, boolean singleton) implements ResultRule {
    @Override
    public TypeInfo apply(TypeInfo input, List<TypeInfo> arguments) {
      return TypeInfo.system(type).withSingleton(singleton);
    }
  }

  /** The input type with the given cardinality. */
  record PreserveInput(Cardinality cardinality) implements ResultRule {
    @Override
    public TypeInfo apply(TypeInfo input, List<TypeInfo> arguments) {
      return switch (cardinality) {
        case SINGLETON -> input.asSingleton();
        case COLLECTION -> input.asCollection();
        case SAME_AS_INPUT -> input;
      };
    }
  }

  /**
   * Widest numeric type among the input and arguments: Quantity over Decimal over Long over
   * Integer. Unions contribute their numeric choices; an unknown operand makes the result unknown.
   */
  record NumericPromotion() implements ResultRule {
    @Override
    public TypeInfo apply(TypeInfo input, List<TypeInfo> arguments) {
      List<TypeInfo> operands = new ArrayList<>();
      if (input != null) {
        operands.add(input);
      }
      operands.addAll(arguments);
      PrimitiveType widest = null;
      for (TypeInfo operand : operands) {
        PrimitiveType base = numericBase(operand);
        if (base == null) {
          return TypeInfo.ANY_SINGLETON;
        }
        widest = widest == null ? base : wider(widest, base);
      }
      return widest == null ? TypeInfo.ANY_SINGLETON : TypeInfo.system(widest);
    }

    private static PrimitiveType numericBase(TypeInfo type) {
      if (type == null) {
        return null;
      }
      if (type.isUnion()) {
        PrimitiveType widest = null;
        for (TypeInfo choice : type.choices()) {
          PrimitiveType base = numericBase(choice);
          if (base != null) {
            widest = widest == null ? base : wider(widest, base);
          }
        }
        return widest;
      }
      PrimitiveType base = type.baseType();
      return base.isNumeric() || base == PrimitiveType.QUANTITY ? base : null;
    }

    private static PrimitiveType wider(PrimitiveType a, PrimitiveType b) {
      return rank(a) >= rank(b) ? a : b;
    }

    private static int rank(PrimitiveType type) {
      return switch (type) {
        case INTEGER -> 0;
        case LONG -> 1;
        case DECIMAL -> 2;
        case QUANTITY -> 3;
        default -> -1;
      };
    }
  }

  /** A result computed from the input and argument types. */
  record Computed(String description, BiFunction<TypeInfo, List<TypeInfo>, TypeInfo> function)
      implements ResultRule {
    @Override
    public TypeInfo apply(TypeInfo input, List<TypeInfo> arguments) {
      TypeInfo result = function.apply(input, arguments);
      return result == null ? TypeInfo.ANY : result;
    }

    @Override
    public String toString() {
      return "Computed[" + description + "]";
    }
  }
}
