package io.treepath.analyzer;

import io.treepath.model.PrimitiveType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Type signature of a built-in function.
 *
 * @param name function name, matched case-sensitively
 * @param category catalogue section the function belongs to
 * @param input accepted receiver types
 * @param parameters parameters in order
 * @param result how the result type is derived
 * @param description human-readable description
 */
public record FunctionSignature(
    String name,
    FunctionCategory category,
    TypeConstraint input,
    List<ParamSpec> parameters,
    ResultRule result,
    String description) {

  /** Canonical constructor with validation */
  public FunctionSignature {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Function name cannot be null or empty");
    }
    if (category == null) {
      category = FunctionCategory.UTILITY;
    }
    if (input == null) {
      input = TypeConstraint.ANY;
    }
    parameters = parameters == null ? Collections.emptyList() : List.copyOf(parameters);
    if (result == null) {
      throw new IllegalArgumentException("Function " + name + " needs a result rule");
    }
    if (description == null) {
      description = "";
    }
    boolean optionalSeen = false;
    for (ParamSpec param : parameters) {
      if (!param.required()) {
        optionalSeen = true;
      } else if (optionalSeen) {
        throw new IllegalArgumentException(
            "Function " + name + ": required parameter " + param.name() + " follows optional");
      }
    }
  }

  /** Catalogue sections */
  public enum FunctionCategory {
    EXISTENCE,
    FILTERING,
    SUBSETTING,
    COMBINING,
    CONVERSION,
    STRING,
    MATH,
    TREE,
    UTILITY,
    AGGREGATE,
    TYPE
  }

  /** Whether any argument is evaluated per element with $this bound. */
  public boolean isLambda() {
    return parameters.stream().anyMatch(ParamSpec::isExpression);
  }

  public int minArity() {
    return (int) parameters.stream().filter(ParamSpec::required).count();
  }

  public int maxArity() {
    return parameters.size();
  }

  public boolean acceptsArity(int count) {
    return count >= minArity() && count <= maxArity();
  }

  /** Parameter at {@code index}, or null when the function takes fewer arguments. */
  public ParamSpec parameter(int index) {
    return index < parameters.size() ? parameters.get(index) : null;
  }

  /** Arity as shown in messages: {@code 1}, {@code 0..1}. */
  public String arityText() {
    return minArity() == maxArity() ? String.valueOf(minArity()) : minArity() + ".." + maxArity();
  }

  /** Builder for fluent construction of FunctionSignature */
  public static Builder builder(String name) {
    return new Builder(name);
  }

  public static class Builder {
    private final String name;
    private FunctionCategory category = FunctionCategory.UTILITY;
    private TypeConstraint input = TypeConstraint.ANY;
    private final List<ParamSpec> parameters = new ArrayList<>();
    private ResultRule result;
    private String description;

    Builder(String name) {
      this.name = name;
    }

    public Builder category(FunctionCategory category) {
      this.category = category;
      return this;
    }

    public Builder input(TypeConstraint input) {
      this.input = input;
      return this;
    }

    public Builder param(ParamSpec param) {
      parameters.add(param);
      return this;
    }

    public Builder value(String name, TypeConstraint type, String description) {
      return param(ParamSpec.value(name, type, description));
    }

    public Builder optionalValue(String name, TypeConstraint type, String description) {
      return param(ParamSpec.optionalValue(name, type, description));
    }

    public Builder expression(String name, TypeConstraint type, String description) {
      return param(ParamSpec.expression(name, type, description));
    }

    public Builder returns(ResultRule result) {
      this.result = result;
      return this;
    }

    public Builder returns(PrimitiveType type) {
      return returns(ResultRule.fixed(type));
    }

    public Builder returnsCollection(PrimitiveType type) {
      return returns(ResultRule.fixedCollection(type));
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public FunctionSignature build() {
      return new FunctionSignature(name, category, input, parameters, result, description);
    }
  }
}
