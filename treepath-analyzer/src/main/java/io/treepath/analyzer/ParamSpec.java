package io.treepath.analyzer;

/**
 * Specification of a function parameter.
 *
 * @param name parameter name used in messages
 * @param kind how the argument is analyzed
 * @param type accepted argument types
 * @param required whether the argument must be present
 * @param description human-readable description
 */
public record ParamSpec(
    String name, ParamKind kind, TypeConstraint type, boolean required, String description) {

  /** Canonical constructor with validation */
  public ParamSpec {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Parameter name cannot be null or empty");
    }
    if (kind == null) {
      kind = ParamKind.VALUE;
    }
    if (type == null) {
      type = TypeConstraint.ANY;
    }
    if (description == null) {
      description = "";
    }
  }

  /** How an argument is analyzed. */
  public enum ParamKind {
    /** Evaluated once, in the caller's scope */
    VALUE,

    /** Evaluated per element of the receiver, with $this and $index bound */
    EXPRESSION,

    /** A type name */
    TYPE_NAME
  }

  // Factory methods for common parameter patterns

  /** Create a required value parameter */
  public static ParamSpec value(String name, TypeConstraint type, String description) {
    return new ParamSpec(name, ParamKind.VALUE, type, true, description);
  }

  /** Create an optional value parameter */
  public static ParamSpec optionalValue(String name, TypeConstraint type, String description) {
    return new ParamSpec(name, ParamKind.VALUE, type, false, description);
  }

  /** Create a required per-element expression parameter */
  public static ParamSpec expression(String name, TypeConstraint type, String description) {
    return new ParamSpec(name, ParamKind.EXPRESSION, type, true, description);
  }

  /** Create an optional per-element expression parameter */
  public static ParamSpec optionalExpression(
      String name, TypeConstraint type, String description) {
    return new ParamSpec(name, ParamKind.EXPRESSION, type, false, description);
  }

  /** Create a type name parameter */
  public static ParamSpec typeName(String name, String description) {
    return new ParamSpec(name, ParamKind.TYPE_NAME, TypeConstraint.ANY, true, description);
  }

  public boolean isExpression() {
    return kind == ParamKind.EXPRESSION;
  }
}
