package io.treepath.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Static type and cardinality of an expression.
 *
 * <p>A type is either a single type, built-in or supplied by the model oracle, or a union of
 * several non-union choices. Unions always have base type {@link PrimitiveType#ANY}. {@code
 * singleton} is true when the expression yields at most one value.
 *
 * @param baseType primitive base; ANY for unknown values, complex model types and unions
 * @param singleton whether the expression yields at most one value
 * @param namespace model namespace, e.g. {@code System} or {@code FHIR}; may be null
 * @param name type name within its namespace; may be null
 * @param choices alternatives of a union, empty otherwise
 * @param modelContext opaque oracle data, passed back to the oracle and never inspected here
 */
public record TypeInfo(
    PrimitiveType baseType,
    boolean singleton,
    String namespace,
    String name,
    List<TypeInfo> choices,
    Object modelContext) {

  /** A collection of unknown values. */
  public static final TypeInfo ANY = new TypeInfo(PrimitiveType.ANY, false, null, null, null, null);

  /** A single unknown value. */
  public static final TypeInfo ANY_SINGLETON =
      new TypeInfo(PrimitiveType.ANY, true, null, null, null, null);

  public static final TypeInfo BOOLEAN = system(PrimitiveType.BOOLEAN);
  public static final TypeInfo STRING = system(PrimitiveType.STRING);
  public static final TypeInfo INTEGER = system(PrimitiveType.INTEGER);
  public static final TypeInfo DECIMAL = system(PrimitiveType.DECIMAL);

  public TypeInfo {
    Objects.requireNonNull(baseType, "baseType");
    choices = choices == null ? List.of() : List.copyOf(choices);
    if (!choices.isEmpty()) {
      if (baseType != PrimitiveType.ANY) {
        throw new IllegalArgumentException("Union types must have base type Any");
      }
      for (TypeInfo choice : choices) {
        if (choice.isUnion()) {
          throw new IllegalArgumentException("Union choices cannot be unions: " + choice);
        }
      }
    }
  }

  /** A single value of a built-in type. */
  public static TypeInfo system(PrimitiveType type) {
    if (type == PrimitiveType.ANY) {
      return ANY_SINGLETON;
    }
    return new TypeInfo(type, true, PrimitiveType.SYSTEM_NAMESPACE, type.typeName(), null, null);
  }

  /** A collection of a built-in type. */
  public static TypeInfo systemCollection(PrimitiveType type) {
    return system(type).asCollection();
  }

  /**
   * A type supplied by the model.
   *
   * @param namespace model namespace
   * @param name type name
   * @param baseType primitive base for model primitives, ANY for complex types
   * @param singleton cardinality
   * @param modelContext opaque oracle data
   */
  public static TypeInfo model(
      String namespace,
      String name,
      PrimitiveType baseType,
      boolean singleton,
      Object modelContext) {
    return new TypeInfo(baseType, singleton, namespace, name, null, modelContext);
  }

  /**
   * Combines types into a union. Nested unions are flattened and duplicate choices dropped; a
   * single remaining choice is returned as a plain type.
   *
   * @param types types to combine; must not be empty
   * @param singleton cardinality of the result
   */
  public static TypeInfo union(Collection<TypeInfo> types, boolean singleton) {
    List<TypeInfo> flat = new ArrayList<>();
    for (TypeInfo type : types) {
      List<TypeInfo> parts = type.isUnion() ? type.choices() : List.of(type);
      for (TypeInfo part : parts) {
        TypeInfo normalized = part.withSingleton(true);
        if (flat.stream().noneMatch(normalized::sameType)) {
          flat.add(normalized);
        }
      }
    }
    if (flat.isEmpty()) {
      throw new IllegalArgumentException("Union requires at least one type");
    }
    if (flat.size() == 1) {
      return flat.get(0).withSingleton(singleton);
    }
    if (flat.stream().anyMatch(TypeInfo::isAny)) {
      return singleton ? ANY_SINGLETON : ANY;
    }
    return new TypeInfo(PrimitiveType.ANY, singleton, null, null, flat, null);
  }

  public boolean isUnion() {
    return !choices.isEmpty();
  }

  /** Unknown type: base ANY without a name and without choices. */
  public boolean isAny() {
    return baseType == PrimitiveType.ANY && name == null && choices.isEmpty();
  }

  /** A named model type without a primitive base. */
  public boolean isComplex() {
    return baseType == PrimitiveType.ANY && name != null && choices.isEmpty();
  }

  public TypeInfo withSingleton(boolean value) {
    if (value == singleton) {
      return this;
    }
    return new TypeInfo(baseType, value, namespace, name, choices, modelContext);
  }

  public TypeInfo asSingleton() {
    return withSingleton(true);
  }

  public TypeInfo asCollection() {
    return withSingleton(false);
  }

  /** Namespace-qualified name, or the base type name for anonymous types. */
  public String qualifiedName() {
    if (name == null) {
      return baseType.typeName();
    }
    return namespace == null ? name : namespace + "." + name;
  }

  /**
   * Compares types ignoring cardinality and model context.
   *
   * @param other type to compare with
   * @return true when both denote the same type
   */
  public boolean sameType(TypeInfo other) {
    if (other == null || baseType != other.baseType) {
      return false;
    }
    if (!Objects.equals(namespace, other.namespace) || !Objects.equals(name, other.name)) {
      return false;
    }
    if (choices.size() != other.choices.size()) {
      return false;
    }
    for (int i = 0; i < choices.size(); i++) {
      if (!choices.get(i).sameType(other.choices.get(i))) {
        return false;
      }
    }
    return true;
  }

  /** Readable form used in diagnostics, e.g. {@code FHIR.HumanName[]} or {@code (A | B)}. */
  public String display() {
    String base = qualifiedName();
    if (isUnion()) {
      base =
          choices.stream()
              .map(TypeInfo::qualifiedName)
              .collect(Collectors.joining(" | ", "(", ")"));
    }
    return singleton ? base : base + "[]";
  }

  @Override
  public String toString() {
    return display();
  }
}
