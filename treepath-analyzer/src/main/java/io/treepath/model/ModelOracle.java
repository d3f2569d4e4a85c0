package io.treepath.model;

import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * Source of domain type knowledge consulted by the type analyzer.
 *
 * <p>Every operation may be backed by slow or lazy I/O and therefore returns a {@link
 * CompletionStage}. A stage completing with {@code null} means the answer is absent (unknown type,
 * no such property, no matching choice). A stage completing exceptionally means the answer could
 * not be resolved; the analyzer reports that as a warning and treats it as absent.
 *
 * <p>Implementations are shared read-only between concurrent analyses and are responsible for
 * their own caching and for terminating on self-referential schemas.
 */
public interface ModelOracle {

  /**
   * Resolves a type by name.
   *
   * @param name simple or namespace-qualified type name
   * @return the type, or null if unknown
   */
  CompletionStage<TypeInfo> getType(String name);

  /**
   * Resolves the type of a property of {@code parent}.
   *
   * @param parent the owning type, possibly a union
   * @param propertyName the property to navigate
   * @return the property type with its cardinality, or null if {@code parent} has no such property
   */
  CompletionStage<TypeInfo> getElementType(TypeInfo parent, String propertyName);

  /**
   * Narrows {@code type} to the named target, picking the matching choice of a union.
   *
   * @param type the type to narrow
   * @param targetName the target type name
   * @return the narrowed type, or null if no part of {@code type} can be {@code targetName}
   */
  CompletionStage<TypeInfo> narrowToType(TypeInfo type, String targetName);

  /**
   * Lists the property names of {@code parent}.
   *
   * @param parent the owning type
   * @return property names, empty if unknown
   */
  CompletionStage<List<String>> listElementNames(TypeInfo parent);
}
