package io.treepath.ast;

import io.treepath.lexer.Range;

/**
 * A type specifier, as used by {@code is T}, {@code as T} and {@code ofType(T)}. Qualified names
 * keep their dots, e.g. {@code FHIR.Patient}.
 */
public record Identifier(String name, Range range) implements Node {

  /** Namespace part of a qualified name, or null. */
  public String namespace() {
    int dot = name.lastIndexOf('.');
    return dot < 0 ? null : name.substring(0, dot);
  }

  /** Unqualified part of the name. */
  public String simpleName() {
    int dot = name.lastIndexOf('.');
    return dot < 0 ? name : name.substring(dot + 1);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitIdentifier(this);
  }

  @Override
  public String toString() {
    return name;
  }
}
