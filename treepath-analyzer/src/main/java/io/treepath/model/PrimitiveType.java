package io.treepath.model;

import java.util.HashMap;
import java.util.Map;

/**
 * Base types of the TreePath type system. {@link #ANY} stands for an unknown value and is also the
 * base type of complex model types and of unions.
 */
public enum PrimitiveType {
  ANY("Any"),
  BOOLEAN("Boolean"),
  STRING("String"),
  INTEGER("Integer"),
  LONG("Long"),
  DECIMAL("Decimal"),
  DATE("Date"),
  DATETIME("DateTime"),
  TIME("Time"),
  QUANTITY("Quantity");

  /** Namespace of the built-in types. */
  public static final String SYSTEM_NAMESPACE = "System";

  private static final Map<String, PrimitiveType> BY_NAME = new HashMap<>();

  static {
    for (PrimitiveType type : values()) {
      BY_NAME.put(type.typeName, type);
    }
  }

  private final String typeName;

  PrimitiveType(String typeName) {
    this.typeName = typeName;
  }

  /** Language-level spelling, e.g. {@code DateTime}. */
  public String typeName() {
    return typeName;
  }

  public boolean isNumeric() {
    return this == INTEGER || this == LONG || this == DECIMAL;
  }

  public boolean isTemporal() {
    return this == DATE || this == DATETIME || this == TIME;
  }

  /**
   * Checks whether a value of this type may be used where {@code target} is expected, either
   * directly or through an implicit conversion (Integer to Long, Decimal or Quantity; Long to
   * Decimal; Date to DateTime).
   */
  public boolean isConvertibleTo(PrimitiveType target) {
    if (this == target || target == ANY) {
      return true;
    }
    return switch (this) {
      case INTEGER -> target == LONG || target == DECIMAL || target == QUANTITY;
      case LONG -> target == DECIMAL;
      case DECIMAL -> target == QUANTITY;
      case DATE -> target == DATETIME;
      default -> false;
    };
  }

  /**
   * Looks up a built-in type by its language-level name, with or without the {@code System.}
   * prefix.
   *
   * @return the type, or null for other names
   */
  public static PrimitiveType fromTypeName(String name) {
    if (name == null) {
      return null;
    }
    String prefix = SYSTEM_NAMESPACE + ".";
    return BY_NAME.get(name.startsWith(prefix) ? name.substring(prefix.length()) : name);
  }
}
