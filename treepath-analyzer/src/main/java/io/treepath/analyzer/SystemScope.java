package io.treepath.analyzer;

import io.treepath.model.TypeInfo;
import java.util.Map;

/**
 * Types of the system variables ({@code $this}, {@code $index}, {@code $total}) visible at a point
 * of the expression.
 *
 * <p>Scopes are immutable frames linked to their parent. Entering a lambda pushes a frame that
 * shadows the rebound names; leaving it simply returns to the parent, so no state has to be undone.
 */
public final class SystemScope {

  public static final String THIS = "$this";
  public static final String INDEX = "$index";
  public static final String TOTAL = "$total";

  /** Scope with no bindings. */
  public static final SystemScope EMPTY = new SystemScope(null, Map.of(), 0);

  private final SystemScope parent;
  private final Map<String, TypeInfo> bindings;
  private final int depth;

  private SystemScope(SystemScope parent, Map<String, TypeInfo> bindings, int depth) {
    this.parent = parent;
    this.bindings = bindings;
    this.depth = depth;
  }

  /** Returns a child scope with {@code bindings} layered over this one. */
  public SystemScope push(Map<String, TypeInfo> bindings) {
    return new SystemScope(this, Map.copyOf(bindings), depth + 1);
  }

  /** The enclosing scope, or null for {@link #EMPTY}. */
  public SystemScope parent() {
    return parent;
  }

  public int depth() {
    return depth;
  }

  /** Innermost binding of {@code name}, or null when unbound. */
  public TypeInfo lookup(String name) {
    for (SystemScope scope = this; scope != null; scope = scope.parent) {
      TypeInfo type = scope.bindings.get(name);
      if (type != null) {
        return type;
      }
    }
    return null;
  }

  public boolean isBound(String name) {
    return lookup(name) != null;
  }

  @Override
  public String toString() {
    return "SystemScope{depth=" + depth + ", bindings=" + bindings + "}";
  }
}
