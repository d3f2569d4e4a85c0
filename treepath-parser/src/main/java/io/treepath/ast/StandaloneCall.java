package io.treepath.ast;

import io.treepath.lexer.Range;
import java.util.Set;

/** A receiverless call: {@code today()}, {@code now()} or {@code timeOfDay()}. */
public record StandaloneCall(String name, Range range) implements Node {

  /** Functions that never take an implicit receiver. */
  public static final Set<String> NAMES = Set.of("today", "now", "timeOfDay");

  public static boolean isStandalone(String name) {
    return NAMES.contains(name);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitStandaloneCall(this);
  }

  @Override
  public String toString() {
    return name + "()";
  }
}
