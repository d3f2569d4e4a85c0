package io.treepath.ast;

import io.treepath.lexer.Range;
import java.util.List;
import java.util.Set;

/** Function call on a receiver: {@code object.name(arguments)}. */
public record Invocation(Node object, String name, List<Node> arguments, Range range)
    implements Node {

  /** Functions whose single argument is a type name rather than an expression. */
  public static final Set<String> TYPE_FUNCTIONS = Set.of("ofType", "is", "as");

  public Invocation {
    if (object == null || name == null) {
      throw new IllegalArgumentException("Invocation requires an object and a name");
    }
    arguments = arguments == null ? List.of() : List.copyOf(arguments);
  }

  /** Whether this is {@code ofType}, {@code is} or {@code as} in function form. */
  public boolean isTypeOperation() {
    return TYPE_FUNCTIONS.contains(name);
  }

  @Override
  public <R> R accept(NodeVisitor<R> visitor) {
    return visitor.visitInvocation(this);
  }

  @Override
  public String toString() {
    return NodePrinter.print(this);
  }
}
