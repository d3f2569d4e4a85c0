package io.treepath.parser.property;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.Tuple;

/**
 * Builds syntactically valid expressions bottom-up: atoms, then paths and calls, then operator
 * chains. Depth is bounded by the {@code depth} argument so generated trees stay small.
 */
public final class ExpressionGenerator {

  private static final String[] NAMES = {"Patient", "name", "given", "family", "active", "value"};
  private static final String[] OPERATORS = {
    "+", "-", "*", "/", "div", "mod", "&", "|", "=", "!=", "~", "!~", "<", "<=", ">", ">=", "and",
    "or", "xor", "implies", "in", "contains"
  };
  private static final String[] FUNCTIONS = {"first", "exists", "count", "empty", "distinct"};
  private static final String[] LAMBDAS = {"where", "select", "all", "exists"};

  private ExpressionGenerator() {}

  /** Valid expressions up to {@code depth} levels of nesting. */
  public static Arbitrary<String> expression(int depth) {
    if (depth <= 0) {
      return Arbitraries.oneOf(atom(), path());
    }
    Arbitrary<String> inner = Arbitraries.lazy(() -> expression(depth - 1));
    return Arbitraries.frequencyOf(
        Tuple.of(3, atom()),
        Tuple.of(3, path()),
        Tuple.of(3, binary(inner)),
        Tuple.of(1, inner.map(e -> "(" + e + ")")),
        Tuple.of(1, inner.map(e -> "-" + e)),
        Tuple.of(2, lambdaCall(inner)),
        Tuple.of(1, iif(inner)),
        Tuple.of(1, inner.map(e -> "(" + e + ")[0]")));
  }

  /** Literals and variables. */
  public static Arbitrary<String> atom() {
    return Arbitraries.oneOf(
        Arbitraries.integers().between(0, 10_000).map(String::valueOf),
        Arbitraries.of("1.5", "0.25", "true", "false", "{}", "$this", "%context", "today()"),
        Arbitraries.of("@2024-01-15", "@2024-01-15T10:30:00Z", "@T10:30"),
        Arbitraries.of("5 'mg'", "3 days", "1 year"),
        Arbitraries.strings().alpha().numeric().ofMaxLength(8).map(s -> "'" + s + "'"));
  }

  /** Member paths with an optional trailing call. */
  public static Arbitrary<String> path() {
    Arbitrary<String> segments =
        Arbitraries.of(NAMES).list().ofMinSize(1).ofMaxSize(4).map(l -> String.join(".", l));
    Arbitrary<String> suffix =
        Arbitraries.oneOf(Arbitraries.just(""), Arbitraries.of(FUNCTIONS).map(f -> "." + f + "()"));
    return Combinators.combine(segments, suffix).as((p, s) -> p + s);
  }

  private static Arbitrary<String> binary(Arbitrary<String> inner) {
    return Combinators.combine(inner, Arbitraries.of(OPERATORS), inner)
        .as((l, op, r) -> l + " " + op + " " + r);
  }

  private static Arbitrary<String> lambdaCall(Arbitrary<String> inner) {
    return Combinators.combine(path(), Arbitraries.of(LAMBDAS), inner)
        .as((p, f, arg) -> p + "." + f + "(" + arg + ")");
  }

  private static Arbitrary<String> iif(Arbitrary<String> inner) {
    return Combinators.combine(inner, inner, inner)
        .as((c, t, o) -> "iif(" + c + ", " + t + ", " + o + ")");
  }
}
