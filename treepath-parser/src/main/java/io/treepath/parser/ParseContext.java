package io.treepath.parser;

/**
 * Immutable state threaded through the recursive descent. Entering the argument list of a
 * lambda-accepting function derives a deeper context; returning from the call restores the
 * caller's context simply by going out of scope.
 *
 * @param lambdaDepth number of enclosing lambda argument lists
 * @param lambdaFunction name of the innermost lambda-accepting function, or null at depth 0
 */
record ParseContext(int lambdaDepth, String lambdaFunction) {

  static final ParseContext ROOT = new ParseContext(0, null);

  ParseContext enterLambda(String function) {
    return new ParseContext(lambdaDepth + 1, function);
  }

  boolean inLambda() {
    return lambdaDepth > 0;
  }

  /** Suffix naming the enclosing lambda argument for error messages, empty outside one. */
  String location() {
    return inLambda() ? " in the argument of " + lambdaFunction + "()" : "";
  }
}
