package io.treepath.parser;

import io.treepath.diagnostics.DiagnosticCode;
import io.treepath.diagnostics.TreePathException;
import io.treepath.lexer.Range;
import io.treepath.lexer.TokenType;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/** Exception thrown when a TreePath expression is structurally malformed. */
public final class ParseException extends TreePathException {

  /** Token types that would have been accepted at the failure point. */
  private final Set<TokenType> expected;

  /** Token type actually found. */
  private final TokenType found;

  public ParseException(
      String message, Range range, DiagnosticCode code, Set<TokenType> expected, TokenType found) {
    super(message, range, code);
    this.expected =
        expected == null || expected.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(expected));
    this.found = found;
  }

  public Set<TokenType> getExpected() {
    return expected;
  }

  public TokenType getFound() {
    return found;
  }

  /** Expected token types rendered for messages, e.g. {@code ')' or ','}. */
  public String describeExpected() {
    return expected.stream().map(TokenType::describe).collect(Collectors.joining(" or "));
  }
}
