package io.treepath.lexer;

import io.treepath.diagnostics.Diagnostic;
import java.util.List;

/**
 * Output of a recovering tokenization.
 *
 * @param tokens all tokens, ending with EOF; unlexable regions appear as ERROR tokens
 * @param diagnostics lexical problems in source order
 */
public record LexResult(List<Token> tokens, List<Diagnostic> diagnostics) {

  public LexResult {
    tokens = List.copyOf(tokens);
    diagnostics = List.copyOf(diagnostics);
  }

  public boolean hasErrors() {
    return !diagnostics.isEmpty();
  }
}
