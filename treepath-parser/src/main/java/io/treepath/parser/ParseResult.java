package io.treepath.parser;

import io.treepath.ast.Node;
import io.treepath.diagnostics.Diagnostic;
import io.treepath.lexer.Token;
import java.util.List;
import java.util.Optional;

/**
 * Output of a parse.
 *
 * @param root tree root, or null in {@link ParserMode#VALIDATE} mode
 * @param diagnostics lexical and structural problems in source order of discovery
 * @param tokens tokens the parse consumed; includes trivia in {@link ParserMode#DIAGNOSTIC} mode
 * @param mode mode the parse ran in
 */
public record ParseResult(
    Node root, List<Diagnostic> diagnostics, List<Token> tokens, ParserMode mode) {

  public ParseResult {
    diagnostics = List.copyOf(diagnostics);
    tokens = List.copyOf(tokens);
  }

  public Optional<Node> ast() {
    return Optional.ofNullable(root);
  }

  public boolean hasErrors() {
    return diagnostics.stream().anyMatch(Diagnostic::isError);
  }
}
