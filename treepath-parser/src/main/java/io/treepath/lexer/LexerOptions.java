package io.treepath.lexer;

/**
 * Lexer switches.
 *
 * @param preserveTrivia emit whitespace and comments as hidden-channel tokens
 * @param recover record lexical problems as diagnostics and keep scanning instead of throwing
 */
public record LexerOptions(boolean preserveTrivia, boolean recover) {

  /** Skip trivia and fail on the first lexical problem. */
  public static final LexerOptions DEFAULT = new LexerOptions(false, false);

  public LexerOptions withPreserveTrivia(boolean value) {
    return new LexerOptions(value, recover);
  }

  public LexerOptions withRecover(boolean value) {
    return new LexerOptions(preserveTrivia, value);
  }
}
