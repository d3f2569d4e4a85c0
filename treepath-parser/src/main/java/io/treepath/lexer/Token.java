package io.treepath.lexer;

/**
 * A single token of a TreePath expression.
 *
 * @param type The type of this token
 * @param text The raw source slice this token was scanned from
 * @param value The decoded content: escapes resolved for strings, delimited identifiers and
 *     environment variables, the {@code @} prefix dropped for date/time literals, otherwise equal
 *     to {@code text}
 * @param range Source span of this token
 * @param channel {@link Channel#HIDDEN} for trivia, otherwise {@link Channel#DEFAULT}
 */
public record Token(TokenType type, String text, String value, Range range, Channel channel) {

  public Token {
    if (type == null || range == null) {
      throw new IllegalArgumentException("Token type and range are required");
    }
    if (text == null) {
      text = "";
    }
    if (value == null) {
      value = text;
    }
    if (channel == null) {
      channel = type.isTrivia() ? Channel.HIDDEN : Channel.DEFAULT;
    }
  }

  /** Creates a default-channel token whose value equals its text. */
  public static Token of(TokenType type, String text, Range range) {
    return new Token(type, text, text, range, Channel.DEFAULT);
  }

  /** Character offset where this token starts (inclusive). */
  public int start() {
    return range.start().offset();
  }

  /** Character offset where this token ends (exclusive). */
  public int end() {
    return range.end().offset();
  }

  public int length() {
    return end() - start();
  }

  public boolean isHidden() {
    return channel == Channel.HIDDEN;
  }

  @Override
  public String toString() {
    return type == TokenType.EOF ? "EOF" : type + "(" + text + ")@" + range.start();
  }
}
