package io.treepath.lexer;

/** Token channels. Hidden tokens are only produced when trivia is preserved. */
public enum Channel {
  DEFAULT,
  HIDDEN
}
