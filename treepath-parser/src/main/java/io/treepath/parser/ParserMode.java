package io.treepath.parser;

import java.util.Locale;

/** How the parser reacts to malformed input and what it returns. */
public enum ParserMode {
  /** Throw on the first lexical or structural problem. */
  FAST,

  /** Collect diagnostics and recover, up to a bounded number of errors. */
  STANDARD,

  /** Unlimited recovery, trivia tokens kept and related locations attached to diagnostics. */
  DIAGNOSTIC,

  /** Like {@link #STANDARD} but only diagnostics are returned. */
  VALIDATE;

  public boolean recovers() {
    return this != FAST;
  }

  public boolean keepsTrivia() {
    return this == DIAGNOSTIC;
  }

  public boolean buildsAst() {
    return this != VALIDATE;
  }

  public boolean limitsErrors() {
    return this == STANDARD || this == VALIDATE;
  }

  /**
   * Parses a mode name, case-insensitively.
   *
   * @throws IllegalArgumentException for unknown names
   */
  public static ParserMode fromName(String name) {
    return valueOf(name.trim().toUpperCase(Locale.ROOT));
  }
}
