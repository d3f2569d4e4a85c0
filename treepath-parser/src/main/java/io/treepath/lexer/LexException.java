package io.treepath.lexer;

import io.treepath.diagnostics.DiagnosticCode;
import io.treepath.diagnostics.TreePathException;

/** Exception thrown when an expression cannot be tokenized. */
public final class LexException extends TreePathException {

  /** The character that could not be accepted, or null at end of input. */
  private final Character offendingChar;

  /** Date/time sub-component that was malformed, or null for other problems. */
  private final String component;

  public LexException(String message, Range range, DiagnosticCode code, Character offendingChar) {
    this(message, range, code, offendingChar, null);
  }

  public LexException(
      String message,
      Range range,
      DiagnosticCode code,
      Character offendingChar,
      String component) {
    super(message, range, code);
    this.offendingChar = offendingChar;
    this.component = component;
  }

  public Character getOffendingChar() {
    return offendingChar;
  }

  public String getComponent() {
    return component;
  }
}
