package io.treepath.diagnostics;

import io.treepath.lexer.Range;
import java.util.List;

/**
 * Base exception for fail-fast lexing and parsing. Carries the offending source range and a
 * diagnostic code so callers can render it like any collected diagnostic.
 */
public class TreePathException extends RuntimeException {

  /** Message without location decoration. */
  private final String detail;

  /** Source span of the problem. */
  private final Range range;

  /** Problem kind. */
  private final DiagnosticCode code;

  public TreePathException(String message, Range range, DiagnosticCode code) {
    this(message, range, code, null);
  }

  public TreePathException(String message, Range range, DiagnosticCode code, Throwable cause) {
    super(formatMessage(message, range, code), cause);
    this.detail = message;
    this.range = range;
    this.code = code;
  }

  private static String formatMessage(String message, Range range, DiagnosticCode code) {
    StringBuilder sb = new StringBuilder(message);
    if (range != null) {
      sb.append(" [at ").append(range.start()).append("]");
    }
    if (code != null) {
      sb.append(" [Error Code: ").append(code).append("]");
    }
    return sb.toString();
  }

  public String getDetail() {
    return detail;
  }

  public Range getRange() {
    return range;
  }

  public DiagnosticCode getCode() {
    return code;
  }

  /** Converts this exception into an error diagnostic. */
  public Diagnostic toDiagnostic() {
    return new Diagnostic(Severity.ERROR, code, detail, range, List.of());
  }
}
