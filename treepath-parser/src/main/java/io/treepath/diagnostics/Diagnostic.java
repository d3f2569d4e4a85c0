package io.treepath.diagnostics;

import io.treepath.lexer.Range;
import java.util.ArrayList;
import java.util.List;

/**
 * A problem found in an expression.
 *
 * @param severity how serious the problem is
 * @param code machine-readable problem kind
 * @param message human-readable description
 * @param range source span the problem applies to
 * @param related secondary locations, possibly empty
 */
public record Diagnostic(
    Severity severity,
    DiagnosticCode code,
    String message,
    Range range,
    List<RelatedInformation> related) {

  public Diagnostic {
    if (severity == null || code == null || range == null) {
      throw new IllegalArgumentException("Diagnostic severity, code and range are required");
    }
    if (message == null) {
      message = "";
    }
    related = related == null ? List.of() : List.copyOf(related);
  }

  /** Creates a diagnostic with the code's default severity. */
  public static Diagnostic of(DiagnosticCode code, String message, Range range) {
    return new Diagnostic(code.defaultSeverity(), code, message, range, List.of());
  }

  public Diagnostic withRelated(RelatedInformation info) {
    List<RelatedInformation> all = new ArrayList<>(related);
    all.add(info);
    return new Diagnostic(severity, code, message, range, all);
  }

  public boolean isError() {
    return severity == Severity.ERROR;
  }

  @Override
  public String toString() {
    return severity + " " + code + " at " + range.start() + ": " + message;
  }
}
