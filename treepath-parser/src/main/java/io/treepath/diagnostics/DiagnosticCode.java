package io.treepath.diagnostics;

/**
 * Closed set of problems reported by the lexer, parser and type analyzer. Each code carries the
 * severity it is reported with unless a caller configures otherwise.
 */
public enum DiagnosticCode {
  // Lexer
  UNEXPECTED_CHARACTER(Stage.LEXER, Severity.ERROR),
  UNTERMINATED_STRING(Stage.LEXER, Severity.ERROR),
  UNTERMINATED_IDENTIFIER(Stage.LEXER, Severity.ERROR),
  UNTERMINATED_COMMENT(Stage.LEXER, Severity.ERROR),
  INVALID_ESCAPE(Stage.LEXER, Severity.ERROR),
  INVALID_UNICODE_ESCAPE(Stage.LEXER, Severity.ERROR),
  INVALID_DATE_TIME(Stage.LEXER, Severity.ERROR),
  INVALID_VARIABLE(Stage.LEXER, Severity.ERROR),

  // Parser
  UNEXPECTED_TOKEN(Stage.PARSER, Severity.ERROR),
  UNEXPECTED_EOF(Stage.PARSER, Severity.ERROR),
  UNCLOSED_DELIMITER(Stage.PARSER, Severity.ERROR),
  MISSING_ARGUMENT(Stage.PARSER, Severity.ERROR),
  TOO_MANY_ARGUMENTS(Stage.PARSER, Severity.ERROR),
  EXPECTED_IDENTIFIER(Stage.PARSER, Severity.ERROR),
  TOO_MANY_ERRORS(Stage.PARSER, Severity.ERROR),

  // Analyzer
  UNKNOWN_PROPERTY(Stage.ANALYZER, Severity.ERROR),
  UNKNOWN_FUNCTION(Stage.ANALYZER, Severity.ERROR),
  UNKNOWN_VARIABLE(Stage.ANALYZER, Severity.ERROR),
  UNKNOWN_TYPE(Stage.ANALYZER, Severity.ERROR),
  ARITY_MISMATCH(Stage.ANALYZER, Severity.ERROR),
  TYPE_MISMATCH(Stage.ANALYZER, Severity.ERROR),
  MODEL_ORACLE_REQUIRED(Stage.ANALYZER, Severity.ERROR),
  EMPTY_TYPE_FILTER(Stage.ANALYZER, Severity.WARNING),
  MODEL_LOOKUP_FAILED(Stage.ANALYZER, Severity.WARNING);

  /** Pipeline stage that reports a code. */
  public enum Stage {
    LEXER,
    PARSER,
    ANALYZER
  }

  private final Stage stage;
  private final Severity defaultSeverity;

  DiagnosticCode(Stage stage, Severity defaultSeverity) {
    this.stage = stage;
    this.defaultSeverity = defaultSeverity;
  }

  public Stage stage() {
    return stage;
  }

  public Severity defaultSeverity() {
    return defaultSeverity;
  }
}
