package io.treepath.diagnostics;

import java.util.Locale;

/** Diagnostic severities, most severe first. */
public enum Severity {
  ERROR,
  WARNING,
  INFORMATION,
  HINT;

  /** Checks if this severity blocks evaluation by default. */
  public boolean isBlocking() {
    return this == ERROR;
  }

  /**
   * Parses a severity name, case-insensitively. Accepts {@code info} as an alias.
   *
   * @throws IllegalArgumentException for unknown names
   */
  public static Severity fromName(String name) {
    String normalized = name.trim().toUpperCase(Locale.ROOT);
    if (normalized.equals("INFO")) {
      return INFORMATION;
    }
    return valueOf(normalized);
  }
}
