package io.treepath.analyzer;

import io.treepath.ast.Node;
import io.treepath.diagnostics.Severity;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Analyzer configuration.
 *
 * <p>{@link #defaults()} resolves each setting from a system property, then an environment
 * variable, then the built-in default:
 *
 * <ul>
 *   <li>{@code treepath.analyzer.emptyTypeFilterSeverity} / {@code
 *       TREEPATH_ANALYZER_EMPTY_TYPE_FILTER_SEVERITY}, default {@code warning}
 *   <li>{@code treepath.analyzer.pollIntervalMillis} / {@code
 *       TREEPATH_ANALYZER_POLL_INTERVAL_MILLIS}, default 50
 * </ul>
 *
 * @param emptyTypeFilterSeverity severity of the diagnostic for type filters that can never match
 * @param cursorMode stop at the cursor and report the type in front of it
 * @param cursorTarget node the cursor is on; null to stop at the first incomplete node
 * @param pollInterval how often a pending model lookup re-checks for cancellation
 */
public record AnalyzerOptions(
    Severity emptyTypeFilterSeverity,
    boolean cursorMode,
    Node cursorTarget,
    Duration pollInterval) {

  private static final Logger log = LoggerFactory.getLogger(AnalyzerOptions.class);

  public static final String EMPTY_TYPE_FILTER_PROPERTY =
      "treepath.analyzer.emptyTypeFilterSeverity";
  public static final String EMPTY_TYPE_FILTER_ENV = "TREEPATH_ANALYZER_EMPTY_TYPE_FILTER_SEVERITY";
  public static final String POLL_INTERVAL_PROPERTY = "treepath.analyzer.pollIntervalMillis";
  public static final String POLL_INTERVAL_ENV = "TREEPATH_ANALYZER_POLL_INTERVAL_MILLIS";

  public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(50);

  public AnalyzerOptions {
    if (emptyTypeFilterSeverity == null) {
      emptyTypeFilterSeverity = Severity.WARNING;
    }
    if (pollInterval == null) {
      pollInterval = DEFAULT_POLL_INTERVAL;
    }
    if (pollInterval.isNegative() || pollInterval.isZero()) {
      throw new IllegalArgumentException("pollInterval must be positive: " + pollInterval);
    }
    if (cursorTarget != null) {
      cursorMode = true;
    }
  }

  /** Options resolved from system properties, environment and built-in defaults. */
  public static AnalyzerOptions defaults() {
    Severity severity = Severity.WARNING;
    String severityValue = lookup(EMPTY_TYPE_FILTER_PROPERTY, EMPTY_TYPE_FILTER_ENV);
    if (severityValue != null) {
      try {
        severity = Severity.fromName(severityValue);
      } catch (IllegalArgumentException e) {
        log.warn("Ignoring unknown severity '{}', using {}", severityValue, severity);
      }
    }
    Duration poll = DEFAULT_POLL_INTERVAL;
    String pollValue = lookup(POLL_INTERVAL_PROPERTY, POLL_INTERVAL_ENV);
    if (pollValue != null) {
      try {
        poll = Duration.ofMillis(Math.max(1, Long.parseLong(pollValue.trim())));
      } catch (NumberFormatException e) {
        log.warn("Ignoring invalid poll interval '{}', using {}", pollValue, poll);
      }
    }
    return new AnalyzerOptions(severity, false, null, poll);
  }

  public AnalyzerOptions withEmptyTypeFilterSeverity(Severity value) {
    return new AnalyzerOptions(value, cursorMode, cursorTarget, pollInterval);
  }

  /** Cursor mode stopping at the first incomplete node. */
  public AnalyzerOptions withCursorMode(boolean value) {
    return new AnalyzerOptions(emptyTypeFilterSeverity, value, null, pollInterval);
  }

  /** Cursor mode stopping at {@code target}, matched by identity. */
  public AnalyzerOptions withCursorTarget(Node target) {
    return new AnalyzerOptions(emptyTypeFilterSeverity, true, target, pollInterval);
  }

  public AnalyzerOptions withPollInterval(Duration value) {
    return new AnalyzerOptions(emptyTypeFilterSeverity, cursorMode, cursorTarget, value);
  }

  static String lookup(String property, String env) {
    String sysProp = System.getProperty(property);
    if (sysProp != null && !sysProp.isBlank()) {
      return sysProp;
    }
    String envVar = System.getenv(env);
    if (envVar != null && !envVar.isBlank()) {
      return envVar;
    }
    return null;
  }
}
