package io.treepath.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import io.treepath.ast.Node;
import io.treepath.diagnostics.Severity;
import io.treepath.parser.Parser;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class AnalyzerOptionsTest {

  @AfterEach
  void clearProperties() {
    System.clearProperty(AnalyzerOptions.EMPTY_TYPE_FILTER_PROPERTY);
    System.clearProperty(AnalyzerOptions.POLL_INTERVAL_PROPERTY);
  }

  @Test
  void readsSystemProperties() {
    System.setProperty(AnalyzerOptions.EMPTY_TYPE_FILTER_PROPERTY, "error");
    System.setProperty(AnalyzerOptions.POLL_INTERVAL_PROPERTY, "7");

    AnalyzerOptions options = AnalyzerOptions.defaults();

    assertEquals(Severity.ERROR, options.emptyTypeFilterSeverity());
    assertEquals(Duration.ofMillis(7), options.pollInterval());
    assertFalse(options.cursorMode());
  }

  @Test
  void invalidValuesFallBack() {
    System.setProperty(AnalyzerOptions.EMPTY_TYPE_FILTER_PROPERTY, "catastrophic");
    System.setProperty(AnalyzerOptions.POLL_INTERVAL_PROPERTY, "soon");

    AnalyzerOptions options = AnalyzerOptions.defaults();

    assertEquals(AnalyzerOptions.DEFAULT_POLL_INTERVAL, options.pollInterval());
    assertNotNull(options.emptyTypeFilterSeverity());
  }

  @Test
  void cursorTargetImpliesCursorMode() {
    Node target = Parser.parseExpression("a");
    AnalyzerOptions options = new AnalyzerOptions(null, false, target, null);

    assertTrue(options.cursorMode());
    assertSame(target, options.cursorTarget());
    assertEquals(Severity.WARNING, options.emptyTypeFilterSeverity());
    assertNull(options.withCursorMode(true).cursorTarget());
  }

  @Test
  void pollIntervalMustBePositive() {
    AnalyzerOptions options = new AnalyzerOptions(null, false, null, null);

    assertThrows(IllegalArgumentException.class, () -> options.withPollInterval(Duration.ZERO));
  }
}
