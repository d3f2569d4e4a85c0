package io.treepath.analyzer.property;

import static org.junit.jupiter.api.Assertions.*;

import io.treepath.analyzer.AnalysisResult;
import io.treepath.analyzer.AnalyzerOptions;
import io.treepath.analyzer.FixtureModelOracle;
import io.treepath.analyzer.TypeAnalyzer;
import io.treepath.ast.Node;
import io.treepath.ast.Nodes;
import io.treepath.diagnostics.Diagnostic;
import io.treepath.diagnostics.DiagnosticCode;
import io.treepath.diagnostics.Severity;
import io.treepath.parser.ParseResult;
import io.treepath.parser.Parser;
import io.treepath.parser.ParserMode;
import io.treepath.parser.ParserOptions;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import net.jqwik.api.*;

/**
 * Property-based tests for the type analyzer.
 *
 * <p>Expressions are assembled from model paths, functions and operators, including misspelled
 * names and broken syntax, then parsed in recovering mode and analyzed against the fixture model.
 */
@PropertyDefaults(tries = 300, shrinking = ShrinkingMode.FULL)
public class AnalyzerPropertyTests {

  private static final Parser PARSER = new Parser(ParserOptions.of(ParserMode.STANDARD));
  private static final AnalyzerOptions OPTIONS =
      new AnalyzerOptions(Severity.WARNING, false, null, Duration.ofMillis(5));
  private static final TypeAnalyzer ANALYZER =
      new TypeAnalyzer(new FixtureModelOracle(), OPTIONS);
  private static final TypeAnalyzer CURSOR_ANALYZER =
      new TypeAnalyzer(new FixtureModelOracle(), OPTIONS.withCursorMode(true));

  @Provide
  Arbitrary<String> expressions() {
    Arbitrary<String> path =
        Arbitraries.of(
                "Patient", "name", "given", "family", "deceased", "birthDate", "active",
                "Observation", "value", "unit", "nosuch", "$this", "$index", "$total", "%resource")
            .list()
            .ofMinSize(1)
            .ofMaxSize(4)
            .map(parts -> String.join(".", parts));
    Arbitrary<String> call =
        Arbitraries.of(
            "", ".first()", ".count()", ".exists()", ".where(use = 'x')", ".select(family)",
            ".ofType(dateTime)", ".ofType(Medication)", ".as(Quantity)", ".children()",
            ".aggregate($total + 1, 0)", ".substring(1)", ".upper()", ".frobnicate()", "[0]",
            ".", ".where(", "");
    Arbitrary<String> operand = Combinators.combine(path, call).as((p, c) -> p + c);
    Arbitrary<String> operator =
        Arbitraries.of(" + ", " = ", " | ", " and ", " < ", " is ", " & ", " - ");
    Arbitrary<String> literal = Arbitraries.of("1", "2.5", "'x'", "true", "@2024-01-01", "{}");
    return Combinators.combine(operand, operator, Arbitraries.oneOf(operand, literal))
        .as((l, op, r) -> l + op + r);
  }

  @Property
  void analysisNeverThrows(@ForAll("expressions") String source) {
    ParseResult parsed = PARSER.parse(source);

    AnalysisResult result = assertDoesNotThrow(() -> ANALYZER.analyze(parsed.root()));

    assertNotNull(result.rootType());
    for (Node node : Nodes.preOrder(parsed.root())) {
      assertNotNull(result.typeOf(node), node::toString);
    }
  }

  @Property
  void analysisIsDeterministic(@ForAll("expressions") String source) {
    Node root = PARSER.parse(source).root();

    AnalysisResult first = ANALYZER.analyze(root);
    AnalysisResult second = ANALYZER.analyze(root, Map.of(), null);

    assertEquals(first.rootType(), second.rootType());
    assertEquals(first.diagnostics(), second.diagnostics());
    for (Node node : Nodes.preOrder(root)) {
      assertEquals(first.typeOf(node), second.typeOf(node));
    }
  }

  @Property
  void cursorModeNeverReportsMore(@ForAll("expressions") String source) {
    Node root = PARSER.parse(source).root();

    AnalysisResult full = ANALYZER.analyze(root);
    AnalysisResult cursor = CURSOR_ANALYZER.analyze(root);

    assertNotNull(cursor.cursorType());
    assertTrue(cursor.diagnostics().size() <= full.diagnostics().size());
    assertTrue(full.diagnostics().containsAll(cursor.diagnostics()));
  }

  @Property
  void noLookupFailuresWithHealthyOracle(@ForAll("expressions") String source) {
    AnalysisResult result = ANALYZER.analyze(PARSER.parse(source).root());

    List<DiagnosticCode> codes =
        result.diagnostics().stream().map(Diagnostic::code).collect(Collectors.toList());
    assertFalse(codes.contains(DiagnosticCode.MODEL_LOOKUP_FAILED));
    assertFalse(codes.contains(DiagnosticCode.MODEL_ORACLE_REQUIRED));
  }
}
