package io.treepath.analyzer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import io.treepath.ast.Node;
import io.treepath.diagnostics.Diagnostic;
import io.treepath.diagnostics.DiagnosticCode;
import io.treepath.diagnostics.Severity;
import io.treepath.model.ModelOracle;
import io.treepath.model.TypeInfo;
import io.treepath.parser.Parser;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.AdditionalAnswers;
import org.mockito.InOrder;

/** Tests how the analyzer drives, awaits and survives its model oracle. */
class ModelOracleInteractionTest {

  private static final AnalyzerOptions OPTIONS =
      new AnalyzerOptions(Severity.WARNING, false, null, Duration.ofMillis(5));

  private ModelOracle oracle;
  private TypeAnalyzer analyzer;
  private ExecutorService executor;

  @BeforeEach
  void setup() {
    oracle = mock(ModelOracle.class, AdditionalAnswers.delegatesTo(new FixtureModelOracle()));
    analyzer = new TypeAnalyzer(oracle, OPTIONS);
    executor = Executors.newFixedThreadPool(4);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  private static boolean hasCode(AnalysisResult result, DiagnosticCode code) {
    return result.diagnostics().stream().anyMatch(d -> d.code() == code);
  }

  @Test
  void lookupsFollowTreeOrder() {
    analyzer.analyze(Parser.parseExpression("Patient.name.given"));

    InOrder inOrder = inOrder(oracle);
    inOrder.verify(oracle).getType("Patient");
    inOrder.verify(oracle).getElementType(FixtureModelOracle.PATIENT, "name");
    inOrder.verify(oracle).getElementType(any(TypeInfo.class), eq("given"));
    verifyNoMoreInteractions(oracle);
  }

  @Test
  void lambdaArgumentsAreAnalyzedAfterReceiver() {
    analyzer.analyze(Parser.parseExpression("Patient.name.where(family = 'Doe')"));

    InOrder inOrder = inOrder(oracle);
    inOrder.verify(oracle).getElementType(any(TypeInfo.class), eq("name"));
    inOrder.verify(oracle).getElementType(FixtureModelOracle.HUMAN_NAME, "family");
  }

  @Test
  void failedLookupBecomesWarning() {
    doReturn(CompletableFuture.failedFuture(new IllegalStateException("schema offline")))
        .when(oracle)
        .getElementType(any(TypeInfo.class), eq("name"));

    AnalysisResult result = analyzer.analyze(Parser.parseExpression("Patient.name"));

    Diagnostic failure =
        result.diagnostics().stream()
            .filter(d -> d.code() == DiagnosticCode.MODEL_LOOKUP_FAILED)
            .findFirst()
            .orElseThrow();
    assertEquals(Severity.WARNING, failure.severity());
    assertTrue(failure.message().contains("schema offline"));
    assertTrue(result.rootType().isAny());
  }

  @Test
  void throwingOracleIsTreatedAsFailedLookup() {
    doThrow(new IllegalArgumentException("bad name")).when(oracle).getType(anyString());

    AnalysisResult result = analyzer.analyze(Parser.parseExpression("Patient.name"));

    assertTrue(hasCode(result, DiagnosticCode.MODEL_LOOKUP_FAILED));
  }

  @Test
  void nullStageMeansAbsent() {
    doReturn(null).when(oracle).getType(anyString());

    AnalysisResult result = analyzer.analyze(Parser.parseExpression("Patient"));

    assertFalse(hasCode(result, DiagnosticCode.MODEL_LOOKUP_FAILED));
    assertTrue(hasCode(result, DiagnosticCode.UNKNOWN_PROPERTY));
  }

  @Test
  void slowLookupIsAwaited() {
    CompletableFuture<TypeInfo> slow = new CompletableFuture<>();
    doReturn(slow).when(oracle).getType("Patient");
    executor.submit(
        () -> {
          TimeUnit.MILLISECONDS.sleep(50);
          return slow.complete(FixtureModelOracle.PATIENT);
        });

    AnalysisResult result = analyzer.analyze(Parser.parseExpression("Patient.birthDate"));

    assertTrue(result.diagnostics().isEmpty());
    assertEquals(FixtureModelOracle.DATE, result.rootType());
  }

  @Test
  void cancelledTokenStopsBeforeFirstLookup() {
    CancellationToken token = new CancellationToken();
    token.cancel();
    Node ast = Parser.parseExpression("Patient.name");

    assertThrows(
        AnalysisCancelledException.class, () -> analyzer.analyze(ast, Map.of(), null, token));
    verifyNoInteractions(oracle);
  }

  @Test
  void cancelledTokenIsIgnoredWithoutLookups() {
    CancellationToken token = new CancellationToken();
    token.cancel();

    Node ast = Parser.parseExpression("1 + 2");
    AnalysisResult result = analyzer.analyze(ast, Map.of(), null, token);

    assertEquals(TypeInfo.INTEGER, result.rootType());
  }

  @Test
  void cancellationInterruptsPendingLookup() throws Exception {
    CountDownLatch asked = new CountDownLatch(1);
    doAnswer(
            invocation -> {
              asked.countDown();
              return new CompletableFuture<TypeInfo>();
            })
        .when(oracle)
        .getType("Patient");
    CancellationToken token = new CancellationToken();

    CompletableFuture<AnalysisResult> running =
        analyzer.analyzeAsync(
            Parser.parseExpression("Patient.name"), Map.of(), null, executor, token);
    assertTrue(asked.await(5, TimeUnit.SECONDS));
    token.cancel();

    ExecutionException e =
        assertThrows(ExecutionException.class, () -> running.get(5, TimeUnit.SECONDS));
    assertInstanceOf(AnalysisCancelledException.class, e.getCause());
  }

  @Test
  void concurrentAnalysesShareOracle() throws Exception {
    Node ast = Parser.parseExpression("Patient.name.where(use = 'official').given.first()");
    TypeInfo expected = analyzer.analyze(ast).rootType();

    List<CompletableFuture<AnalysisResult>> runs = new ArrayList<>();
    for (int i = 0; i < 16; i++) {
      runs.add(analyzer.analyzeAsync(ast, Map.of(), null, executor, CancellationToken.none()));
    }
    for (CompletableFuture<AnalysisResult> run : runs) {
      AnalysisResult result = run.get(5, TimeUnit.SECONDS);
      assertEquals(expected, result.rootType());
      assertTrue(result.diagnostics().isEmpty());
    }
  }
}
