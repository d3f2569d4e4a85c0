package io.treepath.analyzer;

import io.treepath.ast.Node;
import io.treepath.diagnostics.Diagnostic;
import io.treepath.model.TypeInfo;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a type analysis.
 *
 * @param types type of every node of the analyzed tree, keyed by node identity
 * @param diagnostics analyzer diagnostics in the order they were found
 * @param rootType type of the whole expression
 * @param cursorType in cursor mode, the type in front of the cursor; null otherwise
 */
public record AnalysisResult(
    Map<Node, TypeInfo> types,
    List<Diagnostic> diagnostics,
    TypeInfo rootType,
    TypeInfo cursorType) {

  public AnalysisResult {
    types = Collections.unmodifiableMap(new IdentityHashMap<>(types));
    diagnostics = List.copyOf(diagnostics);
  }

  /** Type recorded for {@code node}, or null when the node is not part of the analyzed tree. */
  public TypeInfo typeOf(Node node) {
    return types.get(node);
  }

  public boolean hasErrors() {
    return diagnostics.stream().anyMatch(Diagnostic::isError);
  }
}
