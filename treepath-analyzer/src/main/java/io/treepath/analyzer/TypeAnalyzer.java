package io.treepath.analyzer;

import io.treepath.ast.Binary;
import io.treepath.ast.EmptyCollection;
import io.treepath.ast.EnvironmentVariable;
import io.treepath.ast.ErrorNode;
import io.treepath.ast.Identifier;
import io.treepath.ast.Iif;
import io.treepath.ast.IncompleteNode;
import io.treepath.ast.Index;
import io.treepath.ast.Invocation;
import io.treepath.ast.Literal;
import io.treepath.ast.Member;
import io.treepath.ast.Node;
import io.treepath.ast.Node.BinaryOp;
import io.treepath.ast.NodeVisitor;
import io.treepath.ast.Nodes;
import io.treepath.ast.Quantity;
import io.treepath.ast.SpecialVariable;
import io.treepath.ast.StandaloneCall;
import io.treepath.ast.Unary;
import io.treepath.diagnostics.Diagnostic;
import io.treepath.diagnostics.DiagnosticCode;
import io.treepath.diagnostics.Severity;
import io.treepath.model.ModelOracle;
import io.treepath.model.PrimitiveType;
import io.treepath.model.TypeInfo;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Infers the type and cardinality of every node of an expression tree.
 *
 * <p>Domain knowledge comes from an optional {@link ModelOracle}. Without one, member navigation
 * yields {@code Any} silently and type operations ({@code is}, {@code as}, {@code ofType}) are
 * reported as errors. Oracle lookups are awaited one at a time in tree order, so a given tree and
 * oracle always produce the same calls, types and diagnostics. Failed lookups are reported as
 * warnings and treated as absent answers.
 *
 * <p>An analyzer holds no per-analysis state and may be shared between threads.
 */
public final class TypeAnalyzer {

  private static final Logger log = LoggerFactory.getLogger(TypeAnalyzer.class);

  private static final Set<String> INPUT_VARIABLES = Set.of("context", "resource", "rootResource");
  private static final Set<String> STRING_VARIABLES = Set.of("ucum", "sct", "loinc");

  private final ModelOracle oracle;
  private final AnalyzerOptions options;

  /** Analyzer without a model oracle and with default options. */
  public TypeAnalyzer() {
    this(null, AnalyzerOptions.defaults());
  }

  public TypeAnalyzer(ModelOracle oracle) {
    this(oracle, AnalyzerOptions.defaults());
  }

  /**
   * @param oracle source of model types, or null to analyze without a model
   * @param options analyzer settings
   */
  public TypeAnalyzer(ModelOracle oracle, AnalyzerOptions options) {
    this.oracle = oracle;
    this.options = options == null ? AnalyzerOptions.defaults() : options;
  }

  public AnalyzerOptions options() {
    return options;
  }

  public AnalysisResult analyze(Node ast) {
    return analyze(ast, Map.of(), null, CancellationToken.none());
  }

  public AnalysisResult analyze(Node ast, Map<String, TypeInfo> variables, TypeInfo inputType) {
    return analyze(ast, variables, inputType, CancellationToken.none());
  }

  /**
   * Analyzes {@code ast}, blocking the calling thread while model lookups are pending.
   *
   * @param ast root of the tree to analyze
   * @param variables types of caller-supplied environment variables, keyed with or without the
   *     leading {@code %}
   * @param inputType type of the root {@code $this}; null for unknown
   * @param cancellation checked before and while waiting for every model lookup
   * @return node types and diagnostics
   * @throws AnalysisCancelledException if {@code cancellation} fires
   */
  public AnalysisResult analyze(
      Node ast,
      Map<String, TypeInfo> variables,
      TypeInfo inputType,
      CancellationToken cancellation) {
    if (ast == null) {
      throw new IllegalArgumentException("Nothing to analyze");
    }
    long start = System.nanoTime();
    Walk walk = new Walk(ast, variables, inputType, cancellation);
    TypeInfo rootType = walk.type(ast);
    TypeInfo cursorType = null;
    if (options.cursorMode()) {
      cursorType = walk.cursorReached ? walk.cursorType : rootType;
    }
    if (log.isDebugEnabled()) {
      log.debug(
          "Analyzed {} nodes in {} us: type {}, {} diagnostic(s), {} oracle call(s)",
          walk.types.size(),
          (System.nanoTime() - start) / 1000,
          rootType,
          walk.diagnostics.size(),
          walk.oracleCalls);
    }
    return new AnalysisResult(walk.types, walk.diagnostics, rootType, cursorType);
  }

  /**
   * Runs {@link #analyze(Node, Map, TypeInfo, CancellationToken)} on {@code executor}. A cancelled
   * analysis completes the returned future exceptionally with an {@link
   * AnalysisCancelledException}.
   */
  public CompletableFuture<AnalysisResult> analyzeAsync(
      Node ast,
      Map<String, TypeInfo> variables,
      TypeInfo inputType,
      Executor executor,
      CancellationToken cancellation) {
    return CompletableFuture.supplyAsync(
        () -> analyze(ast, variables, inputType, cancellation), executor);
  }

  /** State of one analysis. */
  private final class Walk implements NodeVisitor<TypeInfo> {
    private final Map<Node, TypeInfo> types = new IdentityHashMap<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final Map<String, TypeInfo> variables = new HashMap<>();
    private final TypeInfo rootInput;
    private final CancellationToken cancellation;
    private final Node cursorTarget;

    private SystemScope scope;
    private boolean cursorReached;
    private TypeInfo cursorType;
    private int oracleCalls;

    Walk(
        Node root,
        Map<String, TypeInfo> variables,
        TypeInfo inputType,
        CancellationToken cancellation) {
      if (variables != null) {
        variables.forEach(
            (name, type) ->
                this.variables.put(name.startsWith("%") ? name.substring(1) : name, type));
      }
      this.rootInput = inputType == null ? TypeInfo.ANY : inputType;
      this.cancellation = cancellation == null ? CancellationToken.none() : cancellation;
      this.scope = SystemScope.EMPTY.push(Map.of(SystemScope.THIS, rootInput));
      Node target = options.cursorTarget();
      if (target == null && options.cursorMode()) {
        target = Nodes.findIncomplete(root);
      }
      this.cursorTarget = target;
    }

    TypeInfo type(Node node) {
      if (cursorReached) {
        fill(node);
        return TypeInfo.ANY;
      }
      if (node == cursorTarget) {
        return atCursor(node);
      }
      TypeInfo type = node.accept(this);
      types.put(node, type);
      return type;
    }

    private TypeInfo atCursor(Node node) {
      TypeInfo before;
      if (node instanceof IncompleteNode incomplete) {
        before = type(incomplete.receiver());
      } else {
        List<Node> children = Nodes.children(node);
        before = children.isEmpty() ? scope.lookup(SystemScope.THIS) : type(children.get(0));
      }
      cursorType = before;
      cursorReached = true;
      log.debug("Cursor reached at {}, type {}", node.range(), before);
      fill(node);
      return TypeInfo.ANY;
    }

    private void fill(Node node) {
      for (Node n : Nodes.preOrder(node)) {
        types.putIfAbsent(n, TypeInfo.ANY);
      }
    }

    // === Leaves ===

    @Override
    public TypeInfo visitLiteral(Literal node) {
      return switch (node.kind()) {
        case STRING -> TypeInfo.STRING;
        case INTEGER -> TypeInfo.INTEGER;
        case DECIMAL -> TypeInfo.DECIMAL;
        case BOOLEAN -> TypeInfo.BOOLEAN;
        case DATE -> TypeInfo.system(PrimitiveType.DATE);
        case DATETIME -> TypeInfo.system(PrimitiveType.DATETIME);
        case TIME -> TypeInfo.system(PrimitiveType.TIME);
      };
    }

    @Override
    public TypeInfo visitIdentifier(Identifier node) {
      PrimitiveType primitive = PrimitiveType.fromTypeName(node.name());
      if (primitive != null) {
        return TypeInfo.system(primitive);
      }
      if (oracle == null) {
        return TypeInfo.ANY_SINGLETON;
      }
      TypeInfo type = call(() -> oracle.getType(node.name()), "getType(" + node.name() + ")", node);
      return type == null ? TypeInfo.ANY_SINGLETON : type.asSingleton();
    }

    @Override
    public TypeInfo visitSpecialVariable(SpecialVariable node) {
      TypeInfo type = scope.lookup(node.name());
      if (type == null) {
        report(
            DiagnosticCode.UNKNOWN_VARIABLE,
            node.name() + " is only defined inside the argument of an iterating function",
            node);
        return TypeInfo.ANY;
      }
      return type;
    }

    @Override
    public TypeInfo visitEnvironmentVariable(EnvironmentVariable node) {
      TypeInfo type = variables.get(node.name());
      if (type != null) {
        return type;
      }
      if (INPUT_VARIABLES.contains(node.name())) {
        return rootInput;
      }
      if (STRING_VARIABLES.contains(node.name())) {
        return TypeInfo.STRING;
      }
      report(DiagnosticCode.UNKNOWN_VARIABLE, "Unknown variable %" + node.name(), node);
      return TypeInfo.ANY;
    }

    @Override
    public TypeInfo visitStandaloneCall(StandaloneCall node) {
      return switch (node.name()) {
        case "today" -> TypeInfo.system(PrimitiveType.DATE);
        case "now" -> TypeInfo.system(PrimitiveType.DATETIME);
        case "timeOfDay" -> TypeInfo.system(PrimitiveType.TIME);
        default -> TypeInfo.ANY_SINGLETON;
      };
    }

    @Override
    public TypeInfo visitQuantity(Quantity node) {
      return TypeInfo.system(PrimitiveType.QUANTITY);
    }

    @Override
    public TypeInfo visitEmptyCollection(EmptyCollection node) {
      return TypeInfo.ANY;
    }

    @Override
    public TypeInfo visitError(ErrorNode node) {
      // already reported by the parser
      return TypeInfo.ANY;
    }

    @Override
    public TypeInfo visitIncomplete(IncompleteNode node) {
      type(node.receiver());
      return TypeInfo.ANY;
    }

    // === Navigation ===

    @Override
    public TypeInfo visitMember(Member node) {
      TypeInfo receiver = type(node.object());
      if (oracle == null) {
        return TypeInfo.ANY;
      }
      boolean implicit =
          node.object() instanceof SpecialVariable variable && variable.implicit();
      String name = node.name();

      if (implicit && receiver.isAny()) {
        TypeInfo named = call(() -> oracle.getType(name), "getType(" + name + ")", node);
        if (named != null) {
          return named;
        }
      } else if (implicit
          && receiver.name() != null
          && (name.equals(receiver.name()) || name.equals(receiver.qualifiedName()))) {
        return receiver;
      }

      TypeInfo element = elementType(receiver, name, node);
      if (element == null && receiver.isUnion()) {
        List<TypeInfo> hits = new ArrayList<>();
        boolean singleton = receiver.singleton();
        for (TypeInfo choice : receiver.choices()) {
          TypeInfo hit = elementType(choice.withSingleton(receiver.singleton()), name, node);
          if (hit != null) {
            hits.add(hit);
            singleton &= hit.singleton();
          }
        }
        if (!hits.isEmpty()) {
          element = TypeInfo.union(hits, singleton);
        }
      }
      if (element == null) {
        if (!receiver.isAny() || implicit) {
          report(
              DiagnosticCode.UNKNOWN_PROPERTY,
              "Unknown property '" + name + "' on " + receiver.display(),
              node);
        }
        return TypeInfo.ANY;
      }
      return receiver.singleton() ? element : element.asCollection();
    }

    private TypeInfo elementType(TypeInfo parent, String name, Node at) {
      return call(
          () -> oracle.getElementType(parent, name),
          "getElementType(" + parent.display() + ", " + name + ")",
          at);
    }

    @Override
    public TypeInfo visitIndex(Index node) {
      TypeInfo collection = type(node.object());
      TypeInfo index = type(node.index());
      if (!TypeConstraint.INTEGER.accepts(index)) {
        report(
            DiagnosticCode.TYPE_MISMATCH,
            "Index must be an Integer but is " + index.display(),
            node.index());
      }
      return collection.asSingleton();
    }

    // === Operators ===

    @Override
    public TypeInfo visitBinary(Binary node) {
      TypeInfo left = type(node.left());
      if (node.op().isTypeOperator()) {
        String op = node.op() == BinaryOp.IS ? "is" : "as";
        return typeOperation(node, op, left, node.right());
      }
      TypeInfo right = type(node.right());
      OperatorSignature signature = OperatorRegistry.resolve(node.op(), left, right);
      if (signature == null) {
        report(
            DiagnosticCode.TYPE_MISMATCH,
            "Operator '"
                + node.op().symbol()
                + "' cannot be applied to "
                + left.display()
                + " and "
                + right.display(),
            node);
        return TypeInfo.ANY_SINGLETON;
      }
      return signature.resultType(left, right);
    }

    @Override
    public TypeInfo visitUnary(Unary node) {
      TypeInfo operand = type(node.operand());
      OperatorSignature signature = OperatorRegistry.resolve(node.op(), operand);
      if (signature == null) {
        report(
            DiagnosticCode.TYPE_MISMATCH,
            "Operator '" + node.op().symbol() + "' cannot be applied to " + operand.display(),
            node);
        return TypeInfo.ANY_SINGLETON;
      }
      return signature.resultType(operand, null);
    }

    @Override
    public TypeInfo visitIif(Iif node) {
      TypeInfo input = type(node.object());
      TypeInfo then;
      TypeInfo otherwise = null;
      // Criterion and branches are evaluated against the receiver
      SystemScope outer = scope;
      scope = scope.push(Map.of(SystemScope.THIS, input.asSingleton()));
      try {
        TypeInfo condition = type(node.condition());
        if (!TypeConstraint.BOOLEAN.accepts(condition)) {
          report(
              DiagnosticCode.TYPE_MISMATCH,
              "iif criterion must be Boolean but is " + condition.display(),
              node.condition());
        }
        then = type(node.then());
        if (node.hasOtherwise()) {
          otherwise = type(node.otherwise());
        }
      } finally {
        scope = outer;
      }
      if (otherwise == null) {
        return then;
      }
      boolean singleton = then.singleton() && otherwise.singleton();
      if (then.sameType(otherwise)) {
        return then.withSingleton(singleton);
      }
      return TypeInfo.union(List.of(then, otherwise), singleton);
    }

    // === Functions ===

    @Override
    public TypeInfo visitInvocation(Invocation node) {
      String name = node.name();
      TypeInfo input = type(node.object());
      if (node.isTypeOperation()) {
        if (node.arguments().size() != 1) {
          report(
              DiagnosticCode.ARITY_MISMATCH,
              "Function '" + name + "' expects 1 argument but got " + node.arguments().size(),
              node);
          node.arguments().forEach(this::type);
          return typeResult(name, TypeInfo.ANY_SINGLETON, input);
        }
        return typeOperation(node, name, input, node.arguments().get(0));
      }

      FunctionSignature signature = FunctionRegistry.get(name);
      if (signature == null) {
        report(DiagnosticCode.UNKNOWN_FUNCTION, "Unknown function '" + name + "'", node);
        node.arguments().forEach(this::type);
        return TypeInfo.ANY;
      }
      int count = node.arguments().size();
      if (!signature.acceptsArity(count)) {
        report(
            DiagnosticCode.ARITY_MISMATCH,
            "Function '"
                + name
                + "' expects "
                + signature.arityText()
                + " argument(s) but got "
                + count,
            node);
      }
      if (!signature.input().accepts(input)) {
        report(
            DiagnosticCode.TYPE_MISMATCH,
            "Function '"
                + name
                + "' expects input of type "
                + signature.input()
                + " but got "
                + input.display(),
            node);
      }
      List<TypeInfo> arguments = arguments(node, signature, input);
      if ("children".equals(name)) {
        return children(input, node);
      }
      return signature.result().apply(input, arguments);
    }

    private List<TypeInfo> arguments(Invocation node, FunctionSignature signature, TypeInfo input) {
      List<Node> args = node.arguments();
      TypeInfo[] argTypes = new TypeInfo[args.size()];
      boolean perElement = false;
      for (int i = 0; i < args.size(); i++) {
        ParamSpec param = signature.parameter(i);
        if (param != null && param.isExpression()) {
          perElement = true;
        } else {
          argTypes[i] = type(args.get(i));
        }
      }
      if (perElement) {
        Map<String, TypeInfo> bindings = new HashMap<>();
        bindings.put(SystemScope.THIS, input.asSingleton());
        bindings.put(SystemScope.INDEX, TypeInfo.INTEGER);
        if ("aggregate".equals(signature.name())) {
          bindings.put(SystemScope.TOTAL, args.size() > 1 ? argTypes[1] : TypeInfo.ANY);
        }
        SystemScope outer = scope;
        scope = scope.push(bindings);
        try {
          for (int i = 0; i < args.size(); i++) {
            ParamSpec param = signature.parameter(i);
            if (param != null && param.isExpression()) {
              argTypes[i] = type(args.get(i));
            }
          }
        } finally {
          scope = outer;
        }
      }
      for (int i = 0; i < args.size(); i++) {
        ParamSpec param = signature.parameter(i);
        if (param != null && !param.type().accepts(argTypes[i])) {
          report(
              DiagnosticCode.TYPE_MISMATCH,
              "Argument '"
                  + param.name()
                  + "' of '"
                  + signature.name()
                  + "' expects "
                  + param.type()
                  + " but got "
                  + argTypes[i].display(),
              args.get(i));
        }
      }
      return Arrays.asList(argTypes);
    }

    private TypeInfo children(TypeInfo input, Node at) {
      if (oracle == null || input.isAny()) {
        return TypeInfo.ANY;
      }
      List<String> names =
          call(
              () -> oracle.listElementNames(input),
              "listElementNames(" + input.display() + ")",
              at);
      if (names == null || names.isEmpty()) {
        return TypeInfo.ANY;
      }
      List<TypeInfo> childTypes = new ArrayList<>();
      for (String name : names) {
        TypeInfo child = elementType(input, name, at);
        if (child != null) {
          childTypes.add(child);
        }
      }
      return childTypes.isEmpty() ? TypeInfo.ANY : TypeInfo.union(childTypes, false);
    }

    // === Type operations ===

    private TypeInfo typeOperation(Node at, String op, TypeInfo operand, Node typeArg) {
      TypeInfo target = type(typeArg);
      String targetName = typeArg instanceof Identifier identifier ? identifier.name() : null;
      if (oracle == null) {
        report(
            DiagnosticCode.MODEL_ORACLE_REQUIRED,
            "A model oracle is required to resolve '" + op + "'",
            at);
        return typeResult(op, target, operand);
      }
      if (targetName == null) {
        return typeResult(op, TypeInfo.ANY_SINGLETON, operand);
      }
      TypeInfo narrowed =
          call(
              () -> oracle.narrowToType(operand, targetName),
              "narrowToType(" + operand.display() + ", " + targetName + ")",
              at);
      if (narrowed == null) {
        if (operand.isUnion()) {
          report(
              DiagnosticCode.EMPTY_TYPE_FILTER,
              options.emptyTypeFilterSeverity(),
              "'"
                  + op
                  + "("
                  + targetName
                  + ")' never matches: "
                  + operand.display()
                  + " has no choice of type "
                  + targetName,
              at);
        } else if (target.isAny()) {
          report(DiagnosticCode.UNKNOWN_TYPE, "Unknown type '" + targetName + "'", typeArg);
        }
      }
      return typeResult(op, narrowed != null ? narrowed : target, operand);
    }

    private TypeInfo typeResult(String op, TypeInfo target, TypeInfo operand) {
      return switch (op) {
        case "is" -> TypeInfo.BOOLEAN;
        case "as" -> target.withSingleton(operand.singleton());
        default -> target.asCollection();
      };
    }

    // === Oracle access ===

    private <T> T call(Supplier<CompletionStage<T>> request, String what, Node at) {
      if (cursorReached) {
        return null;
      }
      cancellation.throwIfCancelled();
      oracleCalls++;
      CompletableFuture<T> future;
      try {
        CompletionStage<T> stage = request.get();
        if (stage == null) {
          return null;
        }
        future = stage.toCompletableFuture();
      } catch (RuntimeException e) {
        lookupFailed(what, e, at);
        return null;
      }
      long pollMillis = Math.max(1, options.pollInterval().toMillis());
      while (true) {
        cancellation.throwIfCancelled();
        try {
          return future.get(pollMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
          log.trace("Waiting for {}", what);
        } catch (ExecutionException e) {
          lookupFailed(what, e.getCause() == null ? e : e.getCause(), at);
          return null;
        } catch (CancellationException e) {
          lookupFailed(what, e, at);
          return null;
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new AnalysisCancelledException("Interrupted while waiting for " + what, e);
        }
      }
    }

    private void lookupFailed(String what, Throwable cause, Node at) {
      log.warn("Model lookup {} failed: {}", what, cause.toString());
      report(
          DiagnosticCode.MODEL_LOOKUP_FAILED,
          "Model lookup " + what + " failed: " + cause.getMessage(),
          at);
    }

    // === Diagnostics ===

    private void report(DiagnosticCode code, String message, Node at) {
      report(code, code.defaultSeverity(), message, at);
    }

    private void report(DiagnosticCode code, Severity severity, String message, Node at) {
      if (cursorReached) {
        return;
      }
      diagnostics.add(new Diagnostic(severity, code, message, at.range(), List.of()));
    }
  }
}
