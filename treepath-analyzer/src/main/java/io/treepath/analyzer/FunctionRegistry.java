package io.treepath.analyzer;

import static io.treepath.model.PrimitiveType.*;

import io.treepath.analyzer.FunctionSignature.FunctionCategory;
import io.treepath.analyzer.ResultRule.Cardinality;
import io.treepath.model.PrimitiveType;
import io.treepath.model.TypeInfo;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Catalogue of built-in functions with their type signatures. The analyzer checks arity, receiver
 * and argument types against these entries and derives result types from their rules.
 *
 * <p>{@code ofType}, {@code is}, {@code as}, {@code children} and {@code descendants} are listed
 * for completeness; their result types depend on the model and are computed by the analyzer.
 */
public final class FunctionRegistry {

  private static final Map<String, FunctionSignature> FUNCTIONS = new LinkedHashMap<>();

  private static final PrimitiveType[] CONVERSION_TARGETS = {
    BOOLEAN, INTEGER, LONG, DECIMAL, STRING, DATE, DATETIME, TIME, QUANTITY
  };

  static {
    registerExistenceFunctions();
    registerFilteringFunctions();
    registerSubsettingFunctions();
    registerCombiningFunctions();
    registerConversionFunctions();
    registerStringFunctions();
    registerMathFunctions();
    registerTreeFunctions();
    registerUtilityFunctions();
    registerAggregateFunctions();
    registerTypeFunctions();
  }

  private static void registerExistenceFunctions() {
    register(
        FunctionSignature.builder("empty")
            .category(FunctionCategory.EXISTENCE)
            .returns(BOOLEAN)
            .build());

    // exists([criteria]) - criteria evaluated per element
    register(
        FunctionSignature.builder("exists")
            .category(FunctionCategory.EXISTENCE)
            .param(ParamSpec.optionalExpression("criteria", TypeConstraint.BOOLEAN, "Filter"))
            .returns(BOOLEAN)
            .description("True when the input, optionally filtered, is not empty")
            .build());

    register(
        FunctionSignature.builder("all")
            .category(FunctionCategory.EXISTENCE)
            .expression("criteria", TypeConstraint.BOOLEAN, "Condition every element must meet")
            .returns(BOOLEAN)
            .build());

    for (String name : List.of("allTrue", "anyTrue", "allFalse", "anyFalse")) {
      register(
          FunctionSignature.builder(name)
              .category(FunctionCategory.EXISTENCE)
              .input(TypeConstraint.BOOLEAN)
              .returns(BOOLEAN)
              .build());
    }

    for (String name : List.of("subsetOf", "supersetOf")) {
      register(
          FunctionSignature.builder(name)
              .category(FunctionCategory.EXISTENCE)
              .value("other", TypeConstraint.ANY, "Collection to compare with")
              .returns(BOOLEAN)
              .build());
    }

    register(
        FunctionSignature.builder("count")
            .category(FunctionCategory.EXISTENCE)
            .returns(INTEGER)
            .build());
    register(
        FunctionSignature.builder("distinct")
            .category(FunctionCategory.EXISTENCE)
            .returns(ResultRule.preserveInput(Cardinality.COLLECTION))
            .build());
    register(
        FunctionSignature.builder("isDistinct")
            .category(FunctionCategory.EXISTENCE)
            .returns(BOOLEAN)
            .build());
  }

  private static void registerFilteringFunctions() {
    register(
        FunctionSignature.builder("where")
            .category(FunctionCategory.FILTERING)
            .expression("criteria", TypeConstraint.BOOLEAN, "Condition evaluated per element")
            .returns(ResultRule.preserveInput(Cardinality.COLLECTION))
            .description("Elements for which the criteria is true")
            .build());

    register(
        FunctionSignature.builder("select")
            .category(FunctionCategory.FILTERING)
            .expression("projection", TypeConstraint.ANY, "Expression evaluated per element")
            .returns(ResultRule.computed("projection collection", (in, args) -> projection(args)))
            .description("Flattened results of the projection")
            .build());

    register(
        FunctionSignature.builder("repeat")
            .category(FunctionCategory.FILTERING)
            .expression("projection", TypeConstraint.ANY, "Expression applied until no new items")
            .returns(ResultRule.computed("projection collection", (in, args) -> projection(args)))
            .build());
  }

  private static void registerSubsettingFunctions() {
    for (String name : List.of("single", "first", "last")) {
      register(
          FunctionSignature.builder(name)
              .category(FunctionCategory.SUBSETTING)
              .returns(ResultRule.preserveInput(Cardinality.SINGLETON))
              .build());
    }
    register(
        FunctionSignature.builder("tail")
            .category(FunctionCategory.SUBSETTING)
            .returns(ResultRule.preserveInput(Cardinality.COLLECTION))
            .build());
    for (String name : List.of("skip", "take")) {
      register(
          FunctionSignature.builder(name)
              .category(FunctionCategory.SUBSETTING)
              .value("num", TypeConstraint.INTEGER, "Number of elements")
              .returns(ResultRule.preserveInput(Cardinality.COLLECTION))
              .build());
    }
    for (String name : List.of("intersect", "exclude")) {
      register(
          FunctionSignature.builder(name)
              .category(FunctionCategory.SUBSETTING)
              .value("other", TypeConstraint.ANY, "Collection to compare with")
              .returns(ResultRule.preserveInput(Cardinality.COLLECTION))
              .build());
    }
  }

  private static void registerCombiningFunctions() {
    for (String name : List.of("union", "combine")) {
      register(
          FunctionSignature.builder(name)
              .category(FunctionCategory.COMBINING)
              .value("other", TypeConstraint.ANY, "Collection to merge")
              .returns(ResultRule.computed("union of input and other", FunctionRegistry::merge))
              .build());
    }
  }

  private static void registerConversionFunctions() {
    for (PrimitiveType target : CONVERSION_TARGETS) {
      register(
          FunctionSignature.builder("to" + target.typeName())
              .category(FunctionCategory.CONVERSION)
              .returns(target)
              .description("Converts the input to " + target.typeName())
              .build());
      register(
          FunctionSignature.builder("convertsTo" + target.typeName())
              .category(FunctionCategory.CONVERSION)
              .returns(BOOLEAN)
              .description("True when the input can be converted to " + target.typeName())
              .build());
    }
  }

  private static void registerStringFunctions() {
    stringFunction("indexOf", INTEGER, List.of(ParamSpec.value("substring", str(), "")));
    stringFunction(
        "substring",
        STRING,
        List.of(
            ParamSpec.value("start", TypeConstraint.INTEGER, "Start index"),
            ParamSpec.optionalValue("length", TypeConstraint.INTEGER, "Number of characters")));
    stringFunction("startsWith", BOOLEAN, List.of(ParamSpec.value("prefix", str(), "")));
    stringFunction("endsWith", BOOLEAN, List.of(ParamSpec.value("suffix", str(), "")));
    stringFunction("contains", BOOLEAN, List.of(ParamSpec.value("substring", str(), "")));
    stringFunction("upper", STRING, List.of());
    stringFunction("lower", STRING, List.of());
    stringFunction(
        "replace",
        STRING,
        List.of(
            ParamSpec.value("pattern", str(), "Text to replace"),
            ParamSpec.value("substitution", str(), "Replacement text")));
    stringFunction("matches", BOOLEAN, List.of(ParamSpec.value("regex", str(), "")));
    stringFunction(
        "replaceMatches",
        STRING,
        List.of(
            ParamSpec.value("regex", str(), "Pattern to replace"),
            ParamSpec.value("substitution", str(), "Replacement text")));
    stringFunction("length", INTEGER, List.of());
    stringFunction("trim", STRING, List.of());

    register(
        FunctionSignature.builder("toChars")
            .category(FunctionCategory.STRING)
            .input(TypeConstraint.STRING)
            .returnsCollection(STRING)
            .build());
    register(
        FunctionSignature.builder("split")
            .category(FunctionCategory.STRING)
            .input(TypeConstraint.STRING)
            .value("separator", str(), "Separator")
            .returnsCollection(STRING)
            .build());
    register(
        FunctionSignature.builder("join")
            .category(FunctionCategory.STRING)
            .input(TypeConstraint.STRING)
            .optionalValue("separator", str(), "Separator")
            .returns(STRING)
            .build());
  }

  private static void registerMathFunctions() {
    register(
        FunctionSignature.builder("abs")
            .category(FunctionCategory.MATH)
            .input(TypeConstraint.NUMERIC_OR_QUANTITY)
            .returns(ResultRule.preserveInput(Cardinality.SINGLETON))
            .build());
    for (String name : List.of("ceiling", "floor", "truncate")) {
      register(
          FunctionSignature.builder(name)
              .category(FunctionCategory.MATH)
              .input(TypeConstraint.NUMERIC)
              .returns(INTEGER)
              .build());
    }
    for (String name : List.of("exp", "ln", "sqrt")) {
      register(
          FunctionSignature.builder(name)
              .category(FunctionCategory.MATH)
              .input(TypeConstraint.NUMERIC)
              .returns(DECIMAL)
              .build());
    }
    register(
        FunctionSignature.builder("log")
            .category(FunctionCategory.MATH)
            .input(TypeConstraint.NUMERIC)
            .value("base", TypeConstraint.NUMERIC, "Logarithm base")
            .returns(DECIMAL)
            .build());
    register(
        FunctionSignature.builder("power")
            .category(FunctionCategory.MATH)
            .input(TypeConstraint.NUMERIC)
            .value("exponent", TypeConstraint.NUMERIC, "Exponent")
            .returns(ResultRule.numericPromotion())
            .build());
    register(
        FunctionSignature.builder("round")
            .category(FunctionCategory.MATH)
            .input(TypeConstraint.NUMERIC)
            .optionalValue("precision", TypeConstraint.INTEGER, "Decimal places")
            .returns(DECIMAL)
            .build());
  }

  private static void registerTreeFunctions() {
    register(
        FunctionSignature.builder("children")
            .category(FunctionCategory.TREE)
            .returns(ResultRule.fixedCollection(ANY))
            .description("Direct child nodes of every element")
            .build());
    register(
        FunctionSignature.builder("descendants")
            .category(FunctionCategory.TREE)
            .returns(ResultRule.fixedCollection(ANY))
            .description("All descendant nodes of every element")
            .build());
  }

  private static void registerUtilityFunctions() {
    register(
        FunctionSignature.builder("trace")
            .category(FunctionCategory.UTILITY)
            .value("name", TypeConstraint.STRING, "Trace label")
            .param(ParamSpec.optionalExpression("projection", TypeConstraint.ANY, "Logged value"))
            .returns(ResultRule.preserveInput(Cardinality.SAME_AS_INPUT))
            .build());
    register(
        FunctionSignature.builder("not")
            .category(FunctionCategory.UTILITY)
            .input(TypeConstraint.BOOLEAN)
            .returns(BOOLEAN)
            .build());
    register(
        FunctionSignature.builder("hasValue")
            .category(FunctionCategory.UTILITY)
            .returns(BOOLEAN)
            .build());
    register(
        FunctionSignature.builder("today")
            .category(FunctionCategory.UTILITY)
            .returns(DATE)
            .build());
    register(
        FunctionSignature.builder("now")
            .category(FunctionCategory.UTILITY)
            .returns(DATETIME)
            .build());
    register(
        FunctionSignature.builder("timeOfDay")
            .category(FunctionCategory.UTILITY)
            .returns(TIME)
            .build());
  }

  private static void registerAggregateFunctions() {
    register(
        FunctionSignature.builder("aggregate")
            .category(FunctionCategory.AGGREGATE)
            .expression("aggregator", TypeConstraint.ANY, "Expression combining $this and $total")
            .optionalValue("init", TypeConstraint.ANY, "Initial value of $total")
            .returns(ResultRule.computed("aggregator result", (in, args) -> projection(args)))
            .build());
    register(
        FunctionSignature.builder("sum")
            .category(FunctionCategory.AGGREGATE)
            .input(TypeConstraint.NUMERIC_OR_QUANTITY)
            .returns(ResultRule.numericPromotion())
            .build());
    for (String name : List.of("min", "max")) {
      register(
          FunctionSignature.builder(name)
              .category(FunctionCategory.AGGREGATE)
              .input(
                  TypeConstraint.of(INTEGER, LONG, DECIMAL, QUANTITY, STRING, DATE, DATETIME, TIME))
              .returns(ResultRule.preserveInput(Cardinality.SINGLETON))
              .build());
    }
    register(
        FunctionSignature.builder("avg")
            .category(FunctionCategory.AGGREGATE)
            .input(TypeConstraint.NUMERIC_OR_QUANTITY)
            .returns(
                ResultRule.computed(
                    "Quantity for quantities, Decimal otherwise",
                    (in, args) ->
                        in.baseType() == QUANTITY ? TypeInfo.system(QUANTITY) : TypeInfo.DECIMAL))
            .build());
  }

  private static void registerTypeFunctions() {
    register(
        FunctionSignature.builder("ofType")
            .category(FunctionCategory.TYPE)
            .param(ParamSpec.typeName("type", "Type to keep"))
            .returns(ResultRule.fixedCollection(ANY))
            .build());
    register(
        FunctionSignature.builder("is")
            .category(FunctionCategory.TYPE)
            .param(ParamSpec.typeName("type", "Type to test"))
            .returns(BOOLEAN)
            .build());
    register(
        FunctionSignature.builder("as")
            .category(FunctionCategory.TYPE)
            .param(ParamSpec.typeName("type", "Type to cast to"))
            .returns(ResultRule.fixed(ANY))
            .build());
  }

  private static void stringFunction(String name, PrimitiveType result, List<ParamSpec> params) {
    FunctionSignature.Builder builder =
        FunctionSignature.builder(name)
            .category(FunctionCategory.STRING)
            .input(TypeConstraint.STRING)
            .returns(result);
    params.forEach(builder::param);
    register(builder.build());
  }

  private static TypeConstraint str() {
    return TypeConstraint.STRING;
  }

  private static TypeInfo projection(List<TypeInfo> args) {
    return args.isEmpty() || args.get(0) == null ? TypeInfo.ANY : args.get(0).asCollection();
  }

  private static TypeInfo merge(TypeInfo input, List<TypeInfo> args) {
    if (args.isEmpty() || args.get(0) == null) {
      return input.asCollection();
    }
    return TypeInfo.union(List.of(input, args.get(0)), false);
  }

  private static void register(FunctionSignature signature) {
    FUNCTIONS.put(signature.name(), signature);
  }

  // === PUBLIC API ===

  /** Get a function by name, or null when unknown */
  public static FunctionSignature get(String name) {
    return FUNCTIONS.get(name);
  }

  /** Check if a function exists */
  public static boolean exists(String name) {
    return FUNCTIONS.containsKey(name);
  }

  /** Get all registered functions */
  public static Collection<FunctionSignature> getAllFunctions() {
    return Collections.unmodifiableCollection(FUNCTIONS.values());
  }

  /** Get the functions of one category */
  public static List<FunctionSignature> getFunctions(FunctionCategory category) {
    return FUNCTIONS.values().stream()
        .filter(f -> f.category() == category)
        .collect(Collectors.toList());
  }

  /** Names of the functions that evaluate an argument per element */
  public static Set<String> lambdaFunctionNames() {
    return FUNCTIONS.values().stream()
        .filter(FunctionSignature::isLambda)
        .map(FunctionSignature::name)
        .collect(Collectors.toUnmodifiableSet());
  }

  private FunctionRegistry() {
    // Prevent instantiation
  }
}
