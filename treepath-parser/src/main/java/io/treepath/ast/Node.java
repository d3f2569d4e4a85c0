package io.treepath.ast;

import io.treepath.lexer.Range;
import io.treepath.lexer.TokenType;

/**
 * Abstract syntax tree of a TreePath expression.
 *
 * <p>The set of node kinds is closed. Consumers dispatch through {@link NodeVisitor}, which forces
 * every implementation to handle every kind. Nodes own their children, hold no parent references
 * and are never modified after parsing; analysis results are kept in side tables keyed by node
 * identity so one tree can be analyzed any number of times.
 *
 * <p>Example: {@code Patient.name.where(use = 'official')} parses to
 *
 * <pre>
 * Invocation(where)
 *   object: Member(name)
 *     object: Member(Patient)
 *       object: SpecialVariable($this, implicit)
 *   arguments: Binary(=)
 *     left: Member(use) on SpecialVariable($this, implicit)
 *     right: Literal('official')
 * </pre>
 */
public sealed interface Node
    permits Literal,
        Identifier,
        SpecialVariable,
        EnvironmentVariable,
        Member,
        Invocation,
        Index,
        Binary,
        Unary,
        Iif,
        StandaloneCall,
        Quantity,
        EmptyCollection,
        ErrorNode,
        IncompleteNode {

  /** Source span covered by this node and its children. */
  Range range();

  <R> R accept(NodeVisitor<R> visitor);

  /** Literal value kinds. */
  enum LiteralKind {
    STRING,
    INTEGER,
    DECIMAL,
    BOOLEAN,
    DATE,
    DATETIME,
    TIME
  }

  /** Binary operators in increasing precedence order. */
  enum BinaryOp {
    IMPLIES("implies", 1),
    OR("or", 2),
    XOR("xor", 2),
    AND("and", 3),
    IN("in", 4),
    CONTAINS("contains", 4),
    EQUALS("=", 5),
    NOT_EQUALS("!=", 5),
    EQUIVALENT("~", 5),
    NOT_EQUIVALENT("!~", 5),
    LESS_THAN("<", 6),
    LESS_OR_EQUAL("<=", 6),
    GREATER_THAN(">", 6),
    GREATER_OR_EQUAL(">=", 6),
    UNION("|", 7),
    IS("is", 8),
    AS("as", 8),
    PLUS("+", 9),
    MINUS("-", 9),
    CONCAT("&", 9),
    MULTIPLY("*", 10),
    DIVIDE("/", 10),
    DIV("div", 10),
    MOD("mod", 10);

    private final String symbol;
    private final int precedence;

    BinaryOp(String symbol, int precedence) {
      this.symbol = symbol;
      this.precedence = precedence;
    }

    public String symbol() {
      return symbol;
    }

    public int precedence() {
      return precedence;
    }

    /** Whether the right operand is a type specifier rather than an expression. */
    public boolean isTypeOperator() {
      return this == IS || this == AS;
    }

    /**
     * Maps a token type to the binary operator it introduces.
     *
     * @return the operator, or null if the token is not a binary operator
     */
    public static BinaryOp fromToken(TokenType type) {
      return switch (type) {
        case IMPLIES -> IMPLIES;
        case OR -> OR;
        case XOR -> XOR;
        case AND -> AND;
        case IN -> IN;
        case CONTAINS -> CONTAINS;
        case EQ -> EQUALS;
        case NEQ -> NOT_EQUALS;
        case SIMILAR -> EQUIVALENT;
        case NOT_SIMILAR -> NOT_EQUIVALENT;
        case LT -> LESS_THAN;
        case LTE -> LESS_OR_EQUAL;
        case GT -> GREATER_THAN;
        case GTE -> GREATER_OR_EQUAL;
        case PIPE -> UNION;
        case IS -> IS;
        case AS -> AS;
        case PLUS -> PLUS;
        case MINUS -> MINUS;
        case AMPERSAND -> CONCAT;
        case STAR -> MULTIPLY;
        case SLASH -> DIVIDE;
        case DIV -> DIV;
        case MOD -> MOD;
        default -> null;
      };
    }
  }

  /** Prefix operators. */
  enum UnaryOp {
    PLUS("+"),
    MINUS("-"),
    NOT("not");

    private final String symbol;

    UnaryOp(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }
  }
}
