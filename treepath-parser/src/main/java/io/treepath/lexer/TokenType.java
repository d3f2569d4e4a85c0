package io.treepath.lexer;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Token types of the TreePath language.
 *
 * <p>Word keywords and calendar-duration units carry their spelling so that the lexer can classify
 * identifiers with one map lookup. There is no {@code null} keyword: the null literal is the empty
 * collection {@code {}}, lexed as {@link #NULL} when the braces are adjacent. Braces separated by
 * trivia arrive as {@link #LBRACE} and {@link #RBRACE} and the parser joins them.
 */
public enum TokenType {
  // Literals
  /** Boolean literal: true */
  TRUE("true", Category.KEYWORD),

  /** Boolean literal: false */
  FALSE("false", Category.KEYWORD),

  /** Null literal, the empty collection: {} */
  NULL("{}", Category.LITERAL),

  /** String literal: 'value' */
  STRING(null, Category.LITERAL),

  /** Number literal: 12, 3.25 */
  NUMBER(null, Category.LITERAL),

  /** Date literal: @2024-01-15 */
  DATE(null, Category.LITERAL),

  /** Date-time literal: @2024-01-15T10:00Z */
  DATETIME(null, Category.LITERAL),

  /** Time literal: @T10:00 */
  TIME(null, Category.LITERAL),

  // Identifiers and variables
  IDENTIFIER(null, Category.IDENTIFIER),

  /** Backtick-quoted identifier: `given name` */
  DELIMITED_IDENTIFIER(null, Category.IDENTIFIER),

  /** Environment variable: %name, %`name`, %'name' */
  ENV_VAR(null, Category.VARIABLE),

  THIS("$this", Category.VARIABLE),
  INDEX("$index", Category.VARIABLE),
  TOTAL("$total", Category.VARIABLE),

  // Word operators
  DIV("div", Category.KEYWORD),
  MOD("mod", Category.KEYWORD),
  IN("in", Category.KEYWORD),
  CONTAINS("contains", Category.KEYWORD),
  AND("and", Category.KEYWORD),
  OR("or", Category.KEYWORD),
  XOR("xor", Category.KEYWORD),
  IMPLIES("implies", Category.KEYWORD),
  IS("is", Category.KEYWORD),
  AS("as", Category.KEYWORD),

  // Calendar-duration units
  YEAR("year", Category.UNIT),
  YEARS("years", Category.UNIT),
  MONTH("month", Category.UNIT),
  MONTHS("months", Category.UNIT),
  WEEK("week", Category.UNIT),
  WEEKS("weeks", Category.UNIT),
  DAY("day", Category.UNIT),
  DAYS("days", Category.UNIT),
  HOUR("hour", Category.UNIT),
  HOURS("hours", Category.UNIT),
  MINUTE("minute", Category.UNIT),
  MINUTES("minutes", Category.UNIT),
  SECOND("second", Category.UNIT),
  SECONDS("seconds", Category.UNIT),
  MILLISECOND("millisecond", Category.UNIT),
  MILLISECONDS("milliseconds", Category.UNIT),

  // Punctuation
  DOT(".", Category.SYMBOL),
  COMMA(",", Category.SYMBOL),
  LPAREN("(", Category.SYMBOL),
  RPAREN(")", Category.SYMBOL),
  LBRACKET("[", Category.SYMBOL),
  RBRACKET("]", Category.SYMBOL),
  LBRACE("{", Category.SYMBOL),
  RBRACE("}", Category.SYMBOL),

  // Symbolic operators
  PLUS("+", Category.SYMBOL),
  MINUS("-", Category.SYMBOL),
  STAR("*", Category.SYMBOL),
  SLASH("/", Category.SYMBOL),
  AMPERSAND("&", Category.SYMBOL),
  PIPE("|", Category.SYMBOL),
  EQ("=", Category.SYMBOL),
  NEQ("!=", Category.SYMBOL),
  SIMILAR("~", Category.SYMBOL),
  NOT_SIMILAR("!~", Category.SYMBOL),
  LT("<", Category.SYMBOL),
  LTE("<=", Category.SYMBOL),
  GT(">", Category.SYMBOL),
  GTE(">=", Category.SYMBOL),

  // Trivia, only emitted when trivia is preserved
  WHITESPACE(null, Category.TRIVIA),

  /** Block comment: /* ... *&#47; */
  COMMENT(null, Category.TRIVIA),

  /** Line comment: // ... */
  LINE_COMMENT(null, Category.TRIVIA),

  /** Unlexable input, only produced when the lexer recovers from errors */
  ERROR(null, Category.SPECIAL),

  /** End of input */
  EOF(null, Category.SPECIAL);

  /** Lexical families used for classification. */
  public enum Category {
    LITERAL,
    IDENTIFIER,
    VARIABLE,
    KEYWORD,
    UNIT,
    SYMBOL,
    TRIVIA,
    SPECIAL
  }

  private static final Map<String, TokenType> WORDS;

  static {
    Map<String, TokenType> words = new HashMap<>();
    for (TokenType type : values()) {
      if (type.category == Category.KEYWORD || type.category == Category.UNIT) {
        words.put(type.text, type);
      }
    }
    WORDS = Collections.unmodifiableMap(words);
  }

  private final String text;
  private final Category category;

  TokenType(String text, Category category) {
    this.text = text;
    this.category = category;
  }

  /** Fixed spelling of this token type, or null when the text varies. */
  public String text() {
    return text;
  }

  public Category category() {
    return category;
  }

  public boolean isTrivia() {
    return category == Category.TRIVIA;
  }

  public boolean isCalendarUnit() {
    return category == Category.UNIT;
  }

  /**
   * Whether a token of this type may stand in for a plain identifier (member, function or type
   * name). Keywords are always lexed as keywords; only the parser decides by position.
   */
  public boolean isIdentifierLike() {
    return category == Category.IDENTIFIER
        || category == Category.KEYWORD
        || category == Category.UNIT;
  }

  /**
   * Keywords that may also begin an expression as a plain identifier: {@code as}, {@code is},
   * {@code in} and {@code contains}.
   */
  public boolean isSoftKeyword() {
    return this == AS || this == IS || this == IN || this == CONTAINS;
  }

  /** Human-readable name used in error messages. */
  public String describe() {
    return text != null ? "'" + text + "'" : name().toLowerCase().replace('_', ' ');
  }

  /**
   * Classifies a bare word.
   *
   * @param word identifier text
   * @return the keyword or unit type, or {@link #IDENTIFIER} for any other word
   */
  public static TokenType classifyWord(String word) {
    return WORDS.getOrDefault(word, IDENTIFIER);
  }
}
