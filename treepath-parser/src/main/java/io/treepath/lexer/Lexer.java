package io.treepath.lexer;

import io.treepath.diagnostics.Diagnostic;
import io.treepath.diagnostics.DiagnosticCode;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tokenizer for TreePath expressions.
 *
 * <p>The lexer performs a single left-to-right pass over the source. A 128-entry character class
 * table drives dispatch for words, numbers and whitespace; punctuation is handled by a switch on
 * the current character with one character of lookahead for two-character operators.
 *
 * <p>The lexer recognizes:
 *
 * <ul>
 *   <li>Punctuation and operators: . , ( ) [ ] { } + - * / &amp; | = != ~ !~ &lt; &lt;= &gt; &gt;=
 *   <li>Literals: 'strings', numbers, @dates, @date-times, @Ttimes, true, false
 *   <li>Identifiers: plain words, `delimited identifiers`, %environment variables, $this, $index,
 *       $total
 *   <li>Keywords and calendar-duration units, always emitted as their own token types
 *   <li>Trivia: whitespace, // line comments and /* block comments
 * </ul>
 *
 * <p>Instances are immutable and may be shared between threads; all scanning state lives in a
 * per-call cursor.
 */
public final class Lexer {

  private static final Logger log = LoggerFactory.getLogger(Lexer.class);

  private static final byte DIGIT = 1;
  private static final byte LETTER = 1 << 1;
  private static final byte ID_START = 1 << 2;
  private static final byte ID_PART = 1 << 3;
  private static final byte SPACE = 1 << 4;
  private static final byte HEX = 1 << 5;

  private static final byte[] CHAR_CLASS = new byte[128];

  static {
    for (char c = '0'; c <= '9'; c++) {
      CHAR_CLASS[c] = DIGIT | ID_PART | HEX;
    }
    for (char c = 'a'; c <= 'z'; c++) {
      CHAR_CLASS[c] = LETTER | ID_START | ID_PART;
    }
    for (char c = 'A'; c <= 'Z'; c++) {
      CHAR_CLASS[c] = LETTER | ID_START | ID_PART;
    }
    for (char c = 'a'; c <= 'f'; c++) {
      CHAR_CLASS[c] |= HEX;
    }
    for (char c = 'A'; c <= 'F'; c++) {
      CHAR_CLASS[c] |= HEX;
    }
    CHAR_CLASS['_'] = ID_START | ID_PART;
    CHAR_CLASS[' '] = SPACE;
    CHAR_CLASS['\t'] = SPACE;
    CHAR_CLASS['\n'] = SPACE;
    CHAR_CLASS['\r'] = SPACE;
    CHAR_CLASS['\f'] = SPACE;
  }

  private final LexerOptions options;

  public Lexer() {
    this(LexerOptions.DEFAULT);
  }

  public Lexer(LexerOptions options) {
    this.options = options == null ? LexerOptions.DEFAULT : options;
  }

  public LexerOptions options() {
    return options;
  }

  /**
   * Tokenizes an expression.
   *
   * <p>Unless the lexer was configured to recover, the first lexical problem aborts the scan and no
   * tokens are returned.
   *
   * @param source expression text; null is treated as empty
   * @return tokens in source order, ending with an EOF token
   * @throws LexException on malformed input when not recovering
   */
  public List<Token> tokenize(String source) {
    return scan(source).tokens();
  }

  /**
   * Tokenizes an expression, recording lexical problems as diagnostics instead of throwing.
   * Unlexable regions become {@link TokenType#ERROR} tokens.
   *
   * @param source expression text; null is treated as empty
   * @return tokens and diagnostics
   */
  public LexResult tokenizeRecovering(String source) {
    return new Cursor(source == null ? "" : source, options.preserveTrivia(), true).run();
  }

  private LexResult scan(String source) {
    return new Cursor(source == null ? "" : source, options.preserveTrivia(), options.recover())
        .run();
  }

  static boolean isDigit(char c) {
    return c < 128 && (CHAR_CLASS[c] & DIGIT) != 0;
  }

  static boolean isHex(char c) {
    return c < 128 && (CHAR_CLASS[c] & HEX) != 0;
  }

  static boolean isIdentifierStart(char c) {
    return c < 128 && (CHAR_CLASS[c] & ID_START) != 0;
  }

  static boolean isIdentifierPart(char c) {
    return c < 128 && (CHAR_CLASS[c] & ID_PART) != 0;
  }

  static boolean isSpace(char c) {
    return c < 128 && (CHAR_CLASS[c] & SPACE) != 0;
  }

  /** Scanning state of one tokenize call. */
  private static final class Cursor {
    private static final char NONE = '\0';

    private final String src;
    private final int len;
    private final boolean trivia;
    private final boolean recover;
    private final List<Token> tokens = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    private int pos;
    private int line = 1;
    private int column = 1;

    // Start of the token being scanned
    private Position tokenStart;

    Cursor(String src, boolean trivia, boolean recover) {
      this.src = src;
      this.len = src.length();
      this.trivia = trivia;
      this.recover = recover;
    }

    LexResult run() {
      while (pos < len) {
        tokenStart = here();
        int startOffset = pos;
        try {
          scanToken();
        } catch (LexException e) {
          if (!recover) {
            throw e;
          }
          diagnostics.add(e.toDiagnostic());
          resync(startOffset);
          tokens.add(token(TokenType.ERROR, src.substring(startOffset, pos), null));
        }
      }
      tokens.add(new Token(TokenType.EOF, "", "", Range.at(here()), Channel.DEFAULT));
      if (log.isDebugEnabled()) {
        log.debug(
            "Tokenized {} chars into {} tokens ({} diagnostics)",
            len,
            tokens.size(),
            diagnostics.size());
      }
      return new LexResult(tokens, diagnostics);
    }

    private void scanToken() {
      char c = peek();

      if (isSpace(c)) {
        while (pos < len && isSpace(peek())) {
          advance();
        }
        emitTrivia(TokenType.WHITESPACE);
        return;
      }

      if (c == '/' && peek(1) == '/') {
        while (pos < len && peek() != '\n') {
          advance();
        }
        emitTrivia(TokenType.LINE_COMMENT);
        return;
      }

      if (c == '/' && peek(1) == '*') {
        advance();
        advance();
        while (!(peek() == '*' && peek(1) == '/')) {
          if (pos >= len) {
            throw error(DiagnosticCode.UNTERMINATED_COMMENT, "Unterminated block comment", null);
          }
          advance();
        }
        advance();
        advance();
        emitTrivia(TokenType.COMMENT);
        return;
      }

      if (isDigit(c)) {
        scanNumber();
        return;
      }

      if (isIdentifierStart(c)) {
        String word = readWord();
        TokenType type = TokenType.classifyWord(word);
        tokens.add(token(type, word, word));
        return;
      }

      switch (c) {
        case '\'' -> {
          String value = readQuoted('\'', DiagnosticCode.UNTERMINATED_STRING, "string");
          tokens.add(token(TokenType.STRING, text(), value));
        }
        case '`' -> {
          String value =
              readQuoted('`', DiagnosticCode.UNTERMINATED_IDENTIFIER, "delimited identifier");
          tokens.add(token(TokenType.DELIMITED_IDENTIFIER, text(), value));
        }
        case '@' -> scanDateTime();
        case '%' -> scanEnvironmentVariable();
        case '$' -> scanSpecialVariable();
        case '.' -> single(TokenType.DOT);
        case ',' -> single(TokenType.COMMA);
        case '(' -> single(TokenType.LPAREN);
        case ')' -> single(TokenType.RPAREN);
        case '[' -> single(TokenType.LBRACKET);
        case ']' -> single(TokenType.RBRACKET);
        case '{' -> {
          if (peek(1) == '}') {
            pair(TokenType.NULL);
          } else {
            single(TokenType.LBRACE);
          }
        }
        case '}' -> single(TokenType.RBRACE);
        case '+' -> single(TokenType.PLUS);
        case '-' -> single(TokenType.MINUS);
        case '*' -> single(TokenType.STAR);
        case '/' -> single(TokenType.SLASH);
        case '&' -> single(TokenType.AMPERSAND);
        case '|' -> single(TokenType.PIPE);
        case '=' -> single(TokenType.EQ);
        case '~' -> single(TokenType.SIMILAR);
        case '<' -> {
          if (peek(1) == '=') {
            pair(TokenType.LTE);
          } else {
            single(TokenType.LT);
          }
        }
        case '>' -> {
          if (peek(1) == '=') {
            pair(TokenType.GTE);
          } else {
            single(TokenType.GT);
          }
        }
        case '!' -> {
          if (peek(1) == '=') {
            pair(TokenType.NEQ);
          } else if (peek(1) == '~') {
            pair(TokenType.NOT_SIMILAR);
          } else {
            advance();
            throw error(DiagnosticCode.UNEXPECTED_CHARACTER, "Expected '=' or '~' after '!'", '!');
          }
        }
        default -> {
          advance();
          throw new LexException(
              "Unexpected character '" + c + "'",
              new Range(tokenStart, here()),
              DiagnosticCode.UNEXPECTED_CHARACTER,
              c);
        }
      }
    }

    // Literals

    private void scanNumber() {
      while (isDigit(peek())) {
        advance();
      }
      if (peek() == '.' && isDigit(peek(1))) {
        advance();
        while (isDigit(peek())) {
          advance();
        }
      }
      String text = text();
      tokens.add(token(TokenType.NUMBER, text, text));
    }

    /**
     * Reads a quoted body starting at the opening quote and returns its decoded content. Escapes:
     * \` \' \" \\ \/ \f \n \r \t and \\uXXXX.
     */
    private String readQuoted(char quote, DiagnosticCode unterminated, String what) {
      advance();
      StringBuilder value = new StringBuilder();
      while (true) {
        if (pos >= len) {
          throw new LexException(
              "Unterminated " + what,
              new Range(tokenStart, here()),
              unterminated,
              null);
        }
        char c = peek();
        if (c == quote) {
          advance();
          return value.toString();
        }
        if (c != '\\') {
          value.append(c);
          advance();
          continue;
        }
        advance();
        if (pos >= len) {
          throw new LexException(
              "Unterminated " + what, new Range(tokenStart, here()), unterminated, null);
        }
        char e = peek();
        switch (e) {
          case '`', '\'', '"', '\\', '/' -> value.append(e);
          case 'f' -> value.append('\f');
          case 'n' -> value.append('\n');
          case 'r' -> value.append('\r');
          case 't' -> value.append('\t');
          case 'u' -> {
            advance();
            value.append(readUnicodeEscape());
            continue;
          }
          default -> throw charError(DiagnosticCode.INVALID_ESCAPE, "Invalid escape '\\" + e + "'");
        }
        advance();
      }
    }

    private char readUnicodeEscape() {
      int code = 0;
      for (int i = 0; i < 4; i++) {
        if (pos >= len || !isHex(peek())) {
          throw charError(
              DiagnosticCode.INVALID_UNICODE_ESCAPE,
              "Unicode escape requires exactly four hex digits");
        }
        code = (code << 4) | Character.digit(peek(), 16);
        advance();
      }
      return (char) code;
    }

    /**
     * Scans a date, date-time or time literal starting at '@'.
     *
     * <pre>
     * '@' 'T' time
     * '@' YYYY ('-' MM ('-' DD)?)? ('T' time?)? timezone?
     * time     := HH (':' MM (':' SS ('.' digits)?)?)?
     * timezone := 'Z' | ('+' | '-') HH ':' MM
     * </pre>
     */
    private void scanDateTime() {
      advance();
      if (peek() == 'T') {
        advance();
        fixedDigits(2, "hour");
        scanTimeRest();
        tokens.add(token(TokenType.TIME, text(), text().substring(1)));
        return;
      }

      boolean hasTime = false;
      fixedDigits(4, "year");
      if (peek() == '-' && isDigit(peek(1))) {
        advance();
        fixedDigits(2, "month");
        if (peek() == '-' && isDigit(peek(1))) {
          advance();
          fixedDigits(2, "day");
        }
      }
      if (peek() == 'T') {
        hasTime = true;
        advance();
        if (isDigit(peek())) {
          fixedDigits(2, "hour");
          scanTimeRest();
        }
      }
      if (peek() == 'Z') {
        advance();
      } else if ((peek() == '+' || peek() == '-') && isDigit(peek(1))) {
        advance();
        fixedDigits(2, "timezone hour");
        if (peek() != ':') {
          throw componentError("timezone minute", "expected ':' after timezone hour");
        }
        advance();
        fixedDigits(2, "timezone minute");
      }

      String text = text();
      tokens.add(token(hasTime ? TokenType.DATETIME : TokenType.DATE, text, text.substring(1)));
    }

    private void scanTimeRest() {
      if (peek() != ':') {
        return;
      }
      advance();
      fixedDigits(2, "minute");
      if (peek() != ':') {
        return;
      }
      advance();
      fixedDigits(2, "second");
      if (peek() == '.') {
        advance();
        if (!isDigit(peek())) {
          throw componentError("fraction", "expected digits after '.'");
        }
        while (isDigit(peek())) {
          advance();
        }
      }
    }

    private void fixedDigits(int width, String component) {
      for (int i = 0; i < width; i++) {
        if (!isDigit(peek())) {
          throw componentError(component, "expected " + width + "-digit " + component);
        }
        advance();
      }
      if (isDigit(peek())) {
        throw componentError(component, "expected " + width + "-digit " + component);
      }
    }

    // Variables

    private void scanEnvironmentVariable() {
      advance();
      char c = peek();
      String value;
      if (c == '`') {
        value = readQuoted('`', DiagnosticCode.UNTERMINATED_IDENTIFIER, "environment variable");
      } else if (c == '\'') {
        value = readQuoted('\'', DiagnosticCode.UNTERMINATED_STRING, "environment variable");
      } else if (isIdentifierStart(c)) {
        value = readWord();
      } else {
        throw charError(DiagnosticCode.INVALID_VARIABLE, "Expected variable name after '%'");
      }
      tokens.add(token(TokenType.ENV_VAR, text(), value));
    }

    private void scanSpecialVariable() {
      advance();
      if (!isIdentifierStart(peek())) {
        throw charError(DiagnosticCode.INVALID_VARIABLE, "Expected this, index or total after '$'");
      }
      String word = readWord();
      TokenType type =
          switch (word) {
            case "this" -> TokenType.THIS;
            case "index" -> TokenType.INDEX;
            case "total" -> TokenType.TOTAL;
            default -> throw new LexException(
                "Unknown special variable '$" + word + "'",
                new Range(tokenStart, here()),
                DiagnosticCode.INVALID_VARIABLE,
                '$');
          };
      String text = text();
      tokens.add(token(type, text, text));
    }

    // Helpers

    private String readWord() {
      int start = pos;
      while (pos < len && isIdentifierPart(peek())) {
        advance();
      }
      return src.substring(start, pos);
    }

    private void single(TokenType type) {
      advance();
      tokens.add(token(type, type.text(), type.text()));
    }

    private void pair(TokenType type) {
      advance();
      advance();
      tokens.add(token(type, type.text(), type.text()));
    }

    private void emitTrivia(TokenType type) {
      if (trivia) {
        String text = text();
        tokens.add(new Token(type, text, text, new Range(tokenStart, here()), Channel.HIDDEN));
      }
    }

    private Token token(TokenType type, String text, String value) {
      return new Token(type, text, value, new Range(tokenStart, here()), Channel.DEFAULT);
    }

    private String text() {
      return src.substring(tokenStart.offset(), pos);
    }

    /**
     * Moves past a region that failed to lex so scanning can resume. Quoted bodies are skipped up
     * to their closing quote; other regions lose at least one character.
     */
    private void resync(int startOffset) {
      char first = src.charAt(startOffset);
      if (first == '\'' || first == '`' || (first == '%' && pos > startOffset + 1)) {
        char quote = first == '%' ? src.charAt(startOffset + 1) : first;
        if (quote == '\'' || quote == '`') {
          while (pos < len && peek() != quote) {
            if (peek() == '\\' && pos + 1 < len) {
              advance();
            }
            advance();
          }
          if (pos < len) {
            advance();
          }
        }
      } else if (first == '@') {
        while (pos < len && (isIdentifierPart(peek()) || "-:.+".indexOf(peek()) >= 0)) {
          advance();
        }
      }
      if (pos == startOffset) {
        advance();
      }
    }

    private char peek() {
      return pos < len ? src.charAt(pos) : NONE;
    }

    private char peek(int ahead) {
      int i = pos + ahead;
      return i < len ? src.charAt(i) : NONE;
    }

    private void advance() {
      if (src.charAt(pos) == '\n') {
        line++;
        column = 1;
      } else {
        column++;
      }
      pos++;
    }

    private Position here() {
      return new Position(line, column, pos);
    }

    private LexException error(DiagnosticCode code, String message, Character offending) {
      return new LexException(message, new Range(tokenStart, here()), code, offending);
    }

    /** An error located at the current character. */
    private LexException charError(DiagnosticCode code, String message) {
      Position at = here();
      Position end = pos < len ? new Position(line, column + 1, pos + 1) : at;
      Character offending = pos < len ? peek() : null;
      return new LexException(message, new Range(at, end), code, offending);
    }

    private LexException componentError(String component, String detail) {
      Position at = here();
      Position end = pos < len ? new Position(line, column + 1, pos + 1) : at;
      Character offending = pos < len ? peek() : null;
      return new LexException(
          "Invalid date/time literal: " + detail,
          new Range(at, end),
          DiagnosticCode.INVALID_DATE_TIME,
          offending,
          component);
    }
  }
}
