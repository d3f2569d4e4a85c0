package io.treepath.lexer;

import static org.junit.jupiter.api.Assertions.*;

import io.treepath.diagnostics.DiagnosticCode;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Tests for the TreePath lexer.
 *
 * <p>Tests cover:
 *
 * <ul>
 *   <li>Token kinds and decoded values
 *   <li>String and identifier escapes
 *   <li>Date, date-time and time literals
 *   <li>Line, column and offset tracking
 *   <li>Trivia preservation and error recovery
 * </ul>
 */
class LexerTest {

  private Lexer lexer;

  @BeforeEach
  void setup() {
    lexer = new Lexer();
  }

  private List<TokenType> types(String source) {
    return lexer.tokenize(source).stream().map(Token::type).collect(Collectors.toList());
  }

  // Basic Tokenization Tests

  @Test
  void tokenizesEmptySource() {
    List<Token> tokens = lexer.tokenize("");

    assertEquals(1, tokens.size());
    assertEquals(TokenType.EOF, tokens.get(0).type());
  }

  @Test
  void tokenizesNullSource() {
    List<Token> tokens = lexer.tokenize(null);

    assertEquals(1, tokens.size());
    assertEquals(TokenType.EOF, tokens.get(0).type());
  }

  @Test
  void tokenizesMemberPath() {
    List<Token> tokens = lexer.tokenize("Patient.name");

    assertEquals(
        List.of(TokenType.IDENTIFIER, TokenType.DOT, TokenType.IDENTIFIER, TokenType.EOF),
        tokens.stream().map(Token::type).collect(Collectors.toList()));
    assertEquals("Patient", tokens.get(0).value());
    assertEquals(0, tokens.get(0).start());
    assertEquals(7, tokens.get(0).end());
    assertEquals(7, tokens.get(1).start());
    assertEquals(8, tokens.get(2).start());
    assertEquals(12, tokens.get(2).end());
    assertEquals(12, tokens.get(3).start());
  }

  @Test
  void classifiesKeywords() {
    assertEquals(
        List.of(
            TokenType.DIV,
            TokenType.MOD,
            TokenType.AND,
            TokenType.OR,
            TokenType.XOR,
            TokenType.IMPLIES,
            TokenType.IS,
            TokenType.AS,
            TokenType.IN,
            TokenType.CONTAINS,
            TokenType.TRUE,
            TokenType.FALSE,
            TokenType.EOF),
        types("div mod and or xor implies is as in contains true false"));
  }

  @Test
  void treatsNotAndIifAsIdentifiers() {
    assertEquals(
        List.of(TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.EOF), types("not iif"));
  }

  @Test
  void tokenizesCalendarUnits() {
    assertEquals(List.of(TokenType.NUMBER, TokenType.DAYS, TokenType.EOF), types("3 days"));
    assertEquals(List.of(TokenType.NUMBER, TokenType.YEAR, TokenType.EOF), types("1 year"));
  }

  @Test
  void tokenizesTwoCharacterOperators() {
    assertEquals(
        List.of(
            TokenType.NEQ,
            TokenType.NOT_SIMILAR,
            TokenType.LTE,
            TokenType.GTE,
            TokenType.LT,
            TokenType.GT,
            TokenType.EQ,
            TokenType.SIMILAR,
            TokenType.EOF),
        types("!= !~ <= >= < > = ~"));
  }

  @Test
  void tokenizesPunctuation() {
    assertEquals(
        List.of(
            TokenType.LPAREN,
            TokenType.RPAREN,
            TokenType.LBRACKET,
            TokenType.RBRACKET,
            TokenType.LBRACE,
            TokenType.RBRACE,
            TokenType.COMMA,
            TokenType.PLUS,
            TokenType.MINUS,
            TokenType.STAR,
            TokenType.SLASH,
            TokenType.AMPERSAND,
            TokenType.PIPE,
            TokenType.EOF),
        types("()[]{ },+-*/&|"));
  }

  @Test
  void tokenizesAdjacentBracesAsNullLiteral() {
    List<Token> tokens = lexer.tokenize("a | {}");

    assertEquals(
        List.of(TokenType.IDENTIFIER, TokenType.PIPE, TokenType.NULL, TokenType.EOF),
        tokens.stream().map(Token::type).collect(Collectors.toList()));
    Token nullLiteral = tokens.get(2);
    assertEquals("{}", nullLiteral.text());
    assertEquals(4, nullLiteral.range().start().offset());
    assertEquals(6, nullLiteral.range().end().offset());
    assertEquals(TokenType.Category.LITERAL, nullLiteral.type().category());
  }

  @Test
  void separatedBracesStayPunctuation() {
    assertEquals(
        List.of(TokenType.LBRACE, TokenType.RBRACE, TokenType.EOF), types("{ /* empty */ }"));
  }

  // Number Tests

  @Test
  void tokenizesIntegerAndDecimal() {
    List<Token> tokens = lexer.tokenize("42 3.25");

    assertEquals("42", tokens.get(0).value());
    assertEquals("3.25", tokens.get(1).value());
  }

  @Test
  void trailingDotIsNotPartOfNumber() {
    assertEquals(List.of(TokenType.NUMBER, TokenType.DOT, TokenType.EOF), types("1."));
  }

  // String Tests

  @Test
  void decodesStringEscapes() {
    Token token = lexer.tokenize("'it\\'s\\n\\t\\u0041'").get(0);

    assertEquals(TokenType.STRING, token.type());
    assertEquals("it's\n\tA", token.value());
    assertEquals("'it\\'s\\n\\t\\u0041'", token.text());
  }

  @Test
  void rejectsInvalidEscape() {
    LexException e = assertThrows(LexException.class, () -> lexer.tokenize("'a\\qb'"));

    assertEquals(DiagnosticCode.INVALID_ESCAPE, e.getCode());
    assertEquals(Character.valueOf('q'), e.getOffendingChar());
  }

  @Test
  void rejectsShortUnicodeEscape() {
    LexException e = assertThrows(LexException.class, () -> lexer.tokenize("'\\u12'"));

    assertEquals(DiagnosticCode.INVALID_UNICODE_ESCAPE, e.getCode());
  }

  @Test
  void rejectsUnterminatedString() {
    LexException e = assertThrows(LexException.class, () -> lexer.tokenize("name = 'abc"));

    assertEquals(DiagnosticCode.UNTERMINATED_STRING, e.getCode());
    assertEquals(7, e.getRange().start().offset());
    assertTrue(e.getMessage().contains("[Error Code: UNTERMINATED_STRING]"));
  }

  @Test
  void decodesDelimitedIdentifier() {
    Token token = lexer.tokenize("`given name`").get(0);

    assertEquals(TokenType.DELIMITED_IDENTIFIER, token.type());
    assertEquals("given name", token.value());
  }

  @Test
  void rejectsUnterminatedDelimitedIdentifier() {
    LexException e = assertThrows(LexException.class, () -> lexer.tokenize("`given"));

    assertEquals(DiagnosticCode.UNTERMINATED_IDENTIFIER, e.getCode());
  }

  // Date/Time Tests

  @Test
  void tokenizesDateLiterals() {
    Token date = lexer.tokenize("@2024-01-15").get(0);
    Token partial = lexer.tokenize("@2024").get(0);

    assertEquals(TokenType.DATE, date.type());
    assertEquals("2024-01-15", date.value());
    assertEquals("@2024-01-15", date.text());
    assertEquals(TokenType.DATE, partial.type());
  }

  @Test
  void tokenizesDateTimeLiterals() {
    Token full = lexer.tokenize("@2024-01-15T10:30:00.123+02:00").get(0);
    Token utc = lexer.tokenize("@2024-01-15T10:30Z").get(0);
    Token bareT = lexer.tokenize("@2024T").get(0);

    assertEquals(TokenType.DATETIME, full.type());
    assertEquals("2024-01-15T10:30:00.123+02:00", full.value());
    assertEquals(TokenType.DATETIME, utc.type());
    assertEquals(TokenType.DATETIME, bareT.type());
  }

  @Test
  void tokenizesTimeLiteral() {
    Token time = lexer.tokenize("@T14:30:15").get(0);

    assertEquals(TokenType.TIME, time.type());
    assertEquals("T14:30:15", time.value());
  }

  @Test
  void dateFollowedByMinusNumberIsSubtraction() {
    assertEquals(
        List.of(TokenType.DATE, TokenType.MINUS, TokenType.NUMBER, TokenType.EOF),
        types("@2024-01-15 - 1"));
  }

  @Test
  void reportsMalformedDateComponent() {
    LexException e = assertThrows(LexException.class, () -> lexer.tokenize("@2024-1"));

    assertEquals(DiagnosticCode.INVALID_DATE_TIME, e.getCode());
    assertEquals("month", e.getComponent());
  }

  @Test
  void reportsMalformedYear() {
    LexException e = assertThrows(LexException.class, () -> lexer.tokenize("@20"));

    assertEquals("year", e.getComponent());
  }

  // Variable Tests

  @Test
  void tokenizesSpecialVariables() {
    assertEquals(
        List.of(TokenType.THIS, TokenType.INDEX, TokenType.TOTAL, TokenType.EOF),
        types("$this $index $total"));
  }

  @Test
  void rejectsUnknownSpecialVariable() {
    LexException e = assertThrows(LexException.class, () -> lexer.tokenize("$foo"));

    assertEquals(DiagnosticCode.INVALID_VARIABLE, e.getCode());
  }

  @Test
  void tokenizesEnvironmentVariables() {
    List<Token> tokens = lexer.tokenize("%resource %`us-zip` %'vs-name'");

    assertEquals(TokenType.ENV_VAR, tokens.get(0).type());
    assertEquals("resource", tokens.get(0).value());
    assertEquals("us-zip", tokens.get(1).value());
    assertEquals("vs-name", tokens.get(2).value());
  }

  @Test
  void rejectsLoneBang() {
    LexException e = assertThrows(LexException.class, () -> lexer.tokenize("a ! b"));

    assertEquals(DiagnosticCode.UNEXPECTED_CHARACTER, e.getCode());
    assertEquals(Character.valueOf('!'), e.getOffendingChar());
  }

  @Test
  void rejectsUnterminatedBlockComment() {
    LexException e = assertThrows(LexException.class, () -> lexer.tokenize("a /* open"));

    assertEquals(DiagnosticCode.UNTERMINATED_COMMENT, e.getCode());
  }

  // Position Tests

  @Test
  void tracksLinesAndColumns() {
    List<Token> tokens = lexer.tokenize("a\n  + b");

    Token plus = tokens.get(1);
    assertEquals(2, plus.range().start().line());
    assertEquals(3, plus.range().start().column());
    assertEquals(4, plus.range().start().offset());
    Token b = tokens.get(2);
    assertEquals(new Position(2, 5, 6), b.range().start());
  }

  // Trivia Tests

  @Test
  void dropsTriviaByDefault() {
    assertEquals(
        List.of(TokenType.IDENTIFIER, TokenType.PLUS, TokenType.IDENTIFIER, TokenType.EOF),
        types("a // comment\n + /* block */ b"));
  }

  @Test
  void preservesTriviaOnHiddenChannel() {
    Lexer trivia = new Lexer(LexerOptions.DEFAULT.withPreserveTrivia(true));
    List<Token> tokens = trivia.tokenize("a // c\n+ /* x */ b");

    List<TokenType> kinds = tokens.stream().map(Token::type).collect(Collectors.toList());
    assertTrue(kinds.contains(TokenType.LINE_COMMENT));
    assertTrue(kinds.contains(TokenType.COMMENT));
    assertTrue(kinds.contains(TokenType.WHITESPACE));
    assertTrue(
        tokens.stream().filter(t -> t.type().isTrivia()).allMatch(Token::isHidden));
    assertFalse(tokens.get(0).isHidden());
    assertEquals(
        "a // c\n+ /* x */ b",
        tokens.stream().map(Token::text).collect(Collectors.joining()));
  }

  // Recovery Tests

  @Test
  void recoversFromUnexpectedCharacter() {
    LexResult result = lexer.tokenizeRecovering("1 + # 2");

    assertEquals(
        List.of(
            TokenType.NUMBER, TokenType.PLUS, TokenType.ERROR, TokenType.NUMBER, TokenType.EOF),
        result.tokens().stream().map(Token::type).collect(Collectors.toList()));
    assertEquals(1, result.diagnostics().size());
    assertEquals(DiagnosticCode.UNEXPECTED_CHARACTER, result.diagnostics().get(0).code());
  }

  @Test
  void recoversPastMalformedDate() {
    LexResult result = lexer.tokenizeRecovering("@2024-1x + 1");

    assertEquals(TokenType.ERROR, result.tokens().get(0).type());
    assertEquals("@2024-1x", result.tokens().get(0).text());
    assertEquals(TokenType.PLUS, result.tokens().get(1).type());
    assertEquals(DiagnosticCode.INVALID_DATE_TIME, result.diagnostics().get(0).code());
  }

  @Test
  void recoveringLexerAlwaysEndsWithEof() {
    LexResult result = lexer.tokenizeRecovering("'open");

    Token last = result.tokens().get(result.tokens().size() - 1);
    assertEquals(TokenType.EOF, last.type());
    assertTrue(result.hasErrors());
  }
}
