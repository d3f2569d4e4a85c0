package io.treepath.parser;

import static io.treepath.lexer.TokenType.*;

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
import io.treepath.ast.Node.LiteralKind;
import io.treepath.ast.Node.UnaryOp;
import io.treepath.ast.Quantity;
import io.treepath.ast.SpecialVariable;
import io.treepath.ast.StandaloneCall;
import io.treepath.ast.Unary;
import io.treepath.diagnostics.Diagnostic;
import io.treepath.diagnostics.DiagnosticCode;
import io.treepath.diagnostics.RelatedInformation;
import io.treepath.diagnostics.Severity;
import io.treepath.lexer.LexResult;
import io.treepath.lexer.Lexer;
import io.treepath.lexer.LexerOptions;
import io.treepath.lexer.Position;
import io.treepath.lexer.Range;
import io.treepath.lexer.Token;
import io.treepath.lexer.TokenType;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Precedence-climbing parser for TreePath expressions.
 *
 * <p>Grammar (informal, lowest precedence first, all binary levels left-associative):
 *
 * <pre>
 * expression := term (binaryOp term)*
 *   implies &lt; or xor &lt; and &lt; in contains &lt; = != ~ !~ &lt; &lt; &lt;= &gt; &gt;=
 *   &lt;  |  &lt;  is as (right operand: typeSpecifier)  &lt;  + - &amp;  &lt;  * / div mod
 * term       := ('+' | '-' | 'not') term | postfix
 * postfix    := primary ('.' name ('(' arguments? ')')? | '[' expression ']')*
 * primary    := literal | number (string | calendarUnit)? | '{' '}' | '(' expression ')'
 *             | $this | $index | $total | %variable | name ('(' arguments? ')')?
 * typeSpecifier := '('? name ('.' name)* ')'?
 * </pre>
 *
 * <p>Every bare name and bare call, other than {@code today()}, {@code now()} and {@code
 * timeOfDay()}, is given an explicit implicit {@code $this} receiver. {@code iif} always becomes
 * an {@link Iif} node, and the argument of {@code ofType}, {@code is} and {@code as} is parsed as
 * a type {@link Identifier}.
 *
 * <p>A parser is immutable and may be shared; each parse runs in its own session.
 */
public final class Parser {

  private static final Logger log = LoggerFactory.getLogger(Parser.class);

  /** Functions whose arguments are evaluated once per element of their receiver. */
  public static final Set<String> LAMBDA_FUNCTIONS =
      Set.of("where", "select", "all", "exists", "repeat", "aggregate", "trace");

  private static final Set<TokenType> SYNC =
      EnumSet.of(COMMA, RPAREN, RBRACKET, RBRACE, AND, OR, XOR, IMPLIES, EOF);

  private static final Set<TokenType> OPERAND_START =
      EnumSet.of(
          NULL, STRING, NUMBER, DATE, DATETIME, TIME, TRUE, FALSE, IDENTIFIER, DELIMITED_IDENTIFIER,
          ENV_VAR, THIS, INDEX, TOTAL, LBRACE, LPAREN, PLUS, MINUS);

  // Tokens after which a leading 'not' is the prefix operator rather than a name
  private static final Set<TokenType> NOT_OPERAND_START =
      EnumSet.of(
          NULL, STRING, NUMBER, DATE, DATETIME, TIME, TRUE, FALSE, IDENTIFIER, DELIMITED_IDENTIFIER,
          ENV_VAR, THIS, INDEX, TOTAL, LBRACE);

  private static final Set<TokenType> NAME = EnumSet.of(IDENTIFIER, DELIMITED_IDENTIFIER);

  private final ParserOptions options;

  /** Creates a parser configured from system properties and environment. */
  public Parser() {
    this(ParserOptions.defaults());
  }

  public Parser(ParserOptions options) {
    this.options = options == null ? ParserOptions.defaults() : options;
  }

  public ParserOptions options() {
    return options;
  }

  /**
   * Parses an expression in fast mode.
   *
   * @param source expression text
   * @return the tree root
   * @throws io.treepath.lexer.LexException on malformed tokens
   * @throws ParseException on malformed structure
   */
  public static Node parseExpression(String source) {
    return new Parser(ParserOptions.of(ParserMode.FAST)).parse(source).root();
  }

  /**
   * Tokenizes and parses an expression.
   *
   * @param source expression text; null is treated as empty
   * @return tree, diagnostics and tokens
   * @throws io.treepath.lexer.LexException in fast mode, on malformed tokens
   * @throws ParseException in fast mode, on malformed structure
   */
  public ParseResult parse(String source) {
    ParserMode mode = options.mode();
    if (!mode.recovers()) {
      return run(new Lexer(LexerOptions.DEFAULT).tokenize(source), List.of());
    }
    LexResult lexed =
        new Lexer(new LexerOptions(mode.keepsTrivia(), true)).tokenizeRecovering(source);
    return run(lexed.tokens(), lexed.diagnostics());
  }

  /**
   * Parses a pre-lexed token list. Hidden-channel tokens are ignored; a missing EOF token is
   * supplied.
   */
  public ParseResult parse(List<Token> tokens) {
    return run(tokens, List.of());
  }

  private ParseResult run(List<Token> all, List<Diagnostic> lexDiagnostics) {
    Session session = new Session(all, lexDiagnostics);
    Node root = session.parseRoot();
    ParserMode mode = options.mode();
    if (log.isDebugEnabled()) {
      log.debug(
          "Parsed {} tokens in {} mode with {} diagnostics",
          session.tokens.size(),
          mode,
          session.diagnostics.size());
    }
    return new ParseResult(
        mode.buildsAst() ? root : null,
        session.diagnostics,
        mode.keepsTrivia() ? all : session.tokens,
        mode);
  }

  /** Cursor and diagnostics of one parse. */
  private final class Session {
    private final List<Token> tokens = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final ParserMode mode = options.mode();

    private int current;
    private int errorCount;
    private boolean abandoned;

    Session(List<Token> all, List<Diagnostic> lexDiagnostics) {
      for (Token token : all) {
        if (!token.isHidden()) {
          tokens.add(token);
        }
      }
      if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != EOF) {
        Position end =
            tokens.isEmpty() ? Position.START : tokens.get(tokens.size() - 1).range().end();
        tokens.add(Token.of(EOF, "", Range.at(end)));
      }
      diagnostics.addAll(lexDiagnostics);
      errorCount = lexDiagnostics.size();
      if (mode.limitsErrors() && errorCount >= options.maxErrors()) {
        abandon();
      }
    }

    Node parseRoot() {
      Node root = expression(ParseContext.ROOT, 0);
      if (!check(EOF)) {
        Token extra = peek();
        if (extra.type() != ERROR) {
          report(
              DiagnosticCode.UNEXPECTED_TOKEN,
              "Unexpected " + describe(extra) + " after end of expression",
              EnumSet.of(EOF),
              extra,
              null);
        }
        current = tokens.size() - 1;
      }
      return root;
    }

    // Expressions

    private Node expression(ParseContext ctx, int minPrecedence) {
      Node left = unary(ctx);
      while (true) {
        BinaryOp op = BinaryOp.fromToken(peek().type());
        if (op == null || op.precedence() < minPrecedence) {
          return left;
        }
        advance();
        Node right = op.isTypeOperator() ? typeSpecifier() : expression(ctx, op.precedence() + 1);
        left = new Binary(op, left, right, Range.covering(left.range(), right.range()));
      }
    }

    private Node unary(ParseContext ctx) {
      Token t = peek();
      if (t.type() == PLUS || t.type() == MINUS) {
        advance();
        Node operand = unary(ctx);
        UnaryOp op = t.type() == PLUS ? UnaryOp.PLUS : UnaryOp.MINUS;
        return new Unary(op, operand, Range.covering(t.range(), operand.range()));
      }
      if (t.type() == IDENTIFIER
          && "not".equals(t.text())
          && NOT_OPERAND_START.contains(peekAt(1).type())) {
        advance();
        Node operand = unary(ctx);
        return new Unary(UnaryOp.NOT, operand, Range.covering(t.range(), operand.range()));
      }
      return postfix(ctx);
    }

    private Node postfix(ParseContext ctx) {
      Node node = primary(ctx);
      while (true) {
        if (check(DOT)) {
          advance();
          Token name = peek();
          if (name.type() == EOF) {
            if (abandoned) {
              return node;
            }
            report(
                DiagnosticCode.UNEXPECTED_EOF,
                "Expected a member name after '.' but reached end of input",
                NAME,
                name,
                null);
            return new IncompleteNode(node, Range.at(name.range().start()));
          }
          if (!name.type().isIdentifierLike()) {
            return errorNode(
                DiagnosticCode.EXPECTED_IDENTIFIER,
                "Expected a member name after '.' but found " + describe(name),
                NAME);
          }
          advance();
          if (check(LPAREN)) {
            node = call(node, name, ctx);
          } else {
            node = new Member(node, name.value(), Range.covering(node.range(), name.range()));
          }
        } else if (check(LBRACKET)) {
          Token open = advance();
          Node index = expression(ctx, 0);
          Token close = expect(RBRACKET, "to close index", open);
          Position end = close != null ? close.range().end() : index.range().end();
          node = new Index(node, index, new Range(node.range().start(), end));
        } else {
          return node;
        }
      }
    }

    private Node primary(ParseContext ctx) {
      Token t = peek();
      switch (t.type()) {
        case NUMBER:
          return number(advance());
        case STRING:
          advance();
          return new Literal(LiteralKind.STRING, t.value(), t.range());
        case TRUE:
        case FALSE:
          advance();
          return new Literal(LiteralKind.BOOLEAN, t.type() == TRUE, t.range());
        case DATE:
          advance();
          return new Literal(LiteralKind.DATE, t.value(), t.range());
        case DATETIME:
          advance();
          return new Literal(LiteralKind.DATETIME, t.value(), t.range());
        case TIME:
          advance();
          return new Literal(LiteralKind.TIME, t.value(), t.range());
        case NULL:
          advance();
          return new EmptyCollection(t.range());
        case LBRACE:
          return emptyCollection(advance());
        case LPAREN:
          {
            Token open = advance();
            Node inner = expression(ctx, 0);
            expect(RPAREN, "to close group", open);
            return inner;
          }
        case THIS:
        case INDEX:
        case TOTAL:
          advance();
          return new SpecialVariable(t.text(), false, t.range());
        case ENV_VAR:
          advance();
          return new EnvironmentVariable(t.value(), t.range());
        case ERROR:
          advance();
          return new ErrorNode("Invalid token '" + t.text() + "'", t.range());
        case EOF:
          return missingOperand(t, ctx);
        default:
          break;
      }

      TokenType type = t.type();
      if (type == IDENTIFIER
          || type == DELIMITED_IDENTIFIER
          || type.isSoftKeyword()
          || type.isCalendarUnit()) {
        advance();
        if (check(LPAREN)) {
          if (type == IDENTIFIER && StandaloneCall.isStandalone(t.text())) {
            return standalone(t, ctx);
          }
          return call(SpecialVariable.implicitThis(t.range()), t, ctx);
        }
        return new Member(SpecialVariable.implicitThis(t.range()), t.value(), t.range());
      }
      return errorNode(
          DiagnosticCode.UNEXPECTED_TOKEN,
          "Unexpected " + describe(t) + ", expected an expression" + ctx.location(),
          OPERAND_START);
    }

    private Node number(Token t) {
      String text = t.text();
      Token next = peek();
      if (next.type() == STRING) {
        advance();
        return new Quantity(
            new BigDecimal(text), next.value(), false, Range.covering(t.range(), next.range()));
      }
      if (next.type().isCalendarUnit()) {
        advance();
        return new Quantity(
            new BigDecimal(text), next.text(), true, Range.covering(t.range(), next.range()));
      }
      if (text.indexOf('.') >= 0) {
        return new Literal(LiteralKind.DECIMAL, new BigDecimal(text), t.range());
      }
      try {
        return new Literal(LiteralKind.INTEGER, Long.parseLong(text), t.range());
      } catch (NumberFormatException e) {
        // Wider than 64 bits
        return new Literal(LiteralKind.DECIMAL, new BigDecimal(text), t.range());
      }
    }

    private Node emptyCollection(Token open) {
      if (check(RBRACE)) {
        Token close = advance();
        return new EmptyCollection(Range.covering(open.range(), close.range()));
      }
      Node error =
          errorNode(
              DiagnosticCode.UNEXPECTED_TOKEN,
              "Expected '}' after '{' but found " + describe(peek()),
              EnumSet.of(RBRACE));
      if (check(RBRACE)) {
        advance();
      }
      return error;
    }

    private Node missingOperand(Token eof, ParseContext ctx) {
      if (abandoned) {
        return new ErrorNode("Input skipped after too many errors", Range.at(eof.range().start()));
      }
      report(
          DiagnosticCode.UNEXPECTED_EOF,
          "Expected an expression" + ctx.location() + " but reached end of input",
          OPERAND_START,
          eof,
          null);
      return new IncompleteNode(
          SpecialVariable.implicitThis(eof.range()), Range.at(eof.range().start()));
    }

    // Calls

    private Node call(Node receiver, Token name, ParseContext ctx) {
      Token open = advance();
      String function = name.value();
      if (name.type() != DELIMITED_IDENTIFIER) {
        if ("iif".equals(function)) {
          return iif(receiver, name, open, ctx);
        }
        if (Invocation.TYPE_FUNCTIONS.contains(function)) {
          return typeCall(receiver, function, open);
        }
      }
      ParseContext argContext =
          LAMBDA_FUNCTIONS.contains(function) ? ctx.enterLambda(function) : ctx;
      Arguments args = arguments(argContext, open);
      return new Invocation(
          receiver, function, args.nodes(), new Range(receiver.range().start(), args.end()));
    }

    private Node iif(Node receiver, Token name, Token open, ParseContext ctx) {
      Arguments args = arguments(ctx, open);
      List<Node> nodes = new ArrayList<>(args.nodes());
      if (nodes.size() < 2) {
        report(
            DiagnosticCode.MISSING_ARGUMENT,
            "iif() requires a criterion and a true-result, found " + nodes.size() + " argument(s)",
            Set.of(),
            name,
            null);
        while (nodes.size() < 2) {
          nodes.add(new ErrorNode("Missing iif argument", Range.at(args.end())));
        }
      } else if (nodes.size() > 3) {
        report(
            DiagnosticCode.TOO_MANY_ARGUMENTS,
            "iif() accepts at most 3 arguments, found " + nodes.size(),
            Set.of(),
            name,
            null);
      }
      Node otherwise = nodes.size() > 2 ? nodes.get(2) : null;
      return new Iif(
          receiver,
          nodes.get(0),
          nodes.get(1),
          otherwise,
          new Range(receiver.range().start(), args.end()));
    }

    private Node typeCall(Node receiver, String function, Token open) {
      Node type;
      if (check(RPAREN)) {
        Token close = peek();
        report(
            DiagnosticCode.MISSING_ARGUMENT,
            function + "() requires a type name",
            NAME,
            close,
            null);
        type = new ErrorNode("Missing type name", Range.at(close.range().start()));
      } else {
        type = typeSpecifier();
      }
      Position end = type.range().end();
      if (check(RPAREN)) {
        end = advance().range().end();
      } else {
        Token found = peek();
        if (found.type() == COMMA) {
          report(
              DiagnosticCode.TOO_MANY_ARGUMENTS,
              function + "() accepts a single type name",
              EnumSet.of(RPAREN),
              found,
              null);
        } else {
          expect(RPAREN, "after type name", open);
        }
        while (!SYNC.contains(peek().type()) || check(COMMA)) {
          end = advance().range().end();
        }
        if (check(RPAREN)) {
          end = advance().range().end();
        }
      }
      return new Invocation(
          receiver, function, List.of(type), new Range(receiver.range().start(), end));
    }

    private Node standalone(Token name, ParseContext ctx) {
      Token open = advance();
      if (check(RPAREN)) {
        Token close = advance();
        return new StandaloneCall(name.text(), Range.covering(name.range(), close.range()));
      }
      report(
          DiagnosticCode.TOO_MANY_ARGUMENTS,
          name.text() + "() takes no arguments",
          EnumSet.of(RPAREN),
          peek(),
          null);
      Arguments ignored = arguments(ctx, open);
      return new StandaloneCall(name.text(), new Range(name.range().start(), ignored.end()));
    }

    /** Parses arguments after an opening parenthesis, through the closing one. */
    private Arguments arguments(ParseContext ctx, Token open) {
      List<Node> nodes = new ArrayList<>();
      if (check(RPAREN)) {
        return new Arguments(nodes, advance().range().end());
      }
      while (true) {
        nodes.add(expression(ctx, 0));
        boolean more = false;
        while (true) {
          Token next = peek();
          if (next.type() == COMMA) {
            advance();
            more = true;
            break;
          }
          if (next.type() == RPAREN) {
            return new Arguments(nodes, advance().range().end());
          }
          if (next.type() == EOF) {
            expect(RPAREN, "to close argument list", open);
            return new Arguments(nodes, next.range().start());
          }
          if (next.type() != ERROR) {
            report(
                DiagnosticCode.UNEXPECTED_TOKEN,
                "Unexpected " + describe(next) + " in argument list",
                EnumSet.of(COMMA, RPAREN),
                next,
                null);
          }
          advance();
        }
        if (!more) {
          return new Arguments(nodes, peek().range().start());
        }
      }
    }

    private Node typeSpecifier() {
      Token open = check(LPAREN) ? advance() : null;
      Token first = peek();
      if (!first.type().isIdentifierLike()) {
        return errorNode(
            DiagnosticCode.EXPECTED_IDENTIFIER,
            "Expected a type name but found " + describe(first),
            NAME);
      }
      advance();
      StringBuilder name = new StringBuilder(first.value());
      Position end = first.range().end();
      while (check(DOT) && peekAt(1).type().isIdentifierLike() && peekAt(2).type() != LPAREN) {
        advance();
        Token part = advance();
        name.append('.').append(part.value());
        end = part.range().end();
      }
      if (open != null) {
        Token close = expect(RPAREN, "after type name", open);
        if (close != null) {
          end = close.range().end();
        }
      }
      return new Identifier(name.toString(), new Range(first.range().start(), end));
    }

    // Error handling

    /**
     * Reports a problem at the current token and skips to the next synchronization token.
     *
     * @return a placeholder spanning the skipped tokens
     */
    private Node errorNode(DiagnosticCode code, String message, Set<TokenType> expected) {
      Token at = peek();
      if (at.type() != ERROR) {
        report(code, message, expected, at, null);
      }
      Position start = at.range().start();
      Position end = start;
      while (!SYNC.contains(peek().type())) {
        end = advance().range().end();
      }
      return new ErrorNode(message, new Range(start, end));
    }

    /**
     * Consumes a token of the given type.
     *
     * @return the token, or null after reporting a problem
     */
    private Token expect(TokenType type, String purpose, Token opener) {
      if (check(type)) {
        return advance();
      }
      Token found = peek();
      DiagnosticCode code = DiagnosticCode.UNEXPECTED_TOKEN;
      if (opener != null) {
        code = DiagnosticCode.UNCLOSED_DELIMITER;
      } else if (found.type() == EOF) {
        code = DiagnosticCode.UNEXPECTED_EOF;
      }
      report(
          code,
          "Expected " + type.describe() + " " + purpose + " but found " + describe(found),
          EnumSet.of(type),
          found,
          opener);
      return null;
    }

    private void report(
        DiagnosticCode code, String message, Set<TokenType> expected, Token at, Token opener) {
      if (!mode.recovers()) {
        throw new ParseException(message, at.range(), code, expected, at.type());
      }
      if (abandoned) {
        return;
      }
      Diagnostic diagnostic = Diagnostic.of(code, message, at.range());
      if (opener != null && mode == ParserMode.DIAGNOSTIC) {
        diagnostic =
            diagnostic.withRelated(
                new RelatedInformation(
                    opener.range(), "Opening " + opener.type().describe() + " is here"));
      }
      diagnostics.add(diagnostic);
      errorCount++;
      if (mode.limitsErrors() && errorCount >= options.maxErrors()) {
        abandon();
      }
    }

    private void abandon() {
      abandoned = true;
      Token at = peek();
      diagnostics.add(
          new Diagnostic(
              Severity.ERROR,
              DiagnosticCode.TOO_MANY_ERRORS,
              "Too many errors (" + errorCount + "), remaining input skipped",
              at.range(),
              List.of()));
      current = tokens.size() - 1;
    }

    // Cursor

    private Token peek() {
      return tokens.get(current);
    }

    private Token peekAt(int ahead) {
      return tokens.get(Math.min(current + ahead, tokens.size() - 1));
    }

    private boolean check(TokenType type) {
      return peek().type() == type;
    }

    private Token advance() {
      Token token = peek();
      if (token.type() != EOF) {
        current++;
      }
      return token;
    }

    private String describe(Token token) {
      return token.type() == EOF ? "end of input" : "'" + token.text() + "'";
    }
  }

  private record Arguments(List<Node> nodes, Position end) {}
}
