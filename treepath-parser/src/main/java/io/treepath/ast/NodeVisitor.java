package io.treepath.ast;

/**
 * Exhaustive visitor over {@link Node} kinds.
 *
 * @param <R> result type
 */
public interface NodeVisitor<R> {

  R visitLiteral(Literal node);

  R visitIdentifier(Identifier node);

  R visitSpecialVariable(SpecialVariable node);

  R visitEnvironmentVariable(EnvironmentVariable node);

  R visitMember(Member node);

  R visitInvocation(Invocation node);

  R visitIndex(Index node);

  R visitBinary(Binary node);

  R visitUnary(Unary node);

  R visitIif(Iif node);

  R visitStandaloneCall(StandaloneCall node);

  R visitQuantity(Quantity node);

  R visitEmptyCollection(EmptyCollection node);

  R visitError(ErrorNode node);

  R visitIncomplete(IncompleteNode node);
}
