package com.cyclo.analyzer.template;

/**
 * Double dispatch over the template node types.
 *
 * @param <R> result type
 * @param <X> checked exception the visit may raise
 */
public interface TemplateNodeVisitor<R, X extends Exception> {

    R visitRoot(TemplateRoot node) throws X;

    R visitOutput(Output node) throws X;

    R visitData(TemplateData node) throws X;

    R visitExpression(Expression node) throws X;

    R visitIf(IfNode node) throws X;

    R visitFor(ForNode node) throws X;

    R visitSet(SetNode node) throws X;

    R visitSetBlock(SetBlockNode node) throws X;

    R visitScopedBlock(ScopedBlockNode node) throws X;

    R visitUnmodeled(UnmodeledTag node) throws X;
}
