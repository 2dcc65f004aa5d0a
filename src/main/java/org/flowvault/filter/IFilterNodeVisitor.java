package org.flowvault.filter;

/**
 * Visitor over {@link FilterNode} trees.
 *
 * @param <R> result type
 */
public interface IFilterNodeVisitor<R> {

    R visitUnary(FilterNode.Unary node);

    R visitRegexMatch(FilterNode.RegexMatch node);

    R visitIntCompare(FilterNode.IntCompare node);

    R visitAnd(FilterNode.And node);

    R visitOr(FilterNode.Or node);

    R visitNot(FilterNode.Not node);
}
