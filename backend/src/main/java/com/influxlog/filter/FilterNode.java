package com.influxlog.filter;

/**
 * One element of a filter tree: either a {@link TagConstraint} leaf or a nested
 * {@link FilterExpression} group.
 */
public interface FilterNode {

    /**
     * Renders this node as a Flux boolean expression.
     *
     * @param enclosing operator of the expression this node is spliced into
     */
    String toPredicate(Operator enclosing);

    int predicateCount();
}
