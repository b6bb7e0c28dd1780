package com.influxlog.filter;

import com.influxlog.exception.FilterTypeException;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Holds a child handed to {@link FilterExpression#of(Operator, Object)} that is neither a
 * tag mapping nor an expression. It fails only once rendering reaches it.
 */
@ToString
@EqualsAndHashCode
final class UnsupportedFilterNode implements FilterNode {

    private final Object element;

    UnsupportedFilterNode(Object element) {
        this.element = element;
    }

    @Override
    public String toPredicate(Operator enclosing) {
        String type = element == null ? "null" : element.getClass().getName();
        throw new FilterTypeException("cannot convert " + type + " to a tag predicate: " + element);
    }

    @Override
    public int predicateCount() {
        return 1;
    }
}
