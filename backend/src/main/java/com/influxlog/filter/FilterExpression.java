package com.influxlog.filter;

import com.influxlog.exception.EmptyFilterException;
import com.influxlog.exception.FilterTypeException;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Boolean combination of tag equality tests, rendered as a Flux {@code filter()} call.
 *
 * <pre>{@code
 * FilterExpression.of(Operator.AND, List.of(
 *         Map.of("building", "b-1"),
 *         FilterExpression.of(Operator.OR, List.of(Map.of("trait", "t-1"), Map.of("trait", "t-2")))))
 *     .render();
 * // filter(fn: (r) => r["building"] == "b-1" and (r["trait"] == "t-1" or r["trait"] == "t-2"))
 * }</pre>
 *
 * <p>Building an expression never fails. Children are validated while {@link #render()}
 * walks the tree: a missing operator or an element of unsupported type raises
 * {@link FilterTypeException}, and an expression or tag mapping without pairs raises
 * {@link EmptyFilterException}. Keys and values are inserted verbatim.
 */
@ToString
@EqualsAndHashCode
public final class FilterExpression implements FilterNode {

    private final Operator operator;
    private final List<FilterNode> children;

    private FilterExpression(Operator operator, List<FilterNode> children) {
        this.operator = operator;
        this.children = List.copyOf(children);
    }

    /**
     * Accepts a tag mapping, a nested expression, or a collection mixing both. Any other
     * element is kept as is and rejected at render time.
     */
    public static FilterExpression of(Operator operator, Object children) {
        List<FilterNode> nodes = new ArrayList<>();
        if (children instanceof Collection<?> elements) {
            elements.forEach(element -> nodes.add(toNode(element)));
        } else {
            nodes.add(toNode(children));
        }
        return new FilterExpression(operator, nodes);
    }

    public static FilterExpression and(FilterNode... children) {
        return new FilterExpression(Operator.AND, toNodes(children));
    }

    public static FilterExpression or(FilterNode... children) {
        return new FilterExpression(Operator.OR, toNodes(children));
    }

    private static List<FilterNode> toNodes(FilterNode[] children) {
        if (children == null) {
            return List.of();
        }
        return Arrays.stream(children).map(FilterExpression::toNode).toList();
    }

    private static FilterNode toNode(Object element) {
        if (element instanceof FilterNode node) {
            return node;
        }
        if (element instanceof Map<?, ?> tags) {
            return TagConstraint.copyOf(tags);
        }
        return new UnsupportedFilterNode(element);
    }

    public Operator operator() {
        return operator;
    }

    public List<FilterNode> children() {
        return children;
    }

    public String render() {
        return "filter(fn: (r) => " + expression() + ")";
    }

    public String expression() {
        if (operator == null) {
            throw new FilterTypeException("filter expression has no operator");
        }
        if (children.isEmpty()) {
            throw new EmptyFilterException("filter expression has no children");
        }
        List<String> predicates = new ArrayList<>(children.size());
        for (FilterNode child : children) {
            predicates.add(child.toPredicate(operator));
        }
        return String.join(operator.delimiter(), predicates);
    }

    // a single test needs no grouping, anything larger is parenthesized
    @Override
    public String toPredicate(Operator enclosing) {
        String rendered = expression();
        return predicateCount() > 1 ? "(" + rendered + ")" : rendered;
    }

    @Override
    public int predicateCount() {
        return children.stream().mapToInt(FilterNode::predicateCount).sum();
    }
}
