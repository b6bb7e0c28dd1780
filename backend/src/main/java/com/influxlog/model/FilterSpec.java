package com.influxlog.model;

import com.influxlog.filter.FilterExpression;
import com.influxlog.filter.Operator;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * JSON form of a {@link FilterExpression}:
 *
 * <pre>{@code
 * {"operator": "and",
 *  "tags": [{"building": "b-1"}],
 *  "groups": [{"operator": "or", "tags": [{"trait": "t-1"}, {"trait": "t-2"}]}]}
 * }</pre>
 *
 * Tag mappings come before nested groups in the rendered expression.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FilterSpec {

    @NotBlank
    private String operator;

    private List<Map<String, String>> tags;

    @Valid
    private List<FilterSpec> groups;

    public FilterExpression toExpression() {
        List<Object> children = new ArrayList<>();
        if (tags != null) {
            children.addAll(tags);
        }
        if (groups != null) {
            groups.forEach(group -> children.add(group.toExpression()));
        }
        return FilterExpression.of(Operator.parse(operator), children);
    }
}
