package com.olo.kernel.pipeline;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

/**
 * Routes to {@code target} when the agent's output has {@code condition} equal to {@code value}.
 * Numbers compare by value, booleans also match their string form, anything else by string form.
 */
public final class RoutingRule {

    private final String condition;
    private final Object value;
    private final String target;

    @JsonCreator
    public RoutingRule(
            @JsonProperty("condition") String condition,
            @JsonProperty("value") Object value,
            @JsonProperty("target") String target) {
        this.condition = condition;
        this.value = value;
        this.target = target;
    }

    public boolean matches(Map<String, Object> output) {
        if (output == null || condition == null || !output.containsKey(condition)) {
            return false;
        }
        return valuesMatch(output.get(condition), value);
    }

    static boolean valuesMatch(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return actual == expected;
        }
        if (actual instanceof Number && expected instanceof Number) {
            return Double.compare(((Number) actual).doubleValue(), ((Number) expected).doubleValue()) == 0;
        }
        if (actual instanceof Boolean || expected instanceof Boolean) {
            return String.valueOf(actual).equalsIgnoreCase(String.valueOf(expected));
        }
        if (actual instanceof Number || actual instanceof String) {
            return actual.toString().equals(expected.toString());
        }
        return actual.equals(expected);
    }

    @JsonProperty("condition")
    public String getCondition() {
        return condition;
    }

    @JsonProperty("value")
    public Object getValue() {
        return value;
    }

    @JsonProperty("target")
    public String getTarget() {
        return target;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RoutingRule that = (RoutingRule) o;
        return Objects.equals(condition, that.condition)
                && Objects.equals(value, that.value)
                && Objects.equals(target, that.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(condition, value, target);
    }
}
