package com.safepocket.categorizer.rules;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.math.BigDecimal;
import java.util.List;

/**
 * Closed set of conditions a manual rule can be built from. The JSON type names double as the
 * notation persisted in the rule cache file.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = MatchCondition.Contains.class, name = "contains"),
        @JsonSubTypes.Type(value = MatchCondition.Exact.class, name = "exact"),
        @JsonSubTypes.Type(value = MatchCondition.GreaterThan.class, name = "greater_than"),
        @JsonSubTypes.Type(value = MatchCondition.LessThan.class, name = "less_than"),
        @JsonSubTypes.Type(value = MatchCondition.Regex.class, name = "regex"),
        @JsonSubTypes.Type(value = MatchCondition.AmountRange.class, name = "amount_range"),
        @JsonSubTypes.Type(value = MatchCondition.All.class, name = "all")
})
public sealed interface MatchCondition {

    /**
     * Conditions on a single field; the only kinds allowed inside {@link All}.
     */
    @JsonSubTypes({
            @JsonSubTypes.Type(value = Contains.class, name = "contains"),
            @JsonSubTypes.Type(value = Exact.class, name = "exact"),
            @JsonSubTypes.Type(value = GreaterThan.class, name = "greater_than"),
            @JsonSubTypes.Type(value = LessThan.class, name = "less_than")
    })
    sealed interface FieldCondition extends MatchCondition {
        TransactionField field();
    }

    record Contains(TransactionField field, String value) implements FieldCondition {
        public Contains {
            requireField(field);
            value = requireText(value, "contains");
        }
    }

    record Exact(TransactionField field, String value) implements FieldCondition {
        public Exact {
            requireField(field);
            value = requireText(value, "exact");
        }
    }

    record GreaterThan(TransactionField field, BigDecimal value) implements FieldCondition {
        public GreaterThan {
            requireField(field);
            if (value == null) {
                throw new IllegalArgumentException("greater_than requires a numeric value");
            }
        }
    }

    record LessThan(TransactionField field, BigDecimal value) implements FieldCondition {
        public LessThan {
            requireField(field);
            if (value == null) {
                throw new IllegalArgumentException("less_than requires a numeric value");
            }
        }
    }

    record Regex(TransactionField field, String pattern) implements MatchCondition {
        public Regex {
            requireField(field);
            if (pattern == null || pattern.isEmpty()) {
                throw new IllegalArgumentException("regex requires a pattern");
            }
        }
    }

    /**
     * Inclusive range on a numeric field; a missing bound is open.
     */
    record AmountRange(TransactionField field, BigDecimal min, BigDecimal max, String descriptionContains)
            implements MatchCondition {
        public AmountRange {
            field = field == null ? TransactionField.AMOUNT : field;
            if (min == null && max == null && (descriptionContains == null || descriptionContains.isBlank())) {
                throw new IllegalArgumentException("amount_range requires min, max or description_contains");
            }
            if (min != null && max != null && min.compareTo(max) > 0) {
                throw new IllegalArgumentException("amount_range min " + min + " exceeds max " + max);
            }
            descriptionContains = descriptionContains == null || descriptionContains.isBlank() ? null : descriptionContains;
        }
    }

    record All(List<FieldCondition> conditions) implements MatchCondition {
        public All {
            if (conditions == null || conditions.isEmpty()) {
                throw new IllegalArgumentException("multi condition requires at least one sub-condition");
            }
            conditions = List.copyOf(conditions);
        }
    }

    private static void requireField(TransactionField field) {
        if (field == null) {
            throw new IllegalArgumentException("field must be provided");
        }
    }

    private static String requireText(String value, String kind) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(kind + " requires a non-blank value");
        }
        return value.trim();
    }
}
