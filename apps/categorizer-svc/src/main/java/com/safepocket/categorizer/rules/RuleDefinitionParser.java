package com.safepocket.categorizer.rules;

import com.fasterxml.jackson.databind.JsonNode;
import com.safepocket.categorizer.model.Category;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns loosely-typed rule definitions (YAML documents, database rows) into {@link CategorizationRule}s.
 * Two notations are understood: a {@code match} block with an explicit type, and the flat column
 * layout of the rules table ({@code description_contains}, {@code amount_min}, ...). Both may be
 * combined on one rule, in which case all conditions must hold.
 */
public final class RuleDefinitionParser {

    private static final Logger log = LoggerFactory.getLogger(RuleDefinitionParser.class);

    private RuleDefinitionParser() {
    }

    /**
     * Parses every entry of a rule list. Invalid entries are logged against {@code origin} and
     * skipped; inactive ones are dropped silently.
     */
    public static List<CategorizationRule> parseRules(JsonNode rulesNode, String origin) {
        List<CategorizationRule> rules = new ArrayList<>();
        if (rulesNode == null || !rulesNode.isArray()) {
            return rules;
        }
        int index = 0;
        for (JsonNode ruleNode : rulesNode) {
            index++;
            try {
                parseRule(ruleNode, index).ifPresent(rules::add);
            } catch (IllegalArgumentException ex) {
                log.error("Skipping categorization rule #{} ('{}') in {}: {}", index,
                        ruleNode.path("name").asText("unnamed"), origin, ex.getMessage());
            }
        }
        return rules;
    }

    public static Optional<CategorizationRule> parseRule(JsonNode node, int index) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("rule #" + index + " is not a mapping");
        }
        if (!node.path("active").asBoolean(true) || !node.path("is_active").asBoolean(true)) {
            return Optional.empty();
        }
        String name = text(node, "name").orElse("rule-" + index);
        int priority = node.path("priority").asInt(0);

        List<MatchCondition> conditions = new ArrayList<>();
        JsonNode match = node.get("match");
        if (match != null && !match.isNull()) {
            conditions.add(parseMatch(match));
        }
        conditions.addAll(parseFlat(column -> text(node, column).orElse(null)));

        JsonNode categoryNode = node.has("category") ? node.get("category") : node;
        Category category = new Category(
                text(categoryNode, "tier1").orElse(null),
                text(categoryNode, "tier2").orElse(null),
                text(categoryNode, "tier3").orElse(null));
        String owner = text(node, "owner").orElse(null);
        return Optional.of(new CategorizationRule(name, priority, conditions, category, owner));
    }

    public static MatchCondition parseMatch(JsonNode match) {
        String type = text(match, "type")
                .orElseThrow(() -> new IllegalArgumentException("match block requires a type"))
                .toLowerCase(Locale.ROOT);
        return switch (type) {
            case "contains" -> new MatchCondition.Contains(field(match), text(match, "value").orElse(null));
            case "exact" -> new MatchCondition.Exact(field(match), text(match, "value").orElse(null));
            case "regex" -> new MatchCondition.Regex(field(match),
                    text(match, "pattern").or(() -> text(match, "value")).orElse(null));
            case "amount_range" -> new MatchCondition.AmountRange(
                    text(match, "field").map(TransactionField::fromKey).orElse(TransactionField.AMOUNT),
                    decimal(match, "min_amount").or(() -> decimal(match, "min")).orElse(null),
                    decimal(match, "max_amount").or(() -> decimal(match, "max")).orElse(null),
                    text(match, "description_contains").orElse(null));
            case "multi", "all" -> new MatchCondition.All(parseSubConditions(match.path("conditions")));
            default -> throw new IllegalArgumentException("Unknown match type '" + type + "'");
        };
    }

    /**
     * Reads the flat condition columns through {@code column}; absent or blank columns add nothing.
     */
    public static List<MatchCondition> parseFlat(Function<String, String> column) {
        List<MatchCondition> conditions = new ArrayList<>();
        present(column.apply("description_contains"))
                .ifPresent(value -> conditions.add(new MatchCondition.Contains(TransactionField.DESCRIPTION, value)));
        present(column.apply("counterparty_name_contains"))
                .ifPresent(value -> conditions.add(new MatchCondition.Contains(TransactionField.COUNTERPARTY_NAME, value)));
        present(column.apply("type_contains"))
                .ifPresent(value -> conditions.add(new MatchCondition.Contains(TransactionField.TYPE, value)));
        present(column.apply("institution_exact"))
                .ifPresent(value -> conditions.add(new MatchCondition.Exact(TransactionField.INSTITUTION, value)));
        present(column.apply("counterparty_account_exact"))
                .ifPresent(value -> conditions.add(new MatchCondition.Exact(TransactionField.COUNTERPARTY_ACCOUNT, value)));
        present(column.apply("variable_symbol_exact"))
                .ifPresent(value -> conditions.add(new MatchCondition.Exact(TransactionField.VARIABLE_SYMBOL, value)));

        Optional<BigDecimal> min = present(column.apply("amount_min"))
                .or(() -> present(column.apply("amount_czk_min")))
                .map(RuleDefinitionParser::toDecimal);
        Optional<BigDecimal> max = present(column.apply("amount_max"))
                .or(() -> present(column.apply("amount_czk_max")))
                .map(RuleDefinitionParser::toDecimal);
        if (min.isPresent() || max.isPresent()) {
            conditions.add(new MatchCondition.AmountRange(
                    TransactionField.NORMALIZED_AMOUNT, min.orElse(null), max.orElse(null), null));
        }
        return conditions;
    }

    private static List<MatchCondition.FieldCondition> parseSubConditions(JsonNode nodes) {
        if (!nodes.isArray()) {
            throw new IllegalArgumentException("multi match requires a list of conditions");
        }
        List<MatchCondition.FieldCondition> conditions = new ArrayList<>();
        for (JsonNode node : nodes) {
            TransactionField field = field(node);
            if (node.has("contains")) {
                conditions.add(new MatchCondition.Contains(field, node.get("contains").asText()));
            } else if (node.has("equals")) {
                conditions.add(new MatchCondition.Exact(field, node.get("equals").asText()));
            } else if (node.has("greater_than")) {
                conditions.add(new MatchCondition.GreaterThan(field, toDecimal(node.get("greater_than").asText())));
            } else if (node.has("less_than")) {
                conditions.add(new MatchCondition.LessThan(field, toDecimal(node.get("less_than").asText())));
            } else {
                throw new IllegalArgumentException("Condition on '" + field.key()
                        + "' needs one of contains, equals, greater_than, less_than");
            }
        }
        return conditions;
    }

    private static TransactionField field(JsonNode node) {
        return TransactionField.fromKey(text(node, "field").orElse(null));
    }

    private static Optional<String> text(JsonNode node, String name) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return Optional.empty();
        }
        return present(value.asText());
    }

    private static Optional<BigDecimal> decimal(JsonNode node, String name) {
        return text(node, name).map(RuleDefinitionParser::toDecimal);
    }

    private static Optional<String> present(String value) {
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    private static BigDecimal toDecimal(String value) {
        try {
            return new BigDecimal(value.trim().replace(',', '.'));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("'" + value + "' is not a number", ex);
        }
    }
}
