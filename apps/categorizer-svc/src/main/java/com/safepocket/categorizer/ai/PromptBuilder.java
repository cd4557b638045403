package com.safepocket.categorizer.ai;

import com.safepocket.categorizer.model.CategoryTaxonomy;
import com.safepocket.categorizer.model.Transaction;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders the classification prompt from a template with {@code {placeholder}} tokens. Tokens are
 * substituted in one pass over the template, so braces inside transaction text reach the model
 * unchanged. Unknown tokens are left as written.
 */
public class PromptBuilder {

    static final String DEFAULT_CURRENCY = "CZK";
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-z_]+)}");
    private static final int TIER3_SAMPLE_SIZE = 3;

    private final String template;

    public PromptBuilder(String template) {
        if (template == null || template.isBlank()) {
            throw new IllegalArgumentException("prompt template must be provided");
        }
        this.template = template;
    }

    public String build(Transaction transaction, CategoryTaxonomy taxonomy) {
        Map<String, String> values = new HashMap<>();
        values.put("date", transaction.date() == null ? "" : transaction.date().toString());
        values.put("amount", plain(transaction.amount()));
        values.put("currency", blankToDefault(transaction.currency(), DEFAULT_CURRENCY));
        values.put("description", blankToDefault(transaction.description(), ""));
        values.put("counterparty_name", blankToDefault(transaction.counterpartyName(), ""));
        values.put("counterparty_account", blankToDefault(transaction.counterpartyAccount(), ""));
        values.put("institution", blankToDefault(transaction.institution(), ""));
        values.put("type", blankToDefault(transaction.type(), ""));
        values.put("category_tree_summary", summarize(taxonomy));

        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder prompt = new StringBuilder(template.length() + 256);
        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            matcher.appendReplacement(prompt, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(prompt);
        return prompt.toString();
    }

    /**
     * One line per tier1 followed by its tier2 labels, each with up to three sample tier3 labels.
     */
    static String summarize(CategoryTaxonomy taxonomy) {
        List<String> lines = new ArrayList<>();
        for (CategoryTaxonomy.Tier1 tier1 : taxonomy.groups()) {
            lines.add("\n" + tier1.name() + ":");
            for (CategoryTaxonomy.Tier2 tier2 : tier1.subcategories()) {
                List<String> leaves = tier2.leaves();
                String sample = String.join(", ", leaves.subList(0, Math.min(TIER3_SAMPLE_SIZE, leaves.size())));
                if (leaves.size() > TIER3_SAMPLE_SIZE) {
                    sample += "...";
                }
                lines.add("  - " + tier2.name() + ": " + sample);
            }
        }
        return String.join("\n", lines);
    }

    private static String plain(BigDecimal amount) {
        return amount == null ? "" : amount.toPlainString();
    }

    private static String blankToDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
