package com.safepocket.categorizer.rules;

import com.safepocket.categorizer.model.Category;
import com.safepocket.categorizer.model.CategoryTaxonomy;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/**
 * Rules maintained through the rules table; each non-null condition column becomes one condition.
 */
public class JdbcRuleSource implements RuleSource {

    private static final Logger log = LoggerFactory.getLogger(JdbcRuleSource.class);

    private static final List<String> CONDITION_COLUMNS = List.of(
            "description_contains",
            "counterparty_name_contains",
            "type_contains",
            "institution_exact",
            "counterparty_account_exact",
            "variable_symbol_exact",
            "amount_min",
            "amount_max");

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public JdbcRuleSource(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Snapshot fetch() {
        try {
            return new Snapshot(loadRules(), loadOwners(), loadTaxonomy());
        } catch (DataAccessException ex) {
            throw new RuleSourceException("Failed to read categorization rules from database", ex);
        }
    }

    @Override
    public String describe() {
        return "jdbc:categorization_rules";
    }

    private List<CategorizationRule> loadRules() {
        String sql = """
                SELECT id,
                       name,
                       priority,
                       description_contains,
                       counterparty_name_contains,
                       type_contains,
                       institution_exact,
                       counterparty_account_exact,
                       variable_symbol_exact,
                       amount_min,
                       amount_max,
                       tier1,
                       tier2,
                       tier3,
                       owner
                FROM categorization_rules
                WHERE is_active = :active
                ORDER BY priority DESC, id ASC
                """;
        List<CategorizationRule> rules = new ArrayList<>();
        jdbcTemplate.query(sql, new MapSqlParameterSource("active", true), rs -> {
            long id = rs.getLong("id");
            try {
                rules.add(mapRule(rs, id));
            } catch (IllegalArgumentException ex) {
                log.error("Skipping categorization rule id={}: {}", id, ex.getMessage());
            }
        });
        return rules;
    }

    private CategorizationRule mapRule(ResultSet rs, long id) throws SQLException {
        Map<String, String> columns = new LinkedHashMap<>();
        for (String column : CONDITION_COLUMNS) {
            columns.put(column, rs.getString(column));
        }
        String name = rs.getString("name");
        return new CategorizationRule(
                name == null || name.isBlank() ? "rule-" + id : name,
                rs.getInt("priority"),
                RuleDefinitionParser.parseFlat(columns::get),
                new Category(rs.getString("tier1"), rs.getString("tier2"), rs.getString("tier3")),
                rs.getString("owner"));
    }

    private Map<String, String> loadOwners() {
        Map<String, String> owners = new LinkedHashMap<>();
        jdbcTemplate.query("SELECT account, owner FROM owner_accounts ORDER BY account", rs -> {
            String account = rs.getString("account");
            String owner = rs.getString("owner");
            if (account != null && !account.isBlank() && owner != null && !owner.isBlank()) {
                owners.put(account.trim(), owner.trim());
            }
        });
        return owners;
    }

    private CategoryTaxonomy loadTaxonomy() {
        List<Category> rows = jdbcTemplate.query(
                "SELECT tier1, tier2, tier3 FROM categories ORDER BY sort_order, tier1, tier2, tier3",
                (rs, rowNum) -> new Category(rs.getString("tier1"), rs.getString("tier2"), rs.getString("tier3")));
        return CategoryTaxonomy.fromRows(rows);
    }
}
