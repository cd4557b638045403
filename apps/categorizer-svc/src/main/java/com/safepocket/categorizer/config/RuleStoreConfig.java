package com.safepocket.categorizer.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.safepocket.categorizer.rules.JdbcRuleSource;
import com.safepocket.categorizer.rules.LearnedRuleFile;
import com.safepocket.categorizer.rules.RuleCacheFile;
import com.safepocket.categorizer.rules.RuleMatcher;
import com.safepocket.categorizer.rules.RuleSource;
import com.safepocket.categorizer.rules.RuleStore;
import com.safepocket.categorizer.rules.YamlRuleSource;
import java.nio.file.Path;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

@Configuration
public class RuleStoreConfig {

    @Bean
    RuleSource ruleSource(
            CategorizerProperties properties,
            ResourceLoader resourceLoader,
            ObjectProvider<NamedParameterJdbcTemplate> jdbcTemplate) {
        CategorizerProperties.Rules rules = properties.rules();
        if ("jdbc".equals(rules.source())) {
            NamedParameterJdbcTemplate template = jdbcTemplate.getIfAvailable();
            if (template == null) {
                throw new IllegalStateException("categorizer.rules.source=jdbc requires a configured DataSource");
            }
            return new JdbcRuleSource(template);
        }
        return new YamlRuleSource(resourceLoader.getResource(rules.path()));
    }

    @Bean
    RuleCacheFile ruleCacheFile(CategorizerProperties properties, ObjectMapper objectMapper) {
        CategorizerProperties.Rules rules = properties.rules();
        return rules.hasCacheFile()
                ? new RuleCacheFile(Path.of(rules.cacheFile()), objectMapper)
                : RuleCacheFile.disabled(objectMapper);
    }

    @Bean
    LearnedRuleFile learnedRuleFile(CategorizerProperties properties) {
        CategorizerProperties.Learning learning = properties.learning();
        return learning.enabledFlag()
                ? new LearnedRuleFile(Path.of(learning.learnedRulesFile()))
                : LearnedRuleFile.disabled();
    }

    @Bean
    RuleStore ruleStore(
            RuleSource ruleSource,
            RuleCacheFile ruleCacheFile,
            LearnedRuleFile learnedRuleFile,
            RuleMatcher ruleMatcher,
            CategorizerProperties properties) {
        RuleStore store = new RuleStore(ruleSource, ruleCacheFile, learnedRuleFile, properties.rules().cacheTtl());
        store.addReloadListener(ruleMatcher::retainPatterns);
        return store;
    }
}
