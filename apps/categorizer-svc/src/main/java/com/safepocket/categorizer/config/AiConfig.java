package com.safepocket.categorizer.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.safepocket.categorizer.ai.AiCallExecutor;
import com.safepocket.categorizer.ai.AiFallbackClassifier;
import com.safepocket.categorizer.ai.AiRateLimiter;
import com.safepocket.categorizer.ai.AiResponseParser;
import com.safepocket.categorizer.ai.AiResultLog;
import com.safepocket.categorizer.ai.ClassificationServiceClient;
import com.safepocket.categorizer.ai.DisabledFallbackClassifier;
import com.safepocket.categorizer.ai.FallbackClassifier;
import com.safepocket.categorizer.ai.PromptBuilder;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Decides once, at startup, whether AI fallback classification is available. A missing API key
 * turns it off instead of failing the application.
 */
@Configuration
public class AiConfig {

    private static final Logger log = LoggerFactory.getLogger(AiConfig.class);

    @Bean
    AiRateLimiter aiRateLimiter(CategorizerProperties properties) {
        CategorizerProperties.Ai ai = properties.ai();
        return new AiRateLimiter(ai.requestsPerMinute(), ai.requestsPerDay());
    }

    @Bean
    FallbackClassifier fallbackClassifier(
            CategorizerProperties properties,
            AiRateLimiter aiRateLimiter,
            ObjectMapper objectMapper) {
        CategorizerProperties.Ai ai = properties.ai();
        if (!ai.enabledFlag()) {
            return new DisabledFallbackClassifier("categorizer.ai.enabled=false");
        }
        Optional<String> apiKey = ai.resolveApiKey();
        if (apiKey.isEmpty()) {
            log.warn("AI categorization enabled but no API key found in env {} or categorizer.ai.api-key; disabling",
                    ai.apiKeyEnv());
            return new DisabledFallbackClassifier("no API key in " + ai.apiKeyEnv());
        }
        ClassificationServiceClient client = new ClassificationServiceClient(ai, apiKey.get(), objectMapper);
        AiCallExecutor executor = new AiCallExecutor(aiRateLimiter, ai.maxRetries(), ai.baseDelay());
        AiResultLog resultLog = ai.cacheResultsFlag() ? new AiResultLog(Path.of(ai.resultLogFile()), objectMapper) : null;
        return new AiFallbackClassifier(client, executor, new PromptBuilder(ai.promptTemplate()),
                new AiResponseParser(), ai.confidenceThreshold(), resultLog);
    }
}
