package com.safepocket.categorizer.health;

import com.safepocket.categorizer.rules.RuleBundle;
import com.safepocket.categorizer.rules.RuleStore;
import com.safepocket.categorizer.service.CategorizationEngine;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lightweight health endpoint. Reports the rule bundle currently held and never refreshes an expired
 * one; only the very first probe loads a bundle. A rule source outage shows up as origin CACHE_FILE,
 * STALE or EMPTY while the service stays UP.
 */
@RestController
public class HealthzController {

    private final RuleStore ruleStore;
    private final CategorizationEngine categorizationEngine;

    public HealthzController(RuleStore ruleStore, CategorizationEngine categorizationEngine) {
        this.ruleStore = ruleStore;
        this.categorizationEngine = categorizationEngine;
    }

    @GetMapping(path = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> healthz() {
        RuleBundle bundle = ruleStore.current().orElseGet(() -> ruleStore.load(false));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("rules", bundle.rules().size());
        body.put("origin", bundle.origin().name());
        body.put("ai", categorizationEngine.aiEnabled() ? "enabled" : "disabled");
        return body;
    }
}
