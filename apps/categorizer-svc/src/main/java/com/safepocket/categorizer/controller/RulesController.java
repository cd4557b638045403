package com.safepocket.categorizer.controller;

import com.safepocket.categorizer.controller.dto.RuleBundleStatusDto;
import com.safepocket.categorizer.rules.RuleBundle;
import com.safepocket.categorizer.rules.RuleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/rules")
public class RulesController {

    private static final Logger log = LoggerFactory.getLogger(RulesController.class);

    private final RuleStore ruleStore;

    public RulesController(RuleStore ruleStore) {
        this.ruleStore = ruleStore;
    }

    @PostMapping("/reload")
    public ResponseEntity<RuleBundleStatusDto> reload() {
        RuleBundle bundle = ruleStore.load(true);
        log.info("Rule reload requested: origin={} rules={}", bundle.origin(), bundle.rules().size());
        return ResponseEntity.ok(RuleBundleStatusDto.from(ruleStore.describeSource(), bundle));
    }

    @GetMapping("/status")
    public ResponseEntity<RuleBundleStatusDto> status() {
        RuleBundle bundle = ruleStore.current().orElseGet(() -> ruleStore.load(false));
        return ResponseEntity.ok(RuleBundleStatusDto.from(ruleStore.describeSource(), bundle));
    }
}
