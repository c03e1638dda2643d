package com.agrisense.api;

import com.agrisense.rule.Rule;
import com.agrisense.rule.RuleLibrary;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of the loaded knowledge base.
 *
 * GET /v1/rules
 */
@RestController
@RequestMapping("/v1/rules")
public class RuleLibraryController {

    private final RuleLibrary ruleLibrary;

    public RuleLibraryController(RuleLibrary ruleLibrary) {
        this.ruleLibrary = ruleLibrary;
    }

    @GetMapping
    public Map<String, Object> describe() {
        List<Map<String, Object>> rules = new ArrayList<>();
        for (Rule rule : ruleLibrary.rules()) {
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("name", rule.name());
            summary.put("priority", rule.priority());
            summary.put("description", rule.description());
            summary.put("conditions", rule.conditions().stream().map(Object::toString).toList());
            summary.put("actions", rule.actions().size());
            rules.add(summary);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("output_kinds", ruleLibrary.outputKinds());
        body.put("rules", rules);
        return body;
    }
}
