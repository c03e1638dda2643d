package com.agrisense.engine;

import com.agrisense.rule.RuleLibrary;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EngineConfiguration {

    @Bean
    public InferenceEngine inferenceEngine(RuleLibrary ruleLibrary, EngineProperties properties) {
        return new InferenceEngine(ruleLibrary, properties);
    }
}
