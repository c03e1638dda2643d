package com.agrisense.rule;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;

@Configuration
public class RuleLibraryConfiguration {

    /**
     * The process-wide rule library. A malformed library fails context startup.
     */
    @Bean
    public RuleLibrary ruleLibrary(ResourceLoader resourceLoader,
                                   ObjectMapper objectMapper,
                                   @Value("${agrisense.rules.location:classpath:rules/agrisense-rules.json}")
                                   String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new RuleLibraryException("rule library not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            return new RuleLibraryLoader(objectMapper).load(in, location);
        } catch (IOException ex) {
            throw new RuleLibraryException("cannot open rule library " + location, ex);
        }
    }
}
