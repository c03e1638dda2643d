package com.agrisense.rule;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads a JSON rule library document and compiles it.
 */
public class RuleLibraryLoader {

    private static final Logger log = LoggerFactory.getLogger(RuleLibraryLoader.class);

    private final ObjectMapper objectMapper;

    public RuleLibraryLoader() {
        this(new ObjectMapper());
    }

    public RuleLibraryLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
    }

    public RuleLibrary load(InputStream in, String source) {
        RuleLibraryDocument document;
        try {
            document = objectMapper.readValue(in, RuleLibraryDocument.class);
        } catch (IOException ex) {
            throw new RuleLibraryException("cannot read rule library " + source + ": " + ex.getMessage(), ex);
        }
        return compile(document, source);
    }

    public RuleLibrary load(String json, String source) {
        RuleLibraryDocument document;
        try {
            document = objectMapper.readValue(json, RuleLibraryDocument.class);
        } catch (JsonProcessingException ex) {
            throw new RuleLibraryException("cannot parse rule library " + source + ": " + ex.getOriginalMessage(), ex);
        }
        return compile(document, source);
    }

    private RuleLibrary compile(RuleLibraryDocument document, String source) {
        RuleLibrary library = RuleLibrary.of(document);
        log.info("Loaded rule library source={}, rules={}, output_kinds={}",
            source, library.size(), library.outputKinds());
        return library;
    }
}
