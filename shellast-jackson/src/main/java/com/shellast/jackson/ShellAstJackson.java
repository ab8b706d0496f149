package com.shellast.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Builds the ObjectMapper that reads and writes shell trees. Every node
 * carries a {@code "type"} tag; positions are plain {@code {"line", "column"}}
 * objects.
 */
public final class ShellAstJackson {

    private ShellAstJackson() {
        // Utility class
    }

    /**
     * A fresh mapper: nulls such as an absent redirect descriptor are left
     * out, unknown fields from a parser's output are skipped, and
     * {@code NoCommand} is written as its bare type tag.
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        // NoCommand has no properties and is written as just its type id
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new AstModule());

        return mapper;
    }
}
