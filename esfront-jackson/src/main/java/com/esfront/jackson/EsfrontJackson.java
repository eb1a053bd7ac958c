package com.esfront.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for ObjectMapper instances configured for AST and token serialization.
 *
 * <pre>
 * ObjectMapper mapper = EsfrontJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(Parser.parse(source));
 * </pre>
 */
public final class EsfrontJackson {

    private EsfrontJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper that writes every node with its {@code type},
     * omits absent optional children unless the node shape requires them, and
     * prints numbers the way JavaScript does.
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        // Exclude null values by default; nullable children that belong to a
        // node's shape are included via mixins in AstModule
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        mapper.registerModule(new AstModule());
        return mapper;
    }
}
