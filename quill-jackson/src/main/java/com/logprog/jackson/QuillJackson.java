package com.logprog.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for ObjectMapper instances that read and write program syntax trees.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = QuillJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(program);
 * StatementList program = mapper.readValue(json, StatementList.class);
 * </pre>
 */
public final class QuillJackson {

    private QuillJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for AST serialization/deserialization.
     *
     * The returned mapper:
     * - Tags every node with a "type" property naming its variant
     * - Leaves out null properties (absent guard, no location, no builtin arguments)
     * - Reads operator and metric kind names case-insensitively
     * - Reads a metric kind or operator it does not know as null, which the unparser renders as nothing
     * - Ignores properties it does not know
     * - Rejects a fractional number where an integer value is expected
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        return JsonMapper.builder()
            .addModule(new ParameterNamesModule())
            .addModule(new AstModule())
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_AS_NULL)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
            .build();
    }
}
