package com.paramguard.api;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.victools.jsonschema.generator.Option;
import com.github.victools.jsonschema.generator.OptionPreset;
import com.github.victools.jsonschema.generator.SchemaGeneratorConfigBuilder;
import com.github.victools.jsonschema.generator.SchemaVersion;
import com.github.victools.jsonschema.module.jackson.JacksonModule;
import com.github.victools.jsonschema.module.jackson.JacksonOption;
import com.paramguard.utils.Json;

/**
 * Output schemas of endpoint response types, generated with victools/jsonschema-generator
 * and cached per type for the /endpoints catalog.
 */
final class SchemaGenerator {
    private static final com.github.victools.jsonschema.generator.SchemaGenerator GENERATOR = create();

    private static final Map<Class<?>, Map<String, Object>> CACHE = new ConcurrentHashMap<>();

    private SchemaGenerator() {}

    private static com.github.victools.jsonschema.generator.SchemaGenerator create() {
        final SchemaGeneratorConfigBuilder builder =
            new SchemaGeneratorConfigBuilder(SchemaVersion.DRAFT_2020_12, OptionPreset.PLAIN_JSON)
                .with(new JacksonModule(JacksonOption.RESPECT_JSONPROPERTY_REQUIRED))
                .with(Option.FORBIDDEN_ADDITIONAL_PROPERTIES_BY_DEFAULT);
        // names as Json writes them
        builder.forFields().withPropertyNameOverrideResolver(field -> Json.toSnakeCase(field.getDeclaredName()));
        builder.forMethods().withPropertyNameOverrideResolver(method -> Json.toSnakeCase(method.getName()));
        return new com.github.victools.jsonschema.generator.SchemaGenerator(builder.build());
    }

    /**
     * @param responseType type declared by {@link Endpoint#responseType()}
     * @return the schema as a JSON object map, or null when the endpoint declares no response type
     */
    static Map<String, Object> outputSchema(final Class<?> responseType) {
        if (responseType == null || responseType == Void.class || responseType == void.class) {
            return null;
        }
        return CACHE.computeIfAbsent(responseType, type -> {
            final ObjectNode schema = GENERATOR.generateSchema(type);
            return Collections.unmodifiableMap(Json.readObject(schema.toString()));
        });
    }
}
