package com.phillippitts.podcaster.service.prompt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.victools.jsonschema.generator.Option;
import com.github.victools.jsonschema.generator.OptionPreset;
import com.github.victools.jsonschema.generator.SchemaGenerator;
import com.github.victools.jsonschema.generator.SchemaGeneratorConfig;
import com.github.victools.jsonschema.generator.SchemaGeneratorConfigBuilder;
import com.github.victools.jsonschema.generator.SchemaVersion;
import com.github.victools.jsonschema.module.jakarta.validation.JakartaValidationModule;
import com.github.victools.jsonschema.module.jakarta.validation.JakartaValidationOption;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Renders the JSON schema of an output record for inclusion in prompts.
 *
 * <p>Record components map to properties. Jakarta constraints are carried over:
 * {@code @NotNull}, {@code @NotBlank} and {@code @NotEmpty} mark a property required, and
 * {@code @Size}, {@code @NotBlank} and {@code @NotEmpty} contribute length or item bounds.
 */
final class OutputSchemaDescriber {

    private final ObjectMapper objectMapper;
    private final SchemaGenerator generator;
    private final Map<Class<?>, String> rendered = new ConcurrentHashMap<>();

    OutputSchemaDescriber(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        SchemaGeneratorConfig config = new SchemaGeneratorConfigBuilder(objectMapper,
                SchemaVersion.DRAFT_2020_12, OptionPreset.PLAIN_JSON)
                .without(Option.SCHEMA_VERSION_INDICATOR)
                .with(new JakartaValidationModule(JakartaValidationOption.NOT_NULLABLE_FIELD_IS_REQUIRED))
                .build();
        this.generator = new SchemaGenerator(config);
    }

    String describe(Class<?> type) {
        return rendered.computeIfAbsent(type, this::render);
    }

    ObjectNode schemaFor(Class<?> type) {
        return generator.generateSchema(type);
    }

    private String render(Class<?> type) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(schemaFor(type));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render schema for " + type.getName(), e);
        }
    }
}
