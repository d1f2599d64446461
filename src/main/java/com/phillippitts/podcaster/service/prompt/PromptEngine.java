package com.phillippitts.podcaster.service.prompt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.podcaster.service.llm.ChatMessage;
import com.phillippitts.podcaster.service.llm.ChatOptions;
import com.phillippitts.podcaster.service.llm.ChatResponse;
import com.phillippitts.podcaster.service.llm.LlmClient;
import com.phillippitts.podcaster.util.LogSanitizer;
import com.phillippitts.podcaster.util.TimeUtils;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Executes {@link PromptDefinition}s against the configured {@link LlmClient}.
 *
 * <p>Pipeline per run:
 * <ol>
 *   <li>validate params against the params record's constraints</li>
 *   <li>render the template and, for structured prompts, append the output schema instructions</li>
 *   <li>call the model with definition defaults overridden by call options</li>
 *   <li>strip an enclosing code fence, parse JSON, bind to the output record</li>
 *   <li>validate the output record's constraints</li>
 * </ol>
 *
 * <p>{@link #run} never throws for model or content problems; every failure is returned as a
 * {@link PromptError} inside the {@link PromptResult}.
 */
@Component
public class PromptEngine {

    private static final Logger LOG = LogManager.getLogger(PromptEngine.class);

    static final int PARSE_ERROR_SNIPPET_CHARS = 150;
    private static final int LOG_PREVIEW_CHARS = 200;
    private static final String ROOT_PATH = "root";

    static final String OUTPUT_INSTRUCTIONS_HEADER = "# Output Instructions";

    private final LlmClient llmClient;
    private final Validator validator;
    private final ObjectMapper objectMapper;
    private final OutputSchemaDescriber schemaDescriber;

    public PromptEngine(LlmClient llmClient, Validator validator, ObjectMapper objectMapper) {
        this.llmClient = Objects.requireNonNull(llmClient, "llmClient");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper").copy()
                .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.schemaDescriber = new OutputSchemaDescriber(this.objectMapper);
    }

    /**
     * Runs the prompt with the definition's default options.
     */
    public <P, O> PromptResult<O> run(PromptDefinition<P, O> definition, P params) {
        return run(definition, params, null);
    }

    /**
     * Runs the prompt.
     *
     * @param definition prompt to run
     * @param params     template params, validated before the model is called
     * @param options    call-level overrides of the definition defaults (nullable)
     * @return structured output or classified error, never both
     */
    public <P, O> PromptResult<O> run(PromptDefinition<P, O> definition, P params, ChatOptions options) {
        Objects.requireNonNull(definition, "definition");

        PromptError inputError = validateParams(definition, params);
        if (inputError != null) {
            LOG.warn("Prompt '{}' rejected params: {}", definition.name(), inputError.describe());
            return PromptResult.failure(inputError);
        }

        String userPrompt;
        try {
            userPrompt = buildUserPrompt(definition, params);
        } catch (RuntimeException e) {
            return PromptResult.failure(PromptError.of(PromptErrorType.INPUT_VALIDATION,
                    "Template rendering failed: " + e.getMessage()));
        }

        ChatOptions merged = definition.defaultOptions().overriddenBy(options);
        List<ChatMessage> messages = List.of(
                ChatMessage.system(merged.systemPrompt() != null
                        ? merged.systemPrompt() : ChatOptions.DEFAULT_SYSTEM_PROMPT),
                ChatMessage.user(userPrompt));

        long start = System.nanoTime();
        ChatResponse response;
        try {
            response = llmClient.chatCompletion(messages, merged);
        } catch (RuntimeException e) {
            LOG.error("Prompt '{}' model call failed after {}ms", definition.name(),
                    TimeUtils.elapsedMillis(start), e);
            return PromptResult.failure(PromptError.of(PromptErrorType.MODEL,
                    "Model call failed: " + e.getMessage()));
        }
        LOG.debug("Prompt '{}' model call completed in {}ms", definition.name(), TimeUtils.elapsedMillis(start));

        if (response == null) {
            return PromptResult.failure(PromptError.of(PromptErrorType.MODEL, "Model returned no response"));
        }
        if (response.hasError()) {
            return PromptResult.failure(PromptError.of(PromptErrorType.MODEL,
                    "Model reported an error: " + response.error()), response.usage());
        }
        String content = response.content();
        if (content == null || content.isBlank()) {
            return PromptResult.failure(PromptError.of(PromptErrorType.MODEL, "Model returned empty content"),
                    response.usage());
        }

        if (!definition.hasOutputSchema()) {
            return PromptResult.success(definition.outputType().cast(content.trim()), response.usage());
        }
        return parseStructured(definition, content, response);
    }

    private <P, O> PromptError validateParams(PromptDefinition<P, O> definition, P params) {
        if (params == null) {
            return new PromptError(PromptErrorType.INPUT_VALIDATION, "Prompt params are required",
                    List.of(ROOT_PATH + ": must not be null"));
        }
        Set<ConstraintViolation<P>> violations = validator.validate(params);
        if (violations.isEmpty()) {
            return null;
        }
        return new PromptError(PromptErrorType.INPUT_VALIDATION,
                "Invalid params for prompt '" + definition.name() + "'", formatViolations(violations));
    }

    private <P, O> String buildUserPrompt(PromptDefinition<P, O> definition, P params) {
        String rendered = definition.render(params);
        if (!definition.hasOutputSchema()) {
            return rendered;
        }
        return rendered + "\n\n" + OUTPUT_INSTRUCTIONS_HEADER + "\n"
                + "You MUST respond ONLY with valid JSON that conforms to the following structure:\n"
                + "```json\n" + schemaDescriber.describe(definition.outputType()) + "\n```\n"
                + "Do not include explanations or any text outside the JSON object.";
    }

    private <P, O> PromptResult<O> parseStructured(PromptDefinition<P, O> definition, String content,
                                                   ChatResponse response) {
        String cleaned = CodeFences.strip(content);

        JsonNode tree;
        try {
            if (cleaned.isEmpty()) {
                throw new IllegalArgumentException("no JSON payload after removing code fences");
            }
            tree = objectMapper.readTree(cleaned);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            LOG.warn("Prompt '{}' returned unparseable content: {}", definition.name(),
                    LogSanitizer.preview(content, LOG_PREVIEW_CHARS));
            return PromptResult.failure(new PromptError(PromptErrorType.PARSE,
                    "Response is not valid JSON: " + e.getMessage(),
                    List.of("snippet: " + LogSanitizer.truncate(content, PARSE_ERROR_SNIPPET_CHARS))),
                    response.usage());
        }

        O output;
        try {
            output = tree == null || tree.isNull() ? null : objectMapper.treeToValue(tree, definition.outputType());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            String path = e instanceof JsonMappingException jme ? pathOf(jme) : ROOT_PATH;
            return PromptResult.failure(new PromptError(PromptErrorType.OUTPUT_VALIDATION,
                    "Response does not match the expected structure",
                    List.of(path + ": " + bindingMessage(e))), response.usage());
        }
        if (output == null) {
            return PromptResult.failure(new PromptError(PromptErrorType.OUTPUT_VALIDATION,
                    "Response does not match the expected structure",
                    List.of(ROOT_PATH + ": must be a JSON object")), response.usage());
        }

        Set<ConstraintViolation<O>> violations = validator.validate(output);
        if (!violations.isEmpty()) {
            PromptError error = new PromptError(PromptErrorType.OUTPUT_VALIDATION,
                    "Response failed validation", formatViolations(violations));
            LOG.warn("Prompt '{}' output rejected: {}", definition.name(), error.describe());
            return PromptResult.failure(error, response.usage());
        }
        return PromptResult.success(output, response.usage());
    }

    private static <T> List<String> formatViolations(Set<ConstraintViolation<T>> violations) {
        return violations.stream()
                .map(v -> {
                    String path = v.getPropertyPath() == null ? "" : v.getPropertyPath().toString();
                    return (path.isEmpty() ? ROOT_PATH : path) + ": " + v.getMessage();
                })
                .sorted()
                .toList();
    }

    private static String pathOf(JsonMappingException e) {
        StringBuilder sb = new StringBuilder();
        for (JsonMappingException.Reference ref : e.getPath()) {
            if (ref.getFieldName() != null) {
                if (!sb.isEmpty()) {
                    sb.append('.');
                }
                sb.append(ref.getFieldName());
            } else if (ref.getIndex() >= 0) {
                sb.append('[').append(ref.getIndex()).append(']');
            }
        }
        return sb.isEmpty() ? ROOT_PATH : sb.toString();
    }

    private static String bindingMessage(Exception e) {
        if (e instanceof JsonMappingException jme && jme.getOriginalMessage() != null) {
            return LogSanitizer.truncate(jme.getOriginalMessage(), LOG_PREVIEW_CHARS);
        }
        return LogSanitizer.truncate(e.getMessage(), LOG_PREVIEW_CHARS);
    }
}
