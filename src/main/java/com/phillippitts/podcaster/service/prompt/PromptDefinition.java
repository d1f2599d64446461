package com.phillippitts.podcaster.service.prompt;

import com.phillippitts.podcaster.service.llm.ChatOptions;

import java.util.Objects;
import java.util.function.Function;

/**
 * Declarative description of a prompt: typed params, a template, optional structured output
 * and default model options.
 *
 * <p>Params and output types are records annotated with Jakarta Bean Validation constraints.
 * A definition built with {@link #textBuilder(String, Class)} has no output schema; its runs
 * return the trimmed model text.
 *
 * @param <P> params type
 * @param <O> output type ({@code String} for text prompts)
 */
public final class PromptDefinition<P, O> {

    private final String name;
    private final String description;
    private final Class<P> paramsType;
    private final Class<O> outputType;
    private final boolean structured;
    private final Function<P, String> template;
    private final ChatOptions defaultOptions;

    private PromptDefinition(Builder<P, O> builder) {
        this.name = builder.name;
        this.description = builder.description;
        this.paramsType = builder.paramsType;
        this.outputType = builder.outputType;
        this.structured = builder.structured;
        this.template = Objects.requireNonNull(builder.template, "template must be set");
        this.defaultOptions = ChatOptions.defaults().overriddenBy(builder.defaultOptions);
    }

    /**
     * Starts a definition whose model reply is parsed into {@code outputType}.
     */
    public static <P, O> Builder<P, O> builder(String name, Class<P> paramsType, Class<O> outputType) {
        return new Builder<>(name, paramsType, Objects.requireNonNull(outputType, "outputType"), true);
    }

    /**
     * Starts a definition whose model reply is returned as plain text.
     */
    public static <P> Builder<P, String> textBuilder(String name, Class<P> paramsType) {
        return new Builder<>(name, paramsType, String.class, false);
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public Class<P> paramsType() {
        return paramsType;
    }

    public Class<O> outputType() {
        return outputType;
    }

    public boolean hasOutputSchema() {
        return structured;
    }

    public String render(P params) {
        return template.apply(params);
    }

    /** Engine defaults overridden by this definition's defaults. */
    public ChatOptions defaultOptions() {
        return defaultOptions;
    }

    public static final class Builder<P, O> {
        private final String name;
        private final Class<P> paramsType;
        private final Class<O> outputType;
        private final boolean structured;
        private String description = "";
        private Function<P, String> template;
        private ChatOptions defaultOptions = ChatOptions.none();

        private Builder(String name, Class<P> paramsType, Class<O> outputType, boolean structured) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name must not be blank");
            }
            this.name = name;
            this.paramsType = Objects.requireNonNull(paramsType, "paramsType");
            this.outputType = outputType;
            this.structured = structured;
        }

        public Builder<P, O> description(String description) {
            this.description = description;
            return this;
        }

        public Builder<P, O> template(Function<P, String> template) {
            this.template = template;
            return this;
        }

        public Builder<P, O> defaultOptions(ChatOptions defaultOptions) {
            this.defaultOptions = defaultOptions;
            return this;
        }

        public PromptDefinition<P, O> build() {
            return new PromptDefinition<>(this);
        }
    }
}
