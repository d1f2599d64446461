package com.phillippitts.podcaster.service.prompt;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phillippitts.podcaster.service.script.PodcastScript;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OutputSchemaDescriberTest {

    private final OutputSchemaDescriber describer = new OutputSchemaDescriber(new ObjectMapper());

    record Chapter(@NotNull String heading, Integer page, @Size(min = 2, max = 5) List<String> notes) {
    }

    private static List<String> names(JsonNode array) {
        List<String> names = new ArrayList<>();
        array.forEach(node -> names.add(node.asText()));
        return names;
    }

    @Test
    void scriptSchemaMarksConstrainedFieldsRequired() {
        ObjectNode schema = describer.schemaFor(PodcastScript.class);

        assertThat(schema.path("type").asText()).isEqualTo("object");
        assertThat(names(schema.path("required")))
                .containsExactlyInAnyOrder("title", "summary", "tags", "dialogue");
        assertThat(schema.path("properties").path("summary").path("maxLength").asInt()).isEqualTo(300);
        assertThat(schema.path("properties").path("dialogue").path("type").asText()).isEqualTo("array");
        assertThat(schema.path("properties").path("dialogue").path("minItems").asInt()).isEqualTo(1);
    }

    @Test
    void nestedDialogueSegmentsAreDescribed() {
        JsonNode items = describer.schemaFor(PodcastScript.class)
                .path("properties").path("dialogue").path("items");

        assertThat(items.path("type").asText()).isEqualTo("object");
        assertThat(names(items.path("required"))).containsExactlyInAnyOrder("speaker", "line");
        assertThat(items.path("properties").path("line").path("minLength").asInt()).isEqualTo(1);
    }

    @Test
    void unconstrainedFieldsAreOptional() {
        ObjectNode schema = describer.schemaFor(Chapter.class);

        assertThat(names(schema.path("required"))).containsExactly("heading");
        assertThat(schema.path("properties").path("page").path("type").asText()).isEqualTo("integer");
        assertThat(schema.path("properties").path("notes").path("minItems").asInt()).isEqualTo(2);
        assertThat(schema.path("properties").path("notes").path("maxItems").asInt()).isEqualTo(5);
    }

    @Test
    void describeIsPrettyPrintedJson() throws Exception {
        String text = describer.describe(PodcastScript.class);

        assertThat(text).contains("\n");
        assertThat(new ObjectMapper().readTree(text)).isEqualTo(describer.schemaFor(PodcastScript.class));
    }
}
