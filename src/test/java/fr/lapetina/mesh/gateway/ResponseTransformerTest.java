package fr.lapetina.mesh.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseTransformerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ResponseTransformer transformer = new ResponseTransformer(objectMapper);

    @Test
    @DisplayName("should extract, rename, remove and wrap in that order")
    void shouldApplyAllSteps() throws Exception {
        String body = "{\"data\":{\"name\":\"Ada\",\"password\":\"secret\",\"id\":7},\"meta\":{}}";
        TransformationConfig config = new TransformationConfig(
                "data", Map.of("name", "fullName"), List.of("password"), "profile");

        JsonNode result = objectMapper.readTree(transformer.transform(body, config));

        assertThat(result.path("profile").path("fullName").asText()).isEqualTo("Ada");
        assertThat(result.path("profile").path("id").asInt()).isEqualTo(7);
        assertThat(result.path("profile").has("password")).isFalse();
        assertThat(result.path("profile").has("name")).isFalse();
        assertThat(result.has("meta")).isFalse();
    }

    @Test
    @DisplayName("should follow array indexes in the extract path")
    void shouldExtractFromArrays() throws Exception {
        String body = "{\"items\":[{\"id\":1},{\"id\":2}]}";

        JsonNode result = objectMapper.readTree(
                transformer.transform(body, new TransformationConfig("items.1", null, null, null)));

        assertThat(result.path("id").asInt()).isEqualTo(2);
    }

    @Test
    @DisplayName("should yield null for a missing extract path")
    void shouldYieldNullForMissingPath() {
        String result = transformer.transform("{\"a\":1}", new TransformationConfig("b.c", null, null, null));

        assertThat(result).isEqualTo("null");
    }

    @Test
    @DisplayName("should leave non-JSON bodies untouched")
    void shouldSkipNonJson() {
        TransformationConfig config = new TransformationConfig(null, null, null, "wrapped");

        assertThat(transformer.transform("plain text", config)).isEqualTo("plain text");
        assertThat(transformer.transform("", config)).isEmpty();
    }

    @Test
    @DisplayName("should treat a config without steps as empty")
    void shouldDetectEmptyConfig() {
        assertThat(new TransformationConfig(null, null, null, null).isEmpty()).isTrue();
        assertThat(new TransformationConfig(null, null, null, "data").isEmpty()).isFalse();
    }
}
