package fr.lapetina.mesh.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies a {@link TransformationConfig} to JSON response bodies.
 * Bodies that are not JSON are returned untouched.
 */
public final class ResponseTransformer {

    private static final Logger log = LoggerFactory.getLogger(ResponseTransformer.class);

    private final ObjectMapper objectMapper;

    public ResponseTransformer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String transform(String body, TransformationConfig config) {
        if (config == null || config.isEmpty() || body == null || body.isBlank()) {
            return body;
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Response is not JSON, transformation skipped: error={}", e.getOriginalMessage());
            return body;
        }

        node = transform(node, config);
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize transformed response", e);
        }
    }

    JsonNode transform(JsonNode node, TransformationConfig config) {
        JsonNode result = node;

        if (config.extract() != null && !config.extract().isBlank()) {
            result = extract(result, config.extract());
        }

        if (result.isObject()) {
            ObjectNode object = (ObjectNode) result;
            for (Map.Entry<String, String> rename : config.rename().entrySet()) {
                JsonNode value = object.remove(rename.getKey());
                if (value != null) {
                    object.set(rename.getValue(), value);
                }
            }
            config.remove().forEach(object::remove);
        }

        if (config.wrap() != null && !config.wrap().isBlank()) {
            ObjectNode wrapper = objectMapper.createObjectNode();
            wrapper.set(config.wrap(), result);
            result = wrapper;
        }
        return result;
    }

    private static JsonNode extract(JsonNode node, String dotPath) {
        JsonNode current = node;
        for (String segment : dotPath.split("\\.")) {
            if (current == null || current.isNull() || current.isMissingNode()) {
                break;
            }
            current = current.isArray() && segment.chars().allMatch(Character::isDigit)
                    ? current.get(Integer.parseInt(segment))
                    : current.get(segment);
        }
        return current == null || current.isMissingNode() ? NullNode.getInstance() : current;
    }
}
