package dumb.prover.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class Json {
    private static final Logger logger = LoggerFactory.getLogger(Json.class);

    public static final ObjectMapper the = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    public static String str(Object obj) {
        try {
            return the.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            logger.error("Error serializing {} to JSON: {}", obj.getClass().getSimpleName(), e.getMessage());
            throw new IllegalStateException("Cannot serialize " + obj.getClass().getSimpleName(), e);
        }
    }

    public static JsonNode node(Object obj) {
        return the.valueToTree(obj);
    }

    public static <T> T obj(String json, Class<T> valueType) throws JsonProcessingException {
        return the.readValue(json, valueType);
    }

    public static <T> T obj(JsonNode json, Class<T> valueType) throws JsonProcessingException {
        return the.treeToValue(json, valueType);
    }

    /**
     * Reads a JSON file, or returns null if there is none.
     */
    public static <T> @Nullable T load(Path path, Class<T> valueType) throws IOException {
        if (!Files.exists(path)) {
            logger.info("{} not found, using default {}", path, valueType.getSimpleName());
            return null;
        }
        return the.readValue(path.toFile(), valueType);
    }
}
