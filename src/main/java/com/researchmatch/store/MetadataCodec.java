package com.researchmatch.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.researchmatch.exception.EmbeddingStoreException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Converts record metadata to and from its JSON column form.
 */
@Component
@RequiredArgsConstructor
public class MetadataCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public String serialize(Map<String, Object> metadata) {
        if (metadata == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new EmbeddingStoreException("Failed to serialize metadata", e);
        }
    }

    public Map<String, Object> deserialize(String metadata) {
        if (metadata == null) {
            return null;
        }
        try {
            return objectMapper.readValue(metadata, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new EmbeddingStoreException("Failed to deserialize metadata", e);
        }
    }
}
