package com.ochre.websocket.domain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ochre.websocket.protocol.ProtocolObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stores message meta as a JSON text column.
 */
@Converter
public class MetaJsonConverter implements AttributeConverter<Map<String, Object>, String> {

    private static final ObjectMapper MAPPER = ProtocolObjectMapper.create();
    private static final TypeReference<LinkedHashMap<String, Object>> META_TYPE = new TypeReference<>() {
    };

    @Override
    public String convertToDatabaseColumn(Map<String, Object> meta) {
        if (meta == null || meta.isEmpty()) {
            return "{}";
        }
        try {
            return MAPPER.writeValueAsString(meta);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Message meta is not serializable", e);
        }
    }

    @Override
    public Map<String, Object> convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return MAPPER.readValue(json, META_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored message meta is not valid JSON", e);
        }
    }
}
