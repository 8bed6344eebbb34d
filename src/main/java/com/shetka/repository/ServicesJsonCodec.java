package com.shetka.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shetka.error.InfrastructureException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Encoding of the orders.services_json column: a JSON array of strings.
 * Non-ASCII text is written as-is, not escaped.
 */
@Component
@RequiredArgsConstructor
public class ServicesJsonCodec {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public String encode(List<String> services) {
        try {
            return objectMapper.writeValueAsString(services == null ? List.of() : services);
        } catch (JsonProcessingException e) {
            throw new InfrastructureException("Failed to encode services", e);
        }
    }

    public List<String> decode(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            List<String> services = objectMapper.readValue(json, STRING_LIST);
            return services == null ? List.of() : services;
        } catch (JsonProcessingException e) {
            throw new InfrastructureException("Stored services value is not a JSON string array", e);
        }
    }
}
