package com.farmket.marketplace.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Stores a list of category ids as a JSON array, e.g. {@code [3,1,7]}.
 */
@Slf4j
@Converter
public class CategoryIdListConverter implements AttributeConverter<List<Long>, String> {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(List<Long> attribute) {
        if (attribute == null) {
            return "[]";
        }
        try {
            return objectMapper.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            log.error("Error converting category ids to JSON", e);
            throw new IllegalStateException("Failed to convert category ids to JSON", e);
        }
    }

    @Override
    public List<Long> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return objectMapper.readValue(dbData, new TypeReference<ArrayList<Long>>() {});
        } catch (JsonProcessingException e) {
            log.error("Error converting JSON to category ids: {}", dbData, e);
            throw new IllegalStateException("Failed to convert JSON to category ids", e);
        }
    }
}
