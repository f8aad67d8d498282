package com.example.eventrelay.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 订阅事件过滤集合与 JSON 数组列之间的转换。
 */
@Converter
public class EventFilterConverter implements AttributeConverter<Set<String>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(Set<String> attribute) {
        try {
            return MAPPER.writeValueAsString(attribute == null ? Set.of() : attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize event filter", e);
        }
    }

    @Override
    public Set<String> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return new LinkedHashSet<>();
        }
        try {
            return MAPPER.readValue(dbData, new TypeReference<LinkedHashSet<String>>() {
            });
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot parse event filter: " + dbData, e);
        }
    }
}
