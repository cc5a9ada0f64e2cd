package com.zenith.backend.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class SurveyProfileConverter implements AttributeConverter<SurveyProfile, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(SurveyProfile attribute) {
        if (attribute == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize survey profile", e);
        }
    }

    @Override
    public SurveyProfile convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(dbData, SurveyProfile.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored survey profile is not valid JSON", e);
        }
    }
}
