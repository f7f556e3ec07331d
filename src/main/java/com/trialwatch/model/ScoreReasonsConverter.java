package com.trialwatch.model;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.List;

@Converter
public class ScoreReasonsConverter implements AttributeConverter<ScoreReasons, String> {

    private static final TypeReference<ScoreReasons> TYPE = new TypeReference<>() {};
    private static final ScoreReasons EMPTY = new ScoreReasons(List.of(), List.of(), List.of());

    @Override
    public String convertToDatabaseColumn(ScoreReasons attribute) {
        return JsonColumns.write(attribute == null ? EMPTY : attribute);
    }

    @Override
    public ScoreReasons convertToEntityAttribute(String dbData) {
        return JsonColumns.read(dbData, TYPE, EMPTY);
    }
}
