package com.trialwatch.model;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class ContactBundleConverter implements AttributeConverter<ContactBundle, String> {

    private static final TypeReference<ContactBundle> TYPE = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(ContactBundle attribute) {
        return JsonColumns.write(attribute == null ? ContactBundle.empty() : attribute);
    }

    @Override
    public ContactBundle convertToEntityAttribute(String dbData) {
        return JsonColumns.read(dbData, TYPE, ContactBundle.empty());
    }
}
