package com.fhi.farm_breeding.model.converter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores a short list of human-readable strings in one column, separated by a pipe.
 */
@Converter
public class StringListConverter implements AttributeConverter<List<String>, String>
{
    private static final String SEPARATOR = "|";

    @Override
    public String convertToDatabaseColumn(List<String> values)
    {
        if (values == null || values.isEmpty()) return null;
        return String.join(SEPARATOR, values);
    }

    @Override
    public List<String> convertToEntityAttribute(String column)
    {
        if (column == null || column.isEmpty()) return new ArrayList<>();
        return new ArrayList<>(Arrays.asList(column.split("\\|")));
    }
}
