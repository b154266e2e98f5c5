package com.mobifone.updatecenter.utils;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

// Stores a package-id list as a JSON array column
@Converter
public class ListStringJsonConverter implements AttributeConverter<List<String>, String> {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> PACKAGE_IDS = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(List<String> packageIds) {
        if (packageIds == null || packageIds.isEmpty()) return "[]";
        try {
            return MAPPER.writeValueAsString(packageIds);
        } catch (Exception e) {
            throw new IllegalStateException("Cannot serialize package id list", e);
        }
    }

    @Override
    public List<String> convertToEntityAttribute(String column) {
        if (column == null || column.isBlank()) return new ArrayList<>();
        try {
            return new ArrayList<>(MAPPER.readValue(column, PACKAGE_IDS));
        } catch (Exception e) {
            throw new IllegalStateException("Cannot read package id list: " + column, e);
        }
    }
}
