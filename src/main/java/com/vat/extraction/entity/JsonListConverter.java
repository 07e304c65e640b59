package com.vat.extraction.entity;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class JsonListConverter extends JsonColumnConverter<List<String>> {

    public JsonListConverter() {
        super(new TypeReference<>() {});
    }

    @Override
    protected List<String> emptyValue() {
        return new ArrayList<>();
    }
}
