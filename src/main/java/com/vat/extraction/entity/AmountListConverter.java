package com.vat.extraction.entity;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class AmountListConverter extends JsonColumnConverter<List<Double>> {

    public AmountListConverter() {
        super(new TypeReference<>() {});
    }

    @Override
    protected List<Double> emptyValue() {
        return new ArrayList<>();
    }
}
