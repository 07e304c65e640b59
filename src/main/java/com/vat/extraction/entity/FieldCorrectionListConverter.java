package com.vat.extraction.entity;

import com.fasterxml.jackson.core.type.TypeReference;
import com.vat.extraction.model.FieldCorrection;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class FieldCorrectionListConverter extends JsonColumnConverter<List<FieldCorrection>> {

    public FieldCorrectionListConverter() {
        super(new TypeReference<>() {});
    }

    @Override
    protected List<FieldCorrection> emptyValue() {
        return new ArrayList<>();
    }
}
