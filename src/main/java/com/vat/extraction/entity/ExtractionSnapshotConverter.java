package com.vat.extraction.entity;

import com.fasterxml.jackson.core.type.TypeReference;
import com.vat.extraction.model.ExtractionSnapshot;
import jakarta.persistence.Converter;

@Converter
public class ExtractionSnapshotConverter extends JsonColumnConverter<ExtractionSnapshot> {

    public ExtractionSnapshotConverter() {
        super(new TypeReference<>() {});
    }

    @Override
    protected ExtractionSnapshot emptyValue() {
        return new ExtractionSnapshot();
    }
}
