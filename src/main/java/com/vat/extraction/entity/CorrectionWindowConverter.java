package com.vat.extraction.entity;

import com.fasterxml.jackson.core.type.TypeReference;
import com.vat.extraction.model.CorrectionWindow;
import jakarta.persistence.Converter;

@Converter
public class CorrectionWindowConverter extends JsonColumnConverter<CorrectionWindow> {

    public CorrectionWindowConverter() {
        super(new TypeReference<>() {});
    }

    @Override
    protected CorrectionWindow emptyValue() {
        return new CorrectionWindow(CorrectionWindow.DEFAULT_CAPACITY);
    }
}
