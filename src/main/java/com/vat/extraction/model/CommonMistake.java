package com.vat.extraction.model;

import lombok.Value;

@Value
public class CommonMistake {
    String type;           // UNDER_ESTIMATION or OVER_ESTIMATION
    double percentageError;
    String description;
}
