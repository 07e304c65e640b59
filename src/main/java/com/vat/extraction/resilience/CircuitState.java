package com.vat.extraction.resilience;

public enum CircuitState {
    CLOSED,     // normal operation
    OPEN,       // resource is down, reject immediately
    HALF_OPEN   // probing recovery
}
