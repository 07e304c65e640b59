package com.vat.extraction.model;

/**
 * Shape a labeled validation case is expected to have.
 */
public enum ReportType {
    STANDARD,
    COUNTRY_SUMMARY,   // per-country subtotals expected
    ORDER_DETAIL       // line items and shipping expected
}
