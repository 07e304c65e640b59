package com.vat.extraction.service;

import com.vat.extraction.entity.DocumentCategory;
import com.vat.extraction.model.VatData;
import com.vat.extraction.model.VatDataReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class VatDataValidatorTest {

    private final VatDataValidator validator = new VatDataValidator();

    private static List<String> codes(List<VatDataReport.Finding> findings) {
        return findings.stream().map(VatDataReport.Finding::getCode).toList();
    }

    @Test
    @DisplayName("consistent Irish figures are valid with full confidence")
    void cleanData() {
        VatData data = VatData.builder()
                .salesVAT(List.of(46.0))
                .vatRates(List.of(23.0))
                .totalAmount(200.0)
                .vatNumber("IE1234567T")
                .documentType(DocumentCategory.SALES_INVOICE)
                .build();

        VatDataReport report = validator.validate(data);

        assertThat(report.isValid()).isTrue();
        assertThat(report.getErrors()).isEmpty();
        assertThat(report.getWarnings()).isEmpty();
        assertThat(report.getConfidence()).isEqualTo(1.0);
        assertThat(report.getCorrectedData()).isNull();
    }

    @Test
    @DisplayName("missing figures are a high severity error")
    void noData() {
        VatDataReport report = validator.validate(VatData.builder().build());

        assertThat(report.isValid()).isFalse();
        assertThat(codes(report.getErrors())).containsExactly("NO_VAT_DATA");
        assertThat(report.getConfidence()).isZero();
    }

    @Test
    @DisplayName("negative values, foreign rates and a foreign supplier are all reported")
    void problemData() {
        VatData data = VatData.builder()
                .salesVAT(List.of(-5.0, 10.0, 10.0))
                .vatRates(List.of(20.0))
                .vatNumber("GB123456789")
                .documentType(DocumentCategory.PURCHASE_INVOICE)
                .build();

        VatDataReport report = validator.validate(data);

        assertThat(report.isValid()).isFalse();
        assertThat(codes(report.getErrors()))
                .containsExactly("NEGATIVE_VAT_VALUES", "INVALID_IRISH_VAT_RATES", "INVALID_VAT_NUMBER_FORMAT");
        assertThat(codes(report.getWarnings()))
                .containsExactly("UK_VAT_RATE_DETECTED", "DUPLICATE_VAT_VALUES",
                        "POTENTIAL_REVERSE_CHARGE", "CATEGORY_VAT_MISMATCH");
        assertThat(report.getConfidence()).isCloseTo(0.1, within(1e-9));
        assertThat(report.getCorrectedData().getSalesVAT()).containsExactly(10.0);
        assertThat(report.getCorrectedData().getCorrections())
                .containsExactly("Removed duplicate sales VAT values", "Removed zero or negative VAT values");
    }

    @Test
    @DisplayName("annualized VAT above the threshold without a VAT number suggests registration")
    void registrationThreshold() {
        VatData data = VatData.builder()
                .salesVAT(List.of(5000.0))
                .vatRates(List.of(23.0))
                .periodStart(LocalDate.of(2024, 1, 1))
                .periodEnd(LocalDate.of(2024, 1, 31))
                .build();

        VatDataReport report = validator.validate(data);

        assertThat(codes(report.getWarnings())).contains("VAT_REGISTRATION_REQUIRED", "ROUND_VAT_VALUES");
        assertThat(report.getSuggestions()).contains("Include VAT number if available for better validation");
    }

    @Test
    @DisplayName("recognizes Irish VAT number formats")
    void vatNumbers() {
        assertThat(VatDataValidator.isValidIrishVatNumber("IE 1234567 WA")).isTrue();
        assertThat(VatDataValidator.isValidIrishVatNumber("IE123")).isFalse();
        assertThat(VatDataValidator.isValidIrishVatNumber(null)).isFalse();
    }
}
