package com.vat.extraction.controller;

import com.vat.extraction.exception.InvalidRequestException;
import com.vat.extraction.model.*;
import com.vat.extraction.service.ExtractionValidationService;
import com.vat.extraction.service.VatDataValidator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/validation")
public class ValidationController {

    private final ExtractionValidationService validationService;
    private final VatDataValidator vatDataValidator;

    public ValidationController(ExtractionValidationService validationService,
                                VatDataValidator vatDataValidator) {
        this.validationService = validationService;
        this.vatDataValidator = vatDataValidator;
    }

    @PostMapping("/validate")
    public ResponseEntity<ValidationResult> validate(@RequestBody ValidateRequest request) {
        if (request.extraction() == null || request.expected() == null) {
            throw new InvalidRequestException("extraction and expected are required");
        }
        return ResponseEntity.ok(validationService.validate(request.extraction(), request.expected()));
    }

    /** Runs extraction over labeled cases and reports how close it came. */
    @PostMapping("/suite")
    public ResponseEntity<ValidationSummary> runSuite(@RequestBody List<ValidationCase> cases) {
        return ResponseEntity.ok(validationService.runValidationSuite(cases));
    }

    @PostMapping("/training-data")
    public ResponseEntity<TrainingData> trainingData(@RequestBody List<ValidationCase> cases) {
        ValidationSummary summary = validationService.runValidationSuite(cases);
        return ResponseEntity.ok(validationService.generateTrainingData(summary.getResults()));
    }

    @PostMapping("/vat-data")
    public ResponseEntity<VatDataReport> validateVatData(@RequestBody VatData data) {
        return ResponseEntity.ok(vatDataValidator.validate(data));
    }

    record ValidateRequest(ExtractionResult extraction, ExpectedTotals expected) {}
}
