package com.vat.extraction.exception;

public class DocumentNotFoundException extends RuntimeException {

    public DocumentNotFoundException(Long documentId) {
        super("Document not found: " + documentId);
    }
}
