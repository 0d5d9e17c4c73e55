package com.example.vectorpdf.domain.model;

/**
 * Info dictionary fields as read back from a generated file.
 */
public record PdfInfoDictionary(
        String title,
        String author,
        String subject,
        String keywords,
        String creator,
        String producer
) {
}
