package com.example.vectorpdf.domain.model;

import java.util.List;

/**
 * Structural summary of a generated PDF, read back independently of the generator.
 * Returned by the summary endpoint and used for the optional post-assembly verification.
 */
public record GeneratedPdfSummary(
        int pageCount,
        String pdfVersion,
        PdfInfoDictionary info,
        List<PageBox> mediaBoxes,
        long fileSizeBytes
) {
}
