package com.example.vectorpdf.interfaces.api;

import com.example.vectorpdf.application.service.PdfGenerationService;
import com.example.vectorpdf.domain.model.DocumentElement;
import com.example.vectorpdf.domain.model.GeneratedPdfSummary;
import com.example.vectorpdf.infrastructure.hiccup.HiccupTreeReader;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Interfaces-layer REST controller that turns JSON element trees into content streams and PDF files.
 */
@RestController
public class PdfGenerationController {

    private static final String DEFAULT_FILENAME = "document.pdf";

    private final HiccupTreeReader treeReader;
    private final PdfGenerationService generationService;

    /**
     * Creates the controller with the reader for request bodies and the generation service.
     *
     * @param treeReader        JSON element tree reader
     * @param generationService service producing operators and documents
     */
    public PdfGenerationController(HiccupTreeReader treeReader, PdfGenerationService generationService) {
        this.treeReader = treeReader;
        this.generationService = generationService;
    }

    /**
     * Renders a single element tree as content stream operators.
     *
     * @param body JSON element, e.g. {@code ["rect", {"x": 10, ...}]}
     * @return operators as plain text
     */
    @PostMapping(value = "/api/content-stream", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> renderContentStream(@RequestBody JsonNode body) {
        String operators = generationService.renderContentStream(treeReader.readElement(body));
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_PLAIN)
                .body(operators);
    }

    /**
     * Renders a document tree as a downloadable PDF file.
     *
     * @param body     JSON document element with page children
     * @param filename name offered to the client for the download
     * @return PDF bytes
     */
    @PostMapping(value = "/api/document", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<byte[]> renderDocument(@RequestBody JsonNode body,
                                                 @RequestParam(value = "filename", required = false) String filename) {
        DocumentElement document = treeReader.readDocument(body);
        byte[] pdf = generationService.renderDocumentBytes(document);
        ContentDisposition disposition = ContentDisposition.attachment()
                .filename(filename == null || filename.isBlank() ? DEFAULT_FILENAME : filename)
                .build();
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .contentType(MediaType.APPLICATION_PDF)
                .body(pdf);
    }

    /**
     * Renders a document tree and returns what PDFBox reads back from it.
     *
     * @param body JSON document element with page children
     * @return page count, version, info entries and page boxes
     */
    @PostMapping(value = "/api/document/summary", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<GeneratedPdfSummary> summarizeDocument(@RequestBody JsonNode body) {
        GeneratedPdfSummary summary = generationService.summarizeDocument(treeReader.readDocument(body));
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(summary);
    }
}
