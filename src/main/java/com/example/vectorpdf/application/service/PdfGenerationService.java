package com.example.vectorpdf.application.service;

import com.example.vectorpdf.application.document.DocumentAssembler;
import com.example.vectorpdf.application.document.PageProcessor;
import com.example.vectorpdf.application.exception.AssemblyInvariantException;
import com.example.vectorpdf.application.render.OperatorEmitter;
import com.example.vectorpdf.application.validation.ElementAttributeValidator;
import com.example.vectorpdf.config.PdfGenerationProperties;
import com.example.vectorpdf.domain.model.DocumentAttributes;
import com.example.vectorpdf.domain.model.DocumentElement;
import com.example.vectorpdf.domain.model.Element;
import com.example.vectorpdf.domain.model.GeneratedPdfSummary;
import com.example.vectorpdf.domain.model.PageElement;
import com.example.vectorpdf.domain.model.PageResult;
import com.example.vectorpdf.infrastructure.pdf.PdfBoxOutputVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Stream;

/**
 * Application-layer service behind both public APIs: bare content streams and complete documents.
 * It validates input, applies configured defaults, fans pages out to the {@link PageProcessor} and
 * hands the ordered results to the {@link DocumentAssembler}.
 */
@Service
public class PdfGenerationService {

    private static final Logger log = LoggerFactory.getLogger(PdfGenerationService.class);

    private final OperatorEmitter operatorEmitter;
    private final PageProcessor pageProcessor;
    private final DocumentAssembler documentAssembler;
    private final ElementAttributeValidator validator;
    private final PdfBoxOutputVerifier outputVerifier;
    private final PdfGenerationProperties properties;

    /**
     * Creates the service with its collaborators.
     *
     * @param operatorEmitter   element-to-operator translation
     * @param pageProcessor     per-page rendering
     * @param documentAssembler object numbering, xref and trailer
     * @param validator         attribute checks for the document node
     * @param outputVerifier    PDFBox reader used for summaries and optional verification
     * @param properties        configured defaults and switches
     */
    public PdfGenerationService(OperatorEmitter operatorEmitter,
                                PageProcessor pageProcessor,
                                DocumentAssembler documentAssembler,
                                ElementAttributeValidator validator,
                                PdfBoxOutputVerifier outputVerifier,
                                PdfGenerationProperties properties) {
        this.operatorEmitter = operatorEmitter;
        this.pageProcessor = pageProcessor;
        this.documentAssembler = documentAssembler;
        this.validator = validator;
        this.outputVerifier = outputVerifier;
        this.properties = properties;
    }

    /**
     * Renders one element tree as raw operators, without any stream dictionary around them.
     * Coordinates are used as given.
     *
     * @param element drawable element
     * @return newline separated operators
     */
    public String renderContentStream(Element element) {
        String operators = operatorEmitter.emit(element);
        log.debug("Rendered {} element into {} char(s) of operators", element.type().tag(), operators.length());
        return operators;
    }

    /**
     * Renders a complete PDF document.
     *
     * @param document document tree in web coordinates
     * @return the file as text, one ISO-8859-1 byte per character
     */
    public String renderDocument(DocumentElement document) {
        validator.validate(document);
        DocumentAttributes attributes = properties.resolve(document);
        List<PageResult> pages = renderPages(document.pages(), attributes);

        String pdf = documentAssembler.assemble(attributes.info(), pages);
        if (properties.verifyOutput()) {
            verify(pdf, pages.size());
        }
        log.info("Generated PDF with {} page(s), {} byte(s)", pages.size(), pdf.length());
        return pdf;
    }

    /**
     * Renders a complete PDF document as bytes ready to be written or streamed.
     *
     * @param document document tree in web coordinates
     * @return PDF file bytes
     */
    public byte[] renderDocumentBytes(DocumentElement document) {
        return renderDocument(document).getBytes(StandardCharsets.ISO_8859_1);
    }

    /**
     * Renders a document and reads it back with PDFBox.
     *
     * @param document document tree in web coordinates
     * @return structural summary of the generated file
     */
    public GeneratedPdfSummary summarizeDocument(DocumentElement document) {
        return outputVerifier.summarize(renderDocumentBytes(document));
    }

    private void verify(String pdf, int expectedPages) {
        GeneratedPdfSummary summary = outputVerifier.summarize(pdf.getBytes(StandardCharsets.ISO_8859_1));
        if (summary.pageCount() != expectedPages) {
            log.warn("Read back {} page(s) but rendered {}", summary.pageCount(), expectedPages);
            throw new AssemblyInvariantException(
                    "Generated document reads back with " + summary.pageCount() + " page(s), expected " + expectedPages);
        }
    }

    private List<PageResult> renderPages(List<PageElement> pages, DocumentAttributes attributes) {
        Stream<PageElement> stream = properties.parallelPages() ? pages.parallelStream() : pages.stream();
        // ordered stream: results keep page order even when rendered in parallel
        return stream.map(page -> pageProcessor.process(page, attributes)).toList();
    }
}
