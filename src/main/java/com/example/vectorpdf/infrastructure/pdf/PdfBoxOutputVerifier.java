package com.example.vectorpdf.infrastructure.pdf;

import com.example.vectorpdf.domain.model.GeneratedPdfSummary;
import com.example.vectorpdf.domain.model.PageBox;
import com.example.vectorpdf.domain.model.PdfInfoDictionary;
import com.example.vectorpdf.infrastructure.exception.PdfProcessingException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Infrastructure service that parses generated PDF bytes with PDFBox and maps what it finds into domain DTOs.
 * Hides the PDFBox parsing details from the rest of the application.
 */
@Service
public class PdfBoxOutputVerifier {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxOutputVerifier.class);

    /**
     * Parses a generated file and summarizes its structure.
     *
     * @param pdfBytes complete PDF file
     * @return page count, version, Info fields and MediaBoxes
     * @throws PdfProcessingException when PDFBox cannot parse the bytes
     */
    public GeneratedPdfSummary summarize(byte[] pdfBytes) {
        try (PDDocument document = Loader.loadPDF(pdfBytes)) {
            List<PageBox> mediaBoxes = new ArrayList<>();
            for (PDPage page : document.getPages()) {
                mediaBoxes.add(toPageBox(page.getMediaBox()));
            }
            return new GeneratedPdfSummary(
                    document.getNumberOfPages(),
                    String.valueOf(document.getDocument().getVersion()),
                    extractInfo(document.getDocumentInformation()),
                    List.copyOf(mediaBoxes),
                    pdfBytes.length
            );
        } catch (IOException ex) {
            log.warn("PDFBox could not read generated document of {} byte(s)", pdfBytes.length, ex);
            throw new PdfProcessingException("Unable to read the generated PDF back.", ex);
        }
    }

    /**
     * Extracts the info dictionary fields the generator writes.
     *
     * @param info info dictionary from PDFBox
     * @return mapped domain DTO or {@code null}
     */
    private PdfInfoDictionary extractInfo(PDDocumentInformation info) {
        if (info == null) {
            return null;
        }
        return new PdfInfoDictionary(
                info.getTitle(),
                info.getAuthor(),
                info.getSubject(),
                info.getKeywords(),
                info.getCreator(),
                info.getProducer()
        );
    }

    private PageBox toPageBox(PDRectangle box) {
        return new PageBox(box.getLowerLeftX(), box.getLowerLeftY(), box.getUpperRightX(), box.getUpperRightY());
    }
}
