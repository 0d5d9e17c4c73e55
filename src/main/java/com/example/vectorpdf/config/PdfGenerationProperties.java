package com.example.vectorpdf.config;

import com.example.vectorpdf.domain.model.DocumentAttributes;
import com.example.vectorpdf.domain.model.DocumentElement;
import com.example.vectorpdf.domain.model.DocumentInfo;
import com.example.vectorpdf.domain.model.Margins;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * Generator settings bound from {@code vector-pdf.*} properties.
 *
 * @param defaults      values a document falls back to when it does not set them
 * @param parallelPages render the pages of one document on the common fork-join pool
 * @param verifyOutput  re-read every assembled document with PDFBox before returning it
 */
@ConfigurationProperties(prefix = "vector-pdf")
public record PdfGenerationProperties(
        @DefaultValue Defaults defaults,
        @DefaultValue("false") boolean parallelPages,
        @DefaultValue("false") boolean verifyOutput
) {

    /**
     * @param width    default page width in points (US Letter)
     * @param height   default page height in points (US Letter)
     * @param margins  default margins {@code [top, right, bottom, left]}
     * @param creator  Info {@code /Creator} used when the document sets none; blank disables it
     * @param producer Info {@code /Producer} used when the document sets none; blank disables it
     */
    public record Defaults(
            @DefaultValue("612") double width,
            @DefaultValue("792") double height,
            @DefaultValue({"0", "0", "0", "0"}) List<Double> margins,
            @DefaultValue("vector-pdf") String creator,
            @DefaultValue("vector-pdf") String producer
    ) {
    }

    /**
     * @return the settings used when nothing is configured
     */
    public static PdfGenerationProperties standard() {
        return new PdfGenerationProperties(
                new Defaults(612, 792, List.of(0d, 0d, 0d, 0d), "vector-pdf", "vector-pdf"),
                false,
                false);
    }

    /**
     * Applies the configured defaults to a document's own attributes; document values always win.
     *
     * @param document validated document element
     * @return resolved attributes inherited by every page
     */
    public DocumentAttributes resolve(DocumentElement document) {
        double width = document.width() != null ? document.width() : defaults.width();
        double height = document.height() != null ? document.height() : defaults.height();
        Margins margins = document.margins() != null ? document.margins() : Margins.of(defaults.margins());
        DocumentInfo info = new DocumentInfo(
                document.title(),
                document.author(),
                document.subject(),
                document.keywords(),
                firstNonBlank(document.creator(), defaults.creator()),
                firstNonBlank(document.producer(), defaults.producer()));
        return new DocumentAttributes(width, height, margins, info);
    }

    private static String firstNonBlank(String value, String fallback) {
        if (value != null) {
            return value;
        }
        return fallback == null || fallback.isBlank() ? null : fallback;
    }
}
