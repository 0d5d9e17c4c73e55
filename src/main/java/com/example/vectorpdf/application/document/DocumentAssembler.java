package com.example.vectorpdf.application.document;

import com.example.vectorpdf.application.exception.AssemblyInvariantException;
import com.example.vectorpdf.application.render.PdfNumbers;
import com.example.vectorpdf.application.render.PdfStrings;
import com.example.vectorpdf.domain.model.DocumentInfo;
import com.example.vectorpdf.domain.model.Margins;
import com.example.vectorpdf.domain.model.PageResult;
import com.example.vectorpdf.domain.model.PdfObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds a complete PDF 1.4 file from rendered pages.
 * <p>
 * Object numbers are assigned in a fixed order: catalog (1), one font per distinct font resource,
 * one content stream per page, one page object per page, the page tree, and finally the Info dictionary
 * when any metadata is present. The whole object section is materialized before offsets are computed,
 * and the finished file is checked against its own cross-reference table before it is returned.
 */
@Component
public class DocumentAssembler {

    private static final Logger log = LoggerFactory.getLogger(DocumentAssembler.class);

    static final String HEADER = "%PDF-1.4";
    // Tf always sits on its own line, so string operands of Tj never match
    private static final Pattern FONT_OPERATOR = Pattern.compile(
            "^/([^\\s/\\[\\]()<>{}%]+)[ \\t]+[-+]?[0-9]*\\.?[0-9]+[ \\t]+Tf[ \\t]*$", Pattern.MULTILINE);

    private final FontTable fontTable;

    /**
     * @param fontTable resource name to standard-14 BaseFont mapping
     */
    public DocumentAssembler(FontTable fontTable) {
        this.fontTable = fontTable;
    }

    /**
     * @param info  document metadata; an Info object is written only when a field is present
     * @param pages rendered pages in document order
     * @return the complete file as text; every character maps to exactly one ISO-8859-1 byte
     * @throws AssemblyInvariantException when a computed offset does not match the emitted bytes
     */
    public String assemble(DocumentInfo info, List<PageResult> pages) {
        List<Set<String>> pageFonts = pages.stream()
                .map(page -> fontsIn(page.contentStream()))
                .toList();
        Set<String> allFonts = new LinkedHashSet<>();
        pageFonts.forEach(allFonts::addAll);

        int pageCount = pages.size();
        int catalogNumber = 1;
        int firstFontNumber = catalogNumber + 1;
        int firstContentNumber = firstFontNumber + allFonts.size();
        int firstPageNumber = firstContentNumber + pageCount;
        int pagesNumber = firstPageNumber + pageCount;
        Integer infoNumber = info.hasAnyField() ? pagesNumber + 1 : null;

        List<PdfObject> objects = new ArrayList<>();
        objects.add(catalogObject(catalogNumber, pagesNumber));

        Map<String, Integer> fontNumbers = new LinkedHashMap<>();
        int fontNumber = firstFontNumber;
        for (String font : allFonts) {
            fontNumbers.put(font, fontNumber);
            objects.add(fontObject(fontNumber, font));
            fontNumber++;
        }
        for (int i = 0; i < pageCount; i++) {
            objects.add(contentObject(firstContentNumber + i, pages.get(i).contentStream()));
        }
        List<Integer> kids = new ArrayList<>();
        for (int i = 0; i < pageCount; i++) {
            int pageNumber = firstPageNumber + i;
            kids.add(pageNumber);
            objects.add(pageObject(pageNumber, pages.get(i), pagesNumber, firstContentNumber + i,
                    pageFonts.get(i), fontNumbers));
        }
        objects.add(pagesObject(pagesNumber, kids));
        if (infoNumber != null) {
            objects.add(infoObject(infoNumber, info));
        }

        String pdf = serialize(objects, catalogNumber, infoNumber);
        log.debug("Assembled {} object(s) for {} page(s), {} byte(s)", objects.size(), pageCount, pdf.length());
        return pdf;
    }

    /**
     * Lists font resource names set by {@code Tf} operator lines, in first-appearance order.
     *
     * @param contentStream emitted operators
     * @return distinct font names without the leading slash
     */
    Set<String> fontsIn(String contentStream) {
        Set<String> fonts = new LinkedHashSet<>();
        Matcher matcher = FONT_OPERATOR.matcher(contentStream);
        while (matcher.find()) {
            fonts.add(matcher.group(1));
        }
        return fonts;
    }

    private String serialize(List<PdfObject> objects, int catalogNumber, Integer infoNumber) {
        StringBuilder file = new StringBuilder(HEADER).append('\n');
        long position = byteLength(file);
        ByteOffsetTable offsets = new ByteOffsetTable();
        for (PdfObject object : objects) {
            offsets.record(object.number(), position);
            String serialized = object.serialize() + "\n";
            file.append(serialized);
            position += byteLength(serialized);
        }
        long xrefOffset = position;
        file.append(offsets.toXrefSection());
        file.append(trailer(offsets.size(), catalogNumber, infoNumber, xrefOffset));

        String pdf = file.toString();
        verifyOffsets(pdf, offsets, xrefOffset);
        return pdf;
    }

    private void verifyOffsets(String pdf, ByteOffsetTable offsets, long xrefOffset) {
        byte[] bytes = pdf.getBytes(StandardCharsets.ISO_8859_1);
        for (int number = 1; number <= offsets.objectCount(); number++) {
            long offset = offsets.offsetOf(number);
            if (!startsWith(bytes, offset, number + " 0 obj")) {
                throw new AssemblyInvariantException(
                        "Offset " + offset + " recorded for object " + number + " does not point at its definition");
            }
        }
        if (!startsWith(bytes, xrefOffset, "xref")) {
            throw new AssemblyInvariantException("startxref offset " + xrefOffset + " does not point at the xref section");
        }
    }

    private static boolean startsWith(byte[] bytes, long offset, String expected) {
        byte[] prefix = expected.getBytes(StandardCharsets.ISO_8859_1);
        if (offset < 0 || offset + prefix.length > bytes.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (bytes[(int) offset + i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    private static long byteLength(CharSequence text) {
        return text.toString().getBytes(StandardCharsets.ISO_8859_1).length;
    }

    private PdfObject catalogObject(int number, int pagesNumber) {
        return new PdfObject(number, "<<\n"
                + "/Type /Catalog\n"
                + "/Pages " + PdfObject.reference(pagesNumber) + "\n"
                + ">>");
    }

    private PdfObject fontObject(int number, String fontName) {
        return new PdfObject(number, "<<\n"
                + "/Type /Font\n"
                + "/Subtype /Type1\n"
                + "/BaseFont /" + fontTable.baseFontFor(fontName) + "\n"
                + ">>");
    }

    private PdfObject contentObject(int number, String contentStream) {
        String stream = contentStream + "\n";
        return new PdfObject(number, "<<\n"
                + "/Length " + byteLength(stream) + "\n"
                + ">>\n"
                + "stream\n"
                + stream
                + "endstream");
    }

    private PdfObject pageObject(int number, PageResult page, int pagesNumber, int contentNumber,
                                 Set<String> fonts, Map<String, Integer> fontNumbers) {
        Margins margins = page.margins() != null ? page.margins() : Margins.none();
        StringBuilder body = new StringBuilder("<<\n")
                .append("/Type /Page\n")
                .append("/Parent ").append(PdfObject.reference(pagesNumber)).append('\n')
                .append("/MediaBox [")
                .append(PdfNumbers.join(margins.left(), margins.bottom(), page.width(), page.height()))
                .append("]\n")
                .append("/Resources <<\n");
        if (!fonts.isEmpty()) {
            body.append("/Font <<\n");
            for (String font : fonts) {
                body.append('/').append(font).append(' ')
                        .append(PdfObject.reference(fontNumbers.get(font))).append('\n');
            }
            body.append(">>\n");
        }
        body.append(">>\n")
                .append("/Contents ").append(PdfObject.reference(contentNumber)).append('\n')
                .append(">>");
        return new PdfObject(number, body.toString());
    }

    private PdfObject pagesObject(int number, List<Integer> kids) {
        List<String> references = kids.stream().map(PdfObject::reference).toList();
        return new PdfObject(number, "<<\n"
                + "/Type /Pages\n"
                + "/Kids [" + String.join(" ", references) + "]\n"
                + "/Count " + kids.size() + "\n"
                + ">>");
    }

    private PdfObject infoObject(int number, DocumentInfo info) {
        StringBuilder body = new StringBuilder("<<\n");
        info.entries().forEach((key, value) ->
                body.append('/').append(key).append(' ').append(PdfStrings.encodeInfoValue(value)).append('\n'));
        body.append(">>");
        return new PdfObject(number, body.toString());
    }

    private String trailer(int size, int catalogNumber, Integer infoNumber, long xrefOffset) {
        StringBuilder trailer = new StringBuilder("trailer\n")
                .append("<<\n")
                .append("/Size ").append(size).append('\n')
                .append("/Root ").append(PdfObject.reference(catalogNumber)).append('\n');
        if (infoNumber != null) {
            trailer.append("/Info ").append(PdfObject.reference(infoNumber)).append('\n');
        }
        return trailer.append(">>\n")
                .append("startxref\n")
                .append(xrefOffset).append('\n')
                .append("%%EOF")
                .toString();
    }
}
