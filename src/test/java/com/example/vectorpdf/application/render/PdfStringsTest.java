package com.example.vectorpdf.application.render;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for PDF string and number tokens.
 */
class PdfStringsTest {

    @Test
    void escapesLiteralDelimiters() {
        assertThat(PdfStrings.encodeText("a (b) \\ c")).isEqualTo("(a \\(b\\) \\\\ c)");
        assertThat(PdfStrings.encodeText("line\nbreak")).isEqualTo("(line\\nbreak)");
    }

    @Test
    void emptyTextIsEmptyLiteral() {
        assertThat(PdfStrings.encodeText("")).isEqualTo("()");
        assertThat(PdfStrings.encodeText(null)).isEqualTo("()");
    }

    @Test
    void nonAsciiTextBecomesLatin1Hex() {
        assertThat(PdfStrings.encodeText("Café")).isEqualTo("<436166E9>");
        assertThat(PdfStrings.encodeText("é€")).isEqualTo("<E93F>");
    }

    @Test
    void nonAsciiInfoValueBecomesUtf16() {
        assertThat(PdfStrings.encodeInfoValue("Report")).isEqualTo("(Report)");
        assertThat(PdfStrings.encodeInfoValue("é")).isEqualTo("<FEFF00E9>");
    }

    @Test
    void numbersUseShortestPlainForm() {
        assertThat(PdfNumbers.format(10.0)).isEqualTo("10");
        assertThat(PdfNumbers.format(-0.0)).isEqualTo("0");
        assertThat(PdfNumbers.format(0.5)).isEqualTo("0.5");
        assertThat(PdfNumbers.format(-12.25)).isEqualTo("-12.25");
        assertThat(PdfNumbers.format(1e-7)).isEqualTo("0.0000001");
        assertThat(PdfNumbers.join(1, 0, 0)).isEqualTo("1 0 0");
    }
}
