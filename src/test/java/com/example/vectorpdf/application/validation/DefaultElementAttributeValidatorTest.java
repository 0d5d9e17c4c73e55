package com.example.vectorpdf.application.validation;

import com.example.vectorpdf.application.render.ColorResolver;
import com.example.vectorpdf.domain.exception.AttributeValidationException;
import com.example.vectorpdf.domain.model.CircleElement;
import com.example.vectorpdf.domain.model.DocumentElement;
import com.example.vectorpdf.domain.model.Element;
import com.example.vectorpdf.domain.model.GroupElement;
import com.example.vectorpdf.domain.model.Margins;
import com.example.vectorpdf.domain.model.PathElement;
import com.example.vectorpdf.domain.model.RectElement;
import com.example.vectorpdf.domain.model.TextElement;
import com.example.vectorpdf.domain.model.TranslateOp;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for the default attribute rules.
 */
class DefaultElementAttributeValidatorTest {

    private final ElementAttributeValidator validator = new DefaultElementAttributeValidator(new ColorResolver());

    @Test
    void validElementIsReturnedUnchanged() {
        RectElement rect = new RectElement(0.0, 0.0, 10.0, 10.0, "#00ff00", "black", 1.5);

        assertThat(validator.validate(rect)).isSameAs(rect);
    }

    /**
     * Ensures a missing required number names the element and field.
     */
    @Test
    void missingNumberIsReported() {
        AttributeValidationException ex = failure(new RectElement(null, 0.0, 10.0, 10.0, null, null, null));

        assertThat(ex.getElementType()).isEqualTo("rect");
        assertThat(ex.getField()).isEqualTo("x");
        assertThat(ex.getReceived()).isNull();
        assertThat(ex.getMessage()).isEqualTo("Missing number in rect element, attribute 'x'");
    }

    @Test
    void nonFiniteNumberIsRejected() {
        AttributeValidationException ex = failure(new RectElement(0.0, Double.NaN, 10.0, 10.0, null, null, null));

        assertThat(ex.getField()).isEqualTo("y");
        assertThat(ex.toDetails()).containsEntry("expected", "finite number");
    }

    @Test
    void negativeRadiusIsRejected() {
        assertThat(failure(new CircleElement(0.0, 0.0, -1.0, null, null, null)).getField()).isEqualTo("r");
    }

    @Test
    void negativeStrokeWidthIsRejected() {
        AttributeValidationException ex = failure(new PathElement("M0 0 L1 1", null, "red", -2.0));

        assertThat(ex.getField()).isEqualTo("stroke-width");
        assertThat(ex.getMessage()).isEqualTo(
                "Expected non-negative number in path element, attribute 'stroke-width'. Got: -2.0");
    }

    @Test
    void unresolvableColorIsRejected() {
        AttributeValidationException ex = failure(new RectElement(0.0, 0.0, 1.0, 1.0, null, "purple", null));

        assertThat(ex.getField()).isEqualTo("stroke");
        assertThat(ex.getReceived()).isEqualTo("purple");
    }

    @Test
    void blankPathDataIsRejected() {
        assertThat(failure(new PathElement("  ", "red", null, null)).getField()).isEqualTo("d");
    }

    @Test
    void textNeedsPositiveSizeAndPlainFontName() {
        assertThat(failure(new TextElement(0.0, 0.0, "Helvetica", 0.0, null, "x")).getField()).isEqualTo("size");
        assertThat(failure(new TextElement(0.0, 0.0, "Times Roman", 12.0, null, "x")).getField()).isEqualTo("font");
        assertThat(failure(new TextElement(0.0, 0.0, null, 12.0, null, "x")).getField()).isEqualTo("font");
    }

    @Test
    void groupTransformsMustBeFinite() {
        GroupElement group = new GroupElement(List.of(new TranslateOp(Double.POSITIVE_INFINITY, 0)), List.of());

        assertThat(failure(group).getField()).isEqualTo("transforms");
    }

    @Test
    void documentRulesCoverMetadataAndGeometry() {
        assertThat(failure(document(" ", null, null)).getField()).isEqualTo("title");
        assertThat(failure(document(null, -612.0, null)).getField()).isEqualTo("width");
        assertThat(failure(document(null, null, new Margins(0, Double.NaN, 0, 0))).getField()).isEqualTo("margins");
        assertThat(validator.validate(document("Report", 612.0, Margins.none())).title()).isEqualTo("Report");
    }

    private AttributeValidationException failure(Element element) {
        return assertThrows(AttributeValidationException.class, () -> validator.validate(element));
    }

    private static DocumentElement document(String title, Double width, Margins margins) {
        return new DocumentElement(title, null, null, null, null, null, width, null, margins, List.of());
    }
}
