package com.example.vectorpdf.application.document;

import com.example.vectorpdf.application.render.ColorResolver;
import com.example.vectorpdf.application.render.OperatorEmitter;
import com.example.vectorpdf.application.render.PathDataDecoder;
import com.example.vectorpdf.application.render.TransformMatrixBuilder;
import com.example.vectorpdf.application.validation.DefaultElementAttributeValidator;
import com.example.vectorpdf.domain.exception.AttributeValidationException;
import com.example.vectorpdf.domain.model.DocumentAttributes;
import com.example.vectorpdf.domain.model.DocumentInfo;
import com.example.vectorpdf.domain.model.GroupElement;
import com.example.vectorpdf.domain.model.Margins;
import com.example.vectorpdf.domain.model.PageElement;
import com.example.vectorpdf.domain.model.PageResult;
import com.example.vectorpdf.domain.model.RectElement;
import com.example.vectorpdf.domain.model.TranslateOp;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for single-page rendering and attribute inheritance.
 */
class PageProcessorTest {

    private static final Margins INCH = new Margins(72, 72, 72, 72);
    private static final DocumentAttributes LETTER = new DocumentAttributes(612, 792, INCH, DocumentInfo.empty());

    private final PageProcessor processor;

    PageProcessorTest() {
        ColorResolver colorResolver = new ColorResolver();
        DefaultElementAttributeValidator validator = new DefaultElementAttributeValidator(colorResolver);
        OperatorEmitter emitter = new OperatorEmitter(validator, colorResolver, new PathDataDecoder(), new TransformMatrixBuilder());
        processor = new PageProcessor(validator, new CoordinateMapper(), emitter);
    }

    @Test
    void pageInheritsDocumentGeometry() {
        PageResult result = processor.process(new PageElement(null, null, null, List.of()), LETTER);

        assertThat(result.width()).isEqualTo(612);
        assertThat(result.height()).isEqualTo(792);
        assertThat(result.margins()).isEqualTo(INCH);
        assertThat(result.contentStream()).isEmpty();
    }

    @Test
    void pageValuesOverrideDocument() {
        PageResult result = processor.process(new PageElement(595.0, null, Margins.none(), List.of()), LETTER);

        assertThat(result.width()).isEqualTo(595);
        assertThat(result.height()).isEqualTo(792);
        assertThat(result.margins()).isEqualTo(Margins.none());
    }

    @Test
    void widthOnlyOverrideKeepsDocumentHeightAndMargins() {
        PageResult result = processor.process(new PageElement(842.0, null, null, List.of()), LETTER);

        assertThat(result.width()).isEqualTo(842);
        assertThat(result.height()).isEqualTo(792);
        assertThat(result.margins()).isEqualTo(INCH);
    }

    /**
     * Verifies elements are mapped against the resolved page height and joined with newlines.
     */
    @Test
    void elementsAreMappedAndJoined() {
        PageElement page = new PageElement(null, 500.0, null, List.of(
                new RectElement(10.0, 20.0, 100.0, 50.0, "red", null, null),
                new RectElement(0.0, 0.0, 10.0, 10.0, null, null, null)));

        PageResult result = processor.process(page, LETTER);

        assertThat(result.contentStream()).isEqualTo("1 0 0 rg\n10 430 100 50 re\nf\n0 490 10 10 re\nf");
        assertThat(result.metadata().elementCount()).isEqualTo(2);
        assertThat(result.metadata().hasTransforms()).isFalse();
    }

    @Test
    void nestedTransformsAreReported() {
        GroupElement inner = new GroupElement(List.of(new TranslateOp(1, 1)), List.of());
        PageElement page = new PageElement(null, null, null, List.of(new GroupElement(List.of(), List.of(inner))));

        assertThat(processor.process(page, LETTER).metadata().hasTransforms()).isTrue();
    }

    @Test
    void nonPositivePageWidthIsRejected() {
        PageElement page = new PageElement(0.0, null, null, List.of());

        AttributeValidationException ex = assertThrows(AttributeValidationException.class,
                () -> processor.process(page, LETTER));
        assertThat(ex.getField()).isEqualTo("width");
    }
}
