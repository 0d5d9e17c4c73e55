package com.example.vectorpdf.application.render;

import com.example.vectorpdf.application.validation.DefaultElementAttributeValidator;
import com.example.vectorpdf.domain.exception.AttributeValidationException;
import com.example.vectorpdf.domain.exception.UnsupportedElementException;
import com.example.vectorpdf.domain.model.CircleElement;
import com.example.vectorpdf.domain.model.Element;
import com.example.vectorpdf.domain.model.GroupElement;
import com.example.vectorpdf.domain.model.LineElement;
import com.example.vectorpdf.domain.model.PageElement;
import com.example.vectorpdf.domain.model.PathElement;
import com.example.vectorpdf.domain.model.RectElement;
import com.example.vectorpdf.domain.model.ScaleOp;
import com.example.vectorpdf.domain.model.TextElement;
import com.example.vectorpdf.domain.model.TranslateOp;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests covering operator emission for every drawable element.
 */
class OperatorEmitterTest {

    private final ColorResolver colorResolver = new ColorResolver();
    private final OperatorEmitter emitter = new OperatorEmitter(
            new DefaultElementAttributeValidator(colorResolver),
            colorResolver,
            new PathDataDecoder(),
            new TransformMatrixBuilder());

    /**
     * Verifies the paint operator follows which colors are present.
     */
    @Test
    void paintOperatorDependsOnFillAndStroke() {
        assertThat(emitter.emit(rect("red", null, null))).isEqualTo("1 0 0 rg\n0 0 10 10 re\nf");
        assertThat(emitter.emit(rect(null, "blue", null))).isEqualTo("0 0 1 RG\n0 0 10 10 re\nS");
        assertThat(emitter.emit(rect("red", "blue", null))).isEqualTo("1 0 0 rg\n0 0 1 RG\n0 0 10 10 re\nB");
        assertThat(emitter.emit(rect(null, null, null))).isEqualTo("0 0 10 10 re\nf");
    }

    @Test
    void lineWidthComesFirst() {
        assertThat(emitter.emit(rect("red", "blue", 2.0)))
                .isEqualTo("2 w\n1 0 0 rg\n0 0 1 RG\n0 0 10 10 re\nB");
    }

    @Test
    void circleUsesFourBezierArcs() {
        String ops = emitter.emit(new CircleElement(50.0, 50.0, 10.0, "green", null, null));

        assertThat(ops).startsWith("0 1 0 rg\n50 60 m\n");
        assertThat(ops).endsWith("50 60 c\nf");
        assertThat(ops.split(" c\n", -1)).hasSize(5);
    }

    @Test
    void circleControlPointOffsetUsesKappa() {
        assertThat(OperatorEmitter.controlPointOffset(10)).isCloseTo(5.52284749831, within(1e-9));
    }

    @Test
    void zeroRadiusCircleIsAccepted() {
        assertThat(emitter.emit(new CircleElement(5.0, 5.0, 0.0, null, null, null)))
                .startsWith("5 5 m\n");
    }

    /**
     * Lines are always stroked, in black unless told otherwise.
     */
    @Test
    void lineDefaultsToBlackStroke() {
        assertThat(emitter.emit(new LineElement(0.0, 0.0, 100.0, 100.0, null, null)))
                .isEqualTo("0 0 0 RG\n0 0 m\n100 100 l\nS");
        assertThat(emitter.emit(new LineElement(0.0, 0.0, 100.0, 100.0, "red", 2.0)))
                .isEqualTo("2 w\n1 0 0 RG\n0 0 m\n100 100 l\nS");
    }

    @Test
    void pathEmitsDecodedSegments() {
        assertThat(emitter.emit(new PathElement("M0 0 L10 10 Z", "blue", null, null)))
                .isEqualTo("0 0 1 rg\n0 0 m\n10 10 l\nh\nf");
    }

    @Test
    void textIsWrappedInTextObject() {
        String ops = emitter.emit(new TextElement(10.0, 20.0, "Helvetica", 12.0, null, "Hello (world)"));

        assertThat(ops).isEqualTo("BT\n0 0 0 rg\n/Helvetica 12 Tf\n10 20 Td\n(Hello \\(world\\)) Tj\nET");
    }

    @Test
    void groupSavesAndRestoresGraphicsState() {
        GroupElement group = new GroupElement(
                List.of(new TranslateOp(50, 50), new ScaleOp(2, 2)),
                List.of(rect("red", null, null)));

        assertThat(emitter.emit(group))
                .isEqualTo("q\n1 0 0 1 50 50 cm\n2 0 0 2 0 0 cm\n1 0 0 rg\n0 0 10 10 re\nf\nQ");
    }

    @Test
    void emptyGroupStillBalancesStateOperators() {
        assertThat(emitter.emit(new GroupElement(List.of(), List.of()))).isEqualTo("q\nQ");
    }

    @Test
    void nestedGroupsStayBalanced() {
        Element inner = new GroupElement(List.of(), List.of(rect(null, null, null)));
        String ops = emitter.emit(new GroupElement(List.of(), List.of(inner, inner)));

        assertThat(ops.lines().filter("q"::equals).count()).isEqualTo(3);
        assertThat(ops.lines().filter("Q"::equals).count()).isEqualTo(3);
    }

    @Test
    void invalidColorIsRejected() {
        AttributeValidationException ex = assertThrows(AttributeValidationException.class,
                () -> emitter.emit(rect("purple", null, null)));

        assertThat(ex.getField()).isEqualTo("fill");
    }

    @Test
    void pageCannotBeEmitted() {
        assertThrows(UnsupportedElementException.class,
                () -> emitter.emit(new PageElement(null, null, null, List.of())));
    }

    private static RectElement rect(String fill, String stroke, Double strokeWidth) {
        return new RectElement(0.0, 0.0, 10.0, 10.0, fill, stroke, strokeWidth);
    }
}
