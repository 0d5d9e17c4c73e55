package com.example.vectorpdf.application.render;

import com.example.vectorpdf.domain.model.RotateOp;
import com.example.vectorpdf.domain.model.ScaleOp;
import com.example.vectorpdf.domain.model.TranslateOp;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TransformMatrixBuilderTest {

    private final TransformMatrixBuilder builder = new TransformMatrixBuilder();

    @Test
    void translateBecomesOffsetMatrix() {
        assertThat(builder.toOperator(new TranslateOp(50, 50))).isEqualTo("1 0 0 1 50 50 cm");
    }

    @Test
    void scaleBecomesDiagonalMatrix() {
        assertThat(builder.toOperator(new ScaleOp(2, 0.5))).isEqualTo("2 0 0 0.5 0 0 cm");
    }

    @Test
    void rotateUsesDegrees() {
        double[] matrix = builder.toMatrix(new RotateOp(90));

        assertThat(matrix[0]).isCloseTo(0, within(1e-12));
        assertThat(matrix[1]).isCloseTo(1, within(1e-12));
        assertThat(matrix[2]).isCloseTo(-1, within(1e-12));
        assertThat(matrix[3]).isCloseTo(0, within(1e-12));
        assertThat(matrix[4]).isZero();
        assertThat(matrix[5]).isZero();
    }

    @Test
    void zeroRotationIsIdentity() {
        assertThat(builder.toOperator(new RotateOp(0))).isEqualTo("1 0 0 1 0 0 cm");
    }
}
