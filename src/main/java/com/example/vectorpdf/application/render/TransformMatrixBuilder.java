package com.example.vectorpdf.application.render;

import com.example.vectorpdf.domain.model.RotateOp;
import com.example.vectorpdf.domain.model.ScaleOp;
import com.example.vectorpdf.domain.model.TransformOp;
import com.example.vectorpdf.domain.model.TranslateOp;
import org.springframework.stereotype.Component;

/**
 * Turns a transform instruction into a {@code cm} operator.
 * Successive operators compose in the viewer's current transformation matrix, so nothing is multiplied here.
 */
@Component
public class TransformMatrixBuilder {

    /**
     * @param transform translate, rotate or scale instruction
     * @return the six matrix entries {@code [a b c d e f]}
     */
    public double[] toMatrix(TransformOp transform) {
        return switch (transform.type()) {
            case TRANSLATE -> {
                TranslateOp translate = (TranslateOp) transform;
                yield new double[]{1, 0, 0, 1, translate.dx(), translate.dy()};
            }
            case ROTATE -> {
                double radians = ((RotateOp) transform).degrees() * Math.PI / 180;
                double cos = Math.cos(radians);
                double sin = Math.sin(radians);
                yield new double[]{cos, sin, -sin, cos, 0, 0};
            }
            case SCALE -> {
                ScaleOp scale = (ScaleOp) transform;
                yield new double[]{scale.sx(), 0, 0, scale.sy(), 0, 0};
            }
        };
    }

    /**
     * @param transform translate, rotate or scale instruction
     * @return operator text such as {@code 1 0 0 1 50 50 cm}
     */
    public String toOperator(TransformOp transform) {
        return PdfNumbers.join(toMatrix(transform)) + " cm";
    }
}
