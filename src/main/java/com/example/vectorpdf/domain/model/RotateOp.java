package com.example.vectorpdf.domain.model;

/**
 * Counter-clockwise rotation around the current origin, in degrees.
 */
public record RotateOp(double degrees) implements TransformOp {

    @Override
    public TransformType type() {
        return TransformType.ROTATE;
    }
}
