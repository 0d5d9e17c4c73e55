package com.example.vectorpdf.domain.model;

public record ScaleOp(double sx, double sy) implements TransformOp {

    @Override
    public TransformType type() {
        return TransformType.SCALE;
    }
}
