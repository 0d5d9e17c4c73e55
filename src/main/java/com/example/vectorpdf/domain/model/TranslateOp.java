package com.example.vectorpdf.domain.model;

public record TranslateOp(double dx, double dy) implements TransformOp {

    @Override
    public TransformType type() {
        return TransformType.TRANSLATE;
    }
}
