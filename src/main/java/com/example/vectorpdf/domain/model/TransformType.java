package com.example.vectorpdf.domain.model;

public enum TransformType {
    TRANSLATE,
    ROTATE,
    SCALE
}
