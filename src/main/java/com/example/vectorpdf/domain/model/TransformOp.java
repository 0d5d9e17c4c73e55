package com.example.vectorpdf.domain.model;

/**
 * Single transform instruction attached to a group.
 * A group applies its transforms left to right, each as its own matrix concatenation.
 */
public interface TransformOp {

    TransformType type();
}
