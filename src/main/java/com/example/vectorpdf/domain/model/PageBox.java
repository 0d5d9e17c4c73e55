package com.example.vectorpdf.domain.model;

/**
 * MediaBox of one page as read back from a generated file, in PDF rectangle order.
 *
 * @param llx lower-left x
 * @param lly lower-left y
 * @param urx upper-right x
 * @param ury upper-right y
 */
public record PageBox(
        float llx,
        float lly,
        float urx,
        float ury
) {
}
