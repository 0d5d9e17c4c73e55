package com.example.vectorpdf.application.document;

import com.example.vectorpdf.domain.model.CircleElement;
import com.example.vectorpdf.domain.model.Element;
import com.example.vectorpdf.domain.model.GroupElement;
import com.example.vectorpdf.domain.model.LineElement;
import com.example.vectorpdf.domain.model.Margins;
import com.example.vectorpdf.domain.model.RectElement;
import com.example.vectorpdf.domain.model.TextElement;
import com.example.vectorpdf.domain.model.TransformOp;
import com.example.vectorpdf.domain.model.TranslateOp;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Rewrites web-style coordinates (origin top-left, y down) into PDF coordinates (origin bottom-left, y up).
 * <p>
 * The base rule is {@code pdfY = pageHeight - webY}. Rectangles also subtract their height because PDF
 * anchors {@code re} at the bottom-left corner. Paths are left alone, and groups only remap the y offset
 * of their translations. Margins are accepted but not applied to y; they only shape the page MediaBox.
 */
@Component
public class CoordinateMapper {

    /**
     * @param webY       y in web coordinates
     * @param pageHeight page height in points
     * @return y in PDF coordinates
     */
    public double toPdfY(double webY, double pageHeight) {
        return pageHeight - webY;
    }

    /**
     * Maps one element and, for groups, its whole subtree.
     *
     * @param element    element in web coordinates
     * @param pageHeight resolved page height in points
     * @param margins    resolved page margins
     * @return new element in PDF coordinates; the input is left untouched
     */
    public Element map(Element element, double pageHeight, Margins margins) {
        return switch (element.type()) {
            case RECT -> mapRect((RectElement) element, pageHeight);
            case CIRCLE -> {
                CircleElement circle = (CircleElement) element;
                yield circle.cy() == null ? circle : circle.withCy(toPdfY(circle.cy(), pageHeight));
            }
            case LINE -> {
                LineElement line = (LineElement) element;
                yield line.withYs(mapNullable(line.y1(), pageHeight), mapNullable(line.y2(), pageHeight));
            }
            case TEXT -> {
                TextElement text = (TextElement) element;
                yield text.y() == null ? text : text.withY(toPdfY(text.y(), pageHeight));
            }
            case GROUP -> mapGroup((GroupElement) element, pageHeight, margins);
            case PATH, PAGE, DOCUMENT -> element;
        };
    }

    /**
     * Maps every top-level element of a page.
     *
     * @param elements   page children in web coordinates
     * @param pageHeight resolved page height
     * @param margins    resolved page margins
     * @return mapped children in the same order
     */
    public List<Element> mapAll(List<Element> elements, double pageHeight, Margins margins) {
        return elements.stream()
                .map(element -> map(element, pageHeight, margins))
                .toList();
    }

    private RectElement mapRect(RectElement rect, double pageHeight) {
        if (rect.y() == null || rect.height() == null) {
            return rect;
        }
        return rect.withY(toPdfY(rect.y(), pageHeight) - rect.height());
    }

    private GroupElement mapGroup(GroupElement group, double pageHeight, Margins margins) {
        List<TransformOp> transforms = group.transforms().stream()
                .map(transform -> transform instanceof TranslateOp translate
                        ? (TransformOp) new TranslateOp(translate.dx(), toPdfY(translate.dy(), pageHeight))
                        : transform)
                .toList();
        return new GroupElement(transforms, mapAll(group.children(), pageHeight, margins));
    }

    private Double mapNullable(Double webY, double pageHeight) {
        return webY == null ? null : toPdfY(webY, pageHeight);
    }
}
