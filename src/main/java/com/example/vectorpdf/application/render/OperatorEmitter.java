package com.example.vectorpdf.application.render;

import com.example.vectorpdf.application.validation.ElementAttributeValidator;
import com.example.vectorpdf.domain.exception.AttributeValidationException;
import com.example.vectorpdf.domain.exception.UnsupportedElementException;
import com.example.vectorpdf.domain.model.CircleElement;
import com.example.vectorpdf.domain.model.Element;
import com.example.vectorpdf.domain.model.GroupElement;
import com.example.vectorpdf.domain.model.LineElement;
import com.example.vectorpdf.domain.model.PathElement;
import com.example.vectorpdf.domain.model.RectElement;
import com.example.vectorpdf.domain.model.TextElement;
import com.example.vectorpdf.domain.model.TransformOp;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Translates one element (recursively, for groups) into content-stream operators.
 * <p>
 * Shapes share one styling rule: an optional line width, then optional fill and stroke colors, then the
 * path, then a paint operator chosen from which colors are present ({@code B} for both, {@code f} for fill,
 * {@code S} for stroke, and {@code f} with the inherited fill color when neither is given).
 * Coordinates are used as given; mapping from web coordinates happens upstream.
 */
@Component
public class OperatorEmitter {

    /**
     * Control-point distance factor of the standard four-arc Bézier circle.
     */
    static final double CIRCLE_BEZIER_FACTOR = 0.552284749831;

    private static final String DEFAULT_LINE_STROKE = "0 0 0 RG";
    private static final String DEFAULT_TEXT_FILL = "0 0 0 rg";

    private final ElementAttributeValidator validator;
    private final ColorResolver colorResolver;
    private final PathDataDecoder pathDataDecoder;
    private final TransformMatrixBuilder matrixBuilder;

    /**
     * @param validator       attribute checks run before any operator is produced
     * @param colorResolver   color value to RGB operand conversion
     * @param pathDataDecoder SVG path data decoder
     * @param matrixBuilder   transform to {@code cm} conversion
     */
    public OperatorEmitter(ElementAttributeValidator validator,
                           ColorResolver colorResolver,
                           PathDataDecoder pathDataDecoder,
                           TransformMatrixBuilder matrixBuilder) {
        this.validator = validator;
        this.colorResolver = colorResolver;
        this.pathDataDecoder = pathDataDecoder;
        this.matrixBuilder = matrixBuilder;
    }

    /**
     * Emits the operators for one element.
     *
     * @param element drawable element
     * @return newline separated operators without a trailing newline
     * @throws UnsupportedElementException  for pages and documents, which are not drawable
     * @throws AttributeValidationException when the validator rejects the element
     */
    public String emit(Element element) {
        validator.validate(element);
        return switch (element.type()) {
            case RECT -> rect((RectElement) element);
            case CIRCLE -> circle((CircleElement) element);
            case LINE -> line((LineElement) element);
            case PATH -> path((PathElement) element);
            case TEXT -> text((TextElement) element);
            case GROUP -> group((GroupElement) element);
            case PAGE, DOCUMENT -> throw new UnsupportedElementException(
                    element.type().tag(), "cannot be rendered inside a content stream");
        };
    }

    /**
     * @param r circle radius
     * @return distance of each Bézier control point from its arc end point
     */
    static double controlPointOffset(double r) {
        return r * CIRCLE_BEZIER_FACTOR;
    }

    private String rect(RectElement rect) {
        String path = PdfNumbers.join(rect.x(), rect.y(), rect.width(), rect.height()) + " re\n";
        return styledShape(rect.fill(), rect.stroke(), rect.strokeWidth(), path);
    }

    private String circle(CircleElement circle) {
        double cx = circle.cx();
        double cy = circle.cy();
        double r = circle.r();
        double k = controlPointOffset(r);
        String path = PdfNumbers.join(cx, cy + r) + " m\n"
                + PdfNumbers.join(cx + k, cy + r, cx + r, cy + k, cx + r, cy) + " c\n"
                + PdfNumbers.join(cx + r, cy - k, cx + k, cy - r, cx, cy - r) + " c\n"
                + PdfNumbers.join(cx - k, cy - r, cx - r, cy - k, cx - r, cy) + " c\n"
                + PdfNumbers.join(cx - r, cy + k, cx - k, cy + r, cx, cy + r) + " c\n";
        return styledShape(circle.fill(), circle.stroke(), circle.strokeWidth(), path);
    }

    private String path(PathElement path) {
        return styledShape(path.fill(), path.stroke(), path.strokeWidth(), pathDataDecoder.decode(path.d()));
    }

    private String line(LineElement line) {
        StringBuilder ops = new StringBuilder();
        appendLineWidth(ops, line.strokeWidth());
        if (line.stroke() != null) {
            ops.append(colorResolver.toOperands(line.stroke())).append(" RG\n");
        } else {
            ops.append(DEFAULT_LINE_STROKE).append('\n');
        }
        ops.append(PdfNumbers.join(line.x1(), line.y1())).append(" m\n")
                .append(PdfNumbers.join(line.x2(), line.y2())).append(" l\n")
                .append('S');
        return ops.toString();
    }

    private String text(TextElement text) {
        String fill = text.fill() != null
                ? colorResolver.toOperands(text.fill()) + " rg"
                : DEFAULT_TEXT_FILL;
        return "BT\n"
                + fill + "\n"
                + "/" + text.font() + " " + PdfNumbers.format(text.size()) + " Tf\n"
                + PdfNumbers.join(text.x(), text.y()) + " Td\n"
                + PdfStrings.encodeText(text.content()) + " Tj\n"
                + "ET";
    }

    private String group(GroupElement group) {
        List<String> lines = new ArrayList<>();
        lines.add("q");
        for (TransformOp transform : group.transforms()) {
            lines.add(matrixBuilder.toOperator(transform));
        }
        for (Element child : group.children()) {
            lines.add(emit(child));
        }
        lines.add("Q");
        return String.join("\n", lines);
    }

    private String styledShape(String fill, String stroke, Double strokeWidth, String path) {
        boolean hasFill = fill != null;
        boolean hasStroke = stroke != null;
        StringBuilder ops = new StringBuilder();
        appendLineWidth(ops, strokeWidth);
        if (hasFill) {
            ops.append(colorResolver.toOperands(fill)).append(" rg\n");
        }
        if (hasStroke) {
            ops.append(colorResolver.toOperands(stroke)).append(" RG\n");
        }
        ops.append(path);
        ops.append(paintOperator(hasFill, hasStroke));
        return ops.toString();
    }

    private static String paintOperator(boolean hasFill, boolean hasStroke) {
        if (hasFill && hasStroke) {
            return "B";
        }
        if (hasStroke) {
            return "S";
        }
        return "f";
    }

    private static void appendLineWidth(StringBuilder ops, Double strokeWidth) {
        if (strokeWidth != null) {
            ops.append(PdfNumbers.format(strokeWidth)).append(" w\n");
        }
    }
}
