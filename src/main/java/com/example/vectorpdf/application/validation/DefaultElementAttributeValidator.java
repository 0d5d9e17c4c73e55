package com.example.vectorpdf.application.validation;

import com.example.vectorpdf.application.render.ColorResolver;
import com.example.vectorpdf.domain.exception.AttributeValidationException;
import com.example.vectorpdf.domain.model.CircleElement;
import com.example.vectorpdf.domain.model.DocumentElement;
import com.example.vectorpdf.domain.model.Element;
import com.example.vectorpdf.domain.model.GroupElement;
import com.example.vectorpdf.domain.model.LineElement;
import com.example.vectorpdf.domain.model.Margins;
import com.example.vectorpdf.domain.model.PageElement;
import com.example.vectorpdf.domain.model.PathElement;
import com.example.vectorpdf.domain.model.RectElement;
import com.example.vectorpdf.domain.model.RotateOp;
import com.example.vectorpdf.domain.model.ScaleOp;
import com.example.vectorpdf.domain.model.TextElement;
import com.example.vectorpdf.domain.model.TransformOp;
import com.example.vectorpdf.domain.model.TranslateOp;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Default attribute rules: required numbers present and finite, radius and stroke width not negative,
 * font size and page dimensions positive, colors resolvable, path data and metadata strings not blank.
 */
@Component
public class DefaultElementAttributeValidator implements ElementAttributeValidator {

    private static final Pattern FONT_NAME_PATTERN = Pattern.compile("[A-Za-z0-9+\\-_.]+");

    private final ColorResolver colorResolver;

    /**
     * @param colorResolver resolver deciding which color values are acceptable
     */
    public DefaultElementAttributeValidator(ColorResolver colorResolver) {
        this.colorResolver = colorResolver;
    }

    @Override
    public <T extends Element> T validate(T element) {
        switch (element.type()) {
            case RECT -> validateRect((RectElement) element);
            case CIRCLE -> validateCircle((CircleElement) element);
            case LINE -> validateLine((LineElement) element);
            case PATH -> validatePath((PathElement) element);
            case TEXT -> validateText((TextElement) element);
            case GROUP -> validateGroup((GroupElement) element);
            case PAGE -> validatePage((PageElement) element);
            case DOCUMENT -> validateDocument((DocumentElement) element);
        }
        return element;
    }

    private void validateRect(RectElement rect) {
        String tag = rect.type().tag();
        requireNumber(tag, "x", rect.x());
        requireNumber(tag, "y", rect.y());
        requireNumber(tag, "width", rect.width());
        requireNumber(tag, "height", rect.height());
        checkStyling(tag, rect.fill(), rect.stroke(), rect.strokeWidth());
    }

    private void validateCircle(CircleElement circle) {
        String tag = circle.type().tag();
        requireNumber(tag, "cx", circle.cx());
        requireNumber(tag, "cy", circle.cy());
        requireNumber(tag, "r", circle.r());
        if (circle.r() < 0) {
            throw new AttributeValidationException(tag, "r", "non-negative number", circle.r());
        }
        checkStyling(tag, circle.fill(), circle.stroke(), circle.strokeWidth());
    }

    private void validateLine(LineElement line) {
        String tag = line.type().tag();
        requireNumber(tag, "x1", line.x1());
        requireNumber(tag, "y1", line.y1());
        requireNumber(tag, "x2", line.x2());
        requireNumber(tag, "y2", line.y2());
        checkStyling(tag, null, line.stroke(), line.strokeWidth());
    }

    private void validatePath(PathElement path) {
        String tag = path.type().tag();
        requireText(tag, "d", path.d());
        checkStyling(tag, path.fill(), path.stroke(), path.strokeWidth());
    }

    private void validateText(TextElement text) {
        String tag = text.type().tag();
        requireNumber(tag, "x", text.x());
        requireNumber(tag, "y", text.y());
        requireText(tag, "font", text.font());
        if (!FONT_NAME_PATTERN.matcher(text.font()).matches()) {
            throw new AttributeValidationException(tag, "font", "font name without spaces or delimiters", text.font());
        }
        requireNumber(tag, "size", text.size());
        if (text.size() <= 0) {
            throw new AttributeValidationException(tag, "size", "positive number", text.size());
        }
        checkColor(tag, "fill", text.fill());
    }

    private void validateGroup(GroupElement group) {
        String tag = group.type().tag();
        for (TransformOp transform : group.transforms()) {
            if (transform instanceof TranslateOp translate) {
                requireFinite(tag, "transforms", translate.dx());
                requireFinite(tag, "transforms", translate.dy());
            } else if (transform instanceof RotateOp rotate) {
                requireFinite(tag, "transforms", rotate.degrees());
            } else if (transform instanceof ScaleOp scale) {
                requireFinite(tag, "transforms", scale.sx());
                requireFinite(tag, "transforms", scale.sy());
            }
        }
    }

    private void validatePage(PageElement page) {
        String tag = page.type().tag();
        checkPositive(tag, "width", page.width());
        checkPositive(tag, "height", page.height());
        checkMargins(tag, page.margins());
    }

    private void validateDocument(DocumentElement document) {
        String tag = document.type().tag();
        checkOptionalText(tag, "title", document.title());
        checkOptionalText(tag, "author", document.author());
        checkOptionalText(tag, "subject", document.subject());
        checkOptionalText(tag, "keywords", document.keywords());
        checkOptionalText(tag, "creator", document.creator());
        checkOptionalText(tag, "producer", document.producer());
        checkPositive(tag, "width", document.width());
        checkPositive(tag, "height", document.height());
        checkMargins(tag, document.margins());
    }

    private void checkStyling(String tag, String fill, String stroke, Double strokeWidth) {
        checkColor(tag, "fill", fill);
        checkColor(tag, "stroke", stroke);
        if (strokeWidth != null) {
            requireFinite(tag, "stroke-width", strokeWidth);
            if (strokeWidth < 0) {
                throw new AttributeValidationException(tag, "stroke-width", "non-negative number", strokeWidth);
            }
        }
    }

    private void checkColor(String tag, String field, String color) {
        if (color != null && !colorResolver.isResolvable(color)) {
            throw new AttributeValidationException(tag, field, "named color or #rrggbb hex color", color);
        }
    }

    private void checkPositive(String tag, String field, Double value) {
        if (value == null) {
            return;
        }
        requireFinite(tag, field, value);
        if (value <= 0) {
            throw new AttributeValidationException(tag, field, "positive number", value);
        }
    }

    private void checkMargins(String tag, Margins margins) {
        if (margins == null) {
            return;
        }
        for (Double side : margins.toList()) {
            if (Double.isNaN(side) || Double.isInfinite(side)) {
                throw new AttributeValidationException(tag, "margins", "four finite numbers", margins.toList());
            }
        }
    }

    private void checkOptionalText(String tag, String field, String value) {
        if (value != null && value.isBlank()) {
            throw new AttributeValidationException(tag, field, "non-blank string", value);
        }
    }

    private static void requireNumber(String tag, String field, Double value) {
        if (value == null) {
            throw new AttributeValidationException(tag, field, "number", null);
        }
        requireFinite(tag, field, value);
    }

    private static void requireFinite(String tag, String field, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new AttributeValidationException(tag, field, "finite number", value);
        }
    }

    private static void requireText(String tag, String field, String value) {
        if (value == null) {
            throw new AttributeValidationException(tag, field, "string", null);
        }
        if (value.isBlank()) {
            throw new AttributeValidationException(tag, field, "non-blank string", value);
        }
    }
}
