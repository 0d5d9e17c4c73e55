package com.example.vectorpdf.infrastructure.hiccup;

import com.example.vectorpdf.domain.exception.AttributeValidationException;
import com.example.vectorpdf.domain.exception.StructuralElementException;
import com.example.vectorpdf.domain.exception.UnsupportedElementException;
import com.example.vectorpdf.domain.model.CircleElement;
import com.example.vectorpdf.domain.model.DocumentElement;
import com.example.vectorpdf.domain.model.Element;
import com.example.vectorpdf.domain.model.ElementType;
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
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads the JSON form of an element tree into typed element records.
 * <p>
 * Every node is an array {@code [tag, attributes, ...children]}: a string tag, an attributes object, then
 * child nodes (or, for text, the text content). Transforms are written as
 * {@code [["translate", [dx, dy]], ["rotate", degrees], ["scale", [sx, sy]]]} and margins as
 * {@code [top, right, bottom, left]}.
 * <p>
 * This reader rejects malformed structure, unknown tags and wrongly typed attributes. Missing attributes
 * and range checks are left to the attribute validator.
 */
@Component
public class HiccupTreeReader {

    private static final int TAG_INDEX = 0;
    private static final int ATTRIBUTES_INDEX = 1;
    private static final int FIRST_CHILD_INDEX = 2;

    /**
     * Reads any element node.
     *
     * @param node JSON node of the element
     * @return typed element tree
     * @throws StructuralElementException   when the node is not {@code [tag, {attributes}, ...]}
     * @throws UnsupportedElementException  when the tag is unknown
     * @throws AttributeValidationException when an attribute has the wrong JSON type
     */
    public Element readElement(JsonNode node) {
        ElementType type = readTag(node);
        JsonNode attributes = node.get(ATTRIBUTES_INDEX);
        String tag = type.tag();
        return switch (type) {
            case RECT -> new RectElement(
                    number(tag, attributes, "x"),
                    number(tag, attributes, "y"),
                    number(tag, attributes, "width"),
                    number(tag, attributes, "height"),
                    string(tag, attributes, "fill"),
                    string(tag, attributes, "stroke"),
                    number(tag, attributes, "stroke-width"));
            case CIRCLE -> new CircleElement(
                    number(tag, attributes, "cx"),
                    number(tag, attributes, "cy"),
                    number(tag, attributes, "r"),
                    string(tag, attributes, "fill"),
                    string(tag, attributes, "stroke"),
                    number(tag, attributes, "stroke-width"));
            case LINE -> new LineElement(
                    number(tag, attributes, "x1"),
                    number(tag, attributes, "y1"),
                    number(tag, attributes, "x2"),
                    number(tag, attributes, "y2"),
                    string(tag, attributes, "stroke"),
                    number(tag, attributes, "stroke-width"));
            case PATH -> new PathElement(
                    string(tag, attributes, "d"),
                    string(tag, attributes, "fill"),
                    string(tag, attributes, "stroke"),
                    number(tag, attributes, "stroke-width"));
            case TEXT -> new TextElement(
                    number(tag, attributes, "x"),
                    number(tag, attributes, "y"),
                    string(tag, attributes, "font"),
                    number(tag, attributes, "size"),
                    string(tag, attributes, "fill"),
                    textContent(node));
            case GROUP -> new GroupElement(transforms(attributes.get("transforms")), children(node));
            case PAGE -> readPage(node, attributes);
            case DOCUMENT -> readDocument(node);
        };
    }

    /**
     * Reads a document root.
     *
     * @param node JSON node whose tag must be {@code document}
     * @return typed document
     * @throws StructuralElementException when the root is not a document or a child is not a page
     */
    public DocumentElement readDocument(JsonNode node) {
        ElementType type = readTag(node);
        if (type != ElementType.DOCUMENT) {
            throw new StructuralElementException("Root element must be document, got: " + type.tag());
        }
        JsonNode attributes = node.get(ATTRIBUTES_INDEX);
        String tag = type.tag();
        List<PageElement> pages = new ArrayList<>();
        for (int i = FIRST_CHILD_INDEX; i < node.size(); i++) {
            ElementType childType = readTag(node.get(i));
            if (childType != ElementType.PAGE) {
                throw new StructuralElementException("Expected page element, got: " + childType.tag());
            }
            pages.add(readPage(node.get(i), node.get(i).get(ATTRIBUTES_INDEX)));
        }
        return new DocumentElement(
                string(tag, attributes, "title"),
                string(tag, attributes, "author"),
                string(tag, attributes, "subject"),
                string(tag, attributes, "keywords"),
                string(tag, attributes, "creator"),
                string(tag, attributes, "producer"),
                number(tag, attributes, "width"),
                number(tag, attributes, "height"),
                margins(tag, attributes.get("margins")),
                pages);
    }

    private PageElement readPage(JsonNode node, JsonNode attributes) {
        String tag = ElementType.PAGE.tag();
        return new PageElement(
                number(tag, attributes, "width"),
                number(tag, attributes, "height"),
                margins(tag, attributes.get("margins")),
                children(node));
    }

    private ElementType readTag(JsonNode node) {
        if (node == null || !node.isArray()) {
            throw new StructuralElementException("Element must be an array of [tag, attributes, ...children]");
        }
        if (node.size() < 2) {
            throw new StructuralElementException("Element needs at least a tag and an attributes object");
        }
        JsonNode tagNode = node.get(TAG_INDEX);
        if (!tagNode.isTextual()) {
            throw new StructuralElementException("Element tag must be a string, got: " + tagNode);
        }
        String tag = tagNode.asText();
        if (!node.get(ATTRIBUTES_INDEX).isObject()) {
            throw new StructuralElementException("Attributes of " + tag + " element must be an object");
        }
        return ElementType.fromTag(tag).orElseThrow(() -> new UnsupportedElementException(tag));
    }

    private List<Element> children(JsonNode node) {
        List<Element> children = new ArrayList<>();
        for (int i = FIRST_CHILD_INDEX; i < node.size(); i++) {
            children.add(readElement(node.get(i)));
        }
        return children;
    }

    private String textContent(JsonNode node) {
        if (node.size() <= FIRST_CHILD_INDEX) {
            return "";
        }
        JsonNode content = node.get(FIRST_CHILD_INDEX);
        if (content.isNull()) {
            return "";
        }
        if (!content.isValueNode()) {
            throw new StructuralElementException("Text content must be a string");
        }
        return content.asText();
    }

    private List<TransformOp> transforms(JsonNode node) {
        String tag = ElementType.GROUP.tag();
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new AttributeValidationException(tag, "transforms", "array of transforms", node.toString());
        }
        List<TransformOp> transforms = new ArrayList<>();
        for (JsonNode transform : node) {
            if (!transform.isArray() || transform.size() != 2 || !transform.get(0).isTextual()) {
                throw new AttributeValidationException(tag, "transforms", "[name, arguments] pair", transform.toString());
            }
            String name = transform.get(0).asText().toLowerCase(Locale.ROOT);
            JsonNode args = transform.get(1);
            transforms.add(switch (name) {
                case "translate" -> {
                    double[] pair = numberPair(tag, args);
                    yield new TranslateOp(pair[0], pair[1]);
                }
                case "scale" -> {
                    double[] pair = numberPair(tag, args);
                    yield new ScaleOp(pair[0], pair[1]);
                }
                case "rotate" -> {
                    if (!args.isNumber()) {
                        throw new AttributeValidationException(tag, "transforms", "rotation in degrees", args.toString());
                    }
                    yield new RotateOp(args.asDouble());
                }
                default -> throw new AttributeValidationException(
                        tag, "transforms", "translate, rotate or scale", name);
            });
        }
        return transforms;
    }

    private double[] numberPair(String tag, JsonNode args) {
        if (!args.isArray() || args.size() != 2 || !args.get(0).isNumber() || !args.get(1).isNumber()) {
            throw new AttributeValidationException(tag, "transforms", "array of two numbers", args.toString());
        }
        return new double[]{args.get(0).asDouble(), args.get(1).asDouble()};
    }

    private Margins margins(String tag, JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isArray() || node.size() != 4) {
            throw new AttributeValidationException(tag, "margins", "array of four numbers", node.toString());
        }
        List<Double> values = new ArrayList<>();
        for (JsonNode side : node) {
            if (!side.isNumber()) {
                throw new AttributeValidationException(tag, "margins", "array of four numbers", node.toString());
            }
            values.add(side.asDouble());
        }
        return Margins.of(values);
    }

    private Double number(String tag, JsonNode attributes, String field) {
        JsonNode value = attributes.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isNumber()) {
            throw new AttributeValidationException(tag, field, "number", value.toString());
        }
        return value.asDouble();
    }

    private String string(String tag, JsonNode attributes, String field) {
        JsonNode value = attributes.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new AttributeValidationException(tag, field, "string", value.toString());
        }
        return value.asText();
    }
}
