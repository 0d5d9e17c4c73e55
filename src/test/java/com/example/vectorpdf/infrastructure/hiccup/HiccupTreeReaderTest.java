package com.example.vectorpdf.infrastructure.hiccup;

import com.example.vectorpdf.domain.exception.AttributeValidationException;
import com.example.vectorpdf.domain.exception.StructuralElementException;
import com.example.vectorpdf.domain.exception.UnsupportedElementException;
import com.example.vectorpdf.domain.model.DocumentElement;
import com.example.vectorpdf.domain.model.GroupElement;
import com.example.vectorpdf.domain.model.Margins;
import com.example.vectorpdf.domain.model.RectElement;
import com.example.vectorpdf.domain.model.RotateOp;
import com.example.vectorpdf.domain.model.ScaleOp;
import com.example.vectorpdf.domain.model.TextElement;
import com.example.vectorpdf.domain.model.TranslateOp;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for reading JSON element trees.
 */
class HiccupTreeReaderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HiccupTreeReader reader = new HiccupTreeReader();

    @Test
    void readsRectAttributes() throws Exception {
        RectElement rect = (RectElement) reader.readElement(json(
                "[\"rect\", {\"x\": 10, \"y\": 20.5, \"width\": 100, \"height\": 50, \"fill\": \"red\", \"stroke-width\": 2}]"));

        assertThat(rect).isEqualTo(new RectElement(10.0, 20.5, 100.0, 50.0, "red", null, 2.0));
    }

    @Test
    void readsTextContent() throws Exception {
        TextElement text = (TextElement) reader.readElement(json(
                "[\"text\", {\"x\": 1, \"y\": 2, \"font\": \"Helvetica\", \"size\": 12}, \"Hello\"]"));

        assertThat(text.content()).isEqualTo("Hello");
        assertThat(text.font()).isEqualTo("Helvetica");
    }

    @Test
    void textWithoutContentIsEmpty() throws Exception {
        TextElement text = (TextElement) reader.readElement(json(
                "[\"text\", {\"x\": 1, \"y\": 2, \"font\": \"Helvetica\", \"size\": 12}]"));

        assertThat(text.content()).isEmpty();
    }

    /**
     * Transforms keep their order; children are read recursively.
     */
    @Test
    void readsGroupWithTransformsAndChildren() throws Exception {
        GroupElement group = (GroupElement) reader.readElement(json(
                "[\"g\", {\"transforms\": [[\"translate\", [50, 60]], [\"rotate\", 45], [\"scale\", [2, 3]]]},"
                        + " [\"rect\", {\"x\": 0, \"y\": 0, \"width\": 1, \"height\": 1}],"
                        + " [\"g\", {}]]"));

        assertThat(group.transforms()).containsExactly(new TranslateOp(50, 60), new RotateOp(45), new ScaleOp(2, 3));
        assertThat(group.children()).hasSize(2);
        assertThat(group.children().get(1)).isEqualTo(new GroupElement(null, null));
    }

    @Test
    void readsDocumentWithPages() throws Exception {
        DocumentElement document = reader.readDocument(json(
                "[\"document\", {\"title\": \"Report\", \"width\": 595, \"height\": 842, \"margins\": [10, 20, 30, 40]},"
                        + " [\"page\", {}, [\"rect\", {\"x\": 0, \"y\": 0, \"width\": 1, \"height\": 1}]],"
                        + " [\"page\", {\"width\": 612}]]"));

        assertThat(document.title()).isEqualTo("Report");
        assertThat(document.margins()).isEqualTo(new Margins(10, 20, 30, 40));
        assertThat(document.pages()).hasSize(2);
        assertThat(document.pages().get(0).children()).hasSize(1);
        assertThat(document.pages().get(1).width()).isEqualTo(612.0);
    }

    @Test
    void documentChildrenMustBePages() throws Exception {
        JsonNode node = json("[\"document\", {}, [\"rect\", {}]]");

        assertThrows(StructuralElementException.class, () -> reader.readDocument(node));
    }

    @Test
    void documentRootIsRequired() throws Exception {
        JsonNode node = json("[\"page\", {}]");

        assertThrows(StructuralElementException.class, () -> reader.readDocument(node));
    }

    /**
     * Ensures nodes that are not {@code [tag, {attributes}, ...]} are rejected.
     */
    @ParameterizedTest
    @ValueSource(strings = {"{\"x\": 1}", "[\"rect\"]", "[1, {}]", "[\"rect\", []]", "\"rect\""})
    void malformedNodesAreStructuralErrors(String body) throws Exception {
        JsonNode node = json(body);

        assertThrows(StructuralElementException.class, () -> reader.readElement(node));
    }

    @Test
    void unknownTagIsUnsupported() throws Exception {
        JsonNode node = json("[\"polygon\", {}]");

        UnsupportedElementException ex = assertThrows(UnsupportedElementException.class, () -> reader.readElement(node));
        assertThat(ex.getTag()).isEqualTo("polygon");
        assertThat(ex.getMessage()).isEqualTo("Element type polygon not yet implemented");
    }

    @Test
    void wronglyTypedAttributeIsReported() throws Exception {
        JsonNode node = json("[\"circle\", {\"cx\": \"10\"}]");

        AttributeValidationException ex = assertThrows(AttributeValidationException.class, () -> reader.readElement(node));
        assertThat(ex.getElementType()).isEqualTo("circle");
        assertThat(ex.getField()).isEqualTo("cx");
    }

    @Test
    void marginsNeedFourNumbers() throws Exception {
        JsonNode node = json("[\"page\", {\"margins\": [1, 2, 3]}]");

        assertThat(assertThrows(AttributeValidationException.class, () -> reader.readElement(node)).getField())
                .isEqualTo("margins");
    }

    @Test
    void unknownTransformIsReported() throws Exception {
        JsonNode node = json("[\"g\", {\"transforms\": [[\"skew\", 10]]}]");

        assertThat(assertThrows(AttributeValidationException.class, () -> reader.readElement(node)).getField())
                .isEqualTo("transforms");
    }

    private JsonNode json(String body) throws Exception {
        return objectMapper.readTree(body);
    }
}
