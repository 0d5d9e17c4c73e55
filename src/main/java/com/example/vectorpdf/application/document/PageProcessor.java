package com.example.vectorpdf.application.document;

import com.example.vectorpdf.application.render.OperatorEmitter;
import com.example.vectorpdf.application.validation.ElementAttributeValidator;
import com.example.vectorpdf.domain.model.DocumentAttributes;
import com.example.vectorpdf.domain.model.Element;
import com.example.vectorpdf.domain.model.GroupElement;
import com.example.vectorpdf.domain.model.PageAttributes;
import com.example.vectorpdf.domain.model.PageElement;
import com.example.vectorpdf.domain.model.PageMetadata;
import com.example.vectorpdf.domain.model.PageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders one page: inherits geometry from the document, maps coordinates, and emits each top-level element.
 * Has no cross-page state, so pages may be processed concurrently.
 */
@Component
public class PageProcessor {

    private static final Logger log = LoggerFactory.getLogger(PageProcessor.class);

    private final ElementAttributeValidator validator;
    private final CoordinateMapper coordinateMapper;
    private final OperatorEmitter operatorEmitter;

    /**
     * @param validator        checks the page's own attributes
     * @param coordinateMapper web-to-PDF coordinate conversion
     * @param operatorEmitter  element-to-operator translation
     */
    public PageProcessor(ElementAttributeValidator validator,
                         CoordinateMapper coordinateMapper,
                         OperatorEmitter operatorEmitter) {
        this.validator = validator;
        this.coordinateMapper = coordinateMapper;
        this.operatorEmitter = operatorEmitter;
    }

    /**
     * @param page     page as authored
     * @param document resolved document attributes supplying inherited geometry
     * @return content stream plus resolved geometry and metadata
     */
    public PageResult process(PageElement page, DocumentAttributes document) {
        validator.validate(page);
        PageAttributes attributes = PageAttributes.inherit(page, document);

        List<Element> mapped = coordinateMapper.mapAll(page.children(), attributes.height(), attributes.margins());
        String contentStream = mapped.stream()
                .map(operatorEmitter::emit)
                .collect(Collectors.joining("\n"));

        PageMetadata metadata = new PageMetadata(page.children().size(), anyTransforms(page.children()));
        log.debug("Rendered page {}x{} with {} element(s), {} char(s) of operators",
                attributes.width(), attributes.height(), metadata.elementCount(), contentStream.length());
        return new PageResult(attributes.width(), attributes.height(), attributes.margins(), contentStream, metadata);
    }

    private static boolean anyTransforms(List<Element> elements) {
        for (Element element : elements) {
            if (element instanceof GroupElement group
                    && (!group.transforms().isEmpty() || anyTransforms(group.children()))) {
                return true;
            }
        }
        return false;
    }
}
