package teranet.mapdev.layout.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import teranet.mapdev.layout.dto.LayoutValidationReport;
import teranet.mapdev.layout.dto.ParsingResult;
import teranet.mapdev.layout.model.FormatType;
import teranet.mapdev.layout.model.Layout;

/**
 * Entry point of the engine for one request.
 *
 * Workflow for a document:
 * 1. Load the layout XML
 * 2. Promote the lines nested under LINHA020 and renumber the line sequences
 * 3. Validate line widths against the width resolved for the layout
 * 4. Parse the document against the normalized layout
 *
 * A layout with invalid lines is still used for parsing; the report is logged.
 */
@Slf4j
@Service
public class LayoutProcessingService {

    private final FormatDetectionService formatDetectionService;
    private final LayoutXmlLoader layoutXmlLoader;
    private final LayoutNormalizerService normalizerService;
    private final LayoutValidationService validationService;
    private final DocumentParserService documentParserService;
    private final TclGeneratorService tclGeneratorService;
    private final XslGeneratorService xslGeneratorService;

    public LayoutProcessingService(
            FormatDetectionService formatDetectionService,
            LayoutXmlLoader layoutXmlLoader,
            LayoutNormalizerService normalizerService,
            LayoutValidationService validationService,
            DocumentParserService documentParserService,
            TclGeneratorService tclGeneratorService,
            XslGeneratorService xslGeneratorService) {
        this.formatDetectionService = formatDetectionService;
        this.layoutXmlLoader = layoutXmlLoader;
        this.normalizerService = normalizerService;
        this.validationService = validationService;
        this.documentParserService = documentParserService;
        this.tclGeneratorService = tclGeneratorService;
        this.xslGeneratorService = xslGeneratorService;
    }

    public FormatType detectFormat(String content) {
        return formatDetectionService.detect(content);
    }

    /**
     * Load a layout and normalize its line structure.
     *
     * @throws teranet.mapdev.layout.exception.LayoutCompilationException if the XML is malformed
     */
    public Layout loadLayout(String layoutXml) {
        Layout loaded = layoutXmlLoader.load(layoutXml);
        Layout normalized = normalizerService.reorderSequences(normalizerService.restructure(loaded));
        log.debug("Layout '{}' normalized to {} top-level lines", normalized.getName(),
                normalized.getElements().size());
        return normalized;
    }

    public LayoutValidationReport validateLayout(String layoutXml) {
        return validationService.validateForLayout(loadLayout(layoutXml));
    }

    /**
     * Validate the layout, then parse the document with it.
     */
    public ParsingResult parseDocument(String content, String layoutXml) {
        Layout layout = loadLayout(layoutXml);

        LayoutValidationReport report = validationService.validateForLayout(layout);
        if (!report.isAllValid()) {
            log.warn("Layout '{}' has {} line(s) not matching {} characters, parsing anyway",
                    layout.getName(), report.getInvalidLineCount(), report.getExpectedLineLength());
        }

        ParsingResult result = documentParserService.parse(content, layout);
        log.info("Document parsed with layout '{}': success={}, fields={}",
                layout.getName(), result.isSuccess(), result.getParsedFields().size());
        return result;
    }

    public String generateTcl(String layoutXml) {
        return tclGeneratorService.generateTcl(layoutXml);
    }

    public String generateXsl(String mapXml) {
        return xslGeneratorService.generateXsl(mapXml);
    }
}
