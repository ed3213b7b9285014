package domain.pipeline;

import domain.grid.Grid;
import domain.grid.GridReadException;
import domain.grid.SpreadsheetReader;
import domain.grid.TemplateDocument;
import domain.grid.TemplateGridReader;
import domain.mapping.MappingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 원본 파일 바이트 → 매핑 결과.
 *
 * <p>template 의 첫 번째 표를 대상으로 한다. 입력 자체를 읽을 수 없으면 {@link GridReadException}.</p>
 */
public final class FieldMappingService {

    private static final Logger log = LoggerFactory.getLogger(FieldMappingService.class);

    private final TemplateGridReader templateReader;
    private final SpreadsheetReader spreadsheetReader;
    private final MappingPipeline pipeline;

    public FieldMappingService(TemplateGridReader templateReader, SpreadsheetReader spreadsheetReader, MappingPipeline pipeline) {
        this.templateReader = templateReader;
        this.spreadsheetReader = spreadsheetReader;
        this.pipeline = pipeline;
    }

    public PipelineResult execute(
            byte[] templateBytes,
            String templateName,
            byte[] spreadsheetBytes,
            String sheetName,
            MappingContext context
    ) {
        TemplateDocument doc = templateReader.read(templateBytes, templateName);
        Grid template = doc.primaryTable();
        log.info("[SERVICE] template={}, tables={}, sections={}, primary={}",
                doc.getFileName(), doc.getTables().size(), doc.getSectionTitles().size(), template);

        Grid sheet = spreadsheetReader.read(spreadsheetBytes, sheetName);
        log.info("[SERVICE] sheet={}, grid={}", sheetName == null ? "(first)" : sheetName, sheet);

        return pipeline.run(sheet, template, context);
    }
}
