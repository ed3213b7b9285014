package infra.output;

import domain.output.MappingReportWriter;
import domain.pipeline.PipelineResult;

import java.nio.file.Path;

/**
 * No-op implementation (feature toggle).
 */
public final class NullMappingReportWriter implements MappingReportWriter {
    @Override
    public void write(Path out, PipelineResult result) {
        // intentionally no-op
    }
}
