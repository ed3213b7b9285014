package domain.output;

import domain.pipeline.PipelineResult;

import java.nio.file.Path;

/** 매핑 결과 리포트를 저장하는 책임. */
public interface MappingReportWriter {

    void write(Path out, PipelineResult result);
}
