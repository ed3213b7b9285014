package domain.pipeline;

import domain.header.HeaderAnalysisResult;
import domain.mapping.FinalMapping;
import domain.mapping.FinalizeResult;
import domain.mapping.MappingCandidate;
import domain.model.MappingWarning;
import domain.validate.ValidationResult;

import java.util.List;

/** 파이프라인 1회 실행 결과. */
public final class PipelineResult {

    private final HeaderAnalysisResult header;
    private final List<String> columns;
    private final List<MappingCandidate> candidates;
    private final List<MappingCandidate> mergedCandidates;
    private final FinalizeResult finalized;
    private final ValidationResult validation;
    private final List<MappingWarning> warnings;

    public PipelineResult(
            HeaderAnalysisResult header,
            List<String> columns,
            List<MappingCandidate> candidates,
            List<MappingCandidate> mergedCandidates,
            FinalizeResult finalized,
            ValidationResult validation,
            List<MappingWarning> warnings
    ) {
        this.header = header;
        this.columns = List.copyOf(columns);
        this.candidates = List.copyOf(candidates);
        this.mergedCandidates = List.copyOf(mergedCandidates);
        this.finalized = finalized;
        this.validation = validation;
        this.warnings = List.copyOf(warnings);
    }

    /** 컬럼 목록을 직접 넘겨 실행했으면 null. */
    public HeaderAnalysisResult getHeader() {
        return header;
    }

    public List<String> getColumns() {
        return columns;
    }

    /** 모든 matcher 의 원본 후보 (matcher 순서대로). */
    public List<MappingCandidate> getCandidates() {
        return candidates;
    }

    public List<MappingCandidate> getMergedCandidates() {
        return mergedCandidates;
    }

    public List<FinalMapping> getMappings() {
        return finalized.getMappings();
    }

    public List<String> getIssues() {
        return finalized.getIssues();
    }

    public FinalizeResult getFinalized() {
        return finalized;
    }

    public ValidationResult getValidation() {
        return validation;
    }

    public List<MappingWarning> getWarnings() {
        return warnings;
    }
}
