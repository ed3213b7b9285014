package domain.mapping;

import java.util.Objects;

/** 컬럼 → template 셀 매핑 후보 (파이프라인 1회 동안만 존재). */
public final class MappingCandidate {

    private final String sourceColumn;
    private final int targetRow;
    private final int targetCol;
    private final String labelText;
    private final double confidence;
    private final CandidateOrigin origin;
    private final String reason;

    public MappingCandidate(
            String sourceColumn,
            int targetRow,
            int targetCol,
            String labelText,
            double confidence,
            CandidateOrigin origin,
            String reason
    ) {
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0,1]: " + confidence);
        }
        this.sourceColumn = Objects.requireNonNull(sourceColumn, "sourceColumn");
        this.targetRow = targetRow;
        this.targetCol = targetCol;
        this.labelText = labelText;
        this.confidence = confidence;
        this.origin = Objects.requireNonNull(origin, "origin");
        this.reason = reason == null ? "" : reason;
    }

    public MappingCandidate withConfidence(double confidence, String reason) {
        return new MappingCandidate(sourceColumn, targetRow, targetCol, labelText, confidence, origin, reason);
    }

    public String getSourceColumn() {
        return sourceColumn;
    }

    public int getTargetRow() {
        return targetRow;
    }

    public int getTargetCol() {
        return targetCol;
    }

    public CellPosition getTarget() {
        return CellPosition.of(targetRow, targetCol);
    }

    /** 없을 수 있다 (override 규칙은 고정 라벨명, 외부 matcher 는 응답에 따라). */
    public String getLabelText() {
        return labelText;
    }

    public double getConfidence() {
        return confidence;
    }

    public CandidateOrigin getOrigin() {
        return origin;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return "\"" + sourceColumn + "\" -> [" + targetRow + "," + targetCol + "] "
                + String.format("%.2f", confidence) + " (" + origin.code() + ")";
    }
}
