package domain.semantic;

/**
 * 추론 응답의 매칭 한 건. 응답에 없던 값은 null.
 */
public final class ReportedMatch {

    private final String sourceColumn;
    private final String labelText;
    private final Integer labelRow;
    private final Integer labelCol;
    private final Integer dataRow;
    private final Integer dataCol;
    private final Double confidence;

    public ReportedMatch(
            String sourceColumn,
            String labelText,
            Integer labelRow,
            Integer labelCol,
            Integer dataRow,
            Integer dataCol,
            Double confidence
    ) {
        this.sourceColumn = sourceColumn;
        this.labelText = labelText;
        this.labelRow = labelRow;
        this.labelCol = labelCol;
        this.dataRow = dataRow;
        this.dataCol = dataCol;
        this.confidence = confidence;
    }

    public String getSourceColumn() {
        return sourceColumn;
    }

    public String getLabelText() {
        return labelText;
    }

    public Integer getLabelRow() {
        return labelRow;
    }

    public Integer getLabelCol() {
        return labelCol;
    }

    public Integer getDataRow() {
        return dataRow;
    }

    public Integer getDataCol() {
        return dataCol;
    }

    public Double getConfidence() {
        return confidence;
    }

    public boolean hasLabelPosition() {
        return labelRow != null && labelCol != null;
    }

    public boolean hasDataPosition() {
        return dataRow != null && dataCol != null;
    }
}
