package domain.model;

/**
 * Standard warning codes for mapping/reporting.
 *
 * <p>Keep the set small and stable. Add codes only when the meaning is clear
 * and actionable for operators.</p>
 */
public enum WarningCode {

    /**
     * Two candidates point at the same template cell; the lower-confidence one was dropped.
     */
    DUPLICATE_CELL,

    /**
     * A source column was already mapped; the later candidate was dropped.
     */
    DUPLICATE_COLUMN,

    /**
     * Target cell lies outside the template bounds.
     */
    OUT_OF_RANGE,

    /**
     * Candidate confidence is below the acceptance floor.
     */
    LOW_CONFIDENCE,

    /**
     * An external matcher was not configured and contributed nothing.
     */
    MATCHER_SKIPPED,

    /**
     * A matcher threw or timed out; its contribution was replaced with an empty list.
     */
    MATCHER_FAILED,

    /**
     * No header row scored; the first row was assumed to be the header.
     */
    HEADER_FALLBACK,

    /**
     * Hierarchical synthesis produced no columns; single-row extraction was used.
     */
    COLUMN_FALLBACK
}
