package domain.mapping;

import domain.grid.Grid;
import domain.grid.GridCell;

import java.util.List;
import java.util.regex.Pattern;

/** template 셀 중 라벨로 볼 셀, 섹션/문서 제목으로 빼야 할 셀 판정. */
public final class LabelCellPolicy {

    private static final Pattern PHONE_DIGITS = Pattern.compile("^\\d{10,}$");
    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

    private final MatchingHeuristics heuristics;

    public LabelCellPolicy(MatchingHeuristics heuristics) {
        this.heuristics = heuristics == null ? MatchingHeuristics.defaults() : heuristics;
    }

    /**
     * 섹션 제목("1. 신상정보"), 문서 제목, 또는 긴 문장.
     * 이메일/전화번호/날짜 형태는 길어도 데이터로 본다.
     */
    public boolean isSectionOrTitle(String text) {
        String t = text == null ? "" : text.trim();
        if (heuristics.getSectionTitlePattern().matcher(t).matches()) return true;
        if (heuristics.getDocumentTitles().contains(t)) return true;
        if (t.contains("@")) return false;
        if (PHONE_DIGITS.matcher(t.replaceAll("[-\\s]", "")).matches()) return false;
        if (ISO_DATE.matcher(t).matches()) return false;
        return t.length() > heuristics.getTitleLengthThreshold();
    }

    /** 규칙 매칭용 라벨: header 이거나 필드명처럼 짧은 텍스트. */
    public boolean isLabelCell(GridCell cell) {
        String t = cell.getText();
        if (t.length() < heuristics.getLabelMinLength()) return false;
        if (isSectionOrTitle(t)) return false;
        return cell.isHeader() || t.length() <= heuristics.getShortLabelMax();
    }

    /** header 로 분류된 라벨만 (검증/외부 matcher 프롬프트용). */
    public boolean isHeaderLabel(GridCell cell) {
        return cell.isHeader()
                && cell.getText().length() >= heuristics.getLabelMinLength()
                && !isSectionOrTitle(cell.getText());
    }

    public boolean isDataCandidate(GridCell cell) {
        return !cell.isHeader() && !isSectionOrTitle(cell.getText());
    }

    public List<GridCell> labelCells(Grid template) {
        return template.getCells().stream().filter(this::isLabelCell).toList();
    }

    public List<GridCell> headerLabels(Grid template) {
        return template.getCells().stream().filter(this::isHeaderLabel).toList();
    }
}
