package domain.grid;

import java.util.List;

/** template 분석 결과: 표 목록 + 섹션 제목. */
public final class TemplateDocument {

    private final String fileName;
    private final List<Grid> tables;
    private final List<String> sectionTitles;

    public TemplateDocument(String fileName, List<Grid> tables, List<String> sectionTitles) {
        this.fileName = fileName == null ? "" : fileName;
        this.tables = tables == null ? List.of() : List.copyOf(tables);
        this.sectionTitles = sectionTitles == null ? List.of() : List.copyOf(sectionTitles);
    }

    public String getFileName() {
        return fileName;
    }

    public List<Grid> getTables() {
        return tables;
    }

    public List<String> getSectionTitles() {
        return sectionTitles;
    }

    /** 매핑 대상 표 (첫 번째). 표가 없으면 GridReadException. */
    public Grid primaryTable() {
        if (tables.isEmpty()) {
            throw new GridReadException("Template has no tables: " + fileName);
        }
        return tables.get(0);
    }
}
