package domain.mapping;

import domain.grid.Grid;
import domain.grid.GridCell;

/** 개인이력카드 축소판 template (origin 0). */
public final class TemplateFixtures {

    private TemplateFixtures() {
    }

    /**
     * <pre>
     * 0: [1. 신상정보 (4칸 병합)]
     * 1: 성명 H | _ | 연락처 H | _
     * 2: 이메일 H | _ | 생년월일 H | _
     * 3: [희망직무 H (4칸 병합)]
     * 4: _ (4칸 병합)
     * </pre>
     */
    public static Grid profileCard() {
        return Grid.builder()
                .origin(0)
                .size(5, 4)
                .add(new GridCell(0, 0, "1. 신상정보", true, 1, 4))
                .add(GridCell.header(1, 0, "성명"))
                .add(GridCell.of(1, 1, ""))
                .add(GridCell.header(1, 2, "연락처"))
                .add(GridCell.of(1, 3, ""))
                .add(GridCell.header(2, 0, "이메일"))
                .add(GridCell.of(2, 1, ""))
                .add(GridCell.header(2, 2, "생년월일"))
                .add(GridCell.of(2, 3, ""))
                .add(new GridCell(3, 0, "희망직무", true, 1, 4))
                .add(new GridCell(4, 0, "", false, 1, 4))
                .build();
    }
}
