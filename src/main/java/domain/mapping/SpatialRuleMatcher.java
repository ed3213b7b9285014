package domain.mapping;

import domain.grid.Grid;
import domain.grid.GridCell;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 규칙 기반 매칭: 라벨 셀의 오른쪽/아래 데이터 셀에 컬럼을 붙인다.
 *
 * <p>순서:</p>
 * <ol>
 *   <li>override 규칙 (고정 좌표, 0.98)</li>
 *   <li>라벨 정확 일치 (0.95) / 부분 포함 (0.85)</li>
 * </ol>
 *
 * <p>두 단계 모두 {@link MatchLedger} 를 받아 (후보, 새 ledger) 를 돌려주는 순수 함수다.
 * 한 컬럼/한 셀은 한 번만 쓰인다.</p>
 */
public final class SpatialRuleMatcher implements CandidateMatcher {

    private static final Logger log = LoggerFactory.getLogger(SpatialRuleMatcher.class);

    private final MatchingHeuristics heuristics;
    private final LabelCellPolicy policy;
    private final DataCellLocator locator;

    public SpatialRuleMatcher() {
        this(MatchingHeuristics.defaults());
    }

    public SpatialRuleMatcher(MatchingHeuristics heuristics) {
        this.heuristics = heuristics == null ? MatchingHeuristics.defaults() : heuristics;
        this.policy = new LabelCellPolicy(this.heuristics);
        this.locator = new DataCellLocator(policy, this.heuristics.getBelowScanRows());
    }

    @Override
    public CandidateOrigin origin() {
        return CandidateOrigin.RULE;
    }

    @Override
    public List<MappingCandidate> match(MatchRequest request) {
        Grid template = request.getTemplate();
        List<String> columns = request.getColumns();

        MatchOutcome overrides = applyOverrides(columns, MatchLedger.empty());
        MatchOutcome labels = matchLabels(template, columns, overrides.getLedger());

        List<MappingCandidate> out = new ArrayList<>(overrides.getCandidates());
        out.addAll(labels.getCandidates());
        log.info("[RULE] columns={}, override={}, label={}",
                columns.size(), overrides.getCandidates().size(), labels.getCandidates().size());
        return out;
    }

    /**
     * 컬럼마다 처음 일치하는 규칙 하나만 본다. 그 셀이 이미 쓰였으면 후보 없음.
     */
    public MatchOutcome applyOverrides(List<String> columns, MatchLedger ledger) {
        List<MappingCandidate> out = new ArrayList<>();
        MatchLedger current = ledger;

        for (String column : columns) {
            if (current.isColumnUsed(column)) continue;
            for (OverrideRule rule : heuristics.getOverrideRules()) {
                if (!rule.matches(column)) continue;

                CellPosition cell = CellPosition.of(rule.getTargetRow(), rule.getTargetCol());
                if (!current.isCellUsed(cell)) {
                    out.add(new MappingCandidate(
                            column, cell.getRow(), cell.getCol(), rule.getLabel(),
                            heuristics.getOverrideConfidence(), CandidateOrigin.RULE,
                            "고정 규칙 \"" + rule.getLabel() + "\" → 데이터 셀 " + cell));
                    current = current.claim(column, cell);
                    log.debug("[RULE] override \"{}\" -> {}", column, cell);
                }
                break;
            }
        }
        return new MatchOutcome(out, current);
    }

    /**
     * 라벨 텍스트 매칭. 정규화 길이가 2 미만인 컬럼은 건너뛴다.
     * 일치하는 라벨의 데이터 셀이 이미 쓰였으면 다음 라벨을 본다.
     */
    public MatchOutcome matchLabels(Grid template, List<String> columns, MatchLedger ledger) {
        List<GridCell> labels = policy.labelCells(template);
        List<MappingCandidate> out = new ArrayList<>();
        MatchLedger current = ledger;

        for (String column : columns) {
            if (current.isColumnUsed(column)) continue;
            String nc = LabelText.normalize(column);
            if (nc.length() < 2) continue;

            for (GridCell label : labels) {
                String nl = LabelText.normalize(label.getText());
                boolean exact = nc.equals(nl);
                if (!exact && !LabelText.overlaps(nc, nl)) continue;

                GridCell data = locator.locate(template, label);
                if (data == null) continue;

                CellPosition cell = CellPosition.of(data.getRow(), data.getCol());
                if (current.isCellUsed(cell)) continue;

                double confidence = exact ? heuristics.getExactConfidence() : heuristics.getPartialConfidence();
                out.add(new MappingCandidate(
                        column, cell.getRow(), cell.getCol(), label.getText(), confidence, CandidateOrigin.RULE,
                        "라벨 \"" + label.getText() + "\" → 데이터 셀 " + cell));
                current = current.claim(column, cell);
                log.debug("[RULE] \"{}\" -> \"{}\" at {} ({})", column, label.getText(), cell, confidence);
                break;
            }
        }
        return new MatchOutcome(out, current);
    }
}
