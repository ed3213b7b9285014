package domain.semantic;

import domain.grid.Grid;
import domain.grid.GridCell;
import domain.mapping.CandidateMatcher;
import domain.mapping.DataCellLocator;
import domain.mapping.LabelCellPolicy;
import domain.mapping.LabelText;
import domain.mapping.MappingCandidate;
import domain.mapping.MatchRequest;
import domain.mapping.MatchingHeuristics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 외부 추론 기반 matcher 공통 흐름: 프롬프트 생성 → 호출 → 응답 파싱 → 후보 변환.
 *
 * <p>서비스가 없거나(설정 없음) 호출/파싱이 실패하면 빈 목록을 돌려준다. 예외를 밖으로 던지지 않는다.</p>
 */
public abstract class AbstractReasoningMatcher implements CandidateMatcher {

    private static final Logger log = LoggerFactory.getLogger(AbstractReasoningMatcher.class);

    private final Optional<ReasoningService> service;
    private final ReasoningResponseParser parser;
    protected final MatchingHeuristics heuristics;
    protected final LabelCellPolicy policy;
    protected final DataCellLocator locator;

    protected AbstractReasoningMatcher(
            Optional<ReasoningService> service,
            ReasoningResponseParser parser,
            MatchingHeuristics heuristics
    ) {
        this.service = service == null ? Optional.empty() : service;
        this.parser = parser == null ? new ReasoningResponseParser() : parser;
        this.heuristics = heuristics == null ? MatchingHeuristics.defaults() : heuristics;
        this.policy = new LabelCellPolicy(this.heuristics);
        this.locator = new DataCellLocator(policy, this.heuristics.getBelowScanRows());
    }

    @Override
    public boolean isAvailable() {
        return service.isPresent();
    }

    @Override
    public final List<MappingCandidate> match(MatchRequest request) {
        String tag = origin().code();
        if (service.isEmpty()) {
            log.info("[EXTERNAL] {}: no reasoning service configured, skipping", tag);
            return List.of();
        }
        if (request.getColumns().isEmpty()) return List.of();

        try {
            String prompt = buildPrompt(request);
            String response = service.get().complete(prompt);
            List<ReportedMatch> reported = parser.parse(response);
            List<MappingCandidate> out = toCandidates(reported, request);
            log.info("[EXTERNAL] {}: reported={}, candidates={}", tag, reported.size(), out.size());
            return out;
        } catch (Exception e) {
            log.error("[EXTERNAL] {}: reasoning call failed: {}", tag, e.toString());
            return List.of();
        }
    }

    protected abstract String buildPrompt(MatchRequest request);

    /** 응답 한 건 → 후보. 변환할 수 없으면 null. */
    protected abstract MappingCandidate toCandidate(ReportedMatch match, MatchRequest request);

    private List<MappingCandidate> toCandidates(List<ReportedMatch> reported, MatchRequest request) {
        List<MappingCandidate> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (ReportedMatch m : reported) {
            MappingCandidate c = toCandidate(m, request);
            if (c == null) continue;
            // 같은 matcher 안에서는 컬럼당 첫 응답만
            if (seen.add(c.getSourceColumn())) out.add(c);
        }
        return out;
    }

    // ------------------------------------------------------------------
    // helpers for subclasses
    // ------------------------------------------------------------------

    protected double confidenceOf(ReportedMatch m) {
        Double c = m.getConfidence();
        if (c == null || c.isNaN()) return heuristics.getExternalDefaultConfidence();
        return Math.max(0.0, Math.min(1.0, c));
    }

    /**
     * 응답의 컬럼명을 실제 컬럼으로 맞춘다: 정확히 같으면 그대로, 아니면 정규화 일치.
     * 컬럼명이 없으면 라벨 텍스트와 겹치는 첫 컬럼.
     */
    protected static String resolveColumn(ReportedMatch m, List<String> columns) {
        String reported = m.getSourceColumn();
        if (reported != null) {
            if (columns.contains(reported)) return reported;
            String n = LabelText.normalize(reported);
            for (String c : columns) {
                if (LabelText.normalize(c).equals(n)) return c;
            }
            return null;
        }

        String label = m.getLabelText();
        if (label == null) return null;
        String nl = LabelText.normalize(label);
        for (String c : columns) {
            String nc = LabelText.normalize(c);
            if (nc.equals(nl) || (!nc.isEmpty() && !nl.isEmpty() && (nl.contains(nc) || nc.contains(nl)))) {
                return c;
            }
        }
        return null;
    }

    /** 응답의 라벨 좌표 → template 라벨 셀. 좌표가 없거나 틀렸으면 텍스트로 찾는다. */
    protected GridCell resolveLabelCell(ReportedMatch m, Grid template) {
        if (m.hasLabelPosition()) {
            GridCell cell = template.cellAt(m.getLabelRow(), m.getLabelCol());
            if (cell != null && !cell.isEmpty()) return cell;
        }
        if (m.getLabelText() != null) {
            String nl = LabelText.normalize(m.getLabelText());
            for (GridCell cell : policy.labelCells(template)) {
                if (LabelText.normalize(cell.getText()).equals(nl)) return cell;
            }
        }
        return null;
    }
}
