package infra.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import domain.header.HierarchicalColumn;
import domain.mapping.FinalMapping;
import domain.mapping.MappingCandidate;
import domain.model.MappingWarning;
import domain.output.MappingReportWriter;
import domain.pipeline.PipelineResult;
import domain.validate.ValidationIssue;
import domain.validate.ValidationResult;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static infra.output.ReportRows.nullToEmpty;

/** JSON report writer. 구조는 xlsx 리포트의 시트 구성과 같다. */
public final class JsonMappingReportWriter implements MappingReportWriter {

    private final ObjectMapper om;

    public JsonMappingReportWriter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public JsonMappingReportWriter(ObjectMapper om) {
        this.om = om;
    }

    @Override
    public void write(Path out, PipelineResult result) {
        if (out == null) throw new IllegalArgumentException("out is null");
        if (result == null) throw new IllegalArgumentException("result is null");

        try {
            Path parent = out.toAbsolutePath()
                    .normalize()
                    .getParent();
            if (parent != null) Files.createDirectories(parent);
            om.writeValue(out.toFile(), toJson(result));
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write json: " + out, e);
        }
    }

    ObjectNode toJson(PipelineResult result) {
        ObjectNode root = om.createObjectNode();

        ArrayNode mappings = root.putArray("mappings");
        Map<FinalMapping, MappingCandidate> sources = ReportRows.candidatesByMapping(result);
        for (FinalMapping m : result.getMappings()) {
            ObjectNode n = mappings.addObject();
            n.put("sourceColumn", m.getSourceColumn());
            n.put("targetRow", m.getTargetRow());
            n.put("targetCol", m.getTargetCol());
            MappingCandidate c = sources.get(m);
            if (c != null) {
                n.put("labelText", nullToEmpty(c.getLabelText()));
                n.put("confidence", c.getConfidence());
                n.put("origin", c.getOrigin().code());
                n.put("reason", nullToEmpty(c.getReason()));
            }
        }

        ArrayNode issues = root.putArray("issues");
        result.getIssues().forEach(issues::add);

        root.set("validation", validation(result.getValidation()));

        ArrayNode columns = root.putArray("columns");
        if (result.getHeader() != null) {
            for (HierarchicalColumn c : result.getHeader().getColumns()) {
                ObjectNode n = columns.addObject();
                n.put("name", c.getName());
                n.put("sourceColIndex", c.getSourceColIndex());
                n.put("depth", c.getDepth());
            }
        } else {
            for (String name : result.getColumns()) {
                columns.addObject().put("name", name);
            }
        }

        root.set("warnings", warnings(result.getWarnings()));
        return root;
    }

    private ObjectNode validation(ValidationResult v) {
        ObjectNode n = om.createObjectNode();
        n.put("isValid", v.isValid());
        n.put("totalRequiredFields", v.getTotalRequiredFields());
        n.put("mappedFields", v.getMappedFields());
        n.put("missingFields", v.getMissingFields());

        ArrayNode issues = n.putArray("issues");
        for (ValidationIssue it : v.getIssues()) {
            ObjectNode i = issues.addObject();
            i.put("kind", it.getKind().name());
            i.put("field", it.getField());
            i.put("message", it.getMessage());
            if (it.hasTarget()) {
                i.put("targetRow", it.getTargetRow());
                i.put("targetCol", it.getTargetCol());
            }
            if (it.hasSuggestion()) i.put("suggestedColumn", it.getSuggestedColumn());
        }

        ArrayNode suggestions = n.putArray("suggestions");
        for (FinalMapping m : v.getSuggestions()) {
            ObjectNode s = suggestions.addObject();
            s.put("sourceColumn", m.getSourceColumn());
            s.put("targetRow", m.getTargetRow());
            s.put("targetCol", m.getTargetCol());
        }
        return n;
    }

    private ArrayNode warnings(List<MappingWarning> warnings) {
        ArrayNode arr = om.createArrayNode();
        for (MappingWarning w : warnings) {
            ObjectNode n = arr.addObject();
            n.put("code", w.getCode() == null ? "" : w.getCode().name());
            n.put("sourceColumn", nullToEmpty(w.getSourceColumn()));
            n.put("message", nullToEmpty(w.getMessage()));
            n.put("detail", nullToEmpty(w.getDetail()));
        }
        return arr;
    }
}
