package domain.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * List-backed sink with best-effort de-duplication.
 *
 * <p>Deduplicated by (code|column|message|detail). Safe to call from the concurrently
 * running matchers.</p>
 */
public final class ListMappingWarningSink implements MappingWarningSink {

    private final List<MappingWarning> target;
    private final Set<String> seen = new HashSet<>(64);

    public ListMappingWarningSink(List<MappingWarning> target) {
        this.target = target;
    }

    private static String key(MappingWarning w) {
        return w.getCode().name() + "|"
                + safe(w.getSourceColumn()) + "|"
                + safe(w.getMessage()) + "|"
                + safe(w.getDetail());
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }

    @Override
    public synchronized void warn(MappingWarning warning) {
        if (warning == null || target == null) return;
        if (seen.add(key(warning))) {
            target.add(warning);
        }
    }

    public synchronized List<MappingWarning> snapshot() {
        return target == null ? List.of() : List.copyOf(target);
    }
}
