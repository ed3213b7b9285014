package domain.mapping;

import domain.grid.Grid;

import java.util.List;
import java.util.Objects;

/** matcher 입력. 불변이라 matcher 들이 동시에 읽어도 된다. */
public final class MatchRequest {

    private final Grid template;
    private final List<String> columns;
    private final MappingContext context;

    public MatchRequest(Grid template, List<String> columns, MappingContext context) {
        this.template = Objects.requireNonNull(template, "template");
        this.columns = columns == null ? List.of() : List.copyOf(columns);
        this.context = context == null ? MappingContext.empty() : context;
    }

    public Grid getTemplate() {
        return template;
    }

    public List<String> getColumns() {
        return columns;
    }

    public MappingContext getContext() {
        return context;
    }
}
