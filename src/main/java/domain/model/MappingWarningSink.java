package domain.model;

/**
 * Sink for mapping warnings.
 *
 * <p>Warnings come from several stages (header inference, matchers, finalizer). A sink lets
 * them be collected without coupling those stages to the CLI or the report writers.</p>
 */
public interface MappingWarningSink {

    static MappingWarningSink none() {
        return NullMappingWarningSink.INSTANCE;
    }

    void warn(MappingWarning warning);
}
