package domain.model;
/** No-op warning sink. */
final class NullMappingWarningSink implements MappingWarningSink {

    static final NullMappingWarningSink INSTANCE = new NullMappingWarningSink();

    private NullMappingWarningSink() {
    }

    @Override
    public void warn(MappingWarning warning) {
        // no-op
    }
}
