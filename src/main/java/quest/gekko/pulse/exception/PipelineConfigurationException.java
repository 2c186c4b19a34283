package quest.gekko.pulse.exception;

/**
 * Invalid or contradictory pipeline configuration. Thrown while the application context
 * starts, so the pipeline never runs half-configured.
 */
public class PipelineConfigurationException extends PulseException {
    private static final String DEFAULT_ERROR_CODE = "ERR-CFG-001";

    public PipelineConfigurationException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
