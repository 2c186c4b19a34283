package quest.gekko.pulse.exception;

public class AggregationIntegrityException extends PulseException {
    private static final String DEFAULT_ERROR_CODE = "ERR-AGG-001";

    public AggregationIntegrityException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
