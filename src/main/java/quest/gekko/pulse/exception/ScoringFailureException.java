package quest.gekko.pulse.exception;

import lombok.Getter;

/**
 * A model failed to score a batch. Recovered per batch by the scoring service.
 */
@Getter
public class ScoringFailureException extends PulseException {
    private static final String DEFAULT_ERROR_CODE = "ERR-SCR-001";
    private static final String TIMEOUT_ERROR_CODE = "ERR-SCR-002";

    private final boolean timeout;

    public ScoringFailureException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public ScoringFailureException(String message, Throwable cause, boolean timeout) {
        super(message, cause, timeout ? TIMEOUT_ERROR_CODE : DEFAULT_ERROR_CODE);
        this.timeout = timeout;
    }

    public ScoringFailureException(String message) {
        super(message);
        this.timeout = false;
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
