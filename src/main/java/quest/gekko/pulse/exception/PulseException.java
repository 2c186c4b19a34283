package quest.gekko.pulse.exception;

import lombok.Getter;

/**
 * Base class for pipeline exceptions. Every subclass carries a stable error code
 * that the REST layer hands back to callers.
 */
@Getter
public abstract class PulseException extends RuntimeException {
    private final String errorCode;

    protected PulseException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    protected PulseException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = getDefaultErrorCode();
    }

    protected PulseException(String message, Throwable cause, String errorCode) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    protected abstract String getDefaultErrorCode();
}
