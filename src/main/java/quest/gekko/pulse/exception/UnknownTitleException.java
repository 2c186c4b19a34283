package quest.gekko.pulse.exception;

public class UnknownTitleException extends PulseException {
    private static final String DEFAULT_ERROR_CODE = "ERR-TTL-404";

    public UnknownTitleException(String titleId) {
        super("Title not tracked: " + titleId);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
