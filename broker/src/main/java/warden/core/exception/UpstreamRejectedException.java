package warden.core.exception;

/**
 * The upstream provider declined the login, e.g. the user denied consent.
 *
 * <p>Carries the provider's own error code and description so they can be shown to the user.
 */
public class UpstreamRejectedException extends ConnectorException {

    private final String error;
    private final String errorDescription;

    public UpstreamRejectedException(String error, String errorDescription) {
        super(format(error, errorDescription));
        this.error = error;
        this.errorDescription = errorDescription != null ? errorDescription : "";
    }

    public String error() {
        return error;
    }

    public String errorDescription() {
        return errorDescription;
    }

    private static String format(String error, String description) {
        if (description == null || description.isEmpty()) {
            return error;
        }
        return error + ": " + description;
    }
}
