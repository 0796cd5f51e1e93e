package warden.core.model.identity;

import java.util.Map;
import java.util.Optional;

/**
 * The upstream redirect as seen by a connector: the parsed query string.
 *
 * @param queryParameters first value of every query parameter
 */
public record CallbackRequest(Map<String, String> queryParameters) {

    public static final String CODE = "code";
    public static final String STATE = "state";
    public static final String ERROR = "error";
    public static final String ERROR_DESCRIPTION = "error_description";

    public CallbackRequest {
        queryParameters = queryParameters != null ? Map.copyOf(queryParameters) : Map.of();
    }

    public Optional<String> parameter(String name) {
        return Optional.ofNullable(queryParameters.get(name)).filter(value -> !value.isEmpty());
    }

    public Optional<String> code() {
        return parameter(CODE);
    }

    public Optional<String> error() {
        return parameter(ERROR);
    }

    public Optional<String> errorDescription() {
        return parameter(ERROR_DESCRIPTION);
    }
}
