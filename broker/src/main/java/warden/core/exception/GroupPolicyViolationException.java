package warden.core.exception;

/**
 * The user authenticated upstream but belongs to none of the groups allowed to log in.
 *
 * <p>{@link #getMessage()} names the user for operator logs. {@link #userMessage()} is safe to
 * render to the end user and never lists the required groups.
 */
public class GroupPolicyViolationException extends ConnectorException {

    private static final String USER_MESSAGE = "You are not a member of any group allowed to use this application.";

    private final String username;

    public GroupPolicyViolationException(String connectorType, String username) {
        super("%s: user \"%s\" is not in any of the required groups".formatted(connectorType, username));
        this.username = username;
    }

    public String username() {
        return username;
    }

    public String userMessage() {
        return USER_MESSAGE;
    }
}
