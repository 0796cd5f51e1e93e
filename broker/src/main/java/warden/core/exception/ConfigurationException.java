package warden.core.exception;

/**
 * Static configuration or stored credential state is unusable: mismatched redirect URI,
 * missing admin binding, unparseable connector data or connector configuration.
 */
public class ConfigurationException extends BrokerException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
