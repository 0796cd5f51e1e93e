package warden.spi;

/**
 * Opens connectors of one type from their stored JSON configuration.
 *
 * <p>Factories are CDI beans; the connector registry maps the configured type string
 * to the matching factory.
 */
public interface ConnectorFactory {

    /**
     * Connector type handled by this factory, e.g. {@code gitlab}.
     */
    String type();

    /**
     * Open a connector.
     *
     * @param id     connector id, used in logs
     * @param config connector-specific JSON configuration
     * @return a ready to use connector
     * @throws warden.core.exception.ConfigurationException if the configuration is invalid
     */
    Connector open(String id, byte[] config);
}
