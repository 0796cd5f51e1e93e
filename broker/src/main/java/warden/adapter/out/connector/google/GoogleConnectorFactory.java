package warden.adapter.out.connector.google;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import warden.adapter.out.connector.OAuth2Client;
import warden.core.exception.ConfigurationException;
import warden.core.port.out.JwksCache;
import warden.spi.Connector;
import warden.spi.ConnectorFactory;

/**
 * Opens {@link GoogleConnector}s from their JSON configuration.
 *
 * <p>The directory client is only built when admin bindings are configured; it then requires a
 * service-account key file.
 */
@ApplicationScoped
public class GoogleConnectorFactory implements ConnectorFactory {

    private static final Logger LOG = Logger.getLogger(GoogleConnectorFactory.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final JwksCache jwksCache;

    @Inject
    public GoogleConnectorFactory(Vertx vertx, ObjectMapper objectMapper, JwksCache jwksCache) {
        this.webClient = WebClient.create(vertx);
        this.objectMapper = objectMapper;
        this.jwksCache = jwksCache;
    }

    @Override
    public String type() {
        return GoogleConnector.TYPE;
    }

    @Override
    public Connector open(String id, byte[] rawConfig) {
        final var config = parse(id, rawConfig);
        final var timeout = timeout(id, config);
        final var oauth = new OAuth2Client(
                webClient, GoogleConnector.TYPE, config.tokenUrl(), config.clientId(), config.clientSecret(), timeout);
        final var verifier =
                new IdTokenVerifier(jwksCache, URI.create(config.jwksUri()), config.issuer(), config.clientId());

        if (config.scopes().contains("groups")) {
            LOG.warnf("google connector %s: \"scopes\" contains \"groups\", which Google rejects", id);
        }

        final var bindings = config.adminBindings();
        final var hasKeyFile =
                config.serviceAccountFilePath() != null && !config.serviceAccountFilePath().isEmpty();
        DirectoryGroupsClient directory = null;
        if (!bindings.isEmpty()) {
            if (!hasKeyFile) {
                throw new ConfigurationException(
                        "google connector %s: domainToAdminEmail requires serviceAccountFilePath".formatted(id));
            }
            final var credentials =
                    ServiceAccountCredentials.load(Path.of(config.serviceAccountFilePath()), objectMapper);
            directory = new DirectoryGroupsClient(
                    oauth,
                    config.directoryUrl(),
                    bindings,
                    new ServiceAccountTokenSource(webClient, credentials, timeout));
            LOG.debugf("google connector %s: directory service configured for %s", id, bindings.keySet());
        } else if (hasKeyFile) {
            throw new ConfigurationException(
                    "google connector %s: directory service requires the domainToAdminEmail option to be configured"
                            .formatted(id));
        } else if (!config.groups().isEmpty()) {
            throw new ConfigurationException(
                    "google connector %s: \"groups\" requires a directory binding (domainToAdminEmail)".formatted(id));
        }

        LOG.infof("Opened google connector %s", id);
        return new GoogleConnector(id, config, oauth, verifier, directory);
    }

    private GoogleConnectorConfig parse(String id, byte[] rawConfig) {
        try {
            return objectMapper.readValue(rawConfig, GoogleConnectorConfig.class);
        } catch (IOException e) {
            throw new ConfigurationException(
                    "google connector %s: invalid configuration: %s".formatted(id, e.getMessage()), e);
        }
    }

    private static Duration timeout(String id, GoogleConnectorConfig config) {
        try {
            return config.requestTimeout();
        } catch (DateTimeParseException e) {
            throw new ConfigurationException(
                    "google connector %s: invalid timeout \"%s\"".formatted(id, config.timeout()), e);
        }
    }
}
