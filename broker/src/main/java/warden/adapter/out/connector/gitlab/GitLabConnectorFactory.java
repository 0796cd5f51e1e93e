package warden.adapter.out.connector.gitlab;

import java.io.IOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import warden.adapter.out.connector.OAuth2Client;
import warden.core.exception.ConfigurationException;
import warden.spi.Connector;
import warden.spi.ConnectorFactory;

/**
 * Opens {@link GitLabConnector}s from their JSON configuration.
 */
@ApplicationScoped
public class GitLabConnectorFactory implements ConnectorFactory {

    private static final Logger LOG = Logger.getLogger(GitLabConnectorFactory.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    @Inject
    public GitLabConnectorFactory(Vertx vertx, ObjectMapper objectMapper) {
        this.webClient = WebClient.create(vertx);
        this.objectMapper = objectMapper;
    }

    @Override
    public String type() {
        return GitLabConnector.TYPE;
    }

    @Override
    public Connector open(String id, byte[] rawConfig) {
        final var config = parse(id, rawConfig);
        final var oauth = new OAuth2Client(
                webClient,
                GitLabConnector.TYPE,
                config.baseUrl() + "/oauth/token",
                config.clientId(),
                config.clientSecret(),
                timeout(id, config));

        LOG.infof(
                "Opened gitlab connector %s (%s, groups from %s)",
                id,
                config.baseUrl(),
                config.groupsSource().name().toLowerCase(Locale.ROOT));
        return new GitLabConnector(id, config, oauth, objectMapper);
    }

    private GitLabConnectorConfig parse(String id, byte[] rawConfig) {
        try {
            return objectMapper.readValue(rawConfig, GitLabConnectorConfig.class);
        } catch (IOException e) {
            throw new ConfigurationException(
                    "gitlab connector %s: invalid configuration: %s".formatted(id, e.getMessage()), e);
        }
    }

    private static Duration timeout(String id, GitLabConnectorConfig config) {
        try {
            return config.requestTimeout();
        } catch (DateTimeParseException e) {
            throw new ConfigurationException(
                    "gitlab connector %s: invalid timeout \"%s\"".formatted(id, config.timeout()), e);
        }
    }
}
