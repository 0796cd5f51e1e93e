package warden.adapter.in.bootstrap;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import warden.adapter.out.storage.memory.InMemoryStorage;
import warden.core.config.ConnectorsConfig;
import warden.core.exception.ConfigurationException;
import warden.core.model.storage.ConnectorEntry;
import warden.core.service.connector.ConnectorRegistry;

@DisplayName("ConnectorBootstrapInitializer")
@ExtendWith(MockitoExtension.class)
class ConnectorBootstrapInitializerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @Mock
    private ConnectorsConfig config;

    @Mock
    private ConnectorRegistry registry;

    private InMemoryStorage storage;
    private ConnectorBootstrapInitializer initializer;

    @BeforeEach
    void setUp() {
        storage = new InMemoryStorage();
        lenient().when(registry.supportedTypes()).thenReturn(Set.of("gitlab", "google"));
        initializer = new ConnectorBootstrapInitializer(config, storage, registry);
    }

    private static ConnectorsConfig.Definition definition(String type, String name, String json) {
        final var definition = mock(ConnectorsConfig.Definition.class);
        lenient().when(definition.type()).thenReturn(type);
        lenient().when(definition.name()).thenReturn(Optional.ofNullable(name));
        lenient().when(definition.config()).thenReturn(json);
        return definition;
    }

    private ConnectorEntry stored(String id) {
        return storage.getConnector(id).await().atMost(TIMEOUT);
    }

    @Test
    @DisplayName("should create every configured connector")
    void createsConnectors() {
        final var definitions = new LinkedHashMap<String, ConnectorsConfig.Definition>();
        definitions.put("gitlab", definition("gitlab", "GitLab", "{\"clientID\":\"a\"}"));
        definitions.put("google", definition("google", null, "{}"));
        when(config.definitions()).thenReturn(definitions);

        initializer.bootstrap().await().atMost(TIMEOUT);

        final var gitlab = stored("gitlab");
        assertEquals("gitlab", gitlab.type());
        assertEquals("GitLab", gitlab.name());
        assertArrayEquals("{\"clientID\":\"a\"}".getBytes(StandardCharsets.UTF_8), gitlab.config());
        assertEquals("google", stored("google").name());
    }

    @Test
    @DisplayName("should overwrite a connector that already exists")
    void overwritesExisting() {
        storage.createConnector(new ConnectorEntry("gitlab", "gitlab", "Old", "v0", new byte[0]))
                .await()
                .atMost(TIMEOUT);
        final var definitions = Map.of("gitlab", definition("gitlab", "GitLab", "{}"));
        when(config.definitions()).thenReturn(definitions);

        initializer.bootstrap().await().atMost(TIMEOUT);

        final var gitlab = stored("gitlab");
        assertEquals("GitLab", gitlab.name());
        assertNotEquals("v0", gitlab.resourceVersion());
    }

    @Test
    @DisplayName("should derive a stable resource version from the definition")
    void stableResourceVersion() {
        final var first = initializer.toEntry("gitlab", definition("gitlab", "GitLab", "{}"));
        final var same = initializer.toEntry("gitlab", definition("gitlab", "GitLab", "{}"));
        final var changed = initializer.toEntry("gitlab", definition("gitlab", "GitLab", "{\"a\":1}"));

        assertEquals(first.resourceVersion(), same.resourceVersion());
        assertNotEquals(first.resourceVersion(), changed.resourceVersion());
    }

    @Test
    @DisplayName("should reject an unknown connector type")
    void unknownType() {
        final var definitions = Map.of("ldap", definition("ldap", null, "{}"));
        when(config.definitions()).thenReturn(definitions);

        assertThrows(ConfigurationException.class, () -> initializer.bootstrap());
    }
}
