package warden.adapter.out.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

import java.util.Optional;

import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@DisplayName("MicroProfileStorageAdapterConfig")
@ExtendWith(MockitoExtension.class)
class MicroProfileStorageAdapterConfigTest {

    @Mock
    private Config config;

    private MicroProfileStorageAdapterConfig adapterConfig;

    @BeforeEach
    void setUp() {
        lenient().when(config.getOptionalValue(anyString(), eq(String.class))).thenReturn(Optional.empty());
        adapterConfig = new MicroProfileStorageAdapterConfig(config);
    }

    @Test
    @DisplayName("should resolve keys under warden.storage")
    void prefixedKeys() {
        when(config.getOptionalValue("warden.storage.sql.jdbc-url", String.class))
                .thenReturn(Optional.of("jdbc:postgresql://db/warden"));
        when(config.getOptionalValue("warden.storage.sql.max-pool-size", Integer.class))
                .thenReturn(Optional.of(4));

        assertEquals("jdbc:postgresql://db/warden", adapterConfig.getRequired("sql.jdbc-url"));
        assertEquals(Optional.of(4), adapterConfig.getInt("sql.max-pool-size"));
    }

    @Test
    @DisplayName("should name the full key when a required setting is missing")
    void missingRequired() {
        final var error = assertThrows(IllegalStateException.class, () -> adapterConfig.getRequired("sql.jdbc-url"));

        assertTrue(error.getMessage().contains("warden.storage.sql.jdbc-url"));
    }

    @Test
    @DisplayName("should treat blank values as unset")
    void blankValue() {
        when(config.getOptionalValue("warden.storage.sql.username", String.class)).thenReturn(Optional.of("  "));

        assertTrue(adapterConfig.get("sql.username").isEmpty());
    }

    @Test
    @DisplayName("should default the offline session key algorithm to SHA-256")
    void offlineSessionKeyAlgorithm() {
        assertEquals("SHA-256", adapterConfig.offlineSessionKeyAlgorithm());

        when(config.getOptionalValue("warden.storage.offline-session-key-algorithm", String.class))
                .thenReturn(Optional.of("SHA-512"));

        assertEquals("SHA-512", adapterConfig.offlineSessionKeyAlgorithm());
    }
}
