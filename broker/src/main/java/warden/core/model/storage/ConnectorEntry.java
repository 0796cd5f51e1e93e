package warden.core.model.storage;

import java.util.Objects;

/**
 * A stored connector definition.
 *
 * @param id              connector id referenced by auth requests and refresh tokens
 * @param type            connector type, e.g. {@code gitlab} or {@code google}
 * @param name            human-readable name
 * @param resourceVersion changes whenever the definition changes, used to reopen cached connectors
 * @param config          connector-specific JSON configuration
 */
public record ConnectorEntry(String id, String type, String name, String resourceVersion, byte[] config) {

    public ConnectorEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(type, "type is required");
        resourceVersion = resourceVersion != null ? resourceVersion : "";
        config = config != null ? config : new byte[0];
    }
}
