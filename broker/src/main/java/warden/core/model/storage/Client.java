package warden.core.model.storage;

import java.util.List;
import java.util.Objects;

/**
 * A relying-party application registered with the broker.
 */
public record Client(
        String id,
        String secret,
        List<String> redirectUris,
        List<String> trustedPeers,
        boolean isPublic,
        String name,
        String logoUrl) {

    public Client {
        Objects.requireNonNull(id, "id is required");
        redirectUris = redirectUris != null ? List.copyOf(redirectUris) : List.of();
        trustedPeers = trustedPeers != null ? List.copyOf(trustedPeers) : List.of();
    }
}
