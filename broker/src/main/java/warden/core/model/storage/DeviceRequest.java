package warden.core.model.storage;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Device authorization grant request, keyed by the user code shown to the user.
 */
public record DeviceRequest(
        String userCode, String deviceCode, String clientId, String clientSecret, List<String> scopes, Instant expiry) {

    public DeviceRequest {
        Objects.requireNonNull(userCode, "userCode is required");
        Objects.requireNonNull(deviceCode, "deviceCode is required");
        Objects.requireNonNull(expiry, "expiry is required");
        scopes = scopes != null ? List.copyOf(scopes) : List.of();
    }
}
