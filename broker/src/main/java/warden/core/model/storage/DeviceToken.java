package warden.core.model.storage;

import java.time.Instant;
import java.util.Objects;

/**
 * Token polled by a device, keyed by the device code.
 */
public record DeviceToken(
        String deviceCode,
        DeviceTokenStatus status,
        String token,
        Instant expiry,
        Instant lastRequestTime,
        int pollIntervalSeconds,
        Pkce pkce) {

    public DeviceToken {
        Objects.requireNonNull(deviceCode, "deviceCode is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(expiry, "expiry is required");
        pkce = pkce != null ? pkce : Pkce.NONE;
    }

    public DeviceToken complete(String issuedToken) {
        return new DeviceToken(
                deviceCode,
                DeviceTokenStatus.COMPLETE,
                issuedToken,
                expiry,
                lastRequestTime,
                pollIntervalSeconds,
                pkce);
    }

    public DeviceToken polled(Instant at) {
        return new DeviceToken(deviceCode, status, token, expiry, at, pollIntervalSeconds, pkce);
    }

    public DeviceToken withStatus(DeviceTokenStatus newStatus) {
        return new DeviceToken(deviceCode, newStatus, token, expiry, lastRequestTime, pollIntervalSeconds, pkce);
    }
}
