package warden.core.model.storage;

import java.util.Locale;

/**
 * State of a device token while the user completes the out-of-band approval.
 */
public enum DeviceTokenStatus {
    PENDING,
    COMPLETE,
    EXPIRED,
    DENIED;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DeviceTokenStatus fromWireValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
