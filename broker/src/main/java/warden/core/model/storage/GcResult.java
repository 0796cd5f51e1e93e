package warden.core.model.storage;

/**
 * Number of expired rows removed per entity type in one garbage collection sweep.
 */
public record GcResult(long authRequests, long authCodes, long deviceRequests, long deviceTokens) {

    public static final GcResult EMPTY = new GcResult(0, 0, 0, 0);

    public boolean isEmpty() {
        return authRequests == 0 && authCodes == 0 && deviceRequests == 0 && deviceTokens == 0;
    }

    public long total() {
        return authRequests + authCodes + deviceRequests + deviceTokens;
    }
}
