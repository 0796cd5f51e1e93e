package warden.core.exception;

/**
 * A presented refresh token is unknown, replayed outside the reuse interval, or expired.
 */
public class RefreshTokenRejectedException extends BrokerException {

    public RefreshTokenRejectedException(String message) {
        super(message);
    }
}
