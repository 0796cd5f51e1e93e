package warden.core.port.out;

import java.time.Instant;
import java.util.List;
import java.util.function.UnaryOperator;

import io.smallrye.mutiny.Uni;

import warden.core.model.storage.AuthCode;
import warden.core.model.storage.AuthRequest;
import warden.core.model.storage.Client;
import warden.core.model.storage.ConnectorEntry;
import warden.core.model.storage.DeviceRequest;
import warden.core.model.storage.DeviceToken;
import warden.core.model.storage.GcResult;
import warden.core.model.storage.Keys;
import warden.core.model.storage.OfflineSessions;
import warden.core.model.storage.Password;
import warden.core.model.storage.RefreshToken;

/**
 * Persistence contract for credential-bearing entities, identical in observable behavior
 * across backends.
 *
 * <h2>Errors</h2>
 * <ul>
 *   <li>{@code create*} fails with {@link warden.core.exception.StorageAlreadyExistsException}
 *       when the key is taken; the existing row is left unchanged</li>
 *   <li>{@code get*}, {@code delete*} and {@code update*} fail with
 *       {@link warden.core.exception.StorageNotFoundException} when the row is absent</li>
 *   <li>everything else surfaces as {@link warden.core.exception.StorageException}</li>
 * </ul>
 *
 * <h2>Updates</h2>
 * <p>{@code update*(id, updater)} reads the current row, applies the updater and writes the
 * result inside one transaction. Concurrent updates of the same row serialize. If the updater
 * throws, nothing is written and the exception is propagated unchanged. The stored value is
 * returned.
 *
 * <p>All timestamps are normalized to UTC before they are stored or compared.
 */
public interface Storage {

    // Auth requests

    Uni<Void> createAuthRequest(AuthRequest request);

    Uni<AuthRequest> getAuthRequest(String id);

    Uni<AuthRequest> updateAuthRequest(String id, UnaryOperator<AuthRequest> updater);

    Uni<Void> deleteAuthRequest(String id);

    // Auth codes

    Uni<Void> createAuthCode(AuthCode code);

    Uni<AuthCode> getAuthCode(String id);

    Uni<Void> deleteAuthCode(String id);

    // Refresh tokens

    Uni<Void> createRefreshToken(RefreshToken token);

    Uni<RefreshToken> getRefreshToken(String id);

    Uni<List<RefreshToken>> listRefreshTokens();

    Uni<RefreshToken> updateRefreshToken(String id, UnaryOperator<RefreshToken> updater);

    Uni<Void> deleteRefreshToken(String id);

    // Device flow

    Uni<Void> createDeviceRequest(DeviceRequest request);

    /**
     * @param userCode the code displayed to the user
     */
    Uni<DeviceRequest> getDeviceRequest(String userCode);

    Uni<Void> deleteDeviceRequest(String userCode);

    Uni<Void> createDeviceToken(DeviceToken token);

    Uni<DeviceToken> getDeviceToken(String deviceCode);

    Uni<DeviceToken> updateDeviceToken(String deviceCode, UnaryOperator<DeviceToken> updater);

    Uni<Void> deleteDeviceToken(String deviceCode);

    // Clients

    Uni<Void> createClient(Client client);

    Uni<Client> getClient(String id);

    Uni<List<Client>> listClients();

    Uni<Client> updateClient(String id, UnaryOperator<Client> updater);

    Uni<Void> deleteClient(String id);

    // Connectors

    Uni<Void> createConnector(ConnectorEntry connector);

    Uni<ConnectorEntry> getConnector(String id);

    Uni<List<ConnectorEntry>> listConnectors();

    Uni<ConnectorEntry> updateConnector(String id, UnaryOperator<ConnectorEntry> updater);

    Uni<Void> deleteConnector(String id);

    // Passwords, keyed by case-insensitive email

    Uni<Void> createPassword(Password password);

    Uni<Password> getPassword(String email);

    Uni<List<Password>> listPasswords();

    Uni<Password> updatePassword(String email, UnaryOperator<Password> updater);

    Uni<Void> deletePassword(String email);

    // Offline sessions, keyed by (userId, connectorId)

    Uni<Void> createOfflineSessions(OfflineSessions sessions);

    Uni<OfflineSessions> getOfflineSessions(String userId, String connectorId);

    Uni<OfflineSessions> updateOfflineSessions(
            String userId, String connectorId, UnaryOperator<OfflineSessions> updater);

    Uni<Void> deleteOfflineSessions(String userId, String connectorId);

    // Signing keys

    /**
     * @return the stored keys; fails with NotFound before the first rotation
     */
    Uni<Keys> getKeys();

    /**
     * Atomically replace the signing keys.
     *
     * <p>Runs in one transaction at the strictest isolation the backend offers. When no keys
     * exist yet the updater receives {@link Keys#empty()} and its result is inserted;
     * otherwise the existing row is updated.
     */
    Uni<Keys> updateKeys(UnaryOperator<Keys> updater);

    /**
     * Delete every auth request, auth code, device request and device token whose expiry is
     * strictly before {@code now}.
     *
     * <p>Each type is removed with a single conditional delete, in that order. The first
     * failure aborts the sweep and is reported; remaining types are not attempted.
     */
    Uni<GcResult> garbageCollect(Instant now);

    /**
     * Release backend resources.
     */
    void close();
}
