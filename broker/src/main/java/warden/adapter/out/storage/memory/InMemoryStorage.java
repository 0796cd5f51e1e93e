package warden.adapter.out.storage.memory;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.adapter.out.storage.OfflineSessionKey;
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
import warden.core.port.out.Storage;

/**
 * In-memory implementation of {@link Storage}.
 *
 * <p>Data is NOT persisted across restarts. Suitable for development, tests and
 * single-instance deployments. Each entity type is a {@link MemoryTable} with its own lock.
 */
public class InMemoryStorage implements Storage {

    private static final Logger LOG = Logger.getLogger(InMemoryStorage.class);
    private static final String KEYS_ROW = "keys";

    private final OfflineSessionKey offlineSessionKey;

    private final MemoryTable<AuthRequest> authRequests = new MemoryTable<>("auth request");
    private final MemoryTable<AuthCode> authCodes = new MemoryTable<>("auth code");
    private final MemoryTable<RefreshToken> refreshTokens = new MemoryTable<>("refresh token");
    private final MemoryTable<DeviceRequest> deviceRequests = new MemoryTable<>("device request");
    private final MemoryTable<DeviceToken> deviceTokens = new MemoryTable<>("device token");
    private final MemoryTable<Client> clients = new MemoryTable<>("client");
    private final MemoryTable<ConnectorEntry> connectors = new MemoryTable<>("connector");
    private final MemoryTable<Password> passwords = new MemoryTable<>("password");
    private final MemoryTable<OfflineSessions> offlineSessions = new MemoryTable<>("offline session");
    private final MemoryTable<Keys> keys = new MemoryTable<>("keys");

    public InMemoryStorage() {
        this(OfflineSessionKey.sha256());
    }

    public InMemoryStorage(OfflineSessionKey offlineSessionKey) {
        this.offlineSessionKey = offlineSessionKey;
    }

    @Override
    public Uni<Void> createAuthRequest(AuthRequest request) {
        return run(() -> authRequests.create(request.id(), request));
    }

    @Override
    public Uni<AuthRequest> getAuthRequest(String id) {
        return call(() -> authRequests.get(id));
    }

    @Override
    public Uni<AuthRequest> updateAuthRequest(String id, UnaryOperator<AuthRequest> updater) {
        return call(() -> authRequests.update(id, updater));
    }

    @Override
    public Uni<Void> deleteAuthRequest(String id) {
        return run(() -> authRequests.delete(id));
    }

    @Override
    public Uni<Void> createAuthCode(AuthCode code) {
        return run(() -> authCodes.create(code.id(), code));
    }

    @Override
    public Uni<AuthCode> getAuthCode(String id) {
        return call(() -> authCodes.get(id));
    }

    @Override
    public Uni<Void> deleteAuthCode(String id) {
        return run(() -> authCodes.delete(id));
    }

    @Override
    public Uni<Void> createRefreshToken(RefreshToken token) {
        return run(() -> refreshTokens.create(token.id(), token));
    }

    @Override
    public Uni<RefreshToken> getRefreshToken(String id) {
        return call(() -> refreshTokens.get(id));
    }

    @Override
    public Uni<List<RefreshToken>> listRefreshTokens() {
        return call(refreshTokens::list);
    }

    @Override
    public Uni<RefreshToken> updateRefreshToken(String id, UnaryOperator<RefreshToken> updater) {
        return call(() -> refreshTokens.update(id, updater));
    }

    @Override
    public Uni<Void> deleteRefreshToken(String id) {
        return run(() -> refreshTokens.delete(id));
    }

    @Override
    public Uni<Void> createDeviceRequest(DeviceRequest request) {
        return run(() -> deviceRequests.create(request.userCode(), request));
    }

    @Override
    public Uni<DeviceRequest> getDeviceRequest(String userCode) {
        return call(() -> deviceRequests.get(userCode));
    }

    @Override
    public Uni<Void> deleteDeviceRequest(String userCode) {
        return run(() -> deviceRequests.delete(userCode));
    }

    @Override
    public Uni<Void> createDeviceToken(DeviceToken token) {
        return run(() -> deviceTokens.create(token.deviceCode(), token));
    }

    @Override
    public Uni<DeviceToken> getDeviceToken(String deviceCode) {
        return call(() -> deviceTokens.get(deviceCode));
    }

    @Override
    public Uni<DeviceToken> updateDeviceToken(String deviceCode, UnaryOperator<DeviceToken> updater) {
        return call(() -> deviceTokens.update(deviceCode, updater));
    }

    @Override
    public Uni<Void> deleteDeviceToken(String deviceCode) {
        return run(() -> deviceTokens.delete(deviceCode));
    }

    @Override
    public Uni<Void> createClient(Client client) {
        return run(() -> clients.create(client.id(), client));
    }

    @Override
    public Uni<Client> getClient(String id) {
        return call(() -> clients.get(id));
    }

    @Override
    public Uni<List<Client>> listClients() {
        return call(clients::list);
    }

    @Override
    public Uni<Client> updateClient(String id, UnaryOperator<Client> updater) {
        return call(() -> clients.update(id, updater));
    }

    @Override
    public Uni<Void> deleteClient(String id) {
        return run(() -> clients.delete(id));
    }

    @Override
    public Uni<Void> createConnector(ConnectorEntry connector) {
        return run(() -> connectors.create(connector.id(), connector));
    }

    @Override
    public Uni<ConnectorEntry> getConnector(String id) {
        return call(() -> connectors.get(id));
    }

    @Override
    public Uni<List<ConnectorEntry>> listConnectors() {
        return call(connectors::list);
    }

    @Override
    public Uni<ConnectorEntry> updateConnector(String id, UnaryOperator<ConnectorEntry> updater) {
        return call(() -> connectors.update(id, updater));
    }

    @Override
    public Uni<Void> deleteConnector(String id) {
        return run(() -> connectors.delete(id));
    }

    @Override
    public Uni<Void> createPassword(Password password) {
        return run(() -> passwords.create(password.email(), password));
    }

    @Override
    public Uni<Password> getPassword(String email) {
        return call(() -> passwords.get(normalizeEmail(email)));
    }

    @Override
    public Uni<List<Password>> listPasswords() {
        return call(passwords::list);
    }

    @Override
    public Uni<Password> updatePassword(String email, UnaryOperator<Password> updater) {
        return call(() -> passwords.update(normalizeEmail(email), updater));
    }

    @Override
    public Uni<Void> deletePassword(String email) {
        return run(() -> passwords.delete(normalizeEmail(email)));
    }

    @Override
    public Uni<Void> createOfflineSessions(OfflineSessions sessions) {
        return run(() -> offlineSessions.create(
                offlineSessionKey.derive(sessions.userId(), sessions.connectorId()), sessions));
    }

    @Override
    public Uni<OfflineSessions> getOfflineSessions(String userId, String connectorId) {
        return call(() -> offlineSessions.get(offlineSessionKey.derive(userId, connectorId)));
    }

    @Override
    public Uni<OfflineSessions> updateOfflineSessions(
            String userId, String connectorId, UnaryOperator<OfflineSessions> updater) {
        return call(() -> offlineSessions.update(offlineSessionKey.derive(userId, connectorId), updater));
    }

    @Override
    public Uni<Void> deleteOfflineSessions(String userId, String connectorId) {
        return run(() -> offlineSessions.delete(offlineSessionKey.derive(userId, connectorId)));
    }

    @Override
    public Uni<Keys> getKeys() {
        return call(() -> keys.get(KEYS_ROW));
    }

    @Override
    public Uni<Keys> updateKeys(UnaryOperator<Keys> updater) {
        return call(() -> keys.upsert(KEYS_ROW, Keys.empty(), updater));
    }

    @Override
    public Uni<GcResult> garbageCollect(Instant now) {
        return call(() -> {
            final var result = new GcResult(
                    authRequests.removeIf(r -> r.expiry().isBefore(now)),
                    authCodes.removeIf(c -> c.expiry().isBefore(now)),
                    deviceRequests.removeIf(r -> r.expiry().isBefore(now)),
                    deviceTokens.removeIf(t -> t.expiry().isBefore(now)));
            LOG.debugf("In-memory garbage collection removed %d rows", result.total());
            return result;
        });
    }

    @Override
    public void close() {
        authRequests.clear();
        authCodes.clear();
        refreshTokens.clear();
        deviceRequests.clear();
        deviceTokens.clear();
        clients.clear();
        connectors.clear();
        passwords.clear();
        offlineSessions.clear();
        keys.clear();
    }

    private static String normalizeEmail(String email) {
        return email.toLowerCase(Locale.ROOT);
    }

    private static <T> Uni<T> call(Supplier<T> operation) {
        return Uni.createFrom().item(operation);
    }

    private static Uni<Void> run(Runnable operation) {
        return Uni.createFrom().item(() -> {
            operation.run();
            return null;
        });
    }
}
