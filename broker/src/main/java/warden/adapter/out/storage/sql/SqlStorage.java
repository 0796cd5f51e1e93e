package warden.adapter.out.storage.sql;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;
import javax.sql.DataSource;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;
import org.jose4j.jwk.JsonWebKey.OutputControlLevel;
import org.jose4j.jwk.PublicJsonWebKey;
import org.jose4j.lang.JoseException;

import warden.adapter.out.storage.OfflineSessionKey;
import warden.core.exception.StorageAlreadyExistsException;
import warden.core.exception.StorageException;
import warden.core.exception.StorageNotFoundException;
import warden.core.exception.StorageTransactionException;
import warden.core.model.storage.AuthCode;
import warden.core.model.storage.AuthRequest;
import warden.core.model.storage.Claims;
import warden.core.model.storage.Client;
import warden.core.model.storage.ConnectorEntry;
import warden.core.model.storage.DeviceRequest;
import warden.core.model.storage.DeviceToken;
import warden.core.model.storage.DeviceTokenStatus;
import warden.core.model.storage.GcResult;
import warden.core.model.storage.Keys;
import warden.core.model.storage.OfflineSessions;
import warden.core.model.storage.Password;
import warden.core.model.storage.Pkce;
import warden.core.model.storage.RefreshToken;
import warden.core.model.storage.RefreshTokenRef;
import warden.core.model.storage.VerificationKey;
import warden.core.port.out.Storage;

/**
 * JDBC implementation of {@link Storage}, tested against PostgreSQL and H2.
 *
 * <p>All JDBC work is blocking and runs on the Mutiny worker pool. Updates run in a
 * SERIALIZABLE transaction that locks the row with {@code SELECT ... FOR UPDATE}; a
 * serialization failure reported by the database is retried up to
 * {@code maxSerializationRetries} times before it is surfaced.
 *
 * <p>Lists, claims and key sets are stored as JSON text. Timestamps are written as
 * {@code timestamp with time zone} in UTC.
 */
public class SqlStorage implements Storage {

    private static final Logger LOG = Logger.getLogger(SqlStorage.class);

    private static final String KEYS_ROW = "keys";

    private static final String AUTH_REQUEST = "auth request";
    private static final String AUTH_CODE = "auth code";
    private static final String REFRESH_TOKEN = "refresh token";
    private static final String DEVICE_REQUEST = "device request";
    private static final String DEVICE_TOKEN = "device token";
    private static final String CLIENT = "client";
    private static final String CONNECTOR = "connector";
    private static final String PASSWORD = "password";
    private static final String OFFLINE_SESSION = "offline session";

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, RefreshTokenRef>> REFRESH_REFS = new TypeReference<>() {};
    private static final TypeReference<List<StoredVerificationKey>> VERIFICATION_KEYS = new TypeReference<>() {};

    private static final String AUTH_REQUEST_COLUMNS =
            """
            id, client_id, response_types, scopes, redirect_uri, nonce, state, force_approval_prompt,
            logged_in, claims, connector_id, connector_data, expiry, code_challenge, code_challenge_method,
            hmac_key""";

    private static final String AUTH_CODE_COLUMNS =
            """
            id, client_id, scopes, nonce, redirect_uri, claims, connector_id, connector_data, expiry,
            code_challenge, code_challenge_method""";

    private static final String REFRESH_TOKEN_COLUMNS =
            """
            id, client_id, scopes, nonce, claims, connector_id, connector_data, token, obsolete_token,
            created_at, last_used""";

    private static final String DEVICE_TOKEN_COLUMNS =
            """
            device_code, status, token, expiry, last_request, poll_interval, code_challenge,
            code_challenge_method""";

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final OfflineSessionKey offlineSessionKey;
    private final int maxSerializationRetries;

    public SqlStorage(DataSource dataSource, OfflineSessionKey offlineSessionKey, int maxSerializationRetries) {
        this.dataSource = dataSource;
        this.offlineSessionKey = offlineSessionKey;
        this.maxSerializationRetries = maxSerializationRetries;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    // ---------------------------------------------------------------------------------------
    // Auth requests

    @Override
    public Uni<Void> createAuthRequest(AuthRequest request) {
        return withConnection(AUTH_REQUEST, request.id(), conn -> {
            execute(
                    conn,
                    "INSERT INTO auth_requests (%s) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)"
                            .formatted(AUTH_REQUEST_COLUMNS),
                    ps -> {
                        ps.setString(1, request.id());
                        bindAuthRequestValues(ps, request, 2);
                    });
            return null;
        });
    }

    @Override
    public Uni<AuthRequest> getAuthRequest(String id) {
        return withConnection(AUTH_REQUEST, id, conn -> selectOne(
                        conn,
                        "SELECT %s FROM auth_requests WHERE id = ?".formatted(AUTH_REQUEST_COLUMNS),
                        id,
                        this::readAuthRequest)
                .orElseThrow(() -> new StorageNotFoundException(AUTH_REQUEST, id)));
    }

    @Override
    public Uni<AuthRequest> updateAuthRequest(String id, UnaryOperator<AuthRequest> updater) {
        return inTransaction(AUTH_REQUEST, id, conn -> {
            final var current = selectOne(
                            conn,
                            "SELECT %s FROM auth_requests WHERE id = ? FOR UPDATE".formatted(AUTH_REQUEST_COLUMNS),
                            id,
                            this::readAuthRequest)
                    .orElseThrow(() -> new StorageNotFoundException(AUTH_REQUEST, id));
            final var updated = updater.apply(current);
            execute(
                    conn,
                    """
                    UPDATE auth_requests SET client_id = ?, response_types = ?, scopes = ?, redirect_uri = ?,
                        nonce = ?, state = ?, force_approval_prompt = ?, logged_in = ?, claims = ?,
                        connector_id = ?, connector_data = ?, expiry = ?, code_challenge = ?,
                        code_challenge_method = ?, hmac_key = ?
                    WHERE id = ?
                    """,
                    ps -> {
                        bindAuthRequestValues(ps, updated, 1);
                        ps.setString(16, id);
                    });
            return updated;
        });
    }

    @Override
    public Uni<Void> deleteAuthRequest(String id) {
        return delete(AUTH_REQUEST, "DELETE FROM auth_requests WHERE id = ?", id);
    }

    private void bindAuthRequestValues(PreparedStatement ps, AuthRequest r, int first) throws SQLException {
        int i = first;
        ps.setString(i++, r.clientId());
        ps.setString(i++, toJson(r.responseTypes()));
        ps.setString(i++, toJson(r.scopes()));
        ps.setString(i++, r.redirectUri());
        ps.setString(i++, r.nonce());
        ps.setString(i++, r.state());
        ps.setBoolean(i++, r.forceApprovalPrompt());
        ps.setBoolean(i++, r.loggedIn());
        ps.setString(i++, claimsToJson(r.claims()));
        ps.setString(i++, r.connectorId());
        ps.setBytes(i++, r.connectorData());
        setInstant(ps, i++, r.expiry());
        ps.setString(i++, r.pkce().codeChallenge());
        ps.setString(i++, r.pkce().codeChallengeMethod());
        ps.setBytes(i, r.hmacKey());
    }

    private AuthRequest readAuthRequest(ResultSet rs) throws SQLException {
        return new AuthRequest(
                rs.getString("id"),
                rs.getString("client_id"),
                fromJson(rs.getString("response_types"), STRING_LIST),
                fromJson(rs.getString("scopes"), STRING_LIST),
                rs.getString("redirect_uri"),
                rs.getString("nonce"),
                rs.getString("state"),
                rs.getBoolean("force_approval_prompt"),
                getInstant(rs, "expiry"),
                rs.getBoolean("logged_in"),
                claimsFromJson(rs.getString("claims")),
                rs.getString("connector_id"),
                rs.getBytes("connector_data"),
                readPkce(rs),
                rs.getBytes("hmac_key"));
    }

    // ---------------------------------------------------------------------------------------
    // Auth codes

    @Override
    public Uni<Void> createAuthCode(AuthCode code) {
        return withConnection(AUTH_CODE, code.id(), conn -> {
            execute(
                    conn,
                    "INSERT INTO auth_codes (%s) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)".formatted(AUTH_CODE_COLUMNS),
                    ps -> {
                        ps.setString(1, code.id());
                        ps.setString(2, code.clientId());
                        ps.setString(3, toJson(code.scopes()));
                        ps.setString(4, code.nonce());
                        ps.setString(5, code.redirectUri());
                        ps.setString(6, claimsToJson(code.claims()));
                        ps.setString(7, code.connectorId());
                        ps.setBytes(8, code.connectorData());
                        setInstant(ps, 9, code.expiry());
                        ps.setString(10, code.pkce().codeChallenge());
                        ps.setString(11, code.pkce().codeChallengeMethod());
                    });
            return null;
        });
    }

    @Override
    public Uni<AuthCode> getAuthCode(String id) {
        return withConnection(AUTH_CODE, id, conn -> selectOne(
                        conn,
                        "SELECT %s FROM auth_codes WHERE id = ?".formatted(AUTH_CODE_COLUMNS),
                        id,
                        rs -> new AuthCode(
                                rs.getString("id"),
                                rs.getString("client_id"),
                                rs.getString("redirect_uri"),
                                rs.getString("nonce"),
                                fromJson(rs.getString("scopes"), STRING_LIST),
                                rs.getString("connector_id"),
                                rs.getBytes("connector_data"),
                                claimsFromJson(rs.getString("claims")),
                                getInstant(rs, "expiry"),
                                readPkce(rs)))
                .orElseThrow(() -> new StorageNotFoundException(AUTH_CODE, id)));
    }

    @Override
    public Uni<Void> deleteAuthCode(String id) {
        return delete(AUTH_CODE, "DELETE FROM auth_codes WHERE id = ?", id);
    }

    // ---------------------------------------------------------------------------------------
    // Refresh tokens

    @Override
    public Uni<Void> createRefreshToken(RefreshToken token) {
        return withConnection(REFRESH_TOKEN, token.id(), conn -> {
            execute(
                    conn,
                    "INSERT INTO refresh_tokens (%s) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)"
                            .formatted(REFRESH_TOKEN_COLUMNS),
                    ps -> {
                        ps.setString(1, token.id());
                        bindRefreshTokenValues(ps, token, 2);
                    });
            return null;
        });
    }

    @Override
    public Uni<RefreshToken> getRefreshToken(String id) {
        return withConnection(REFRESH_TOKEN, id, conn -> selectOne(
                        conn,
                        "SELECT %s FROM refresh_tokens WHERE id = ?".formatted(REFRESH_TOKEN_COLUMNS),
                        id,
                        this::readRefreshToken)
                .orElseThrow(() -> new StorageNotFoundException(REFRESH_TOKEN, id)));
    }

    @Override
    public Uni<List<RefreshToken>> listRefreshTokens() {
        return withConnection(REFRESH_TOKEN, "*", conn -> selectAll(
                conn, "SELECT %s FROM refresh_tokens".formatted(REFRESH_TOKEN_COLUMNS), this::readRefreshToken));
    }

    @Override
    public Uni<RefreshToken> updateRefreshToken(String id, UnaryOperator<RefreshToken> updater) {
        return inTransaction(REFRESH_TOKEN, id, conn -> {
            final var current = selectOne(
                            conn,
                            "SELECT %s FROM refresh_tokens WHERE id = ? FOR UPDATE".formatted(REFRESH_TOKEN_COLUMNS),
                            id,
                            this::readRefreshToken)
                    .orElseThrow(() -> new StorageNotFoundException(REFRESH_TOKEN, id));
            final var updated = updater.apply(current);
            execute(
                    conn,
                    """
                    UPDATE refresh_tokens SET client_id = ?, scopes = ?, nonce = ?, claims = ?, connector_id = ?,
                        connector_data = ?, token = ?, obsolete_token = ?, created_at = ?, last_used = ?
                    WHERE id = ?
                    """,
                    ps -> {
                        bindRefreshTokenValues(ps, updated, 1);
                        ps.setString(11, id);
                    });
            return updated;
        });
    }

    @Override
    public Uni<Void> deleteRefreshToken(String id) {
        return delete(REFRESH_TOKEN, "DELETE FROM refresh_tokens WHERE id = ?", id);
    }

    private void bindRefreshTokenValues(PreparedStatement ps, RefreshToken t, int first) throws SQLException {
        int i = first;
        ps.setString(i++, t.clientId());
        ps.setString(i++, toJson(t.scopes()));
        ps.setString(i++, t.nonce());
        ps.setString(i++, claimsToJson(t.claims()));
        ps.setString(i++, t.connectorId());
        ps.setBytes(i++, t.connectorData());
        ps.setString(i++, t.token());
        ps.setString(i++, t.obsoleteToken());
        setInstant(ps, i++, t.createdAt());
        setInstant(ps, i, t.lastUsed());
    }

    private RefreshToken readRefreshToken(ResultSet rs) throws SQLException {
        return new RefreshToken(
                rs.getString("id"),
                rs.getString("token"),
                rs.getString("obsolete_token"),
                getInstant(rs, "created_at"),
                getInstant(rs, "last_used"),
                rs.getString("client_id"),
                rs.getString("connector_id"),
                rs.getBytes("connector_data"),
                claimsFromJson(rs.getString("claims")),
                fromJson(rs.getString("scopes"), STRING_LIST),
                rs.getString("nonce"));
    }

    // ---------------------------------------------------------------------------------------
    // Device flow

    @Override
    public Uni<Void> createDeviceRequest(DeviceRequest request) {
        return withConnection(DEVICE_REQUEST, request.userCode(), conn -> {
            execute(
                    conn,
                    """
                    INSERT INTO device_requests (user_code, device_code, client_id, client_secret, scopes, expiry)
                    VALUES (?, ?, ?, ?, ?, ?)
                    """,
                    ps -> {
                        ps.setString(1, request.userCode());
                        ps.setString(2, request.deviceCode());
                        ps.setString(3, request.clientId());
                        ps.setString(4, request.clientSecret());
                        ps.setString(5, toJson(request.scopes()));
                        setInstant(ps, 6, request.expiry());
                    });
            return null;
        });
    }

    @Override
    public Uni<DeviceRequest> getDeviceRequest(String userCode) {
        return withConnection(DEVICE_REQUEST, userCode, conn -> selectOne(
                        conn,
                        """
                        SELECT user_code, device_code, client_id, client_secret, scopes, expiry
                        FROM device_requests WHERE user_code = ?
                        """,
                        userCode,
                        rs -> new DeviceRequest(
                                rs.getString("user_code"),
                                rs.getString("device_code"),
                                rs.getString("client_id"),
                                rs.getString("client_secret"),
                                fromJson(rs.getString("scopes"), STRING_LIST),
                                getInstant(rs, "expiry")))
                .orElseThrow(() -> new StorageNotFoundException(DEVICE_REQUEST, userCode)));
    }

    @Override
    public Uni<Void> deleteDeviceRequest(String userCode) {
        return delete(DEVICE_REQUEST, "DELETE FROM device_requests WHERE user_code = ?", userCode);
    }

    @Override
    public Uni<Void> createDeviceToken(DeviceToken token) {
        return withConnection(DEVICE_TOKEN, token.deviceCode(), conn -> {
            execute(
                    conn,
                    "INSERT INTO device_tokens (%s) VALUES (?, ?, ?, ?, ?, ?, ?, ?)".formatted(DEVICE_TOKEN_COLUMNS),
                    ps -> {
                        ps.setString(1, token.deviceCode());
                        bindDeviceTokenValues(ps, token, 2);
                    });
            return null;
        });
    }

    @Override
    public Uni<DeviceToken> getDeviceToken(String deviceCode) {
        return withConnection(DEVICE_TOKEN, deviceCode, conn -> selectOne(
                        conn,
                        "SELECT %s FROM device_tokens WHERE device_code = ?".formatted(DEVICE_TOKEN_COLUMNS),
                        deviceCode,
                        this::readDeviceToken)
                .orElseThrow(() -> new StorageNotFoundException(DEVICE_TOKEN, deviceCode)));
    }

    @Override
    public Uni<DeviceToken> updateDeviceToken(String deviceCode, UnaryOperator<DeviceToken> updater) {
        return inTransaction(DEVICE_TOKEN, deviceCode, conn -> {
            final var current = selectOne(
                            conn,
                            "SELECT %s FROM device_tokens WHERE device_code = ? FOR UPDATE"
                                    .formatted(DEVICE_TOKEN_COLUMNS),
                            deviceCode,
                            this::readDeviceToken)
                    .orElseThrow(() -> new StorageNotFoundException(DEVICE_TOKEN, deviceCode));
            final var updated = updater.apply(current);
            execute(
                    conn,
                    """
                    UPDATE device_tokens SET status = ?, token = ?, expiry = ?, last_request = ?, poll_interval = ?,
                        code_challenge = ?, code_challenge_method = ?
                    WHERE device_code = ?
                    """,
                    ps -> {
                        bindDeviceTokenValues(ps, updated, 1);
                        ps.setString(8, deviceCode);
                    });
            return updated;
        });
    }

    @Override
    public Uni<Void> deleteDeviceToken(String deviceCode) {
        return delete(DEVICE_TOKEN, "DELETE FROM device_tokens WHERE device_code = ?", deviceCode);
    }

    private static void bindDeviceTokenValues(PreparedStatement ps, DeviceToken t, int first) throws SQLException {
        int i = first;
        ps.setString(i++, t.status().wireValue());
        ps.setString(i++, t.token());
        setInstant(ps, i++, t.expiry());
        setInstant(ps, i++, t.lastRequestTime());
        ps.setInt(i++, t.pollIntervalSeconds());
        ps.setString(i++, t.pkce().codeChallenge());
        ps.setString(i, t.pkce().codeChallengeMethod());
    }

    private DeviceToken readDeviceToken(ResultSet rs) throws SQLException {
        return new DeviceToken(
                rs.getString("device_code"),
                DeviceTokenStatus.fromWireValue(rs.getString("status")),
                rs.getString("token"),
                getInstant(rs, "expiry"),
                getInstant(rs, "last_request"),
                rs.getInt("poll_interval"),
                readPkce(rs));
    }

    // ---------------------------------------------------------------------------------------
    // Clients

    @Override
    public Uni<Void> createClient(Client client) {
        return withConnection(CLIENT, client.id(), conn -> {
            execute(
                    conn,
                    """
                    INSERT INTO clients (id, secret, redirect_uris, trusted_peers, public_client, name, logo_url)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                    """,
                    ps -> {
                        ps.setString(1, client.id());
                        bindClientValues(ps, client, 2);
                    });
            return null;
        });
    }

    @Override
    public Uni<Client> getClient(String id) {
        return withConnection(CLIENT, id, conn -> selectOne(
                        conn,
                        "SELECT id, secret, redirect_uris, trusted_peers, public_client, name, logo_url"
                                + " FROM clients WHERE id = ?",
                        id,
                        this::readClient)
                .orElseThrow(() -> new StorageNotFoundException(CLIENT, id)));
    }

    @Override
    public Uni<List<Client>> listClients() {
        return withConnection(CLIENT, "*", conn -> selectAll(
                conn,
                "SELECT id, secret, redirect_uris, trusted_peers, public_client, name, logo_url FROM clients",
                this::readClient));
    }

    @Override
    public Uni<Client> updateClient(String id, UnaryOperator<Client> updater) {
        return inTransaction(CLIENT, id, conn -> {
            final var current = selectOne(
                            conn,
                            "SELECT id, secret, redirect_uris, trusted_peers, public_client, name, logo_url"
                                    + " FROM clients WHERE id = ? FOR UPDATE",
                            id,
                            this::readClient)
                    .orElseThrow(() -> new StorageNotFoundException(CLIENT, id));
            final var updated = updater.apply(current);
            execute(
                    conn,
                    """
                    UPDATE clients SET secret = ?, redirect_uris = ?, trusted_peers = ?, public_client = ?, name = ?,
                        logo_url = ?
                    WHERE id = ?
                    """,
                    ps -> {
                        bindClientValues(ps, updated, 1);
                        ps.setString(7, id);
                    });
            return updated;
        });
    }

    @Override
    public Uni<Void> deleteClient(String id) {
        return delete(CLIENT, "DELETE FROM clients WHERE id = ?", id);
    }

    private void bindClientValues(PreparedStatement ps, Client c, int first) throws SQLException {
        int i = first;
        ps.setString(i++, c.secret());
        ps.setString(i++, toJson(c.redirectUris()));
        ps.setString(i++, toJson(c.trustedPeers()));
        ps.setBoolean(i++, c.isPublic());
        ps.setString(i++, c.name());
        ps.setString(i, c.logoUrl());
    }

    private Client readClient(ResultSet rs) throws SQLException {
        return new Client(
                rs.getString("id"),
                rs.getString("secret"),
                fromJson(rs.getString("redirect_uris"), STRING_LIST),
                fromJson(rs.getString("trusted_peers"), STRING_LIST),
                rs.getBoolean("public_client"),
                rs.getString("name"),
                rs.getString("logo_url"));
    }

    // ---------------------------------------------------------------------------------------
    // Connectors

    @Override
    public Uni<Void> createConnector(ConnectorEntry connector) {
        return withConnection(CONNECTOR, connector.id(), conn -> {
            execute(
                    conn,
                    "INSERT INTO connectors (id, type, name, resource_version, config) VALUES (?, ?, ?, ?, ?)",
                    ps -> {
                        ps.setString(1, connector.id());
                        ps.setString(2, connector.type());
                        ps.setString(3, connector.name());
                        ps.setString(4, connector.resourceVersion());
                        ps.setBytes(5, connector.config());
                    });
            return null;
        });
    }

    @Override
    public Uni<ConnectorEntry> getConnector(String id) {
        return withConnection(CONNECTOR, id, conn -> selectOne(
                        conn,
                        "SELECT id, type, name, resource_version, config FROM connectors WHERE id = ?",
                        id,
                        SqlStorage::readConnector)
                .orElseThrow(() -> new StorageNotFoundException(CONNECTOR, id)));
    }

    @Override
    public Uni<List<ConnectorEntry>> listConnectors() {
        return withConnection(CONNECTOR, "*", conn -> selectAll(
                conn, "SELECT id, type, name, resource_version, config FROM connectors", SqlStorage::readConnector));
    }

    @Override
    public Uni<ConnectorEntry> updateConnector(String id, UnaryOperator<ConnectorEntry> updater) {
        return inTransaction(CONNECTOR, id, conn -> {
            final var current = selectOne(
                            conn,
                            "SELECT id, type, name, resource_version, config FROM connectors WHERE id = ? FOR UPDATE",
                            id,
                            SqlStorage::readConnector)
                    .orElseThrow(() -> new StorageNotFoundException(CONNECTOR, id));
            final var updated = updater.apply(current);
            execute(
                    conn,
                    "UPDATE connectors SET type = ?, name = ?, resource_version = ?, config = ? WHERE id = ?",
                    ps -> {
                        ps.setString(1, updated.type());
                        ps.setString(2, updated.name());
                        ps.setString(3, updated.resourceVersion());
                        ps.setBytes(4, updated.config());
                        ps.setString(5, id);
                    });
            return updated;
        });
    }

    @Override
    public Uni<Void> deleteConnector(String id) {
        return delete(CONNECTOR, "DELETE FROM connectors WHERE id = ?", id);
    }

    private static ConnectorEntry readConnector(ResultSet rs) throws SQLException {
        return new ConnectorEntry(
                rs.getString("id"),
                rs.getString("type"),
                rs.getString("name"),
                rs.getString("resource_version"),
                rs.getBytes("config"));
    }

    // ---------------------------------------------------------------------------------------
    // Passwords

    @Override
    public Uni<Void> createPassword(Password password) {
        return withConnection(PASSWORD, password.email(), conn -> {
            execute(conn, "INSERT INTO passwords (email, hash, username, user_id) VALUES (?, ?, ?, ?)", ps -> {
                ps.setString(1, password.email());
                ps.setBytes(2, password.hash());
                ps.setString(3, password.username());
                ps.setString(4, password.userId());
            });
            return null;
        });
    }

    @Override
    public Uni<Password> getPassword(String email) {
        final var key = normalizeEmail(email);
        return withConnection(PASSWORD, key, conn -> selectOne(
                        conn,
                        "SELECT email, hash, username, user_id FROM passwords WHERE email = ?",
                        key,
                        SqlStorage::readPassword)
                .orElseThrow(() -> new StorageNotFoundException(PASSWORD, key)));
    }

    @Override
    public Uni<List<Password>> listPasswords() {
        return withConnection(PASSWORD, "*", conn -> selectAll(
                conn, "SELECT email, hash, username, user_id FROM passwords", SqlStorage::readPassword));
    }

    @Override
    public Uni<Password> updatePassword(String email, UnaryOperator<Password> updater) {
        final var key = normalizeEmail(email);
        return inTransaction(PASSWORD, key, conn -> {
            final var current = selectOne(
                            conn,
                            "SELECT email, hash, username, user_id FROM passwords WHERE email = ? FOR UPDATE",
                            key,
                            SqlStorage::readPassword)
                    .orElseThrow(() -> new StorageNotFoundException(PASSWORD, key));
            final var updated = updater.apply(current);
            execute(conn, "UPDATE passwords SET hash = ?, username = ?, user_id = ? WHERE email = ?", ps -> {
                ps.setBytes(1, updated.hash());
                ps.setString(2, updated.username());
                ps.setString(3, updated.userId());
                ps.setString(4, key);
            });
            return updated;
        });
    }

    @Override
    public Uni<Void> deletePassword(String email) {
        return delete(PASSWORD, "DELETE FROM passwords WHERE email = ?", normalizeEmail(email));
    }

    private static Password readPassword(ResultSet rs) throws SQLException {
        return new Password(
                rs.getString("email"), rs.getBytes("hash"), rs.getString("username"), rs.getString("user_id"));
    }

    // ---------------------------------------------------------------------------------------
    // Offline sessions

    @Override
    public Uni<Void> createOfflineSessions(OfflineSessions sessions) {
        final var key = offlineSessionKey.derive(sessions.userId(), sessions.connectorId());
        return withConnection(OFFLINE_SESSION, key, conn -> {
            execute(
                    conn,
                    "INSERT INTO offline_sessions (id, user_id, conn_id, refresh, connector_data)"
                            + " VALUES (?, ?, ?, ?, ?)",
                    ps -> {
                        ps.setString(1, key);
                        ps.setString(2, sessions.userId());
                        ps.setString(3, sessions.connectorId());
                        ps.setString(4, toJson(sessions.refresh()));
                        ps.setBytes(5, sessions.connectorData());
                    });
            return null;
        });
    }

    @Override
    public Uni<OfflineSessions> getOfflineSessions(String userId, String connectorId) {
        final var key = offlineSessionKey.derive(userId, connectorId);
        return withConnection(OFFLINE_SESSION, key, conn -> selectOne(
                        conn,
                        "SELECT user_id, conn_id, refresh, connector_data FROM offline_sessions WHERE id = ?",
                        key,
                        this::readOfflineSessions)
                .orElseThrow(() -> new StorageNotFoundException(OFFLINE_SESSION, key)));
    }

    @Override
    public Uni<OfflineSessions> updateOfflineSessions(
            String userId, String connectorId, UnaryOperator<OfflineSessions> updater) {
        final var key = offlineSessionKey.derive(userId, connectorId);
        return inTransaction(OFFLINE_SESSION, key, conn -> {
            final var current = selectOne(
                            conn,
                            "SELECT user_id, conn_id, refresh, connector_data FROM offline_sessions"
                                    + " WHERE id = ? FOR UPDATE",
                            key,
                            this::readOfflineSessions)
                    .orElseThrow(() -> new StorageNotFoundException(OFFLINE_SESSION, key));
            final var updated = updater.apply(current);
            execute(conn, "UPDATE offline_sessions SET refresh = ?, connector_data = ? WHERE id = ?", ps -> {
                ps.setString(1, toJson(updated.refresh()));
                ps.setBytes(2, updated.connectorData());
                ps.setString(3, key);
            });
            return updated;
        });
    }

    @Override
    public Uni<Void> deleteOfflineSessions(String userId, String connectorId) {
        return delete(
                OFFLINE_SESSION,
                "DELETE FROM offline_sessions WHERE id = ?",
                offlineSessionKey.derive(userId, connectorId));
    }

    private OfflineSessions readOfflineSessions(ResultSet rs) throws SQLException {
        return new OfflineSessions(
                rs.getString("user_id"),
                rs.getString("conn_id"),
                fromJson(rs.getString("refresh"), REFRESH_REFS),
                rs.getBytes("connector_data"));
    }

    // ---------------------------------------------------------------------------------------
    // Signing keys

    @Override
    public Uni<Keys> getKeys() {
        return withConnection(KEYS_ROW, KEYS_ROW, conn -> selectKeys(conn, false)
                .orElseThrow(() -> new StorageNotFoundException(KEYS_ROW, KEYS_ROW)));
    }

    @Override
    public Uni<Keys> updateKeys(UnaryOperator<Keys> updater) {
        return inTransaction(KEYS_ROW, KEYS_ROW, conn -> {
            final var current = selectKeys(conn, true);
            final var updated = updater.apply(current.orElseGet(Keys::empty));
            final var sql = current.isPresent()
                    ? """
                      UPDATE signing_keys SET verification_keys = ?, signing_key = ?, signing_key_pub = ?,
                          next_rotation = ?
                      WHERE id = ?
                      """
                    : """
                      INSERT INTO signing_keys (verification_keys, signing_key, signing_key_pub, next_rotation, id)
                      VALUES (?, ?, ?, ?, ?)
                      """;
            execute(conn, sql, ps -> {
                ps.setString(1, toJson(toStored(updated.verificationKeys())));
                ps.setString(2, jwkToJson(updated.signingKey(), OutputControlLevel.INCLUDE_PRIVATE));
                ps.setString(3, jwkToJson(updated.signingKeyPub(), OutputControlLevel.PUBLIC_ONLY));
                setInstant(ps, 4, updated.nextRotation());
                ps.setString(5, KEYS_ROW);
            });
            return updated;
        });
    }

    private Optional<Keys> selectKeys(Connection conn, boolean forUpdate) throws SQLException {
        final var sql = "SELECT verification_keys, signing_key, signing_key_pub, next_rotation FROM signing_keys"
                + " WHERE id = ?" + (forUpdate ? " FOR UPDATE" : "");
        return selectOne(
                conn,
                sql,
                KEYS_ROW,
                rs -> new Keys(
                        jwkFromJson(rs.getString("signing_key")),
                        jwkFromJson(rs.getString("signing_key_pub")),
                        fromStored(fromJson(rs.getString("verification_keys"), VERIFICATION_KEYS)),
                        getInstant(rs, "next_rotation")));
    }

    private static List<StoredVerificationKey> toStored(List<VerificationKey> keys) {
        return keys.stream()
                .map(k -> new StoredVerificationKey(
                        jwkToJson(k.publicKey(), OutputControlLevel.PUBLIC_ONLY), k.expiry()))
                .toList();
    }

    private static List<VerificationKey> fromStored(List<StoredVerificationKey> stored) {
        final var keys = new ArrayList<VerificationKey>(stored.size());
        for (var key : stored) {
            keys.add(new VerificationKey(jwkFromJson(key.publicKey()), key.expiry()));
        }
        return keys;
    }

    // ---------------------------------------------------------------------------------------
    // Garbage collection

    @Override
    public Uni<GcResult> garbageCollect(Instant now) {
        return withConnection("expired rows", now.toString(), conn -> {
            final var result = new GcResult(
                    deleteExpired(conn, "auth_requests", now),
                    deleteExpired(conn, "auth_codes", now),
                    deleteExpired(conn, "device_requests", now),
                    deleteExpired(conn, "device_tokens", now));
            LOG.debugf("SQL garbage collection removed %d rows", result.total());
            return result;
        });
    }

    private static long deleteExpired(Connection conn, String table, Instant now) throws SQLException {
        return execute(conn, "DELETE FROM %s WHERE expiry < ?".formatted(table), ps -> setInstant(ps, 1, now));
    }

    @Override
    public void close() {
        if (dataSource instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                LOG.warnf(e, "Failed to close data source");
            }
        }
    }

    // ---------------------------------------------------------------------------------------
    // JDBC plumbing

    @FunctionalInterface
    private interface ConnectionWork<T> {
        T execute(Connection conn) throws SQLException;
    }

    @FunctionalInterface
    private interface RowReader<T> {
        T read(ResultSet rs) throws SQLException;
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    private <T> Uni<T> withConnection(String entity, String id, ConnectionWork<T> work) {
        return Uni.createFrom()
                .item(() -> {
                    try (Connection conn = dataSource.getConnection()) {
                        return work.execute(conn);
                    } catch (SQLException e) {
                        throw failure(entity, id, e);
                    }
                })
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }

    private <T> Uni<T> inTransaction(String entity, String id, ConnectionWork<T> work) {
        return Uni.createFrom()
                .item(() -> retryOnSerializationFailure(entity, id, work))
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }

    private <T> T retryOnSerializationFailure(String entity, String id, ConnectionWork<T> work) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return transaction(work);
            } catch (SQLException e) {
                if (attempt <= maxSerializationRetries && SqlErrors.isSerializationFailure(e)) {
                    LOG.debugf("Serialization failure updating %s %s, retrying (attempt %d)", entity, id, attempt);
                    continue;
                }
                throw failure(entity, id, e);
            }
        }
    }

    private <T> T transaction(ConnectionWork<T> work) throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            conn.setTransactionIsolation(Connection.TRANSACTION_SERIALIZABLE);
            conn.setAutoCommit(false);
            try {
                final var result = work.execute(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollback(conn, e);
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        }
    }

    private static void rollback(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
            throw new StorageTransactionException("Rollback failed", cause);
        }
    }

    private static StorageException failure(String entity, String id, SQLException e) {
        final var translated = SqlErrors.translate(entity, id, e);
        if (!(translated instanceof StorageAlreadyExistsException)) {
            LOG.errorf(e, "SQL operation failed for %s %s", entity, id);
        }
        return translated;
    }

    private Uni<Void> delete(String entity, String sql, String id) {
        return withConnection(entity, id, conn -> {
            if (execute(conn, sql, ps -> ps.setString(1, id)) == 0) {
                throw new StorageNotFoundException(entity, id);
            }
            return null;
        });
    }

    private static <T> Optional<T> selectOne(Connection conn, String sql, String id, RowReader<T> reader)
            throws SQLException {
        try (var ps = conn.prepareStatement(sql)) {
            ps.setString(1, id);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(reader.read(rs)) : Optional.empty();
            }
        }
    }

    private static <T> List<T> selectAll(Connection conn, String sql, RowReader<T> reader) throws SQLException {
        try (var ps = conn.prepareStatement(sql);
                var rs = ps.executeQuery()) {
            final var rows = new ArrayList<T>();
            while (rs.next()) {
                rows.add(reader.read(rs));
            }
            return rows;
        }
    }

    private static int execute(Connection conn, String sql, Binder binder) throws SQLException {
        try (var ps = conn.prepareStatement(sql)) {
            binder.bind(ps);
            return ps.executeUpdate();
        }
    }

    private static Pkce readPkce(ResultSet rs) throws SQLException {
        return new Pkce(rs.getString("code_challenge"), rs.getString("code_challenge_method"));
    }

    private static void setInstant(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant == null) {
            ps.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        } else {
            ps.setObject(index, instant.atOffset(ZoneOffset.UTC));
        }
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        final var value = rs.getObject(column, OffsetDateTime.class);
        return value != null ? value.toInstant() : null;
    }

    private static String normalizeEmail(String email) {
        return email.toLowerCase(Locale.ROOT);
    }

    // ---------------------------------------------------------------------------------------
    // Serialization

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to encode column value", e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to decode column value", e);
        }
    }

    private String claimsToJson(Claims claims) {
        return claims != null ? toJson(claims) : null;
    }

    private Claims claimsFromJson(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, Claims.class);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to decode claims", e);
        }
    }

    private static String jwkToJson(PublicJsonWebKey key, OutputControlLevel level) {
        return key != null ? key.toJson(level) : null;
    }

    private static PublicJsonWebKey jwkFromJson(String json) {
        if (json == null) {
            return null;
        }
        try {
            return PublicJsonWebKey.Factory.newPublicJwk(json);
        } catch (JoseException e) {
            throw new StorageException("Failed to decode signing key", e);
        }
    }

    /**
     * JSON shape of one verification key in the {@code verification_keys} column.
     */
    record StoredVerificationKey(String publicKey, Instant expiry) {}
}
