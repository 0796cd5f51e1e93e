package warden.core.service.keys;

import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;
import org.jose4j.jwk.RsaJsonWebKey;
import org.jose4j.jwk.Use;
import org.jose4j.jws.AlgorithmIdentifiers;

import warden.core.config.KeyRotationConfig;
import warden.core.exception.StorageNotFoundException;
import warden.core.model.storage.Keys;
import warden.core.model.storage.VerificationKey;
import warden.core.port.out.Metrics;
import warden.core.port.out.Storage;

/**
 * Rotates the signing key shared by all broker instances.
 *
 * <h2>Rotation Process</h2>
 * <ol>
 *   <li>Every check interval, read the stored keys; nothing stored means never rotated</li>
 *   <li>If the next rotation is still in the future, stop</li>
 *   <li>Generate a new RSA key pair outside of any transaction</li>
 *   <li>Inside {@link Storage#updateKeys}, re-check the rotation time, since another instance
 *       may have rotated in the meantime</li>
 *   <li>Drop expired verification keys and demote the current public key to a verification
 *       key that lives as long as the ID tokens it signed</li>
 *   <li>Install the new pair and schedule the next rotation</li>
 * </ol>
 */
@ApplicationScoped
public class KeyRotationService {

    private static final Logger LOG = Logger.getLogger(KeyRotationService.class);

    private static final int KEY_ID_BYTES = 20;

    private final Storage storage;
    private final Metrics metrics;
    private final KeyRotationConfig config;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    @Inject
    public KeyRotationService(Storage storage, Metrics metrics, KeyRotationConfig config) {
        this(storage, metrics, config, Clock.systemUTC());
    }

    KeyRotationService(Storage storage, Metrics metrics, KeyRotationConfig config, Clock clock) {
        this.storage = storage;
        this.metrics = metrics;
        this.config = config;
        this.clock = clock;
    }

    @Scheduled(
            every = "${warden.key-rotation.check-interval:30s}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    Uni<Void> scheduledRotation() {
        if (!config.enabled()) {
            return Uni.createFrom().voidItem();
        }
        // Failures are logged by rotate(); the next check retries
        return rotate().replaceWithVoid().onFailure().recoverWithNull();
    }

    /**
     * Rotate the signing key if it is due.
     *
     * @return true if this call installed a new signing key
     */
    public Uni<Boolean> rotate() {
        final var now = clock.instant();

        return currentKeys()
                .flatMap(current -> {
                    if (now.isBefore(current.nextRotation())) {
                        LOG.debugv("Keys not due for rotation until {0}", current.nextRotation());
                        return Uni.createFrom().item(false);
                    }

                    return generateKey().flatMap(newKey -> storage.updateKeys(stored -> rotated(stored, newKey, now))
                            .map(keys -> {
                                metrics.recordKeyRotation();
                                LOG.infof(
                                        "Rotated signing key, new key %s, next rotation at %s",
                                        newKey.getKeyId(),
                                        keys.nextRotation());
                                return true;
                            }));
                })
                .onFailure(KeysAlreadyRotatedException.class)
                .recoverWithItem(e -> {
                    LOG.info(e.getMessage());
                    return false;
                })
                .onFailure()
                .invoke(e -> LOG.error("Key rotation failed", e));
    }

    private Uni<Keys> currentKeys() {
        return storage.getKeys()
                .onFailure(StorageNotFoundException.class)
                .recoverWithItem(e -> Keys.empty());
    }

    Keys rotated(Keys stored, RsaJsonWebKey newKey, Instant now) {
        if (now.isBefore(stored.nextRotation())) {
            throw new KeysAlreadyRotatedException(stored.nextRotation());
        }

        final var verificationKeys = new ArrayList<VerificationKey>();
        for (var key : stored.verificationKeys()) {
            if (!key.isExpired(now)) {
                verificationKeys.add(key);
            }
        }
        if (stored.signingKeyPub() != null) {
            verificationKeys.add(new VerificationKey(stored.signingKeyPub(), now.plus(config.idTokensValidFor())));
        }

        return new Keys(newKey, publicOnly(newKey), verificationKeys, now.plus(config.rotationFrequency()));
    }

    private Uni<RsaJsonWebKey> generateKey() {
        return Uni.createFrom()
                .item(this::newSigningKey)
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }

    RsaJsonWebKey newSigningKey() {
        final KeyPairGenerator generator;
        try {
            generator = KeyPairGenerator.getInstance("RSA");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("RSA algorithm not available", e);
        }
        generator.initialize(config.keySize(), random);
        final var keyPair = generator.generateKeyPair();

        final var jwk = new RsaJsonWebKey((RSAPublicKey) keyPair.getPublic());
        jwk.setPrivateKey((RSAPrivateKey) keyPair.getPrivate());
        jwk.setKeyId(newKeyId());
        jwk.setAlgorithm(AlgorithmIdentifiers.RSA_USING_SHA256);
        jwk.setUse(Use.SIGNATURE);
        return jwk;
    }

    private static RsaJsonWebKey publicOnly(RsaJsonWebKey key) {
        final var pub = new RsaJsonWebKey(key.getRsaPublicKey());
        pub.setKeyId(key.getKeyId());
        pub.setAlgorithm(key.getAlgorithm());
        pub.setUse(key.getUse());
        return pub;
    }

    private String newKeyId() {
        final var bytes = new byte[KEY_ID_BYTES];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    /**
     * Another instance rotated the keys between our read and our update.
     */
    static class KeysAlreadyRotatedException extends RuntimeException {

        KeysAlreadyRotatedException(Instant nextRotation) {
            super("Keys already rotated by another instance, next rotation at " + nextRotation);
        }
    }
}
