package wattle.core.service.authcode;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import wattle.core.config.AuthorizationCodeConfig;
import wattle.core.model.grant.AuthorizedGrant;
import wattle.core.model.storage.StorageOptions;
import wattle.core.port.out.EntityStorage;
import wattle.core.service.common.RandomValueGenerator;

/**
 * Issues authorization codes and resolves them back to the grants they stand for.
 */
@ApplicationScoped
public class AuthorizationCodeService {

    private static final Logger LOG = Logger.getLogger(AuthorizationCodeService.class);
    private static final String KEY_PREFIX = "authorization_code:";

    private final EntityStorage storage;
    private final AuthorizationCodeConfig config;
    private final RandomValueGenerator randomValueGenerator;

    @Inject
    public AuthorizationCodeService(
            EntityStorage storage, AuthorizationCodeConfig config, RandomValueGenerator randomValueGenerator) {
        this.storage = storage;
        this.config = config;
        this.randomValueGenerator = randomValueGenerator;
    }

    /**
     * Stores a grant under a new authorization code.
     *
     * @return the code to return to the client
     */
    public Uni<String> generateAuthorizationCode(AuthorizedGrant grant) {
        final var code = randomValueGenerator.randomUrlSafe(config.length());
        return storage.set(key(code), grant, StorageOptions.expiresIn(config.lifetime()))
                .invoke(() -> LOG.debugf(
                        "Issued authorization code for client %s", grant.context().clientId()))
                .replaceWith(code);
    }

    /**
     * Looks up the grant of a code without consuming it.
     */
    public Uni<Optional<AuthorizedGrant>> authorizeByCode(String code) {
        return storage.get(key(code), AuthorizedGrant.class, false);
    }

    /**
     * Replaces the grant stored under a code, restarting its lifetime.
     */
    public Uni<Void> updateAuthorizationGrant(String code, AuthorizedGrant grant) {
        return storage.set(key(code), grant, StorageOptions.expiresIn(config.lifetime()));
    }

    /**
     * Deletes a code.
     *
     * @return true if the code existed
     */
    public Uni<Boolean> removeAuthorizationCode(String code) {
        return storage.remove(key(code));
    }

    private static String key(String code) {
        return KEY_PREFIX + code;
    }
}
