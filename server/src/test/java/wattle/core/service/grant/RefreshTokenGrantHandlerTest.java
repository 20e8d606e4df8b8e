package wattle.core.service.grant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.jose4j.jwt.JwtClaims;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import wattle.adapter.out.auth.ConfigSigningKeyProvider;
import wattle.adapter.out.auth.Jose4jJsonWebTokenValidator;
import wattle.adapter.out.auth.RsaJsonWebTokenSigner;
import wattle.adapter.out.storage.StorageTokenRegistry;
import wattle.adapter.out.storage.memory.InMemoryEntityStorage;
import wattle.core.config.TokenConfig;
import wattle.core.model.common.ErrorCodes;
import wattle.core.model.common.GrantTypes;
import wattle.core.model.common.OidcError;
import wattle.core.model.common.Result;
import wattle.core.model.grant.AuthSession;
import wattle.core.model.grant.AuthorizationContext;
import wattle.core.model.grant.AuthorizedGrant;
import wattle.core.model.grant.TokenRequest;
import wattle.core.model.jwt.JwtTypes;
import wattle.core.model.jwt.TokenStatus;
import wattle.core.service.common.InvalidRequestException;
import wattle.core.service.token.RefreshTokenService;
import wattle.testing.MutableClock;
import wattle.testing.TestGrants;
import wattle.testing.TestJwts;

@DisplayName("RefreshTokenGrantHandler")
class RefreshTokenGrantHandlerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final String ISSUER = "https://auth.example.com";

    private MutableClock clock;
    private InMemoryEntityStorage storage;
    private StorageTokenRegistry tokenRegistry;
    private ConfigSigningKeyProvider keyProvider;
    private RefreshTokenService refreshTokenService;
    private RefreshTokenGrantHandler handler;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        storage = new InMemoryEntityStorage(clock);
        tokenRegistry = new StorageTokenRegistry(storage);

        TokenConfig config = tokenConfig(ISSUER);
        keyProvider = new ConfigSigningKeyProvider(config);
        var signer = new RsaJsonWebTokenSigner(keyProvider);
        refreshTokenService = new RefreshTokenService(config, signer, tokenRegistry, clock);
        handler = new RefreshTokenGrantHandler(
                new Jose4jJsonWebTokenValidator(clock), keyProvider, refreshTokenService, tokenRegistry, config);
    }

    @AfterEach
    void tearDown() {
        storage.shutdown();
    }

    private static TokenConfig tokenConfig(String issuer) {
        TokenConfig config = mock(TokenConfig.class);
        when(config.issuer()).thenReturn(issuer);
        when(config.signingKey()).thenReturn(Optional.empty());
        when(config.keyId()).thenReturn("test-key");
        when(config.refreshTokenLifetime()).thenReturn(Duration.ofDays(30));
        when(config.clockSkew()).thenReturn(Duration.ofSeconds(30));
        return config;
    }

    private static AuthorizedGrant grant() {
        var session = new AuthSession(
                "alice",
                "session-1",
                Instant.parse("2023-12-31T23:00:00Z"),
                "local",
                Set.of("c1"),
                "urn:acr:mfa",
                List.of("pwd", "otp"));
        var context = AuthorizationContext.of("c1", List.of("openid", "offline_access"))
                .withResources(List.of(URI.create("https://api.example.com")));
        return new AuthorizedGrant(session, context);
    }

    private Result<AuthorizedGrant, OidcError> redeem(String refreshToken, String clientId) {
        var request = TokenRequest.builder(GrantTypes.REFRESH_TOKEN)
                .refreshToken(refreshToken)
                .build();
        return handler.authorize(request, TestGrants.client(clientId, GrantTypes.REFRESH_TOKEN))
                .await()
                .atMost(TIMEOUT);
    }

    @Test
    @DisplayName("should restore the grant a refresh token was issued for")
    void shouldRestoreGrant() {
        var issued = refreshTokenService.createRefreshToken(grant()).await().atMost(TIMEOUT);

        var restored = redeem(issued.value(), "c1").getSuccess();

        var session = restored.authSession();
        assertEquals("alice", session.subject());
        assertEquals("session-1", session.sessionId());
        assertEquals(Instant.parse("2023-12-31T23:00:00Z"), session.authenticationTime());
        assertEquals("local", session.identityProvider());
        assertEquals("urn:acr:mfa", session.authContextClassRef());
        assertEquals(List.of("pwd", "otp"), session.authenticationMethods());
        assertEquals(List.of("openid", "offline_access"), restored.context().scope());
        assertEquals(List.of(URI.create("https://api.example.com")), restored.context().resources());
    }

    @Test
    @DisplayName("should register issued tokens as active")
    void shouldRegisterIssuedTokensAsActive() {
        var issued = refreshTokenService.createRefreshToken(grant()).await().atMost(TIMEOUT);

        assertNotNull(issued.info().jwtId());
        assertEquals(
                Optional.of(TokenStatus.ACTIVE),
                tokenRegistry.getStatus(issued.info().jwtId()).await().atMost(TIMEOUT));
    }

    @Nested
    @DisplayName("rejections")
    class RejectionTests {

        @Test
        @DisplayName("should reject a token issued to another client")
        void shouldRejectAnotherClient() {
            var issued = refreshTokenService.createRefreshToken(grant()).await().atMost(TIMEOUT);

            assertEquals(ErrorCodes.INVALID_GRANT, redeem(issued.value(), "c2").getFailure().error());
        }

        @Test
        @DisplayName("should reject a revoked token")
        void shouldRejectRevokedToken() {
            var issued = refreshTokenService.createRefreshToken(grant()).await().atMost(TIMEOUT);
            tokenRegistry.setStatus(issued.info().jwtId(), TokenStatus.REVOKED, issued.info().expiresAt())
                    .await()
                    .atMost(TIMEOUT);

            assertEquals(ErrorCodes.INVALID_GRANT, redeem(issued.value(), "c1").getFailure().error());
        }

        @Test
        @DisplayName("should reject an expired token")
        void shouldRejectExpiredToken() {
            var issued = refreshTokenService.createRefreshToken(grant()).await().atMost(TIMEOUT);
            clock.advance(Duration.ofDays(31));

            assertEquals(ErrorCodes.INVALID_GRANT, redeem(issued.value(), "c1").getFailure().error());
        }

        @Test
        @DisplayName("should reject a token from another issuer")
        void shouldRejectAnotherIssuer() {
            var foreignService = new RefreshTokenService(
                    tokenConfig("https://elsewhere.example.com"),
                    new RsaJsonWebTokenSigner(keyProvider),
                    tokenRegistry,
                    clock);
            var issued = foreignService.createRefreshToken(grant()).await().atMost(TIMEOUT);

            assertEquals(ErrorCodes.INVALID_GRANT, redeem(issued.value(), "c1").getFailure().error());
        }

        @Test
        @DisplayName("should reject a token that is not a refresh token")
        void shouldRejectOtherTokenType() {
            var claims = new JwtClaims();
            claims.setIssuer(ISSUER);
            claims.setSubject("alice");
            claims.setExpirationTime(TestJwts.at(clock.instant().plus(Duration.ofMinutes(5))));
            claims.setClaim("client_id", "c1");
            String accessToken = TestJwts.sign(keyProvider.currentSigningKey(), claims, JwtTypes.ACCESS_TOKEN);

            assertEquals(ErrorCodes.INVALID_GRANT, redeem(accessToken, "c1").getFailure().error());
        }

        @Test
        @DisplayName("should reject garbage")
        void shouldRejectGarbage() {
            assertEquals(ErrorCodes.INVALID_GRANT, redeem("garbage", "c1").getFailure().error());
        }

        @Test
        @DisplayName("should require the refresh_token parameter")
        void shouldRequireRefreshToken() {
            assertThrows(InvalidRequestException.class, () -> redeem(null, "c1"));
        }
    }
}
