package wattle.core.service.grant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import io.smallrye.mutiny.Uni;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.RsaJsonWebKey;
import org.jose4j.jwt.JwtClaims;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import wattle.adapter.out.auth.Jose4jJsonWebTokenValidator;
import wattle.adapter.out.storage.StorageJwtReplayCache;
import wattle.adapter.out.storage.memory.InMemoryEntityStorage;
import wattle.core.config.EndpointConfig;
import wattle.core.config.JwtBearerConfig;
import wattle.core.model.client.ClientInfo;
import wattle.core.model.common.ErrorCodes;
import wattle.core.model.common.GrantTypes;
import wattle.core.model.common.OidcError;
import wattle.core.model.common.Result;
import wattle.core.model.grant.AuthorizedGrant;
import wattle.core.model.grant.TokenRequest;
import wattle.core.model.jwt.TrustedIssuer;
import wattle.core.port.out.GrantMetrics;
import wattle.core.port.out.JwksCache;
import wattle.core.port.out.RequestInfoProvider;
import wattle.core.service.common.InvalidRequestException;
import wattle.core.service.common.RandomValueGenerator;
import wattle.core.service.jwtbearer.JwtBearerIssuerProvider;
import wattle.testing.MutableClock;
import wattle.testing.TestGrants;
import wattle.testing.TestJwts;

@DisplayName("JwtBearerGrantHandler")
class JwtBearerGrantHandlerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final String ISSUER = "https://idp.example.com";
    private static final URI JWKS_URI = URI.create("https://idp.example.com/jwks");
    private static final String TOKEN_ENDPOINT = "https://auth.example.com/connect/token";

    private static RsaJsonWebKey issuerKey;

    private MutableClock clock;
    private InMemoryEntityStorage storage;
    private JwksCache jwksCache;
    private JwtBearerConfig config;
    private GrantMetrics metrics;
    private StorageJwtReplayCache replayCache;
    private ClientInfo client;
    private int jtiCounter;

    @BeforeAll
    static void generateKeys() {
        issuerKey = TestJwts.rsaKey("idp-1");
    }

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        storage = new InMemoryEntityStorage(clock);

        jwksCache = mock(JwksCache.class);
        when(jwksCache.getSigningKeys(eq(JWKS_URI), any()))
                .thenReturn(Uni.createFrom().item(List.<JsonWebKey>of(issuerKey)));

        config = mock(JwtBearerConfig.class);
        when(config.clockSkew()).thenReturn(Duration.ofMinutes(5));
        when(config.requireJti()).thenReturn(true);
        when(config.maxJwtSize()).thenReturn(8192);
        when(config.strictAudienceValidation()).thenReturn(true);
        when(config.maxJwtAge()).thenReturn(Optional.empty());
        when(config.allowedTokenTypes()).thenReturn(Optional.empty());
        when(config.defaultAllowedAlgorithms()).thenReturn(List.of("RS256", "ES256", "PS256"));

        metrics = mock(GrantMetrics.class);
        replayCache = new StorageJwtReplayCache(storage, config, clock);
        client = TestGrants.client("service-a", GrantTypes.JWT_BEARER);
    }

    @AfterEach
    void tearDown() {
        storage.shutdown();
    }

    private JwtBearerGrantHandler handler(TrustedIssuer... issuers) {
        RequestInfoProvider requestInfo = mock(RequestInfoProvider.class);
        when(requestInfo.applicationUri()).thenReturn(URI.create("https://auth.example.com/"));
        when(requestInfo.remoteIpAddress()).thenReturn("10.0.0.1");
        EndpointConfig endpointConfig = mock(EndpointConfig.class);
        when(endpointConfig.tokenPath()).thenReturn("/connect/token");

        return new JwtBearerGrantHandler(
                new Jose4jJsonWebTokenValidator(clock),
                new JwtBearerIssuerProvider(List.of(issuers), jwksCache),
                replayCache,
                requestInfo,
                new RandomValueGenerator(),
                metrics,
                config,
                endpointConfig,
                clock);
    }

    private static TrustedIssuer trusted() {
        return new TrustedIssuer(ISSUER, JWKS_URI, Set.of(), Set.of());
    }

    private JwtClaims claims() {
        var claims = new JwtClaims();
        claims.setIssuer(ISSUER);
        claims.setSubject("alice");
        claims.setAudience(TOKEN_ENDPOINT);
        claims.setJwtId("jti-" + (++jtiCounter));
        claims.setIssuedAt(TestJwts.at(clock.instant()));
        claims.setExpirationTime(TestJwts.at(clock.instant().plus(Duration.ofMinutes(5))));
        return claims;
    }

    private Result<AuthorizedGrant, OidcError> authorize(
            JwtBearerGrantHandler handler, String assertion, List<String> scope) {
        var request = TokenRequest.builder(GrantTypes.JWT_BEARER)
                .assertion(assertion)
                .scope(scope)
                .build();
        return handler.authorize(request, client).await().atMost(TIMEOUT);
    }

    @Test
    @DisplayName("should grant a valid assertion with a fresh session for the requester")
    void shouldGrantValidAssertion() {
        String assertion = TestJwts.sign(issuerKey, claims(), null);

        var result = authorize(handler(trusted()), assertion, List.of("api"));

        var grant = result.getSuccess();
        assertEquals("alice", grant.authSession().subject());
        assertEquals(ISSUER, grant.authSession().identityProvider());
        assertEquals(Set.of("service-a"), grant.authSession().affectedClientIds());
        assertEquals(clock.instant(), grant.authSession().authenticationTime());
        assertEquals("service-a", grant.context().clientId());
        assertEquals(List.of("api"), grant.context().scope());
    }

    @Nested
    @DisplayName("replay protection")
    class ReplayTests {

        @Test
        @DisplayName("should reject the second use of a jti and accept a fresh one")
        void shouldRejectReplayedJti() {
            var handler = handler(trusted());
            String assertion = TestJwts.sign(issuerKey, claims(), null);

            var first = authorize(handler, assertion, List.of());
            var second = authorize(handler, assertion, List.of());
            var fresh = authorize(handler, TestJwts.sign(issuerKey, claims(), null), List.of());

            assertTrue(first.isSuccess());
            assertEquals(ErrorCodes.INVALID_GRANT, second.getFailure().error());
            assertTrue(fresh.isSuccess());
            verify(metrics).recordReplayDetected(ISSUER);
        }

        @Test
        @DisplayName("should require a jti")
        void shouldRequireJti() {
            var claims = claims();
            claims.unsetClaim("jti");

            var result = authorize(handler(trusted()), TestJwts.sign(issuerKey, claims, null), List.of());

            assertEquals(ErrorCodes.INVALID_GRANT, result.getFailure().error());
        }
    }

    @Test
    @DisplayName("should reject an untrusted issuer before algorithm and replay checks")
    void shouldRejectUntrustedIssuerFirst() {
        var claims = claims();
        claims.setIssuer("https://evil.example.com");
        String assertion = TestJwts.sign(issuerKey, claims, null);

        var result = authorize(handler(trusted()), assertion, List.of());

        assertEquals(ErrorCodes.INVALID_GRANT, result.getFailure().error());
        assertFalse(replayCache.isReplayed(claims.getClaimValueAsString("jti")).await().atMost(TIMEOUT));
        verify(jwksCache, never()).getSigningKeys(any(), any());
    }

    @Nested
    @DisplayName("audience")
    class AudienceTests {

        @Test
        @DisplayName("should reject the application URI in strict mode")
        void shouldRejectApplicationUriInStrictMode() {
            var claims = claims();
            claims.setAudience("https://auth.example.com/");

            var result = authorize(handler(trusted()), TestJwts.sign(issuerKey, claims, null), List.of());

            assertEquals(ErrorCodes.INVALID_GRANT, result.getFailure().error());
        }

        @Test
        @DisplayName("should accept the application URI in permissive mode")
        void shouldAcceptApplicationUriInPermissiveMode() {
            when(config.strictAudienceValidation()).thenReturn(false);
            var claims = claims();
            claims.setAudience("https://AUTH.example.com:443");

            var result = authorize(handler(trusted()), TestJwts.sign(issuerKey, claims, null), List.of());

            assertTrue(result.isSuccess());
        }

        @Test
        @DisplayName("should ignore a trailing slash on the token endpoint")
        void shouldIgnoreTrailingSlash() {
            var claims = claims();
            claims.setAudience(TOKEN_ENDPOINT + "/");

            assertTrue(authorize(handler(trusted()), TestJwts.sign(issuerKey, claims, null), List.of())
                    .isSuccess());
        }
    }

    @Nested
    @DisplayName("issuer restrictions")
    class IssuerRestrictionTests {

        @Test
        @DisplayName("should reject an algorithm the issuer does not allow")
        void shouldRejectDisallowedAlgorithm() {
            var issuer = new TrustedIssuer(ISSUER, JWKS_URI, Set.of("ES256"), Set.of());

            var result = authorize(handler(issuer), TestJwts.sign(issuerKey, claims(), null), List.of());

            assertEquals(ErrorCodes.INVALID_GRANT, result.getFailure().error());
        }

        @Test
        @DisplayName("should list scopes the issuer may not request")
        void shouldRejectDisallowedScopes() {
            var issuer = new TrustedIssuer(ISSUER, JWKS_URI, Set.of(), Set.of("read"));

            var result =
                    authorize(handler(issuer), TestJwts.sign(issuerKey, claims(), null), List.of("read", "admin"));

            assertEquals(ErrorCodes.INVALID_SCOPE, result.getFailure().error());
            assertTrue(result.getFailure().errorDescription().contains("admin"));
            assertFalse(result.getFailure().errorDescription().contains("read"));
        }
    }

    @Nested
    @DisplayName("token shape")
    class TokenShapeTests {

        @Test
        @DisplayName("should reject an oversized assertion")
        void shouldRejectOversizedAssertion() {
            when(config.maxJwtSize()).thenReturn(100);

            var result = authorize(handler(trusted()), TestJwts.sign(issuerKey, claims(), null), List.of());

            assertEquals(ErrorCodes.INVALID_GRANT, result.getFailure().error());
            verify(jwksCache, never()).getSigningKeys(any(), any());
        }

        @Test
        @DisplayName("should reject a typ outside the allow-list")
        void shouldRejectDisallowedType() {
            when(config.allowedTokenTypes()).thenReturn(Optional.of(List.of("JWT")));

            var rejected = authorize(handler(trusted()), TestJwts.sign(issuerKey, claims(), "at+jwt"), List.of());
            var accepted = authorize(handler(trusted()), TestJwts.sign(issuerKey, claims(), "jwt"), List.of());

            assertEquals(ErrorCodes.INVALID_GRANT, rejected.getFailure().error());
            assertTrue(accepted.isSuccess());
        }

        @Test
        @DisplayName("should reject an assertion older than the maximum age")
        void shouldRejectOldAssertion() {
            when(config.maxJwtAge()).thenReturn(Optional.of(Duration.ofMinutes(1)));
            var claims = claims();
            claims.setIssuedAt(TestJwts.at(clock.instant().minus(Duration.ofMinutes(7))));

            var result = authorize(handler(trusted()), TestJwts.sign(issuerKey, claims, null), List.of());

            assertEquals(ErrorCodes.INVALID_GRANT, result.getFailure().error());
        }

        @Test
        @DisplayName("should require the assertion parameter")
        void shouldRequireAssertion() {
            assertThrows(InvalidRequestException.class, () -> authorize(handler(trusted()), null, List.of()));
        }
    }
}
