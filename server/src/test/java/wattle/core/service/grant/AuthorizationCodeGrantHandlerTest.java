package wattle.core.service.grant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import wattle.adapter.out.storage.memory.InMemoryEntityStorage;
import wattle.core.config.AuthorizationCodeConfig;
import wattle.core.model.common.ErrorCodes;
import wattle.core.model.common.GrantTypes;
import wattle.core.model.common.OidcError;
import wattle.core.model.common.Result;
import wattle.core.model.grant.AuthorizationContext;
import wattle.core.model.grant.AuthorizedGrant;
import wattle.core.model.grant.CodeChallengeMethods;
import wattle.core.model.grant.TokenRequest;
import wattle.core.service.authcode.AuthorizationCodeService;
import wattle.core.service.common.InvalidRequestException;
import wattle.core.service.common.RandomValueGenerator;
import wattle.core.service.pkce.CodeChallengeCalculator;
import wattle.testing.MutableClock;
import wattle.testing.TestGrants;

@DisplayName("AuthorizationCodeGrantHandler")
class AuthorizationCodeGrantHandlerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final String VERIFIER = "dBjftJeZ4CVP-mB92K27uhbUJU1p1r_wW1gFWFOEjXk";
    private static final String S256_CHALLENGE = "E9Melhoa2OwvFrEMTJguCHaoeK1t8URWbuGJSstw-cM";

    private InMemoryEntityStorage storage;
    private AuthorizationCodeService codeService;
    private AuthorizationCodeGrantHandler handler;

    @BeforeEach
    void setUp() {
        storage = new InMemoryEntityStorage(MutableClock.startingAt("2024-01-01T00:00:00Z"));
        AuthorizationCodeConfig config = mock(AuthorizationCodeConfig.class);
        when(config.lifetime()).thenReturn(Duration.ofMinutes(1));
        when(config.length()).thenReturn(32);
        codeService = new AuthorizationCodeService(storage, config, new RandomValueGenerator());
        handler = new AuthorizationCodeGrantHandler(codeService, new CodeChallengeCalculator());
    }

    @AfterEach
    void tearDown() {
        storage.shutdown();
    }

    private String issueCode(AuthorizationContext context) {
        var grant = new AuthorizedGrant(TestGrants.session("alice", context.clientId()), context);
        return codeService.generateAuthorizationCode(grant).await().atMost(TIMEOUT);
    }

    private Result<AuthorizedGrant, OidcError> redeem(String code, String verifier, String clientId) {
        var request = TokenRequest.builder(GrantTypes.AUTHORIZATION_CODE)
                .code(code)
                .codeVerifier(verifier)
                .build();
        return handler.authorize(request, TestGrants.client(clientId, GrantTypes.AUTHORIZATION_CODE))
                .await()
                .atMost(TIMEOUT);
    }

    @Nested
    @DisplayName("PKCE")
    class PkceTests {

        @Test
        @DisplayName("should accept the RFC 7636 S256 verifier")
        void shouldAcceptS256Verifier() {
            String code = issueCode(AuthorizationContext.of("c1", List.of("openid"))
                    .withCodeChallenge(S256_CHALLENGE, CodeChallengeMethods.S256));

            var result = redeem(code, VERIFIER, "c1");

            assertTrue(result.isSuccess());
            assertEquals("alice", result.getSuccess().authSession().subject());
        }

        @Test
        @DisplayName("should reject a wrong verifier")
        void shouldRejectWrongVerifier() {
            String code = issueCode(AuthorizationContext.of("c1", List.of("openid"))
                    .withCodeChallenge(S256_CHALLENGE, CodeChallengeMethods.S256));

            var result = redeem(code, "wrong-verifier", "c1");

            assertEquals(ErrorCodes.INVALID_GRANT, result.getFailure().error());
        }

        @Test
        @DisplayName("should require a verifier when a challenge was registered")
        void shouldRequireVerifier() {
            String code = issueCode(AuthorizationContext.of("c1", List.of("openid"))
                    .withCodeChallenge(S256_CHALLENGE, CodeChallengeMethods.S256));

            var result = redeem(code, null, "c1");

            assertEquals(ErrorCodes.INVALID_GRANT, result.getFailure().error());
            assertEquals("Code verifier is required", result.getFailure().errorDescription());
        }

        @Test
        @DisplayName("should default to the plain method")
        void shouldDefaultToPlainMethod() {
            String code = issueCode(AuthorizationContext.of("c1", List.of()).withCodeChallenge("abc", null));

            assertTrue(redeem(code, "abc", "c1").isSuccess());
        }

        @Test
        @DisplayName("should fail on an unknown challenge method")
        void shouldFailOnUnknownMethod() {
            String code = issueCode(AuthorizationContext.of("c1", List.of()).withCodeChallenge("abc", "S1"));

            assertThrows(IllegalArgumentException.class, () -> redeem(code, "abc", "c1"));
        }
    }

    @Test
    @DisplayName("should reject an unknown code")
    void shouldRejectUnknownCode() {
        var result = redeem("no-such-code", null, "c1");

        assertEquals(ErrorCodes.INVALID_GRANT, result.getFailure().error());
    }

    @Test
    @DisplayName("should reject a code issued to another client")
    void shouldRejectCodeOfAnotherClient() {
        String code = issueCode(AuthorizationContext.of("c1", List.of("openid")));

        var result = redeem(code, null, "c2");

        assertEquals(ErrorCodes.UNAUTHORIZED_CLIENT, result.getFailure().error());
    }

    @Test
    @DisplayName("should require the code parameter")
    void shouldRequireCode() {
        assertThrows(InvalidRequestException.class, () -> redeem(null, null, "c1"));
    }
}
