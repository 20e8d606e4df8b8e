package wattle.core.service.pkce;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import wattle.core.model.grant.CodeChallengeMethods;

@DisplayName("CodeChallengeCalculator")
class CodeChallengeCalculatorTest {

    // RFC 7636 appendix B
    private static final String VERIFIER = "dBjftJeZ4CVP-mB92K27uhbUJU1p1r_wW1gFWFOEjXk";
    private static final String S256_CHALLENGE = "E9Melhoa2OwvFrEMTJguCHaoeK1t8URWbuGJSstw-cM";

    private CodeChallengeCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new CodeChallengeCalculator();
    }

    @Nested
    @DisplayName("calculate()")
    class CalculateTests {

        @Test
        @DisplayName("should return verifier unchanged for plain")
        void shouldReturnVerifierForPlain() {
            assertEquals(VERIFIER, calculator.calculate(CodeChallengeMethods.PLAIN, VERIFIER));
        }

        @Test
        @DisplayName("should compute S256 challenge from RFC 7636 example")
        void shouldComputeS256Challenge() {
            assertEquals(S256_CHALLENGE, calculator.calculate(CodeChallengeMethods.S256, VERIFIER));
        }

        @Test
        @DisplayName("should compute unpadded S512 challenge")
        void shouldComputeUnpaddedS512Challenge() {
            String challenge = calculator.calculate(CodeChallengeMethods.S512, VERIFIER);

            assertEquals(86, challenge.length());
            assertTrue(challenge.matches("^[A-Za-z0-9_-]+$"));
        }

        @Test
        @DisplayName("should reject unknown method")
        void shouldRejectUnknownMethod() {
            assertThrows(IllegalArgumentException.class, () -> calculator.calculate("S1", VERIFIER));
        }
    }

    @Nested
    @DisplayName("matches()")
    class MatchesTests {

        @Test
        @DisplayName("should match case-insensitively")
        void shouldMatchCaseInsensitively() {
            assertTrue(calculator.matches(S256_CHALLENGE.toLowerCase(), CodeChallengeMethods.S256, VERIFIER));
        }

        @Test
        @DisplayName("should not match a different verifier")
        void shouldNotMatchDifferentVerifier() {
            assertFalse(calculator.matches(S256_CHALLENGE, CodeChallengeMethods.S256, VERIFIER + "x"));
        }
    }
}
