package ublauth.core.service;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import ublauth.core.model.token.TokenVerificationException;
import ublauth.core.model.token.VerificationFailure;
import ublauth.support.TestTokens;

@DisplayName("TokenDecoder")
class TokenDecoderTest {

    private static final String HEADER = TestTokens.segment("{\"alg\":\"EdDSA\",\"kid\":\"k1\"}");
    private static final String SIGNATURE = TestTokens.base64Url(new byte[64]);

    private TokenDecoder decoder;

    @BeforeEach
    void setUp() {
        decoder = new TokenDecoder();
    }

    private String token(String header, String payloadJson) {
        return header + "." + TestTokens.segment(payloadJson) + "." + SIGNATURE;
    }

    private VerificationFailure failureOf(String token) {
        return assertThrows(TokenVerificationException.class, () -> decoder.decode(token))
                .failure();
    }

    @Nested
    @DisplayName("well-formed tokens")
    class WellFormedTests {

        @Test
        @DisplayName("should decode header, claims, signature and signing input")
        void shouldDecodeAllParts() {
            final var payload = TestTokens.segment("{\"sub\":\"did:key:z6Mk\",\"iss\":\"https://id.example\","
                    + "\"aud\":\"demo\",\"exp\":1700003600,\"nbf\":1699999995,\"iat\":1700000000,"
                    + "\"jti\":\"abc\",\"scope\":\"read write\"}");
            final var token = HEADER + "." + payload + "." + SIGNATURE;

            final var decoded = decoder.decode(token);

            assertEquals("EdDSA", decoded.header().algorithm());
            assertEquals(Optional.of("k1"), decoded.header().keyId());
            assertEquals("did:key:z6Mk", decoded.claims().subject());
            assertEquals(Optional.of("https://id.example"), decoded.claims().issuer());
            assertEquals(List.of("demo"), decoded.claims().audience());
            assertEquals(1700003600L, decoded.claims().expiresAt().getAsLong());
            assertEquals(1699999995L, decoded.claims().notBefore().getAsLong());
            assertEquals(1700000000L, decoded.claims().issuedAt().getAsLong());
            assertEquals(Optional.of("abc"), decoded.claims().jwtId());
            assertEquals(Optional.of("read write"), decoded.claims().scope());
            assertArrayEquals(new byte[64], decoded.signature());
            assertArrayEquals((HEADER + "." + payload).getBytes(StandardCharsets.US_ASCII), decoded.signingInput());
        }

        @Test
        @DisplayName("should pass unrecognized claims through in document order")
        void shouldKeepExtraClaimsInOrder() {
            final var decoded = decoder.decode(
                    token(HEADER, "{\"zeta\":1,\"sub\":\"did:web:x\",\"alpha\":{\"nested\":true},\"mid\":null}"));

            final var extra = decoded.claims().extra();
            assertEquals(List.of("zeta", "alpha", "mid"), List.copyOf(extra.keySet()));
            assertEquals(1, extra.get("zeta"));
            assertEquals(Map.of("nested", true), extra.get("alpha"));
            assertTrue(extra.containsKey("mid"));
        }

        @Test
        @DisplayName("should make nested extra claims read-only")
        void shouldFreezeNestedExtraClaims() {
            final var decoded = decoder.decode(
                    token(HEADER, "{\"sub\":\"did:web:x\",\"ctx\":{\"roles\":[\"a\",{\"b\":1}]}}"));

            @SuppressWarnings("unchecked")
            final var ctx = (Map<String, Object>) decoded.claims().extra().get("ctx");
            @SuppressWarnings("unchecked")
            final var roles = (List<Object>) ctx.get("roles");
            @SuppressWarnings("unchecked")
            final var inner = (Map<String, Object>) roles.get(1);

            assertEquals(List.of("a", Map.of("b", 1)), roles);
            assertThrows(UnsupportedOperationException.class, () -> ctx.put("admin", true));
            assertThrows(UnsupportedOperationException.class, () -> roles.add("root"));
            assertThrows(UnsupportedOperationException.class, () -> inner.put("b", 2));
        }

        @Test
        @DisplayName("should accept an audience array")
        void shouldAcceptAudienceArray() {
            final var decoded = decoder.decode(token(HEADER, "{\"sub\":\"did:web:x\",\"aud\":[\"a\",\"b\"]}"));

            assertEquals(List.of("a", "b"), decoded.claims().audience());
        }

        @Test
        @DisplayName("should treat null optional claims as absent")
        void shouldTreatNullAsAbsent() {
            final var decoded =
                    decoder.decode(token(HEADER, "{\"sub\":\"did:web:x\",\"exp\":null,\"iss\":null,\"aud\":null}"));

            assertTrue(decoded.claims().expiresAt().isEmpty());
            assertTrue(decoded.claims().issuer().isEmpty());
            assertTrue(decoded.claims().audience().isEmpty());
        }

        @Test
        @DisplayName("should allow a header without kid")
        void shouldAllowMissingKid() {
            final var decoded = decoder.decode(token(TestTokens.segment("{\"alg\":\"EdDSA\"}"), "{\"sub\":\"did:x\"}"));

            assertTrue(decoded.header().keyId().isEmpty());
        }

        @Test
        @DisplayName("should decode a header with a non-EdDSA algorithm so it can be rejected later")
        void shouldDecodeOtherAlgorithms() {
            final var decoded = decoder.decode(token(TestTokens.segment("{\"alg\":\"none\"}"), "{\"sub\":\"did:x\"}"));

            assertEquals("none", decoded.header().algorithm());
        }
    }

    @Nested
    @DisplayName("malformed tokens")
    class MalformedTests {

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "abc", "a.b", "a.b.c.d", "a..b.c"})
        @DisplayName("should reject wrong segment counts and empty input")
        void shouldRejectWrongShape(String token) {
            assertEquals(VerificationFailure.MALFORMED_TOKEN, failureOf(token));
        }

        @Test
        @DisplayName("should reject null")
        void shouldRejectNull() {
            assertEquals(VerificationFailure.MALFORMED_TOKEN, failureOf(null));
        }

        @Test
        @DisplayName("should reject characters outside the base64url alphabet")
        void shouldRejectInvalidBase64() {
            assertEquals(VerificationFailure.MALFORMED_TOKEN, failureOf("e+/." + TestTokens.segment("{}") + "." + SIGNATURE));
        }

        @Test
        @DisplayName("should reject padded segments")
        void shouldRejectPadding() {
            final var padded = Base64.getUrlEncoder()
                    .encodeToString("{\"alg\":\"EdDSA\",\"kid\":\"k\"}".getBytes(StandardCharsets.UTF_8));
            assertTrue(padded.endsWith("="));
            assertEquals(VerificationFailure.MALFORMED_TOKEN, failureOf(token(padded, "{\"sub\":\"did:x\"}")));
        }

        @Test
        @DisplayName("should reject a header that is not JSON")
        void shouldRejectNonJsonHeader() {
            assertEquals(VerificationFailure.MALFORMED_TOKEN, failureOf(token(TestTokens.segment("not json"), "{\"sub\":\"did:x\"}")));
        }

        @Test
        @DisplayName("should reject a payload that is a JSON array")
        void shouldRejectArrayPayload() {
            assertEquals(VerificationFailure.MALFORMED_TOKEN, failureOf(token(HEADER, "[\"did:x\"]")));
        }

        @Test
        @DisplayName("should reject duplicate claim names")
        void shouldRejectDuplicateMembers() {
            assertEquals(
                    VerificationFailure.MALFORMED_TOKEN,
                    failureOf(token(HEADER, "{\"sub\":\"did:a\",\"sub\":\"did:b\"}")));
        }

        @Test
        @DisplayName("should reject trailing content after the JSON object")
        void shouldRejectTrailingContent() {
            assertEquals(VerificationFailure.MALFORMED_TOKEN, failureOf(token(HEADER, "{\"sub\":\"did:a\"} {}")));
        }

        @Test
        @DisplayName("should reject a header without alg")
        void shouldRejectMissingAlg() {
            assertEquals(VerificationFailure.MALFORMED_TOKEN, failureOf(token(TestTokens.segment("{\"kid\":\"k1\"}"), "{\"sub\":\"did:x\"}")));
        }

        @Test
        @DisplayName("should reject a non-string alg")
        void shouldRejectNonStringAlg() {
            assertEquals(VerificationFailure.MALFORMED_TOKEN, failureOf(token(TestTokens.segment("{\"alg\":1}"), "{\"sub\":\"did:x\"}")));
        }

        @Test
        @DisplayName("should reject a non-string kid")
        void shouldRejectNonStringKid() {
            assertEquals(
                    VerificationFailure.MALFORMED_TOKEN,
                    failureOf(token(TestTokens.segment("{\"alg\":\"EdDSA\",\"kid\":7}"), "{\"sub\":\"did:x\"}")));
        }

        @Test
        @DisplayName("should reject critical header extensions")
        void shouldRejectCrit() {
            assertEquals(
                    VerificationFailure.MALFORMED_TOKEN,
                    failureOf(token(TestTokens.segment("{\"alg\":\"EdDSA\",\"crit\":[\"b64\"],\"b64\":false}"), "{\"sub\":\"did:x\"}")));
        }

        @Test
        @DisplayName("should reject a payload without sub")
        void shouldRejectMissingSubject() {
            assertEquals(VerificationFailure.MALFORMED_TOKEN, failureOf(token(HEADER, "{\"iss\":\"x\"}")));
        }

        @ParameterizedTest
        @ValueSource(strings = {"\"1700000000\"", "1.5", "true", "123456789012345678901234567890"})
        @DisplayName("should reject exp that is not an integral 64-bit number")
        void shouldRejectNonIntegerExp(String exp) {
            assertEquals(VerificationFailure.MALFORMED_TOKEN, failureOf(token(HEADER, "{\"sub\":\"did:x\",\"exp\":" + exp + "}")));
        }

        @ParameterizedTest
        @ValueSource(strings = {"1", "{}", "[\"a\",2]"})
        @DisplayName("should reject aud that is neither a string nor an array of strings")
        void shouldRejectInvalidAudience(String aud) {
            assertEquals(VerificationFailure.MALFORMED_TOKEN, failureOf(token(HEADER, "{\"sub\":\"did:x\",\"aud\":" + aud + "}")));
        }

        @Test
        @DisplayName("should reject a signature segment that is not base64url")
        void shouldRejectInvalidSignatureEncoding() {
            final var token = HEADER + "." + TestTokens.segment("{\"sub\":\"did:x\"}") + ".***";
            assertEquals(VerificationFailure.MALFORMED_TOKEN, failureOf(token));
        }

        @Test
        @DisplayName("should reject a signature segment whose last character carries non-zero unused bits")
        void shouldRejectNonCanonicalSignature() {
            // 64 bytes leave 4 unused bits in the last of 86 characters, so 'A' and 'B' decode alike
            final var sibling = SIGNATURE.substring(0, SIGNATURE.length() - 1) + "B";
            assertArrayEquals(Base64.getUrlDecoder().decode(SIGNATURE), Base64.getUrlDecoder().decode(sibling));

            final var token = HEADER + "." + TestTokens.segment("{\"sub\":\"did:x\"}") + "." + sibling;

            assertEquals(VerificationFailure.MALFORMED_TOKEN, failureOf(token));
        }

        @Test
        @DisplayName("should reject a header segment with non-zero unused bits")
        void shouldRejectNonCanonicalHeader() {
            // '{"alg":"EdDSA"}' is 15 bytes, a whole number of groups, so pad it to 16 with a space
            final var header = TestTokens.segment("{\"alg\":\"EdDSA\"} ");
            final var last = header.charAt(header.length() - 1);
            final var sibling = header.substring(0, header.length() - 1) + (char) (last + 1);
            assertArrayEquals(Base64.getUrlDecoder().decode(header), Base64.getUrlDecoder().decode(sibling));

            assertEquals(VerificationFailure.MALFORMED_TOKEN, failureOf(token(sibling, "{\"sub\":\"did:x\"}")));
        }
    }
}
