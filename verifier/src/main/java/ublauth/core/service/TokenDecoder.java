package ublauth.core.service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ublauth.core.model.token.Claims;
import ublauth.core.model.token.DecodedToken;
import ublauth.core.model.token.TokenHeader;
import ublauth.core.model.token.TokenVerificationException;
import ublauth.core.model.token.VerificationFailure;

/**
 * Decodes the compact serialization of a token into its header, claims,
 * signing input and signature.
 *
 * <p>Decoding is purely structural: nothing is verified here, and every
 * failure is reported as {@link VerificationFailure#MALFORMED_TOKEN}.
 */
public class TokenDecoder {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .configure(JsonParser.Feature.STRICT_DUPLICATE_DETECTION, true)
            .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);

    private static final Base64.Decoder BASE64URL = Base64.getUrlDecoder();
    private static final Base64.Encoder BASE64URL_NO_PAD = Base64.getUrlEncoder().withoutPadding();

    private static final Set<String> REGISTERED_CLAIMS = Set.of("sub", "iss", "aud", "exp", "nbf", "iat", "jti", "scope");

    /**
     * Decode a compact token.
     *
     * @param token the token string
     * @return the decoded, unverified token
     * @throws TokenVerificationException with {@code MALFORMED_TOKEN} if the token is not structurally valid
     */
    public DecodedToken decode(String token) {
        if (token == null || token.isBlank()) {
            throw malformed("Token is empty");
        }

        final var segments = token.split("\\.", -1);
        if (segments.length != 3) {
            throw malformed("Token must have 3 segments, found " + segments.length);
        }

        final var header = parseHeader(parseObject(decodeSegment(segments[0], "header"), "header"));
        final var claims = parseClaims(parseObject(decodeSegment(segments[1], "payload"), "payload"));
        final var signature = decodeSegment(segments[2], "signature");
        final var signingInput = (segments[0] + "." + segments[1]).getBytes(StandardCharsets.US_ASCII);

        return new DecodedToken(header, claims, signingInput, signature);
    }

    private byte[] decodeSegment(String segment, String name) {
        if (segment.indexOf('=') >= 0) {
            throw malformed("Padded base64url in " + name + " segment");
        }
        final byte[] decoded;
        try {
            decoded = BASE64URL.decode(segment);
        } catch (IllegalArgumentException e) {
            throw new TokenVerificationException(
                    VerificationFailure.MALFORMED_TOKEN, "Invalid base64url in " + name + " segment", e);
        }
        // The JDK decoder ignores non-zero bits in the final character, so each value must have exactly one spelling
        if (!BASE64URL_NO_PAD.encodeToString(decoded).equals(segment)) {
            throw malformed("Non-canonical base64url in " + name + " segment");
        }
        return decoded;
    }

    private JsonNode parseObject(byte[] json, String name) {
        final JsonNode node;
        try {
            node = OBJECT_MAPPER.readTree(json);
        } catch (IOException e) {
            throw new TokenVerificationException(
                    VerificationFailure.MALFORMED_TOKEN, "Invalid JSON in " + name + " segment", e);
        }
        if (node == null || !node.isObject()) {
            throw malformed("Token " + name + " is not a JSON object");
        }
        return node;
    }

    private TokenHeader parseHeader(JsonNode header) {
        final var alg = header.get("alg");
        if (alg == null || !alg.isTextual()) {
            throw malformed("Header is missing string 'alg'");
        }
        // No JWS extensions are understood, so any critical one must be refused
        if (header.has("crit")) {
            throw malformed("Header declares unsupported critical extensions");
        }
        return new TokenHeader(alg.asText(), optionalString(header, "kid"));
    }

    private Claims parseClaims(JsonNode payload) {
        final var sub = payload.get("sub");
        if (sub == null || !sub.isTextual()) {
            throw malformed("Payload is missing string 'sub'");
        }

        final Map<String, Object> extra = new LinkedHashMap<>();
        final var fields = payload.fields();
        while (fields.hasNext()) {
            final var field = fields.next();
            if (!REGISTERED_CLAIMS.contains(field.getKey())) {
                extra.put(field.getKey(), immutableValue(field.getValue()));
            }
        }

        return new Claims(
                sub.asText(),
                optionalString(payload, "iss"),
                audience(payload.get("aud")),
                numericDate(payload, "exp"),
                numericDate(payload, "nbf"),
                numericDate(payload, "iat"),
                optionalString(payload, "jti"),
                optionalString(payload, "scope"),
                extra);
    }

    private Object immutableValue(JsonNode node) {
        if (node.isObject()) {
            final Map<String, Object> object = new LinkedHashMap<>();
            node.fields().forEachRemaining(field -> object.put(field.getKey(), immutableValue(field.getValue())));
            return Collections.unmodifiableMap(object);
        }
        if (node.isArray()) {
            final List<Object> array = new ArrayList<>(node.size());
            node.forEach(element -> array.add(immutableValue(element)));
            return Collections.unmodifiableList(array);
        }
        return OBJECT_MAPPER.convertValue(node, Object.class);
    }

    private Optional<String> optionalString(JsonNode node, String name) {
        final var value = node.get(name);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        if (!value.isTextual()) {
            throw malformed("'" + name + "' must be a string");
        }
        return Optional.of(value.asText());
    }

    private OptionalLong numericDate(JsonNode node, String name) {
        final var value = node.get(name);
        if (value == null || value.isNull()) {
            return OptionalLong.empty();
        }
        if (!value.isIntegralNumber() || !value.canConvertToLong()) {
            throw malformed("'" + name + "' must be an integer NumericDate");
        }
        return OptionalLong.of(value.longValue());
    }

    private List<String> audience(JsonNode value) {
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (value.isTextual()) {
            return List.of(value.asText());
        }
        if (!value.isArray()) {
            throw malformed("'aud' must be a string or an array of strings");
        }
        final var audience = new ArrayList<String>(value.size());
        for (var element : value) {
            if (!element.isTextual()) {
                throw malformed("'aud' must be a string or an array of strings");
            }
            audience.add(element.asText());
        }
        return audience;
    }

    private static TokenVerificationException malformed(String message) {
        return new TokenVerificationException(VerificationFailure.MALFORMED_TOKEN, message);
    }
}
