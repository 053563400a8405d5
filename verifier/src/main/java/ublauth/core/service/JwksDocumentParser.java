package ublauth.core.service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ublauth.core.model.jwks.Jwk;
import ublauth.core.model.jwks.JwksDocument;
import ublauth.core.model.token.TokenVerificationException;
import ublauth.core.model.token.VerificationFailure;

/**
 * Parses the body of a JWKS endpoint.
 *
 * <p>The document must be an object with a {@code keys} array of objects.
 * Key members that are not strings are treated as absent; such keys are
 * skipped when a signing key is selected.
 */
public class JwksDocumentParser {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .configure(JsonParser.Feature.STRICT_DUPLICATE_DETECTION, true)
            .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);

    /**
     * Parse a JWKS document.
     *
     * @param body the raw response body
     * @return the parsed document
     * @throws TokenVerificationException with {@code JWKS_PARSE_ERROR} if the body is not a key set
     */
    public JwksDocument parse(byte[] body) {
        final JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(body);
        } catch (IOException e) {
            throw new TokenVerificationException(VerificationFailure.JWKS_PARSE_ERROR, "JWKS is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw parseError("JWKS is not a JSON object");
        }

        final var keys = root.get("keys");
        if (keys == null || !keys.isArray()) {
            throw parseError("JWKS is missing the 'keys' array");
        }

        final var parsed = new ArrayList<Jwk>(keys.size());
        for (var key : keys) {
            if (!key.isObject()) {
                throw parseError("JWKS 'keys' must only contain objects");
            }
            parsed.add(new Jwk(member(key, "kid"), member(key, "kty"), member(key, "crv"), member(key, "x")));
        }
        return new JwksDocument(parsed);
    }

    private Optional<String> member(JsonNode key, String name) {
        final var value = key.get(name);
        return value != null && value.isTextual() ? Optional.of(value.asText()) : Optional.empty();
    }

    private static TokenVerificationException parseError(String message) {
        return new TokenVerificationException(VerificationFailure.JWKS_PARSE_ERROR, message);
    }
}
