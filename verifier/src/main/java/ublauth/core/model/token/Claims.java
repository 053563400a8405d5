package ublauth.core.model.token;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Payload of a token, split into the claims the verifier understands and an
 * ordered pass-through map of everything else.
 *
 * <p>Time claims are NumericDate values in seconds since the epoch. A single
 * string {@code aud} is represented as a one-element list.
 *
 * @param subject   the {@code sub} claim
 * @param issuer    the {@code iss} claim
 * @param audience  the {@code aud} claim values, empty when absent
 * @param expiresAt the {@code exp} claim
 * @param notBefore the {@code nbf} claim
 * @param issuedAt  the {@code iat} claim
 * @param jwtId     the {@code jti} claim
 * @param scope     the {@code scope} claim
 * @param extra     all unrecognized claims, in document order
 */
public record Claims(
        String subject,
        Optional<String> issuer,
        List<String> audience,
        OptionalLong expiresAt,
        OptionalLong notBefore,
        OptionalLong issuedAt,
        Optional<String> jwtId,
        Optional<String> scope,
        Map<String, Object> extra) {

    public static final String DID_PREFIX = "did:";

    public Claims {
        if (subject == null) {
            throw new IllegalArgumentException("Subject cannot be null");
        }
        issuer = issuer == null ? Optional.empty() : issuer;
        audience = audience == null ? List.of() : List.copyOf(audience);
        expiresAt = expiresAt == null ? OptionalLong.empty() : expiresAt;
        notBefore = notBefore == null ? OptionalLong.empty() : notBefore;
        issuedAt = issuedAt == null ? OptionalLong.empty() : issuedAt;
        jwtId = jwtId == null ? Optional.empty() : jwtId;
        scope = scope == null ? Optional.empty() : scope;
        // Keeps document order and null values
        extra = extra == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
    }

    public boolean hasDidSubject() {
        return subject.startsWith(DID_PREFIX);
    }

    public static Builder builder(String subject) {
        return new Builder(subject);
    }

    public static class Builder {
        private final String subject;
        private String issuer;
        private List<String> audience = List.of();
        private Long expiresAt;
        private Long notBefore;
        private Long issuedAt;
        private String jwtId;
        private String scope;
        private final Map<String, Object> extra = new LinkedHashMap<>();

        private Builder(String subject) {
            this.subject = subject;
        }

        public Builder issuer(String issuer) {
            this.issuer = issuer;
            return this;
        }

        public Builder audience(List<String> audience) {
            this.audience = audience;
            return this;
        }

        public Builder expiresAt(Long expiresAt) {
            this.expiresAt = expiresAt;
            return this;
        }

        public Builder notBefore(Long notBefore) {
            this.notBefore = notBefore;
            return this;
        }

        public Builder issuedAt(Long issuedAt) {
            this.issuedAt = issuedAt;
            return this;
        }

        public Builder jwtId(String jwtId) {
            this.jwtId = jwtId;
            return this;
        }

        public Builder scope(String scope) {
            this.scope = scope;
            return this;
        }

        public Builder extra(String name, Object value) {
            this.extra.put(name, value);
            return this;
        }

        public Claims build() {
            return new Claims(
                    subject,
                    Optional.ofNullable(issuer),
                    audience,
                    toOptional(expiresAt),
                    toOptional(notBefore),
                    toOptional(issuedAt),
                    Optional.ofNullable(jwtId),
                    Optional.ofNullable(scope),
                    extra);
        }

        private static OptionalLong toOptional(Long value) {
            return value == null ? OptionalLong.empty() : OptionalLong.of(value);
        }
    }
}
