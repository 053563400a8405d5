package ublauth.core.model.token;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Per-call verification policy.
 *
 * @param issuer   expected {@code iss}; the issuer check is skipped when empty
 * @param audience required {@code aud} member; the audience check is skipped when empty
 * @param leeway   clock skew tolerance applied to {@code exp}, {@code nbf} and {@code iat} (default 5 minutes)
 * @param clock    time source for the time window checks
 */
public record VerifyOptions(Optional<String> issuer, Optional<String> audience, Duration leeway, Clock clock) {

    public static final Duration DEFAULT_LEEWAY = Duration.ofSeconds(300);

    public VerifyOptions {
        if (issuer == null) {
            issuer = Optional.empty();
        }
        if (audience == null) {
            audience = Optional.empty();
        }
        if (leeway == null) {
            leeway = DEFAULT_LEEWAY;
        }
        if (leeway.isNegative()) {
            throw new IllegalArgumentException("Leeway cannot be negative: " + leeway);
        }
        if (clock == null) {
            clock = Clock.systemUTC();
        }
    }

    public static VerifyOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .issuer(issuer.orElse(null))
                .audience(audience.orElse(null))
                .leeway(leeway)
                .clock(clock);
    }

    public static class Builder {
        private String issuer;
        private String audience;
        private Duration leeway = DEFAULT_LEEWAY;
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        public Builder issuer(String issuer) {
            this.issuer = issuer;
            return this;
        }

        public Builder audience(String audience) {
            this.audience = audience;
            return this;
        }

        public Builder leeway(Duration leeway) {
            this.leeway = leeway;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public VerifyOptions build() {
            return new VerifyOptions(Optional.ofNullable(issuer), Optional.ofNullable(audience), leeway, clock);
        }
    }
}
