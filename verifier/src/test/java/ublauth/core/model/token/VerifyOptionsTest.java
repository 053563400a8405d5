package ublauth.core.model.token;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("VerifyOptions")
class VerifyOptionsTest {

    @Test
    @DisplayName("defaults() should skip issuer and audience checks with a 300 second leeway")
    void defaultsShouldBeLenient() {
        final var options = VerifyOptions.defaults();

        assertTrue(options.issuer().isEmpty());
        assertTrue(options.audience().isEmpty());
        assertEquals(Duration.ofSeconds(300), options.leeway());
    }

    @Test
    @DisplayName("toBuilder() should copy every field")
    void toBuilderShouldCopy() {
        final var clock = Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC);
        final var options = VerifyOptions.builder()
                .issuer("https://id.example")
                .audience("demo")
                .leeway(Duration.ofSeconds(10))
                .clock(clock)
                .build();

        final var copy = options.toBuilder().build();

        assertEquals(Optional.of("https://id.example"), copy.issuer());
        assertEquals(Optional.of("demo"), copy.audience());
        assertEquals(Duration.ofSeconds(10), copy.leeway());
        assertSame(clock, copy.clock());
    }

    @Test
    @DisplayName("should reject a negative leeway")
    void shouldRejectNegativeLeeway() {
        assertThrows(
                IllegalArgumentException.class,
                () -> VerifyOptions.builder().leeway(Duration.ofSeconds(-1)).build());
    }

    @Test
    @DisplayName("should fall back to defaults for null components")
    void shouldDefaultNulls() {
        final var options = new VerifyOptions(null, null, null, null);

        assertTrue(options.issuer().isEmpty());
        assertEquals(VerifyOptions.DEFAULT_LEEWAY, options.leeway());
        assertEquals(ZoneOffset.UTC, options.clock().getZone());
    }
}
