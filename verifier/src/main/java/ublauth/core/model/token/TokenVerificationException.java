package ublauth.core.model.token;

/**
 * Thrown when a token fails verification.
 *
 * <p>The {@link #failure()} identifies the first check that rejected the token.
 * Verification never continues past a failure.
 */
public class TokenVerificationException extends RuntimeException {

    private final VerificationFailure failure;

    public TokenVerificationException(VerificationFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public TokenVerificationException(VerificationFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public VerificationFailure failure() {
        return failure;
    }
}
