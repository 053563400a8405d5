package ublauth.core.model.token;

/**
 * Structurally decoded but unverified token.
 *
 * <p>Nothing in here may be trusted until the signature over
 * {@link #signingInput()} has been verified.
 *
 * @param header       the decoded header
 * @param claims       the decoded payload
 * @param signingInput ASCII bytes of {@code header-segment "." payload-segment}, exactly as received
 * @param signature    the raw signature bytes
 */
public record DecodedToken(TokenHeader header, Claims claims, byte[] signingInput, byte[] signature) {}
