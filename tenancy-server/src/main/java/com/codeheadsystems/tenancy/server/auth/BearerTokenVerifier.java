package com.codeheadsystems.tenancy.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.tenancy.validator.TokenAuthorizer;
import com.codeheadsystems.tenancy.validator.TokenPayload;
import java.security.interfaces.RSAPublicKey;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies identity-provider bearer tokens on tenant requests.
 * <p>
 * Tokens must be RS256-signed by the configured key. After the signature checks out, the claims go
 * through {@link TokenAuthorizer}: timing, then origin, then subject. Any failure yields an empty
 * result; the reason is logged at debug and never returned, so callers answer every rejection with
 * the same 401.
 */
public class BearerTokenVerifier {

  public static final String ALGORITHM = "RS256";

  private static final Logger log = LoggerFactory.getLogger(BearerTokenVerifier.class);
  private static final String BEARER_PREFIX = "bearer ";

  private final Algorithm algorithm;
  private final TokenAuthorizer authorizer;

  /**
   * Instantiates a new bearer token verifier.
   *
   * @param publicKey  identity provider signing key
   * @param authorizer timing and origin rules
   */
  public BearerTokenVerifier(RSAPublicKey publicKey, TokenAuthorizer authorizer) {
    this.algorithm = Algorithm.RSA256(Objects.requireNonNull(publicKey, "publicKey"), null);
    this.authorizer = Objects.requireNonNull(authorizer, "authorizer");
  }

  /**
   * Identity established by a verified token.
   *
   * @param subject the {@code sub} claim, used as the owner id
   * @param azp     the {@code azp} claim, may be null when no origins are configured
   */
  public record VerifiedToken(String subject, String azp) {
  }

  /**
   * Verifies a raw JWT.
   *
   * @param token compact JWT, without the {@code Bearer } prefix
   * @return the identity if every check passed, empty otherwise
   */
  public Optional<VerifiedToken> verify(String token) {
    if (token == null || token.isBlank()) {
      return Optional.empty();
    }
    try {
      DecodedJWT decoded = JWT.decode(token);
      if (!ALGORITHM.equals(decoded.getAlgorithm())) {
        log.debug("Bearer token rejected: alg={}", decoded.getAlgorithm());
        return Optional.empty();
      }
      algorithm.verify(decoded);

      TokenPayload payload = new TokenPayload(
          decoded.getSubject(),
          decoded.getClaim("azp").asString(),
          epochSeconds(decoded.getExpiresAtAsInstant()),
          epochSeconds(decoded.getNotBeforeAsInstant()));
      TokenAuthorizer.Decision decision = authorizer.authorize(payload);
      if (!decision.admitted()) {
        return Optional.empty();
      }
      return Optional.of(new VerifiedToken(payload.subject(), payload.azp()));
    } catch (JWTVerificationException e) {
      log.debug("Bearer token rejected: {}", e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Extracts the token from an {@code Authorization} header value.
   *
   * @param authorizationHeader header value, may be null
   * @return the token, or null if the header is absent or not a bearer credential
   */
  public static String stripBearer(String authorizationHeader) {
    if (authorizationHeader == null) {
      return null;
    }
    String trimmed = authorizationHeader.trim();
    if (!trimmed.toLowerCase(Locale.ROOT).startsWith(BEARER_PREFIX)) {
      return null;
    }
    return trimmed.substring(BEARER_PREFIX.length()).trim();
  }

  private static Long epochSeconds(Instant instant) {
    return instant == null ? null : instant.getEpochSecond();
  }
}
