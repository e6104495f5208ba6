package com.codeheadsystems.tenancy.validator;

import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Admit / deny decision for a decoded token: timing first, then origin.
 * <p>
 * Shared by every process that authorizes tenant requests, so all of them apply the same rules.
 * Reason codes are for server logs; callers must answer every denial with the same 401.
 */
public class TokenAuthorizer {

  public static final String ORIGIN_MISMATCH = "origin_mismatch";
  public static final String MISSING_SUBJECT = "missing_subject";

  private static final Logger log = LoggerFactory.getLogger(TokenAuthorizer.class);

  private final List<String> permittedOrigins;
  private final TimingValidator timingValidator;

  /**
   * Instantiates a new token authorizer.
   *
   * @param permittedOrigins origin patterns; empty means no origin restriction
   * @param timingValidator  validator supplying the current time
   */
  public TokenAuthorizer(List<String> permittedOrigins, TimingValidator timingValidator) {
    this.permittedOrigins = List.copyOf(permittedOrigins);
    this.timingValidator = Objects.requireNonNull(timingValidator, "timingValidator");
  }

  /**
   * Decision for a token.
   *
   * @param admitted whether the request may proceed
   * @param reason   log-only reason code when denied
   */
  public record Decision(boolean admitted, String reason) {
  }

  /**
   * Authorizes a decoded token. A token without a subject is denied since it cannot be tied to
   * a tenant.
   *
   * @param payload decoded claims
   * @return the decision
   */
  public Decision authorize(TokenPayload payload) {
    TimingResult timing = timingValidator.validate(payload);
    if (!timing.valid()) {
      return deny(payload, timing.reason());
    }
    if (!OriginMatcher.matchOrigin(payload.azp(), permittedOrigins)) {
      return deny(payload, ORIGIN_MISMATCH);
    }
    if (payload.subject() == null || payload.subject().isBlank()) {
      return deny(payload, MISSING_SUBJECT);
    }
    return new Decision(true, null);
  }

  public List<String> permittedOrigins() {
    return permittedOrigins;
  }

  private Decision deny(TokenPayload payload, String reason) {
    log.debug("Token for sub={} azp={} denied: {}", payload.subject(), payload.azp(), reason);
    return new Decision(false, reason);
  }
}
