package com.codeheadsystems.tenancy.validator;

import java.time.Clock;
import java.util.Objects;

/**
 * Checks the {@code exp} / {@code nbf} window of a token. Stateless and thread-safe.
 * <p>
 * Expiry is inclusive: a token with {@code exp == now} is expired. Not-before is inclusive: a token
 * with {@code nbf == now} is valid. Absent claims impose no constraint.
 */
public class TimingValidator {

  private final Clock clock;

  public TimingValidator() {
    this(Clock.systemUTC());
  }

  public TimingValidator(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Validates against the current time of this validator's clock.
   *
   * @param payload token claims
   * @return the result
   */
  public TimingResult validate(TokenPayload payload) {
    return validate(payload, clock.instant().getEpochSecond());
  }

  /**
   * Validates against an explicit time.
   *
   * @param payload      token claims
   * @param nowEpochSecs current time in epoch seconds
   * @return the result
   */
  public static TimingResult validate(TokenPayload payload, long nowEpochSecs) {
    if (payload.exp() != null && payload.exp() <= nowEpochSecs) {
      return TimingResult.invalid(TimingResult.EXPIRED);
    }
    if (payload.nbf() != null && payload.nbf() > nowEpochSecs) {
      return TimingResult.invalid(TimingResult.NOT_YET_VALID);
    }
    return TimingResult.ok();
  }
}
