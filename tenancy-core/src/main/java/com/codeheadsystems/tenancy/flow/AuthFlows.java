package com.codeheadsystems.tenancy.flow;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Pure transition functions for the tenant-facing auth flows. None of these perform I/O: callers
 * run the passkey ceremony or identity-provider call and feed the outcome in.
 */
public final class AuthFlows {

  static final String STATUS_COMPLETE = "complete";
  static final String STATUS_MISSING_REQUIREMENTS = "missing_requirements";

  private AuthFlows() {
  }

  /**
   * Next signup state once the current step has finished.
   * <p>
   * In {@code verify} the identity provider's sign-up status decides: {@code complete} or
   * {@code missing_requirements} moves on to {@code passkey}, anything else stays in
   * {@code verify}. Every other state advances unconditionally; {@code done} is terminal.
   *
   * @param current            current state
   * @param verificationStatus sign-up status after a verification attempt, ignored outside
   *                           {@code verify}, may be null
   * @return the next state
   */
  public static SignupState nextSignupState(SignupState current, String verificationStatus) {
    return switch (current) {
      case EMAIL -> SignupState.VERIFY;
      case VERIFY -> STATUS_COMPLETE.equals(verificationStatus)
          || STATUS_MISSING_REQUIREMENTS.equals(verificationStatus)
          ? SignupState.PASSKEY
          : SignupState.VERIFY;
      case PASSKEY -> SignupState.CLAIMING;
      case CLAIMING, DONE -> SignupState.DONE;
    };
  }

  /**
   * Next signin state after a passkey attempt. Failure or cancellation falls back to email.
   *
   * @param current current state; only {@code passkey} reacts
   * @param outcome ceremony result
   * @return the next state
   */
  public static SigninState nextSigninStateAfterPasskey(SigninState current, PasskeyOutcome outcome) {
    if (current != SigninState.PASSKEY) {
      return current;
    }
    return outcome.success() ? SigninState.COMPLETE : SigninState.EMAIL;
  }

  /**
   * Next signin state after an email address was submitted. A link is preferred over a code;
   * with neither the flow stays in {@code email} and the caller surfaces an error.
   *
   * @param current current state; only {@code email} reacts
   * @param factors methods offered for the account
   * @return the next state
   */
  public static SigninState nextSigninStateAfterEmail(SigninState current, EmailFactors factors) {
    if (current != SigninState.EMAIL) {
      return current;
    }
    if (factors.hasEmailLink()) {
      return SigninState.VERIFY_LINK;
    }
    if (factors.hasEmailCode()) {
      return SigninState.VERIFY_CODE;
    }
    return SigninState.EMAIL;
  }

  /**
   * Read-only access gate.
   *
   * @param user signed-in user, or null while the session is still loading
   * @return {@code checking}, {@code ready} with a passkey, otherwise {@code passkey}
   */
  public static GateState gateState(FlowUser user) {
    if (user == null) {
      return GateState.CHECKING;
    }
    return user.hasPasskey() ? GateState.READY : GateState.PASSKEY;
  }

  /**
   * Claim prompt. Same test as {@link #gateState} but a user with a passkey is prompted to claim,
   * so a subdomain is only ever claimed once a durable credential exists.
   *
   * @param user signed-in user, or null while the session is still loading
   * @return {@code checking}, {@code claim} with a passkey, otherwise {@code passkey}
   */
  public static GateState claimPromptState(FlowUser user) {
    if (user == null) {
      return GateState.CHECKING;
    }
    return user.hasPasskey() ? GateState.CLAIM : GateState.PASSKEY;
  }

  /**
   * Picks the email verification strategy: the first {@code email_link} factor, else the first
   * {@code email_code} factor, else none.
   *
   * @param factors supported first factors, may be null
   * @return the chosen strategy and its email address id
   */
  public static EmailVerification selectEmailVerificationStrategy(List<VerificationFactor> factors) {
    if (factors == null) {
      return EmailVerification.none();
    }
    return firstOf(factors, EmailVerification.EMAIL_LINK)
        .or(() -> firstOf(factors, EmailVerification.EMAIL_CODE))
        .orElse(EmailVerification.none());
  }

  private static Optional<EmailVerification> firstOf(List<VerificationFactor> factors,
                                                     String strategy) {
    return factors.stream()
        .filter(Objects::nonNull)
        .filter(f -> strategy.equals(f.strategy()))
        .findFirst()
        .map(f -> new EmailVerification(strategy, f.emailAddressId()));
  }
}
