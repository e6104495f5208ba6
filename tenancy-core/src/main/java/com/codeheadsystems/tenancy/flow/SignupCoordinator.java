package com.codeheadsystems.tenancy.flow;

import com.codeheadsystems.tenancy.registry.ClaimResult;
import com.codeheadsystems.tenancy.registry.SubdomainRegistry;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one user's signup through {@link AuthFlows#nextSignupState} and creates the subdomain
 * claim at the end.
 * <p>
 * A claim can only be attempted in {@link SignupState#CLAIMING}, which is reached only after a
 * passkey was created. One instance per in-flight signup; not thread-safe.
 */
public class SignupCoordinator {

  private static final Logger log = LoggerFactory.getLogger(SignupCoordinator.class);

  private final SubdomainRegistry registry;
  private final String ownerId;
  private SignupState state = SignupState.EMAIL;

  /**
   * Instantiates a new signup coordinator.
   *
   * @param registry registry that receives the claim
   * @param ownerId  identity provider user id of the new tenant
   */
  public SignupCoordinator(SubdomainRegistry registry, String ownerId) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.ownerId = Objects.requireNonNull(ownerId, "ownerId");
  }

  public SignupState state() {
    return state;
  }

  /**
   * The email address was submitted to the identity provider.
   *
   * @return the new state
   */
  public SignupState emailSubmitted() {
    expect(SignupState.EMAIL);
    return advance(null);
  }

  /**
   * A verification code or link was checked.
   *
   * @param status sign-up status reported by the identity provider
   * @return the new state; still {@code verify} unless the status allows moving on
   */
  public SignupState verificationAttempted(String status) {
    expect(SignupState.VERIFY);
    return advance(status);
  }

  /**
   * The passkey creation ceremony finished.
   *
   * @param outcome ceremony result; anything but success keeps the flow in {@code passkey}
   * @return the new state
   */
  public SignupState passkeyCeremonyFinished(PasskeyOutcome outcome) {
    expect(SignupState.PASSKEY);
    if (!outcome.success()) {
      log.debug("Passkey creation for {} did not succeed (cancelled={})", ownerId, outcome.cancelled());
      return state;
    }
    return advance(null);
  }

  /**
   * Claims the tenant's subdomain. A rejected claim keeps the flow in {@code claiming} so the
   * user can pick another name.
   *
   * @param subdomain requested name
   * @return the registry's result
   * @throws IllegalStateException if the flow is not in {@code claiming}
   */
  public ClaimResult claim(String subdomain) {
    expect(SignupState.CLAIMING);
    ClaimResult result = registry.createClaim(subdomain, ownerId);
    if (result.success()) {
      advance(null);
    }
    return result;
  }

  private SignupState advance(String status) {
    SignupState next = AuthFlows.nextSignupState(state, status);
    if (next != state) {
      log.debug("Signup for {}: {} -> {}", ownerId, state.code(), next.code());
    }
    state = next;
    return state;
  }

  private void expect(SignupState expected) {
    if (state != expected) {
      throw new IllegalStateException("Signup is in state " + state.code() + ", expected " + expected.code());
    }
  }
}
