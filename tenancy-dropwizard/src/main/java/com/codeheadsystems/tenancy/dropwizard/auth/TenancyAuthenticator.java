package com.codeheadsystems.tenancy.dropwizard.auth;

import com.codeheadsystems.tenancy.server.auth.BearerTokenVerifier;
import io.dropwizard.auth.AuthenticationException;
import io.dropwizard.auth.Authenticator;
import java.util.Optional;

/**
 * Dropwizard {@link Authenticator} that validates identity-provider bearer tokens using
 * {@link BearerTokenVerifier}.
 */
public class TenancyAuthenticator implements Authenticator<String, TenancyPrincipal> {

  private final BearerTokenVerifier verifier;

  /**
   * Instantiates a new tenancy authenticator.
   *
   * @param verifier the bearer token verifier
   */
  public TenancyAuthenticator(BearerTokenVerifier verifier) {
    this.verifier = verifier;
  }

  @Override
  public Optional<TenancyPrincipal> authenticate(String token) throws AuthenticationException {
    return verifier.verify(token)
        .map(result -> new TenancyPrincipal(result.subject(), result.azp()));
  }
}
