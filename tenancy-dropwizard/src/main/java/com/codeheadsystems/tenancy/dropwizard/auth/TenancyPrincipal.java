package com.codeheadsystems.tenancy.dropwizard.auth;

import java.security.Principal;

/**
 * Principal representing an authenticated tenant.
 *
 * @param ownerId the token subject, used as the registry owner id
 * @param azp     the origin the token was issued for, may be null
 */
public record TenancyPrincipal(String ownerId, String azp) implements Principal {

  @Override
  public String getName() {
    return ownerId;
  }
}
