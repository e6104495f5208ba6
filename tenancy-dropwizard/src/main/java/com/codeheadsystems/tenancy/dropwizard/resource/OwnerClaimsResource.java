package com.codeheadsystems.tenancy.dropwizard.resource;

import com.codeheadsystems.tenancy.dropwizard.auth.TenancyPrincipal;
import com.codeheadsystems.tenancy.model.OwnerClaimsResponse;
import com.codeheadsystems.tenancy.server.manager.TenancyRegistryManager;
import io.dropwizard.auth.Auth;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

/**
 * Lists the authenticated tenant's subdomains, newest first.
 */
@Path("/api/claims")
@Produces(MediaType.APPLICATION_JSON)
public class OwnerClaimsResource {

  private final TenancyRegistryManager manager;

  public OwnerClaimsResource(TenancyRegistryManager manager) {
    this.manager = manager;
  }

  @GET
  public OwnerClaimsResponse claims(@Auth TenancyPrincipal principal) {
    return manager.ownerClaims(principal.ownerId());
  }
}
