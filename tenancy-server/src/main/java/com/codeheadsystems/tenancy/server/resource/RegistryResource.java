package com.codeheadsystems.tenancy.server.resource;

import com.codeheadsystems.tenancy.model.CheckResponse;
import com.codeheadsystems.tenancy.model.ClaimRequest;
import com.codeheadsystems.tenancy.model.RegistryDocument;
import com.codeheadsystems.tenancy.server.auth.BearerTokenVerifier;
import com.codeheadsystems.tenancy.server.manager.ClaimOutcome;
import com.codeheadsystems.tenancy.server.manager.TenancyRegistryManager;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource for subdomain availability and claims.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code GET /check/{subdomain}} : public availability check</li>
 *   <li>{@code POST /claim}            : claim a subdomain for the bearer token's subject</li>
 *   <li>{@code GET /registry.json}     : public read of the whole registry</li>
 * </ul>
 */
@Singleton
@Path("/")
@Produces(MediaType.APPLICATION_JSON)
public class RegistryResource {

  private static final Logger log = LoggerFactory.getLogger(RegistryResource.class);

  private final TenancyRegistryManager manager;

  /**
   * Instantiates a new registry resource.
   *
   * @param manager the registry manager
   */
  @Inject
  public RegistryResource(final TenancyRegistryManager manager) {
    this.manager = manager;
    log.info("RegistryResource({})", manager);
  }

  @GET
  @Path("check/{subdomain}")
  public CheckResponse check(@PathParam("subdomain") final String subdomain) {
    try {
      return manager.check(subdomain);
    } catch (IllegalArgumentException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.BAD_REQUEST);
    }
  }

  /**
   * Claims a subdomain. The owner is the subject of the bearer token.
   *
   * @param authorization {@code Authorization} header
   * @param request       the claim
   * @return 201 on success, otherwise 400, 402 or 409 with the reason in the body
   */
  @POST
  @Path("claim")
  @Consumes(MediaType.APPLICATION_JSON)
  public Response claim(@HeaderParam(HttpHeaders.AUTHORIZATION) final String authorization,
                        final ClaimRequest request) {
    try {
      ClaimOutcome outcome = manager.claim(request, BearerTokenVerifier.stripBearer(authorization));
      return Response.status(outcome.status()).entity(outcome.response()).build();
    } catch (SecurityException e) {
      throw new WebApplicationException(Response.Status.UNAUTHORIZED);
    } catch (IllegalArgumentException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.BAD_REQUEST);
    }
  }

  @GET
  @Path("registry.json")
  public RegistryDocument registry() {
    return manager.registryDocument();
  }
}
