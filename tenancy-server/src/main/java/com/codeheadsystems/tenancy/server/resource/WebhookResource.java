package com.codeheadsystems.tenancy.server.resource;

import com.codeheadsystems.tenancy.model.WebhookResponse;
import com.codeheadsystems.tenancy.server.manager.TenancyRegistryManager;
import com.codeheadsystems.tenancy.server.webhook.WebhookVerifier;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receives signed subscription events from the billing provider.
 * <p>
 * The body is taken as raw bytes because the signature covers the exact bytes sent.
 */
@Singleton
@Path("/webhook")
public class WebhookResource {

  private static final Logger log = LoggerFactory.getLogger(WebhookResource.class);

  private final TenancyRegistryManager manager;

  @Inject
  public WebhookResource(final TenancyRegistryManager manager) {
    this.manager = manager;
    log.info("WebhookResource({})", manager);
  }

  /**
   * Applies a subscription event.
   *
   * @return the acknowledgement listing released subdomains
   */
  @POST
  @Consumes(MediaType.WILDCARD)
  @Produces(MediaType.APPLICATION_JSON)
  public WebhookResponse receive(@HeaderParam(WebhookVerifier.ID_HEADER) final String id,
                                 @HeaderParam(WebhookVerifier.TIMESTAMP_HEADER) final String timestamp,
                                 @HeaderParam(WebhookVerifier.SIGNATURE_HEADER) final String signature,
                                 final byte[] body) {
    log.trace("receive(id={})", id);
    try {
      return manager.handleWebhook(id, timestamp, signature, body);
    } catch (SecurityException e) {
      log.debug("Webhook {} rejected: {}", id, e.getMessage());
      throw new WebApplicationException(Response.Status.UNAUTHORIZED);
    } catch (IllegalStateException e) {
      log.warn("Webhook {} refused: {}", id, e.getMessage());
      throw new WebApplicationException(Response.Status.SERVICE_UNAVAILABLE);
    } catch (IllegalArgumentException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.BAD_REQUEST);
    }
  }
}
