package com.codeheadsystems.tenancy.server.resource;

import com.codeheadsystems.tenancy.validator.OriginMatcher;
import jakarta.ws.rs.HttpMethod;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.container.PreMatching;
import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.core.Response;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CORS for browser apps running on tenant subdomains.
 * <p>
 * Every response carries {@code Access-Control-Allow-Origin}: the request's {@code Origin} when it
 * matches a permitted pattern, {@code *} when no patterns are configured, and otherwise the first
 * configured pattern so the browser rejects the response. Any {@code OPTIONS} request is answered
 * directly with 204.
 */
@PreMatching
public class CorsFilter implements ContainerRequestFilter, ContainerResponseFilter {

  private static final Logger log = LoggerFactory.getLogger(CorsFilter.class);

  public static final String ORIGIN_HEADER = "Origin";
  public static final String ALLOW_ORIGIN = "Access-Control-Allow-Origin";
  public static final String ALLOW_METHODS = "Access-Control-Allow-Methods";
  public static final String ALLOW_HEADERS = "Access-Control-Allow-Headers";
  static final String METHODS = "GET, POST, OPTIONS";
  static final String HEADERS = "Content-Type, Authorization";

  private final List<String> permittedOrigins;

  /**
   * Instantiates a new cors filter.
   *
   * @param permittedOrigins origin patterns, same syntax as token {@code azp} matching
   */
  public CorsFilter(List<String> permittedOrigins) {
    this.permittedOrigins = List.copyOf(permittedOrigins);
  }

  /**
   * Chooses the {@code Access-Control-Allow-Origin} value for a request.
   *
   * @param requestOrigin the request's Origin header, may be null
   * @return the header value
   */
  public String allowedOrigin(String requestOrigin) {
    if (permittedOrigins.isEmpty()) {
      return "*";
    }
    if (OriginMatcher.matchOrigin(requestOrigin, permittedOrigins)) {
      return requestOrigin;
    }
    log.debug("CORS: origin {} not permitted", requestOrigin);
    return permittedOrigins.get(0);
  }

  @Override
  public void filter(ContainerRequestContext request) {
    if (HttpMethod.OPTIONS.equalsIgnoreCase(request.getMethod())) {
      request.abortWith(Response.noContent()
          .header(ALLOW_ORIGIN, allowedOrigin(request.getHeaderString(ORIGIN_HEADER)))
          .header(ALLOW_METHODS, METHODS)
          .header(ALLOW_HEADERS, HEADERS)
          .build());
    }
  }

  @Override
  public void filter(ContainerRequestContext request, ContainerResponseContext response) {
    MultivaluedMap<String, Object> headers = response.getHeaders();
    headers.putSingle(ALLOW_ORIGIN, allowedOrigin(request.getHeaderString(ORIGIN_HEADER)));
    headers.putSingle(ALLOW_METHODS, METHODS);
    headers.putSingle(ALLOW_HEADERS, HEADERS);
  }
}
