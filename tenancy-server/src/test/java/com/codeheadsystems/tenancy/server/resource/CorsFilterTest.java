package com.codeheadsystems.tenancy.server.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.core.MultivaluedHashMap;
import jakarta.ws.rs.core.MultivaluedMap;
import java.util.List;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CorsFilterTest {

  private final CorsFilter filter = new CorsFilter(List.of("https://*.vibes.test", "http://localhost:3000"));

  @Mock private ContainerRequestContext request;
  @Mock private ContainerResponseContext response;

  @BeforeAll
  static void installRuntimeDelegate() {
    MockRuntimeDelegate.install();
  }

  @AfterAll
  static void removeRuntimeDelegate() {
    MockRuntimeDelegate.uninstall();
  }

  @Test
  void allowedOrigin_matchingWildcard_echoesOrigin() {
    assertThat(filter.allowedOrigin("https://site.vibes.test")).isEqualTo("https://site.vibes.test");
    assertThat(filter.allowedOrigin("http://localhost:3000")).isEqualTo("http://localhost:3000");
  }

  @Test
  void allowedOrigin_unmatchedOrMissing_fallsBackToFirstPattern() {
    assertThat(filter.allowedOrigin("https://evil.test")).isEqualTo("https://*.vibes.test");
    assertThat(filter.allowedOrigin("https://a.b.vibes.test")).isEqualTo("https://*.vibes.test");
    assertThat(filter.allowedOrigin(null)).isEqualTo("https://*.vibes.test");
  }

  @Test
  void allowedOrigin_noPatterns_allowsAny() {
    assertThat(new CorsFilter(List.of()).allowedOrigin("https://anything.test")).isEqualTo("*");
  }

  @Test
  void responseFilter_addsCorsHeaders() {
    MultivaluedMap<String, Object> headers = new MultivaluedHashMap<>();
    when(request.getHeaderString(CorsFilter.ORIGIN_HEADER)).thenReturn("https://site.vibes.test");
    when(response.getHeaders()).thenReturn(headers);

    filter.filter(request, response);

    assertThat(headers.getFirst(CorsFilter.ALLOW_ORIGIN)).isEqualTo("https://site.vibes.test");
    assertThat(headers.getFirst(CorsFilter.ALLOW_METHODS)).isEqualTo("GET, POST, OPTIONS");
    assertThat(headers.getFirst(CorsFilter.ALLOW_HEADERS)).isEqualTo("Content-Type, Authorization");
  }

  @Test
  void requestFilter_options_isAnsweredDirectly() {
    when(request.getMethod()).thenReturn("OPTIONS");

    filter.filter(request);

    verify(request).abortWith(any());
  }

  @Test
  void requestFilter_get_passesThrough() {
    when(request.getMethod()).thenReturn("GET");

    filter.filter(request);

    verify(request, never()).abortWith(any());
  }
}
