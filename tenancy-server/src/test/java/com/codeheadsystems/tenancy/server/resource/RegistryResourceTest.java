package com.codeheadsystems.tenancy.server.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.tenancy.model.CheckResponse;
import com.codeheadsystems.tenancy.model.ClaimRequest;
import com.codeheadsystems.tenancy.model.RegistryDocument;
import com.codeheadsystems.tenancy.server.manager.TenancyRegistryManager;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RegistryResourceTest {

  @Mock private TenancyRegistryManager manager;
  private RegistryResource resource;

  @BeforeAll
  static void installRuntimeDelegate() {
    MockRuntimeDelegate.install();
  }

  @AfterAll
  static void removeRuntimeDelegate() {
    MockRuntimeDelegate.uninstall();
  }

  @BeforeEach
  void setUp() {
    resource = new RegistryResource(manager);
  }

  @Test
  void check_delegatesToManager() {
    CheckResponse expected = new CheckResponse(false, "claimed", "user_1");
    when(manager.check("my-site")).thenReturn(expected);

    assertThat(resource.check("my-site")).isEqualTo(expected);
  }

  @Test
  void claim_passesTokenWithoutBearerPrefix() {
    ClaimRequest request = new ClaimRequest("my-site");
    when(manager.claim(eq(request), eq("abc.def.ghi"))).thenThrow(new SecurityException("Authentication failed"));

    assertThatThrownBy(() -> resource.claim("Bearer abc.def.ghi", request))
        .isInstanceOf(WebApplicationException.class);
    verify(manager).claim(request, "abc.def.ghi");
  }

  @Test
  void claim_securityException_isUnauthorized() {
    when(manager.claim(any(), any())).thenThrow(new SecurityException("Authentication required"));

    assertThatThrownBy(() -> resource.claim(null, new ClaimRequest("my-site")))
        .isInstanceOf(WebApplicationException.class)
        .satisfies(e -> assertThat(((WebApplicationException) e).getResponse().getStatus())
            .isEqualTo(Response.Status.UNAUTHORIZED.getStatusCode()));
  }

  @Test
  void claim_illegalArgument_isBadRequest() {
    when(manager.claim(any(), any())).thenThrow(new IllegalArgumentException("Missing required field: subdomain"));

    assertThatThrownBy(() -> resource.claim("Bearer t", new ClaimRequest(null)))
        .isInstanceOf(WebApplicationException.class)
        .satisfies(e -> assertThat(((WebApplicationException) e).getResponse().getStatus())
            .isEqualTo(Response.Status.BAD_REQUEST.getStatusCode()));
  }

  @Test
  void registry_returnsDocument() {
    RegistryDocument document = new RegistryDocument(Map.of(), List.of("admin"), Map.of(), Map.of());
    when(manager.registryDocument()).thenReturn(document);

    assertThat(resource.registry()).isEqualTo(document);
  }
}
