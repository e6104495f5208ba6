package com.codeheadsystems.tenancy.dropwizard.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.codeheadsystems.tenancy.server.auth.BearerTokenVerifier;
import com.codeheadsystems.tenancy.server.auth.BearerTokenVerifier.VerifiedToken;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TenancyAuthenticatorTest {

  @Mock private BearerTokenVerifier verifier;

  @Test
  void authenticate_verifiedToken_returnsPrincipal() throws Exception {
    when(verifier.verify("good")).thenReturn(Optional.of(new VerifiedToken("user_1", "https://a.vibes.test")));

    Optional<TenancyPrincipal> principal = new TenancyAuthenticator(verifier).authenticate("good");

    assertThat(principal).contains(new TenancyPrincipal("user_1", "https://a.vibes.test"));
    assertThat(principal.get().getName()).isEqualTo("user_1");
  }

  @Test
  void authenticate_rejectedToken_returnsEmpty() throws Exception {
    when(verifier.verify("bad")).thenReturn(Optional.empty());

    assertThat(new TenancyAuthenticator(verifier).authenticate("bad")).isEmpty();
  }
}
