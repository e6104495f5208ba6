package com.codeheadsystems.tenancy.server.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class PemKeysTest {

  private final TestTokens tokens = new TestTokens();

  @Test
  void rsaPublicKey_parsesPem() {
    assertThat(PemKeys.rsaPublicKey(tokens.publicKeyPem())).isEqualTo(tokens.publicKey());
  }

  @Test
  void rsaPublicKey_acceptsSingleLineWithEscapedNewlines() {
    String squashed = tokens.publicKeyPem().replace("\n", "\\n");

    assertThat(PemKeys.rsaPublicKey(squashed)).isEqualTo(tokens.publicKey());
  }

  @Test
  void rsaPublicKey_rejectsGarbage() {
    assertThatThrownBy(() -> PemKeys.rsaPublicKey("-----BEGIN PUBLIC KEY-----\nnot base64!\n-----END PUBLIC KEY-----"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> PemKeys.rsaPublicKey(" "))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
