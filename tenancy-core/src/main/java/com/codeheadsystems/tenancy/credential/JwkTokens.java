package com.codeheadsystems.tenancy.credential;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.ECPublicKey;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.bouncycastle.util.BigIntegers;

/**
 * Exports P-256 keys as JWKs and encodes JWKs as portable tokens:
 * {@code 'z' + base58btc(utf8(json(jwk)))}, the {@code z} being the multibase prefix for base58btc.
 */
public final class JwkTokens {

  /**
   * Multibase prefix for base58btc.
   */
  public static final String PREFIX = "z";

  private static final int P256_COORDINATE_BYTES = 32;
  private static final TypeReference<Map<String, Object>> JWK_TYPE = new TypeReference<>() {
  };
  private static final Base64.Encoder B64URL = Base64.getUrlEncoder().withoutPadding();

  private JwkTokens() {
  }

  /**
   * Public JWK ({@code kty, crv, x, y}) tagged with {@code alg: ES256}.
   *
   * @param publicKey P-256 public key
   * @return the JWK members in a stable order
   */
  public static Map<String, Object> publicJwk(ECPublicKey publicKey) {
    Map<String, Object> jwk = coordinates(publicKey);
    jwk.put("ext", true);
    jwk.put("key_ops", List.of("verify"));
    jwk.put("alg", "ES256");
    return jwk;
  }

  /**
   * Private JWK (public coordinates plus {@code d}) tagged with {@code alg: ES256}.
   *
   * @param publicKey  P-256 public key
   * @param privateKey matching private key
   * @return the JWK members in a stable order
   */
  public static Map<String, Object> privateJwk(ECPublicKey publicKey, ECPrivateKey privateKey) {
    Map<String, Object> jwk = coordinates(publicKey);
    jwk.put("d", B64URL.encodeToString(BigIntegers.asUnsignedByteArray(P256_COORDINATE_BYTES, privateKey.getS())));
    jwk.put("ext", true);
    jwk.put("key_ops", List.of("sign"));
    jwk.put("alg", "ES256");
    return jwk;
  }

  /**
   * Encodes a JWK as a portable token.
   *
   * @param mapper JSON serializer
   * @param jwk    JWK members
   * @return the token, always starting with {@value #PREFIX}
   */
  public static String toToken(ObjectMapper mapper, Map<String, Object> jwk) {
    try {
      return PREFIX + Base58.encode(mapper.writeValueAsBytes(jwk));
    } catch (JsonProcessingException e) {
      throw new CredentialIssuanceException("Unable to serialize JWK", e);
    }
  }

  /**
   * Decodes a token produced by {@link #toToken}.
   *
   * @param mapper JSON deserializer
   * @param token  the token
   * @return the JWK members
   * @throws IllegalArgumentException if the token is not a {@value #PREFIX}-prefixed base58 JWK
   */
  public static Map<String, Object> fromToken(ObjectMapper mapper, String token) {
    if (token == null || !token.startsWith(PREFIX)) {
      throw new IllegalArgumentException("JWK token must start with '" + PREFIX + "'");
    }
    try {
      return mapper.readValue(Base58.decode(token.substring(PREFIX.length())), JWK_TYPE);
    } catch (IOException e) {
      throw new IllegalArgumentException("JWK token does not contain a JSON object", e);
    }
  }

  static Map<String, Object> coordinates(ECPublicKey publicKey) {
    Map<String, Object> jwk = new LinkedHashMap<>();
    jwk.put("kty", "EC");
    jwk.put("crv", "P-256");
    jwk.put("x", B64URL.encodeToString(
        BigIntegers.asUnsignedByteArray(P256_COORDINATE_BYTES, publicKey.getW().getAffineX())));
    jwk.put("y", B64URL.encodeToString(
        BigIntegers.asUnsignedByteArray(P256_COORDINATE_BYTES, publicKey.getW().getAffineY())));
    return jwk;
  }
}
