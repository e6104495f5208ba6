package com.codeheadsystems.tenancy.credential;

/**
 * ES256 session key pair shared with a sync backend, each key as a portable JWK token.
 *
 * @param publicToken  {@code 'z' + base58btc(json(public JWK))}
 * @param privateToken {@code 'z' + base58btc(json(private JWK))}
 */
public record SessionTokens(String publicToken, String privateToken) {
}
