package com.codeheadsystems.tenancy.flow;

/**
 * One supported first-factor verification method, as reported by the identity provider.
 *
 * @param strategy       e.g. {@code email_link}, {@code email_code}, {@code passkey}
 * @param emailAddressId id of the email address the factor targets, may be null
 */
public record VerificationFactor(String strategy, String emailAddressId) {
}
