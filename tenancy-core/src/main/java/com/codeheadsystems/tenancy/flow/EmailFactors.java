package com.codeheadsystems.tenancy.flow;

/**
 * Email verification methods the identity provider offers for an account.
 *
 * @param hasEmailLink a magic link can be sent
 * @param hasEmailCode a one-time code can be sent
 */
public record EmailFactors(boolean hasEmailLink, boolean hasEmailCode) {
}
