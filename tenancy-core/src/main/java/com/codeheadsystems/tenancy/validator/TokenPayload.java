package com.codeheadsystems.tenancy.validator;

/**
 * Decoded JWT claims relevant to authorization. Produced by the identity provider; only read here.
 *
 * @param subject  {@code sub}, the tenant / user identifier, may be null
 * @param azp      {@code azp}, the authorized party (origin) the token was issued for, may be null
 * @param exp      {@code exp} in epoch seconds, null when absent
 * @param nbf      {@code nbf} in epoch seconds, null when absent
 */
public record TokenPayload(String subject, String azp, Long exp, Long nbf) {
}
