package com.codeheadsystems.tenancy.registry;

/**
 * Outcome of {@link SubdomainRegistry#createClaim}.
 *
 * @param success   whether a claim was created
 * @param subdomain the normalized subdomain on success
 * @param error     the rejection reason on failure
 * @param ownerId   the existing owner when the rejection is {@code claimed} or {@code preallocated}
 */
public record ClaimResult(boolean success, String subdomain, UnavailableReason error, String ownerId) {

  public static ClaimResult claimed(String subdomain) {
    return new ClaimResult(true, subdomain, null, null);
  }

  public static ClaimResult rejected(Availability availability) {
    return new ClaimResult(false, null, availability.reason(), availability.ownerId());
  }

  public static ClaimResult rejected(UnavailableReason reason) {
    return new ClaimResult(false, null, reason, null);
  }
}
