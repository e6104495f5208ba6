package com.codeheadsystems.tenancy.registry;

/**
 * Result of an availability check.
 *
 * @param available whether the subdomain can be claimed
 * @param reason    why not, or null when available
 * @param ownerId   current owner for {@code claimed} and {@code preallocated}, otherwise null
 */
public record Availability(boolean available, UnavailableReason reason, String ownerId) {

  private static final Availability AVAILABLE = new Availability(true, null, null);

  public static Availability free() {
    return AVAILABLE;
  }

  public static Availability unavailable(UnavailableReason reason) {
    return new Availability(false, reason, null);
  }

  public static Availability ownedBy(UnavailableReason reason, String ownerId) {
    return new Availability(false, reason, ownerId);
  }
}
