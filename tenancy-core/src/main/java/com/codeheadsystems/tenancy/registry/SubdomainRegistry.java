package com.codeheadsystems.tenancy.registry;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * System of record for which subdomain belongs to which tenant.
 * <p>
 * All mutations ({@link #createClaim}, {@link #releaseClaim}, {@link #processSubscriptionChange})
 * run under a single write lock, so the availability check and the insert of a claim are one
 * atomic unit. Reads take the read lock and always see a fully applied state.
 * <p>
 * Every mutation is saved to the {@link RegistryStore} before the lock is released. If the save
 * fails the in-memory change is reverted and the {@link RegistryPersistenceException} propagates,
 * so memory and storage never diverge.
 */
public class SubdomainRegistry {

  /**
   * Quota applied to owners with no recorded subscription quantity (billing disabled).
   */
  public static final int DEFAULT_QUOTA = 999;

  static final int MIN_LENGTH = 3;
  static final int MAX_LENGTH = 63;

  private static final Logger log = LoggerFactory.getLogger(SubdomainRegistry.class);
  private static final Pattern SUBDOMAIN_FORMAT = Pattern.compile("[a-z0-9]([a-z0-9-]*[a-z0-9])?");
  private static final Comparator<Claim> NEWEST_FIRST =
      Comparator.comparing(Claim::claimedAt).reversed().thenComparing(Claim::subdomain);

  private final RegistryStore store;
  private final Set<String> reserved;
  private final Map<String, String> preallocated;
  private final int defaultQuota;
  private final Clock clock;

  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<String, Claim> claims = new HashMap<>();
  private final Map<String, Integer> quotas = new HashMap<>();

  /**
   * Opens a registry with the default quota and the system clock.
   *
   * @param store        durable store; its last committed state is loaded immediately
   * @param reserved     names that can never be claimed
   * @param preallocated subdomain to owner bindings managed outside this API
   */
  public SubdomainRegistry(RegistryStore store, Set<String> reserved, Map<String, String> preallocated) {
    this(store, reserved, preallocated, DEFAULT_QUOTA, Clock.systemUTC());
  }

  /**
   * Opens a registry.
   * <p>
   * Reserved and preallocated names from the store are merged with the ones supplied here. Both
   * policy sets are fixed for the lifetime of the instance.
   *
   * @param store        durable store; its last committed state is loaded immediately
   * @param reserved     names that can never be claimed
   * @param preallocated subdomain to owner bindings managed outside this API
   * @param defaultQuota claims allowed for an owner with no recorded subscription quantity
   * @param clock        source of {@link Claim#claimedAt()}
   */
  public SubdomainRegistry(RegistryStore store,
                           Set<String> reserved,
                           Map<String, String> preallocated,
                           int defaultQuota,
                           Clock clock) {
    if (defaultQuota < 0) {
      throw new IllegalArgumentException("defaultQuota must not be negative: " + defaultQuota);
    }
    this.store = Objects.requireNonNull(store, "store");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.defaultQuota = defaultQuota;

    RegistrySnapshot loaded = store.load();
    Set<String> reservedNames = new HashSet<>();
    loaded.reserved().forEach(name -> reservedNames.add(normalize(name)));
    reserved.forEach(name -> reservedNames.add(normalize(name)));
    this.reserved = Set.copyOf(reservedNames);

    Map<String, String> preallocatedNames = new HashMap<>();
    loaded.preallocated().forEach((name, owner) -> preallocatedNames.put(normalize(name), owner));
    preallocated.forEach((name, owner) -> preallocatedNames.put(normalize(name), owner));
    this.preallocated = Map.copyOf(preallocatedNames);

    loaded.claims().values().forEach(c -> claims.put(c.subdomain(), c));
    quotas.putAll(loaded.quotas());
    log.info("Opened subdomain registry: claims={}, reserved={}, preallocated={}",
        claims.size(), this.reserved.size(), this.preallocated.size());
  }

  /**
   * Lowercases and trims a subdomain name.
   *
   * @param subdomain raw name
   * @return normalized name
   */
  public static String normalize(String subdomain) {
    Objects.requireNonNull(subdomain, "subdomain");
    return subdomain.toLowerCase(Locale.ROOT).trim();
  }

  /**
   * Checks whether a subdomain can be claimed.
   * <p>
   * Reservation, preallocation and existing claims are checked before the name's format, so a
   * well-formed reserved name is rejected as {@code reserved} and a short reserved name is not
   * reported as {@code too_short}.
   *
   * @param subdomain raw name
   * @return the availability
   */
  public Availability checkAvailability(String subdomain) {
    String normalized = normalize(subdomain);
    lock.readLock().lock();
    try {
      return availabilityOf(normalized);
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Claims a subdomain for an owner.
   *
   * @param subdomain raw name
   * @param ownerId   claimant
   * @return the normalized subdomain on success, or the rejection reason
   * @throws RegistryPersistenceException if the claim could not be persisted; nothing is claimed
   */
  public ClaimResult createClaim(String subdomain, String ownerId) {
    Objects.requireNonNull(ownerId, "ownerId");
    String normalized = normalize(subdomain);
    lock.writeLock().lock();
    try {
      Availability availability = availabilityOf(normalized);
      if (!availability.available()) {
        log.debug("Claim of '{}' by {} rejected: {}", normalized, ownerId, availability.reason().code());
        return ClaimResult.rejected(availability);
      }
      int held = ownedBy(ownerId).size();
      int quota = quotaOf(ownerId);
      if (held >= quota) {
        log.debug("Claim of '{}' by {} rejected: holds {} of quota {}", normalized, ownerId, held, quota);
        return ClaimResult.rejected(UnavailableReason.QUOTA_EXCEEDED);
      }

      Claim claim = new Claim(normalized, ownerId, clock.instant());
      claims.put(normalized, claim);
      try {
        persist();
      } catch (RegistryPersistenceException e) {
        claims.remove(normalized);
        throw e;
      }
      log.info("Subdomain '{}' claimed by {}", normalized, ownerId);
      return ClaimResult.claimed(normalized);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Releases a claim. Idempotent: releasing an unclaimed name returns false and does nothing.
   * Preallocated names are never released through this path.
   *
   * @param subdomain raw name
   * @return true if a claim was removed
   * @throws RegistryPersistenceException if the release could not be persisted; the claim is kept
   */
  public boolean releaseClaim(String subdomain) {
    String normalized = normalize(subdomain);
    lock.writeLock().lock();
    try {
      Claim removed = claims.remove(normalized);
      if (removed == null) {
        return false;
      }
      try {
        persist();
      } catch (RegistryPersistenceException e) {
        claims.put(normalized, removed);
        throw e;
      }
      log.info("Subdomain '{}' released from {}", normalized, removed.ownerId());
      return true;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Lists an owner's subdomains, newest claim first.
   *
   * @param ownerId the owner
   * @return subdomains sorted by claim time descending
   */
  public List<String> getUserClaims(String ownerId) {
    lock.readLock().lock();
    try {
      return ownedBy(ownerId).stream().map(Claim::subdomain).toList();
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Computes which claims exceed a new allotment. The newest claims go first, so a tenant keeps
   * its longest-standing sites.
   *
   * @param ownerId     the owner
   * @param newQuantity number of subdomains the owner may keep
   * @return the newest {@code count - newQuantity} subdomains, or empty when within the allotment
   */
  public List<String> getSubdomainsToRelease(String ownerId, int newQuantity) {
    requireQuantity(newQuantity);
    lock.readLock().lock();
    try {
      return excessOf(ownerId, newQuantity);
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Applies a subscription quantity change: records the new quota and releases the owner's
   * excess claims, newest first, as one atomic unit. Only the given owner's claims are touched.
   * An owner without claims is not an error; the result simply releases nothing.
   *
   * @param ownerId     the owner whose subscription changed
   * @param newQuantity new allotment; 0 releases every claim the owner holds
   * @return the released subdomains
   * @throws RegistryPersistenceException if the change could not be persisted; nothing changes
   */
  public SubscriptionChange processSubscriptionChange(String ownerId, int newQuantity) {
    Objects.requireNonNull(ownerId, "ownerId");
    requireQuantity(newQuantity);
    lock.writeLock().lock();
    try {
      List<String> toRelease = excessOf(ownerId, newQuantity);
      Map<String, Claim> removed = new LinkedHashMap<>();
      toRelease.forEach(subdomain -> removed.put(subdomain, claims.remove(subdomain)));
      Integer previousQuota = newQuantity > 0
          ? quotas.put(ownerId, newQuantity)
          : quotas.remove(ownerId);
      try {
        persist();
      } catch (RegistryPersistenceException e) {
        claims.putAll(removed);
        if (previousQuota == null) {
          quotas.remove(ownerId);
        } else {
          quotas.put(ownerId, previousQuota);
        }
        throw e;
      }
      log.info("Subscription change for {}: quantity={}, released={}", ownerId, newQuantity, toRelease);
      return new SubscriptionChange(ownerId, newQuantity, toRelease);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Looks up the active claim for a subdomain.
   *
   * @param subdomain raw name
   * @return the claim, or empty if the name is not claimed
   */
  public Optional<Claim> findClaim(String subdomain) {
    String normalized = normalize(subdomain);
    lock.readLock().lock();
    try {
      return Optional.ofNullable(claims.get(normalized));
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Number of subdomains the owner may hold.
   *
   * @param ownerId the owner
   * @return the recorded subscription quantity, or the default quota
   */
  public int quotaFor(String ownerId) {
    lock.readLock().lock();
    try {
      return quotaOf(ownerId);
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Consistent copy of the whole registry.
   *
   * @return the snapshot
   */
  public RegistrySnapshot snapshot() {
    lock.readLock().lock();
    try {
      return snapshotOf();
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Number of active claims.
   *
   * @return the count
   */
  public int claimCount() {
    lock.readLock().lock();
    try {
      return claims.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  // Callers must hold the lock.
  private Availability availabilityOf(String normalized) {
    if (reserved.contains(normalized)) {
      return Availability.unavailable(UnavailableReason.RESERVED);
    }
    String preallocatedOwner = preallocated.get(normalized);
    if (preallocatedOwner != null) {
      return Availability.ownedBy(UnavailableReason.PREALLOCATED, preallocatedOwner);
    }
    Claim existing = claims.get(normalized);
    if (existing != null) {
      return Availability.ownedBy(UnavailableReason.CLAIMED, existing.ownerId());
    }
    if (normalized.length() < MIN_LENGTH) {
      return Availability.unavailable(UnavailableReason.TOO_SHORT);
    }
    if (normalized.length() > MAX_LENGTH) {
      return Availability.unavailable(UnavailableReason.TOO_LONG);
    }
    if (!SUBDOMAIN_FORMAT.matcher(normalized).matches()) {
      return Availability.unavailable(UnavailableReason.INVALID_FORMAT);
    }
    return Availability.free();
  }

  private List<Claim> ownedBy(String ownerId) {
    List<Claim> owned = new ArrayList<>();
    for (Claim claim : claims.values()) {
      if (claim.ownerId().equals(ownerId)) {
        owned.add(claim);
      }
    }
    owned.sort(NEWEST_FIRST);
    return owned;
  }

  private List<String> excessOf(String ownerId, int newQuantity) {
    List<Claim> owned = ownedBy(ownerId);
    if (owned.size() <= newQuantity) {
      return List.of();
    }
    return owned.subList(0, owned.size() - newQuantity).stream().map(Claim::subdomain).toList();
  }

  private int quotaOf(String ownerId) {
    return quotas.getOrDefault(ownerId, defaultQuota);
  }

  private RegistrySnapshot snapshotOf() {
    return new RegistrySnapshot(claims, reserved, preallocated, quotas);
  }

  private void persist() {
    store.save(snapshotOf());
  }

  private static void requireQuantity(int newQuantity) {
    if (newQuantity < 0) {
      throw new IllegalArgumentException("newQuantity must not be negative: " + newQuantity);
    }
  }
}
