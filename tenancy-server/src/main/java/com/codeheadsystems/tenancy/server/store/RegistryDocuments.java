package com.codeheadsystems.tenancy.server.store;

import com.codeheadsystems.tenancy.model.ClaimEntry;
import com.codeheadsystems.tenancy.model.RegistryDocument;
import com.codeheadsystems.tenancy.registry.Claim;
import com.codeheadsystems.tenancy.registry.RegistrySnapshot;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;

/**
 * Converts between the in-memory {@link RegistrySnapshot} and its JSON form.
 */
public final class RegistryDocuments {

  private RegistryDocuments() {
  }

  public static RegistryDocument toDocument(RegistrySnapshot snapshot) {
    Map<String, ClaimEntry> claims = new HashMap<>();
    snapshot.claims().forEach((subdomain, claim) ->
        claims.put(subdomain, new ClaimEntry(claim.ownerId(), claim.claimedAt().toString())));
    return new RegistryDocument(claims, new ArrayList<>(snapshot.reserved()), snapshot.preallocated(),
        snapshot.quotas());
  }

  /**
   * Rebuilds a snapshot.
   *
   * @param document parsed JSON
   * @return the snapshot
   * @throws IllegalArgumentException if a claim lacks an owner or has an unparseable timestamp
   */
  public static RegistrySnapshot toSnapshot(RegistryDocument document) {
    Map<String, Claim> claims = new HashMap<>();
    document.claims().forEach((subdomain, entry) -> {
      if (entry == null || entry.ownerId() == null || entry.claimedAt() == null) {
        throw new IllegalArgumentException("Incomplete claim for subdomain " + subdomain);
      }
      try {
        claims.put(subdomain, new Claim(subdomain, entry.ownerId(), Instant.parse(entry.claimedAt())));
      } catch (DateTimeParseException e) {
        throw new IllegalArgumentException("Invalid claimedAt for subdomain " + subdomain, e);
      }
    });
    return new RegistrySnapshot(claims, new HashSet<>(document.reserved()),
        document.preallocated(), document.quotas());
  }
}
