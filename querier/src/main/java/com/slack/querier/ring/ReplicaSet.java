package com.slack.querier.ring;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * An ordered group of replicas that hold the same data, together with the failure budget of a
 * read against them.
 *
 * <p>When maxUnavailableZones is greater than zero the set is zone aware: a zone counts as
 * successful only once every replica in it has answered, and the read needs all but
 * maxUnavailableZones zones. Otherwise the read needs all but maxErrors replicas.
 */
public class ReplicaSet {
  public final ImmutableList<ReplicaDescriptor> replicas;
  public final int maxErrors;
  public final int maxUnavailableZones;

  public ReplicaSet(List<ReplicaDescriptor> replicas, int maxErrors, int maxUnavailableZones) {
    checkArgument(replicas != null, "replicas can't be null");
    checkArgument(maxErrors >= 0, "maxErrors can't be negative");
    checkArgument(maxUnavailableZones >= 0, "maxUnavailableZones can't be negative");
    checkArgument(
        maxErrors == 0 || maxUnavailableZones == 0,
        "maxErrors and maxUnavailableZones are mutually exclusive");
    this.replicas = ImmutableList.copyOf(replicas);
    checkArgument(
        this.replicas.isEmpty() || maxErrors < this.replicas.size(),
        "maxErrors must be lower than the number of replicas");
    this.maxErrors = maxErrors;
    this.maxUnavailableZones = maxUnavailableZones;
  }

  /** A replica set that needs a majority of its replicas to answer. */
  public static ReplicaSet of(List<ReplicaDescriptor> replicas) {
    int quorum = replicas.size() / 2 + 1;
    return new ReplicaSet(replicas, Math.max(0, replicas.size() - quorum), 0);
  }

  /** A replica set where every replica has to answer. */
  public static ReplicaSet allOf(List<ReplicaDescriptor> replicas) {
    return new ReplicaSet(replicas, 0, 0);
  }

  public boolean isZoneAware() {
    return maxUnavailableZones > 0;
  }

  public boolean isEmpty() {
    return replicas.isEmpty();
  }

  public int size() {
    return replicas.size();
  }

  /** Replicas grouped by zone, zones in order of first appearance. */
  public Map<String, List<ReplicaDescriptor>> replicasByZone() {
    Map<String, List<ReplicaDescriptor>> byZone = new LinkedHashMap<>();
    for (ReplicaDescriptor replica : replicas) {
      String zone = replica.zone == null ? "" : replica.zone;
      byZone.computeIfAbsent(zone, (z) -> new ArrayList<>()).add(replica);
    }
    return byZone;
  }

  /** Returns a copy of this set holding only the replicas matching the filter. */
  public ReplicaSet filter(Predicate<ReplicaDescriptor> filter, int maxErrors) {
    return new ReplicaSet(
        replicas.stream().filter(filter).collect(ImmutableList.toImmutableList()), maxErrors, 0);
  }

  @Override
  public String toString() {
    return "ReplicaSet{"
        + "replicas="
        + replicas
        + ", maxErrors="
        + maxErrors
        + ", maxUnavailableZones="
        + maxUnavailableZones
        + '}';
  }
}
