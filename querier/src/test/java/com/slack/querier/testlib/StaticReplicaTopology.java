package com.slack.querier.testlib;

import com.slack.querier.ring.ReplicaSet;
import com.slack.querier.ring.ReplicaTopology;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/** A ring that always returns the replica sets it was configured with. */
public class StaticReplicaTopology implements ReplicaTopology {
  private ReplicaSet readSet = ReplicaSet.allOf(List.of());
  private ReplicaSet healthySet = ReplicaSet.allOf(List.of());
  private List<ReplicaSet> partitions = List.of();

  private final AtomicInteger partitionLookups = new AtomicInteger();
  private volatile String lastTenantId;
  private volatile int lastShardCount;
  private volatile Duration lastLookback;

  public StaticReplicaTopology withReadSet(ReplicaSet readSet) {
    this.readSet = readSet;
    return this;
  }

  public StaticReplicaTopology withHealthySet(ReplicaSet healthySet) {
    this.healthySet = healthySet;
    return this;
  }

  public StaticReplicaTopology withPartitions(List<ReplicaSet> partitions) {
    this.partitions = partitions;
    return this;
  }

  @Override
  public ReplicaSet replicasForRead() {
    return readSet;
  }

  @Override
  public ReplicaSet allHealthyReplicasForRead() {
    return healthySet;
  }

  @Override
  public List<ReplicaSet> shardedPartitionReplicaSets(
      String tenantId, int shardCount, Duration lookback, Instant now) {
    partitionLookups.incrementAndGet();
    lastTenantId = tenantId;
    lastShardCount = shardCount;
    lastLookback = lookback;
    return partitions;
  }

  public int getPartitionLookups() {
    return partitionLookups.get();
  }

  public String getLastTenantId() {
    return lastTenantId;
  }

  public int getLastShardCount() {
    return lastShardCount;
  }

  public Duration getLastLookback() {
    return lastLookback;
  }
}
