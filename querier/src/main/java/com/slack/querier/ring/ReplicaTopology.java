package com.slack.querier.ring;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Read view of the ingester ring. Membership, heartbeats and health computation are owned by the
 * ring implementation, the querier only asks it which replicas to talk to.
 */
public interface ReplicaTopology {

  /**
   * Returns the replicas to query for a read, along with the number of errors the read can
   * tolerate.
   *
   * @throws TopologyException if there are not enough healthy replicas
   */
  ReplicaSet replicasForRead();

  /** Returns every healthy replica, tolerating no errors. */
  ReplicaSet allHealthyReplicasForRead();

  /**
   * Returns one replica set per partition owned by the tenant's shuffle shard, including partitions
   * that owned the tenant at any point during the lookback window.
   *
   * @throws TopologyException if the partitions could not be resolved
   */
  List<ReplicaSet> shardedPartitionReplicaSets(
      String tenantId, int shardCount, Duration lookback, Instant now);
}
