package com.slack.querier.session;

import com.google.common.collect.ImmutableList;
import com.slack.querier.client.ReplicaClient;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tracks which ingesters answered the reads of a partitioned query, so that a later step of the
 * same query can be sent to exactly the same ingesters instead of resolving the ring again.
 *
 * <p>Nothing is tracked until the context is marked as partitioned. The lock is only held while
 * the flag or the map are accessed, never across a remote call.
 */
public class PartitionContext {

  /** An ingester that contributed to a read, with the client that was used to reach it. */
  public record UsedReplica(ReplicaClient client, String address) {}

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, UsedReplica> usedReplicas = new HashMap<>();
  private boolean partitioned = false;

  public void addClient(ReplicaClient client, String address) {
    lock.lock();
    try {
      if (!partitioned) {
        return;
      }
      usedReplicas.put(address, new UsedReplica(client, address));
    } finally {
      lock.unlock();
    }
  }

  public void removeClient(String address) {
    lock.lock();
    try {
      if (!partitioned) {
        return;
      }
      usedReplicas.remove(address);
    } finally {
      lock.unlock();
    }
  }

  public void setPartitioned(boolean partitioned) {
    lock.lock();
    try {
      this.partitioned = partitioned;
    } finally {
      lock.unlock();
    }
  }

  public boolean isPartitioned() {
    lock.lock();
    try {
      return partitioned;
    } finally {
      lock.unlock();
    }
  }

  /** Returns a snapshot of the ingesters recorded so far. */
  public ImmutableList<UsedReplica> usedReplicas() {
    lock.lock();
    try {
      return ImmutableList.copyOf(usedReplicas.values());
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String toString() {
    lock.lock();
    try {
      return "PartitionContext{"
          + "partitioned="
          + partitioned
          + ", usedReplicas="
          + usedReplicas.keySet()
          + '}';
    } finally {
      lock.unlock();
    }
  }
}
