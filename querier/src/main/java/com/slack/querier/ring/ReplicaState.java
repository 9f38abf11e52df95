package com.slack.querier.ring;

/** Health state of an ingester as reported by the ring. */
public enum ReplicaState {
  PENDING,
  JOINING,
  ACTIVE,
  LEAVING,
  LEFT
}
