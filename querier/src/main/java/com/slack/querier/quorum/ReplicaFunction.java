package com.slack.querier.quorum;

import com.slack.querier.ring.ReplicaDescriptor;

@FunctionalInterface
public interface ReplicaFunction<T> {
  T apply(ReplicaDescriptor replica) throws Exception;
}
