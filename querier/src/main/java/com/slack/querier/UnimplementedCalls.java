package com.slack.querier;

import io.grpc.Status;

/**
 * Older ingesters answer the stats and volume RPCs with an UNIMPLEMENTED status. Those errors are
 * treated as an empty answer rather than a failed query.
 */
public class UnimplementedCalls {

  private UnimplementedCalls() {}

  /** Returns true if the error, or any error in its cause chain, carries the UNIMPLEMENTED code. */
  public static boolean isUnimplementedCallError(Throwable t) {
    if (t == null) {
      return false;
    }
    return Status.fromThrowable(t).getCode() == Status.Code.UNIMPLEMENTED;
  }
}
