package com.slack.querier.client;

import com.slack.querier.IngesterQueryException;

/** A client for the ingester could not be obtained, or the call to it failed. */
public class ReplicaUnavailableException extends IngesterQueryException {
  private final String address;

  public ReplicaUnavailableException(String address, String msg) {
    super(msg);
    this.address = address;
  }

  public ReplicaUnavailableException(String address, String msg, Throwable t) {
    super(msg, t);
    this.address = address;
  }

  public String getAddress() {
    return address;
  }
}
