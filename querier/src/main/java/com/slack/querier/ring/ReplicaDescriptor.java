package com.slack.querier.ring;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Strings;
import java.util.Objects;

/**
 * An immutable snapshot of one ingester in the ring. The zone is optional and is only used for
 * zone aware quorum computation.
 */
public class ReplicaDescriptor {
  public final String address;
  public final String zone;
  public final ReplicaState state;

  public ReplicaDescriptor(String address, String zone, ReplicaState state) {
    checkArgument(!Strings.isNullOrEmpty(address), "address can't be null or empty");
    checkArgument(state != null, "state can't be null");
    this.address = address;
    this.zone = Strings.emptyToNull(zone);
    this.state = state;
  }

  public static ReplicaDescriptor active(String address) {
    return new ReplicaDescriptor(address, null, ReplicaState.ACTIVE);
  }

  public static ReplicaDescriptor active(String address, String zone) {
    return new ReplicaDescriptor(address, zone, ReplicaState.ACTIVE);
  }

  public boolean isActive() {
    return state == ReplicaState.ACTIVE;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    ReplicaDescriptor that = (ReplicaDescriptor) o;
    return address.equals(that.address) && Objects.equals(zone, that.zone) && state == that.state;
  }

  @Override
  public int hashCode() {
    return Objects.hash(address, zone, state);
  }

  @Override
  public String toString() {
    return "ReplicaDescriptor{"
        + "address='"
        + address
        + '\''
        + ", zone='"
        + zone
        + '\''
        + ", state="
        + state
        + '}';
  }
}
